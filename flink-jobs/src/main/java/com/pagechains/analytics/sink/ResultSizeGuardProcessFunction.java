package com.pagechains.analytics.sink;

import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagechains.analytics.model.CriticalChainsResult;
import com.pagechains.analytics.model.RejectedEventEnvelope;
import com.pagechains.analytics.quality.RejectedEventEnvelopeFactory;
import com.pagechains.analytics.util.JsonSupport;

import java.nio.charset.StandardCharsets;

/**
 * Serializes results for the Kafka sink and routes ones above the broker's message limit to the DLQ.
 */
public class ResultSizeGuardProcessFunction extends ProcessFunction<CriticalChainsResult, String> {
    private static final Logger LOG = LoggerFactory.getLogger(ResultSizeGuardProcessFunction.class);

    private final OutputTag<RejectedEventEnvelope> dlqTag;
    private final int sizeLimitBytes;
    private transient Counter oversizeCounter;
    private transient Counter emittedCounter;

    public ResultSizeGuardProcessFunction(OutputTag<RejectedEventEnvelope> dlqTag, int sizeLimitBytes) {
        this.dlqTag = dlqTag;
        this.sizeLimitBytes = sizeLimitBytes;
    }

    @Override
    public void open(Configuration parameters) {
        MetricGroup metrics = getRuntimeContext().getMetricGroup()
                .addGroup("critical_chains")
                .addGroup("result_guard");
        oversizeCounter = metrics.counter("oversize");
        emittedCounter = metrics.counter("emitted");
    }

    @Override
    public void processElement(CriticalChainsResult value, Context ctx, Collector<String> out) {
        if (value == null) {
            return;
        }
        String json = JsonSupport.toJson(value);
        int sizeBytes = utf8Bytes(json);
        if (sizeBytes > sizeLimitBytes) {
            oversizeCounter.inc();
            String details = "Result for page load " + value.pageLoadId + " is " + sizeBytes
                    + " bytes, limit " + sizeLimitBytes;
            if (value.sourceEvent == null) {
                LOG.warn("Dropping oversized result with no event context: {}", details);
                return;
            }
            ctx.output(dlqTag, RejectedEventEnvelopeFactory.forResultGuardFailure(value.sourceEvent, "result_too_large", details));
            return;
        }
        emittedCounter.inc();
        out.collect(json);
    }

    static int utf8Bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }
}
