package com.pagechains.analytics.pageload;

import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagechains.analytics.chains.ChainForest;
import com.pagechains.analytics.chains.ChainSummary;
import com.pagechains.analytics.chains.CriticalChainAssembler;
import com.pagechains.analytics.chains.ForestSerializer;
import com.pagechains.analytics.chains.MalformedNetworkRecordsException;
import com.pagechains.analytics.chains.RootDocument;
import com.pagechains.analytics.model.CriticalChainsResult;
import com.pagechains.analytics.model.PageEvent;
import com.pagechains.analytics.model.RejectedEventEnvelope;
import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.quality.PipelineConfig;
import com.pagechains.analytics.quality.RejectedEventEnvelopeFactory;
import com.pagechains.analytics.rules.ClassifierRules;
import com.pagechains.analytics.util.BuildMetadata;
import com.pagechains.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects a page load's request records and computes its critical request chains once the
 * recorder reports the page load complete.
 *
 * <p>Design:
 * - Keyed by page-load id; records are buffered in list state until the completion signal.
 * - Every record (re)arms a processing-time idle timer. A page load that goes quiet without
 *   completing is evicted to the DLQ, as is one that exceeds the record cap.
 * - After a cap overflow the page load stays marked until it completes or idles out, so the rest
 *   of its records are dropped instead of starting a fresh, partial buffer.
 * - State is cleared after every outcome; a record arriving after completion starts a new buffer
 *   that will idle out.
 * </p>
 */
public class PageLoadChainAggregatorFunction
        extends KeyedProcessFunction<String, PageLoadSignal, CriticalChainsResult> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(PageLoadChainAggregatorFunction.class);

    private final PipelineConfig config;
    private final ClassifierRules rules;
    private final OutputTag<RejectedEventEnvelope> dlqTag;

    private transient CriticalChainAssembler assembler;
    private transient ListState<RequestRecord> recordsState;
    private transient ValueState<Integer> recordCountState;
    private transient ValueState<Boolean> overflowedState;
    private transient ValueState<Long> idleTimerState;
    private transient ValueState<PageEvent> firstEventState;

    private transient Counter completedCounter;
    private transient Counter malformedCounter;
    private transient Counter idleEvictionCounter;
    private transient Counter overflowCounter;
    private transient Counter droppedRecordCounter;

    public PageLoadChainAggregatorFunction(
            PipelineConfig config,
            ClassifierRules rules,
            OutputTag<RejectedEventEnvelope> dlqTag) {
        this.config = config;
        this.rules = rules;
        this.dlqTag = dlqTag;
    }

    @Override
    public void open(Configuration parameters) {
        assembler = new CriticalChainAssembler(rules);
        recordsState = getRuntimeContext().getListState(
                new ListStateDescriptor<>("page-load-records", RequestRecord.class));
        recordCountState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("page-load-record-count", Integer.class));
        overflowedState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("page-load-overflowed", Boolean.class));
        idleTimerState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("page-load-idle-timer", Long.class));
        firstEventState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("page-load-first-event", PageEvent.class));

        MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("critical_chains");
        completedCounter = metrics.counter("page_loads_completed");
        malformedCounter = metrics.counter("page_loads_malformed");
        idleEvictionCounter = metrics.counter("page_loads_idle_evicted");
        overflowCounter = metrics.counter("page_loads_overflowed");
        droppedRecordCounter = metrics.counter("records_dropped");

        LOG.info("Page load chain aggregator initialized (rulesVersion={}, idleTimeoutMs={}, maxRecords={}, build_version={})",
                rules.version(), config.pageLoadIdleTimeoutMs, config.maxRecordsPerPageLoad,
                BuildMetadata.current().identity());
    }

    @Override
    public void processElement(PageLoadSignal signal, Context ctx, Collector<CriticalChainsResult> out) throws Exception {
        if (signal == null || StringSemantics.isBlank(signal.pageLoadId) || signal.signalType == null) {
            return;
        }
        if (firstEventState.value() == null && signal.sourceEvent != null) {
            firstEventState.update(signal.sourceEvent);
        }

        if (signal.signalType == PageLoadSignal.SignalType.PAGE_LOAD_COMPLETE) {
            complete(signal, ctx, out);
            return;
        }

        if (signal.record == null) {
            return;
        }
        rearmIdleTimer(ctx);
        if (Boolean.TRUE.equals(overflowedState.value())) {
            droppedRecordCounter.inc();
            return;
        }

        int count = recordCountState.value() == null ? 0 : recordCountState.value();
        if (count >= config.maxRecordsPerPageLoad) {
            overflowCounter.inc();
            LOG.warn("Page load {} exceeded {} records; evicting to DLQ", signal.pageLoadId, config.maxRecordsPerPageLoad);
            ctx.output(dlqTag, RejectedEventEnvelopeFactory.forIncompletePageLoad(
                    firstEventState.value(),
                    signal.pageLoadId,
                    "record_cap_exceeded",
                    "Page load " + signal.pageLoadId + " exceeded " + config.maxRecordsPerPageLoad + " records"));
            recordsState.clear();
            recordCountState.clear();
            overflowedState.update(Boolean.TRUE);
            droppedRecordCounter.inc();
            return;
        }
        recordsState.add(signal.record);
        recordCountState.update(count + 1);
    }

    @Override
    public void onTimer(long timestamp, OnTimerContext ctx, Collector<CriticalChainsResult> out) throws Exception {
        Long armed = idleTimerState.value();
        if (armed == null || armed != timestamp) {
            return;
        }
        String pageLoadId = ctx.getCurrentKey();
        if (!Boolean.TRUE.equals(overflowedState.value())) {
            int count = recordCountState.value() == null ? 0 : recordCountState.value();
            idleEvictionCounter.inc();
            LOG.debug("Page load {} idle for {}ms without completion ({} records)",
                    pageLoadId, config.pageLoadIdleTimeoutMs, count);
            ctx.output(dlqTag, RejectedEventEnvelopeFactory.forIncompletePageLoad(
                    firstEventState.value(),
                    pageLoadId,
                    "idle_timeout",
                    "No page_load_complete within " + config.pageLoadIdleTimeoutMs + "ms; "
                            + count + " records buffered"));
        }
        idleTimerState.clear();
        clearPageLoad();
    }

    private void complete(PageLoadSignal signal, Context ctx, Collector<CriticalChainsResult> out) throws Exception {
        if (Boolean.TRUE.equals(overflowedState.value())) {
            LOG.debug("Completion for overflowed page load {} ignored", signal.pageLoadId);
            clearAll(ctx);
            return;
        }

        List<RequestRecord> records = new ArrayList<>();
        Iterable<RequestRecord> buffered = recordsState.get();
        if (buffered != null) {
            for (RequestRecord record : buffered) {
                records.add(record);
            }
        }

        try {
            RootDocument root = RootDocument.of(signal.mainRequestId, signal.mainDocumentUrl);
            ChainForest forest = assembler.assemble(records, root);
            out.collect(toResult(signal, records.size(), forest));
            completedCounter.inc();
        } catch (MalformedNetworkRecordsException ex) {
            malformedCounter.inc();
            LOG.debug("Malformed page load {} ({}): {}", signal.pageLoadId, ex.reason().code(), ex.getMessage());
            ctx.output(dlqTag, RejectedEventEnvelopeFactory.forAssemblyFailure(
                    signal.sourceEvent, signal.pageLoadId, records.size(), ex));
        }
        clearAll(ctx);
    }

    static CriticalChainsResult toResult(PageLoadSignal signal, int recordCount, ChainForest forest) {
        ChainSummary summary = ChainSummary.of(forest);
        CriticalChainsResult result = new CriticalChainsResult();
        result.pageLoadId = signal.pageLoadId;
        result.rootRequestId = forest.isEmpty() ? null : forest.root().requestId();
        result.mainDocumentUrl = signal.mainDocumentUrl != null || forest.isEmpty()
                ? signal.mainDocumentUrl
                : forest.root().request().url;
        result.recordCount = recordCount;
        result.criticalCount = forest.nodeCount();
        result.chainCount = summary.chainCount();
        result.longestChainLength = summary.longestChainLength();
        result.longestChainDurationMs = summary.longestChainDurationMs();
        result.longestChainTransferSize = summary.longestChainTransferSize();
        result.chains = ForestSerializer.toJson(forest);
        result.computedAt = System.currentTimeMillis();
        result.buildVersion = BuildMetadata.current().identity();
        result.sourceEvent = signal.sourceEvent;
        return result;
    }

    private void rearmIdleTimer(Context ctx) throws Exception {
        Long armed = idleTimerState.value();
        if (armed != null) {
            ctx.timerService().deleteProcessingTimeTimer(armed);
        }
        long fireAt = ctx.timerService().currentProcessingTime() + config.pageLoadIdleTimeoutMs;
        ctx.timerService().registerProcessingTimeTimer(fireAt);
        idleTimerState.update(fireAt);
    }

    private void clearAll(Context ctx) throws Exception {
        Long armed = idleTimerState.value();
        if (armed != null) {
            ctx.timerService().deleteProcessingTimeTimer(armed);
        }
        idleTimerState.clear();
        clearPageLoad();
    }

    private void clearPageLoad() {
        recordsState.clear();
        recordCountState.clear();
        overflowedState.clear();
        firstEventState.clear();
    }
}
