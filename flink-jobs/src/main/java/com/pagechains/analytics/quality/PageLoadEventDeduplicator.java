package com.pagechains.analytics.quality;

import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagechains.analytics.model.PageEvent;
import com.pagechains.analytics.model.RejectedEventEnvelope;

/**
 * Drops recorder retries before they reach page-load aggregation, where a repeated
 * {@code network_request} would collide on request id and a repeated {@code page_load_complete}
 * would emit the page load a second time.
 *
 * <p>Keyed by {@link #scopeKey(PageEvent)}, so an event id is only unique within its page load.
 * The first copy's Kafka position is kept under TTL and quoted in the quarantine envelope of every
 * later copy.</p>
 */
public class PageLoadEventDeduplicator extends KeyedProcessFunction<String, ValidatedEvent, ValidatedEvent> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(PageLoadEventDeduplicator.class);

    static final String DUPLICATE_REQUEST = "duplicate_network_request";
    static final String DUPLICATE_COMPLETION = "duplicate_page_load_complete";

    private final PipelineConfig config;
    private final OutputTag<RejectedEventEnvelope> quarantineTag;

    private transient ValueState<String> firstSeenState;
    private transient Counter duplicateRequestCounter;
    private transient Counter duplicateCompletionCounter;
    private transient Counter duplicateCounter;
    private transient Counter acceptedCounter;

    public PageLoadEventDeduplicator(PipelineConfig config, OutputTag<RejectedEventEnvelope> quarantineTag) {
        this.config = config;
        this.quarantineTag = quarantineTag;
    }

    /** Dedup key scoped to the event's page load. */
    public static String scopeKey(PageEvent event) {
        return event.pageLoadId + "|" + event.dedupKey;
    }

    @Override
    public void open(Configuration parameters) {
        ValueStateDescriptor<String> firstSeen = new ValueStateDescriptor<>("page-load-event-first-seen", String.class);
        firstSeen.enableTimeToLive(StateTtlConfig
                .newBuilder(Time.minutes(config.dedupTtlMinutes))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build());
        firstSeenState = getRuntimeContext().getState(firstSeen);

        MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("quality_gate").addGroup("page_load_dedup");
        duplicateRequestCounter = metrics.counter("duplicate_requests");
        duplicateCompletionCounter = metrics.counter("duplicate_completions");
        duplicateCounter = metrics.counter("duplicates");
        acceptedCounter = metrics.counter("accepted");
        metrics.meter("duplicate_rate", new MeterView(duplicateCounter, (int) config.metricsRateWindow.getSeconds()));
        LOG.info("Page load dedup initialized (ttlMinutes={})", config.dedupTtlMinutes);
    }

    @Override
    public void processElement(ValidatedEvent validated, Context ctx, Collector<ValidatedEvent> out) throws Exception {
        if (validated == null || validated.event == null) {
            return;
        }
        PageEvent event = validated.event;

        String firstSeenAt = firstSeenState.value();
        if (firstSeenAt == null) {
            firstSeenState.update(position(event.source));
            acceptedCounter.inc();
            out.collect(validated);
            return;
        }

        duplicateCounter.inc();
        String reason;
        if (SchemaValidator.PAGE_LOAD_COMPLETE.equals(event.eventType)) {
            duplicateCompletionCounter.inc();
            reason = DUPLICATE_COMPLETION;
        } else {
            duplicateRequestCounter.inc();
            reason = DUPLICATE_REQUEST;
        }
        LOG.debug("Duplicate {} for page load {} (id={}, firstSeenAt={})",
                event.eventType, event.pageLoadId, event.eventId, firstSeenAt);
        ctx.output(quarantineTag, RejectedEventEnvelopeFactory.forDuplicateEvent(event, reason, firstSeenAt));
    }

    static String position(RejectedEventEnvelope.SourcePointer source) {
        if (source == null || source.topic == null) {
            return "unknown";
        }
        return source.topic + "/" + source.partition + "@" + source.offset;
    }
}
