package com.pagechains.analytics.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Meter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagechains.analytics.model.KafkaInboundRecord;
import com.pagechains.analytics.model.PageEvent;
import com.pagechains.analytics.model.RejectedEventEnvelope;
import com.pagechains.analytics.parse.JsonNodeUtils;
import com.pagechains.analytics.util.Hashing;
import com.pagechains.analytics.util.JsonSupport;

import java.nio.charset.StandardCharsets;

/**
 * Quality gate that deserializes raw recorder messages, validates schema, and emits
 * either a ValidatedEvent or a DLQ envelope describing the failure.
 *
 * <p>Every accepted event carries a page-load id (from the payload or the Kafka key), since all
 * downstream state is keyed by it.</p>
 */
public class QualityGateProcessFunction extends ProcessFunction<KafkaInboundRecord, ValidatedEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(QualityGateProcessFunction.class);

    private final PipelineConfig config;
    private final OutputTag<RejectedEventEnvelope> dlqTag;
    private transient SchemaValidator validator;
    private transient Counter inputCounter;
    private transient Counter acceptedCounter;
    private transient Counter dlqCounter;
    private transient Meter inputRate;
    private transient Meter dlqRate;
    private transient long lastDlqLogMs;
    private transient long dlqSinceLastLog;

    public QualityGateProcessFunction(PipelineConfig config, OutputTag<RejectedEventEnvelope> dlqTag) {
        this.config = config;
        this.dlqTag = dlqTag;
    }

    @Override
    public void open(Configuration parameters) {
        this.validator = new SchemaValidator(config.supportedVersions);
        MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("quality_gate");
        this.inputCounter = metrics.counter("input");
        this.acceptedCounter = metrics.counter("accepted");
        this.dlqCounter = metrics.counter("dlq");
        this.inputRate = metrics.meter("input_rate", new MeterView(inputCounter, (int) config.metricsRateWindow.getSeconds()));
        this.dlqRate = metrics.meter("dlq_rate", new MeterView(dlqCounter, (int) config.metricsRateWindow.getSeconds()));
        this.lastDlqLogMs = System.currentTimeMillis();
        this.dlqSinceLastLog = 0;
        LOG.info("Quality gate initialized (supportedVersions={}, metricsWindowSec={})",
                config.supportedVersions, config.metricsRateWindow.getSeconds());
    }

    @Override
    public void processElement(KafkaInboundRecord record, Context ctx, Collector<ValidatedEvent> out) {
        inputCounter.inc();

        if (record == null || record.value == null) {
            LOG.debug("Rejecting record with null payload (topic={}, partition={}, offset={})",
                    record == null ? null : record.topic,
                    record == null ? null : record.partition,
                    record == null ? null : record.offset);
            emitDlq(ctx, RejectedEventEnvelopeFactory.forRawRecord(
                    record,
                    "DESERIALIZATION_FAILED",
                    "DESERIALIZATION",
                    "null_payload",
                    "Record value is null",
                    null,
                    null,
                    null));
            return;
        }

        String rawJson = new String(record.value, StandardCharsets.UTF_8);
        JsonNode root;
        try {
            root = JsonSupport.MAPPER.readTree(rawJson);
        } catch (JsonProcessingException ex) {
            LOG.warn("JSON parse failed (topic={}, partition={}, offset={}): {}",
                    record.topic, record.partition, record.offset, ex.getOriginalMessage());
            emitDlq(ctx, RejectedEventEnvelopeFactory.forRawRecord(
                    record,
                    "DESERIALIZATION_FAILED",
                    "DESERIALIZATION",
                    "json_parse_error",
                    ex.getOriginalMessage(),
                    rawJson,
                    null,
                    record.value));
            return;
        }

        SchemaValidator.ValidationResult validation = validator.validate(root);
        if (!validation.valid) {
            LOG.debug("Schema validation failed (type={}, reason={}, details={})",
                    root == null ? null : root.path("type").asText(""), validation.reason, validation.details);
            emitDlq(ctx, RejectedEventEnvelopeFactory.forSchemaValidationFailure(
                    record,
                    root,
                    validation.failureClass,
                    "SCHEMA_VALIDATION",
                    validation.reason,
                    validation.details,
                    rawJson));
            return;
        }

        String pageLoadId = RejectedEventEnvelopeSupport.extractPageLoadId(root, record);
        if (pageLoadId == null) {
            LOG.debug("Rejecting event without page load id (type={}, id={})",
                    root.path("type").asText(""), root.path("id").asText(""));
            emitDlq(ctx, RejectedEventEnvelopeFactory.forSchemaValidationFailure(
                    record,
                    root,
                    "SCHEMA_INVALID",
                    "SCHEMA_VALIDATION",
                    "missing_page_load_id",
                    "Neither data.page_load_id nor the Kafka key identifies the page load",
                    rawJson));
            return;
        }

        PageEvent event = new PageEvent();
        event.eventId = root.path("id").asText("");
        event.eventType = root.path("type").asText("");
        event.eventVersion = validation.eventVersion;
        event.pageLoadId = pageLoadId;
        event.timestamp = JsonNodeUtils.parseTimestampMillisOrDefault(root.path("timestamp"), System.currentTimeMillis());
        event.recorder = root.path("recorder").asText("");
        event.rawJson = rawJson;
        event.replay = root.path("__replay").asBoolean(false);
        event.source = RejectedEventEnvelopeSupport.buildSourcePointer(record);
        event.dimensions = RejectedEventEnvelopeSupport.extractDimensions(root, record);

        DedupKey dedupKey = DedupKey.build(event, root);
        event.dedupKey = dedupKey.key;
        event.dedupStrategy = dedupKey.strategy;

        LOG.trace("Accepted event (id={}, type={}, pageLoadId={}, dedupKey={})",
                event.eventId, event.eventType, event.pageLoadId, event.dedupKey);
        acceptedCounter.inc();
        out.collect(new ValidatedEvent(event, root));
    }

    private void emitDlq(Context ctx, RejectedEventEnvelope envelope) {
        dlqCounter.inc();
        dlqSinceLastLog++;
        long now = System.currentTimeMillis();
        if (now - lastDlqLogMs >= 60000) {
            LOG.warn("DLQ rate summary: {} rejects in last 60s", dlqSinceLastLog);
            lastDlqLogMs = now;
            dlqSinceLastLog = 0;
        }
        ctx.output(dlqTag, envelope);
    }

    public static class DedupKey {
        public final String key;
        public final String strategy;

        private DedupKey(String key, String strategy) {
            this.key = key;
            this.strategy = strategy;
        }

        public static DedupKey build(PageEvent event, JsonNode root) {
            if (event.eventId != null && !event.eventId.isEmpty()) {
                return new DedupKey(event.eventId, "event_id");
            }
            // Hash the canonical payload without replay metadata so replayed events stay idempotent.
            String canonical;
            try {
                JsonNode normalized = root;
                if (root != null && root.isObject()) {
                    ObjectNode copy = ((ObjectNode) root).deepCopy();
                    copy.remove("__replay");
                    copy.remove("__replay_ts");
                    copy.remove("__replay_source");
                    copy.remove("__replay_failure_class");
                    copy.remove("__replay_failure_reason");
                    normalized = copy;
                }
                canonical = JsonSupport.CANONICAL_MAPPER.writeValueAsString(normalized);
            } catch (JsonProcessingException ex) {
                canonical = event.rawJson;
            }
            String hash = Hashing.sha256Hex(event.eventType + "|" + event.pageLoadId + "|" + canonical);
            return new DedupKey(hash, "payload_hash");
        }
    }
}
