package com.pagechains.analytics.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.serialization.SimpleStringSchema;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagechains.analytics.model.RejectedEventEnvelope;
import com.pagechains.analytics.util.JsonSupport;

import java.util.Set;

/**
 * Re-publishes DLQ'd recorder events to the input topic, tagged with {@code __replay*} markers so
 * the quality gate does not treat them as duplicates of the original.
 *
 * <p>Only envelopes of the selected failure stages are replayed; page-load level rejections
 * (assembly, result guard) carry the first event of the page load and are skipped unless
 * {@code REPLAY_STAGES} names them explicitly.</p>
 */
public class DlqReplayJob {
    private static final Logger LOG = LoggerFactory.getLogger(DlqReplayJob.class);

    static final String DEFAULT_STAGES = "SCHEMA_VALIDATION,PARSE";

    public static void main(String[] args) throws Exception {
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

        String bootstrap = envOrDefault("REPLAY_KAFKA_BOOTSTRAP", envOrDefault("CHAINS_KAFKA_BOOTSTRAP", "kafka:9092"));
        String dlqTopic = envOrDefault("REPLAY_DLQ_TOPIC", envOrDefault("CHAINS_DLQ_TOPIC", "events.dlq.page_load_events.v1"));
        String outputTopic = envOrDefault("REPLAY_OUTPUT_TOPIC", envOrDefault("CHAINS_INPUT_TOPIC", "page_load_events"));
        Set<String> stages = Set.of(envOrDefault("REPLAY_STAGES", DEFAULT_STAGES).toUpperCase().split("\\s*,\\s*"));
        Long startMs = envLong("REPLAY_START_EPOCH_MS");
        Long endMs = envLong("REPLAY_END_EPOCH_MS");

        LOG.info("Starting DLQ replay: dlqTopic={}, outputTopic={}, stages={}, window=[{}, {}]",
                dlqTopic, outputTopic, stages, startMs, endMs);

        KafkaSource<String> source = KafkaSource.<String>builder()
                .setBootstrapServers(bootstrap)
                .setTopics(dlqTopic)
                .setGroupId(envOrDefault("REPLAY_GROUP_ID", "flink-critical-chains-replay-v1"))
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new SimpleStringSchema())
                .build();

        DataStream<RejectedEventEnvelope> envelopes = env
                .fromSource(source, WatermarkStrategy.noWatermarks(), "DLQ Source")
                .flatMap((String value, org.apache.flink.util.Collector<RejectedEventEnvelope> out) -> {
                    try {
                        out.collect(JsonSupport.MAPPER.readValue(value, RejectedEventEnvelope.class));
                    } catch (Exception ex) {
                        LOG.warn("Failed to parse DLQ envelope: {}", ex.getMessage());
                    }
                })
                .returns(RejectedEventEnvelope.class);

        DataStream<String> replayEvents = envelopes
                .filter(envelope -> withinWindow(envelope, startMs, endMs) && matchesStage(envelope, stages))
                .flatMap((RejectedEventEnvelope envelope, org.apache.flink.util.Collector<String> out) -> {
                    String payload = toReplayPayload(envelope, System.currentTimeMillis());
                    if (payload != null) {
                        out.collect(payload);
                    }
                })
                .returns(String.class);

        KafkaSink<String> sink = KafkaSink.<String>builder()
                .setBootstrapServers(bootstrap)
                .setRecordSerializer(KafkaRecordSerializationSchema.builder()
                        .setTopic(outputTopic)
                        .setValueSerializationSchema(new SimpleStringSchema())
                        .build())
                .build();

        replayEvents.sinkTo(sink).name("Replay to Kafka");

        env.execute("Critical Chains DLQ Replay");
    }

    static boolean withinWindow(RejectedEventEnvelope envelope, Long startMs, Long endMs) {
        if (startMs == null && endMs == null) {
            return true;
        }
        long ts;
        if (envelope.eventTimestamp != null) {
            ts = envelope.eventTimestamp;
        } else if (envelope.source != null) {
            ts = envelope.source.recordTimestamp;
        } else {
            ts = envelope.ingestionTimestamp;
        }
        if (startMs != null && ts < startMs) {
            return false;
        }
        return endMs == null || ts <= endMs;
    }

    static boolean matchesStage(RejectedEventEnvelope envelope, Set<String> stages) {
        return envelope.failure != null
                && envelope.failure.stage != null
                && stages.contains(envelope.failure.stage.toUpperCase());
    }

    /**
     * Returns the original event marked for replay, or null when the envelope holds no JSON object.
     */
    static String toReplayPayload(RejectedEventEnvelope envelope, long replayTimestamp) {
        if (envelope.payload == null || envelope.payload.body == null) {
            LOG.debug("Skipping envelope without payload body");
            return null;
        }
        if (!"json".equalsIgnoreCase(envelope.payload.encoding)) {
            LOG.debug("Skipping non-json payload encoding: {}", envelope.payload.encoding);
            return null;
        }
        try {
            JsonNode node = JsonSupport.MAPPER.readTree(envelope.payload.body);
            if (!node.isObject()) {
                return null;
            }
            ObjectNode obj = (ObjectNode) node;
            obj.put("__replay", true);
            obj.put("__replay_ts", replayTimestamp);
            obj.put("__replay_source", "dlq");
            if (envelope.failure != null) {
                obj.put("__replay_failure_class", envelope.failure.failureClass);
                obj.put("__replay_failure_reason", envelope.failure.reason);
            }
            return JsonSupport.MAPPER.writeValueAsString(obj);
        } catch (Exception ex) {
            LOG.warn("Failed to build replay payload: {}", ex.getMessage());
            return null;
        }
    }

    private static String envOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static Long envLong(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            LOG.warn("Ignoring non-numeric {}={}", key, value);
            return null;
        }
    }
}
