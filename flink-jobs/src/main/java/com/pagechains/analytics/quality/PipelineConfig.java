package com.pagechains.analytics.quality;

import java.io.Serializable;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Centralized configuration for the critical chains pipeline, sourced from environment variables.
 */
public class PipelineConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    public final String kafkaBootstrap;
    public final String inputTopic;
    public final String outputTopic;
    public final String dlqTopic;
    public final String quarantineTopic;
    public final String kafkaGroupId;
    public final int dedupTtlMinutes;
    public final Set<String> supportedVersions;

    public final long pageLoadIdleTimeoutMs;
    public final int maxRecordsPerPageLoad;
    public final int resultMaxBytes;

    public final long checkpointIntervalMs;
    public final Duration metricsRateWindow;

    private PipelineConfig(
            String kafkaBootstrap,
            String inputTopic,
            String outputTopic,
            String dlqTopic,
            String quarantineTopic,
            String kafkaGroupId,
            int dedupTtlMinutes,
            Set<String> supportedVersions,
            long pageLoadIdleTimeoutMs,
            int maxRecordsPerPageLoad,
            int resultMaxBytes,
            long checkpointIntervalMs,
            Duration metricsRateWindow) {
        this.kafkaBootstrap = kafkaBootstrap;
        this.inputTopic = inputTopic;
        this.outputTopic = outputTopic;
        this.dlqTopic = dlqTopic;
        this.quarantineTopic = quarantineTopic;
        this.kafkaGroupId = kafkaGroupId;
        this.dedupTtlMinutes = dedupTtlMinutes;
        this.supportedVersions = supportedVersions;
        this.pageLoadIdleTimeoutMs = pageLoadIdleTimeoutMs;
        this.maxRecordsPerPageLoad = maxRecordsPerPageLoad;
        this.resultMaxBytes = resultMaxBytes;
        this.checkpointIntervalMs = checkpointIntervalMs;
        this.metricsRateWindow = metricsRateWindow;
    }

    public static PipelineConfig fromEnv() {
        return from(System::getenv);
    }

    /** Resolves settings through {@code env}; unset or empty keys fall back to defaults. */
    public static PipelineConfig from(Function<String, String> env) {
        return new PipelineConfig(
                string(env, "CHAINS_KAFKA_BOOTSTRAP", "kafka:9092"),
                string(env, "CHAINS_INPUT_TOPIC", "page_load_events"),
                string(env, "CHAINS_OUTPUT_TOPIC", "critical_request_chains"),
                string(env, "CHAINS_DLQ_TOPIC", "events.dlq.page_load_events.v1"),
                string(env, "CHAINS_QUARANTINE_TOPIC", "events.quarantine.page_load_events.v1"),
                string(env, "CHAINS_GROUP_ID", "flink-critical-chains-v1"),
                integer(env, "CHAINS_DEDUP_TTL_MINUTES", 1440),
                set(env, "CHAINS_SUPPORTED_VERSIONS", "1,v1"),
                longValue(env, "CHAINS_PAGE_LOAD_IDLE_TIMEOUT_MS", 300_000L),
                integer(env, "CHAINS_MAX_RECORDS_PER_PAGE_LOAD", 5000),
                integer(env, "CHAINS_RESULT_MAX_BYTES", 1_000_000),
                longValue(env, "CHAINS_CHECKPOINT_INTERVAL_MS", 60_000L),
                Duration.ofSeconds(integer(env, "CHAINS_METRICS_RATE_WINDOW_SEC", 60)));
    }

    private static String string(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int integer(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static long longValue(Function<String, String> env, String key, long defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static Set<String> set(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        String raw = value == null || value.isEmpty() ? defaultValue : value;
        if (raw == null || raw.trim().isEmpty()) {
            return Collections.emptySet();
        }
        return new HashSet<>(Arrays.asList(raw.trim().split("\\s*,\\s*")));
    }
}
