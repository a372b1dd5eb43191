package com.pagechains.analytics.pipeline;

import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.serialization.SimpleStringSchema;
import org.apache.flink.api.common.typeinfo.TypeHint;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;

import com.pagechains.analytics.model.CriticalChainsResult;
import com.pagechains.analytics.model.KafkaInboundRecord;
import com.pagechains.analytics.model.RejectedEventEnvelope;
import com.pagechains.analytics.pageload.PageLoadChainAggregatorFunction;
import com.pagechains.analytics.pageload.PageLoadSignal;
import com.pagechains.analytics.parse.PageEventParsers;
import com.pagechains.analytics.quality.PageLoadEventDeduplicator;
import com.pagechains.analytics.quality.PipelineConfig;
import com.pagechains.analytics.quality.QualityGateProcessFunction;
import com.pagechains.analytics.quality.RejectedEventEnvelopeFactory;
import com.pagechains.analytics.quality.SchemaValidator;
import com.pagechains.analytics.quality.ValidatedEvent;
import com.pagechains.analytics.rules.ClassifierRules;
import com.pagechains.analytics.rules.ClassifierRulesLoader;
import com.pagechains.analytics.sink.ResultSizeGuardProcessFunction;
import com.pagechains.analytics.util.BuildMetadata;
import com.pagechains.analytics.util.JsonSupport;

import java.util.List;

/**
 * Main Flink pipeline:
 * - Ingest recorder events from Kafka
 * - Validate schema + build dedup key
 * - Deduplicate events within each page load (state TTL)
 * - Parse network requests and page-load completions into per-page-load signals
 * - Buffer each page load and build its critical request chains on completion
 * - Guard result size, sink results and DLQ/quarantine envelopes to Kafka
 */
public class NetworkRecordsToCriticalChains {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(NetworkRecordsToCriticalChains.class);

    static final OutputTag<RejectedEventEnvelope> DLQ_TAG = new OutputTag<RejectedEventEnvelope>("dlq"){};
    static final OutputTag<RejectedEventEnvelope> QUARANTINE_TAG = new OutputTag<RejectedEventEnvelope>("quarantine"){};

    public static void main(String[] args) throws Exception {
        final StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

        PipelineConfig config = PipelineConfig.fromEnv();
        env.enableCheckpointing(config.checkpointIntervalMs);

        // Loaded once on the client; shipped to the operators with the job graph.
        ClassifierRules rules = ClassifierRulesLoader.loadDefault();
        LOG.info("Starting critical chains job with inputTopic={}, outputTopic={}, dlqTopic={}, quarantineTopic={}, rulesVersion={}, build={}",
                config.inputTopic, config.outputTopic, config.dlqTopic, config.quarantineTopic,
                rules.version(), BuildMetadata.current().identity());

        KafkaSource<KafkaInboundRecord> kafkaSource = KafkaSource.<KafkaInboundRecord>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setTopics(config.inputTopic)
                .setGroupId(config.kafkaGroupId)
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setDeserializer(new KafkaInboundRecordDeserializationSchema())
                .build();

        // Quality gate: deserialize → validate → build dedup key, then forward or emit DLQ.
        // JSON is parsed once here and reused downstream via ValidatedEvent.
        SingleOutputStreamOperator<ValidatedEvent> validatedStream = env
                .fromSource(kafkaSource, WatermarkStrategy.noWatermarks(), "Kafka Source")
                .process(new QualityGateProcessFunction(config, DLQ_TAG))
                .returns(ValidatedEvent.class)
                .name("Quality Gate");

        // Deduplicate within each page load; repeats go to quarantine.
        SingleOutputStreamOperator<ValidatedEvent> dedupedStream = validatedStream
                .keyBy(event -> PageLoadEventDeduplicator.scopeKey(event.event))
                .process(new PageLoadEventDeduplicator(config, QUARANTINE_TAG))
                .returns(ValidatedEvent.class)
                .name("Dedup");

        SingleOutputStreamOperator<PageLoadSignal> requestSignals = parseEvents(
                dedupedStream,
                SchemaValidator.NETWORK_REQUEST,
                PageEventParsers::parseNetworkRequest,
                DLQ_TAG,
                "Parse: Network Requests");

        SingleOutputStreamOperator<PageLoadSignal> completionSignals = parseEvents(
                dedupedStream,
                SchemaValidator.PAGE_LOAD_COMPLETE,
                PageEventParsers::parsePageLoadComplete,
                DLQ_TAG,
                "Parse: Page Load Complete");

        SingleOutputStreamOperator<CriticalChainsResult> results = requestSignals
                .union(completionSignals)
                .keyBy(signal -> signal.pageLoadId)
                .process(new PageLoadChainAggregatorFunction(config, rules, DLQ_TAG))
                .returns(CriticalChainsResult.class)
                .name("Assemble: Critical Chains");

        SingleOutputStreamOperator<String> resultJson = results
                .process(new ResultSizeGuardProcessFunction(DLQ_TAG, config.resultMaxBytes))
                .returns(String.class)
                .name("Guard: Result Size");

        DataStream<RejectedEventEnvelope> dlqStream = validatedStream.getSideOutput(DLQ_TAG)
                .union(requestSignals.getSideOutput(DLQ_TAG))
                .union(completionSignals.getSideOutput(DLQ_TAG))
                .union(results.getSideOutput(DLQ_TAG))
                .union(resultJson.getSideOutput(DLQ_TAG));
        DataStream<RejectedEventEnvelope> quarantineStream = dedupedStream.getSideOutput(QUARANTINE_TAG);

        resultJson.sinkTo(kafkaSink(config, config.outputTopic)).name("Kafka: Critical Chains");
        dlqStream.map(JsonSupport::toJson).returns(String.class)
                .sinkTo(kafkaSink(config, config.dlqTopic)).name("Kafka: DLQ");
        quarantineStream.map(JsonSupport::toJson).returns(String.class)
                .sinkTo(kafkaSink(config, config.quarantineTopic)).name("Kafka: Quarantine");

        env.execute("Critical Request Chains");
    }

    private static KafkaSink<String> kafkaSink(PipelineConfig config, String topic) {
        LOG.info("Configuring Kafka sink (topic={})", topic);
        return KafkaSink.<String>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setRecordSerializer(KafkaRecordSerializationSchema.builder()
                        .setTopic(topic)
                        .setValueSerializationSchema(new SimpleStringSchema())
                        .build())
                .build();
    }

    private static SingleOutputStreamOperator<PageLoadSignal> parseEvents(
            SingleOutputStreamOperator<ValidatedEvent> input,
            String eventType,
            EventParser parser,
            OutputTag<RejectedEventEnvelope> dlqTag,
            String name) {
        return input
                .filter(event -> event != null && event.event != null && eventType.equals(event.event.eventType))
                .process(new SafeParser(parser, dlqTag))
                .returns(new TypeHint<PageLoadSignal>() {})
                .name(name);
    }

    @FunctionalInterface
    interface EventParser extends java.io.Serializable {
        List<PageLoadSignal> parse(ValidatedEvent event) throws Exception;
    }

    /**
     * Runs a parser and turns any failure into a parse DLQ envelope instead of failing the job.
     */
    static class SafeParser extends ProcessFunction<ValidatedEvent, PageLoadSignal> {
        private static final long serialVersionUID = 1L;
        private final EventParser parser;
        private final OutputTag<RejectedEventEnvelope> dlqTag;

        SafeParser(EventParser parser, OutputTag<RejectedEventEnvelope> dlqTag) {
            this.parser = parser;
            this.dlqTag = dlqTag;
        }

        @Override
        public void processElement(ValidatedEvent event, Context ctx, Collector<PageLoadSignal> out) {
            if (event == null || event.event == null) {
                return;
            }
            try {
                List<PageLoadSignal> signals = parser.parse(event);
                if (signals != null) {
                    for (PageLoadSignal signal : signals) {
                        out.collect(signal);
                    }
                }
            } catch (Exception ex) {
                LOG.debug("Parse failure (type={}, id={}): {}", event.event.eventType, event.event.eventId, ex.getMessage());
                ctx.output(dlqTag, RejectedEventEnvelopeFactory.forParseFailure(event.event, ex));
            }
        }
    }
}
