package com.pagechains.analytics.pipeline;

import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.source.reader.deserializer.KafkaRecordDeserializationSchema;
import org.apache.flink.util.Collector;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

import com.pagechains.analytics.model.KafkaInboundRecord;

import java.nio.charset.StandardCharsets;

/**
 * Wraps recorder messages with their Kafka coordinates. Tombstones carry no event and are skipped;
 * everything else, decodable or not, is handed to the quality gate.
 */
public class KafkaInboundRecordDeserializationSchema implements KafkaRecordDeserializationSchema<KafkaInboundRecord> {
    private static final long serialVersionUID = 1L;

    @Override
    public void deserialize(ConsumerRecord<byte[], byte[]> record, Collector<KafkaInboundRecord> out) {
        if (record.value() == null) {
            return;
        }
        out.collect(toInbound(record));
    }

    static KafkaInboundRecord toInbound(ConsumerRecord<byte[], byte[]> record) {
        KafkaInboundRecord inbound = new KafkaInboundRecord();
        inbound.topic = record.topic();
        inbound.partition = record.partition();
        inbound.offset = record.offset();
        inbound.recordTimestamp = record.timestamp();
        inbound.value = record.value();
        inbound.key = decode(record.key());
        if (record.headers() != null) {
            for (Header header : record.headers()) {
                String value = decode(header.value());
                if (value != null) {
                    inbound.headers.put(header.key(), value);
                }
            }
        }
        return inbound;
    }

    private static String decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public TypeInformation<KafkaInboundRecord> getProducedType() {
        return TypeInformation.of(KafkaInboundRecord.class);
    }
}
