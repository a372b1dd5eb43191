package com.pagechains.analytics.pipeline;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;

import com.pagechains.analytics.model.KafkaInboundRecord;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class KafkaInboundRecordDeserializationSchemaTest {

    @Test
    void keepsCoordinatesKeyAndHeaders() {
        ConsumerRecord<byte[], byte[]> record = new ConsumerRecord<>(
                "page_load_events", 3, 17L, bytes("pl-1"), bytes("{\"type\":\"network_request\"}"));
        record.headers().add("recorder", bytes("lighthouse"));
        record.headers().add("empty", new byte[0]);

        KafkaInboundRecord inbound = KafkaInboundRecordDeserializationSchema.toInbound(record);

        assertEquals("page_load_events", inbound.topic);
        assertEquals(3, inbound.partition);
        assertEquals(17L, inbound.offset);
        assertEquals("pl-1", inbound.key);
        assertEquals("{\"type\":\"network_request\"}", new String(inbound.value, StandardCharsets.UTF_8));
        assertEquals("lighthouse", inbound.headers.get("recorder"));
        assertFalse(inbound.headers.containsKey("empty"));
    }

    @Test
    void emptyKeyBecomesNull() {
        ConsumerRecord<byte[], byte[]> record = new ConsumerRecord<>("page_load_events", 0, 1L, new byte[0], bytes("{}"));

        assertNull(KafkaInboundRecordDeserializationSchema.toInbound(record).key);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
