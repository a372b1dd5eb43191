package com.pagechains.analytics.model;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Raw recorder message as read from Kafka, before any JSON parsing.
 */
public class KafkaInboundRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public String topic;
    public int partition;
    public long offset;
    public long recordTimestamp;
    public byte[] value;
    // Recorders key messages by page-load id; used when the payload omits it.
    public String key;
    public Map<String, String> headers = new HashMap<>();

    public KafkaInboundRecord() {}
}
