package com.pagechains.analytics.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pagechains.analytics.model.PageEvent;
import com.pagechains.analytics.util.JsonSupport;

import java.io.Serializable;

/**
 * A validated recorder event together with its parsed JSON tree.
 */
public class ValidatedEvent implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ValidatedEvent.class);

    public PageEvent event;
    // Transient to avoid Kryo/ReflectASM instantiation issues with JsonNode on Java 17+.
    // Re-parsed from rawJson after the event crosses a network boundary.
    public transient JsonNode root;
    public transient JsonNode data;

    public ValidatedEvent() {}

    public ValidatedEvent(PageEvent event, JsonNode root) {
        this.event = event;
        this.root = root;
        this.data = root == null ? null : root.path("data");
    }

    public JsonNode root() {
        if (root == null) {
            root = parseRoot();
            data = root == null ? null : root.path("data");
        }
        return root;
    }

    public JsonNode data() {
        if (data == null) {
            JsonNode parsedRoot = root();
            data = parsedRoot == null ? null : parsedRoot.path("data");
        }
        return data;
    }

    private JsonNode parseRoot() {
        if (event == null || event.rawJson == null) {
            return null;
        }
        try {
            return JsonSupport.MAPPER.readTree(event.rawJson);
        } catch (JsonProcessingException ex) {
            // Already validated upstream; only a corrupted state copy ends up here.
            LOG.warn("Unable to re-parse validated event (id={}): {}", event.eventId, ex.getMessage());
            return null;
        }
    }
}
