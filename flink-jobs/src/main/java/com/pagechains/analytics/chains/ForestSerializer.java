package com.pagechains.analytics.chains;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.pagechains.analytics.model.RequestPriority;
import com.pagechains.analytics.model.RequestRecord;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.util.JsonSupport;

/**
 * Renders a forest as nested {@code {id: {request: {...}, children: {...}}}} JSON.
 */
public final class ForestSerializer {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ForestSerializer() {}

    public static ObjectNode serialize(ChainForest forest) {
        ObjectNode out = NODES.objectNode();
        if (forest == null) {
            return out;
        }
        for (ChainNode root : forest.roots().values()) {
            out.set(root.requestId(), renderNode(root));
        }
        return out;
    }

    public static String toJson(ChainForest forest) {
        try {
            return JsonSupport.MAPPER.writeValueAsString(serialize(forest));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize critical request chains", ex);
        }
    }

    private static ObjectNode renderNode(ChainNode node) {
        ObjectNode rendered = NODES.objectNode();
        rendered.set("request", renderRequest(node.request()));
        ObjectNode children = rendered.putObject("children");
        for (ChainNode child : node.children().values()) {
            children.set(child.requestId(), renderNode(child));
        }
        return rendered;
    }

    static ObjectNode renderRequest(RequestRecord record) {
        ObjectNode request = NODES.objectNode();
        request.put("url", record.url);
        if (record.resourceType == null || record.resourceType == ResourceType.UNKNOWN) {
            request.putNull("resourceType");
        } else {
            request.put("resourceType", record.resourceType.wireName());
        }
        if (record.priority == null || record.priority == RequestPriority.UNKNOWN) {
            request.putNull("priority");
        } else {
            request.put("priority", record.priority.wireName());
        }
        request.put("startTime", record.startTime);
        request.put("responseReceivedTime", record.responseReceivedTime);
        request.put("endTime", record.endTime);
        request.put("transferSize", record.transferSize);
        request.put("statusCode", record.statusCode);
        return request;
    }
}
