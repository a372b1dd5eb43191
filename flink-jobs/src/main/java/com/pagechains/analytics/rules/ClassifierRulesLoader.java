package com.pagechains.analytics.rules;

import com.fasterxml.jackson.databind.JsonNode;

import com.pagechains.analytics.model.RequestPriority;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.util.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the criticality rules catalog from classpath or filesystem.
 *
 * Lookup order:
 * 1) JVM property `chains.rules.path`
 * 2) classpath resource `/reference/critical_request_rules.v1.json`
 * 3) repository fallback `configs/reference/critical_request_rules.v1.json`
 */
public final class ClassifierRulesLoader {
    public static final String RULES_PROPERTY = "chains.rules.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "reference/critical_request_rules.v1.json";
    public static final Path DEFAULT_REPO_PATH = Path.of("configs/reference/critical_request_rules.v1.json");

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(ClassifierRulesLoader.class);

    private ClassifierRulesLoader() {}

    public static ClassifierRules loadDefault() {
        String overridePath = System.getProperty(RULES_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }

        ClassifierRules fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        return loadFromFile(DEFAULT_REPO_PATH);
    }

    static ClassifierRules loadFromClasspath(String resourcePath) {
        try (InputStream in = ClassifierRulesLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            JsonNode root = JsonSupport.MAPPER.readTree(in);
            ClassifierRules rules = parseRules(root);
            LOG.info("Loaded criticality rules version={} from classpath:{}", rules.version(), resourcePath);
            return rules;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load criticality rules from classpath: " + resourcePath, ex);
        }
    }

    static ClassifierRules loadFromFile(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Criticality rules file not found: " + path);
        }
        try {
            JsonNode root = JsonSupport.MAPPER.readTree(path.toFile());
            ClassifierRules rules = parseRules(root);
            LOG.info("Loaded criticality rules version={} from {}", rules.version(), path);
            return rules;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load criticality rules from file: " + path, ex);
        }
    }

    static ClassifierRules parseRules(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Criticality rules catalog is not a JSON object");
        }

        String version = root.path("rules_version").asText("unknown");
        RequestPriority minimumPriority = RequestPriority.fromWire(root.path("minimum_priority").asText(""));
        if (minimumPriority == RequestPriority.UNKNOWN) {
            throw new IllegalStateException("Criticality rules catalog has an unknown minimum_priority: "
                    + root.path("minimum_priority").asText(""));
        }

        return new ClassifierRules(
                version,
                resourceTypes(root, "render_blocking_resource_types"),
                resourceTypes(root, "parser_initiated_resource_types"),
                minimumPriority,
                strings(root, "favicon_name_patterns"),
                strings(root, "icon_mime_types"),
                root.path("exclude_image_mime_types").asBoolean(true),
                strings(root, "non_network_schemes"));
    }

    private static List<ResourceType> resourceTypes(JsonNode root, String field) {
        List<ResourceType> out = new ArrayList<>();
        for (String wire : strings(root, field)) {
            ResourceType type = ResourceType.fromWire(wire);
            if (type == ResourceType.UNKNOWN) {
                LOG.warn("Ignoring unknown resource type '{}' in {}", wire, field);
                continue;
            }
            out.add(type);
        }
        return out;
    }

    private static List<String> strings(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (!node.isArray()) {
            throw new IllegalStateException("Criticality rules catalog missing " + field + " array");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                out.add(item.asText());
            }
        }
        return out;
    }
}
