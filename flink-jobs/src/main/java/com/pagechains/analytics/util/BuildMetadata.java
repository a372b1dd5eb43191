package com.pagechains.analytics.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Properties;

/**
 * Build identity stamped onto results and startup logs.
 */
public final class BuildMetadata implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BuildMetadata.class);

    private static final String BUILD_INFO_RESOURCE = "build-info.properties";
    private static final BuildMetadata INSTANCE = load();

    private final String version;
    private final String gitCommit;

    BuildMetadata(String version, String gitCommit) {
        this.version = normalize(version, "dev");
        this.gitCommit = normalize(gitCommit, "unknown");
    }

    public static BuildMetadata current() {
        return INSTANCE;
    }

    public String version() {
        return version;
    }

    public String gitCommit() {
        return gitCommit;
    }

    public String identity() {
        return version + "+" + gitCommit;
    }

    private static BuildMetadata load() {
        Properties props = new Properties();
        try (InputStream in = BuildMetadata.class.getClassLoader().getResourceAsStream(BUILD_INFO_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            // Missing metadata must not stop the job.
            LOG.warn("Unable to read {}: {}", BUILD_INFO_RESOURCE, ex.getMessage());
        }
        return new BuildMetadata(props.getProperty("build.version"), props.getProperty("build.git.commit"));
    }

    // Unfiltered Maven placeholders count as missing.
    static String normalize(String value, String fallback) {
        if (StringSemantics.isBlank(value)) {
            return fallback;
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("${") && trimmed.endsWith("}")) {
            return fallback;
        }
        return trimmed;
    }
}
