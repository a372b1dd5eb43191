package com.pagechains.analytics.rules;

import com.pagechains.analytics.model.InitiatorType;
import com.pagechains.analytics.model.RequestPriority;
import com.pagechains.analytics.model.ResourceType;
import com.pagechains.analytics.util.StringSemantics;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Versioned thresholds and heuristics used to decide whether a request blocks rendering.
 */
public final class ClassifierRules implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String version;
    private final Set<ResourceType> renderBlockingTypes;
    private final Set<ResourceType> parserInitiatedTypes;
    private final RequestPriority minimumPriority;
    private final List<Pattern> faviconNamePatterns;
    private final Set<String> iconMimeTypes;
    private final boolean excludeImageMimeTypes;
    private final Set<String> nonNetworkSchemes;

    public ClassifierRules(
            String version,
            Collection<ResourceType> renderBlockingTypes,
            Collection<ResourceType> parserInitiatedTypes,
            RequestPriority minimumPriority,
            Collection<String> faviconNamePatterns,
            Collection<String> iconMimeTypes,
            boolean excludeImageMimeTypes,
            Collection<String> nonNetworkSchemes) {
        if (minimumPriority == null || minimumPriority == RequestPriority.UNKNOWN) {
            throw new IllegalArgumentException("minimumPriority must be a known priority");
        }
        this.version = StringSemantics.isBlank(version) ? "unknown" : version;
        this.renderBlockingTypes = Collections.unmodifiableSet(toEnumSet(renderBlockingTypes));
        this.parserInitiatedTypes = Collections.unmodifiableSet(toEnumSet(parserInitiatedTypes));
        this.minimumPriority = minimumPriority;
        List<Pattern> patterns = new ArrayList<>();
        for (String pattern : faviconNamePatterns) {
            patterns.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
        }
        this.faviconNamePatterns = Collections.unmodifiableList(patterns);
        this.iconMimeTypes = Collections.unmodifiableSet(lowerCased(iconMimeTypes));
        this.excludeImageMimeTypes = excludeImageMimeTypes;
        this.nonNetworkSchemes = Collections.unmodifiableSet(lowerCased(nonNetworkSchemes));
    }

    public String version() {
        return version;
    }

    public RequestPriority minimumPriority() {
        return minimumPriority;
    }

    /**
     * Documents, scripts and stylesheets block rendering outright; fetch/XHR only when the HTML
     * parser issued them.
     */
    public boolean isRenderBlocking(ResourceType type, InitiatorType initiatorType) {
        if (type == null || type == ResourceType.UNKNOWN) {
            return false;
        }
        if (renderBlockingTypes.contains(type)) {
            return true;
        }
        return initiatorType == InitiatorType.PARSER && parserInitiatedTypes.contains(type);
    }

    public boolean meetsMinimumPriority(RequestPriority priority) {
        return priority != null && priority.isAtLeast(minimumPriority);
    }

    public boolean isFaviconName(String lastPathComponent) {
        if (StringSemantics.isBlank(lastPathComponent)) {
            return false;
        }
        for (Pattern pattern : faviconNamePatterns) {
            if (pattern.matcher(lastPathComponent).matches()) {
                return true;
            }
        }
        return false;
    }

    /** Icon mime types always match; any other {@code image/*} matches when image exclusion is on. */
    public boolean isExcludedMimeType(String mimeType) {
        if (StringSemantics.isBlank(mimeType)) {
            return false;
        }
        String normalized = mimeType.trim().toLowerCase(Locale.ROOT);
        int params = normalized.indexOf(';');
        if (params >= 0) {
            normalized = normalized.substring(0, params).trim();
        }
        if (iconMimeTypes.contains(normalized)) {
            return true;
        }
        return excludeImageMimeTypes && normalized.startsWith("image/");
    }

    public boolean isNonNetworkScheme(String scheme) {
        return !StringSemantics.isBlank(scheme) && nonNetworkSchemes.contains(scheme.toLowerCase(Locale.ROOT));
    }

    private static EnumSet<ResourceType> toEnumSet(Collection<ResourceType> types) {
        EnumSet<ResourceType> set = EnumSet.noneOf(ResourceType.class);
        if (types != null) {
            for (ResourceType type : types) {
                if (type != null && type != ResourceType.UNKNOWN) {
                    set.add(type);
                }
            }
        }
        return set;
    }

    private static Set<String> lowerCased(Collection<String> values) {
        Set<String> out = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                if (!StringSemantics.isBlank(value)) {
                    out.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return out;
    }
}
