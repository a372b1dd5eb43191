package com.pagechains.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.Serializable;

/**
 * Critical request chains computed for one completed page load, as published to the result topic.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CriticalChainsResult implements Serializable {
    private static final long serialVersionUID = 1L;

    public String pageLoadId;
    public String mainDocumentUrl;
    public String rootRequestId;
    public int recordCount;
    public int criticalCount;
    public int chainCount;
    public int longestChainLength;
    public double longestChainDurationMs;
    public long longestChainTransferSize;
    // Serialized forest; embedded as-is in the published JSON.
    @JsonRawValue
    public String chains;
    public long computedAt;
    public String buildVersion;

    @JsonIgnore
    public PageEvent sourceEvent;

    public CriticalChainsResult() {}
}
