package com.bizlaw.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal artifact of one research query.
 * {@code sources} is the Federal, then State, then Local source URLs that fed the synthesis call.
 */
public record LegalAnalysis(
        @JsonProperty("summary") String summary,
        @JsonProperty("key_points") List<String> keyPoints,
        @JsonProperty("jurisdiction_analysis") Map<String, String> jurisdictionAnalysis,
        @JsonProperty("compliance_steps") List<String> complianceSteps,
        @JsonProperty("overlapping_regulations") List<String> overlappingRegulations,
        @JsonProperty("sources") List<String> sources,
        @JsonProperty("response_time") double responseTime
) {

    public LegalAnalysis {
        keyPoints = List.copyOf(keyPoints);
        jurisdictionAnalysis = Collections.unmodifiableMap(new LinkedHashMap<>(jurisdictionAnalysis));
        complianceSteps = List.copyOf(complianceSteps);
        overlappingRegulations = List.copyOf(overlappingRegulations);
        sources = List.copyOf(sources);
    }
}
