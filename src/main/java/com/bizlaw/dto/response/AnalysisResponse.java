package com.bizlaw.dto.response;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.bizlaw.model.JurisdictionSources;
import com.bizlaw.model.LegalAnalysis;
import com.bizlaw.service.advisory.AdvisoryService.AdvisoryResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResponse {

    // ================= ANALYSIS =================
    private String summary;

    @JsonProperty("key_points")
    private List<String> keyPoints;

    @JsonProperty("jurisdiction_analysis")
    private Map<String, String> jurisdictionAnalysis;

    @JsonProperty("compliance_steps")
    private List<String> complianceSteps;

    @JsonProperty("overlapping_regulations")
    private List<String> overlappingRegulations;

    private List<String> sources;

    @JsonProperty("response_time")
    private Double responseTime;

    // ================= CALL METADATA =================
    @JsonProperty("session_id")
    private String sessionId;

    /**
     * Keyed by jurisdiction name, Federal/State/Local order.
     */
    @JsonProperty("search_status")
    private Map<String, JurisdictionStatus> searchStatus;

    public static AnalysisResponse from(AdvisoryResult advisoryResult) {
        LegalAnalysis analysis = advisoryResult.result().analysis();

        Map<String, JurisdictionStatus> status = new LinkedHashMap<>();
        for (JurisdictionSources sources : advisoryResult.result().allSources()) {
            status.put(sources.jurisdiction().getDisplayName(), JurisdictionStatus.from(sources));
        }

        return AnalysisResponse.builder()
                .summary(analysis.summary())
                .keyPoints(analysis.keyPoints())
                .jurisdictionAnalysis(analysis.jurisdictionAnalysis())
                .complianceSteps(analysis.complianceSteps())
                .overlappingRegulations(analysis.overlappingRegulations())
                .sources(analysis.sources())
                .responseTime(analysis.responseTime())
                .sessionId(advisoryResult.sessionId())
                .searchStatus(status)
                .build();
    }
}
