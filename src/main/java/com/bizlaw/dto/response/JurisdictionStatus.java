package com.bizlaw.dto.response;

import com.bizlaw.model.JurisdictionSources;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lets callers tell "no sources exist" apart from "search degraded".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JurisdictionStatus {

    private Integer records;

    @JsonProperty("attempted_queries")
    private Integer attemptedQueries;

    @JsonProperty("failed_queries")
    private Integer failedQueries;

    private Boolean degraded;

    public static JurisdictionStatus from(JurisdictionSources sources) {
        return JurisdictionStatus.builder()
                .records(sources.records().size())
                .attemptedQueries(sources.attemptedQueries())
                .failedQueries(sources.failedQueries())
                .degraded(sources.isDegraded())
                .build();
    }
}
