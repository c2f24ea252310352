package com.bizlaw.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Describes the business a research request is about. Created once per context submission.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BusinessContext(
        @NotBlank @JsonProperty("city") String city,
        @NotBlank @JsonProperty("state") String state,
        @NotBlank @JsonProperty("business_type") String businessType,
        @NotBlank @JsonProperty("area_of_law") String areaOfLaw,
        @JsonProperty("statute_of_law") String statuteOfLaw
) {

    public BusinessContext(String city, String state, String businessType, String areaOfLaw) {
        this(city, state, businessType, areaOfLaw, null);
    }

    public boolean isComplete() {
        return hasText(city) && hasText(state) && hasText(businessType) && hasText(areaOfLaw);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
