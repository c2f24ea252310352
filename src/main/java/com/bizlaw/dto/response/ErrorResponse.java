package com.bizlaw.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String message,
        @JsonProperty("raw_output") String rawOutput,
        @JsonProperty("cleaned_output") String cleanedOutput
) {

    public ErrorResponse(String error, String message) {
        this(error, message, null, null);
    }
}
