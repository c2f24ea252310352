package com.bizlaw.dto.request;

import com.bizlaw.model.BusinessContext;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextRequest {

    @JsonProperty("session_id")
    private String sessionId;

    @NotNull
    @Valid
    private BusinessContext context;

    @Min(1)
    @Max(600)
    @JsonProperty("timeout_seconds")
    private Long timeoutSeconds;
}
