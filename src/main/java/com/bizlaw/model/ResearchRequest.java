package com.bizlaw.model;

/**
 * Explicit per-call input to the pipeline. {@code timeoutSeconds} is the caller-supplied
 * deadline around the model call; null falls back to the configured default.
 */
public record ResearchRequest(
        String query,
        BusinessContext context,
        Long timeoutSeconds
) {

    public ResearchRequest(String query, BusinessContext context) {
        this(query, context, null);
    }
}
