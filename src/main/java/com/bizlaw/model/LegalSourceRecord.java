package com.bizlaw.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One discovered candidate legal reference. {@code content} is a serialized snapshot
 * of the raw provider result, not fetched page content.
 */
public record LegalSourceRecord(
        @JsonProperty("url") String url,
        @JsonProperty("jurisdiction") Jurisdiction jurisdiction,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("relevance_score") double relevanceScore,
        @JsonProperty("content") String content
) {
}
