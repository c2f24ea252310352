package com.bizlaw.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One organic search hit as returned by the provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganicResult {

    private String url;

    private String title;

    private String snippet;

    private String rawJson;  // provider payload for this hit, serialized as-is
}
