package com.bizlaw.service.search;

import java.util.List;

import com.bizlaw.dto.internal.OrganicResult;
import com.bizlaw.exception.ProviderException;

/**
 * External web search boundary: one free-text query in, ordered organic results out.
 */
public interface SearchProvider {

    /**
     * @throws ProviderException on network failure or a malformed provider payload
     */
    List<OrganicResult> search(String query);
}
