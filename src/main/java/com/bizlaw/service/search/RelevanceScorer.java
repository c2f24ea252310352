package com.bizlaw.service.search;

import com.bizlaw.dto.internal.OrganicResult;
import com.bizlaw.model.Jurisdiction;

/**
 * Scores one provider hit for a scoped query. Implementations should return a value in [0, 1].
 */
public interface RelevanceScorer {

    double score(String query, OrganicResult result, Jurisdiction jurisdiction);
}
