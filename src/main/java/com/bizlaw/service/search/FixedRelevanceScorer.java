package com.bizlaw.service.search;

import org.springframework.stereotype.Component;

import com.bizlaw.dto.internal.OrganicResult;
import com.bizlaw.model.Jurisdiction;

/**
 * No ranking model: every trusted hit is equally relevant.
 */
@Component
public class FixedRelevanceScorer implements RelevanceScorer {

    public static final double FIXED_SCORE = 1.0;

    @Override
    public double score(String query, OrganicResult result, Jurisdiction jurisdiction) {
        return FIXED_SCORE;
    }
}
