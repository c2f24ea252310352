package com.bizlaw.model;

import java.util.List;

/**
 * Result of exactly one provider call. A failed call carries no records.
 */
public record ScopedSearchOutcome(
        String scopedQuery,
        List<LegalSourceRecord> records,
        boolean failed,
        String error
) {

    public ScopedSearchOutcome {
        records = List.copyOf(records);
    }

    public static ScopedSearchOutcome success(String scopedQuery, List<LegalSourceRecord> records) {
        return new ScopedSearchOutcome(scopedQuery, records, false, null);
    }

    public static ScopedSearchOutcome failure(String scopedQuery, String error) {
        return new ScopedSearchOutcome(scopedQuery, List.of(), true, error);
    }
}
