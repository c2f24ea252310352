package com.bizlaw.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Records gathered for one jurisdiction plus the status of the scoped queries that produced them,
 * so that "no sources exist" and "search degraded" can be told apart.
 */
public record JurisdictionSources(
        Jurisdiction jurisdiction,
        List<LegalSourceRecord> records,
        int attemptedQueries,
        int failedQueries,
        List<String> errors
) {

    public JurisdictionSources {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }

    /**
     * Concatenates outcomes in the given order.
     */
    public static JurisdictionSources of(Jurisdiction jurisdiction, List<ScopedSearchOutcome> outcomes) {
        List<LegalSourceRecord> records = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int failed = 0;

        for (ScopedSearchOutcome outcome : outcomes) {
            records.addAll(outcome.records());
            if (outcome.failed()) {
                failed++;
                errors.add(outcome.error() != null ? outcome.error() : "unknown error");
            }
        }

        return new JurisdictionSources(jurisdiction, records, outcomes.size(), failed, errors);
    }

    /**
     * A branch that failed as a whole, outside any single scoped query.
     */
    public static JurisdictionSources failed(Jurisdiction jurisdiction, String error) {
        return new JurisdictionSources(jurisdiction, List.of(), 1, 1, List.of(error));
    }

    public static JurisdictionSources empty(Jurisdiction jurisdiction) {
        return new JurisdictionSources(jurisdiction, List.of(), 0, 0, List.of());
    }

    public boolean isDegraded() {
        return failedQueries > 0;
    }

    public List<String> urls() {
        return records.stream().map(LegalSourceRecord::url).toList();
    }
}
