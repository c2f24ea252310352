package com.bizlaw.model;

import java.util.List;

public record ResearchResult(
        LegalAnalysis analysis,
        JurisdictionSources federal,
        JurisdictionSources state,
        JurisdictionSources local,
        double searchSeconds,
        double totalSeconds
) {

    public List<JurisdictionSources> allSources() {
        return List.of(federal, state, local);
    }

    public boolean isDegraded() {
        return federal.isDegraded() || state.isDegraded() || local.isDegraded();
    }
}
