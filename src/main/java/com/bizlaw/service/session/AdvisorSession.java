package com.bizlaw.service.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.bizlaw.model.BusinessContext;
import com.bizlaw.model.LegalAnalysis;

import lombok.Getter;

/**
 * Explicit per-session state: the active business context and a bounded chat history.
 */
public class AdvisorSession {

    @Getter
    private final String id;

    @Getter
    private final Instant createdAt = Instant.now();

    private final int maxHistory;

    private BusinessContext context;

    private final List<ChatTurn> turns = new ArrayList<>();

    public AdvisorSession(String id, int maxHistory) {
        this.id = id;
        this.maxHistory = maxHistory;
    }

    public synchronized BusinessContext getContext() {
        return context;
    }

    /**
     * Replaces the business context; history built under the old context is discarded.
     */
    public synchronized void replaceContext(BusinessContext newContext) {
        this.context = newContext;
        this.turns.clear();
    }

    public synchronized void addTurn(String query, LegalAnalysis analysis) {
        turns.add(new ChatTurn(Instant.now().toString(), query, analysis));
        while (turns.size() > maxHistory) {
            turns.remove(0);
        }
    }

    public synchronized List<ChatTurn> getTurns() {
        return List.copyOf(turns);
    }

    public record ChatTurn(String timestamp, String query, LegalAnalysis analysis) {
    }
}
