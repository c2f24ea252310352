package com.bizlaw.service.session;

import com.bizlaw.config.AdvisorProperties;
import com.bizlaw.exception.SessionNotFoundException;
import com.bizlaw.model.BusinessContext;
import com.bizlaw.model.LegalAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdvisorSessionServiceTest {

    private static final BusinessContext BAKERY = new BusinessContext("Boise", "Idaho", "Bakery", "Health and Safety");
    private static final BusinessContext SALON = new BusinessContext("Reno", "Nevada", "Hair Salon", "Licensing, Permits and Zoning");

    private AdvisorSessionService sessionService;

    @BeforeEach
    void setUp() {
        AdvisorProperties properties = new AdvisorProperties();
        properties.getSession().setMaxHistory(2);
        sessionService = new AdvisorSessionService(properties);
    }

    private static LegalAnalysis analysis(String summary) {
        return new LegalAnalysis(summary, List.of(), Map.of(), List.of(), List.of(), List.of(), 0.5);
    }

    @Test
    @DisplayName("a missing id creates a fresh session; a known id returns the same one")
    void getOrCreate() {
        AdvisorSession created = sessionService.getOrCreate(null);

        assertThat(created.getId()).isNotBlank();
        assertThat(sessionService.getOrCreate(created.getId())).isSameAs(created);
        assertThat(sessionService.listSessions()).containsExactly(created.getId());
    }

    @Test
    @DisplayName("ids unusable as artifact directory names are refused")
    void rejectsUnsafeIds() {
        assertThatThrownBy(() -> sessionService.getOrCreate("../../etc"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("replacing the context clears the history built under the old one")
    void contextReplacementClearsHistory() {
        sessionService.defineContext("s1", BAKERY);
        sessionService.addTurn("s1", "do I need a permit?", analysis("yes"));

        sessionService.defineContext("s1", SALON);

        assertThat(sessionService.require("s1").getContext()).isEqualTo(SALON);
        assertThat(sessionService.getHistory("s1")).isEmpty();
    }

    @Test
    @DisplayName("history keeps only the most recent turns")
    void boundedHistory() {
        sessionService.defineContext("s1", BAKERY);
        sessionService.addTurn("s1", "q1", analysis("a1"));
        sessionService.addTurn("s1", "q2", analysis("a2"));
        sessionService.addTurn("s1", "q3", analysis("a3"));

        assertThat(sessionService.getHistory("s1"))
                .extracting(AdvisorSession.ChatTurn::query)
                .containsExactly("q2", "q3");
    }

    @Test
    @DisplayName("unknown sessions are reported, deletion tells whether anything was removed")
    void unknownAndDelete() {
        assertThatThrownBy(() -> sessionService.require("missing")).isInstanceOf(SessionNotFoundException.class);

        sessionService.defineContext("s1", BAKERY);
        assertThat(sessionService.deleteSession("s1")).isTrue();
        assertThat(sessionService.deleteSession("s1")).isFalse();
        assertThat(sessionService.sessionExists("s1")).isFalse();
        assertThat(sessionService.getSessionCount()).isZero();
    }
}
