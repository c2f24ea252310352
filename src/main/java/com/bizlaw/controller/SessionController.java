package com.bizlaw.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bizlaw.model.LegalAnalysis;
import com.bizlaw.service.advisory.AdvisoryService;
import com.bizlaw.service.session.AdvisorSession;
import com.bizlaw.service.session.AdvisorSessionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SessionController {

    private final AdvisorSessionService sessionService;
    private final AdvisoryService advisoryService;

    @GetMapping("/session/{sessionId}/history")
    public ResponseEntity<?> history(@PathVariable String sessionId) {
        log.debug("History requested for session: {}", sessionId);

        AdvisorSession session = sessionService.require(sessionId);
        List<AdvisorSession.ChatTurn> turns = session.getTurns();

        return ResponseEntity.ok(Map.of(
                "session_id", sessionId,
                "total_turns", turns.size(),
                "conversations", turns
        ));
    }

    /**
     * The analysis stored when the session's context was last submitted.
     */
    @GetMapping("/session/{sessionId}/applicable-laws")
    public ResponseEntity<LegalAnalysis> applicableLaws(@PathVariable String sessionId) {
        return advisoryService.applicableLaws(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/session/{sessionId}")
    public ResponseEntity<?> deleteSession(@PathVariable String sessionId) {
        log.info("Deleting session: {}", sessionId);
        if (!advisoryService.deleteSession(sessionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "session_id", sessionId));
    }

    @GetMapping("/sessions")
    public ResponseEntity<?> listSessions() {
        List<String> sessions = sessionService.listSessions();
        log.debug("Active sessions: {}", sessions.size());
        return ResponseEntity.ok(Map.of("sessions", sessions, "total", sessions.size()));
    }
}
