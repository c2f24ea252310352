package com.bizlaw.service.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.bizlaw.config.AdvisorProperties;
import com.bizlaw.exception.SessionNotFoundException;
import com.bizlaw.model.BusinessContext;
import com.bizlaw.model.LegalAnalysis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdvisorSessionService {

    // ids double as artifact directory names
    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final AdvisorProperties properties;

    private final Map<String, AdvisorSession> sessions = new ConcurrentHashMap<>();

    /**
     * Get or create a session; a null id creates a fresh one
     */
    public AdvisorSession getOrCreate(String sessionId) {
        String id = sessionId != null && !sessionId.isBlank() ? sessionId : UUID.randomUUID().toString();
        if (!SESSION_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Session id must be 1-64 letters, digits, '-' or '_'");
        }
        return sessions.computeIfAbsent(id, key -> {
            log.info("Creating new session: {}", key);
            return new AdvisorSession(key, properties.getSession().getMaxHistory());
        });
    }

    public AdvisorSession require(String sessionId) {
        AdvisorSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public boolean sessionExists(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    public AdvisorSession defineContext(String sessionId, BusinessContext context) {
        AdvisorSession session = getOrCreate(sessionId);
        session.replaceContext(context);
        log.info("Session {} context set: {} in {}, {} ({})",
                session.getId(), context.businessType(), context.city(), context.state(), context.areaOfLaw());
        return session;
    }

    public void addTurn(String sessionId, String query, LegalAnalysis analysis) {
        require(sessionId).addTurn(query, analysis);
    }

    public List<AdvisorSession.ChatTurn> getHistory(String sessionId) {
        return require(sessionId).getTurns();
    }

    public boolean deleteSession(String sessionId) {
        AdvisorSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("Deleted session: {}", sessionId);
            return true;
        }
        log.warn("Attempted to delete non-existent session: {}", sessionId);
        return false;
    }

    public List<String> listSessions() {
        return new ArrayList<>(sessions.keySet());
    }

    public int getSessionCount() {
        return sessions.size();
    }
}
