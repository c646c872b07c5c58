package com.moviebot.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-lifetime registry of user sessions. Sessions are created on first use and only ever
 * cleared, never evicted.
 */
@Component
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} with exclusive access to the user's session.
     */
    public <T> T withSession(String userId, Function<Session, T> action) {
        Session session = sessionFor(userId);
        session.lock().lock();
        try {
            return action.apply(session);
        } finally {
            session.lock().unlock();
        }
    }

    public void reset(String userId) {
        withSession(userId, session -> {
            session.clear();
            return null;
        });
    }

    public SessionModels.SessionSnapshot snapshot(String userId) {
        return withSession(userId, Session::snapshot);
    }

    public boolean exists(String userId) {
        return sessions.containsKey(userId);
    }

    private Session sessionFor(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return sessions.computeIfAbsent(userId, id -> {
            log.info("Creating new session for user {}", id);
            return new Session(id);
        });
    }
}
