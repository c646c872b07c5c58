package com.moviebot.session;

import com.moviebot.session.SessionModels.Constraint;
import com.moviebot.session.SessionModels.ConstraintKind;
import com.moviebot.session.SessionModels.ParsedIntent;
import com.moviebot.session.SessionModels.SessionSnapshot;
import com.moviebot.session.SessionModels.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Conversational memory of one user. Not thread-safe on its own: callers go through
 * {@link SessionManager#withSession}, which holds {@link #lock()} for the whole request.
 */
public class Session {
    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final String userId;
    private final ReentrantLock lock = new ReentrantLock();

    private final Set<String> seedEntities = new LinkedHashSet<>();
    private final Map<String, String> preferences = new LinkedHashMap<>();
    private final Map<ConstraintKind, Constraint> constraints = new EnumMap<>(ConstraintKind.class);
    private final Map<String, String> negations = new LinkedHashMap<>();
    private final Set<String> recommendedEntities = new LinkedHashSet<>();
    private final List<Turn> history = new ArrayList<>();

    public Session(String userId) {
        this.userId = userId;
    }

    public void update(ParsedIntent intent) {
        if (intent == null) return;
        log.debug("Updating session {} with {}", userId, intent);

        if (!intent.seedEntities().isEmpty()) {
            seedEntities.addAll(intent.seedEntities());
            log.info("Session {}: added seeds {}", userId, intent.seedEntities());
        }
        if (!intent.preferences().isEmpty()) {
            preferences.putAll(intent.preferences());
            log.info("Session {}: updated preferences {}", userId, intent.preferences());
        }
        if (!intent.constraints().isEmpty()) {
            constraints.putAll(intent.constraints());
            log.info("Session {}: updated constraints {}", userId, intent.constraints().keySet());
        }
        if (!intent.negations().isEmpty()) {
            negations.putAll(intent.negations());
            log.info("Session {}: updated negations {}", userId, intent.negations());
        }

        // "more like that": last answer becomes the new anchor and stops counting as shown
        if (intent.followUp() && intent.seedEntities().isEmpty() && !recommendedEntities.isEmpty()) {
            log.info("Session {}: promoting {} previous recommendations to seeds", userId, recommendedEntities.size());
            seedEntities.addAll(recommendedEntities);
            recommendedEntities.clear();
        }
    }

    public void addRecommendations(Collection<String> entityIds) {
        recommendedEntities.addAll(entityIds);
        log.info("Session {}: {} movies marked as recommended", userId, entityIds.size());
    }

    public Set<String> excludeList() {
        Set<String> exclude = new HashSet<>(seedEntities);
        exclude.addAll(recommendedEntities);
        return exclude;
    }

    public boolean hasInput() {
        return !seedEntities.isEmpty() || !preferences.isEmpty();
    }

    public void recordTurn(String userMessage, String botResponse) {
        history.add(new Turn(userMessage, botResponse, Instant.now()));
    }

    public void clear() {
        log.info("Clearing session for user {}", userId);
        seedEntities.clear();
        preferences.clear();
        constraints.clear();
        negations.clear();
        recommendedEntities.clear();
        history.clear();
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(userId,
                Set.copyOf(seedEntities),
                Map.copyOf(preferences),
                Map.copyOf(constraints),
                Map.copyOf(negations),
                Set.copyOf(recommendedEntities),
                List.copyOf(history));
    }

    ReentrantLock lock() {
        return lock;
    }

    public String userId() {
        return userId;
    }

    public Set<String> seedEntities() {
        return Collections.unmodifiableSet(seedEntities);
    }

    public Map<String, String> preferences() {
        return Collections.unmodifiableMap(preferences);
    }

    public Map<ConstraintKind, Constraint> constraints() {
        return Collections.unmodifiableMap(constraints);
    }

    public Map<String, String> negations() {
        return Collections.unmodifiableMap(negations);
    }

    public Set<String> recommendedEntities() {
        return Collections.unmodifiableSet(recommendedEntities);
    }

    public List<Turn> history() {
        return Collections.unmodifiableList(history);
    }
}
