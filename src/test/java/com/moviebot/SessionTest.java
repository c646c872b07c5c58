package com.moviebot;

import com.moviebot.session.Session;
import com.moviebot.session.SessionManager;
import com.moviebot.session.SessionModels.Constraint;
import com.moviebot.session.SessionModels.ConstraintKind;
import com.moviebot.session.SessionModels.IntentType;
import com.moviebot.session.SessionModels.ParsedIntent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    @Test
    void excludeListTracksSeedsAndRecommendationsAtEveryStep() {
        Session session = new Session("u1");
        assertEquals(Set.of(), session.excludeList());

        session.update(ParsedIntent.seeds("M1"));
        assertEquals(Set.of("M1"), session.excludeList());

        session.addRecommendations(List.of("M2", "M3"));
        assertEquals(Set.of("M1", "M2", "M3"), session.excludeList());

        session.update(ParsedIntent.seeds("M4"));
        assertEquals(Set.of("M1", "M2", "M3", "M4"), session.excludeList());

        session.clear();
        assertEquals(Set.of(), session.excludeList());
    }

    @Test
    void followUpWithoutSeedsPromotesPreviousRecommendations() {
        Session session = new Session("u2");
        session.update(ParsedIntent.seeds("M1"));
        session.addRecommendations(List.of("M5", "M6"));

        session.update(ParsedIntent.followUpRequest());

        assertTrue(session.seedEntities().containsAll(Set.of("M1", "M5", "M6")));
        assertTrue(session.recommendedEntities().isEmpty());
        assertEquals(Set.of("M1", "M5", "M6"), session.excludeList());
    }

    @Test
    void followUpWithNewSeedsKeepsRecommendationsAsShown() {
        Session session = new Session("u3");
        session.addRecommendations(List.of("M5"));

        session.update(new ParsedIntent(IntentType.RECOMMENDATION, Set.of("M9"), Map.of(), Map.of(), Map.of(), true));

        assertEquals(Set.of("M9"), session.seedEntities());
        assertEquals(Set.of("M5"), session.recommendedEntities());
    }

    @Test
    void preferencesConstraintsAndNegationsAreLastWriteWinsPerKind() {
        Session session = new Session("u4");
        session.update(new ParsedIntent(IntentType.RECOMMENDATION, Set.of(),
                Map.of("genre", "Q100", "director", "Q300"),
                Map.of(ConstraintKind.YEAR, Constraint.year(">", 1990)),
                Map.of("genre", "Q103"), false));
        session.update(new ParsedIntent(IntentType.RECOMMENDATION, Set.of(),
                Map.of("genre", "Q101"),
                Map.of(ConstraintKind.YEAR, Constraint.year("<", 2000), ConstraintKind.LANGUAGE, Constraint.language("Q150")),
                Map.of(), false));

        assertEquals(Map.of("genre", "Q101", "director", "Q300"), session.preferences());
        assertEquals("<", session.constraints().get(ConstraintKind.YEAR).operator());
        assertEquals("Q150", session.constraints().get(ConstraintKind.LANGUAGE).entityId());
        assertEquals(Map.of("genre", "Q103"), session.negations());
    }

    @Test
    void clearKeepsUserIdAndEmptiesEverythingElse() {
        Session session = new Session("u5");
        session.update(new ParsedIntent(IntentType.RECOMMENDATION, Set.of("M1"), Map.of("genre", "Q100"),
                Map.of(ConstraintKind.MIN_RATING, Constraint.minRating(7.0)), Map.of("actor", "Q7"), false));
        session.addRecommendations(List.of("M2"));
        session.recordTurn("hi", "hello");

        session.clear();

        var snapshot = session.snapshot();
        assertEquals("u5", snapshot.userId());
        assertTrue(snapshot.seedEntities().isEmpty());
        assertTrue(snapshot.preferences().isEmpty());
        assertTrue(snapshot.constraints().isEmpty());
        assertTrue(snapshot.negations().isEmpty());
        assertTrue(snapshot.recommendedEntities().isEmpty());
        assertTrue(snapshot.history().isEmpty());
        assertFalse(session.hasInput());
    }

    @Test
    void rejectsMalformedConstraints() {
        assertThrows(IllegalArgumentException.class, () -> Constraint.year("!=", 1990));
        assertThrows(IllegalArgumentException.class, () -> Constraint.yearRange(2000, 1990));
        assertThrows(IllegalArgumentException.class, () -> Constraint.language(" "));
    }

    @Test
    void managerCreatesSessionsLazilyAndSerializesAccessPerUser() throws Exception {
        SessionManager manager = new SessionManager();
        assertFalse(manager.exists("u6"));

        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new java.util.ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String id = "M" + i;
            futures.add(pool.submit(() -> manager.withSession("u6", s -> {
                maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                s.addRecommendations(List.of(id));
                inside.decrementAndGet();
                return null;
            })));
        }
        for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertTrue(manager.exists("u6"));
        assertEquals(1, maxInside.get());
        assertEquals(50, manager.snapshot("u6").recommendedEntities().size());

        manager.reset("u6");
        assertTrue(manager.snapshot("u6").recommendedEntities().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> manager.withSession(" ", s -> null));
    }
}
