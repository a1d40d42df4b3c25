package com.duckide.practice.session;

import com.duckide.practice.domain.DomainModels.Session;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SessionTrackerTest {
    @Autowired
    private SessionTracker tracker;

    @Test
    void unknownLearnerHasNoSession() {
        assertTrue(tracker.get("session-none").isEmpty());
    }

    @Test
    void settingCurrentExerciseCreatesInactiveSession() {
        tracker.setCurrentExercise("session-new", 3);

        Session session = tracker.get("session-new").orElseThrow();
        assertEquals(3, session.currentExerciseId());
        assertFalse(session.practiceActive());
        assertNotNull(session.lastActivity());
    }

    @Test
    void activationKeepsCurrentExerciseAndViceVersa() {
        tracker.setCurrentExercise("session-toggle", 2);
        tracker.activate("session-toggle");
        assertEquals(2, tracker.get("session-toggle").orElseThrow().currentExerciseId());

        tracker.setCurrentExercise("session-toggle", 4);
        assertTrue(tracker.get("session-toggle").orElseThrow().practiceActive());

        tracker.deactivate("session-toggle");
        Session session = tracker.get("session-toggle").orElseThrow();
        assertFalse(session.practiceActive());
        assertEquals(4, session.currentExerciseId());
    }

    @Test
    void resetReturnsToIdle() {
        tracker.activate("session-reset");
        tracker.setCurrentExercise("session-reset", 5);

        tracker.reset("session-reset");

        Session session = tracker.get("session-reset").orElseThrow();
        assertFalse(session.practiceActive());
        assertNull(session.currentExerciseId());
    }
}
