package com.duckide.practice.session;

import com.duckide.practice.domain.DomainModels.Session;
import com.duckide.practice.repository.SessionJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-learner practice pointer: which exercise is current and whether practice mode is on.
 * Every write is an upsert; concurrent writers for one learner resolve as last writer wins.
 */
@Service
public class SessionTracker {
    private static final Logger logger = LoggerFactory.getLogger(SessionTracker.class);

    private final SessionJdbcRepository repository;

    public SessionTracker(SessionJdbcRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public Session activate(String learnerId) {
        Session current = repository.find(learnerId).orElse(Session.idle(learnerId));
        return save(new Session(learnerId, current.currentExerciseId(), true, Instant.now()));
    }

    @Transactional
    public Session deactivate(String learnerId) {
        Session current = repository.find(learnerId).orElse(Session.idle(learnerId));
        return save(new Session(learnerId, current.currentExerciseId(), false, Instant.now()));
    }

    @Transactional
    public Session setCurrentExercise(String learnerId, int exerciseId) {
        Session current = repository.find(learnerId).orElse(Session.idle(learnerId));
        return save(new Session(learnerId, exerciseId, current.practiceActive(), Instant.now()));
    }

    /** Back to the idle state: inactive and no current exercise. */
    @Transactional
    public Session reset(String learnerId) {
        return save(new Session(learnerId, null, false, Instant.now()));
    }

    public Optional<Session> get(String learnerId) {
        return repository.find(learnerId);
    }

    private Session save(Session session) {
        repository.upsert(session);
        logger.debug("Session {} -> exercise={}, active={}", session.learnerId(), session.currentExerciseId(), session.practiceActive());
        return session;
    }
}
