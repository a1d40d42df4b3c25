package com.duckide.practice.ledger;

import com.duckide.practice.config.PracticeProperties;
import com.duckide.practice.domain.DomainModels.Attempt;
import com.duckide.practice.repository.AttemptJdbcRepository;
import com.duckide.practice.verification.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only record of submissions. Sequence numbers per (learner, exercise) run 1..n without gaps:
 * writers for one pair are serialized by a striped lock inside this process, and the unique
 * constraint behind {@link AttemptJdbcRepository#insertNext} catches writers from other processes.
 */
@Service
public class AttemptLedger {
    private static final Logger logger = LoggerFactory.getLogger(AttemptLedger.class);
    private static final int STRIPES = 64;

    private final AttemptJdbcRepository repository;
    private final PracticeProperties.Ledger policy;
    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    public AttemptLedger(AttemptJdbcRepository repository, PracticeProperties properties) {
        this.repository = repository;
        this.policy = properties.ledger();
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public Attempt record(String learnerId, int exerciseId, String query, Verdict verdict, Integer elapsedSeconds) {
        ReentrantLock lock = stripes[Math.floorMod(Objects.hash(learnerId, exerciseId), STRIPES)];
        lock.lock();
        try {
            return insertWithRetry(learnerId, exerciseId, query, verdict, elapsedSeconds);
        } finally {
            lock.unlock();
        }
    }

    private Attempt insertWithRetry(String learnerId, int exerciseId, String query, Verdict verdict, Integer elapsedSeconds) {
        int maxAttempts = Math.max(1, policy.maxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return repository.insertNext(learnerId, exerciseId, query, verdict.correct(), verdict.queryError(),
                        elapsedSeconds, Instant.now());
            } catch (DuplicateKeyException | ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    logger.warn("Sequencing conflict for learner {} on exercise {} not resolved after {} tries",
                            learnerId, exerciseId, attempt);
                    throw new SequencingConflictException(learnerId, exerciseId, attempt, e);
                }
                logger.debug("Sequencing conflict for learner {} on exercise {}, retry {}", learnerId, exerciseId, attempt);
                pause(computeBackoffMs(attempt), learnerId, exerciseId, attempt, e);
            }
        }
    }

    public List<Attempt> attemptsFor(String learnerId, int exerciseId) {
        return repository.findFor(learnerId, exerciseId);
    }

    public int countFor(String learnerId, int exerciseId) {
        return repository.countFor(learnerId, exerciseId);
    }

    public boolean hasCorrectAttempt(String learnerId, int exerciseId) {
        return repository.existsCorrect(learnerId, exerciseId);
    }

    public List<Attempt> recentAttempts(String learnerId, int limit) {
        if (limit <= 0) return List.of();
        return repository.findRecent(learnerId, limit);
    }

    /** Every attempt of the learner, most recent first. */
    public List<Attempt> history(String learnerId) {
        return repository.findByLearner(learnerId);
    }

    private void pause(long millis, String learnerId, int exerciseId, int attempt, RuntimeException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SequencingConflictException(learnerId, exerciseId, attempt, cause);
        }
    }

    private long computeBackoffMs(int attempt) {
        long max = Math.max(1L, policy.maxBackoffMs());
        long backoff = Math.max(1L, policy.baseBackoffMs());
        for (int i = 1; i < attempt; i++) {
            if (backoff >= max / 2L) {
                backoff = max;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, max);
        long jitter = ThreadLocalRandom.current().nextLong(0L, backoff + 1L);
        return Math.min(max, backoff / 2L + jitter);
    }
}
