package com.duckide.practice.orchestrator;

import com.duckide.practice.catalog.ExerciseCatalog;
import com.duckide.practice.domain.DomainModels.Exercise;
import com.duckide.practice.engine.RowSet;
import com.duckide.practice.engine.ScratchDataset;
import com.duckide.practice.engine.SqlEngine;
import com.duckide.practice.practice.PracticeModels;
import com.duckide.practice.practice.PracticeService;
import com.duckide.practice.session.SessionTracker;
import com.duckide.practice.verification.Verdict;
import com.duckide.practice.verification.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Drives one learner through the exercises while owning the dataset of the exercise on screen.
 * <p>
 * State lives behind a single monitor. Engine work (materializing, querying, grading) runs outside
 * it; a load generation counter lets {@link #exit()} cancel a load that is still running, and the
 * late dataset is disposed as soon as its setup returns.
 */
public class PracticeOrchestrator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PracticeOrchestrator.class);

    private static final EnumSet<PracticeState> WORKING = EnumSet.of(PracticeState.READY, PracticeState.SUBMITTED);

    private final String learnerId;
    private final ExerciseCatalog catalog;
    private final SqlEngine engine;
    private final Verifier verifier;
    private final SessionTracker sessions;
    private final PracticeService practice;
    private final LongSupplier nanoTicker;

    private final Object lock = new Object();
    private PracticeState state = PracticeState.NOT_STARTED;
    private long generation;
    private Exercise exercise;
    private ScratchDataset dataset;
    private Verdict lastVerdict;
    private long readyAtNanos;
    private volatile long lastUsedNanos;

    public PracticeOrchestrator(String learnerId,
                                ExerciseCatalog catalog,
                                SqlEngine engine,
                                Verifier verifier,
                                SessionTracker sessions,
                                PracticeService practice,
                                LongSupplier nanoTicker) {
        this.learnerId = learnerId;
        this.catalog = catalog;
        this.engine = engine;
        this.verifier = verifier;
        this.sessions = sessions;
        this.practice = practice;
        this.nanoTicker = nanoTicker;
        this.lastUsedNanos = nanoTicker.getAsLong();
    }

    public Exercise start() {
        touch();
        long loadGeneration;
        synchronized (lock) {
            if (state != PracticeState.NOT_STARTED) {
                throw new ContractViolationException("start", state);
            }
            state = PracticeState.LOADING;
            loadGeneration = ++generation;
        }

        Exercise target;
        try {
            target = practice.resumeExercise(learnerId);
        } catch (RuntimeException e) {
            abandonLoad(loadGeneration);
            throw e;
        }
        return load(loadGeneration, target);
    }

    /** Free exploration against the current dataset; failures surface as engine exceptions. */
    public RowSet runQuery(String sql) {
        touch();
        ScratchDataset current;
        synchronized (lock) {
            requireWorking("runQuery");
            current = dataset;
        }
        try {
            return current.query(sql);
        } catch (IllegalStateException e) {
            throw new ContractViolationException("runQuery", state(), "the dataset was disposed");
        }
    }

    public PracticeModels.SubmissionResult submit(String candidateQuery) {
        touch();
        ScratchDataset current;
        Exercise target;
        int elapsed;
        synchronized (lock) {
            requireWorking("submit");
            current = dataset;
            target = exercise;
            elapsed = elapsedSecondsLocked();
        }

        Verdict verdict;
        try {
            verdict = verifier.verify(current, candidateQuery, target);
        } catch (IllegalStateException e) {
            throw new ContractViolationException("submit", state(), "the dataset was disposed");
        }
        PracticeModels.SubmissionResult result = practice.recordSubmission(learnerId, target, candidateQuery, verdict, elapsed);

        synchronized (lock) {
            if (dataset == current && WORKING.contains(state)) {
                state = PracticeState.SUBMITTED;
                lastVerdict = verdict;
            }
        }
        return result;
    }

    /**
     * Advances after a correct verdict. Empty means every exercise is done and the session has
     * been deactivated.
     */
    public Optional<Exercise> next() {
        touch();
        long loadGeneration;
        Optional<Exercise> following;
        synchronized (lock) {
            if (state != PracticeState.SUBMITTED) {
                throw new ContractViolationException("next", state);
            }
            if (lastVerdict == null || !lastVerdict.correct()) {
                throw new ContractViolationException("next", state, "the last verdict is not correct");
            }
            following = catalog.after(exercise.id());
            disposeLocked();
            if (following.isEmpty()) {
                state = PracticeState.ALL_COMPLETE;
                loadGeneration = -1;
            } else {
                state = PracticeState.LOADING;
                loadGeneration = ++generation;
            }
        }

        if (following.isEmpty()) {
            sessions.deactivate(learnerId);
            logger.info("Learner {} completed every exercise", learnerId);
            return Optional.empty();
        }

        Exercise target = following.get();
        try {
            sessions.setCurrentExercise(learnerId, target.id());
        } catch (RuntimeException e) {
            abandonLoad(loadGeneration);
            throw e;
        }
        return Optional.of(load(loadGeneration, target));
    }

    /** Leaves practice from any state. A load in flight is cancelled. */
    public void exit() {
        touch();
        synchronized (lock) {
            generation++;
            disposeLocked();
            state = PracticeState.NOT_STARTED;
        }
        sessions.deactivate(learnerId);
        logger.debug("Learner {} left practice", learnerId);
    }

    /** Releases the dataset without touching the session; used when the workspace is discarded. */
    @Override
    public void close() {
        synchronized (lock) {
            generation++;
            disposeLocked();
            state = PracticeState.NOT_STARTED;
        }
    }

    public long elapsedSeconds() {
        synchronized (lock) {
            return WORKING.contains(state) ? elapsedSecondsLocked() : 0;
        }
    }

    public PracticeState state() {
        synchronized (lock) {
            return state;
        }
    }

    public Optional<Exercise> exercise() {
        synchronized (lock) {
            return Optional.ofNullable(exercise);
        }
    }

    public Optional<Verdict> lastVerdict() {
        synchronized (lock) {
            return Optional.ofNullable(lastVerdict);
        }
    }

    public WorkspaceState snapshot() {
        touch();
        synchronized (lock) {
            return new WorkspaceState(learnerId, state, exercise == null ? null : exercise.id(), lastVerdict,
                    WORKING.contains(state) ? elapsedSecondsLocked() : 0);
        }
    }

    public String learnerId() {
        return learnerId;
    }

    /** Time since the last operation on this orchestrator. */
    public Duration idleTime() {
        return Duration.ofNanos(Math.max(0L, nanoTicker.getAsLong() - lastUsedNanos));
    }

    private Exercise load(long loadGeneration, Exercise target) {
        ScratchDataset loaded;
        try {
            loaded = ScratchDataset.materialize(engine, target);
        } catch (RuntimeException e) {
            if (!abandonLoad(loadGeneration)) {
                throw new LoadCancelledException(target.id(), e);
            }
            throw e;
        }

        synchronized (lock) {
            if (generation == loadGeneration && state == PracticeState.LOADING) {
                exercise = target;
                dataset = loaded;
                lastVerdict = null;
                readyAtNanos = nanoTicker.getAsLong();
                state = PracticeState.READY;
                return target;
            }
        }
        loaded.close();
        logger.info("Load of exercise {} for learner {} cancelled", target.id(), learnerId);
        throw new LoadCancelledException(target.id());
    }

    /** Returns false when the load had already been cancelled. */
    private boolean abandonLoad(long loadGeneration) {
        synchronized (lock) {
            if (generation != loadGeneration || state != PracticeState.LOADING) {
                return false;
            }
            exercise = null;
            lastVerdict = null;
            state = PracticeState.NOT_STARTED;
            return true;
        }
    }

    private void touch() {
        lastUsedNanos = nanoTicker.getAsLong();
    }

    private void requireWorking(String operation) {
        if (!WORKING.contains(state) || dataset == null) {
            throw new ContractViolationException(operation, state);
        }
    }

    private int elapsedSecondsLocked() {
        return (int) TimeUnit.NANOSECONDS.toSeconds(Math.max(0L, nanoTicker.getAsLong() - readyAtNanos));
    }

    private void disposeLocked() {
        if (dataset != null) {
            dataset.close();
            dataset = null;
        }
        lastVerdict = null;
    }
}
