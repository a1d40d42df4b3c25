package com.duckide.practice.practice;

import com.duckide.practice.catalog.ExerciseCatalog;
import com.duckide.practice.domain.DomainModels.Attempt;
import com.duckide.practice.domain.DomainModels.Exercise;
import com.duckide.practice.domain.DomainModels.Session;
import com.duckide.practice.engine.ScratchDataset;
import com.duckide.practice.engine.SqlEngine;
import com.duckide.practice.ledger.AttemptLedger;
import com.duckide.practice.progress.ProgressAggregator;
import com.duckide.practice.progress.ProgressModels;
import com.duckide.practice.session.SessionTracker;
import com.duckide.practice.verification.Verdict;
import com.duckide.practice.verification.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Request-scoped practice operations. Nothing is held between calls: every submission is graded
 * on a dataset built for that submission alone.
 */
@Service
public class PracticeService {
    private static final Logger logger = LoggerFactory.getLogger(PracticeService.class);

    private final ExerciseCatalog catalog;
    private final SqlEngine engine;
    private final Verifier verifier;
    private final AttemptLedger ledger;
    private final SessionTracker sessions;
    private final ProgressAggregator progress;

    public PracticeService(ExerciseCatalog catalog,
                           SqlEngine engine,
                           Verifier verifier,
                           AttemptLedger ledger,
                           SessionTracker sessions,
                           ProgressAggregator progress) {
        this.catalog = catalog;
        this.engine = engine;
        this.verifier = verifier;
        this.ledger = ledger;
        this.sessions = sessions;
        this.progress = progress;
    }

    /**
     * Activates practice and returns the exercise the learner stopped at, or the first one.
     * The returned exercise is recorded as current.
     */
    public PracticeModels.ExerciseView currentOrFirstExercise(String learnerId) {
        return PracticeModels.ExerciseView.of(resumeExercise(learnerId));
    }

    public Exercise resumeExercise(String learnerId) {
        Session session = sessions.activate(learnerId);
        Exercise exercise = Optional.ofNullable(session.currentExerciseId())
                .flatMap(catalog::byId)
                .orElseGet(catalog::requireFirst);
        sessions.setCurrentExercise(learnerId, exercise.id());
        return exercise;
    }

    /**
     * Moves past the current exercise. Allowed only once it has a correct attempt; a learner
     * without a current exercise gets the one {@link #currentOrFirstExercise} would return.
     */
    public PracticeModels.NextExerciseResponse nextExercise(String learnerId) {
        Integer currentId = sessions.get(learnerId).map(Session::currentExerciseId).orElse(null);
        if (currentId == null) {
            return PracticeModels.NextExerciseResponse.of(resumeExercise(learnerId));
        }
        if (!ledger.hasCorrectAttempt(learnerId, currentId)) {
            throw new AdvanceNotAllowedException(currentId);
        }

        Optional<Exercise> next = catalog.after(currentId);
        if (next.isEmpty()) {
            sessions.deactivate(learnerId);
            logger.info("Learner {} completed all {} exercise(s)", learnerId, catalog.count());
            return PracticeModels.NextExerciseResponse.finished();
        }
        sessions.setCurrentExercise(learnerId, next.get().id());
        return PracticeModels.NextExerciseResponse.of(next.get());
    }

    public PracticeModels.ExerciseView exercise(int exerciseId) {
        return PracticeModels.ExerciseView.of(catalog.require(exerciseId));
    }

    public PracticeModels.SolutionView solution(int exerciseId) {
        Exercise exercise = catalog.require(exerciseId);
        return new PracticeModels.SolutionView(exercise.id(), exercise.solutionQuery(), exercise.explanationSteps());
    }

    public PracticeModels.ExerciseOverview allExercises(String learnerId) {
        return new PracticeModels.ExerciseOverview(
                catalog.all().stream().map(PracticeModels.ExerciseView::of).toList(),
                progress.exerciseProgress(learnerId));
    }

    public PracticeModels.SubmissionResult submitAttempt(String learnerId, int exerciseId, String query, Integer elapsedSeconds) {
        Exercise exercise = catalog.require(exerciseId);
        Verdict verdict;
        try (ScratchDataset dataset = ScratchDataset.materialize(engine, exercise)) {
            verdict = verifier.verify(dataset, query, exercise);
        }
        return recordSubmission(learnerId, exercise, query, verdict, elapsedSeconds);
    }

    /**
     * Appends an already graded submission to the ledger. {@code firstSuccessForPair} is decided
     * against the ledger as it was before this attempt.
     */
    public PracticeModels.SubmissionResult recordSubmission(String learnerId, Exercise exercise, String query,
                                                            Verdict verdict, Integer elapsedSeconds) {
        boolean solvedBefore = ledger.hasCorrectAttempt(learnerId, exercise.id());
        Attempt attempt = ledger.record(learnerId, exercise.id(), query, verdict, elapsedSeconds);
        logger.debug("Attempt #{} by {} on exercise {}: correct={}", attempt.sequenceNumber(), learnerId,
                exercise.id(), verdict.correct());
        return new PracticeModels.SubmissionResult(
                attempt.id(),
                attempt.sequenceNumber(),
                verdict,
                attempt.sequenceNumber(),
                exercise.solutionQuery(),
                exercise.explanationSteps(),
                verdict.correct() && !solvedBefore);
    }

    public Session session(String learnerId) {
        return sessions.get(learnerId).orElse(Session.idle(learnerId));
    }

    public Session activate(String learnerId) {
        return sessions.activate(learnerId);
    }

    public Session deactivate(String learnerId) {
        return sessions.deactivate(learnerId);
    }

    /** Forgets where the learner was; attempts are kept, so progress is unchanged. */
    public Session resetSession(String learnerId) {
        logger.info("Resetting session of learner {}", learnerId);
        return sessions.reset(learnerId);
    }

    public ProgressModels.ProgressSnapshot progress(String learnerId) {
        return progress.snapshot(learnerId);
    }
}
