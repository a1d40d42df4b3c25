package com.duckide.practice.practice;

import com.duckide.practice.domain.DomainModels.Exercise;
import com.duckide.practice.progress.ProgressModels;
import com.duckide.practice.verification.Verdict;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public class PracticeModels {
    public record ExerciseView(int id,
                               String prompt,
                               String difficulty,
                               String category,
                               String rowOrder,
                               List<String> setupStatements) {
        public static ExerciseView of(Exercise exercise) {
            return new ExerciseView(exercise.id(), exercise.prompt(),
                    exercise.difficulty().name().toLowerCase(Locale.ROOT), exercise.category(),
                    exercise.rowOrder().name().toLowerCase(Locale.ROOT), exercise.setupStatements());
        }
    }

    public record SolutionView(int exerciseId, String solutionQuery, List<String> explanationSteps) {}

    /** Either the exercise to move to, or {@code allComplete} when the set is exhausted. */
    public record NextExerciseResponse(ExerciseView exercise, boolean allComplete) {
        public static NextExerciseResponse of(Exercise exercise) {
            return new NextExerciseResponse(ExerciseView.of(exercise), false);
        }

        public static NextExerciseResponse finished() {
            return new NextExerciseResponse(null, true);
        }
    }

    public record ExerciseOverview(List<ExerciseView> exercises,
                                   Map<Integer, ProgressModels.ExerciseProgress> progressByExerciseId) {}

    public record SubmissionResult(long attemptId,
                                   int sequenceNumber,
                                   Verdict verdict,
                                   int attemptsCountForPair,
                                   String solutionQuery,
                                   List<String> explanationSteps,
                                   boolean firstSuccessForPair) {}
}
