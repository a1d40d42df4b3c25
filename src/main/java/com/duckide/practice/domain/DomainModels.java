package com.duckide.practice.domain;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

public class DomainModels {
    public record Exercise(int id,
                           String prompt,
                           List<String> setupStatements,
                           String solutionQuery,
                           List<String> explanationSteps,
                           Difficulty difficulty,
                           String category,
                           RowOrder rowOrder) {
        public Exercise {
            setupStatements = List.copyOf(setupStatements);
            explanationSteps = List.copyOf(explanationSteps);
        }
    }

    public record Attempt(long id,
                          String learnerId,
                          int exerciseId,
                          String submittedQuery,
                          boolean correct,
                          String queryError,
                          int sequenceNumber,
                          Instant submittedAt,
                          Integer elapsedSeconds) {}

    public record Session(String learnerId, Integer currentExerciseId, boolean practiceActive, Instant lastActivity) {
        public static Session idle(String learnerId) {
            return new Session(learnerId, null, false, null);
        }
    }

    public enum Difficulty {
        BEGINNER, INTERMEDIATE, ADVANCED;

        public static Difficulty parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * How result rows are matched against the solution. {@code STRICT} compares row i with row i;
     * {@code ANY} compares the two results as multisets of rows.
     */
    public enum RowOrder {
        STRICT, ANY;

        public static RowOrder parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
