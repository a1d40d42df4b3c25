package com.duckide.practice.progress;

import java.time.Instant;
import java.util.List;

public class ProgressModels {
    public record ProgressSnapshot(String learnerId,
                                   int totalAttempts,
                                   int distinctExercisesAttempted,
                                   int correctAttempts,
                                   double successRate,
                                   double averageElapsedSeconds,
                                   List<Integer> completedExerciseIds,
                                   Instant lastAttemptAt,
                                   int totalExercises,
                                   List<RecentAttempt> recentAttempts) {}

    public record RecentAttempt(long attemptId,
                                int exerciseId,
                                boolean correct,
                                int sequenceNumber,
                                Instant submittedAt,
                                Integer elapsedSeconds,
                                String prompt,
                                String difficulty,
                                String category) {}

    public record ExerciseProgress(int attempts, boolean completed, Instant lastAttemptAt) {}
}
