package com.duckide.practice.progress;

import com.duckide.practice.catalog.ExerciseCatalog;
import com.duckide.practice.config.PracticeProperties;
import com.duckide.practice.domain.DomainModels.Attempt;
import com.duckide.practice.domain.DomainModels.Exercise;
import com.duckide.practice.ledger.AttemptLedger;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-side statistics over one learner's attempts, recomputed on every request.
 */
@Service
public class ProgressAggregator {
    private final AttemptLedger ledger;
    private final ExerciseCatalog catalog;
    private final int recentLimit;

    public ProgressAggregator(AttemptLedger ledger, ExerciseCatalog catalog, PracticeProperties properties) {
        this.ledger = ledger;
        this.catalog = catalog;
        this.recentLimit = properties.progress().recentLimit();
    }

    public ProgressModels.ProgressSnapshot snapshot(String learnerId) {
        List<Attempt> attempts = ledger.history(learnerId);

        int total = attempts.size();
        int correct = (int) attempts.stream().filter(Attempt::correct).count();
        int distinct = (int) attempts.stream().map(Attempt::exerciseId).distinct().count();
        double successRate = total == 0 ? 0.0 : (double) correct / total;
        double avgElapsed = attempts.stream()
                .map(Attempt::elapsedSeconds)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0.0);
        List<Integer> completed = attempts.stream()
                .filter(Attempt::correct)
                .map(Attempt::exerciseId)
                .distinct()
                .sorted()
                .toList();
        Instant lastAttemptAt = attempts.stream().map(Attempt::submittedAt).max(Comparator.naturalOrder()).orElse(null);

        List<ProgressModels.RecentAttempt> recent = attempts.stream()
                .limit(Math.max(0, recentLimit))
                .map(this::decorate)
                .toList();

        return new ProgressModels.ProgressSnapshot(learnerId, total, distinct, correct, successRate, avgElapsed,
                completed, lastAttemptAt, catalog.count(), recent);
    }

    public Map<Integer, ProgressModels.ExerciseProgress> exerciseProgress(String learnerId) {
        Map<Integer, List<Attempt>> byExercise = ledger.history(learnerId).stream()
                .collect(Collectors.groupingBy(Attempt::exerciseId));

        Map<Integer, ProgressModels.ExerciseProgress> out = new LinkedHashMap<>();
        for (Exercise exercise : catalog.all()) {
            List<Attempt> attempts = byExercise.getOrDefault(exercise.id(), List.of());
            out.put(exercise.id(), new ProgressModels.ExerciseProgress(
                    attempts.size(),
                    attempts.stream().anyMatch(Attempt::correct),
                    attempts.stream().map(Attempt::submittedAt).max(Comparator.naturalOrder()).orElse(null)));
        }
        return out;
    }

    private ProgressModels.RecentAttempt decorate(Attempt a) {
        Optional<Exercise> exercise = catalog.byId(a.exerciseId());
        return new ProgressModels.RecentAttempt(a.id(), a.exerciseId(), a.correct(), a.sequenceNumber(), a.submittedAt(),
                a.elapsedSeconds(),
                exercise.map(Exercise::prompt).orElse(null),
                exercise.map(e -> e.difficulty().name().toLowerCase(Locale.ROOT)).orElse(null),
                exercise.map(Exercise::category).orElse(null));
    }
}
