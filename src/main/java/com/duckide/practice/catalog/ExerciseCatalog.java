package com.duckide.practice.catalog;

import com.duckide.practice.domain.DomainModels.Exercise;

import java.util.*;

/**
 * Immutable, id-ordered set of exercises. Loaded once, read concurrently.
 */
public final class ExerciseCatalog {
    private final NavigableMap<Integer, Exercise> byId;

    private ExerciseCatalog(NavigableMap<Integer, Exercise> byId) {
        this.byId = Collections.unmodifiableNavigableMap(byId);
    }

    public static ExerciseCatalog of(Collection<Exercise> exercises) {
        NavigableMap<Integer, Exercise> map = new TreeMap<>();
        for (Exercise exercise : exercises) {
            if (map.putIfAbsent(exercise.id(), exercise) != null) {
                throw new IllegalArgumentException("Duplicate exercise id: " + exercise.id());
            }
        }
        return new ExerciseCatalog(map);
    }

    public Optional<Exercise> first() {
        return byId.isEmpty() ? Optional.empty() : Optional.of(byId.firstEntry().getValue());
    }

    public Optional<Exercise> byId(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * The exercise with the smallest id strictly greater than {@code id}. Empty means the learner
     * has exhausted the set.
     */
    public Optional<Exercise> after(int id) {
        Map.Entry<Integer, Exercise> next = byId.higherEntry(id);
        return next == null ? Optional.empty() : Optional.of(next.getValue());
    }

    public int count() {
        return byId.size();
    }

    public List<Exercise> all() {
        return List.copyOf(byId.values());
    }

    public Exercise require(int id) {
        return byId(id).orElseThrow(() -> new ExerciseNotFoundException(id));
    }

    public Exercise requireFirst() {
        return first().orElseThrow(() -> new ExerciseNotFoundException("No exercises available"));
    }
}
