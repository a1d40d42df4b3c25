package com.duckide.practice.catalog;

public class ExerciseNotFoundException extends RuntimeException {
    public ExerciseNotFoundException(int exerciseId) {
        super("Exercise not found: " + exerciseId);
    }

    public ExerciseNotFoundException(String message) {
        super(message);
    }
}
