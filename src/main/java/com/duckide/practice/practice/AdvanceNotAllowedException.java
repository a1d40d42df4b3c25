package com.duckide.practice.practice;

public class AdvanceNotAllowedException extends RuntimeException {
    private final int exerciseId;

    public AdvanceNotAllowedException(int exerciseId) {
        super("Exercise " + exerciseId + " has no correct attempt yet");
        this.exerciseId = exerciseId;
    }

    public int exerciseId() {
        return exerciseId;
    }
}
