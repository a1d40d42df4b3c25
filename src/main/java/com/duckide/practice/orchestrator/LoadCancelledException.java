package com.duckide.practice.orchestrator;

public class LoadCancelledException extends RuntimeException {
    private final int exerciseId;

    public LoadCancelledException(int exerciseId) {
        super("Loading exercise " + exerciseId + " was cancelled");
        this.exerciseId = exerciseId;
    }

    public LoadCancelledException(int exerciseId, Throwable cause) {
        super("Loading exercise " + exerciseId + " was cancelled", cause);
        this.exerciseId = exerciseId;
    }

    public int exerciseId() {
        return exerciseId;
    }
}
