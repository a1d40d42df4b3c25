package com.duckide.practice.verification;

/**
 * The canonical solution of an exercise failed to run. The exercise content is broken; the learner's
 * submission must not be graded against it.
 */
public class SolutionExecutionException extends RuntimeException {
    private final int exerciseId;

    public SolutionExecutionException(int exerciseId, Throwable cause) {
        super("Solution of exercise " + exerciseId + " failed to execute: " + cause.getMessage(), cause);
        this.exerciseId = exerciseId;
    }

    public int exerciseId() {
        return exerciseId;
    }
}
