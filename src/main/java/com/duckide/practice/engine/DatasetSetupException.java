package com.duckide.practice.engine;

/**
 * An exercise's setup statements could not be applied. Points at the exercise content, not the learner.
 */
public class DatasetSetupException extends RuntimeException {
    private final int exerciseId;
    private final int statementIndex;

    public DatasetSetupException(int exerciseId, int statementIndex, Throwable cause) {
        super("Setup statement " + (statementIndex + 1) + " of exercise " + exerciseId + " failed: " + cause.getMessage(), cause);
        this.exerciseId = exerciseId;
        this.statementIndex = statementIndex;
    }

    public int exerciseId() {
        return exerciseId;
    }

    public int statementIndex() {
        return statementIndex;
    }
}
