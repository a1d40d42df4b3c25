package com.duckide.practice.ledger;

public class SequencingConflictException extends RuntimeException {
    public SequencingConflictException(String learnerId, int exerciseId, int attempts, Throwable cause) {
        super("Could not assign an attempt sequence number for learner " + learnerId + " on exercise " + exerciseId
                + " after " + attempts + " tries", cause);
    }
}
