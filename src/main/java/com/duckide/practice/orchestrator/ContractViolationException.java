package com.duckide.practice.orchestrator;

/**
 * An orchestrator operation was called in a state that does not allow it.
 */
public class ContractViolationException extends RuntimeException {
    private final String operation;
    private final PracticeState state;

    public ContractViolationException(String operation, PracticeState state) {
        super("Operation '" + operation + "' is not allowed in state " + state);
        this.operation = operation;
        this.state = state;
    }

    public ContractViolationException(String operation, PracticeState state, String reason) {
        super("Operation '" + operation + "' is not allowed in state " + state + ": " + reason);
        this.operation = operation;
        this.state = state;
    }

    public String operation() {
        return operation;
    }

    public PracticeState state() {
        return state;
    }
}
