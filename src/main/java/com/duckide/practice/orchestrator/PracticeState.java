package com.duckide.practice.orchestrator;

public enum PracticeState {
    NOT_STARTED,
    LOADING,
    READY,
    SUBMITTED,
    ALL_COMPLETE
}
