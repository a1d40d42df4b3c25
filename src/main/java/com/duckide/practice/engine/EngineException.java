package com.duckide.practice.engine;

/**
 * The engine rejected a statement or query. The message is the engine's own, fit for display.
 */
public class EngineException extends RuntimeException {
    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
