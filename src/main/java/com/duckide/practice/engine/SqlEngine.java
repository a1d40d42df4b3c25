package com.duckide.practice.engine;

public interface SqlEngine {
    /**
     * Opens a connection to a fresh, isolated database. The caller owns it and must close it.
     */
    EngineConnection openConnection();
}
