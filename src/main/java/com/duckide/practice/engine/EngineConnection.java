package com.duckide.practice.engine;

public interface EngineConnection extends AutoCloseable {
    void execute(String statement);

    RowSet query(String sql);

    /**
     * Runs {@code sql} in its own transaction and rolls it back, so the data looks the same
     * afterwards whatever the statement did.
     */
    RowSet queryAndRollBack(String sql);

    @Override
    void close();
}
