package com.duckide.practice.engine;

import com.duckide.practice.domain.DomainModels.Exercise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The data of one exercise, materialized on a connection nobody else uses. Closing it drops the data.
 */
public final class ScratchDataset implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ScratchDataset.class);

    private final int exerciseId;
    private final EngineConnection connection;
    private boolean closed;

    private ScratchDataset(int exerciseId, EngineConnection connection) {
        this.exerciseId = exerciseId;
        this.connection = connection;
    }

    /**
     * Runs every setup statement in order. On the first failure the connection is closed and
     * nothing of the partial dataset survives.
     */
    public static ScratchDataset materialize(SqlEngine engine, Exercise exercise) {
        EngineConnection connection;
        try {
            connection = engine.openConnection();
        } catch (EngineException e) {
            throw new DatasetSetupException(exercise.id(), 0, e);
        }

        List<String> statements = exercise.setupStatements();
        for (int i = 0; i < statements.size(); i++) {
            try {
                connection.execute(statements.get(i));
            } catch (RuntimeException e) {
                connection.close();
                throw new DatasetSetupException(exercise.id(), i, e);
            }
        }
        logger.debug("Materialized dataset for exercise {} ({} statement(s))", exercise.id(), statements.size());
        return new ScratchDataset(exercise.id(), connection);
    }

    public int exerciseId() {
        return exerciseId;
    }

    /**
     * Runs a query against the dataset. Whatever the statement changes is rolled back, so the data
     * stays as setup left it for every later query.
     */
    public synchronized RowSet query(String sql) {
        if (closed) {
            throw new IllegalStateException("Dataset for exercise " + exerciseId + " is closed");
        }
        return connection.queryAndRollBack(sql);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        connection.close();
        logger.debug("Disposed dataset for exercise {}", exerciseId);
    }
}
