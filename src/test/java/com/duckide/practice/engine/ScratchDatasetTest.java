package com.duckide.practice.engine;

import com.duckide.practice.domain.DomainModels.Difficulty;
import com.duckide.practice.domain.DomainModels.Exercise;
import com.duckide.practice.domain.DomainModels.RowOrder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ScratchDatasetTest {
    private final DuckDbEngine engine = new DuckDbEngine("jdbc:duckdb:");

    @Test
    void materializesSetupStatementsInOrder() {
        try (ScratchDataset dataset = ScratchDataset.materialize(engine, exercise(
                "CREATE TABLE notes (body VARCHAR)",
                "INSERT INTO notes VALUES ('a;b'), ('c')"))) {
            RowSet rows = dataset.query("SELECT body FROM notes ORDER BY body");

            assertEquals(2, rows.size());
            assertEquals("a;b", rows.rows().get(0).valueAt(0).stringValue());
            assertEquals(List.of("body"), rows.columns());
        }
    }

    @Test
    void datasetsAreIsolatedFromEachOther() {
        try (ScratchDataset first = ScratchDataset.materialize(engine, exercise("CREATE TABLE t (a INTEGER)", "INSERT INTO t VALUES (1)"));
             ScratchDataset second = ScratchDataset.materialize(engine, exercise("CREATE TABLE t (a INTEGER)"))) {
            assertEquals(1, first.query("SELECT * FROM t").size());
            assertEquals(0, second.query("SELECT * FROM t").size());
        }
    }

    @Test
    void changesMadeByQueriesAreRolledBack() {
        try (ScratchDataset dataset = ScratchDataset.materialize(engine, exercise(
                "CREATE TABLE t (a INTEGER)", "INSERT INTO t VALUES (1), (2)"))) {
            RowSet deleted = dataset.query("DELETE FROM t");
            dataset.query("INSERT INTO t VALUES (3)");
            dataset.query("DROP TABLE t");

            assertFalse(deleted.hasResultSet());
            RowSet rows = dataset.query("SELECT a FROM t ORDER BY a");
            assertTrue(rows.hasResultSet());
            assertEquals(2, rows.size());
            assertEquals("2", rows.rows().get(1).valueAt(0).stringValue());
        }
    }

    @Test
    void emptyQueryResultStillHasColumns() {
        try (ScratchDataset dataset = ScratchDataset.materialize(engine, exercise("CREATE TABLE t (a INTEGER)"))) {
            RowSet rows = dataset.query("SELECT a FROM t");

            assertTrue(rows.hasResultSet());
            assertEquals(0, rows.size());
        }
    }

    @Test
    void failedSetupClosesConnectionAndReportsStatement() {
        AtomicBoolean closed = new AtomicBoolean();
        SqlEngine failing = () -> new EngineConnection() {
            @Override
            public void execute(String statement) {
                if (statement.startsWith("INSERT")) {
                    throw new EngineException("table t does not exist", null);
                }
            }

            @Override
            public RowSet query(String sql) {
                return RowSet.noResultSet();
            }

            @Override
            public RowSet queryAndRollBack(String sql) {
                return RowSet.noResultSet();
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };

        DatasetSetupException e = assertThrows(DatasetSetupException.class,
                () -> ScratchDataset.materialize(failing, exercise("CREATE TABLE x (a INT)", "INSERT INTO t VALUES (1)")));

        assertEquals(1, e.statementIndex());
        assertEquals(9, e.exerciseId());
        assertTrue(closed.get());
    }

    @Test
    void closeIsIdempotentAndBlocksFurtherQueries() {
        ScratchDataset dataset = ScratchDataset.materialize(engine, exercise("CREATE TABLE t (a INTEGER)"));
        dataset.close();
        dataset.close();

        assertTrue(dataset.isClosed());
        assertThrows(IllegalStateException.class, () -> dataset.query("SELECT 1"));
    }

    @Test
    void engineErrorsCarryTheEngineMessage() {
        try (ScratchDataset dataset = ScratchDataset.materialize(engine, exercise("CREATE TABLE t (a INTEGER)"))) {
            EngineException e = assertThrows(EngineException.class, () -> dataset.query("SELECT * FROM missing_table"));
            assertTrue(e.getMessage().contains("missing_table"));
        }
    }

    private static Exercise exercise(String... statements) {
        return new Exercise(9, "prompt", List.of(statements), "SELECT 1", List.of(),
                Difficulty.BEGINNER, "test", RowOrder.STRICT);
    }
}
