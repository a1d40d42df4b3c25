package com.duckide.practice.engine;

import com.duckide.practice.config.PracticeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Embedded DuckDB. With the default {@code jdbc:duckdb:} url every connection is its own in-memory
 * database, so nothing written on one connection is visible on another.
 */
@Component
public class DuckDbEngine implements SqlEngine {
    private static final Logger logger = LoggerFactory.getLogger(DuckDbEngine.class);

    private final String url;

    @Autowired
    public DuckDbEngine(PracticeProperties properties) {
        this(properties.engine().url());
    }

    public DuckDbEngine(String url) {
        this.url = url;
    }

    @Override
    public EngineConnection openConnection() {
        try {
            return new DuckDbConnection(DriverManager.getConnection(url));
        } catch (SQLException e) {
            throw new EngineException("Cannot open engine connection: " + e.getMessage(), e);
        }
    }

    static RowSet read(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<String> columns = new ArrayList<>(meta.getColumnCount());
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            List<Value> values = new ArrayList<>(columns.size());
            for (int i = 1; i <= columns.size(); i++) {
                values.add(Value.of(rs.getObject(i)));
            }
            rows.add(new Row(columns, values));
        }
        return new RowSet(columns, rows);
    }

    private static final class DuckDbConnection implements EngineConnection {
        private final Connection connection;

        private DuckDbConnection(Connection connection) {
            this.connection = connection;
        }

        @Override
        public void execute(String statement) {
            try (Statement st = connection.createStatement()) {
                st.execute(statement);
            } catch (SQLException e) {
                throw new EngineException(e.getMessage(), e);
            }
        }

        @Override
        public RowSet query(String sql) {
            try (Statement st = connection.createStatement()) {
                if (!st.execute(sql)) {
                    return RowSet.noResultSet();
                }
                try (ResultSet rs = st.getResultSet()) {
                    return read(rs);
                }
            } catch (SQLException e) {
                throw new EngineException(e.getMessage(), e);
            }
        }

        @Override
        public RowSet queryAndRollBack(String sql) {
            try {
                connection.setAutoCommit(false);
            } catch (SQLException e) {
                throw new EngineException(e.getMessage(), e);
            }
            try {
                return query(sql);
            } finally {
                rollBack();
            }
        }

        private void rollBack() {
            try {
                connection.rollback();
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                throw new EngineException("Could not discard the changes of a query: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                connection.close();
            } catch (SQLException e) {
                logger.warn("Failed to close engine connection: {}", e.getMessage());
            }
        }
    }
}
