package com.duckide.practice.repository;

import com.duckide.practice.domain.DomainModels.Attempt;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Repository
public class AttemptJdbcRepository {
    private static final String COLUMNS =
            "id, learner_id, exercise_id, submitted_query, is_correct, query_error, sequence_number, submitted_at, elapsed_seconds";

    private static final RowMapper<Attempt> ATTEMPT_MAPPER = (rs, n) -> new Attempt(
            rs.getLong(1), rs.getString(2), rs.getInt(3), rs.getString(4), rs.getBoolean(5), rs.getString(6),
            rs.getInt(7), Instant.parse(rs.getString(8)), rs.getObject(9, Integer.class));

    private final JdbcTemplate jdbcTemplate;

    public AttemptJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Counts the pair's attempts and inserts the next one in a single transaction. Two writers that
     * read the same count collide on the {@code (learner_id, exercise_id, sequence_number)} unique
     * constraint; the loser gets a {@link org.springframework.dao.DuplicateKeyException}.
     */
    @Transactional
    public Attempt insertNext(String learnerId, int exerciseId, String query, boolean correct,
                              String queryError, Integer elapsedSeconds, Instant submittedAt) {
        int sequenceNumber = countFor(learnerId, exerciseId) + 1;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO attempts(learner_id, exercise_id, submitted_query, is_correct, query_error, sequence_number, submitted_at, elapsed_seconds) VALUES (?,?,?,?,?,?,?,?)",
                    new String[]{"ID"});
            ps.setString(1, learnerId);
            ps.setInt(2, exerciseId);
            ps.setString(3, query);
            ps.setBoolean(4, correct);
            ps.setString(5, queryError);
            ps.setInt(6, sequenceNumber);
            ps.setString(7, submittedAt.toString());
            ps.setObject(8, elapsedSeconds, Types.INTEGER);
            return ps;
        }, keyHolder);

        long id = Objects.requireNonNull(keyHolder.getKey(), "generated attempt id").longValue();
        return new Attempt(id, learnerId, exerciseId, query, correct, queryError, sequenceNumber, submittedAt, elapsedSeconds);
    }

    public int countFor(String learnerId, int exerciseId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM attempts WHERE learner_id = ? AND exercise_id = ?",
                Integer.class, learnerId, exerciseId);
        return count == null ? 0 : count;
    }

    public List<Attempt> findFor(String learnerId, int exerciseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM attempts WHERE learner_id = ? AND exercise_id = ? ORDER BY id DESC",
                ATTEMPT_MAPPER, learnerId, exerciseId);
    }

    public boolean existsCorrect(String learnerId, int exerciseId) {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS(SELECT 1 FROM attempts WHERE learner_id = ? AND exercise_id = ? AND is_correct = TRUE)",
                Boolean.class, learnerId, exerciseId);
        return Boolean.TRUE.equals(exists);
    }

    public List<Attempt> findRecent(String learnerId, int limit) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM attempts WHERE learner_id = ? ORDER BY id DESC LIMIT ?",
                ATTEMPT_MAPPER, learnerId, limit);
    }

    public List<Attempt> findByLearner(String learnerId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM attempts WHERE learner_id = ? ORDER BY id DESC",
                ATTEMPT_MAPPER, learnerId);
    }
}
