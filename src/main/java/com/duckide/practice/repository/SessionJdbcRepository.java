package com.duckide.practice.repository;

import com.duckide.practice.domain.DomainModels.Session;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class SessionJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Session> find(String learnerId) {
        return jdbcTemplate.query(
                "SELECT learner_id, current_exercise_id, practice_active, last_activity FROM practice_sessions WHERE learner_id = ?",
                (rs, n) -> new Session(rs.getString(1), rs.getObject(2, Integer.class), rs.getBoolean(3), Instant.parse(rs.getString(4))),
                learnerId).stream().findFirst();
    }

    public void upsert(Session session) {
        jdbcTemplate.update(
                "MERGE INTO practice_sessions(learner_id, current_exercise_id, practice_active, last_activity) KEY(learner_id) VALUES (?,?,?,?)",
                session.learnerId(), session.currentExerciseId(), session.practiceActive(), session.lastActivity().toString());
    }
}
