package com.duckide.practice.repository;

import com.duckide.practice.domain.DomainModels.Difficulty;
import com.duckide.practice.domain.DomainModels.Exercise;
import com.duckide.practice.domain.DomainModels.RowOrder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

@Repository
public class ExerciseJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ExerciseJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public void replaceAll(List<Exercise> exercises) {
        jdbcTemplate.update("DELETE FROM exercise_setup_statements");
        jdbcTemplate.update("DELETE FROM exercise_explanation_steps");
        jdbcTemplate.update("DELETE FROM exercises");

        exercises.forEach(e -> {
            jdbcTemplate.update(
                    "INSERT INTO exercises(id, prompt, solution_query, difficulty, category, row_order) VALUES (?,?,?,?,?,?)",
                    e.id(), e.prompt(), e.solutionQuery(), e.difficulty().name().toLowerCase(Locale.ROOT), e.category(),
                    e.rowOrder().name().toLowerCase(Locale.ROOT));
            for (int i = 0; i < e.setupStatements().size(); i++) {
                jdbcTemplate.update(
                        "INSERT INTO exercise_setup_statements(exercise_id, statement_index, sql_text) VALUES (?,?,?)",
                        e.id(), i, e.setupStatements().get(i));
            }
            for (int i = 0; i < e.explanationSteps().size(); i++) {
                jdbcTemplate.update(
                        "INSERT INTO exercise_explanation_steps(exercise_id, step_index, step_text) VALUES (?,?,?)",
                        e.id(), i, e.explanationSteps().get(i));
            }
        });
    }

    public List<Exercise> loadAll() {
        Map<Integer, List<String>> statements = loadOrdered(
                "SELECT exercise_id, sql_text FROM exercise_setup_statements ORDER BY exercise_id, statement_index");
        Map<Integer, List<String>> steps = loadOrdered(
                "SELECT exercise_id, step_text FROM exercise_explanation_steps ORDER BY exercise_id, step_index");

        return jdbcTemplate.query(
                "SELECT id, prompt, solution_query, difficulty, category, row_order FROM exercises ORDER BY id",
                (rs, n) -> new Exercise(
                        rs.getInt(1), rs.getString(2),
                        statements.getOrDefault(rs.getInt(1), List.of()),
                        rs.getString(3),
                        steps.getOrDefault(rs.getInt(1), List.of()),
                        Difficulty.parse(rs.getString(4)), rs.getString(5), RowOrder.parse(rs.getString(6))));
    }

    private Map<Integer, List<String>> loadOrdered(String sql) {
        return jdbcTemplate.query(sql, (rs, n) -> new TextRow(rs.getInt(1), rs.getString(2))).stream()
                .collect(Collectors.groupingBy(TextRow::exerciseId, LinkedHashMap::new,
                        Collectors.mapping(TextRow::text, Collectors.toList())));
    }

    private record TextRow(int exerciseId, String text) {}
}
