package com.duckide.practice.api;

import com.duckide.practice.engine.Row;
import com.duckide.practice.engine.RowSet;
import com.duckide.practice.engine.Value;
import com.duckide.practice.domain.DomainModels.Exercise;
import com.duckide.practice.orchestrator.PracticeWorkspaceRegistry;
import com.duckide.practice.orchestrator.WorkspaceState;
import com.duckide.practice.practice.PracticeModels;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.duckide.practice.api.PracticeController.LEARNER_HEADER;

/**
 * Drives the learner's long-lived practice workspace: one dataset kept open between requests.
 */
@RestController
@RequestMapping("/api/workspace")
public class WorkspaceController {
    private final PracticeWorkspaceRegistry registry;

    public WorkspaceController(PracticeWorkspaceRegistry registry) {
        this.registry = registry;
    }

    @PostMapping("/start")
    public ResponseEntity<PracticeModels.ExerciseView> start(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(PracticeModels.ExerciseView.of(registry.forLearner(learnerId).start()));
    }

    @PostMapping("/query")
    public ResponseEntity<QueryResult> query(@RequestHeader(LEARNER_HEADER) String learnerId,
                                             @Valid @RequestBody QueryRequest request) {
        return ResponseEntity.ok(QueryResult.of(registry.forLearner(learnerId).runQuery(request.sql())));
    }

    @PostMapping("/submit")
    public ResponseEntity<PracticeModels.SubmissionResult> submit(@RequestHeader(LEARNER_HEADER) String learnerId,
                                                                  @Valid @RequestBody SubmitRequest request) {
        return ResponseEntity.ok(registry.forLearner(learnerId).submit(request.query()));
    }

    @PostMapping("/next")
    public ResponseEntity<PracticeModels.NextExerciseResponse> next(@RequestHeader(LEARNER_HEADER) String learnerId) {
        Optional<Exercise> next = registry.forLearner(learnerId).next();
        if (next.isEmpty()) {
            registry.release(learnerId);
            return ResponseEntity.ok(PracticeModels.NextExerciseResponse.finished());
        }
        return ResponseEntity.ok(PracticeModels.NextExerciseResponse.of(next.get()));
    }

    @PostMapping("/exit")
    public ResponseEntity<WorkspaceState> exit(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(registry.exit(learnerId));
    }

    @GetMapping("/state")
    public ResponseEntity<WorkspaceState> state(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(registry.forLearner(learnerId).snapshot());
    }

    public record QueryRequest(@NotBlank String sql) {}

    public record SubmitRequest(@NotBlank String query) {}

    /** Cells in their display form; SQL NULL stays null. */
    public record QueryResult(List<String> columns, List<List<String>> rows) {
        static QueryResult of(RowSet rowSet) {
            List<List<String>> rows = new ArrayList<>(rowSet.size());
            for (Row row : rowSet.rows()) {
                List<String> cells = new ArrayList<>(row.arity());
                for (Value value : row.values()) {
                    cells.add(value instanceof Value.Null ? null : value.stringValue());
                }
                rows.add(cells);
            }
            return new QueryResult(rowSet.columns(), rows);
        }
    }
}
