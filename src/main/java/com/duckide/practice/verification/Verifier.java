package com.duckide.practice.verification;

import com.duckide.practice.domain.DomainModels.Exercise;
import com.duckide.practice.domain.DomainModels.RowOrder;
import com.duckide.practice.engine.EngineException;
import com.duckide.practice.engine.Row;
import com.duckide.practice.engine.RowSet;
import com.duckide.practice.engine.ScratchDataset;
import com.duckide.practice.engine.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Grades a candidate query by running it and the exercise's solution on the same dataset and
 * comparing the two results cell by cell in their textual form. Column names are ignored; only
 * row count, arity and values matter.
 * <p>
 * The solution reads the dataset before the candidate runs, and the dataset rolls back whatever a
 * query changes, so a candidate can neither alter the expected result nor break the solution.
 */
@Component
public class Verifier {
    private static final Logger logger = LoggerFactory.getLogger(Verifier.class);
    private static final String CELL_SEPARATOR = "\u001f";
    static final String NO_RESULT_SET = "The query must return rows";

    public Verdict verify(ScratchDataset dataset, String candidateQuery, Exercise exercise) {
        SolutionRun solution = runSolution(dataset, exercise);

        RowSet candidate;
        try {
            candidate = dataset.query(candidateQuery);
        } catch (EngineException e) {
            logger.debug("Candidate query for exercise {} failed: {}", exercise.id(), e.getMessage());
            return Verdict.queryFailed(e.getMessage());
        }
        if (!candidate.hasResultSet()) {
            return Verdict.queryFailed(NO_RESULT_SET);
        }

        RowSet expected = solution.rowsOrThrow(exercise.id());
        return matches(candidate, expected, exercise.rowOrder()) ? Verdict.correctResult() : Verdict.mismatch();
    }

    private SolutionRun runSolution(ScratchDataset dataset, Exercise exercise) {
        try {
            return new SolutionRun(dataset.query(exercise.solutionQuery()), null);
        } catch (EngineException e) {
            return new SolutionRun(null, e);
        }
    }

    boolean matches(RowSet candidate, RowSet solution, RowOrder rowOrder) {
        if (candidate.size() != solution.size()) return false;
        if (candidate.size() == 0) return true;
        if (candidate.rows().get(0).arity() != solution.rows().get(0).arity()) return false;

        if (rowOrder == RowOrder.ANY) {
            return signatures(candidate).equals(signatures(solution));
        }
        for (int i = 0; i < candidate.size(); i++) {
            if (!sameCells(candidate.rows().get(i), solution.rows().get(i))) return false;
        }
        return true;
    }

    private boolean sameCells(Row candidate, Row solution) {
        if (candidate.arity() != solution.arity()) return false;
        for (int col = 0; col < candidate.arity(); col++) {
            if (!candidate.valueAt(col).stringValue().equals(solution.valueAt(col).stringValue())) {
                return false;
            }
        }
        return true;
    }

    private List<String> signatures(RowSet rows) {
        return rows.rows().stream()
                .map(r -> r.values().stream().map(Value::stringValue).collect(Collectors.joining(CELL_SEPARATOR)))
                .sorted()
                .toList();
    }

    /** Holds a solution failure back until the candidate has run without a learner error. */
    private record SolutionRun(RowSet rows, EngineException failure) {
        RowSet rowsOrThrow(int exerciseId) {
            if (failure != null) {
                throw new SolutionExecutionException(exerciseId, failure);
            }
            return rows;
        }
    }
}
