package com.duckide.practice.api;

import com.duckide.practice.catalog.ExerciseNotFoundException;
import com.duckide.practice.engine.DatasetSetupException;
import com.duckide.practice.engine.EngineException;
import com.duckide.practice.ledger.SequencingConflictException;
import com.duckide.practice.orchestrator.ContractViolationException;
import com.duckide.practice.orchestrator.LoadCancelledException;
import com.duckide.practice.practice.AdvanceNotAllowedException;
import com.duckide.practice.verification.SolutionExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String LOAD_FAILED = "This exercise could not be loaded";

    @ExceptionHandler(DatasetSetupException.class)
    public ResponseEntity<ErrorResponse> datasetSetup(DatasetSetupException e) {
        logger.error("Dataset setup failed for exercise {} at statement {}", e.exerciseId(), e.statementIndex(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.of("DATASET_SETUP_FAILED", LOAD_FAILED));
    }

    @ExceptionHandler(SolutionExecutionException.class)
    public ResponseEntity<ErrorResponse> solutionFault(SolutionExecutionException e) {
        logger.error("Solution query of exercise {} failed", e.exerciseId(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of("SOLUTION_FAILED", LOAD_FAILED));
    }

    @ExceptionHandler(SequencingConflictException.class)
    public ResponseEntity<ErrorResponse> sequencingConflict(SequencingConflictException e) {
        logger.warn(e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE,
                ErrorResponse.of("SEQUENCING_CONFLICT", "The attempt could not be recorded, please submit again"));
    }

    @ExceptionHandler(ContractViolationException.class)
    public ResponseEntity<ErrorResponse> contractViolation(ContractViolationException e) {
        logger.warn(e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.of("INVALID_STATE", e.getMessage()));
    }

    @ExceptionHandler(LoadCancelledException.class)
    public ResponseEntity<ErrorResponse> loadCancelled(LoadCancelledException e) {
        logger.info(e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.of("LOAD_CANCELLED", e.getMessage()));
    }

    @ExceptionHandler(ExerciseNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(ExerciseNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.of("EXERCISE_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(AdvanceNotAllowedException.class)
    public ResponseEntity<ErrorResponse> advanceNotAllowed(AdvanceNotAllowedException e) {
        return respond(HttpStatus.CONFLICT, ErrorResponse.of("ADVANCE_NOT_ALLOWED", e.getMessage()));
    }

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ErrorResponse> queryFailed(EngineException e) {
        logger.debug("Query rejected: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.of("QUERY_ERROR", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(this::formatViolation)
                .toList();
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse("VALIDATION_FAILED", "Validation failed", details));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> missingHeader(MissingRequestHeaderException e) {
        return respond(HttpStatus.BAD_REQUEST,
                ErrorResponse.of("MISSING_LEARNER", "Header " + e.getHeaderName() + " is required"));
    }

    private String formatViolation(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        return ResponseEntity.status(status).body(body);
    }
}
