package com.duckide.practice.api;

import com.duckide.practice.domain.DomainModels;
import com.duckide.practice.practice.PracticeModels;
import com.duckide.practice.practice.PracticeService;
import com.duckide.practice.progress.ProgressModels;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/practice")
public class PracticeController {
    static final String LEARNER_HEADER = "X-Learner-Id";

    private final PracticeService practiceService;

    public PracticeController(PracticeService practiceService) {
        this.practiceService = practiceService;
    }

    @GetMapping("/exercise/current")
    public ResponseEntity<PracticeModels.ExerciseView> current(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(practiceService.currentOrFirstExercise(learnerId));
    }

    @GetMapping("/exercise/next")
    public ResponseEntity<PracticeModels.NextExerciseResponse> next(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(practiceService.nextExercise(learnerId));
    }

    @GetMapping("/exercises")
    public ResponseEntity<PracticeModels.ExerciseOverview> exercises(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(practiceService.allExercises(learnerId));
    }

    @GetMapping("/exercises/{exerciseId}")
    public ResponseEntity<PracticeModels.ExerciseView> exercise(@PathVariable int exerciseId) {
        return ResponseEntity.ok(practiceService.exercise(exerciseId));
    }

    @GetMapping("/exercises/{exerciseId}/solution")
    public ResponseEntity<PracticeModels.SolutionView> solution(@PathVariable int exerciseId) {
        return ResponseEntity.ok(practiceService.solution(exerciseId));
    }

    @PostMapping("/attempts")
    public ResponseEntity<PracticeModels.SubmissionResult> submit(@RequestHeader(LEARNER_HEADER) String learnerId,
                                                                  @Valid @RequestBody AttemptRequest request) {
        return ResponseEntity.ok(practiceService.submitAttempt(
                learnerId, request.exerciseId(), request.query(), request.elapsedSeconds()));
    }

    @GetMapping("/progress")
    public ResponseEntity<ProgressModels.ProgressSnapshot> progress(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(practiceService.progress(learnerId));
    }

    @GetMapping("/session")
    public ResponseEntity<DomainModels.Session> session(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(practiceService.session(learnerId));
    }

    @PostMapping("/session/activate")
    public ResponseEntity<DomainModels.Session> activate(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(practiceService.activate(learnerId));
    }

    @PostMapping("/session/deactivate")
    public ResponseEntity<DomainModels.Session> deactivate(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(practiceService.deactivate(learnerId));
    }

    @PostMapping("/session/reset")
    public ResponseEntity<DomainModels.Session> reset(@RequestHeader(LEARNER_HEADER) String learnerId) {
        return ResponseEntity.ok(practiceService.resetSession(learnerId));
    }

    public record AttemptRequest(@NotNull @Min(1) Integer exerciseId,
                                 @NotBlank String query,
                                 @PositiveOrZero Integer elapsedSeconds) {}
}
