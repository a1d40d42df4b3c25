package com.duckide.practice.validation;

import com.duckide.practice.domain.DomainModels;
import com.duckide.practice.parser.ParserDtos.ExercisePackDoc;
import com.duckide.practice.parser.ParserDtos.ParseError;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class ExercisePackValidator {
    public List<ParseError> validate(ExercisePackDoc doc) {
        List<ParseError> errors = new ArrayList<>();

        Map<Integer, Long> counts = doc.exercises().stream()
                .collect(Collectors.groupingBy(e -> e.id(), Collectors.counting()));
        doc.exercises().forEach(e -> {
            if (counts.getOrDefault(e.id(), 0L) > 1) {
                errors.add(new ParseError("DUPLICATE_EXERCISE", "Duplicate exercise id: " + e.id(), e.line(), "exercise", String.valueOf(e.id())));
            }
            if (e.prompt() == null || e.prompt().isBlank()) {
                errors.add(new ParseError("MISSING_PROMPT", "Exercise has no prompt: " + e.id(), e.line(), "exercise", String.valueOf(e.id())));
            }
            if (!isEnumValue(e.difficulty(), DomainModels.Difficulty.class)) {
                errors.add(new ParseError("INVALID_FIELD", "Unsupported difficulty: " + e.difficulty(), e.line(), "exercise", String.valueOf(e.id())));
            }
            if (!isEnumValue(e.rowOrder(), DomainModels.RowOrder.class)) {
                errors.add(new ParseError("INVALID_FIELD", "Unsupported rows mode: " + e.rowOrder(), e.line(), "exercise", String.valueOf(e.id())));
            }
        });

        Set<Integer> ids = counts.keySet();
        unknown(doc.statements().stream().map(s -> new Ref(s.exerciseId(), s.line(), "statement")).toList(), ids, errors);
        unknown(doc.solutions().stream().map(s -> new Ref(s.exerciseId(), s.line(), "solution")).toList(), ids, errors);
        unknown(doc.steps().stream().map(s -> new Ref(s.exerciseId(), s.line(), "step")).toList(), ids, errors);

        doc.statements().stream().filter(s -> s.sql().isBlank()).forEach(s ->
                errors.add(new ParseError("MISSING_FIELD", "Empty setup statement", s.line(), "statement", String.valueOf(s.exerciseId()))));

        Set<Integer> withSetup = doc.statements().stream().map(s -> s.exerciseId()).collect(Collectors.toSet());
        Map<Integer, Long> solutionCounts = doc.solutions().stream()
                .filter(s -> !s.sql().isBlank())
                .collect(Collectors.groupingBy(s -> s.exerciseId(), Collectors.counting()));
        doc.exercises().forEach(e -> {
            if (!withSetup.contains(e.id())) {
                errors.add(new ParseError("MISSING_SETUP", "Exercise has no setup statements: " + e.id(), e.line(), "exercise", String.valueOf(e.id())));
            }
            long solutions = solutionCounts.getOrDefault(e.id(), 0L);
            if (solutions == 0) {
                errors.add(new ParseError("MISSING_SOLUTION", "Exercise has no solution: " + e.id(), e.line(), "exercise", String.valueOf(e.id())));
            } else if (solutions > 1) {
                errors.add(new ParseError("DUPLICATE_SOLUTION", "Exercise has more than one solution: " + e.id(), e.line(), "exercise", String.valueOf(e.id())));
            }
        });

        return errors;
    }

    private void unknown(List<Ref> refs, Set<Integer> ids, List<ParseError> errors) {
        refs.forEach(r -> {
            if (!ids.contains(r.exerciseId())) {
                errors.add(new ParseError("EXERCISE_NOT_FOUND", "@" + r.block() + " references unknown exercise: " + r.exerciseId(),
                        r.line(), r.block(), String.valueOf(r.exerciseId())));
            }
        });
    }

    private <E extends Enum<E>> boolean isEnumValue(String value, Class<E> type) {
        if (value == null) return false;
        return Arrays.stream(type.getEnumConstants()).anyMatch(c -> c.name().equalsIgnoreCase(value.trim()));
    }

    private record Ref(Integer exerciseId, int line, String block) {}
}
