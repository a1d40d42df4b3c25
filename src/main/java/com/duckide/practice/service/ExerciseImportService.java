package com.duckide.practice.service;

import com.duckide.practice.catalog.CatalogLoadException;
import com.duckide.practice.catalog.ExerciseCatalog;
import com.duckide.practice.domain.DomainModels;
import com.duckide.practice.parser.ExercisePackParser;
import com.duckide.practice.parser.ParserDtos;
import com.duckide.practice.repository.ExerciseJdbcRepository;
import com.duckide.practice.validation.ExercisePackValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
public class ExerciseImportService {
    private static final Logger logger = LoggerFactory.getLogger(ExerciseImportService.class);

    private final ExercisePackParser parser;
    private final ExercisePackValidator validator;
    private final ExerciseJdbcRepository repository;

    public ExerciseImportService(ExercisePackParser parser,
                                 ExercisePackValidator validator,
                                 ExerciseJdbcRepository repository) {
        this.parser = parser;
        this.validator = validator;
        this.repository = repository;
    }

    public ImportResult importExercises(String content, boolean dryRun) {
        ExercisePackParser.ParseResult parseResult = parser.parse(content);
        List<ParserDtos.ParseError> errors = new ArrayList<>(parseResult.errors());
        errors.addAll(validator.validate(parseResult.doc()));

        if (!errors.isEmpty()) {
            logger.warn("Exercise pack {} rejected with {} error(s)", parseResult.doc().packId(), errors.size());
            return new ImportResult(dryRun, false, List.of(), errors);
        }

        List<DomainModels.Exercise> exercises = toDomain(parseResult.doc());
        if (!dryRun) {
            repository.replaceAll(exercises);
            logger.info("Imported exercise pack {} v{} with {} exercise(s)",
                    parseResult.doc().packId(), parseResult.doc().version(), exercises.size());
        }
        return new ImportResult(dryRun, true, exercises, errors);
    }

    /**
     * Imports the pack and builds the catalog from the persisted reference rows.
     *
     * @throws CatalogLoadException listing every parse and validation error when the pack is invalid
     */
    public ExerciseCatalog importCatalog(String location, String content) {
        ImportResult result = importExercises(content, false);
        if (!result.valid()) {
            throw new CatalogLoadException(location, result.errors());
        }
        return ExerciseCatalog.of(repository.loadAll());
    }

    private List<DomainModels.Exercise> toDomain(ParserDtos.ExercisePackDoc doc) {
        Map<Integer, List<String>> statements = doc.statements().stream()
                .collect(Collectors.groupingBy(ParserDtos.StatementDoc::exerciseId,
                        Collectors.mapping(ParserDtos.StatementDoc::sql, Collectors.toList())));
        Map<Integer, String> solutions = doc.solutions().stream()
                .collect(Collectors.toMap(ParserDtos.SolutionDoc::exerciseId, ParserDtos.SolutionDoc::sql, (a, b) -> a));
        Map<Integer, List<String>> steps = doc.steps().stream()
                .collect(Collectors.groupingBy(ParserDtos.StepDoc::exerciseId,
                        Collectors.mapping(ParserDtos.StepDoc::text, Collectors.toList())));

        return doc.exercises().stream()
                .map(e -> new DomainModels.Exercise(
                        e.id(),
                        e.prompt(),
                        statements.getOrDefault(e.id(), List.of()),
                        solutions.get(e.id()),
                        steps.getOrDefault(e.id(), List.of()),
                        DomainModels.Difficulty.parse(e.difficulty()),
                        e.category(),
                        DomainModels.RowOrder.parse(e.rowOrder())))
                .sorted(Comparator.comparingInt(DomainModels.Exercise::id))
                .toList();
    }

    public record ImportResult(boolean dryRun,
                               boolean valid,
                               List<DomainModels.Exercise> exercises,
                               List<ParserDtos.ParseError> errors) {
    }
}
