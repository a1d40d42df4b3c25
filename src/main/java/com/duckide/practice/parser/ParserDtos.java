package com.duckide.practice.parser;

import java.util.List;

public class ParserDtos {
    public record ExercisePackDoc(String version, String packId, String title,
                                  List<ExerciseDoc> exercises,
                                  List<StatementDoc> statements,
                                  List<SolutionDoc> solutions,
                                  List<StepDoc> steps) {}

    public record ExerciseDoc(Integer id, String difficulty, String category, String rowOrder, String prompt, int line) {}
    public record StatementDoc(Integer exerciseId, String sql, int line) {}
    public record SolutionDoc(Integer exerciseId, String sql, int line) {}
    public record StepDoc(Integer exerciseId, String text, int line) {}

    public record ParseError(String code, String message, int line, String block, String sectionId) {}
}
