package com.duckide.practice.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExercisePackParserTest {
    private final ExercisePackParser parser = new ExercisePackParser();

    @Test
    void parsesExercisesWithStatementsSolutionAndSteps() {
        String content = """
                # comment line
                @meta version="1.0.0" pack="demo" title="Demo pack"
                @exercise id="1" difficulty="beginner" category="SELECT queries"
                List every city
                @statement exercise="1"
                CREATE TABLE cities (name VARCHAR)
                @statement exercise="1"
                INSERT INTO cities VALUES ('Oslo'), ('Bergen; Norway')
                @solution exercise="1"
                SELECT name FROM cities
                @step exercise="1"
                SELECT name - picks the column
                """;

        ExercisePackParser.ParseResult result = parser.parse(content);

        assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
        assertEquals("demo", result.doc().packId());
        assertEquals("1.0.0", result.doc().version());
        assertEquals(1, result.doc().exercises().size());
        ParserDtos.ExerciseDoc exercise = result.doc().exercises().get(0);
        assertEquals(1, exercise.id());
        assertEquals("List every city", exercise.prompt());
        assertEquals("strict", exercise.rowOrder());
        assertEquals(2, result.doc().statements().size());
        assertEquals("INSERT INTO cities VALUES ('Oslo'), ('Bergen; Norway')", result.doc().statements().get(1).sql());
        assertEquals("SELECT name FROM cities", result.doc().solutions().get(0).sql());
        assertEquals(1, result.doc().steps().size());
    }

    @Test
    void keepsExplicitRowsModeAndUnescapesAttributes() {
        String content = """
                @meta version="1" pack="demo" title="Say \\"hi\\""
                @exercise id="3" difficulty="advanced" category="Joins" rows="any"
                prompt
                """;

        ExercisePackParser.ParseResult result = parser.parse(content);

        assertTrue(result.errors().isEmpty());
        assertEquals("Say \"hi\"", result.doc().title());
        assertEquals("any", result.doc().exercises().get(0).rowOrder());
    }

    @Test
    void reportsStructuredErrors() {
        String content = """
                @exercise id="x" difficulty="beginner"
                prompt
                @statement
                CREATE TABLE t (a INT)
                @hint exercise="1"
                text
                @solution exercise="1" broken
                SELECT 1
                """;

        ExercisePackParser.ParseResult result = parser.parse(content);

        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("MISSING_META")));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("INVALID_FIELD") && e.line() == 1));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("MISSING_FIELD") && e.line() == 3));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("UNKNOWN_MARKER") && e.line() == 5));
        assertTrue(result.errors().stream().anyMatch(e -> e.code().equals("INVALID_ATTR_SYNTAX") && e.line() == 7));
        assertTrue(result.doc().exercises().isEmpty());
    }

    @Test
    void rejectsUnknownEscape() {
        ExercisePackParser.ParseResult result = parser.parse("@meta version=\"1\" pack=\"p\" title=\"a\\qb\"\n");

        assertEquals(1, result.errors().size());
        assertEquals("INVALID_ESCAPE", result.errors().get(0).code());
    }

    @Test
    void splitsIntoBlocksSkippingCommentsAndStrayText() {
        String content = """
                text before any marker
                @meta version="1" pack="p"
                @exercise id="1" difficulty="beginner"
                first line
                # a comment inside the body

                second line
                @Not a marker
                """;

        List<ExercisePackParser.Block> blocks = ExercisePackParser.blocks(content);

        assertEquals(2, blocks.size());
        assertEquals("meta", blocks.get(0).marker());
        assertEquals(2, blocks.get(0).line());
        assertEquals("exercise", blocks.get(1).marker());
        assertEquals("id=\"1\" difficulty=\"beginner\"", blocks.get(1).header());
        assertEquals("first line\nsecond line\n@Not a marker", blocks.get(1).text());
    }

    @Test
    void keepsAttributesReadBeforeAMalformedOne() {
        ExercisePackParser.ParseResult result = parser.parse("""
                @meta version="1" pack="p"
                @exercise id="4" difficulty="beginner" category="Open
                prompt
                """);

        assertEquals(1, result.errors().size());
        ParserDtos.ParseError error = result.errors().get(0);
        assertEquals("INVALID_ATTR_SYNTAX", error.code());
        assertEquals(2, error.line());
        assertEquals("Cannot parse attributes: category=\"Open", error.message());
        assertEquals(4, result.doc().exercises().get(0).id());
        assertNull(result.doc().exercises().get(0).category());
    }
}
