package com.duckide.practice.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.duckide.practice.parser.ParserDtos.*;

/**
 * Parses the line-oriented exercise pack format. A line starting with {@code @marker} opens a block,
 * the following non-blank lines form its body. Each {@code @statement} body is exactly one setup
 * statement, so bodies are never split on {@code ;}.
 * <p>
 * Parsing runs in two passes: the text is cut into {@link Block}s, then each block is read into the
 * pack. Errors are collected, never thrown, so one run reports every problem in the document.
 */
@Component
public class ExercisePackParser {

    public ParseResult parse(String content) {
        PackReader reader = new PackReader();
        for (Block block : blocks(content)) {
            reader.read(block);
        }
        return reader.result();
    }

    /** One marker line and the body lines under it. */
    record Block(String marker, String header, int line, List<String> body) {
        String text() {
            return String.join("\n", body).trim();
        }
    }

    static List<Block> blocks(String content) {
        List<Block> blocks = new ArrayList<>();
        String[] lines = content.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();
            if (trimmed.startsWith("#")) {
                continue;
            }
            int nameEnd = markerNameEnd(trimmed);
            if (nameEnd > 0) {
                blocks.add(new Block(trimmed.substring(1, nameEnd), trimmed.substring(nameEnd).trim(), i + 1, new ArrayList<>()));
            } else if (!blocks.isEmpty() && !trimmed.isEmpty()) {
                blocks.get(blocks.size() - 1).body().add(lines[i]);
            }
        }
        return blocks;
    }

    /** End index of the marker name in {@code @name ...}, or -1 when the line is not a marker. */
    private static int markerNameEnd(String line) {
        if (line.length() < 2 || line.charAt(0) != '@' || !isLower(line.charAt(1))) {
            return -1;
        }
        int end = 2;
        while (end < line.length() && isNameChar(line.charAt(end))) {
            end++;
        }
        return end;
    }

    private static boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isNameChar(char c) {
        return isLower(c) || (c >= '0' && c <= '9') || c == '_';
    }

    /** Accumulates the pack while blocks are read. */
    private static final class PackReader {
        private final List<ParseError> errors = new ArrayList<>();
        private final List<ExerciseDoc> exercises = new ArrayList<>();
        private final List<StatementDoc> statements = new ArrayList<>();
        private final List<SolutionDoc> solutions = new ArrayList<>();
        private final List<StepDoc> steps = new ArrayList<>();
        private String version;
        private String packId;
        private String title;

        void read(Block block) {
            Map<String, String> attrs = new AttributeScanner(block, errors).scan();
            switch (block.marker()) {
                case "meta" -> readMeta(block, attrs);
                case "exercise" -> readExercise(block, attrs);
                case "statement" -> {
                    Integer id = referencedExercise(block, attrs);
                    if (id != null) statements.add(new StatementDoc(id, block.text(), block.line()));
                }
                case "solution" -> {
                    Integer id = referencedExercise(block, attrs);
                    if (id != null) solutions.add(new SolutionDoc(id, block.text(), block.line()));
                }
                case "step" -> {
                    Integer id = referencedExercise(block, attrs);
                    if (id != null) steps.add(new StepDoc(id, block.text(), block.line()));
                }
                default -> error("UNKNOWN_MARKER", "Unsupported marker @" + block.marker(), block, block.marker());
            }
        }

        private void readMeta(Block block, Map<String, String> attrs) {
            version = attrs.get("version");
            packId = attrs.get("pack");
            title = attrs.get("title");
            if (version == null) error("MISSING_FIELD", "@meta.version required", block, "meta");
            if (packId == null) error("MISSING_FIELD", "@meta.pack required", block, "meta");
        }

        private void readExercise(Block block, Map<String, String> attrs) {
            String rawId = attrs.get("id");
            String difficulty = attrs.get("difficulty");
            if (rawId == null || difficulty == null) {
                error("MISSING_FIELD", "@exercise id/difficulty required", block, rawId);
                return;
            }
            Integer id = exerciseId(block, rawId);
            if (id != null) {
                exercises.add(new ExerciseDoc(id, difficulty, attrs.get("category"),
                        attrs.getOrDefault("rows", "strict"), block.text(), block.line()));
            }
        }

        private Integer referencedExercise(Block block, Map<String, String> attrs) {
            String rawId = attrs.get("exercise");
            if (rawId == null) {
                error("MISSING_FIELD", "@" + block.marker() + " exercise required", block, null);
                return null;
            }
            return exerciseId(block, rawId);
        }

        private Integer exerciseId(Block block, String rawId) {
            String digits = rawId.trim();
            boolean numeric = !digits.isEmpty() && digits.length() <= 9 && digits.chars().allMatch(Character::isDigit);
            int id = numeric ? Integer.parseInt(digits) : 0;
            if (id <= 0) {
                error("INVALID_FIELD", "Exercise id must be a positive integer: " + rawId, block, rawId);
                return null;
            }
            return id;
        }

        private void error(String code, String message, Block block, String sectionId) {
            errors.add(new ParseError(code, message, block.line(), block.marker(), sectionId));
        }

        ParseResult result() {
            if (version == null || packId == null) {
                errors.add(new ParseError("MISSING_META", "Document must contain @meta with version and pack", 1, "meta", "meta"));
            }
            return new ParseResult(new ExercisePackDoc(version, packId, title, exercises, statements, solutions, steps), errors);
        }
    }

    /**
     * Reads {@code name="value"} pairs from a marker header, decoding escapes as it goes. Stops at the
     * first malformed pair; the pairs read before it are kept.
     */
    private static final class AttributeScanner {
        private final Block block;
        private final String header;
        private final List<ParseError> errors;
        private final Map<String, String> attrs = new LinkedHashMap<>();
        private int pos;

        AttributeScanner(Block block, List<ParseError> errors) {
            this.block = block;
            this.header = block.header();
            this.errors = errors;
        }

        Map<String, String> scan() {
            while (skipSpaces()) {
                int start = pos;
                if (!readPair()) {
                    fail("INVALID_ATTR_SYNTAX", "Cannot parse attributes: " + header.substring(start).trim());
                    break;
                }
            }
            return attrs;
        }

        private boolean skipSpaces() {
            while (pos < header.length() && Character.isWhitespace(header.charAt(pos))) {
                pos++;
            }
            return pos < header.length();
        }

        private boolean readPair() {
            int nameStart = pos;
            if (!isLower(header.charAt(pos))) {
                return false;
            }
            while (pos < header.length() && isNameChar(header.charAt(pos))) {
                pos++;
            }
            String name = header.substring(nameStart, pos);
            if (!consume('=') || !consume('"')) {
                return false;
            }
            StringBuilder value = new StringBuilder();
            while (pos < header.length()) {
                char c = header.charAt(pos++);
                if (c == '"') {
                    attrs.put(name, value.toString());
                    return pos == header.length() || Character.isWhitespace(header.charAt(pos));
                }
                if (c != '\\') {
                    value.append(c);
                } else if (pos < header.length()) {
                    value.append(escaped(header.charAt(pos++)));
                }
            }
            return false;
        }

        private char escaped(char c) {
            return switch (c) {
                case '"', '\\', '@' -> c;
                case 'n' -> '\n';
                case 't' -> '\t';
                default -> {
                    fail("INVALID_ESCAPE", "Unknown escape: \\" + c);
                    yield c;
                }
            };
        }

        private boolean consume(char expected) {
            if (pos < header.length() && header.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private void fail(String code, String message) {
            errors.add(new ParseError(code, message, block.line(), block.marker(), block.marker()));
        }
    }

    public record ParseResult(ExercisePackDoc doc, List<ParseError> errors) {}
}
