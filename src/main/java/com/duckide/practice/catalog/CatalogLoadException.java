package com.duckide.practice.catalog;

import com.duckide.practice.parser.ParserDtos.ParseError;

import java.util.List;
import java.util.stream.Collectors;

public class CatalogLoadException extends RuntimeException {
    private final List<ParseError> errors;

    public CatalogLoadException(String location, List<ParseError> errors) {
        super("Invalid exercise pack " + location + ": " + errors.stream()
                .map(e -> e.code() + " at line " + e.line() + " (" + e.message() + ")")
                .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public CatalogLoadException(String location, Throwable cause) {
        super("Cannot read exercise pack " + location, cause);
        this.errors = List.of();
    }

    public List<ParseError> errors() {
        return errors;
    }
}
