package com.duckide.practice.api;

import java.util.List;

public record ErrorResponse(String error, String message, List<String> details) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, List.of());
    }
}
