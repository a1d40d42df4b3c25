package com.duckide.practice.verification;

/**
 * Outcome of grading one candidate query. {@code queryError} is set only when the candidate failed
 * to execute; such a verdict is never correct.
 */
public record Verdict(boolean correct, String queryError) {
    public static Verdict correctResult() {
        return new Verdict(true, null);
    }

    public static Verdict mismatch() {
        return new Verdict(false, null);
    }

    public static Verdict queryFailed(String message) {
        return new Verdict(false, message);
    }

    public boolean errored() {
        return queryError != null;
    }
}
