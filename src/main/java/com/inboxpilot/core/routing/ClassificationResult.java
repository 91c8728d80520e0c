package com.inboxpilot.core.routing;

import java.util.Optional;

/**
 * Outcome of validating a classification response: either a value or the reason it was rejected.
 */
public record ClassificationResult<T>(T value, String failure) {

    public static <T> ClassificationResult<T> valid(T value) {
        return new ClassificationResult<>(value, null);
    }

    public static <T> ClassificationResult<T> invalid(String failure) {
        return new ClassificationResult<>(null, failure);
    }

    public boolean isValid() {
        return value != null;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }
}
