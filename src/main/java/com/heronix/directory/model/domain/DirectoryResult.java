package com.heronix.directory.model.domain;

import java.util.List;

/**
 * Successful directory outcome plus the non-fatal warnings collected on the way.
 */
public record DirectoryResult<T>(T value, List<String> warnings) {

    public DirectoryResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static <T> DirectoryResult<T> of(T value) {
        return new DirectoryResult<>(value, List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
