package com.heronix.directory.model.domain;

import java.util.Objects;

/**
 * A provider region code, e.g. {@code us-east-1}.
 */
public record Region(String code) {

    public Region {
        Objects.requireNonNull(code, "code");
        if (code.isBlank()) {
            throw new IllegalArgumentException("Region code must not be blank");
        }
    }

    public static Region of(String code) {
        return new Region(code.trim());
    }

    @Override
    public String toString() {
        return code;
    }
}
