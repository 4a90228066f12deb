package com.comments.processor.model;

import java.util.Locale;
import java.util.Optional;

public enum ModerationStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isFinal() {
        return this != PENDING;
    }

    public static Optional<ModerationStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
