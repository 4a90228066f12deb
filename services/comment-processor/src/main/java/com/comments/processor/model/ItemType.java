package com.comments.processor.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Partition key of the item store.
 * Low cardinality by construction: every item of a kind shares one partition,
 * which only holds up while per-type volume stays small.
 */
public enum ItemType {
    COMMENT,
    SUBSCRIPTION;

    /** Absent or blank means a comment; anything unrecognised is empty. */
    public static Optional<ItemType> fromField(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(COMMENT);
        }
        return parse(value);
    }

    public static Optional<ItemType> parse(String value) {
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
