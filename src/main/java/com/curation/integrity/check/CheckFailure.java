package com.curation.integrity.check;

import java.util.List;
import java.util.Objects;

/**
 * One diagnostic produced by a consistency check.
 *
 * @param kind      failure category
 * @param recordIds records involved, possibly empty for structural failures
 * @param message   human-readable description
 */
public record CheckFailure(FailureKind kind, List<String> recordIds, String message) {

    public CheckFailure {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(message, "message is required");
        recordIds = recordIds != null ? List.copyOf(recordIds) : List.of();
    }

    public static CheckFailure of(FailureKind kind, String message, String... recordIds) {
        return new CheckFailure(kind, List.of(recordIds), message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
