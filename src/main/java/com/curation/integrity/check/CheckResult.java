package com.curation.integrity.check;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a consistency checker run. The status is FAIL exactly when there is at
 * least one failure.
 */
public record CheckResult(Status status, List<CheckFailure> failures) {

    public enum Status {
        PASS,
        FAIL
    }

    public CheckResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
        if (status == null) {
            status = failures.isEmpty() ? Status.PASS : Status.FAIL;
        }
        if ((status == Status.PASS) != failures.isEmpty()) {
            throw new IllegalArgumentException("Status " + status + " does not match " + failures.size() + " failures");
        }
    }

    public static CheckResult of(List<CheckFailure> failures) {
        return new CheckResult(null, failures);
    }

    public boolean isPassed() {
        return status == Status.PASS;
    }

    public List<CheckFailure> failuresOf(FailureKind kind) {
        return failures.stream()
                .filter(f -> f.kind() == kind)
                .collect(Collectors.toList());
    }

    /**
     * Itemized diagnostics, one {@code KIND: message} line per failure.
     */
    public String summary() {
        if (failures.isEmpty()) {
            return "Everything ok.";
        }
        return failures.stream()
                .map(CheckFailure::toString)
                .collect(Collectors.joining("\n"));
    }
}
