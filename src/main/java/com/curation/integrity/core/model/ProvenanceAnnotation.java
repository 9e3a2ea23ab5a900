package com.curation.integrity.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Per-field quality metadata: which process last touched the field and the
 * comma-joined defect codes found in it. An empty note means the field is clean.
 */
public record ProvenanceAnnotation(String source, String note) {

    public static final String MISSING = "missing";
    public static final String NOT_MISSING = "not-missing";

    public ProvenanceAnnotation {
        Objects.requireNonNull(source, "source is required");
        note = note != null ? note : "";
    }

    public static ProvenanceAnnotation clean(String source) {
        return new ProvenanceAnnotation(source, "");
    }

    public boolean isClean() {
        return note.isEmpty();
    }

    public boolean isMissing() {
        return MISSING.equals(note);
    }

    public boolean isNotMissing() {
        return NOT_MISSING.equals(note);
    }

    /**
     * Splits the note into its individual codes.
     */
    public List<String> notes() {
        if (note.isEmpty()) {
            return List.of();
        }
        List<String> codes = new ArrayList<>();
        for (String code : Arrays.asList(note.split(","))) {
            String trimmed = code.trim();
            if (!trimmed.isEmpty()) {
                codes.add(trimmed);
            }
        }
        return codes;
    }
}
