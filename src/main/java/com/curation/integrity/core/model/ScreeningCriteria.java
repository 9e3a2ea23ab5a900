package com.curation.integrity.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed form of the {@code screening_criteria} field: {@code name=in;name2=out}.
 */
public final class ScreeningCriteria {

    public enum Decision { IN, OUT }

    private final Map<String, Decision> decisions;
    private final List<String> malformed;

    private ScreeningCriteria(Map<String, Decision> decisions, List<String> malformed) {
        this.decisions = Collections.unmodifiableMap(decisions);
        this.malformed = Collections.unmodifiableList(malformed);
    }

    /**
     * Parses the raw field value. Entries that are not {@code name=in|out} are kept
     * aside as malformed rather than rejected.
     */
    public static ScreeningCriteria parse(String raw) {
        Map<String, Decision> decisions = new LinkedHashMap<>();
        List<String> malformed = new ArrayList<>();
        if (raw == null || raw.isBlank() || "NA".equals(raw.trim())) {
            return new ScreeningCriteria(decisions, malformed);
        }
        for (String entry : raw.split(";")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                malformed.add(trimmed);
                continue;
            }
            String name = trimmed.substring(0, eq).trim();
            String value = trimmed.substring(eq + 1).trim();
            if ("in".equals(value)) {
                decisions.put(name, Decision.IN);
            } else if ("out".equals(value)) {
                decisions.put(name, Decision.OUT);
            } else {
                malformed.add(trimmed);
            }
        }
        return new ScreeningCriteria(decisions, malformed);
    }

    public Map<String, Decision> decisions() {
        return decisions;
    }

    public List<String> malformed() {
        return malformed;
    }

    public boolean isEmpty() {
        return decisions.isEmpty();
    }

    public boolean hasExclusion() {
        return decisions.containsValue(Decision.OUT);
    }
}
