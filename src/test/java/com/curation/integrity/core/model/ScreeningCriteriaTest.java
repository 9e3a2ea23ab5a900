package com.curation.integrity.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScreeningCriteriaTest {

    @Test
    @DisplayName("Parses in and out decisions")
    void parse() {
        ScreeningCriteria criteria = ScreeningCriteria.parse("scope=in; method=out");

        assertEquals(Map.of("scope", ScreeningCriteria.Decision.IN, "method", ScreeningCriteria.Decision.OUT),
                criteria.decisions());
        assertTrue(criteria.hasExclusion());
        assertEquals(List.of(), criteria.malformed());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"NA", "  "})
    @DisplayName("Absent criteria are empty")
    void empty(String raw) {
        ScreeningCriteria criteria = ScreeningCriteria.parse(raw);
        assertTrue(criteria.isEmpty());
        assertFalse(criteria.hasExclusion());
    }

    @Test
    @DisplayName("Malformed entries are kept aside")
    void malformed() {
        ScreeningCriteria criteria = ScreeningCriteria.parse("scope=maybe;=in;method;topic=in");

        assertEquals(List.of("scope=maybe", "=in", "method"), criteria.malformed());
        assertEquals(Map.of("topic", ScreeningCriteria.Decision.IN), criteria.decisions());
    }
}
