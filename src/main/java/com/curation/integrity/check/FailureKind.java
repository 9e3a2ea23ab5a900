package com.curation.integrity.check;

/**
 * Categories of consistency failures.
 */
public enum FailureKind {
    STRUCTURE,
    DUPLICATE_ID,
    PROPAGATED_ID_CHANGE,
    ORIGIN,
    FIELD_VALUE,
    STATUS_TRANSITION,
    SCREEN_CRITERIA,
    INTERNAL_ERROR
}
