package com.curation.integrity.core.model;

import com.curation.integrity.core.UnknownVocabularyException;

import java.util.HashMap;
import java.util.Map;

/**
 * Lifecycle status of a record in the curation pipeline.
 * The wire value is what gets persisted in the {@code colrev_status} field.
 * Records are never physically deleted; rejection paths end in an excluded state.
 */
public enum RecordStatus {
    MD_RETRIEVED("md_retrieved", 1),
    MD_IMPORTED("md_imported", 2),
    MD_NEEDS_MANUAL_PREPARATION("md_needs_manual_preparation", 3),
    MD_PREPARED("md_prepared", 4),
    MD_NEEDS_MANUAL_DEDUPLICATION("md_needs_manual_deduplication", 5),
    MD_PROCESSED("md_processed", 6),
    REV_PRESCREEN_EXCLUDED("rev_prescreen_excluded", 7),
    REV_PRESCREEN_INCLUDED("rev_prescreen_included", 8),
    PDF_NEEDS_MANUAL_RETRIEVAL("pdf_needs_manual_retrieval", 9),
    PDF_IMPORTED("pdf_imported", 10),
    PDF_NOT_AVAILABLE("pdf_not_available", 11),
    PDF_NEEDS_MANUAL_PREPARATION("pdf_needs_manual_preparation", 12),
    PDF_PREPARED("pdf_prepared", 13),
    REV_EXCLUDED("rev_excluded", 14),
    REV_INCLUDED("rev_included", 15),
    REV_SYNTHESIZED("rev_synthesized", 16);

    private static final Map<String, RecordStatus> BY_WIRE = new HashMap<>();

    static {
        for (RecordStatus status : values()) {
            BY_WIRE.put(status.wireValue, status);
        }
    }

    private final String wireValue;
    private final int stage;

    RecordStatus(String wireValue, int stage) {
        this.wireValue = wireValue;
        this.stage = stage;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Position in the pipeline vocabulary; higher values are further downstream.
     */
    public int getStage() {
        return stage;
    }

    /**
     * Returns true for the per-stage rejection states.
     */
    public boolean isExcluded() {
        return this == REV_PRESCREEN_EXCLUDED || this == PDF_NOT_AVAILABLE || this == REV_EXCLUDED;
    }

    /**
     * Returns true for states that wait on a human.
     */
    public boolean isManualIntervention() {
        return wireValue.contains("_needs_manual_");
    }

    /**
     * Parses a persisted status string.
     *
     * @throws UnknownVocabularyException if the value is not part of the vocabulary
     */
    public static RecordStatus fromWire(String value) {
        RecordStatus status = value != null ? BY_WIRE.get(value.trim()) : null;
        if (status == null) {
            throw new UnknownVocabularyException("record status", value);
        }
        return status;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
