package com.curation.integrity.state;

/**
 * Pipeline operations that move records between statuses.
 */
public enum Operation {
    LOAD("load"),
    PREP("prep"),
    PREP_MAN("prep_man"),
    DEDUPE("dedupe"),
    DEDUPE_MAN("dedupe_man"),
    PRESCREEN("prescreen"),
    PDF_GET("pdf_get"),
    PDF_GET_MAN("pdf_get_man"),
    PDF_PREP("pdf_prep"),
    PDF_PREP_MAN("pdf_prep_man"),
    SCREEN("screen"),
    DATA("data");

    private final String label;

    Operation(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
