package com.curation.integrity.core.model;

import com.curation.integrity.core.UnknownVocabularyException;

import java.util.Locale;

/**
 * Bibliographic entry types understood by the quality model.
 */
public enum EntryType {
    ARTICLE("article"),
    INPROCEEDINGS("inproceedings"),
    INCOLLECTION("incollection"),
    INBOOK("inbook"),
    BOOK("book"),
    PROCEEDINGS("proceedings"),
    PHDTHESIS("phdthesis"),
    MASTERSTHESIS("mastersthesis"),
    BACHELORTHESIS("bachelorthesis"),
    THESIS("thesis"),
    TECHREPORT("techreport"),
    UNPUBLISHED("unpublished"),
    MISC("misc"),
    ONLINE("online"),
    SOFTWARE("software");

    private final String label;

    EntryType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isThesis() {
        return this == PHDTHESIS || this == MASTERSTHESIS || this == BACHELORTHESIS || this == THESIS;
    }

    /**
     * Parses an {@code ENTRYTYPE} value (case-insensitive).
     *
     * @throws UnknownVocabularyException for entry types outside the vocabulary
     */
    public static EntryType fromWire(String value) {
        if (value != null) {
            String wanted = value.trim().toLowerCase(Locale.ROOT);
            for (EntryType type : values()) {
                if (type.label.equals(wanted)) {
                    return type;
                }
            }
        }
        throw new UnknownVocabularyException("entry type", value);
    }

    @Override
    public String toString() {
        return label;
    }
}
