package com.curation.integrity.rules;

import com.curation.integrity.core.UnknownVocabularyException;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Machine-readable defect codes written into {@code colrev_masterdata_provenance[field].note}.
 * Downstream consumers split the note on {@code ','}, so codes must never contain a comma.
 */
public enum DefectCode {
    MISSING("missing"),
    NOT_MISSING("not-missing"),
    INCONSISTENT_WITH_ENTRYTYPE("inconsistent-with-entrytype"),
    MOSTLY_ALL_CAPS("mostly-all-caps"),
    INCOMPLETE_FIELD("incomplete-field"),
    NAME_FORMAT_SEPARATORS("name-format-separators"),
    NAME_FORMAT_TITLES("name-format-titles"),
    NAME_ABBREVIATED("name-abbreviated"),
    ERRONEOUS_TERM_IN_FIELD("erroneous-term-in-field"),
    ERRONEOUS_SYMBOL_IN_FIELD("erroneous-symbol-in-field"),
    ERRONEOUS_TITLE_FIELD("erroneous-title-field"),
    CONTAINER_TITLE_ABBREVIATED("container-title-abbreviated"),
    INCONSISTENT_CONTENT("inconsistent-content"),
    IDENTICAL_VALUES_BETWEEN_TITLE_AND_CONTAINER("identical-values-between-title-and-container"),
    THESIS_WITH_MULTIPLE_AUTHORS("thesis-with-multiple-authors"),
    YEAR_FORMAT("year-format"),
    LANGUAGE_FORMAT_ERROR("language-format-error");

    /**
     * Version of the code vocabulary. Bump when codes are added, renamed or removed.
     */
    public static final String VOCABULARY_VERSION = "1";

    private static final Map<String, DefectCode> BY_WIRE = new HashMap<>();

    static {
        for (DefectCode code : values()) {
            BY_WIRE.put(code.wireValue, code);
        }
    }

    private final String wireValue;

    DefectCode(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static boolean isKnown(String value) {
        return value != null && BY_WIRE.containsKey(value);
    }

    /**
     * @throws UnknownVocabularyException when the code is not part of the vocabulary
     */
    public static DefectCode fromWire(String value) {
        DefectCode code = value != null ? BY_WIRE.get(value.trim()) : null;
        if (code == null) {
            throw new UnknownVocabularyException("defect code", value);
        }
        return code;
    }

    /**
     * Joins codes into the alphabetically sorted, comma-separated note format.
     */
    public static String joinNote(Collection<DefectCode> codes) {
        return codes.stream()
                .map(DefectCode::getWireValue)
                .distinct()
                .sorted()
                .collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
