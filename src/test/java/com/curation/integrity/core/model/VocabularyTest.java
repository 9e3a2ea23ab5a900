package com.curation.integrity.core.model;

import com.curation.integrity.core.UnknownVocabularyException;
import com.curation.integrity.rules.DefectCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyTest {

    @ParameterizedTest
    @EnumSource(RecordStatus.class)
    @DisplayName("Statuses parse from their wire value")
    void statusWireValues(RecordStatus status) {
        assertEquals(status, RecordStatus.fromWire(status.getWireValue()));
        assertEquals(status.getWireValue(), status.toString());
    }

    @Test
    @DisplayName("Unknown statuses are rejected")
    void unknownStatus() {
        UnknownVocabularyException e = assertThrows(UnknownVocabularyException.class,
                () -> RecordStatus.fromWire("md_unknown"));
        assertEquals("md_unknown", e.getValue());
        assertEquals("record status", e.getVocabulary());
    }

    @Test
    @DisplayName("Stages follow declaration order")
    void stages() {
        RecordStatus[] values = RecordStatus.values();
        for (int i = 0; i < values.length; i++) {
            assertEquals(i + 1, values[i].getStage());
        }
    }

    @Test
    @DisplayName("Manual intervention statuses")
    void manualIntervention() {
        EnumSet<RecordStatus> manual = EnumSet.noneOf(RecordStatus.class);
        for (RecordStatus status : RecordStatus.values()) {
            if (status.isManualIntervention()) {
                manual.add(status);
            }
        }
        assertEquals(EnumSet.of(RecordStatus.MD_NEEDS_MANUAL_PREPARATION, RecordStatus.MD_NEEDS_MANUAL_DEDUPLICATION,
                RecordStatus.PDF_NEEDS_MANUAL_RETRIEVAL, RecordStatus.PDF_NEEDS_MANUAL_PREPARATION), manual);
    }

    @ParameterizedTest
    @ValueSource(strings = {"article", "ARTICLE", " Article "})
    @DisplayName("Entry types parse case-insensitively")
    void entryTypes(String value) {
        assertEquals(EntryType.ARTICLE, EntryType.fromWire(value));
    }

    @Test
    @DisplayName("Unknown entry types are rejected")
    void unknownEntryType() {
        assertThrows(UnknownVocabularyException.class, () -> EntryType.fromWire("pamphlet"));
        assertThrows(UnknownVocabularyException.class, () -> EntryType.fromWire(null));
    }

    @Test
    @DisplayName("Defect codes round-trip and join into sorted notes")
    void defectCodes() {
        for (DefectCode code : DefectCode.values()) {
            assertTrue(DefectCode.isKnown(code.getWireValue()));
        }
        assertFalse(DefectCode.isKnown("looks-odd"));
        assertThrows(UnknownVocabularyException.class, () -> DefectCode.fromWire("looks-odd"));
        assertEquals("incomplete-field,mostly-all-caps",
                DefectCode.joinNote(List.of(DefectCode.MOSTLY_ALL_CAPS, DefectCode.INCOMPLETE_FIELD,
                        DefectCode.MOSTLY_ALL_CAPS)));
    }
}
