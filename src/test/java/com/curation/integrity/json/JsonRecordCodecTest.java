package com.curation.integrity.json;

import com.curation.integrity.TestRecords;
import com.curation.integrity.core.IntegrityException;
import com.curation.integrity.core.UnknownVocabularyException;
import com.curation.integrity.core.model.EntryType;
import com.curation.integrity.core.model.ProvenanceAnnotation;
import com.curation.integrity.core.model.Record;
import com.curation.integrity.core.model.RecordStatus;
import com.curation.integrity.core.model.Snapshot;
import com.curation.integrity.quality.QualityModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonRecordCodecTest {

    private JsonRecordCodec codec;

    @BeforeEach
    void setUp() {
        codec = new JsonRecordCodec();
    }

    @Test
    @DisplayName("Should read records using wire keys")
    void read() {
        String json = """
                [
                  {
                    "ID": "Rai2021",
                    "ENTRYTYPE": "article",
                    "colrev_status": "md_prepared",
                    "colrev_origin": ["scopus.bib/0001", "crossref.bib/17"],
                    "colrev_masterdata_provenance": {
                      "title": {"source": "quality_model", "note": ""},
                      "volume": {"source": "quality_model", "note": "missing"}
                    },
                    "title": "Generative AI",
                    "year": 2021
                  }
                ]
                """;

        Snapshot snapshot = codec.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, snapshot.size());
        Record record = snapshot.records().get(0);
        assertEquals("Rai2021", record.getId());
        assertEquals(EntryType.ARTICLE, record.getEntryType());
        assertEquals(RecordStatus.MD_PREPARED, record.getStatus());
        assertEquals(List.of("scopus.bib/0001", "crossref.bib/17"), record.getOrigins());
        assertEquals("2021", record.getField(Record.YEAR));
        assertEquals(ProvenanceAnnotation.MISSING, record.note(Record.VOLUME));
        assertFalse(record.hasField(Record.STATUS));
    }

    @Test
    @DisplayName("Should accept semicolon-separated origin strings")
    void legacyOrigins() {
        Snapshot snapshot = codec.readString(
                "[{\"ID\": \"A\", \"ENTRYTYPE\": \"misc\", \"colrev_origin\": \"a.bib/1;b.bib/2\"}]");
        assertEquals(List.of("a.bib/1", "b.bib/2"), snapshot.records().get(0).getOrigins());
    }

    @Test
    @DisplayName("Written records read back unchanged")
    void writeThenRead() {
        Record record = QualityModel.defaults().evaluate(TestRecords.article("Rai2021").field(Record.AUTHOR, "RAI").build());
        Snapshot snapshot = Snapshot.of(record);

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        codec.write(snapshot, output);
        Snapshot read = codec.read(new ByteArrayInputStream(output.toByteArray()));

        assertEquals(snapshot.records(), read.records());
    }

    @Test
    @DisplayName("Should write records under their wire keys")
    void writeString() {
        Record record = Record.builder()
                .id("Smith2020")
                .entryType(EntryType.MISC)
                .status(RecordStatus.MD_IMPORTED)
                .origin("scopus.bib/0007")
                .field(Record.TITLE, "Platform ecosystems")
                .build();

        String json = codec.writeString(Snapshot.of(record));

        assertTrue(json.contains("\"ID\" : \"Smith2020\""), json);
        assertTrue(json.contains("\"ENTRYTYPE\" : \"misc\""), json);
        assertTrue(json.contains("\"colrev_status\" : \"md_imported\""), json);
        assertTrue(json.contains("\"scopus.bib/0007\""), json);
        assertEquals(List.of(record), codec.readString(json).records());
    }

    @Test
    @DisplayName("Unknown vocabulary is fatal")
    void unknownVocabulary() {
        assertThrows(UnknownVocabularyException.class, () -> codec.readString(
                "[{\"ID\": \"A\", \"ENTRYTYPE\": \"misc\", \"colrev_status\": \"md_lost\"}]"));
        assertThrows(UnknownVocabularyException.class, () -> codec.readString(
                "[{\"ID\": \"A\", \"ENTRYTYPE\": \"pamphlet\"}]"));
    }

    @Test
    @DisplayName("Malformed input is rejected")
    void malformed() {
        assertThrows(IntegrityException.class, () -> codec.readString("[{\"ID\": "));
        assertThrows(IntegrityException.class, () -> codec.readString("{\"ID\": \"A\"}"));
        assertThrows(IntegrityException.class, () -> codec.readString("[{\"title\": \"no id\"}]"));
    }

    @Test
    @DisplayName("Empty input is an empty snapshot")
    void empty() {
        assertTrue(codec.readString("[]").isEmpty());
    }
}
