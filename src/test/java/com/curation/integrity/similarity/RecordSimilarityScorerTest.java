package com.curation.integrity.similarity;

import com.curation.integrity.TestRecords;
import com.curation.integrity.core.model.EntryType;
import com.curation.integrity.core.model.Record;
import com.curation.integrity.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

class RecordSimilarityScorerTest {

    private RecordSimilarityScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new RecordSimilarityScorer();
    }

    @Test
    @DisplayName("Identical records score 1.0")
    void identity() {
        Record a = TestRecords.article("Rai2021").build();
        Record b = TestRecords.article("Rai2021b").origin("other.bib/7").build();
        assertEquals(1.0, scorer.similarity(a, b), 1e-9);
    }

    @Test
    @DisplayName("Formatting differences do not matter")
    void normalization() {
        Record a = TestRecords.article("A").build();
        Record b = TestRecords.article("B")
                .field(Record.TITLE, "GENERATIVE AI in Information-Systems Research!")
                .field(Record.AUTHOR, "Straub, Detmar and Rai, Arun")
                .field(Record.JOURNAL, "MIS quarterly")
                .build();
        assertEquals(1.0, scorer.similarity(a, b), 1e-9);
    }

    @Test
    @DisplayName("Accents are ignored")
    void accents() {
        Record a = TestRecords.article("A").field(Record.AUTHOR, "Mourato, Inês").build();
        Record b = TestRecords.article("B").field(Record.AUTHOR, "Mourato, Ines").build();
        assertEquals(1.0, scorer.similarity(a, b), 1e-9);
    }

    @Test
    @DisplayName("Disjoint records score near 0.0")
    void disjoint() {
        Record a = TestRecords.article("A").build();
        Record b = Record.builder()
                .id("B")
                .entryType(EntryType.ARTICLE)
                .field(Record.AUTHOR, "Zhou, Qing")
                .field(Record.TITLE, "Quantum lattice cryptography benchmarks")
                .field(Record.JOURNAL, "Physical Review Letters")
                .field(Record.YEAR, "1987")
                .build();
        assertTrue(scorer.similarity(a, b) < 0.4, "Expected low score, got " + scorer.similarity(a, b));
    }

    @Test
    @DisplayName("Similarity is symmetric")
    void symmetric() {
        Record a = TestRecords.article("A").build();
        Record b = TestRecords.article("B")
                .field(Record.TITLE, "Generative artificial intelligence in IS research")
                .field(Record.YEAR, "2022")
                .build();
        assertEquals(scorer.similarity(a, b), scorer.similarity(b, a), 1e-12);
    }

    @Test
    @DisplayName("Near duplicates score above the default duplicate threshold")
    void nearDuplicate() {
        Record a = TestRecords.article("A").build();
        Record b = TestRecords.article("B")
                .field(Record.TITLE, "Generative AI in information system research")
                .build();
        assertTrue(scorer.similarity(a, b) >= 0.9);
    }

    @Nested
    @DisplayName("Absent fields")
    class AbsentFields {

        @Test
        @DisplayName("Fields absent from both records are skipped")
        void skipped() {
            Record a = Record.builder().id("A").entryType(EntryType.MISC).field(Record.TITLE, "Same title").build();
            Record b = Record.builder().id("B").entryType(EntryType.MISC).field(Record.TITLE, "Same title").build();

            RecordSimilarityScorer.SimilarityBreakdown breakdown = scorer.breakdown(a, b);

            assertEquals(1.0, breakdown.score(), 1e-9);
            assertEquals(1, breakdown.fieldScores().size());
        }

        @Test
        @DisplayName("A field present in only one record scores 0.0")
        void oneSided() {
            Record a = TestRecords.article("A").build();
            Record b = TestRecords.article("B").build();
            b.removeField(Record.YEAR);

            RecordSimilarityScorer.SimilarityBreakdown breakdown = scorer.breakdown(a, b);

            assertEquals(0.0, breakdown.fieldScores().get(RecordSimilarityScorer.YEAR));
            assertEquals(0.9, breakdown.score(), 1e-9);
        }

        @Test
        @DisplayName("Records without comparable fields fall back to equality")
        void nothingComparable() {
            Record a = Record.builder().id("A").entryType(EntryType.MISC).field("url", "https://x.org").build();
            Record b = Record.builder().id("B").entryType(EntryType.MISC).field("url", "https://x.org").build();
            Record c = Record.builder().id("C").entryType(EntryType.MISC).field("url", "https://y.org").build();

            assertEquals(1.0, scorer.similarity(a, b));
            assertEquals(0.0, scorer.similarity(a, c));
        }
    }

    @Test
    @DisplayName("Scores are reported to metrics")
    void metrics() {
        MetricsService metrics = mock(MetricsService.class);
        RecordSimilarityScorer instrumented = new RecordSimilarityScorer(FieldWeights.defaultWeights(), metrics);

        instrumented.similarity(TestRecords.article("A").build(), TestRecords.article("B").build());

        verify(metrics).recordSimilarityScore(anyDouble());
    }

    @Test
    @DisplayName("Field weights must sum to 1.0")
    void invalidWeights() {
        assertThrows(IllegalArgumentException.class, () -> new FieldWeights(0.5, 0.5, 0.5, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new FieldWeights(-0.1, 0.6, 0.3, 0.2));
    }
}
