package com.curation.integrity.state;

import com.curation.integrity.TestRecords;
import com.curation.integrity.audit.AuditAction;
import com.curation.integrity.audit.AuditEntry;
import com.curation.integrity.audit.AuditService;
import com.curation.integrity.core.model.Record;
import com.curation.integrity.core.model.RecordStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.curation.integrity.core.model.RecordStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class RecordStateMachineTest {

    private AuditService auditService;
    private RecordStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
        stateMachine = new RecordStateMachine(auditService);
    }

    @Nested
    @DisplayName("Transition table")
    class TransitionTable {

        @ParameterizedTest(name = "{0} -> {1} via {2}")
        @CsvSource({
                "md_retrieved,md_imported,LOAD",
                "md_imported,md_needs_manual_preparation,PREP",
                "md_imported,md_prepared,PREP",
                "md_needs_manual_preparation,md_prepared,PREP",
                "md_prepared,md_needs_manual_preparation,PREP_MAN",
                "md_prepared,md_needs_manual_deduplication,DEDUPE",
                "md_prepared,md_processed,DEDUPE",
                "md_needs_manual_deduplication,md_processed,DEDUPE_MAN",
                "md_processed,md_needs_manual_deduplication,DEDUPE_MAN",
                "md_processed,rev_prescreen_excluded,PRESCREEN",
                "md_processed,rev_prescreen_included,PRESCREEN",
                "rev_prescreen_included,pdf_imported,PDF_GET",
                "rev_prescreen_included,pdf_needs_manual_retrieval,PDF_GET",
                "pdf_needs_manual_retrieval,pdf_imported,PDF_GET_MAN",
                "pdf_needs_manual_retrieval,pdf_not_available,PDF_GET_MAN",
                "pdf_imported,pdf_needs_manual_retrieval,PDF_GET_MAN",
                "pdf_imported,pdf_needs_manual_preparation,PDF_PREP",
                "pdf_imported,pdf_prepared,PDF_PREP",
                "pdf_needs_manual_preparation,pdf_prepared,PDF_PREP_MAN",
                "pdf_prepared,pdf_needs_manual_preparation,PDF_PREP_MAN",
                "pdf_prepared,rev_excluded,SCREEN",
                "pdf_prepared,rev_included,SCREEN",
                "rev_included,rev_synthesized,DATA"
        })
        void legalEdges(String from, String to, Operation operation) {
            RecordStatus source = RecordStatus.fromWire(from);
            RecordStatus target = RecordStatus.fromWire(to);
            assertTrue(stateMachine.isValidTransition(source, target));
            assertEquals(operation, stateMachine.operationFor(source, target).orElseThrow());
            assertTrue(stateMachine.statesAfter(operation).contains(target));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "rev_included,md_prepared",
                "md_retrieved,md_prepared",
                "rev_prescreen_excluded,rev_prescreen_included",
                "rev_synthesized,rev_included",
                "pdf_prepared,pdf_imported",
                "md_processed,md_prepared"
        })
        void illegalEdges(String from, String to) {
            RecordStatus source = RecordStatus.fromWire(from);
            RecordStatus target = RecordStatus.fromWire(to);
            assertFalse(stateMachine.isValidTransition(source, target));
            assertTrue(stateMachine.operationFor(source, target).isEmpty());
        }

        @ParameterizedTest
        @EnumSource(RecordStatus.class)
        @DisplayName("Every status has an answer and never loops to itself")
        void total(RecordStatus status) {
            for (RecordStatus target : RecordStatus.values()) {
                boolean valid = stateMachine.isValidTransition(status, target);
                assertEquals(valid, stateMachine.allowedNext(status).contains(target));
            }
            assertFalse(stateMachine.isValidTransition(status, status));
        }

        @Test
        @DisplayName("The forward pipeline never moves back except into a needs-manual status")
        void backEdgesOnlyIntoManualStates() {
            for (RecordStatus from : RecordStatus.values()) {
                for (RecordStatus to : stateMachine.allowedNext(from)) {
                    if (to.getStage() < from.getStage()) {
                        assertTrue(to.isManualIntervention(), from + " -> " + to);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Terminal statuses have no successor")
    void terminalStates() {
        Set<RecordStatus> terminal = EnumSet.noneOf(RecordStatus.class);
        for (RecordStatus status : RecordStatus.values()) {
            if (stateMachine.isTerminal(status)) {
                terminal.add(status);
            }
        }
        assertEquals(EnumSet.of(REV_PRESCREEN_EXCLUDED, PDF_NOT_AVAILABLE, REV_EXCLUDED, REV_SYNTHESIZED), terminal);
    }

    @Test
    @DisplayName("Excluded statuses leave the pipeline")
    void excluded() {
        assertTrue(stateMachine.isExcludedFromPipeline(REV_PRESCREEN_EXCLUDED));
        assertTrue(stateMachine.isExcludedFromPipeline(PDF_NOT_AVAILABLE));
        assertTrue(stateMachine.isExcludedFromPipeline(REV_EXCLUDED));
        assertFalse(stateMachine.isExcludedFromPipeline(REV_SYNTHESIZED));
    }

    @Test
    @DisplayName("Initial statuses")
    void initialStates() {
        assertEquals(EnumSet.of(MD_RETRIEVED, MD_IMPORTED), stateMachine.initialStates());
    }

    @Nested
    @DisplayName("Applying transitions")
    class Applying {

        @Test
        @DisplayName("Automatic transitions along legal edges are applied and audited")
        void automatic() {
            Record record = TestRecords.article("Rai2021").status(MD_PREPARED).build();

            stateMachine.transition(record, MD_PROCESSED, TransitionRequest.automatic(Operation.DEDUPE));

            assertEquals(MD_PROCESSED, record.getStatus());
            List<AuditEntry> entries = auditService.getEntriesByAction(AuditAction.STATUS_TRANSITION);
            assertEquals(1, entries.size());
            assertEquals("dedupe", entries.get(0).details().get("operation"));
            assertEquals(MD_PREPARED, entries.get(0).fromStatus());
            assertEquals(MD_PROCESSED, entries.get(0).toStatus());
        }

        @Test
        @DisplayName("Illegal automatic transitions are rejected and leave the record untouched")
        void illegal() {
            Record record = TestRecords.article("Rai2021").status(REV_INCLUDED).build();

            StateTransitionException e = assertThrows(StateTransitionException.class,
                    () -> stateMachine.transition(record, MD_PREPARED, TransitionRequest.automatic(Operation.PREP)));

            assertEquals("Rai2021", e.getRecordId());
            assertEquals(REV_INCLUDED, e.getFrom());
            assertEquals(MD_PREPARED, e.getTo());
            assertEquals(REV_INCLUDED, record.getStatus());
            assertEquals(0, auditService.size());
        }

        @Test
        @DisplayName("An operation that does not drive the edge is rejected")
        void wrongOperation() {
            Record record = TestRecords.article("Rai2021").status(MD_PREPARED).build();

            assertThrows(StateTransitionException.class,
                    () -> stateMachine.transition(record, MD_PROCESSED, TransitionRequest.automatic(Operation.SCREEN)));
        }

        @Test
        @DisplayName("Manual overrides may jump and are audited")
        void override() {
            Record record = TestRecords.article("Rai2021").status(REV_INCLUDED).build();

            stateMachine.transition(record, MD_PREPARED, TransitionRequest.override("alice", "re-open for correction"));

            assertEquals(MD_PREPARED, record.getStatus());
            List<AuditEntry> entries = auditService.getEntriesByAction(AuditAction.MANUAL_STATUS_OVERRIDE);
            assertEquals(1, entries.size());
            assertEquals("alice", entries.get(0).actor());
            assertEquals("Rai2021", entries.get(0).recordId());
            assertEquals(false, entries.get(0).details().get("legal"));
            assertEquals(List.of(REV_INCLUDED, MD_PREPARED), auditService.statusHistory("Rai2021"));
        }

        @Test
        @DisplayName("Overrides need an actor and a reason")
        void overrideValidation() {
            assertThrows(IllegalArgumentException.class, () -> TransitionRequest.override(" ", "reason"));
            assertThrows(IllegalArgumentException.class, () -> TransitionRequest.override("alice", null));
        }

        @Test
        @DisplayName("Moving to the current status is a no-op")
        void noop() {
            Record record = TestRecords.article("Rai2021").status(MD_PREPARED).build();

            stateMachine.transition(record, MD_PREPARED, TransitionRequest.automatic(Operation.PREP));

            assertEquals(0, auditService.size());
        }
    }
}
