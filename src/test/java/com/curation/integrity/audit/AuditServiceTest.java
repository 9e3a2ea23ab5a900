package com.curation.integrity.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.curation.integrity.core.model.RecordStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    @Test
    @DisplayName("Should record and filter entries")
    void recordAndFilter() {
        auditService.recordTransition("A", "pipeline", MD_PREPARED, MD_PROCESSED, Map.of("operation", "dedupe"));
        auditService.recordOverride("B", "alice", REV_INCLUDED, MD_PREPARED, Map.of("reason", "fix"));
        auditService.recordCheckRun("consistency-checker", null);

        assertEquals(3, auditService.size());
        assertEquals(1, auditService.getEntriesForRecord("A").size());
        List<AuditEntry> overrides = auditService.getEntriesByAction(AuditAction.MANUAL_STATUS_OVERRIDE);
        assertEquals(1, overrides.size());
        assertTrue(overrides.get(0).isManual());
        assertEquals("alice", overrides.get(0).actor());
        assertEquals(REV_INCLUDED, overrides.get(0).fromStatus());
        assertEquals(Map.of(), auditService.getEntriesByAction(AuditAction.CONSISTENCY_CHECKED).get(0).details());
    }

    @Test
    @DisplayName("Status history follows the recorded transitions")
    void statusHistory() {
        auditService.recordTransition("A", "pipeline", MD_IMPORTED, MD_PREPARED, Map.of());
        auditService.recordCheckRun("consistency-checker", Map.of());
        auditService.recordTransition("A", "pipeline", MD_PREPARED, MD_PROCESSED, Map.of());

        assertEquals(List.of(MD_IMPORTED, MD_PREPARED, MD_PROCESSED), auditService.statusHistory("A"));
        assertTrue(auditService.statusHistory("B").isEmpty());
    }

    @Test
    @DisplayName("Returned entry lists are snapshots")
    void immutableView() {
        auditService.recordTransition("A", "pipeline", MD_IMPORTED, MD_PREPARED, Map.of());
        List<AuditEntry> entries = auditService.getAllEntries();
        assertThrows(UnsupportedOperationException.class, () -> entries.add(entries.get(0)));
    }

    @Test
    @DisplayName("Status changes need a record and both statuses; checker runs have none")
    void entryShape() {
        assertThrows(NullPointerException.class, () -> AuditEntry.statusChange(
                AuditAction.STATUS_TRANSITION, null, "pipeline", MD_IMPORTED, MD_PREPARED, Map.of()));
        assertThrows(NullPointerException.class, () -> AuditEntry.statusChange(
                AuditAction.STATUS_TRANSITION, "A", "pipeline", MD_IMPORTED, null, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> AuditEntry.statusChange(
                AuditAction.CONSISTENCY_CHECKED, "A", "pipeline", MD_IMPORTED, MD_PREPARED, Map.of()));
    }

    @Test
    @DisplayName("Concurrent appends are all kept")
    void concurrentAppends() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            String id = "R" + i;
            executor.submit(() -> auditService.recordTransition(id, "pipeline", MD_IMPORTED, MD_PREPARED, Map.of()));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(200, auditService.size());
    }
}
