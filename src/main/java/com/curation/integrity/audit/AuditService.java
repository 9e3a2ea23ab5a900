package com.curation.integrity.audit;

import com.curation.integrity.core.model.RecordStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only log of status transitions, manual overrides and checker runs.
 * Safe for concurrent appends; readers get point-in-time copies.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        if (entry.action().isStatusChange()) {
            log.debug("audit.recorded action={} record={} from={} to={} actor={}",
                    entry.action(), entry.recordId(), entry.fromStatus(), entry.toStatus(), entry.actor());
        } else {
            log.debug("audit.recorded action={} actor={}", entry.action(), entry.actor());
        }
        return entry;
    }

    public AuditEntry recordTransition(String recordId, String actor, RecordStatus from, RecordStatus to,
                                       Map<String, Object> details) {
        return record(AuditEntry.statusChange(AuditAction.STATUS_TRANSITION, recordId, actor, from, to, details));
    }

    public AuditEntry recordOverride(String recordId, String actor, RecordStatus from, RecordStatus to,
                                     Map<String, Object> details) {
        return record(AuditEntry.statusChange(AuditAction.MANUAL_STATUS_OVERRIDE, recordId, actor, from, to, details));
    }

    public AuditEntry recordCheckRun(String actor, Map<String, Object> details) {
        return record(AuditEntry.checkRun(actor, details));
    }

    public List<AuditEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> getEntriesForRecord(String recordId) {
        return entries.stream()
                .filter(e -> recordId.equals(e.recordId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    /**
     * Statuses a record passed through, oldest first, as far as the log knows.
     * Empty when the record never changed status.
     */
    public List<RecordStatus> statusHistory(String recordId) {
        List<RecordStatus> history = new ArrayList<>();
        for (AuditEntry entry : getEntriesForRecord(recordId)) {
            if (history.isEmpty()) {
                history.add(entry.fromStatus());
            }
            history.add(entry.toStatus());
        }
        return history;
    }

    public int size() {
        return entries.size();
    }
}
