package com.curation.integrity.audit;

import com.curation.integrity.core.model.RecordStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One audited event. Status changes carry the record and both statuses;
 * checker runs carry neither.
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String recordId,
        String actor,
        RecordStatus fromStatus,
        RecordStatus toStatus,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (action.isStatusChange()) {
            Objects.requireNonNull(recordId, "recordId is required for " + action);
            Objects.requireNonNull(fromStatus, "fromStatus is required for " + action);
            Objects.requireNonNull(toStatus, "toStatus is required for " + action);
        } else if (recordId != null || fromStatus != null || toStatus != null) {
            throw new IllegalArgumentException(action + " does not refer to a record");
        }
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry statusChange(AuditAction action, String recordId, String actor,
                                          RecordStatus from, RecordStatus to, Map<String, Object> details) {
        return new AuditEntry(UUID.randomUUID().toString(), action, recordId, actor, from, to, details, Instant.now());
    }

    public static AuditEntry checkRun(String actor, Map<String, Object> details) {
        return new AuditEntry(UUID.randomUUID().toString(), AuditAction.CONSISTENCY_CHECKED,
                null, actor, null, null, details, Instant.now());
    }

    public boolean isManual() {
        return action == AuditAction.MANUAL_STATUS_OVERRIDE;
    }
}
