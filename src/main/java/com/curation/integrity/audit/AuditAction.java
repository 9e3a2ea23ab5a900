package com.curation.integrity.audit;

/**
 * Types of auditable actions on records.
 */
public enum AuditAction {
    STATUS_TRANSITION,
    MANUAL_STATUS_OVERRIDE,
    CONSISTENCY_CHECKED;

    public boolean isStatusChange() {
        return this != CONSISTENCY_CHECKED;
    }
}
