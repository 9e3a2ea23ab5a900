package com.curation.integrity.state;

import com.curation.integrity.core.IntegrityException;
import com.curation.integrity.core.model.RecordStatus;

/**
 * Thrown when a record would move along an edge the state machine does not allow.
 */
public class StateTransitionException extends IntegrityException {

    private final String recordId;
    private final RecordStatus from;
    private final RecordStatus to;

    public StateTransitionException(String recordId, RecordStatus from, RecordStatus to) {
        this(recordId, from, to, null);
    }

    public StateTransitionException(String recordId, RecordStatus from, RecordStatus to, String detail) {
        super("Illegal status transition for record '" + recordId + "': " + from + " -> " + to
                + (detail != null ? " (" + detail + ")" : ""));
        this.recordId = recordId;
        this.from = from;
        this.to = to;
    }

    public String getRecordId() {
        return recordId;
    }

    public RecordStatus getFrom() {
        return from;
    }

    public RecordStatus getTo() {
        return to;
    }
}
