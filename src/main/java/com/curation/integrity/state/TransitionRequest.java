package com.curation.integrity.state;

import java.util.Objects;

/**
 * How a status change was requested: by a pipeline operation, which must follow a
 * legal edge, or by an explicit manual override, which is audited.
 */
public interface TransitionRequest {

    static TransitionRequest automatic(Operation operation) {
        return new Automatic(operation);
    }

    static TransitionRequest override(String actor, String reason) {
        return new ManualOverride(actor, reason);
    }

    record Automatic(Operation operation) implements TransitionRequest {
        public Automatic {
            Objects.requireNonNull(operation, "operation is required");
        }
    }

    record ManualOverride(String actor, String reason) implements TransitionRequest {
        public ManualOverride {
            if (actor == null || actor.isBlank()) {
                throw new IllegalArgumentException("actor is required for a manual override");
            }
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason is required for a manual override");
            }
        }
    }
}
