package com.curation.integrity.core.model;

import java.util.Objects;

/**
 * Logged rename of a record identifier. A rename is the only way a persisted ID may change.
 */
public record IdRename(String fromId, String toId, String actor) {

    public IdRename {
        Objects.requireNonNull(fromId, "fromId is required");
        Objects.requireNonNull(toId, "toId is required");
    }
}
