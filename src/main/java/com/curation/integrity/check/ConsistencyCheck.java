package com.curation.integrity.check;

import java.util.List;

/**
 * A single consistency rule over a pair of snapshots.
 * Implementations must not mutate the records they inspect.
 */
public interface ConsistencyCheck {

    String getName();

    FailureKind kind();

    /**
     * Runs the check and returns every failure found, in discovery order.
     */
    List<CheckFailure> run(CheckContext context);
}
