package com.curation.integrity.check;

import com.curation.integrity.core.model.Record;
import com.curation.integrity.state.StateTransitionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Verifies that every record whose status changed between snapshots followed a
 * legal edge, unless a manual override was registered for it.
 */
public class StatusTransitionCheck implements ConsistencyCheck {

    @Override
    public String getName() {
        return "status-transition";
    }

    @Override
    public FailureKind kind() {
        return FailureKind.STATUS_TRANSITION;
    }

    /**
     * @throws StateTransitionException on the first violation when the checker runs in strict mode
     */
    @Override
    public List<CheckFailure> run(CheckContext context) {
        SnapshotPair pair = context.pair();
        if (!pair.hasPrior()) {
            return List.of();
        }
        Map<String, Record> priorById = pair.prior().byId();
        List<CheckFailure> failures = new ArrayList<>();
        for (Record after : pair.current().byId().values()) {
            Record before = priorById.get(after.getId());
            if (before == null || before.getStatus() == after.getStatus()) {
                continue;
            }
            if (context.stateMachine().isValidTransition(before.getStatus(), after.getStatus())
                    || pair.hasOverride(after.getId())) {
                continue;
            }
            if (context.settings().isStrict()) {
                throw new StateTransitionException(after.getId(), before.getStatus(), after.getStatus());
            }
            failures.add(CheckFailure.of(kind(), "Record " + after.getId() + " moved from " + before.getStatus()
                    + " to " + after.getStatus() + ", which is not a legal transition", after.getId()));
        }
        return failures;
    }
}
