package com.curation.integrity.check;

import com.curation.integrity.core.model.Record;
import com.curation.integrity.core.model.RecordStatus;
import com.curation.integrity.core.model.Snapshot;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Detects records whose ID changed between snapshots. Records are traced through
 * their origins. A changed ID is accepted when a rename was logged, or when the
 * record was merged into another record that already existed during deduplication.
 */
public class IdImmutabilityCheck implements ConsistencyCheck {

    private static final Set<RecordStatus> MERGEABLE = EnumSet.of(
            RecordStatus.MD_PREPARED, RecordStatus.MD_NEEDS_MANUAL_DEDUPLICATION);

    @Override
    public String getName() {
        return "id-immutability";
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PROPAGATED_ID_CHANGE;
    }

    @Override
    public List<CheckFailure> run(CheckContext context) {
        SnapshotPair pair = context.pair();
        if (!pair.hasPrior()) {
            return List.of();
        }
        Snapshot prior = pair.prior();
        Map<String, Record> priorById = prior.byId();
        Map<String, Record> currentByOrigin = pair.current().byOrigin();

        List<CheckFailure> failures = new ArrayList<>();
        for (Record before : prior.records()) {
            Set<String> newIds = new LinkedHashSet<>();
            for (String origin : before.getOrigins()) {
                Record after = currentByOrigin.get(origin);
                if (after != null && !after.getId().equals(before.getId())) {
                    newIds.add(after.getId());
                }
            }
            for (String newId : newIds) {
                if (pair.isRenamed(before.getId(), newId)) {
                    continue;
                }
                boolean merged = priorById.containsKey(newId) && MERGEABLE.contains(before.getStatus());
                if (!merged) {
                    failures.add(CheckFailure.of(kind(),
                            "ID changed from " + before.getId() + " to " + newId + " without a logged rename",
                            before.getId(), newId));
                }
            }
        }
        return failures;
    }
}
