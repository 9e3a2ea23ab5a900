package com.curation.integrity.check;

import com.curation.integrity.core.model.Record;
import com.curation.integrity.core.model.SearchSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates record origins. Each record needs at least one origin of the form
 * {@code <source filename>/<local id>} pointing to a declared source, no origin may
 * belong to two records, and no origin of the prior snapshot may disappear.
 */
public class OriginIntegrityCheck implements ConsistencyCheck {

    @Override
    public String getName() {
        return "origin-integrity";
    }

    @Override
    public FailureKind kind() {
        return FailureKind.ORIGIN;
    }

    @Override
    public List<CheckFailure> run(CheckContext context) {
        SnapshotPair pair = context.pair();
        Set<String> filenames = new HashSet<>();
        for (SearchSource source : pair.sources()) {
            filenames.add(source.filename());
        }

        List<CheckFailure> failures = new ArrayList<>();
        Map<String, String> owners = new HashMap<>();
        Set<String> currentOrigins = new HashSet<>();
        for (Record record : pair.current().records()) {
            if (record.getOrigins().isEmpty()) {
                failures.add(CheckFailure.of(kind(), "Record " + record.getId() + " has no origin", record.getId()));
                continue;
            }
            for (String origin : record.getOrigins()) {
                currentOrigins.add(origin);
                int slash = origin.lastIndexOf('/');
                if (slash <= 0 || slash == origin.length() - 1) {
                    failures.add(CheckFailure.of(kind(),
                            "Malformed origin '" + origin + "' in record " + record.getId(), record.getId()));
                } else if (!filenames.contains(origin.substring(0, slash))) {
                    failures.add(CheckFailure.of(kind(),
                            "Origin '" + origin + "' in record " + record.getId() + " points to an undeclared source",
                            record.getId()));
                }
                String owner = owners.putIfAbsent(origin, record.getId());
                if (owner != null) {
                    failures.add(CheckFailure.of(kind(),
                            "Origin '" + origin + "' is shared by records " + owner + " and " + record.getId(),
                            owner, record.getId()));
                }
            }
        }

        for (Record before : pair.prior().records()) {
            for (String origin : before.getOrigins()) {
                if (!currentOrigins.contains(origin)) {
                    failures.add(CheckFailure.of(kind(),
                            "Origin '" + origin + "' of record " + before.getId() + " was lost", before.getId()));
                }
            }
        }
        return failures;
    }
}
