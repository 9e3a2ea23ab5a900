package com.curation.integrity.check;

import com.curation.integrity.core.model.Record;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reports IDs shared by more than one current record. The similarity of the records
 * tells an unmerged duplicate apart from an ID collision between distinct works.
 */
public class DuplicateIdCheck implements ConsistencyCheck {

    @Override
    public String getName() {
        return "duplicate-id";
    }

    @Override
    public FailureKind kind() {
        return FailureKind.DUPLICATE_ID;
    }

    @Override
    public List<CheckFailure> run(CheckContext context) {
        Map<String, List<Record>> byId = new LinkedHashMap<>();
        for (Record record : context.pair().current().records()) {
            byId.computeIfAbsent(record.getId(), k -> new ArrayList<>()).add(record);
        }

        double threshold = context.settings().getDuplicateSimilarityThreshold();
        List<CheckFailure> failures = new ArrayList<>();
        for (Map.Entry<String, List<Record>> entry : byId.entrySet()) {
            List<Record> records = entry.getValue();
            if (records.size() < 2) {
                continue;
            }
            Record first = records.get(0);
            double maxSimilarity = 0.0;
            for (Record other : records.subList(1, records.size())) {
                maxSimilarity = Math.max(maxSimilarity, context.similarityScorer().similarity(first, other));
            }
            String verdict = maxSimilarity >= threshold
                    ? "likely unmerged duplicate"
                    : "ID collision between distinct records";
            failures.add(CheckFailure.of(kind(), String.format(Locale.ROOT,
                    "ID %s used by %d records (similarity %.2f vs threshold %.2f: %s)",
                    entry.getKey(), records.size(), maxSimilarity, threshold, verdict), entry.getKey()));
        }
        return failures;
    }
}
