package com.curation.integrity.check;

import com.curation.integrity.core.model.Record;
import com.curation.integrity.core.model.RecordStatus;
import com.curation.integrity.core.model.ScreeningCriteria;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Verifies screening decisions against the screening status. Excluded records must
 * cite at least one violated criterion, included records none.
 */
public class ScreenCriteriaCheck implements ConsistencyCheck {

    @Override
    public String getName() {
        return "screen-criteria";
    }

    @Override
    public FailureKind kind() {
        return FailureKind.SCREEN_CRITERIA;
    }

    @Override
    public List<CheckFailure> run(CheckContext context) {
        Set<String> known = context.settings().getScreeningCriteria();
        List<CheckFailure> failures = new ArrayList<>();
        for (Record record : context.pair().current().records()) {
            String id = record.getId();
            ScreeningCriteria criteria = ScreeningCriteria.parse(record.getField(Record.SCREENING_CRITERIA));

            for (String entry : criteria.malformed()) {
                failures.add(CheckFailure.of(kind(), "Record " + id + " has malformed screening criterion '" + entry + "'", id));
            }
            if (!known.isEmpty()) {
                for (String name : criteria.decisions().keySet()) {
                    if (!known.contains(name)) {
                        failures.add(CheckFailure.of(kind(), "Record " + id + " cites unknown screening criterion '" + name + "'", id));
                    }
                }
            }
            if (record.getStatus() == RecordStatus.REV_EXCLUDED && !criteria.hasExclusion()) {
                failures.add(CheckFailure.of(kind(), "Record " + id + " is excluded without a violated criterion", id));
            } else if (record.getStatus() == RecordStatus.REV_INCLUDED && criteria.hasExclusion()) {
                failures.add(CheckFailure.of(kind(), "Record " + id + " is included but violates a criterion", id));
            }
        }
        return failures;
    }
}
