package com.curation.integrity.check;

import com.curation.integrity.core.model.ProvenanceAnnotation;
import com.curation.integrity.core.model.Record;
import com.curation.integrity.rules.DefectCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates masterdata provenance: every present bibliographic field is annotated,
 * annotations of absent fields only say missing or not-missing, every note code is
 * part of the defect vocabulary, and every annotation names its source.
 */
public class ProvenanceIntegrityCheck implements ConsistencyCheck {

    @Override
    public String getName() {
        return "provenance-integrity";
    }

    @Override
    public FailureKind kind() {
        return FailureKind.FIELD_VALUE;
    }

    @Override
    public List<CheckFailure> run(CheckContext context) {
        List<CheckFailure> failures = new ArrayList<>();
        for (Record record : context.pair().current().records()) {
            String id = record.getId();
            Map<String, ProvenanceAnnotation> provenance = record.getMasterdataProvenance();

            for (String field : record.bibliographicFields()) {
                if (!provenance.containsKey(field)) {
                    failures.add(CheckFailure.of(kind(), "Record " + id + " has no provenance for field " + field, id));
                }
            }

            for (Map.Entry<String, ProvenanceAnnotation> entry : provenance.entrySet()) {
                String field = entry.getKey();
                ProvenanceAnnotation annotation = entry.getValue();
                if (annotation.source().isBlank()) {
                    failures.add(CheckFailure.of(kind(),
                            "Record " + id + " has provenance without source for field " + field, id));
                }
                if (!record.hasField(field) && !annotation.isMissing() && !annotation.isNotMissing()) {
                    failures.add(CheckFailure.of(kind(), "Record " + id + " annotates absent field " + field
                            + " with '" + annotation.note() + "'", id));
                }
                for (String code : annotation.notes()) {
                    if (!DefectCode.isKnown(code)) {
                        failures.add(CheckFailure.of(kind(), "Record " + id + " uses unknown defect code '" + code
                                + "' for field " + field, id));
                    }
                }
            }
        }
        return failures;
    }
}
