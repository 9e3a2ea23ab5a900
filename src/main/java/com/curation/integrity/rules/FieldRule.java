package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.Set;

/**
 * A stateless defect detector for one semantic concern.
 *
 * <p>Implementations read bibliographic fields only (never previous notes) and must not
 * throw on malformed input: a value they cannot interpret contributes no defect.</p>
 */
public interface FieldRule {

    /**
     * Unique rule name, used for logging and registry lookup.
     */
    String getName();

    /**
     * Fields this rule inspects.
     */
    Set<String> fields();

    /**
     * Checks one field of the record.
     *
     * @return the defects found, empty when the field is clean or absent
     */
    Set<DefectCode> check(String field, Record record, RuleSettings settings);

    default boolean appliesTo(String field) {
        return fields().contains(field);
    }
}
