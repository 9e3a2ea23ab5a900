package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.Set;

/**
 * Heuristic abbreviation detection for journal and booktitle values: a short all-caps
 * single token, unless the value is a known short venue name.
 */
public class ContainerTitleAbbreviatedRule implements FieldRule {

    private static final Set<String> FIELDS = Set.of(Record.JOURNAL, Record.BOOKTITLE);

    @Override
    public String getName() {
        return "container-title-abbreviated";
    }

    @Override
    public Set<String> fields() {
        return FIELDS;
    }

    @Override
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        String value = record.getField(field);
        if (value == null) {
            return Set.of();
        }
        return looksAbbreviated(value, settings) ? Set.of(DefectCode.CONTAINER_TITLE_ABBREVIATED) : Set.of();
    }

    static boolean isContainerField(String field) {
        return FIELDS.contains(field);
    }

    static boolean looksAbbreviated(String value, RuleSettings settings) {
        String trimmed = value.trim();
        return !trimmed.isEmpty()
                && trimmed.length() <= settings.getAbbreviationMaxLength()
                && trimmed.indexOf(' ') < 0
                && TextStats.isUpperCase(trimmed)
                && !settings.isKnownShortContainerName(trimmed);
    }
}
