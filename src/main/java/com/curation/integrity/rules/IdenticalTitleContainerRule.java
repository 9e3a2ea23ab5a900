package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.Set;

/**
 * Flags a title that repeats the journal or booktitle verbatim.
 */
public class IdenticalTitleContainerRule implements FieldRule {

    @Override
    public String getName() {
        return "identical-title-container";
    }

    @Override
    public Set<String> fields() {
        return Set.of(Record.TITLE);
    }

    @Override
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        String title = record.getField(Record.TITLE);
        if (title == null || title.isBlank()) {
            return Set.of();
        }
        String trimmed = title.trim();
        if (sameValue(trimmed, record.getField(Record.JOURNAL))
                || sameValue(trimmed, record.getField(Record.BOOKTITLE))) {
            return Set.of(DefectCode.IDENTICAL_VALUES_BETWEEN_TITLE_AND_CONTAINER);
        }
        return Set.of();
    }

    private static boolean sameValue(String title, String container) {
        return container != null && title.equals(container.trim());
    }
}
