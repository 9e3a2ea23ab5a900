package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.Set;

/**
 * Flags values that were cut off: trailing separators and "et al." in name lists,
 * ellipses in titles.
 */
public class IncompleteFieldRule implements FieldRule {

    private static final Set<String> FIELDS = Set.of(
            Record.AUTHOR, Record.EDITOR, Record.TITLE, Record.JOURNAL, Record.BOOKTITLE);

    @Override
    public String getName() {
        return "incomplete-field";
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
        String trimmed = value.trim();
        boolean incomplete = Record.AUTHOR.equals(field) || Record.EDITOR.equals(field)
                ? isTruncatedNameList(trimmed)
                : trimmed.endsWith("...") || trimmed.endsWith("…");
        return incomplete ? Set.of(DefectCode.INCOMPLETE_FIELD) : Set.of();
    }

    private static boolean isTruncatedNameList(String value) {
        return value.endsWith(",")
                || value.endsWith(" and")
                || value.endsWith("et al.")
                || value.endsWith("et al");
    }
}
