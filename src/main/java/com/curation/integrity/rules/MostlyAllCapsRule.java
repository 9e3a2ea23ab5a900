package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.Set;

/**
 * Flags fields whose letters are overwhelmingly uppercase.
 * Short all-caps container titles are left to {@link ContainerTitleAbbreviatedRule}.
 */
public class MostlyAllCapsRule implements FieldRule {

    private static final Set<String> FIELDS = Set.of(
            Record.TITLE, Record.AUTHOR, Record.EDITOR, Record.JOURNAL, Record.BOOKTITLE);

    @Override
    public String getName() {
        return "mostly-all-caps";
    }

    @Override
    public Set<String> fields() {
        return FIELDS;
    }

    @Override
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        String value = record.getField(field);
        if (value != null && (Record.AUTHOR.equals(field) || Record.EDITOR.equals(field))) {
            value = TextStats.withoutNameConnectors(value);
        }
        if (value == null || TextStats.letterCount(value) < 2) {
            return Set.of();
        }
        if (ContainerTitleAbbreviatedRule.isContainerField(field)
                && ContainerTitleAbbreviatedRule.looksAbbreviated(value, settings)) {
            return Set.of();
        }
        return TextStats.upperCaseRatio(value) > settings.getCapsRatioThreshold()
                ? Set.of(DefectCode.MOSTLY_ALL_CAPS)
                : Set.of();
    }
}
