package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.Set;

/**
 * A thesis has exactly one author.
 */
public class ThesisMultipleAuthorsRule implements FieldRule {

    @Override
    public String getName() {
        return "thesis-multiple-authors";
    }

    @Override
    public Set<String> fields() {
        return Set.of(Record.AUTHOR);
    }

    @Override
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        String author = record.getField(Record.AUTHOR);
        if (author == null || !record.getEntryType().isThesis()) {
            return Set.of();
        }
        return author.contains(" and ") ? Set.of(DefectCode.THESIS_WITH_MULTIPLE_AUTHORS) : Set.of();
    }
}
