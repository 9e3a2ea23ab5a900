package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags container fields that mix venue kinds, e.g. {@code "A Journal, Conference"},
 * a journal field naming a conference, or a booktitle naming a journal.
 */
public class InconsistentContentRule implements FieldRule {

    private static final Set<String> FIELDS = Set.of(Record.JOURNAL, Record.BOOKTITLE);

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[,;|/]");
    private static final Pattern JOURNAL_TERM = Pattern.compile("\\b(journal|transactions)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONFERENCE_TERM = Pattern.compile(
            "\\b(conference|proceedings|workshop|symposium)\\b", Pattern.CASE_INSENSITIVE);

    enum VenueKind { JOURNAL, CONFERENCE }

    @Override
    public String getName() {
        return "inconsistent-content";
    }

    @Override
    public Set<String> fields() {
        return FIELDS;
    }

    @Override
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        String value = record.getField(field);
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        Set<VenueKind> kinds = EnumSet.noneOf(VenueKind.class);
        for (String segment : SEGMENT_SEPARATOR.split(value)) {
            VenueKind kind = classify(segment);
            if (kind != null) {
                kinds.add(kind);
            }
        }
        boolean inconsistent = kinds.size() > 1
                || (Record.JOURNAL.equals(field) && kinds.equals(EnumSet.of(VenueKind.CONFERENCE)))
                || (Record.BOOKTITLE.equals(field) && kinds.equals(EnumSet.of(VenueKind.JOURNAL)));
        return inconsistent ? Set.of(DefectCode.INCONSISTENT_CONTENT) : Set.of();
    }

    /**
     * Returns the venue kind a segment names, or null when it names neither or both.
     */
    static VenueKind classify(String segment) {
        boolean journal = JOURNAL_TERM.matcher(segment).find();
        boolean conference = CONFERENCE_TERM.matcher(segment).find();
        if (journal == conference) {
            return null;
        }
        return journal ? VenueKind.JOURNAL : VenueKind.CONFERENCE;
    }
}
