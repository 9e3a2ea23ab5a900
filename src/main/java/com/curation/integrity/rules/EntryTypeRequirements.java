package com.curation.integrity.rules;

import com.curation.integrity.core.model.EntryType;
import com.curation.integrity.core.model.Record;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fields each entry type requires and fields that contradict it.
 *
 * <p>{@code year = forthcoming} excuses {@code volume} and {@code number}: they are
 * annotated {@code not-missing} instead of {@code missing}.</p>
 */
public final class EntryTypeRequirements {

    private static final Set<String> FORTHCOMING_EXCUSED = Set.of(Record.VOLUME, Record.NUMBER);

    private static final Map<EntryType, List<String>> REQUIRED = new EnumMap<>(EntryType.class);
    private static final Map<EntryType, Set<String>> INCONSISTENT = new EnumMap<>(EntryType.class);

    static {
        List<String> thesis = List.of("author", "title", "school", "year");
        REQUIRED.put(EntryType.ARTICLE, List.of("author", "title", "journal", "year", "volume", "number"));
        REQUIRED.put(EntryType.INPROCEEDINGS, List.of("author", "title", "booktitle", "year"));
        REQUIRED.put(EntryType.INCOLLECTION, List.of("author", "title", "booktitle", "publisher", "year"));
        REQUIRED.put(EntryType.INBOOK, List.of("author", "title", "chapter", "publisher", "year"));
        REQUIRED.put(EntryType.BOOK, List.of("author", "title", "publisher", "year"));
        REQUIRED.put(EntryType.PROCEEDINGS, List.of("booktitle", "editor", "year"));
        REQUIRED.put(EntryType.PHDTHESIS, thesis);
        REQUIRED.put(EntryType.MASTERSTHESIS, thesis);
        REQUIRED.put(EntryType.BACHELORTHESIS, thesis);
        REQUIRED.put(EntryType.THESIS, thesis);
        REQUIRED.put(EntryType.TECHREPORT, List.of("author", "title", "institution", "year"));
        REQUIRED.put(EntryType.UNPUBLISHED, List.of("author", "title", "year"));
        REQUIRED.put(EntryType.MISC, List.of("author", "title", "year"));
        REQUIRED.put(EntryType.ONLINE, List.of("author", "title", "url"));
        REQUIRED.put(EntryType.SOFTWARE, List.of("author", "title", "url"));

        Set<String> nonSerial = Set.of("volume", "issue", "number", "journal", "booktitle");
        INCONSISTENT.put(EntryType.ARTICLE, Set.of("booktitle"));
        INCONSISTENT.put(EntryType.INPROCEEDINGS, Set.of("issue", "number", "journal"));
        INCONSISTENT.put(EntryType.INBOOK, Set.of("journal"));
        INCONSISTENT.put(EntryType.BOOK, Set.of("volume", "issue", "number", "journal"));
        INCONSISTENT.put(EntryType.PHDTHESIS, nonSerial);
        INCONSISTENT.put(EntryType.MASTERSTHESIS, nonSerial);
        INCONSISTENT.put(EntryType.BACHELORTHESIS, nonSerial);
        INCONSISTENT.put(EntryType.THESIS, nonSerial);
        INCONSISTENT.put(EntryType.TECHREPORT, nonSerial);
        INCONSISTENT.put(EntryType.UNPUBLISHED, nonSerial);
    }

    private EntryTypeRequirements() {
        // Utility class
    }

    public static List<String> requiredFields(EntryType type) {
        return REQUIRED.getOrDefault(type, List.of());
    }

    public static Set<String> inconsistentFields(EntryType type) {
        return INCONSISTENT.getOrDefault(type, Set.of());
    }

    /**
     * True when the field is present but contradicts the record's entry type.
     */
    public static boolean isInconsistent(Record record, String field) {
        if (!record.hasField(field) || isExcused(record, field)) {
            return false;
        }
        return inconsistentFields(record.getEntryType()).contains(field);
    }

    /**
     * True when a missing value for the field is acceptable because the work is forthcoming.
     */
    public static boolean isExcused(Record record, String field) {
        return record.isForthcoming() && FORTHCOMING_EXCUSED.contains(field);
    }
}
