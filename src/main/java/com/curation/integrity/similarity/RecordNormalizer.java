package com.curation.integrity.similarity;

import com.curation.integrity.core.model.Record;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces record fields to comparable strings: lowercase, no accents, no punctuation,
 * single spaces. Author lists become their sorted surnames.
 */
final class RecordNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern NAME_SEPARATOR = Pattern.compile("\\s+and\\s+", Pattern.CASE_INSENSITIVE);

    private RecordNormalizer() {
        // Utility class
    }

    static String text(String value) {
        if (value == null) {
            return null;
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        String plain = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return NON_ALPHANUMERIC.matcher(plain.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    static String title(Record record) {
        return blankToNull(text(record.getField(Record.TITLE)));
    }

    static String container(Record record) {
        return blankToNull(text(record.containerTitle()));
    }

    static String year(Record record) {
        String year = record.getField(Record.YEAR);
        return year != null ? blankToNull(year.trim()) : null;
    }

    /**
     * Surnames of all authors, sorted, so that author order does not matter.
     */
    static String authors(Record record) {
        String author = record.getField(Record.AUTHOR);
        if (author == null || author.isBlank()) {
            return null;
        }
        List<String> surnames = new ArrayList<>();
        for (String name : NAME_SEPARATOR.split(author.trim())) {
            int comma = name.indexOf(',');
            String surname;
            if (comma >= 0) {
                surname = name.substring(0, comma);
            } else {
                String[] tokens = name.trim().split("\\s+");
                surname = tokens[tokens.length - 1];
            }
            String normalized = text(surname);
            if (!normalized.isEmpty()) {
                surnames.add(normalized.replace(" ", ""));
            }
        }
        Collections.sort(surnames);
        return blankToNull(String.join(" ", surnames));
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
