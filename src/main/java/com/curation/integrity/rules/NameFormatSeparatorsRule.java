package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks that name lists use {@code Last, First and Last, First}.
 * Accents are stripped first so non-ASCII names are judged by their shape only.
 */
public class NameFormatSeparatorsRule implements FieldRule {

    private static final Set<String> FIELDS = Set.of(Record.AUTHOR, Record.EDITOR);

    private static final Pattern NOISE = Pattern.compile("[^A-Za-z\\s,.'\\-]+");
    private static final Pattern NAME_SEPARATOR = Pattern.compile(" and ");
    private static final Pattern PERSON_NAME = Pattern.compile(
            "^(?:(?:van|von|der|den|de|da|di|del|la|le|du|dos)\\s+)*"
                    + "[A-Z][A-Za-z'\\-]*(?:[ '\\-][A-Za-z][A-Za-z'\\-]*)*"
                    + ", [A-Z][A-Za-z.'\\- ]*$");

    @Override
    public String getName() {
        return "name-format-separators";
    }

    @Override
    public Set<String> fields() {
        return FIELDS;
    }

    @Override
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        String value = record.getField(field);
        if (value == null || value.isBlank() || "UNKNOWN".equals(value)) {
            return Set.of();
        }
        String sanitized = NOISE.matcher(TextStats.removeAccents(value)).replaceAll("");
        for (String name : NAME_SEPARATOR.split(sanitized)) {
            if (!PERSON_NAME.matcher(name.trim()).matches()) {
                return Set.of(DefectCode.NAME_FORMAT_SEPARATORS);
            }
        }
        return Set.of();
    }
}
