package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Requires the language field to hold a three-letter ISO 639-3 code.
 * Codes come from the bundled {@code iso-639-3.tab} table, extended by
 * {@link RuleSettings#getAdditionalLanguageCodes()}.
 */
public class LanguageFormatRule implements FieldRule {
    private static final Logger log = LoggerFactory.getLogger(LanguageFormatRule.class);

    private static final String CODE_TABLE = "/iso-639-3.tab";
    private static final Set<String> ISO_639_3 = loadLanguageCodes();

    @Override
    public String getName() {
        return "language-format";
    }

    @Override
    public Set<String> fields() {
        return Set.of(Record.LANGUAGE);
    }

    @Override
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        String value = record.getField(Record.LANGUAGE);
        if (value == null) {
            return Set.of();
        }
        String code = value.trim();
        boolean valid = code.length() == 3
                && code.equals(code.toLowerCase(Locale.ROOT))
                && (ISO_639_3.contains(code) || settings.getAdditionalLanguageCodes().contains(code));
        return valid ? Set.of() : Set.of(DefectCode.LANGUAGE_FORMAT_ERROR);
    }

    private static Set<String> loadLanguageCodes() {
        Set<String> codes = new HashSet<>();
        try (InputStream input = LanguageFormatRule.class.getResourceAsStream(CODE_TABLE)) {
            if (input == null) {
                throw new IllegalStateException("Language code table not found: " + CODE_TABLE);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
            // Header row first, then one code per line in the Id column
            reader.readLine();
            String line;
            while ((line = reader.readLine()) != null) {
                int tab = line.indexOf('\t');
                String code = tab >= 0 ? line.substring(0, tab) : line.trim();
                if (!code.isEmpty()) {
                    codes.add(code);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + CODE_TABLE, e);
        }
        log.debug("Loaded {} ISO 639-3 codes", codes.size());
        return Collections.unmodifiableSet(codes);
    }
}
