package com.curation.integrity.rules;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Character-level helpers shared by the field rules.
 */
final class TextStats {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NAME_CONNECTORS =
            Pattern.compile("(?<!\\p{L})(?:and|others|et\\s+al\\.?)(?!\\p{L})");

    private TextStats() {
        // Utility class
    }

    /**
     * Share of uppercase characters among the letters of the value, 0.0 when it has none.
     */
    static double upperCaseRatio(String value) {
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        return letters == 0 ? 0.0 : (double) upper / letters;
    }

    /**
     * Drops the lowercase connectors of a name list ({@code and}, {@code et al.}, {@code others}).
     */
    static String withoutNameConnectors(String value) {
        return NAME_CONNECTORS.matcher(value).replaceAll(" ");
    }

    static int letterCount(String value) {
        int letters = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isLetter(value.charAt(i))) {
                letters++;
            }
        }
        return letters;
    }

    /**
     * True when the value has at least one cased letter and no lowercase letter.
     */
    static boolean isUpperCase(String value) {
        boolean cased = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                cased = true;
            }
        }
        return cased;
    }

    static String removeAccents(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
