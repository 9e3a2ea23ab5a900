package com.curation.integrity.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token overlap: {@code |A ∩ B| / |A ∪ B|} over lowercase whitespace tokens.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        Set<String> left = tokens(s1);
        Set<String> right = tokens(s2);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String token : left) {
            if (right.contains(token)) {
                shared++;
            }
        }
        return (double) shared / (left.size() + right.size() - shared);
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    private static Set<String> tokens(String value) {
        Set<String> tokens = new HashSet<>();
        for (String token : WHITESPACE.split(value.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
