package com.curation.integrity.similarity;

/**
 * Jaro-Winkler similarity, favouring strings that share a prefix.
 * Inputs are put in canonical order first, which makes the greedy matching symmetric.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_PREFIX_SCALE = 0.1;
    private static final int MAX_PREFIX = 4;

    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(DEFAULT_PREFIX_SCALE);
    }

    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("Prefix scale must be between 0 and 0.25");
        }
        this.prefixScale = prefixScale;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        String first = s1.compareTo(s2) <= 0 ? s1 : s2;
        String second = first == s1 ? s2 : s1;

        double jaro = jaro(first, second);
        int prefix = 0;
        int limit = Math.min(MAX_PREFIX, Math.min(first.length(), second.length()));
        while (prefix < limit && first.charAt(prefix) == second.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * prefixScale * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    private static double jaro(String a, String b) {
        int window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        boolean[] matchedA = new boolean[a.length()];
        boolean[] matchedB = new boolean[b.length()];

        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length(), i + window + 1);
            for (int j = from; j < to; j++) {
                if (!matchedB[j] && a.charAt(i) == b.charAt(j)) {
                    matchedA[i] = true;
                    matchedB[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int j = 0;
        for (int i = 0; i < a.length(); i++) {
            if (!matchedA[i]) {
                continue;
            }
            while (!matchedB[j]) {
                j++;
            }
            if (a.charAt(i) != b.charAt(j)) {
                halfTranspositions++;
            }
            j++;
        }
        double m = matches;
        return (m / a.length() + m / b.length() + (m - halfTranspositions / 2.0) / m) / 3.0;
    }
}
