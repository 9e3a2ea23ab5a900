package com.curation.integrity.rules;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tunable thresholds of the field rules. Passed explicitly into the quality model;
 * there is no process-wide configuration.
 */
public class RuleSettings {

    private static final double DEFAULT_CAPS_RATIO_THRESHOLD = 0.8;
    private static final int DEFAULT_ABBREVIATION_MAX_LENGTH = 5;
    private static final String DEFAULT_ANNOTATION_SOURCE = "quality_model";

    private final double capsRatioThreshold;
    private final int abbreviationMaxLength;
    private final Set<String> knownShortContainerNames;
    private final Set<String> additionalLanguageCodes;
    private final String annotationSource;

    private RuleSettings(Builder builder) {
        this.capsRatioThreshold = builder.capsRatioThreshold;
        this.abbreviationMaxLength = builder.abbreviationMaxLength;
        this.knownShortContainerNames = builder.knownShortContainerNames.stream()
                .map(name -> name.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.additionalLanguageCodes = builder.additionalLanguageCodes.stream()
                .map(code -> code.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.annotationSource = builder.annotationSource;
    }

    public double getCapsRatioThreshold() {
        return capsRatioThreshold;
    }

    public int getAbbreviationMaxLength() {
        return abbreviationMaxLength;
    }

    public Set<String> getKnownShortContainerNames() {
        return knownShortContainerNames;
    }

    public Set<String> getAdditionalLanguageCodes() {
        return additionalLanguageCodes;
    }

    public String getAnnotationSource() {
        return annotationSource;
    }

    public boolean isKnownShortContainerName(String name) {
        return name != null && knownShortContainerNames.contains(name.trim().toUpperCase(Locale.ROOT));
    }

    public static RuleSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double capsRatioThreshold = DEFAULT_CAPS_RATIO_THRESHOLD;
        private int abbreviationMaxLength = DEFAULT_ABBREVIATION_MAX_LENGTH;
        // Short container titles that are real names rather than abbreviations
        private Set<String> knownShortContainerNames = Set.of("NATURE", "SCIENCE", "CELL", "JAMA", "BMJ", "PLOS");
        private Set<String> additionalLanguageCodes = Set.of();
        private String annotationSource = DEFAULT_ANNOTATION_SOURCE;

        public Builder capsRatioThreshold(double capsRatioThreshold) {
            if (capsRatioThreshold <= 0.0 || capsRatioThreshold > 1.0) {
                throw new IllegalArgumentException("capsRatioThreshold must be in (0, 1], got " + capsRatioThreshold);
            }
            this.capsRatioThreshold = capsRatioThreshold;
            return this;
        }

        public Builder abbreviationMaxLength(int abbreviationMaxLength) {
            if (abbreviationMaxLength < 1) {
                throw new IllegalArgumentException("abbreviationMaxLength must be >= 1");
            }
            this.abbreviationMaxLength = abbreviationMaxLength;
            return this;
        }

        public Builder knownShortContainerNames(Set<String> names) {
            this.knownShortContainerNames = Set.copyOf(names);
            return this;
        }

        public Builder additionalLanguageCodes(Set<String> codes) {
            this.additionalLanguageCodes = Set.copyOf(codes);
            return this;
        }

        public Builder annotationSource(String annotationSource) {
            if (annotationSource == null || annotationSource.isBlank()) {
                throw new IllegalArgumentException("annotationSource must not be blank");
            }
            this.annotationSource = annotationSource;
            return this;
        }

        public RuleSettings build() {
            return new RuleSettings(this);
        }
    }
}
