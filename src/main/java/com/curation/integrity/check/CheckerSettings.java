package com.curation.integrity.check;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration of the consistency checker.
 */
public class CheckerSettings {

    private final boolean strict;
    private final boolean parallel;
    private final int threads;
    private final double duplicateSimilarityThreshold;
    private final Set<String> screeningCriteria;

    private CheckerSettings(Builder builder) {
        this.strict = builder.strict;
        this.parallel = builder.parallel;
        this.threads = builder.threads;
        this.duplicateSimilarityThreshold = builder.duplicateSimilarityThreshold;
        this.screeningCriteria = Collections.unmodifiableSet(new LinkedHashSet<>(builder.screeningCriteria));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CheckerSettings defaults() {
        return builder().build();
    }

    /**
     * When set, the first illegal status transition aborts the run.
     */
    public boolean isStrict() {
        return strict;
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Similarity at or above which two records sharing an ID are reported as likely
     * duplicates rather than an ID collision.
     */
    public double getDuplicateSimilarityThreshold() {
        return duplicateSimilarityThreshold;
    }

    /**
     * Known screening criteria names; empty means names are not validated.
     */
    public Set<String> getScreeningCriteria() {
        return screeningCriteria;
    }

    public static class Builder {
        private boolean strict = false;
        private boolean parallel = false;
        private int threads = 4;
        private double duplicateSimilarityThreshold = 0.9;
        private Set<String> screeningCriteria = new LinkedHashSet<>();

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be at least 1");
            }
            this.threads = threads;
            return this;
        }

        public Builder duplicateSimilarityThreshold(double threshold) {
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("duplicateSimilarityThreshold must be between 0.0 and 1.0");
            }
            this.duplicateSimilarityThreshold = threshold;
            return this;
        }

        public Builder screeningCriteria(Set<String> criteria) {
            this.screeningCriteria = new LinkedHashSet<>(criteria);
            return this;
        }

        public Builder screeningCriterion(String criterion) {
            if (criterion == null || criterion.isBlank()) {
                throw new IllegalArgumentException("screening criterion must not be blank");
            }
            this.screeningCriteria.add(criterion.trim());
            return this;
        }

        public CheckerSettings build() {
            return new CheckerSettings(this);
        }
    }
}
