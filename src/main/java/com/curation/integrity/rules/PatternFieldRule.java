package com.curation.integrity.rules;

import com.curation.integrity.core.model.Record;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A field rule that reports a defect when a regex matches (or, in {@link Mode#MUST_MATCH}
 * mode, fails to match) the field value.
 */
public class PatternFieldRule implements FieldRule {

    public enum Mode {
        /** Defect when the pattern is found anywhere in the value. */
        FLAG_ON_MATCH,
        /** Defect when the whole value does not match the pattern. */
        MUST_MATCH
    }

    private final String name;
    private final Pattern pattern;
    private final Set<String> fields;
    private final DefectCode defect;
    private final Mode mode;

    private PatternFieldRule(Builder builder) {
        this.name = builder.name;
        this.pattern = builder.caseInsensitive
                ? Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                : Pattern.compile(builder.pattern);
        this.fields = Set.copyOf(builder.fields);
        this.defect = builder.defect;
        this.mode = builder.mode;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Set<String> fields() {
        return fields;
    }

    @Override
    public Set<DefectCode> check(String field, Record record, RuleSettings settings) {
        String value = record.getField(field);
        if (value == null) {
            return Set.of();
        }
        boolean defective = mode == Mode.MUST_MATCH
                ? !pattern.matcher(value.trim()).matches()
                : pattern.matcher(value).find();
        return defective ? Set.of(defect) : Set.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(name, ((PatternFieldRule) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "PatternFieldRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", defect=" + defect +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private Set<String> fields;
        private DefectCode defect;
        private Mode mode = Mode.FLAG_ON_MATCH;
        private boolean caseInsensitive;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder fields(String... fields) {
            this.fields = Set.of(fields);
            return this;
        }

        public Builder defect(DefectCode defect) {
            this.defect = defect;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = mode;
            return this;
        }

        public Builder caseInsensitive(boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
            return this;
        }

        public PatternFieldRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(fields, "fields are required");
            Objects.requireNonNull(defect, "defect is required");
            return new PatternFieldRule(this);
        }
    }
}
