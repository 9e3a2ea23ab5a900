package com.curation.integrity.config;

import com.curation.integrity.check.CheckerSettings;
import com.curation.integrity.check.ConsistencyChecker;
import com.curation.integrity.quality.QualityModel;
import com.curation.integrity.rules.DefaultFieldRules;
import com.curation.integrity.rules.RuleSettings;
import com.curation.integrity.similarity.FieldWeights;
import com.curation.integrity.similarity.RecordSimilarityScorer;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Bundles the settings of the rule library, the similarity scorer and the checker,
 * read from MicroProfile Config.
 *
 * <p>Recognized keys (all optional):</p>
 * <ul>
 *   <li>{@code integrity.rules.caps-ratio-threshold}</li>
 *   <li>{@code integrity.rules.abbreviation-max-length}</li>
 *   <li>{@code integrity.rules.known-short-container-names} (comma-separated)</li>
 *   <li>{@code integrity.rules.additional-language-codes} (comma-separated)</li>
 *   <li>{@code integrity.rules.annotation-source}</li>
 *   <li>{@code integrity.similarity.weight.title|author|year|container}</li>
 *   <li>{@code integrity.checker.strict}, {@code integrity.checker.parallel}, {@code integrity.checker.threads}</li>
 *   <li>{@code integrity.checker.duplicate-similarity-threshold}</li>
 *   <li>{@code integrity.checker.screening-criteria} (comma-separated)</li>
 * </ul>
 */
public final class IntegritySettings {
    private static final Logger log = LoggerFactory.getLogger(IntegritySettings.class);

    private static final String RULES = "integrity.rules.";
    private static final String WEIGHTS = "integrity.similarity.weight.";
    private static final String CHECKER = "integrity.checker.";

    private final RuleSettings ruleSettings;
    private final FieldWeights fieldWeights;
    private final CheckerSettings checkerSettings;

    public IntegritySettings(RuleSettings ruleSettings, FieldWeights fieldWeights, CheckerSettings checkerSettings) {
        this.ruleSettings = Objects.requireNonNull(ruleSettings, "ruleSettings are required");
        this.fieldWeights = Objects.requireNonNull(fieldWeights, "fieldWeights are required");
        this.checkerSettings = Objects.requireNonNull(checkerSettings, "checkerSettings are required");
    }

    public static IntegritySettings defaults() {
        return new IntegritySettings(RuleSettings.defaults(), FieldWeights.defaultWeights(), CheckerSettings.defaults());
    }

    /**
     * Reads settings from the default config sources: system properties, environment
     * and {@code META-INF/microprofile-config.properties}.
     */
    public static IntegritySettings load() {
        Config config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDefaultInterceptors()
                .build();
        return fromConfig(config);
    }

    /**
     * Builds settings from a config; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException on a value that cannot be converted or is out of range
     */
    public static IntegritySettings fromConfig(Config config) {
        RuleSettings.Builder rules = RuleSettings.builder();
        config.getOptionalValue(RULES + "caps-ratio-threshold", Double.class)
                .ifPresent(rules::capsRatioThreshold);
        config.getOptionalValue(RULES + "abbreviation-max-length", Integer.class)
                .ifPresent(rules::abbreviationMaxLength);
        values(config, RULES + "known-short-container-names")
                .ifPresent(rules::knownShortContainerNames);
        values(config, RULES + "additional-language-codes")
                .ifPresent(rules::additionalLanguageCodes);
        config.getOptionalValue(RULES + "annotation-source", String.class)
                .ifPresent(rules::annotationSource);

        FieldWeights defaults = FieldWeights.defaultWeights();
        FieldWeights weights = new FieldWeights(
                config.getOptionalValue(WEIGHTS + "title", Double.class).orElse(defaults.titleWeight()),
                config.getOptionalValue(WEIGHTS + "author", Double.class).orElse(defaults.authorWeight()),
                config.getOptionalValue(WEIGHTS + "year", Double.class).orElse(defaults.yearWeight()),
                config.getOptionalValue(WEIGHTS + "container", Double.class).orElse(defaults.containerWeight()));

        CheckerSettings.Builder checker = CheckerSettings.builder();
        config.getOptionalValue(CHECKER + "strict", Boolean.class).ifPresent(checker::strict);
        config.getOptionalValue(CHECKER + "parallel", Boolean.class).ifPresent(checker::parallel);
        config.getOptionalValue(CHECKER + "threads", Integer.class).ifPresent(checker::threads);
        config.getOptionalValue(CHECKER + "duplicate-similarity-threshold", Double.class)
                .ifPresent(checker::duplicateSimilarityThreshold);
        values(config, CHECKER + "screening-criteria").ifPresent(checker::screeningCriteria);

        IntegritySettings settings = new IntegritySettings(rules.build(), weights, checker.build());
        log.info("settings.loaded strict={} parallel={} threads={}",
                settings.checkerSettings.isStrict(), settings.checkerSettings.isParallel(),
                settings.checkerSettings.getThreads());
        return settings;
    }

    public RuleSettings getRuleSettings() {
        return ruleSettings;
    }

    public FieldWeights getFieldWeights() {
        return fieldWeights;
    }

    public CheckerSettings getCheckerSettings() {
        return checkerSettings;
    }

    public QualityModel createQualityModel() {
        return new QualityModel(DefaultFieldRules.createDefaultRegistry(), ruleSettings);
    }

    public RecordSimilarityScorer createSimilarityScorer() {
        return new RecordSimilarityScorer(fieldWeights);
    }

    /**
     * A checker builder preconfigured with these settings and the built-in checks.
     */
    public ConsistencyChecker.Builder checkerBuilder() {
        return ConsistencyChecker.builder()
                .withBuiltInChecks()
                .settings(checkerSettings)
                .similarityScorer(createSimilarityScorer());
    }

    private static Optional<Set<String>> values(Config config, String key) {
        return config.getOptionalValues(key, String.class)
                .map(IntegritySettings::trimmed);
    }

    private static Set<String> trimmed(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }
}
