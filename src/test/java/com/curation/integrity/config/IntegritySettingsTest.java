package com.curation.integrity.config;

import com.curation.integrity.check.ConsistencyChecker;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IntegritySettingsTest {

    /**
     * Bundled defaults overlaid with the given values.
     */
    private static Config config(Map<String, String> overrides) {
        return new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "overrides", 500))
                .build();
    }

    @Test
    @DisplayName("Should load the bundled microprofile-config.properties")
    void loadDefaultSources() {
        IntegritySettings settings = IntegritySettings.load();

        assertEquals(0.8, settings.getRuleSettings().getCapsRatioThreshold());
        assertEquals(5, settings.getRuleSettings().getAbbreviationMaxLength());
        assertTrue(settings.getRuleSettings().getKnownShortContainerNames().contains("NATURE"));
        assertEquals(0.45, settings.getFieldWeights().titleWeight());
        assertEquals(0.9, settings.getCheckerSettings().getDuplicateSimilarityThreshold());
        assertFalse(settings.getCheckerSettings().isStrict());
        assertTrue(settings.getCheckerSettings().getScreeningCriteria().isEmpty());
    }

    @Test
    @DisplayName("Should apply overrides and keep defaults for absent keys")
    void overrides() {
        IntegritySettings settings = IntegritySettings.fromConfig(config(Map.of(
                "integrity.rules.caps-ratio-threshold", "0.9",
                "integrity.rules.additional-language-codes", "qaa, qab",
                "integrity.checker.strict", "true",
                "integrity.checker.parallel", "TRUE",
                "integrity.checker.threads", "2",
                "integrity.checker.screening-criteria", "scope,method",
                "integrity.similarity.weight.title", "0.5",
                "integrity.similarity.weight.container", "0.1")));

        assertEquals(0.9, settings.getRuleSettings().getCapsRatioThreshold());
        assertEquals(Set.of("qaa", "qab"), settings.getRuleSettings().getAdditionalLanguageCodes());
        assertTrue(settings.getRuleSettings().getKnownShortContainerNames().contains("NATURE"));
        assertEquals("quality_model", settings.getRuleSettings().getAnnotationSource());
        assertTrue(settings.getCheckerSettings().isStrict());
        assertTrue(settings.getCheckerSettings().isParallel());
        assertEquals(2, settings.getCheckerSettings().getThreads());
        assertEquals(Set.of("scope", "method"), settings.getCheckerSettings().getScreeningCriteria());
        assertEquals(0.5, settings.getFieldWeights().titleWeight());
        assertEquals(0.1, settings.getFieldWeights().containerWeight());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void invalidValues() {
        assertThrows(IllegalArgumentException.class, () -> IntegritySettings.fromConfig(
                config(Map.of("integrity.checker.threads", "many"))));
        assertThrows(IllegalArgumentException.class, () -> IntegritySettings.fromConfig(
                config(Map.of("integrity.rules.caps-ratio-threshold", "1.5"))));
        assertThrows(IllegalArgumentException.class, () -> IntegritySettings.fromConfig(
                config(Map.of("integrity.similarity.weight.title", "0.9"))));
        assertThrows(IllegalArgumentException.class, () -> IntegritySettings.fromConfig(
                config(Map.of("integrity.checker.threads", "0"))));
    }

    @Test
    @DisplayName("Should build configured components")
    void components() {
        IntegritySettings settings = IntegritySettings.defaults();

        assertNotNull(settings.createQualityModel());
        assertEquals(settings.getFieldWeights(), settings.createSimilarityScorer().getWeights());
        ConsistencyChecker checker = settings.checkerBuilder().build();
        assertEquals(7, checker.getChecks().size());
        assertSame(settings.getCheckerSettings(), checker.getSettings());
    }
}
