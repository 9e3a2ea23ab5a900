package com.curation.integrity.rules;

import java.util.List;

/**
 * The built-in field rules.
 */
public final class DefaultFieldRules {

    private DefaultFieldRules() {
        // Utility class
    }

    /**
     * Creates a registry holding every built-in rule.
     */
    public static FieldRuleRegistry createDefaultRegistry() {
        FieldRuleRegistry registry = new FieldRuleRegistry();
        registry.registerAll(getNameRules());
        registry.registerAll(getTitleRules());
        registry.registerAll(getContainerRules());
        registry.registerAll(getFormatRules());
        return registry;
    }

    /**
     * Rules for author and editor lists.
     */
    public static List<FieldRule> getNameRules() {
        return List.of(
                new MostlyAllCapsRule(),
                new IncompleteFieldRule(),
                new NameFormatSeparatorsRule(),

                // Academic titles as stand-alone tokens ("Rai, PhD, Arun"), not inside a word.
                // MD only in capitals, "Md" is a common given name.
                PatternFieldRule.builder()
                        .name("name-format-titles")
                        .pattern("(^|[\\s,])(PhD|Dr|Prof|MBA|MSc|(?-i:MD|M\\.D))\\.?(?=[\\s,]|$)")
                        .caseInsensitive(true)
                        .fields("author", "editor")
                        .defect(DefectCode.NAME_FORMAT_TITLES)
                        .build(),

                PatternFieldRule.builder()
                        .name("name-abbreviated")
                        .pattern("(^|[\\s,])(and\\s+)?others\\s*$")
                        .caseInsensitive(true)
                        .fields("author", "editor")
                        .defect(DefectCode.NAME_ABBREVIATED)
                        .build(),

                PatternFieldRule.builder()
                        .name("erroneous-term-in-author")
                        .pattern("\\b(University|Institute|Department|Faculty|School of|Laboratory|College|Management)\\b"
                                + "|https?:")
                        .fields("author")
                        .defect(DefectCode.ERRONEOUS_TERM_IN_FIELD)
                        .build(),

                new ThesisMultipleAuthorsRule()
        );
    }

    /**
     * Rules for the title field.
     */
    public static List<FieldRule> getTitleRules() {
        return List.of(
                // Underscore separators or digit-for-letter substitutions ("0th3r")
                PatternFieldRule.builder()
                        .name("erroneous-title-field")
                        .pattern("_|[a-z][0-9]+[a-z]|(^|\\s)0[a-z]")
                        .fields("title")
                        .defect(DefectCode.ERRONEOUS_TITLE_FIELD)
                        .build(),

                PatternFieldRule.builder()
                        .name("erroneous-term-in-title")
                        .pattern("https?:|\\bwww\\.")
                        .caseInsensitive(true)
                        .fields("title")
                        .defect(DefectCode.ERRONEOUS_TERM_IN_FIELD)
                        .build(),

                new IdenticalTitleContainerRule()
        );
    }

    /**
     * Rules for journal and booktitle.
     */
    public static List<FieldRule> getContainerRules() {
        return List.of(
                new ContainerTitleAbbreviatedRule(),
                new InconsistentContentRule()
        );
    }

    /**
     * Symbol, year and language format rules.
     */
    public static List<FieldRule> getFormatRules() {
        return List.of(
                PatternFieldRule.builder()
                        .name("erroneous-symbol-in-field")
                        .pattern("[\\uFFFD\\u2122\\u00AE\\u00A9]|[\\p{Cc}&&[^\\t\\n\\r]]")
                        .fields("title", "author", "editor", "journal", "booktitle")
                        .defect(DefectCode.ERRONEOUS_SYMBOL_IN_FIELD)
                        .build(),

                PatternFieldRule.builder()
                        .name("year-format")
                        .pattern("\\d{4}|forthcoming")
                        .mode(PatternFieldRule.Mode.MUST_MATCH)
                        .fields("year")
                        .defect(DefectCode.YEAR_FORMAT)
                        .build(),

                new LanguageFormatRule()
        );
    }
}
