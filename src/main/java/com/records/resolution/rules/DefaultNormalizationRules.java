package com.records.resolution.rules;

import java.util.List;

/**
 * Built-in rules for public-records entity names.
 */
public final class DefaultNormalizationRules {

    static final String PUNCTUATION_PATTERN = "[.,;:'\"!?()\\[\\]{}]";
    static final String ORGANIZATION_SUFFIX_PATTERN =
            "\\b(inc|llc|corp|ltd|co|foundation|fund|assoc|association|committee|pac)\\b\\.?";

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getRules());
    }

    public static List<NormalizationRule> getRules() {
        return List.of(
                // Punctuation goes first so "Inc." and "Inc" look the same to the suffix rule
                NormalizationRule.builder()
                        .name("strip-punctuation")
                        .pattern(PUNCTUATION_PATTERN)
                        .replacement("")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("strip-organization-suffixes")
                        .pattern(ORGANIZATION_SUFFIX_PATTERN)
                        .replacement("")
                        .priority(20)
                        .build()
        );
    }
}
