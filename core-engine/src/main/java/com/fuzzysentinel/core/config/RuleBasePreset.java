package com.fuzzysentinel.core.config;

import java.util.Locale;

/**
 * Built-in rule bases over the standard anomaly vocabulary.
 *
 * @see StandardFuzzySystem
 * @since 1.0.0
 */
public enum RuleBasePreset {

    /** Nine three-term AND rules. */
    CANONICAL,

    /** Fourteen rules, mostly two-term AND rules over pairs of indicators. */
    PAIRWISE;

    /**
     * Parse a preset name as written in settings files.
     *
     * @throws IllegalArgumentException if the name matches no preset
     */
    public static RuleBasePreset fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule base preset must not be null or blank");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "canonical" -> CANONICAL;
            case "pairwise" -> PAIRWISE;
            default -> throw new IllegalArgumentException(
                    "Unknown rule base: '" + name + "'. Supported: canonical, pairwise");
        };
    }
}
