package com.fuzzysentinel.core.inference;

import java.util.Locale;

/**
 * What the engine does for inputs that no rule covers, i.e. when every rule
 * fires with strength zero.
 *
 * @since 1.0.0
 */
public enum CoveragePolicy {

    /**
     * Return the output domain midpoint labelled {@code undetermined}.
     */
    UNDETERMINED,

    /**
     * Re-score every rule with a compensatory AND (mean of the children) and
     * fire only the rules with the highest such score. Falls back to
     * {@link #UNDETERMINED} when even that yields nothing.
     */
    NEAREST_RULE;

    /**
     * Parse a policy name as written in settings files, e.g.
     * {@code nearest_rule} or {@code nearest-rule}.
     *
     * @throws IllegalArgumentException if the name matches no policy
     */
    public static CoveragePolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Coverage policy must not be null or blank");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (CoveragePolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown coverage policy: '" + name
                + "'. Supported: undetermined, nearest_rule");
    }
}
