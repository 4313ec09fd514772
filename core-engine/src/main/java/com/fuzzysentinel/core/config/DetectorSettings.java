package com.fuzzysentinel.core.config;

import com.fuzzysentinel.core.inference.CoveragePolicy;
import com.fuzzysentinel.core.inference.InferenceConfig;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Top-level POJO for the detector settings YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * ruleBase: canonical          # canonical | pairwise
 * coveragePolicy: undetermined # undetermined | nearest_rule
 * resolution: 0.01             # centroid sampling step
 * </pre>
 *
 * <p>
 * Every key is optional; missing keys keep the defaults shown above. Call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Finest accepted step; keeps the ten-unit output domain well under {@link InferenceConfig#MAX_SAMPLES}. */
    public static final double MIN_RESOLUTION = 20.0 / InferenceConfig.MAX_SAMPLES;

    /** Built-in rule base name. */
    private String ruleBase = "canonical";

    /** Behaviour when no rule fires. */
    private String coveragePolicy = "undetermined";

    /** Sampling step of the centroid integration over the output domain. */
    private double resolution = InferenceConfig.DEFAULT_RESOLUTION;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every setting holds a legal value.
     *
     * @throws IllegalStateException listing every invalid setting
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            RuleBasePreset.fromName(ruleBase);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        try {
            CoveragePolicy.fromName(coveragePolicy);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        // The output domain spans 10 units
        if (!(resolution >= MIN_RESOLUTION) || resolution > 1.0) {
            errors.add("'resolution' must be in [" + MIN_RESOLUTION + ", 1], got: " + resolution);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorSettings: " + String.join("; ", errors));
        }
    }

    /**
     * @return the parsed rule base preset
     * @throws IllegalArgumentException if the name is unknown
     */
    public RuleBasePreset rulePreset() {
        return RuleBasePreset.fromName(ruleBase);
    }

    /**
     * @return the parsed coverage policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public CoveragePolicy policy() {
        return CoveragePolicy.fromName(coveragePolicy);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getRuleBase() {
        return ruleBase;
    }

    /**
     * Set the rule base preset name, normalised to lowercase.
     */
    public void setRuleBase(String ruleBase) {
        this.ruleBase = ruleBase != null ? ruleBase.toLowerCase(Locale.ROOT) : null;
    }

    public String getCoveragePolicy() {
        return coveragePolicy;
    }

    /**
     * Set the coverage policy name, normalised to lowercase.
     */
    public void setCoveragePolicy(String coveragePolicy) {
        this.coveragePolicy = coveragePolicy != null ? coveragePolicy.toLowerCase(Locale.ROOT) : null;
    }

    public double getResolution() {
        return resolution;
    }

    public void setResolution(double resolution) {
        this.resolution = resolution;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorSettings that))
            return false;
        return Double.compare(resolution, that.resolution) == 0
                && Objects.equals(ruleBase, that.ruleBase)
                && Objects.equals(coveragePolicy, that.coveragePolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleBase, coveragePolicy, resolution);
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "ruleBase='" + ruleBase + '\'' +
                ", coveragePolicy='" + coveragePolicy + '\'' +
                ", resolution=" + resolution +
                '}';
    }
}
