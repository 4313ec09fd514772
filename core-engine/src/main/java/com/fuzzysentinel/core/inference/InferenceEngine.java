package com.fuzzysentinel.core.inference;

import com.fuzzysentinel.core.model.EvaluationResult;
import com.fuzzysentinel.core.model.FuzzifiedInputs;
import com.fuzzysentinel.core.model.FuzzySet;
import com.fuzzysentinel.core.model.LinguisticVariable;
import com.fuzzysentinel.core.model.Outcome;
import com.fuzzysentinel.core.model.RuleActivation;
import com.fuzzysentinel.core.rules.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Mamdani inference over an {@link InferenceConfig}.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   crisp inputs
 *     → range check (InputOutOfRangeException, no clamping)
 *     → fuzzify every input variable
 *     → firing strength per rule (weight × antecedent)
 *     → aggregate: max strength per output set
 *     → centroid over the sampled output domain
 *     → label: output set with the highest degree at the centroid
 * </pre>
 *
 * <h3>Zero mass</h3>
 * <p>
 * If the aggregated output has no mass the centroid is undefined. Under
 * {@link CoveragePolicy#NEAREST_RULE} the nearest rules are fired first;
 * if there is still no mass the engine returns the output domain midpoint
 * labelled {@value EvaluationResult#UNDETERMINED_LABEL} with
 * {@link Outcome#UNDETERMINED}. This is a regular result, not an error.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The engine holds only immutable configuration. Every call works on its
 * own intermediate structures, so one instance can serve concurrent callers
 * without synchronization.
 * </p>
 *
 * @since 1.0.0
 */
public class InferenceEngine {

    private static final Logger LOG = LoggerFactory.getLogger(InferenceEngine.class);

    private final InferenceConfig config;
    private final CentroidDefuzzifier defuzzifier;

    public InferenceEngine(InferenceConfig config) {
        this.config = Objects.requireNonNull(config, "InferenceConfig must not be null");
        this.defuzzifier = new CentroidDefuzzifier(config.getResolution());
    }

    /**
     * Evaluate the rule base for one set of crisp inputs.
     *
     * @param crispInputs input variable name to value; every declared input
     *                    must be present
     * @return the evaluation result, never {@code null}
     * @throws IllegalArgumentException  if a declared input is missing
     * @throws InputOutOfRangeException  if an input is {@code NaN} or outside
     *                                   its variable's domain
     */
    public EvaluationResult evaluate(Map<String, Double> crispInputs) {
        Objects.requireNonNull(crispInputs, "Inputs must not be null");

        FuzzifiedInputs fuzzified = fuzzify(crispInputs);

        List<RuleActivation> activations = fire(fuzzified);
        AggregatedOutput aggregated = aggregate(activations);
        Outcome outcome = Outcome.FIRED;

        if (aggregated.isSilent() && config.getCoveragePolicy() == CoveragePolicy.NEAREST_RULE) {
            activations = fireNearest(fuzzified);
            aggregated = aggregate(activations);
            outcome = Outcome.INTERPOLATED;
            LOG.debug("No rule fired for {}; interpolated from {}", crispInputs, activations);
        }

        OptionalDouble centroid = defuzzifier.defuzzify(aggregated);
        if (centroid.isEmpty()) {
            return undetermined(crispInputs, aggregated, activations);
        }

        double score = centroid.getAsDouble();
        String label = labelAt(score);
        LOG.debug("Evaluated {} -> score={} label={} outcome={}", crispInputs, score, label, outcome);

        return EvaluationResult.builder()
                .score(score)
                .label(label)
                .outcome(outcome)
                .aggregatedStrengths(aggregated.asMap())
                .activations(activations)
                .build();
    }

    public InferenceConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Pipeline steps
    // ---------------------------------------------------------------

    private FuzzifiedInputs fuzzify(Map<String, Double> crispInputs) {
        FuzzifiedInputs fuzzified = new FuzzifiedInputs();
        for (LinguisticVariable variable : config.getInputs()) {
            Double value = crispInputs.get(variable.getName());
            if (value == null) {
                throw new IllegalArgumentException("Missing input '" + variable.getName() + "'");
            }
            if (!variable.inDomain(value)) {
                throw new InputOutOfRangeException(variable.getName(), value, variable.getMin(), variable.getMax());
            }
            fuzzified.put(variable.getName(), variable.fuzzify(value));
        }
        return fuzzified;
    }

    private List<RuleActivation> fire(FuzzifiedInputs fuzzified) {
        List<RuleActivation> activations = new ArrayList<>(config.getRuleBase().size());
        for (Rule rule : config.getRuleBase().getRules()) {
            double strength = rule.firingStrength(fuzzified);
            LOG.trace("Rule [{}] strength={}", rule.getName(), strength);
            activations.add(new RuleActivation(rule.getName(), rule.getConsequent(), strength));
        }
        return activations;
    }

    /**
     * Fire only the rules with the highest compensated strength; all others
     * get zero.
     */
    private List<RuleActivation> fireNearest(FuzzifiedInputs fuzzified) {
        List<Rule> rules = config.getRuleBase().getRules();
        double[] compensated = new double[rules.size()];
        double best = 0.0;
        for (int i = 0; i < rules.size(); i++) {
            compensated[i] = rules.get(i).compensatedStrength(fuzzified);
            best = Math.max(best, compensated[i]);
        }

        List<RuleActivation> activations = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            double strength = best > 0 && compensated[i] == best ? best : 0.0;
            activations.add(new RuleActivation(rule.getName(), rule.getConsequent(), strength));
        }
        return activations;
    }

    private AggregatedOutput aggregate(List<RuleActivation> activations) {
        AggregatedOutput aggregated = new AggregatedOutput(config.getOutput());
        for (RuleActivation activation : activations) {
            aggregated.accumulate(activation.getConsequent(), activation.getStrength());
        }
        return aggregated;
    }

    /**
     * Output set with the highest degree at {@code score}; the first declared
     * set wins ties.
     */
    private String labelAt(double score) {
        String label = null;
        double best = -1.0;
        for (FuzzySet set : config.getOutput().getSets()) {
            double degree = set.degree(score);
            if (degree > best) {
                best = degree;
                label = set.getName();
            }
        }
        return label;
    }

    private EvaluationResult undetermined(Map<String, Double> crispInputs,
            AggregatedOutput aggregated,
            List<RuleActivation> activations) {
        double midpoint = config.getOutput().midpoint();
        LOG.debug("No output mass for {}; returning undetermined midpoint {}", crispInputs, midpoint);
        return EvaluationResult.builder()
                .score(midpoint)
                .label(EvaluationResult.UNDETERMINED_LABEL)
                .outcome(Outcome.UNDETERMINED)
                .aggregatedStrengths(aggregated.asMap())
                .activations(activations)
                .build();
    }
}
