package com.fuzzysentinel.core.rules;

import com.fuzzysentinel.core.model.FuzzifiedInputs;
import com.fuzzysentinel.core.model.LinguisticVariable;
import com.fuzzysentinel.core.model.UnknownTermException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fuzzysentinel.core.rules.Antecedent.allOf;
import static com.fuzzysentinel.core.rules.Antecedent.anyOf;
import static com.fuzzysentinel.core.rules.Antecedent.term;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RuleBase}.
 */
class RuleBaseTest {

    private static final LinguisticVariable TEMPERATURE = LinguisticVariable.builder("temperature", 0, 40)
            .triangular("cold", 0, 0, 20)
            .triangular("hot", 20, 40, 40)
            .build();

    private static final LinguisticVariable FAN = LinguisticVariable.builder("fan", 0, 100)
            .triangular("slow", 0, 0, 50)
            .triangular("fast", 50, 100, 100)
            .build();

    @Test
    @DisplayName("Should keep rules in declaration order")
    void shouldPreserveOrder() {
        RuleBase rules = RuleBase.builder()
                .addRule("hot_fast", term("temperature", "hot"), "fast")
                .addRule("cold_slow", term("temperature", "cold"), "slow")
                .build();

        assertThat(rules.size()).isEqualTo(2);
        assertThat(rules.getRules()).extracting(Rule::getName).containsExactly("hot_fast", "cold_slow");
    }

    @Test
    @DisplayName("Should reject duplicate rule names")
    void shouldRejectDuplicateNames() {
        RuleBase.Builder builder = RuleBase.builder()
                .addRule("r1", term("temperature", "hot"), "fast");

        assertThatThrownBy(() -> builder.addRule("r1", term("temperature", "cold"), "slow"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("r1");
    }

    @Test
    @DisplayName("Should not be affected by later builder changes")
    void shouldSnapshotBuilder() {
        RuleBase.Builder builder = RuleBase.builder()
                .addRule("r1", term("temperature", "hot"), "fast");
        RuleBase rules = builder.build();
        builder.addRule("r2", term("temperature", "cold"), "slow");

        assertThat(rules.size()).isEqualTo(1);
        assertThatThrownBy(() -> rules.getRules().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should validate a rule base over defined terms")
    void shouldValidateKnownTerms() {
        RuleBase rules = RuleBase.builder()
                .addRule("hot_fast", term("temperature", "hot"), "fast")
                .build();

        assertThatCode(() -> rules.validate(List.of(TEMPERATURE), FAN)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should list every undefined reference in one error")
    void shouldReportAllUnknownTerms() {
        RuleBase rules = RuleBase.builder()
                .addRule("bad_variable", term("humidity", "high"), "fast")
                .addRule("bad_set", allOf(term("temperature", "warm")), "slow")
                .addRule("bad_consequent", term("temperature", "hot"), "turbo")
                .build();

        assertThatThrownBy(() -> rules.validate(List.of(TEMPERATURE), FAN))
                .isInstanceOf(UnknownTermException.class)
                .hasMessageContaining("humidity")
                .hasMessageContaining("warm")
                .hasMessageContaining("turbo");
    }

    @Test
    @DisplayName("Should reduce an antecedent against fuzzified inputs")
    void shouldEvaluateAntecedent() {
        FuzzifiedInputs inputs = new FuzzifiedInputs();
        inputs.put("temperature", TEMPERATURE.fuzzify(30));
        RuleBase rules = RuleBase.builder().build();

        assertThat(rules.evaluate(anyOf(term("temperature", "cold"), term("temperature", "hot")), inputs))
                .isCloseTo(0.5, within(1e-9));
        assertThat(rules.evaluate(allOf(term("temperature", "cold"), term("temperature", "hot")), inputs))
                .isZero();
    }

    @Test
    @DisplayName("Should report an empty rule base as empty")
    void shouldAllowEmptyRuleBase() {
        RuleBase rules = RuleBase.builder().build();

        assertThat(rules.isEmpty()).isTrue();
        assertThatCode(() -> rules.validate(List.of(TEMPERATURE), FAN)).doesNotThrowAnyException();
    }
}
