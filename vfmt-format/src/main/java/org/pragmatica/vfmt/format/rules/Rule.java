package org.pragmatica.vfmt.format.rules;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Interface for annotation rules.
 *
 * Each rule inspects a token pair and either produces a value for it or declines,
 * leaving the decision to the next rule of its {@link RuleChain}. Rules are pure.
 *
 * @param <T> decided value, e.g. number of spaces or a break decision
 */
public interface Rule<T> {

    /**
     * Get the rule ID (e.g., "comma-before").
     */
    String ruleId();

    /**
     * Get a short description of the layout this rule enforces.
     */
    String description();

    /**
     * Decide the value for the pair, or return empty if the rule does not apply.
     */
    Optional<T> analyze(TokenPair pair);

    /**
     * Rule backed by an analysis function.
     */
    static <T> Rule<T> rule(String ruleId, String description, Function<TokenPair, Optional<T>> analysis) {
        return new FunctionRule<>(ruleId, description, analysis);
    }

    /**
     * Rule producing a constant value whenever the condition holds.
     */
    static <T> Rule<T> when(String ruleId, String description, Predicate<TokenPair> condition, T value) {
        Objects.requireNonNull(value, "value");
        return new FunctionRule<>(ruleId,
                                  description,
                                  pair -> condition.test(pair)
                                          ? Optional.of(value)
                                          : Optional.empty());
    }

    record FunctionRule<T>(String ruleId, String description, Function<TokenPair, Optional<T>> analysis)
            implements Rule<T> {
        public FunctionRule {
            Objects.requireNonNull(ruleId, "ruleId");
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(analysis, "analysis");
        }

        @Override
        public Optional<T> analyze(TokenPair pair) {
            return analysis.apply(pair);
        }

        @Override
        public String toString() {
            return ruleId;
        }
    }
}
