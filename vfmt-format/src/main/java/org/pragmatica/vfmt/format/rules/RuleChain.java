package org.pragmatica.vfmt.format.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered rules where the first applicable rule decides.
 */
public final class RuleChain<T> {
    private final String name;
    private final List<Rule<T>> rules;
    private final Verdict<T> fallback;

    private RuleChain(String name, List<Rule<T>> rules, Verdict<T> fallback) {
        this.name = name;
        this.rules = rules;
        this.fallback = fallback;
    }

    /**
     * Chain with a fallback value used when no rule applies.
     */
    public static <T> RuleChain<T> ruleChain(String name, T fallback, List<Rule<T>> rules) {
        Objects.requireNonNull(fallback, "fallback");
        return new RuleChain<>(name,
                               List.copyOf(rules),
                               new Verdict<>(fallback, name + "-default", "No rule applies"));
    }

    public String name() {
        return name;
    }

    public List<Rule<T>> rules() {
        return rules;
    }

    /**
     * Verdict of the first applicable rule, if any.
     */
    public Optional<Verdict<T>> firstMatch(TokenPair pair) {
        for (var rule : rules) {
            var value = rule.analyze(pair);
            if (value.isPresent()) {
                return Optional.of(Verdict.verdict(value.get(), rule));
            }
        }
        return Optional.empty();
    }

    /**
     * Verdict of the first applicable rule, or the fallback. Never empty.
     */
    public Verdict<T> evaluate(TokenPair pair) {
        return firstMatch(pair).orElse(fallback);
    }

    /**
     * Chain evaluating this chain's rules first and then those of {@code next}, with the
     * fallback of {@code next}.
     */
    public RuleChain<T> then(RuleChain<T> next) {
        var combined = new ArrayList<Rule<T>>(rules);
        combined.addAll(next.rules);
        return new RuleChain<>(name + "+" + next.name, List.copyOf(combined), next.fallback);
    }
}
