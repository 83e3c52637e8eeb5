package org.pragmatica.vfmt.format.rules;

import java.util.Objects;

/**
 * Value decided by a rule, with the rule that decided it.
 */
public record Verdict<T>(T value, String ruleId, String reason) {
    public Verdict {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(reason, "reason");
    }

    static <T> Verdict<T> verdict(T value, Rule<T> rule) {
        return new Verdict<>(value, rule.ruleId(), rule.description());
    }

    @Override
    public String toString() {
        return value + " (" + ruleId + ": " + reason + ")";
    }
}
