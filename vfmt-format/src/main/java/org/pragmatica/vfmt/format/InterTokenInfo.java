package org.pragmatica.vfmt.format;

import java.util.Objects;

/**
 * Relationship of a token to its predecessor: required spaces when both stay on one line,
 * the cost of breaking the line between them and the break constraint.
 */
public record InterTokenInfo(int spacesRequired, int breakPenalty, BreakDecision breakDecision) {
    public InterTokenInfo {
        if (spacesRequired < 0) {
            throw new IllegalArgumentException("spacesRequired must be non-negative, got " + spacesRequired);
        }
        if (breakPenalty < 1) {
            throw new IllegalArgumentException("breakPenalty must be positive, got " + breakPenalty);
        }
        Objects.requireNonNull(breakDecision, "breakDecision");
    }

    public static InterTokenInfo interTokenInfo(int spacesRequired, int breakPenalty, BreakDecision breakDecision) {
        return new InterTokenInfo(spacesRequired, breakPenalty, breakDecision);
    }

    /**
     * Compact notation, e.g. {@code {1,5,+}}.
     */
    public String compact() {
        return "{" + spacesRequired + "," + breakPenalty + "," + breakDecision.symbol() + "}";
    }
}
