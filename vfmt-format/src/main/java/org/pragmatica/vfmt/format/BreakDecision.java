package org.pragmatica.vfmt.format;

/**
 * Line break constraint between a token and its predecessor.
 */
public enum BreakDecision {
    /// Left to the layout optimizer.
    UNDECIDED("?"),
    /// Token must stay on the same line as its predecessor.
    MUST_APPEND("+"),
    /// Token must start a new line.
    MUST_WRAP("\\n"),
    /// Keep whatever the original source had.
    PRESERVE("=");

    private final String symbol;

    BreakDecision(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isConstraint() {
        return this == MUST_APPEND || this == MUST_WRAP;
    }
}
