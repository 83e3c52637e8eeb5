package org.pragmatica.vfmt.format.rules;

import org.pragmatica.vfmt.format.FormatStyle;
import org.pragmatica.vfmt.format.FormatToken;
import org.pragmatica.vfmt.text.SyntaxTreeContext;
import org.pragmatica.vfmt.text.TokenKind;
import org.pragmatica.vfmt.token.TokenCategory;

import java.util.Objects;

/**
 * Input of the annotation rules: two adjacent tokens, the ancestor context of each and the
 * style in effect.
 *
 * @param left         preceding token, already annotated unless it starts the sequence
 * @param right        token being annotated
 * @param leftContext  ancestors of the left token
 * @param rightContext ancestors of the right token
 * @param style        formatting style
 */
public record TokenPair(
        FormatToken left,
        FormatToken right,
        SyntaxTreeContext leftContext,
        SyntaxTreeContext rightContext,
        FormatStyle style
) {
    public TokenPair {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(leftContext, "leftContext");
        Objects.requireNonNull(rightContext, "rightContext");
        Objects.requireNonNull(style, "style");
    }

    public static TokenPair tokenPair(FormatToken left,
                                      FormatToken right,
                                      SyntaxTreeContext leftContext,
                                      SyntaxTreeContext rightContext,
                                      FormatStyle style) {
        return new TokenPair(left, right, leftContext, rightContext, style);
    }

    public TokenKind leftKind() {
        return left.kind();
    }

    public TokenKind rightKind() {
        return right.kind();
    }

    public TokenCategory leftCategory() {
        return left.category();
    }

    public TokenCategory rightCategory() {
        return right.category();
    }

    public boolean leftIs(TokenKind kind) {
        return left.kind() == kind;
    }

    public boolean rightIs(TokenKind kind) {
        return right.kind() == kind;
    }

    public boolean leftIs(TokenCategory category) {
        return left.category() == category;
    }

    public boolean rightIs(TokenCategory category) {
        return right.category() == category;
    }

    /// Original source has a line break between the two tokens.
    public boolean newlineBetween() {
        return right.hasNewlineBefore();
    }

    @Override
    public String toString() {
        return left.token() + " " + leftContext + " | " + right.token() + " " + rightContext;
    }
}
