package org.pragmatica.vfmt.format;

import org.pragmatica.vfmt.text.Token;
import org.pragmatica.vfmt.text.TokenKind;
import org.pragmatica.vfmt.token.TokenCategory;
import org.pragmatica.vfmt.token.TokenClassifier;

import java.util.Objects;
import java.util.Optional;

/**
 * Token prepared for formatting. Carries the whitespace that preceded the token in the
 * original source and, once annotated, its {@link InterTokenInfo}.
 *
 * The annotation is written exactly once. The first token of a sequence has no predecessor
 * and stays unannotated.
 */
public final class FormatToken {
    private final Token token;
    private final TokenCategory category;
    private final String precedingWhitespace;
    private InterTokenInfo info;

    private FormatToken(Token token, String precedingWhitespace) {
        this.token = Objects.requireNonNull(token, "token");
        this.precedingWhitespace = Objects.requireNonNull(precedingWhitespace, "precedingWhitespace");
        this.category = TokenClassifier.classify(token.kind());
    }

    public static FormatToken formatToken(Token token) {
        return new FormatToken(token, "");
    }

    public static FormatToken formatToken(Token token, String precedingWhitespace) {
        return new FormatToken(token, precedingWhitespace);
    }

    public Token token() {
        return token;
    }

    public TokenKind kind() {
        return token.kind();
    }

    public String text() {
        return token.text();
    }

    public TokenCategory category() {
        return category;
    }

    /// Source text between the previous token and this one.
    public String precedingWhitespace() {
        return precedingWhitespace;
    }

    public boolean hasNewlineBefore() {
        return newlinesBefore() > 0;
    }

    public int newlinesBefore() {
        return (int) precedingWhitespace.chars()
                                        .filter(ch -> ch == '\n')
                                        .count();
    }

    /**
     * Spaces before this token in the original source, counted after the last newline.
     */
    public int originalSpacesBefore() {
        var lastNewline = precedingWhitespace.lastIndexOf('\n');
        return precedingWhitespace.length() - lastNewline - 1;
    }

    /**
     * Writes the annotation.
     *
     * @throws IllegalStateException if the token is already annotated
     */
    public void annotate(InterTokenInfo info) {
        Objects.requireNonNull(info, "info");
        if (this.info != null) {
            throw new IllegalStateException("Token " + token + " is already annotated with " + this.info.compact());
        }
        this.info = info;
    }

    public boolean isAnnotated() {
        return info != null;
    }

    public Optional<InterTokenInfo> info() {
        return Optional.ofNullable(info);
    }

    /// Required spaces before the token, zero when unannotated.
    public int spacesBefore() {
        return info == null ? 0 : info.spacesRequired();
    }

    public BreakDecision breakDecision() {
        return info == null ? BreakDecision.UNDECIDED : info.breakDecision();
    }

    @Override
    public String toString() {
        return (info == null ? "{-}" : info.compact()) + " " + token;
    }
}
