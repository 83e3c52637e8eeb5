package org.pragmatica.vfmt.text;

import java.util.Objects;

/**
 * Immutable lexical token: kind, source text and start offset within the source buffer.
 *
 * @param kind   lexical kind
 * @param text   exact source text of the token (empty for EOF and some synthesized tokens)
 * @param offset start of the token within the source buffer
 */
public record Token(TokenKind kind, String text, int offset) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (offset < 0) {
            throw new IllegalArgumentException("Negative token offset: " + offset);
        }
    }

    /**
     * Factory method for a token at the given source offset.
     */
    public static Token token(TokenKind kind, String text, int offset) {
        return new Token(kind, text, offset);
    }

    /**
     * Factory method for a fixed-spelling token at the given source offset.
     */
    public static Token token(TokenKind kind, int offset) {
        return new Token(kind, kind.spelling(), offset);
    }

    /**
     * Offset one past the last character of the token.
     */
    public int end() {
        return offset + text.length();
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + offset;
    }
}
