package org.pragmatica.vfmt.text;

import java.util.List;
import java.util.Objects;

/**
 * One unit of formatting input: the original source text, its token sequence and the
 * syntax tree built over those tokens.
 *
 * @param contents original source text; token offsets index into it
 * @param tokens   token sequence in source order
 * @param root     syntax tree root, may be {@code null} when the parser produced no tree
 */
public record TextStructure(String contents, List<Token> tokens, SyntaxNode root) {
    public TextStructure {
        Objects.requireNonNull(contents, "contents");
        tokens = List.copyOf(tokens);
    }

    public static TextStructure textStructure(String contents, List<Token> tokens, SyntaxNode root) {
        return new TextStructure(contents, tokens, root);
    }

    /**
     * True if the token's span lies within the source text and its text matches it.
     */
    public boolean covers(Token token) {
        return token.end() <= contents.length()
               && contents.regionMatches(token.offset(), token.text(), 0, token.text().length());
    }

    /**
     * Source text between the end of {@code left} and the start of {@code right}.
     * Empty if the tokens touch or overlap.
     */
    public String textBetween(Token left, Token right) {
        var start = Math.min(left.end(), contents.length());
        var end = Math.min(right.offset(), contents.length());
        if (end <= start) {
            return "";
        }
        return contents.substring(start, end);
    }

    /**
     * Source text before the first token.
     */
    public String leadingText(Token first) {
        return contents.substring(0, Math.min(first.offset(), contents.length()));
    }

    /**
     * 1-based line and column of a source offset.
     */
    public LineColumn lineColumn(int offset) {
        var limit = Math.min(offset, contents.length());
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < limit; i++) {
            if (contents.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new LineColumn(line, limit - lineStart + 1);
    }

    public record LineColumn(int line, int column) {
        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    public boolean hasTree() {
        return root != null;
    }
}
