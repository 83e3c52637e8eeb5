package org.pragmatica.vfmt.format;

import org.pragmatica.vfmt.text.Token;
import org.pragmatica.vfmt.text.TreePath;

/**
 * Violations of the annotation input contract and style configuration errors.
 */
public sealed interface FormattingError {
    String message();

    static FormattingError nullSyntaxTree() {
        return new NullSyntaxTree();
    }

    static FormattingError tokenCountMismatch(int tokens, int leaves) {
        return new TokenCountMismatch(tokens, leaves);
    }

    static FormattingError leafTokenMismatch(int index, TreePath path, Token expected, Token actual) {
        return new LeafTokenMismatch(index, path, expected, actual);
    }

    static FormattingError tokenOutOfBounds(Token token, int contentLength) {
        return new TokenOutOfBounds(token, contentLength);
    }

    static FormattingError invalidStyleValue(String key, String value, String reason) {
        return new InvalidStyleValue(key, value, reason);
    }

    static FormattingError styleReadFailed(String source, Throwable cause) {
        return new StyleReadFailed(source, cause);
    }

    /// Fails fast with this error.
    default FormattingException exception() {
        return new FormattingException(this);
    }

    /**
     * Text structure has no syntax tree.
     */
    record NullSyntaxTree() implements FormattingError {
        @Override
        public String message() {
            return "Syntax tree is missing";
        }
    }

    /**
     * Token sequence and tree leaves differ in length.
     */
    record TokenCountMismatch(int tokens, int leaves) implements FormattingError {
        @Override
        public String message() {
            return "Token sequence has " + tokens + " tokens but syntax tree has " + leaves + " leaves";
        }
    }

    /**
     * Tree leaf does not wrap the token at the same position of the sequence.
     */
    record LeafTokenMismatch(int index, TreePath path, Token expected, Token actual) implements FormattingError {
        @Override
        public String message() {
            return "Leaf " + index + " at " + path + " holds " + actual + " but token sequence has " + expected;
        }
    }

    /**
     * Token span is not part of the source text.
     */
    record TokenOutOfBounds(Token token, int contentLength) implements FormattingError {
        @Override
        public String message() {
            return "Token " + token + " is outside of source text of length " + contentLength;
        }
    }

    record InvalidStyleValue(String key, String value, String reason) implements FormattingError {
        @Override
        public String message() {
            return "Invalid value '" + value + "' for style setting " + key + ": " + reason;
        }
    }

    record StyleReadFailed(String source, Throwable cause) implements FormattingError {
        @Override
        public String message() {
            return "Failed to read style from " + source + ": " + cause.getMessage();
        }
    }
}
