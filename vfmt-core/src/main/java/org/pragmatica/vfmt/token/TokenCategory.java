package org.pragmatica.vfmt.token;

/**
 * Coarse lexical category of a token, the first dispatch key of the spacing rules.
 */
public enum TokenCategory {
    IDENTIFIER,
    KEYWORD,
    /// Width, unbased number, digits of a based number, real and time literals.
    NUMERIC_LITERAL,
    /// Base marker of a based number, e.g. {@code 'h}.
    NUMERIC_BASE,
    STRING_LITERAL,
    UNARY_OPERATOR,
    BINARY_OPERATOR,
    /// Operator or punctuation whose role is decided by syntax context: {@code : # @ ' ~ !}.
    CONTEXTUAL_OPERATOR,
    /// Scope resolution and member access.
    HIERARCHY,
    OPEN_GROUP,
    CLOSE_GROUP,
    /// Comma and semicolon.
    SEPARATOR,
    EDGE_DESCRIPTOR,
    EOL_COMMENT,
    BLOCK_COMMENT,
    PREPROCESSOR_DIRECTIVE,
    /// Macro identifiers, macro calls, unlexed macro arguments and definition bodies.
    MACRO,
    UNKNOWN;

    public boolean isComment() {
        return this == EOL_COMMENT || this == BLOCK_COMMENT;
    }

    /// Identifier, keyword, macro name or directive: two of these cannot touch without
    /// merging into a different token.
    public boolean isWordLike() {
        return this == IDENTIFIER || this == KEYWORD || this == MACRO || this == PREPROCESSOR_DIRECTIVE;
    }
}
