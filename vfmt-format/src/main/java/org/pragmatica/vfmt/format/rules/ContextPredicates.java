package org.pragmatica.vfmt.format.rules;

import org.pragmatica.vfmt.format.FormatToken;
import org.pragmatica.vfmt.text.NodeKind;
import org.pragmatica.vfmt.text.SyntaxTreeContext;
import org.pragmatica.vfmt.text.TokenKind;
import org.pragmatica.vfmt.token.TokenCategory;
import org.pragmatica.vfmt.token.TokenClassifier;

import java.util.EnumSet;
import java.util.Set;

/**
 * Token and context tests shared by the spacing and break rules.
 */
final class ContextPredicates {
    private static final Set<NodeKind> UNARY_PREFIX = EnumSet.of(NodeKind.UNARY_PREFIX_EXPRESSION);
    private static final Set<NodeKind> EXPRESSION = EnumSet.of(NodeKind.EXPRESSION);
    private static final Set<NodeKind> DECLARED_DIMENSIONS = EnumSet.of(NodeKind.PACKED_DIMENSIONS,
                                                                        NodeKind.UNPACKED_DIMENSIONS);
    private static final Set<NodeKind> RANGE_LIKE = EnumSet.of(NodeKind.DIMENSION_SCALAR,
                                                               NodeKind.DIMENSION_RANGE,
                                                               NodeKind.DIMENSION_SLICE,
                                                               NodeKind.CYCLE_DELAY_RANGE);

    private ContextPredicates() {}

    /**
     * Left token is a prefix operator bound to the right token: a unary operator applied
     * inside a unary prefix expression, or a {@code ##} cycle delay.
     */
    static boolean isUnaryPrefixOperand(FormatToken left, SyntaxTreeContext rightContext) {
        return (TokenClassifier.isUnaryOperator(left.kind())
                && rightContext.isInsideFirst(UNARY_PREFIX, EXPRESSION))
               || left.kind() == TokenKind.POUND_POUND;
    }

    static boolean isInsideUnaryPrefix(SyntaxTreeContext context) {
        return context.isInsideFirst(UNARY_PREFIX, Set.of());
    }

    /**
     * Pair of consecutive parts of one numeric literal: width and base, base and digits,
     * or width and unbased value.
     */
    static boolean isInsideNumericLiteral(FormatToken left, FormatToken right) {
        return (left.category() == TokenCategory.NUMERIC_LITERAL && right.category() == TokenCategory.NUMERIC_BASE)
               || left.category() == TokenCategory.NUMERIC_BASE
               || (left.kind() == TokenKind.DEC_NUMBER && right.kind() == TokenKind.UNBASED_NUMBER);
    }

    static boolean isInDeclaredDimensions(SyntaxTreeContext context) {
        return context.isInsideFirst(DECLARED_DIMENSIONS, Set.of());
    }

    /// Inside an index, a dimension or a cycle delay range.
    static boolean isInRangeLikeContext(SyntaxTreeContext context) {
        return context.isInsideFirst(RANGE_LIKE, Set.of());
    }

    /**
     * Two tokens of this kind cannot touch without lexing as a different token.
     */
    static boolean isPairwiseNonmergeable(FormatToken token) {
        return token.kind() == TokenKind.DEC_NUMBER || token.category()
                                                            .isWordLike();
    }

    /// Identifier-like token that may be followed by a call's argument list.
    static boolean isCallable(FormatToken token) {
        return token.category() == TokenCategory.IDENTIFIER
               || TokenClassifier.isMacroName(token.kind())
               || TokenClassifier.isCallableKeyword(token.kind());
    }

    static boolean isAnySemicolon(FormatToken token) {
        return token.kind() == TokenKind.SEMICOLON;
    }

    static boolean isComment(FormatToken token) {
        return token.category()
                    .isComment();
    }

    /**
     * Original spaces before the token limited to 0 or 1. A line break counts as no space.
     */
    static int limitedOriginalSpaces(FormatToken token) {
        if (token.hasNewlineBefore()) {
            return 0;
        }
        return Math.min(token.originalSpacesBefore(), 1);
    }
}
