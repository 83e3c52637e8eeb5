package org.pragmatica.vfmt.format.rules;

import org.pragmatica.vfmt.format.FormatStyle;
import org.pragmatica.vfmt.format.FormatToken;
import org.pragmatica.vfmt.text.NodeKind;
import org.pragmatica.vfmt.text.SyntaxTreeContext;
import org.pragmatica.vfmt.text.TokenKind;
import org.pragmatica.vfmt.token.TokenCategory;
import org.pragmatica.vfmt.token.TokenClassifier;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.pragmatica.vfmt.format.rules.ContextPredicates.isAnySemicolon;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isCallable;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isComment;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isInDeclaredDimensions;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isInRangeLikeContext;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isInsideNumericLiteral;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isInsideUnaryPrefix;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isPairwiseNonmergeable;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isUnaryPrefixOperand;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.limitedOriginalSpaces;
import static org.pragmatica.vfmt.format.rules.Rule.rule;
import static org.pragmatica.vfmt.format.rules.Rule.when;
import static org.pragmatica.vfmt.format.rules.RuleChain.ruleChain;
import static org.pragmatica.vfmt.text.TokenKind.*;

/**
 * Syntactic spacing rules: number of spaces required between two tokens placed on one line.
 *
 * Rules are listed from the highest priority down. Numeric literal cohesion comes first,
 * grouping and operator disambiguation follow, the most generic keyword and punctuation
 * rules come last. When nothing applies, one space is required.
 */
public final class SpacingRules {
    private static final Set<NodeKind> STREAMING = EnumSet.of(NodeKind.STREAMING_CONCATENATION);
    private static final Set<NodeKind> UDP_ENTRIES = EnumSet.of(NodeKind.UDP_COMB_ENTRY,
                                                                NodeKind.UDP_SEQUENCE_ENTRY);
    private static final Set<NodeKind> PACKED = EnumSet.of(NodeKind.PACKED_DIMENSIONS);
    private static final Set<NodeKind> EXPRESSION = EnumSet.of(NodeKind.EXPRESSION);
    private static final Set<NodeKind> CASE_LIKE_ITEMS = EnumSet.of(NodeKind.CASE_ITEM,
                                                                    NodeKind.CASE_INSIDE_ITEM,
                                                                    NodeKind.CASE_PATTERN_ITEM,
                                                                    NodeKind.GENERATE_CASE_ITEM,
                                                                    NodeKind.PROPERTY_CASE_ITEM,
                                                                    NodeKind.RAND_SEQUENCE_CASE_ITEM,
                                                                    NodeKind.COVER_POINT);
    private static final Set<NodeKind> PREFIX_LABELS = EnumSet.of(NodeKind.BLOCK_IDENTIFIER,
                                                                  NodeKind.LABELED_STATEMENT,
                                                                  NodeKind.GENERATE_BLOCK);
    // Parameterized types that keep a space before '#'
    private static final Set<NodeKind> SPACED_PARAMETERIZATION = EnumSet.of(NodeKind.INSTANTIATION_TYPE,
                                                                            NodeKind.BIND_TARGET_INSTANCE,
                                                                            NodeKind.EXTENDS_LIST,
                                                                            NodeKind.BRACE_GROUP);

    public static final RuleChain<Integer> DEFAULT = ruleChain("spacing", 1, List.of(
            when("numeric-literal",
                 "No space inside based numeric literals, \"16'h123\"",
                 pair -> isInsideNumericLiteral(pair.left(), pair.right()),
                 0),
            when("group-inner",
                 "Prefer \"(foo)\" over \"( foo )\", \"[x]\" over \"[ x ]\"",
                 pair -> pair.leftIs(TokenCategory.OPEN_GROUP) || pair.rightIs(TokenCategory.CLOSE_GROUP),
                 0),
            when("unary-prefix",
                 "Bind unary prefix operator close to its operand",
                 pair -> isUnaryPrefixOperand(pair.left(), pair.rightContext())
                         && (!pair.leftIs(TokenCategory.BINARY_OPERATOR)
                             || !TokenClassifier.isUnaryOperator(pair.rightKind())),
                 0),
            when("scope-resolution-after",
                 "Prefer \"::id\" over \":: id\"",
                 pair -> pair.leftIs(SCOPE_RES),
                 0),
            when("comma-before", "No space before comma", pair -> pair.rightIs(COMMA), 0),
            when("comma-after", "Require space after comma", pair -> pair.leftIs(COMMA), 1),
            rule("semicolon-before",
                 "No space before semicolon, except after a colon as in \"default: ;\"",
                 pair -> isAnySemicolon(pair.right())
                         ? Optional.of(pair.leftIs(COLON) ? 1 : 0)
                         : Optional.empty()),
            when("semicolon-after", "Require space after semicolon", pair -> isAnySemicolon(pair.left()), 1),
            when("return-value", "Space between return keyword and return value", pair -> pair.leftIs(RETURN), 1),
            rule("streaming-concatenation", "No space around streaming operators and slice size", SpacingRules::streaming),
            when("event-control-after", "Prefer \"@(\" and \"@*\"", pair -> pair.leftIs(AT), 0),
            when("event-control-before", "Space before \"@\"", pair -> pair.rightIs(AT), 1),
            when("unary-concatenation",
                 "No space between unary operator and concatenation, \"^{a, b}\"",
                 pair -> isInsideUnaryPrefix(pair.rightContext())
                         && TokenClassifier.isUnaryOperator(pair.leftKind())
                         && pair.rightIs(LBRACE),
                 0),
            rule("binary-operator", "Space around binary and assignment operators", SpacingRules::binaryOperator),
            when("empty-text",
                 "No additional space around empty-text tokens",
                 pair -> pair.left()
                             .text()
                             .isEmpty() || pair.right()
                                               .text()
                                               .isEmpty(),
                 0),
            when("udp-entry",
                 "One space around UDP table entries",
                 pair -> pair.rightContext()
                             .isInsideFirst(UDP_ENTRIES, Set.of()),
                 1),
            when("hierarchy",
                 "No space around hierarchy separators, \"a.b\" and \"a::b\"",
                 pair -> pair.leftIs(TokenCategory.HIERARCHY) || pair.rightIs(TokenCategory.HIERARCHY),
                 0),
            when("cast", "No space around cast operator, \"void'(...)\"", pair -> pair.leftIs(APOSTROPHE) || pair.rightIs(APOSTROPHE), 0),
            rule("open-parenthesis", "Space before '(' depends on what is called or declared", SpacingRules::openParenthesis),
            rule("colon-after",
                 "Space after ':', symmetric inside ranges",
                 pair -> pair.leftIs(COLON)
                         ? Optional.of(isInRangeLikeContext(pair.rightContext())
                                       ? rangeOperatorSpaces(pair.left(), pair.leftContext(), pair.style())
                                       : 1)
                         : Optional.empty()),
            when("brace-close-after", "Space after '}', \"struct {...} foo_t\"", pair -> pair.leftIs(RBRACE), 1),
            rule("brace-open-before", "Space before '{' opening a body", SpacingRules::openBrace),
            rule("bracket-open-before", "Space before [packed dimensions] of declarations", SpacingRules::openBracket),
            when("packed-dimensions-after",
                 "Space between [packed dimensions] and declared identifier",
                 pair -> pair.leftIs(RBRACKET)
                         && pair.rightIs(TokenCategory.IDENTIFIER)
                         && pair.rightContext()
                                .directParentsAre(NodeKind.UNQUALIFIED_ID,
                                                  NodeKind.DATA_TYPE_IMPLICIT_BASIC_ID_DIMENSIONS),
                 1),
            when("nonmergeable",
                 "Numbers, identifiers and keywords cannot touch",
                 pair -> isPairwiseNonmergeable(pair.left()) && isPairwiseNonmergeable(pair.right()),
                 1),
            rule("colon-before", "Space before ':' depends on its role", SpacingRules::colonBefore),
            when("keyword-after",
                 "Space after keywords and directives, \"if (\"",
                 pair -> pair.leftIs(TokenCategory.KEYWORD) || pair.leftIs(TokenCategory.PREPROCESSOR_DIRECTIVE),
                 1),
            rule("time-literal-after",
                 "Space after time literals except before ';'",
                 pair -> pair.leftIs(TIME_LITERAL)
                         ? Optional.of(pair.rightIs(SEMICOLON) ? 0 : 1)
                         : Optional.empty()),
            when("cycle-delay-before", "Space before ## delay", pair -> pair.rightIs(POUND_POUND), 1),
            when("unary-operator-after", "Prefer \"++i\" over \"++ i\"", pair -> pair.leftIs(TokenCategory.UNARY_OPERATOR), 0),
            when("unary-operator-before", "Prefer \"i++\" over \"i ++\"", pair -> pair.rightIs(TokenCategory.UNARY_OPERATOR), 0),
            when("multi-dimension", "No space between dimensions, \"a[i][j]\"", pair -> pair.leftIs(RBRACKET) && pair.rightIs(LBRACKET), 0),
            when("hash-after", "No space after # in delays and parameters", pair -> pair.leftIs(HASH), 0),
            rule("hash-before", "Space before # except in parameterized type references", SpacingRules::hashBefore),
            when("keyword-before", "Space before keywords", pair -> pair.rightIs(TokenCategory.KEYWORD), 1),
            rule("paren-close-after",
                 "Space after ')' except before ':'",
                 pair -> pair.leftIs(RPAREN)
                         ? Optional.of(pair.rightIs(COLON) ? 0 : 1)
                         : Optional.empty()),
            rule("macro-close-after",
                 "Space after macro-closing ')' except before ';'",
                 pair -> pair.leftIs(MACRO_CALL_CLOSE_TO_END_LINE)
                         ? Optional.of(isAnySemicolon(pair.right()) ? 0 : 1)
                         : Optional.empty()),
            when("bracket-close-after", "Space after ']'", pair -> pair.leftIs(RBRACKET), 1),
            when("comment-after", "Space after a comment", pair -> isComment(pair.left()), 1)));

    private SpacingRules() {}

    private static Optional<Integer> streaming(TokenPair pair) {
        if (!pair.style()
                 .compactIndexingAndSelections() || !pair.rightContext()
                                                         .isInsideFirst(STREAMING, Set.of())) {
            return Optional.empty();
        }
        if (pair.leftIs(SHIFT_LEFT) || pair.leftIs(SHIFT_RIGHT)) {
            return Optional.of(0);
        }
        if (pair.leftIs(TokenCategory.NUMERIC_LITERAL)
            || pair.leftIs(TokenCategory.IDENTIFIER)
            || pair.leftIs(TokenCategory.KEYWORD)) {
            return Optional.of(0);
        }
        return Optional.empty();
    }

    private static Optional<Integer> binaryOperator(TokenPair pair) {
        var leftBinary = pair.leftIs(TokenCategory.BINARY_OPERATOR);
        var rightBinary = pair.rightIs(TokenCategory.BINARY_OPERATOR);
        if (!leftBinary && !rightBinary) {
            return Optional.empty();
        }
        if (rightBinary && isInRangeLikeContext(pair.rightContext())) {
            return Optional.of(rangeOperatorSpaces(pair.right(), pair.rightContext(), pair.style()));
        }
        if (leftBinary && isInRangeLikeContext(pair.leftContext())) {
            // Same spaces as before the operator
            return Optional.of(rangeOperatorSpaces(pair.left(), pair.leftContext(), pair.style()));
        }
        return Optional.of(1);
    }

    /**
     * Spaces on either side of an operator or colon inside a range: none when compact and
     * outside declared dimensions, otherwise the original spacing before the operator
     * limited to 0 or 1. Computed from the operator token alone, so both sides agree
     * regardless of annotation order.
     */
    private static int rangeOperatorSpaces(FormatToken operator, SyntaxTreeContext context, FormatStyle style) {
        if (style.compactIndexingAndSelections() && !isInDeclaredDimensions(context)) {
            return 0;
        }
        return limitedOriginalSpaces(operator);
    }

    private static Optional<Integer> openParenthesis(TokenPair pair) {
        if (!pair.rightIs(LPAREN)) {
            return Optional.empty();
        }
        if (pair.leftIs(HASH)) {
            return Optional.of(0);
        }
        // ") (" between parameters and ports
        if (pair.leftIs(RPAREN)) {
            return Optional.of(1);
        }
        if (!isCallable(pair.left())) {
            return Optional.empty();
        }
        var rightContext = pair.rightContext();
        if (rightContext.isInside(NodeKind.ACTUAL_NAMED_PORT) || rightContext.isInside(NodeKind.PORT)) {
            return Optional.of(0);
        }
        if (rightContext.isInside(NodeKind.PRIMITIVE_GATE_INSTANCE)) {
            return Optional.of(1);
        }
        if (pair.leftContext()
                .directParentIs(NodeKind.GATE_INSTANCE) && rightContext.isInside(NodeKind.GATE_INSTANCE)) {
            return Optional.of(1);
        }
        if (pair.leftContext()
                .directParentIs(NodeKind.MODULE_HEADER)) {
            return Optional.of(1);
        }
        // Function, task and macro calls
        return Optional.of(0);
    }

    private static Optional<Integer> openBrace(TokenPair pair) {
        if (!pair.rightIs(LBRACE)) {
            return Optional.empty();
        }
        var rightContext = pair.rightContext();
        if (pair.leftIs(TokenCategory.KEYWORD)
            || rightContext.directParentsAre(NodeKind.BRACE_GROUP, NodeKind.CONSTRAINT_DECLARATION)
            || rightContext.directParentsAre(NodeKind.BRACE_GROUP, NodeKind.COVER_POINT)
            || rightContext.directParentsAre(NodeKind.BRACE_GROUP, NodeKind.ENUM_TYPE)
            || pair.leftIs(RPAREN)) {
            return Optional.of(1);
        }
        if (pair.leftIs(RBRACKET) && isInDeclaredDimensions(pair.leftContext())) {
            return Optional.of(1);
        }
        return Optional.of(0);
    }

    private static Optional<Integer> openBracket(TokenPair pair) {
        if (!pair.rightIs(LBRACKET) || !(pair.leftIs(TokenCategory.KEYWORD) || pair.leftIs(TokenCategory.IDENTIFIER))) {
            return Optional.empty();
        }
        return Optional.of(pair.rightContext()
                               .isInsideFirst(PACKED, EXPRESSION)
                           ? 1
                           : 0);
    }

    private static Optional<Integer> colonBefore(TokenPair pair) {
        if (!pair.rightIs(COLON)) {
            return Optional.empty();
        }
        var rightContext = pair.rightContext();
        if (pair.leftIs(TokenKind.DEFAULT) || rightContext.directParentIsOneOf(CASE_LIKE_ITEMS)) {
            return Optional.of(0);
        }
        // End labels: "end : name"
        if (TokenClassifier.isEndKeyword(pair.leftKind())) {
            return Optional.of(1);
        }
        if (rightContext.directParentIsOneOf(PREFIX_LABELS)) {
            return Optional.of(1);
        }
        if (rightContext.directParentIs(NodeKind.CONDITION_EXPRESSION)) {
            return Optional.of(1);
        }
        if (isInRangeLikeContext(rightContext)) {
            return Optional.of(rangeOperatorSpaces(pair.right(), rightContext, pair.style()));
        }
        if (rightContext.directParentIs(NodeKind.VALUE_RANGE)) {
            return Optional.of(1);
        }
        return Optional.empty();
    }

    private static Optional<Integer> hashBefore(TokenPair pair) {
        if (!pair.rightIs(HASH)) {
            return Optional.empty();
        }
        var leftContext = pair.leftContext();
        if (leftContext.directParentIs(NodeKind.UNQUALIFIED_ID)
            && !leftContext.isInsideFirst(SPACED_PARAMETERIZATION, Set.of())) {
            return Optional.of(0);
        }
        return Optional.of(1);
    }
}
