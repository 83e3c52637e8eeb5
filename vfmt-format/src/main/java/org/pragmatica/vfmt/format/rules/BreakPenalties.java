package org.pragmatica.vfmt.format.rules;

import org.pragmatica.vfmt.text.NodeKind;
import org.pragmatica.vfmt.token.TokenCategory;
import org.pragmatica.vfmt.token.TokenClassifier;

import java.util.List;

import static org.pragmatica.vfmt.format.rules.Rule.when;
import static org.pragmatica.vfmt.format.rules.RuleChain.ruleChain;
import static org.pragmatica.vfmt.text.TokenKind.ASSIGN;
import static org.pragmatica.vfmt.text.TokenKind.COMMA;
import static org.pragmatica.vfmt.text.TokenKind.DEC_NUMBER;
import static org.pragmatica.vfmt.text.TokenKind.MACRO_CALL_CLOSE_TO_END_LINE;
import static org.pragmatica.vfmt.text.TokenKind.SEMICOLON;
import static org.pragmatica.vfmt.text.TokenKind.UNBASED_NUMBER;

/**
 * Cost of breaking the line between two tokens. Higher values keep tokens together.
 *
 * The penalty is {@code max(1, 5 + 2 * commonAncestors + tokenPenalty + contextPenalty)}:
 * tokens sharing more ancestors are bound tighter, the token and context terms prefer
 * breaking after separators and operators rather than before them.
 */
public final class BreakPenalties {
    public static final int MIN_PENALTY = 1;
    public static final int PENALTY_BIAS = 5;
    public static final int DEPTH_SCALE_FACTOR = 2;

    /// Penalty depending on the two tokens only.
    public static final RuleChain<Integer> TOKEN_PAIR = ruleChain("token-penalty", 0, List.of(
            when("call-parenthesis", "identifier, open-group",
                 pair -> pair.leftIs(TokenCategory.IDENTIFIER) && pair.rightIs(TokenCategory.OPEN_GROUP), 20),
            // Slightly prefer "a .b" over "a. b"
            when("hierarchy-left", "hierarchy separator on left", pair -> pair.leftIs(TokenCategory.HIERARCHY), 50),
            when("hierarchy-right", "hierarchy separator on right", pair -> pair.rightIs(TokenCategory.HIERARCHY), 45),
            when("separator-before", "avoid breaking before ',' or ';'",
                 pair -> pair.rightIs(COMMA) || pair.rightIs(SEMICOLON), 10),
            when("separator-after", "encourage breaking after ',' or ';'",
                 pair -> pair.leftIs(COMMA) || pair.leftIs(SEMICOLON), -5),
            when("assignment-before", "right is '='", pair -> pair.rightIs(ASSIGN), 8),
            when("open-group", "keep '(' with the token on its left",
                 pair -> (!pair.leftIs(TokenCategory.BINARY_OPERATOR) || pair.leftIs(ASSIGN))
                         && pair.rightIs(TokenCategory.OPEN_GROUP), 5),
            when("close-group", "keep ')' with the token on its left",
                 pair -> pair.rightIs(TokenCategory.CLOSE_GROUP) || pair.rightIs(MACRO_CALL_CLOSE_TO_END_LINE), 10),
            when("numeric-width", "numeric width, base",
                 pair -> pair.leftIs(DEC_NUMBER) && pair.rightIs(UNBASED_NUMBER), 90)));

    /// Penalty depending on the tokens and their direct parents.
    public static final RuleChain<Integer> TOKEN_CONTEXT = ruleChain("context-penalty", 0, List.of(
            when("ternary-before", "prefer to split after ternary operators",
                 pair -> pair.rightContext()
                             .directParentIs(NodeKind.CONDITION_EXPRESSION)
                         && TokenClassifier.isTernaryOperator(pair.rightKind()), 10),
            when("ternary-after", "prefer to split after ternary operators",
                 pair -> pair.leftContext()
                             .directParentIs(NodeKind.CONDITION_EXPRESSION)
                         && TokenClassifier.isTernaryOperator(pair.leftKind()), -5),
            when("binary-before", "prefer to split after binary operators",
                 pair -> pair.rightContext()
                             .directParentIs(NodeKind.BINARY_EXPRESSION)
                         && pair.rightIs(TokenCategory.BINARY_OPERATOR), 8),
            when("binary-after", "prefer to split after binary operators",
                 pair -> pair.leftContext()
                             .directParentIs(NodeKind.BINARY_EXPRESSION)
                         && pair.leftIs(TokenCategory.BINARY_OPERATOR), -5)));

    private BreakPenalties() {}

    public static int penalty(TokenPair pair) {
        var depth = DEPTH_SCALE_FACTOR * pair.leftContext()
                                             .commonAncestors(pair.rightContext());
        var tokens = TOKEN_PAIR.evaluate(pair)
                               .value();
        var context = TOKEN_CONTEXT.evaluate(pair)
                                   .value();
        return Math.max(PENALTY_BIAS + depth + tokens + context, MIN_PENALTY);
    }
}
