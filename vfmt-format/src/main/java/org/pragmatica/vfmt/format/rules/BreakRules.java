package org.pragmatica.vfmt.format.rules;

import org.pragmatica.vfmt.format.BreakDecision;
import org.pragmatica.vfmt.text.TokenKind;
import org.pragmatica.vfmt.token.TokenClassifier;

import java.util.List;
import java.util.Optional;

import static org.pragmatica.vfmt.format.BreakDecision.MUST_APPEND;
import static org.pragmatica.vfmt.format.BreakDecision.MUST_WRAP;
import static org.pragmatica.vfmt.format.BreakDecision.PRESERVE;
import static org.pragmatica.vfmt.format.BreakDecision.UNDECIDED;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isAnySemicolon;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isComment;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isInDeclaredDimensions;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isInRangeLikeContext;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isInsideNumericLiteral;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isUnaryPrefixOperand;
import static org.pragmatica.vfmt.format.rules.Rule.rule;
import static org.pragmatica.vfmt.format.rules.Rule.when;
import static org.pragmatica.vfmt.format.rules.RuleChain.ruleChain;
import static org.pragmatica.vfmt.text.TokenKind.BEGIN;
import static org.pragmatica.vfmt.text.TokenKind.COLON;
import static org.pragmatica.vfmt.text.TokenKind.COMMA;
import static org.pragmatica.vfmt.text.TokenKind.ELSE;
import static org.pragmatica.vfmt.text.TokenKind.END;
import static org.pragmatica.vfmt.text.TokenKind.HASH;
import static org.pragmatica.vfmt.text.TokenKind.LBRACKET;
import static org.pragmatica.vfmt.text.TokenKind.LPAREN;
import static org.pragmatica.vfmt.text.TokenKind.MACRO_ARG;
import static org.pragmatica.vfmt.text.TokenKind.MACRO_CALL_CLOSE_TO_END_LINE;
import static org.pragmatica.vfmt.text.TokenKind.MACRO_CALL_ID;
import static org.pragmatica.vfmt.text.TokenKind.PP_IDENTIFIER;
import static org.pragmatica.vfmt.text.TokenKind.RBRACE;
import static org.pragmatica.vfmt.text.TokenKind.RBRACKET;
import static org.pragmatica.vfmt.text.TokenKind.RPAREN;
import static org.pragmatica.vfmt.text.TokenKind.SEMICOLON;
import static org.pragmatica.vfmt.text.TokenKind.TIME_LITERAL;

/**
 * Syntactic line break rules. Anything not constrained here is left {@link BreakDecision#UNDECIDED}
 * for the layout optimizer.
 */
public final class BreakRules {

    public static final RuleChain<BreakDecision> DEFAULT = ruleChain("breaking", UNDECIDED, List.of(
            when("numeric-literal",
                 "Never separate numeric width, base and digits",
                 pair -> isInsideNumericLiteral(pair.left(), pair.right()),
                 MUST_APPEND),
            when("declared-dimensions",
                 "Leave line breaks inside [dimensions] untouched",
                 pair -> isInDeclaredDimensions(pair.rightContext()) && !touchesDimensionPunctuation(pair.leftKind())
                         && !touchesDimensionPunctuation(pair.rightKind()),
                 PRESERVE),
            when("unary-prefix",
                 "Never separate unary prefix operator from its operand",
                 pair -> isUnaryPrefixOperand(pair.left(), pair.rightContext()),
                 MUST_APPEND),
            when("macro-parenthesis",
                 "No break between macro name and '('",
                 pair -> (pair.leftIs(PP_IDENTIFIER) || pair.leftIs(MACRO_CALL_ID)) && pair.rightIs(LPAREN),
                 MUST_APPEND),
            when("end-keyword",
                 "end* keywords start their own line",
                 pair -> TokenClassifier.isEndKeyword(pair.rightKind()),
                 MUST_WRAP),
            rule("else-clause", "'else' placement depends on what it follows", BreakRules::elseClause),
            when("begin-attached",
                 "'begin' stays on the line of 'else' or ')'",
                 pair -> pair.rightIs(BEGIN) && (pair.leftIs(ELSE) || pair.leftIs(RPAREN)),
                 MUST_APPEND),
            when("macro-close-own-line",
                 "Macro-closing ')' ends its line except before a comment or ';'",
                 pair -> pair.leftIs(MACRO_CALL_CLOSE_TO_END_LINE)
                         && !isComment(pair.right())
                         && !isAnySemicolon(pair.right())
                         && !isInRangeLikeContext(pair.leftContext()),
                 MUST_WRAP),
            when("hash-attached",
                 "Never separate # from what follows",
                 pair -> pair.leftIs(HASH),
                 MUST_APPEND),
            when("delay-statement",
                 "Keep delay statements together, \"#1ps;\"",
                 pair -> pair.leftIs(TIME_LITERAL) && pair.rightIs(SEMICOLON),
                 MUST_APPEND),
            when("multi-line-macro-argument",
                 "Multi-line unlexed macro arguments start their own line",
                 pair -> pair.leftIs(COMMA) && pair.rightIs(MACRO_ARG) && pair.right()
                                                                              .text()
                                                                              .indexOf('\n') >= 0,
                 MUST_WRAP)));

    private BreakRules() {}

    private static Optional<BreakDecision> elseClause(TokenPair pair) {
        if (!pair.rightIs(ELSE)) {
            return Optional.empty();
        }
        if (pair.leftIs(END)) {
            return Optional.of(pair.style()
                                   .wrapEndElseClauses()
                               ? MUST_WRAP
                               : MUST_APPEND);
        }
        if (pair.leftIs(RBRACE)) {
            return Optional.of(MUST_APPEND);
        }
        return Optional.of(MUST_WRAP);
    }

    private static boolean touchesDimensionPunctuation(TokenKind kind) {
        return kind == LBRACKET || kind == RBRACKET || kind == COLON;
    }
}
