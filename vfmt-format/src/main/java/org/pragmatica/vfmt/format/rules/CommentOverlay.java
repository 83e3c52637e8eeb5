package org.pragmatica.vfmt.format.rules;

import org.pragmatica.vfmt.format.BreakDecision;
import org.pragmatica.vfmt.token.TokenCategory;
import org.pragmatica.vfmt.token.TokenClassifier;

import java.util.List;
import java.util.Optional;

import static org.pragmatica.vfmt.format.BreakDecision.MUST_APPEND;
import static org.pragmatica.vfmt.format.BreakDecision.MUST_WRAP;
import static org.pragmatica.vfmt.format.BreakDecision.PRESERVE;
import static org.pragmatica.vfmt.format.BreakDecision.UNDECIDED;
import static org.pragmatica.vfmt.format.rules.ContextPredicates.isComment;
import static org.pragmatica.vfmt.format.rules.Rule.rule;
import static org.pragmatica.vfmt.format.rules.Rule.when;
import static org.pragmatica.vfmt.format.rules.RuleChain.ruleChain;
import static org.pragmatica.vfmt.text.TokenKind.ESCAPED_IDENTIFIER;
import static org.pragmatica.vfmt.text.TokenKind.LINE_CONTINUATION;
import static org.pragmatica.vfmt.text.TokenKind.PP_DEFINE;
import static org.pragmatica.vfmt.text.TokenKind.PP_DEFINE_BODY;
import static org.pragmatica.vfmt.text.TokenKind.PP_ELSE;
import static org.pragmatica.vfmt.text.TokenKind.PP_ENDIF;

/**
 * Rules for comments, preprocessor directives, macro definitions, line continuations and
 * escaped identifiers. Evaluated before the syntactic rules and override them.
 */
public final class CommentOverlay {

    public static final RuleChain<Integer> SPACING = ruleChain("comment-spacing", 1, List.of(
            when("escaped-identifier-end",
                 "Escaped identifiers must end with whitespace",
                 pair -> pair.leftIs(ESCAPED_IDENTIFIER),
                 1),
            when("directive-before",
                 "Separate preprocessor directives from the token on the left",
                 pair -> TokenClassifier.isPreprocessorKeyword(pair.rightKind()),
                 1),
            when("line-continuation-before",
                 "No space before \\ line continuation",
                 pair -> pair.rightIs(LINE_CONTINUATION),
                 0),
            when("line-continuation-after",
                 "No space after \\ line continuation",
                 pair -> pair.leftIs(LINE_CONTINUATION),
                 0),
            rule("comment-before",
                 "Separate trailing comments from code",
                 pair -> isComment(pair.right())
                         ? Optional.of(pair.style().spacesBeforeComment())
                         : Optional.empty()),
            when("eol-comment-after",
                 "Nothing follows an end-of-line comment on its line",
                 pair -> pair.leftIs(TokenCategory.EOL_COMMENT),
                 1)));

    public static final RuleChain<BreakDecision> BREAKING = ruleChain("comment-breaking", UNDECIDED, List.of(
            when("directive-own-line",
                 "Preprocessor directives start their own line",
                 pair -> TokenClassifier.isPreprocessorKeyword(pair.rightKind()),
                 MUST_WRAP),
            when("line-continuation-attached",
                 "Keep \\ line continuation attached to its left neighbor",
                 pair -> pair.rightIs(LINE_CONTINUATION),
                 MUST_APPEND),
            when("line-continuation-newline",
                 "\\ line continuation is always followed by a newline",
                 pair -> pair.leftIs(LINE_CONTINUATION),
                 MUST_WRAP),
            when("define-name",
                 "Keep `define and macro name together",
                 pair -> pair.leftIs(PP_DEFINE),
                 MUST_APPEND),
            rule("define-body",
                 "Macro definition body starts on the same line unless it spans lines",
                 pair -> pair.rightIs(PP_DEFINE_BODY)
                         ? Optional.of(newlines(pair.right()
                                                    .text()) >= 2 ? PRESERVE : MUST_APPEND)
                         : Optional.empty()),
            when("newline-terminated",
                 "End-of-line comments and macro bodies end their line",
                 pair -> pair.leftIs(TokenCategory.EOL_COMMENT) || pair.leftIs(PP_DEFINE_BODY),
                 MUST_WRAP),
            when("eol-comment-same-line",
                 "End-of-line comment stays on the line of the tokens to its left",
                 pair -> pair.rightIs(TokenCategory.EOL_COMMENT) && !pair.newlineBetween(),
                 MUST_APPEND),
            when("block-comment-line-break",
                 "Keep the line break around a block comment",
                 pair -> (pair.leftIs(TokenCategory.BLOCK_COMMENT) || pair.rightIs(TokenCategory.BLOCK_COMMENT))
                         && pair.newlineBetween(),
                 MUST_WRAP),
            rule("conditional-end-own-line",
                 "`else and `endif end their line except for a trailing comment",
                 pair -> pair.leftIs(PP_ELSE) || pair.leftIs(PP_ENDIF)
                         ? Optional.of(isComment(pair.right()) ? UNDECIDED : MUST_WRAP)
                         : Optional.empty())));

    private CommentOverlay() {}

    private static long newlines(String text) {
        return text.chars()
                   .filter(ch -> ch == '\n')
                   .count();
    }
}
