package org.pragmatica.vfmt.format;

import org.pragmatica.vfmt.format.rules.BreakPenalties;
import org.pragmatica.vfmt.format.rules.BreakRules;
import org.pragmatica.vfmt.format.rules.CommentOverlay;
import org.pragmatica.vfmt.format.rules.RuleChain;
import org.pragmatica.vfmt.format.rules.SpacingRules;
import org.pragmatica.vfmt.format.rules.TokenPair;
import org.pragmatica.vfmt.text.SyntaxTreeContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides spacing and line break constraints between adjacent tokens.
 *
 * Comment and preprocessor rules are evaluated first, then the syntactic spacing and
 * break rules. Every pair gets a definite answer: one space and an undecided break when
 * no rule applies. The annotator holds no state besides its style and is safe to share.
 */
public final class TokenAnnotator {
    private static final Logger log = LoggerFactory.getLogger(TokenAnnotator.class);

    private static final RuleChain<Integer> SPACING = CommentOverlay.SPACING.then(SpacingRules.DEFAULT);
    private static final RuleChain<BreakDecision> BREAKING = CommentOverlay.BREAKING.then(BreakRules.DEFAULT);

    private final FormatStyle style;

    private TokenAnnotator(FormatStyle style) {
        this.style = style;
    }

    /**
     * Factory method for creating an annotator with default style.
     */
    public static TokenAnnotator tokenAnnotator() {
        return new TokenAnnotator(FormatStyle.defaultStyle());
    }

    /**
     * Factory method for creating an annotator with custom style.
     */
    public static TokenAnnotator tokenAnnotator(FormatStyle style) {
        return new TokenAnnotator(style);
    }

    public FormatStyle style() {
        return style;
    }

    /**
     * Decide the relationship of {@code curr} to {@code prev} and write it into {@code curr}.
     *
     * @param prev        preceding token, annotated before unless it is the first one
     * @param curr        token to annotate
     * @param prevContext ancestors of the preceding token
     * @param currContext ancestors of the current token
     * @return the written annotation
     * @throws IllegalStateException if {@code curr} is already annotated
     */
    public InterTokenInfo annotate(FormatToken prev,
                                   FormatToken curr,
                                   SyntaxTreeContext prevContext,
                                   SyntaxTreeContext currContext) {
        var info = decide(prev, curr, prevContext, currContext);
        curr.annotate(info);
        return info;
    }

    /**
     * Decide the relationship of {@code curr} to {@code prev} without writing it.
     */
    public InterTokenInfo decide(FormatToken prev,
                                 FormatToken curr,
                                 SyntaxTreeContext prevContext,
                                 SyntaxTreeContext currContext) {
        var pair = TokenPair.tokenPair(prev, curr, prevContext, currContext, style);
        var spacing = SPACING.evaluate(pair);
        var breaking = BREAKING.evaluate(pair);
        var info = InterTokenInfo.interTokenInfo(spacing.value(), BreakPenalties.penalty(pair), breaking.value());

        if (log.isTraceEnabled()) {
            log.trace("{} -> {} spacing: {}, break: {}", pair, info.compact(), spacing, breaking);
        }
        return info;
    }
}
