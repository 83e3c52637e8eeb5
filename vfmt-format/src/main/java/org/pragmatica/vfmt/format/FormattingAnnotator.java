package org.pragmatica.vfmt.format;

import org.pragmatica.vfmt.text.SyntaxTreeContext;
import org.pragmatica.vfmt.text.TextStructure;
import org.pragmatica.vfmt.text.Token;
import org.pragmatica.vfmt.text.TreePath;
import org.pragmatica.vfmt.text.TreePathVisitor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Annotates a whole {@link TextStructure}: collects the ancestor context of every token in
 * one tree walk, then annotates each token against its predecessor.
 *
 * Input that breaks the contract between token sequence and syntax tree fails fast with
 * {@link FormattingException}; no partial annotation is returned.
 */
public final class FormattingAnnotator {
    private static final Logger log = LoggerFactory.getLogger(FormattingAnnotator.class);

    private final TokenAnnotator tokenAnnotator;

    private FormattingAnnotator(TokenAnnotator tokenAnnotator) {
        this.tokenAnnotator = tokenAnnotator;
    }

    public static FormattingAnnotator formattingAnnotator() {
        return new FormattingAnnotator(TokenAnnotator.tokenAnnotator());
    }

    public static FormattingAnnotator formattingAnnotator(FormatStyle style) {
        return new FormattingAnnotator(TokenAnnotator.tokenAnnotator(style));
    }

    public FormatStyle style() {
        return tokenAnnotator.style();
    }

    /**
     * Annotate every token of the structure.
     *
     * @return format tokens in source order, all but the first annotated
     * @throws FormattingException if the tree is missing, a token lies outside the source
     *                             text or tokens and tree leaves do not correspond
     */
    public List<FormatToken> annotate(TextStructure structure) {
        if (!structure.hasTree()) {
            throw FormattingError.nullSyntaxTree()
                                 .exception();
        }
        var tokens = structure.tokens();
        checkBounds(structure, tokens);

        var contexts = collectContexts(structure, tokens);
        var formatTokens = formatTokens(structure, tokens);

        for (int i = 1; i < formatTokens.size(); i++) {
            tokenAnnotator.annotate(formatTokens.get(i - 1), formatTokens.get(i), contexts.get(i - 1), contexts.get(i));
        }
        if (log.isDebugEnabled()) {
            log.debug("Annotated {} tokens, break decisions {}", formatTokens.size(), summary(formatTokens));
        }
        return formatTokens;
    }

    private static void checkBounds(TextStructure structure, List<Token> tokens) {
        for (var token : tokens) {
            if (!structure.covers(token)) {
                throw FormattingError.tokenOutOfBounds(token,
                                                       structure.contents()
                                                                .length())
                                     .exception();
            }
        }
    }

    private static List<SyntaxTreeContext> collectContexts(TextStructure structure, List<Token> tokens) {
        var contexts = new ArrayList<SyntaxTreeContext>(tokens.size());
        var paths = new ArrayList<TreePath>(tokens.size());
        var leaves = new ArrayList<Token>(tokens.size());

        TreePathVisitor.traverse(structure.root(), (token, context, path) -> {
            leaves.add(token);
            contexts.add(context);
            paths.add(path);
        });

        if (leaves.size() != tokens.size()) {
            throw FormattingError.tokenCountMismatch(tokens.size(), leaves.size())
                                 .exception();
        }
        for (int i = 0; i < tokens.size(); i++) {
            if (!leaves.get(i)
                       .equals(tokens.get(i))) {
                throw FormattingError.leafTokenMismatch(i, paths.get(i), tokens.get(i), leaves.get(i))
                                     .exception();
            }
        }
        return contexts;
    }

    private static List<FormatToken> formatTokens(TextStructure structure, List<Token> tokens) {
        var result = new ArrayList<FormatToken>(tokens.size());
        Token previous = null;
        for (var token : tokens) {
            var whitespace = previous == null
                             ? structure.leadingText(token)
                             : structure.textBetween(previous, token);
            result.add(FormatToken.formatToken(token, whitespace));
            previous = token;
        }
        return result;
    }

    private static Map<BreakDecision, Integer> summary(List<FormatToken> tokens) {
        var counts = new EnumMap<BreakDecision, Integer>(BreakDecision.class);
        tokens.stream()
              .filter(FormatToken::isAnnotated)
              .forEach(token -> counts.merge(token.breakDecision(), 1, Integer::sum));
        return counts;
    }
}
