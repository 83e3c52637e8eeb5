package org.pragmatica.vfmt.format;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pragmatica.vfmt.text.SyntaxNode;
import org.pragmatica.vfmt.text.TextStructure;
import org.pragmatica.vfmt.text.Token;
import org.pragmatica.vfmt.text.TreePath;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.vfmt.format.BreakDecision.MUST_APPEND;
import static org.pragmatica.vfmt.format.BreakDecision.MUST_WRAP;
import static org.pragmatica.vfmt.format.BreakDecision.UNDECIDED;
import static org.pragmatica.vfmt.text.NodeKind.*;
import static org.pragmatica.vfmt.text.SyntaxNode.leaf;
import static org.pragmatica.vfmt.text.SyntaxNode.node;
import static org.pragmatica.vfmt.text.TextStructure.textStructure;
import static org.pragmatica.vfmt.text.Token.token;
import static org.pragmatica.vfmt.text.TokenKind.*;

class FormattingAnnotatorTest {
    static final String SOURCE = "module m;\n  wire [7:0] a; // bus\nendmodule\n";

    static final Token MODULE_KW = token(MODULE, 0);
    static final Token NAME = token(SYMBOL_IDENTIFIER, "m", 7);
    static final Token HEADER_END = token(SEMICOLON, 8);
    static final Token WIRE_KW = token(WIRE, 12);
    static final Token OPEN = token(LBRACKET, 17);
    static final Token MSB = token(DEC_NUMBER, "7", 18);
    static final Token RANGE = token(COLON, 19);
    static final Token LSB = token(DEC_NUMBER, "0", 20);
    static final Token CLOSE = token(RBRACKET, 21);
    static final Token WIRE_NAME = token(SYMBOL_IDENTIFIER, "a", 23);
    static final Token DECL_END = token(SEMICOLON, 24);
    static final Token COMMENT = token(EOL_COMMENT, "// bus", 26);
    static final Token END_KW = token(ENDMODULE, 33);

    static final List<Token> TOKENS = List.of(MODULE_KW, NAME, HEADER_END, WIRE_KW, OPEN, MSB, RANGE, LSB, CLOSE,
                                              WIRE_NAME, DECL_END, COMMENT, END_KW);

    static SyntaxNode tree(Token headerEnd) {
        return node(DESCRIPTION_LIST,
                    node(MODULE_DECLARATION,
                         node(MODULE_HEADER, leaf(MODULE_KW), leaf(NAME), leaf(headerEnd)),
                         node(MODULE_ITEM_LIST,
                              node(DATA_DECLARATION,
                                   leaf(WIRE_KW),
                                   node(PACKED_DIMENSIONS,
                                        node(DIMENSION_RANGE, leaf(OPEN), leaf(MSB), leaf(RANGE), leaf(LSB), leaf(CLOSE))),
                                   leaf(WIRE_NAME),
                                   leaf(DECL_END)),
                              leaf(COMMENT)),
                         leaf(END_KW)));
    }

    static TextStructure structure() {
        return textStructure(SOURCE, TOKENS, tree(HEADER_END));
    }

    @Nested
    class Annotation {
        @Test
        void annotate_decidesEveryTokenButFirst() {
            var tokens = FormattingAnnotator.formattingAnnotator()
                                            .annotate(structure());

            assertThat(tokens).hasSize(TOKENS.size());
            assertThat(tokens.get(0)
                             .isAnnotated()).isFalse();
            assertThat(tokens.subList(1, tokens.size())).allMatch(FormatToken::isAnnotated);
            assertThat(tokens).extracting(FormatToken::token)
                              .containsExactlyElementsOf(TOKENS);
        }

        @Test
        void annotate_producesSpacingOfDeclaration() {
            var tokens = FormattingAnnotator.formattingAnnotator()
                                            .annotate(structure());

            assertThat(tokens).extracting(FormatToken::spacesBefore)
                              .containsExactly(0, 1, 0, 1, 1, 0, 0, 0, 0, 1, 0, 2, 1);
        }

        @Test
        void annotate_constrainsCommentLineBreaks() {
            var tokens = FormattingAnnotator.formattingAnnotator()
                                            .annotate(structure());

            assertThat(tokens.get(11)
                             .breakDecision()).isEqualTo(MUST_APPEND);
            assertThat(tokens.get(12)
                             .breakDecision()).isEqualTo(MUST_WRAP);
            assertThat(tokens.get(1)
                             .breakDecision()).isEqualTo(UNDECIDED);
        }

        @Test
        void annotate_recordsOriginalWhitespace() {
            var tokens = FormattingAnnotator.formattingAnnotator()
                                            .annotate(structure());

            assertThat(tokens.get(3)
                             .precedingWhitespace()).isEqualTo("\n  ");
            assertThat(tokens.get(3)
                             .originalSpacesBefore()).isEqualTo(2);
            assertThat(tokens.get(12)
                             .hasNewlineBefore()).isTrue();
            assertThat(tokens.get(0)
                             .precedingWhitespace()).isEmpty();
        }

        @Test
        void annotate_appliesStyle() {
            var style = FormatStyle.defaultStyle()
                                   .withSpacesBeforeComment(4);

            var tokens = FormattingAnnotator.formattingAnnotator(style)
                                            .annotate(structure());

            assertThat(tokens.get(11)
                             .spacesBefore()).isEqualTo(4);
        }

        @Test
        void annotate_penaltiesArePositive() {
            var tokens = FormattingAnnotator.formattingAnnotator()
                                            .annotate(structure());

            assertThat(tokens.subList(1, tokens.size()))
                    .allSatisfy(token -> assertThat(token.info()).hasValueSatisfying(
                            info -> assertThat(info.breakPenalty()).isPositive()));
        }

        @Test
        void annotate_emptyStructureGivesNoTokens() {
            var empty = textStructure("", List.of(), node(DESCRIPTION_LIST));

            assertThat(FormattingAnnotator.formattingAnnotator()
                                          .annotate(empty)).isEmpty();
        }

        @Test
        void annotate_isDeterministic() {
            var annotator = FormattingAnnotator.formattingAnnotator();

            var first = annotator.annotate(structure());
            var second = annotator.annotate(structure());

            assertThat(second).extracting(FormatToken::info)
                              .containsExactlyElementsOf(first.stream()
                                                              .map(FormatToken::info)
                                                              .toList());
        }
    }

    @Nested
    class Contract {
        @Test
        void annotate_rejectsMissingTree() {
            var noTree = textStructure(SOURCE, TOKENS, null);

            assertThatThrownBy(() -> FormattingAnnotator.formattingAnnotator()
                                                        .annotate(noTree))
                    .isInstanceOfSatisfying(FormattingException.class,
                                            e -> assertThat(e.error()).isEqualTo(FormattingError.nullSyntaxTree()));
        }

        @Test
        void annotate_rejectsTokenOutsideOfText() {
            var stray = token(SYMBOL_IDENTIFIER, "zz", 40);
            var structure = textStructure(SOURCE, List.of(MODULE_KW, stray), node(DESCRIPTION_LIST, leaf(MODULE_KW), leaf(stray)));

            assertThatThrownBy(() -> FormattingAnnotator.formattingAnnotator()
                                                        .annotate(structure))
                    .isInstanceOfSatisfying(FormattingException.class,
                                            e -> assertThat(e.error()).isEqualTo(
                                                    FormattingError.tokenOutOfBounds(stray, SOURCE.length())));
        }

        @Test
        void annotate_rejectsTreeWithMissingLeaf() {
            var shortTree = node(DESCRIPTION_LIST, leaf(MODULE_KW), leaf(NAME));
            var structure = textStructure(SOURCE, List.of(MODULE_KW, NAME, HEADER_END), shortTree);

            assertThatThrownBy(() -> FormattingAnnotator.formattingAnnotator()
                                                        .annotate(structure))
                    .isInstanceOf(FormattingException.class)
                    .hasMessage("Token sequence has 3 tokens but syntax tree has 2 leaves");
        }

        @Test
        void annotate_reportsPathOfMismatchedLeaf() {
            var wrong = token(SYMBOL_IDENTIFIER, "m", 8);
            var structure = textStructure(SOURCE, TOKENS, tree(wrong));

            assertThatThrownBy(() -> FormattingAnnotator.formattingAnnotator()
                                                        .annotate(structure))
                    .isInstanceOfSatisfying(FormattingException.class,
                                            e -> assertThat(e.error()).isEqualTo(
                                                    FormattingError.leafTokenMismatch(2,
                                                                                      TreePath.treePath(0, 0, 2),
                                                                                      HEADER_END,
                                                                                      wrong)));
        }

        @Test
        void annotate_skipsEmptyTreeSlots() {
            var withGap = node(DESCRIPTION_LIST, leaf(MODULE_KW), null, leaf(NAME));
            var structure = textStructure(SOURCE, List.of(MODULE_KW, NAME), withGap);

            var tokens = FormattingAnnotator.formattingAnnotator()
                                            .annotate(structure);

            assertThat(tokens.get(1)
                             .spacesBefore()).isEqualTo(1);
        }
    }
}
