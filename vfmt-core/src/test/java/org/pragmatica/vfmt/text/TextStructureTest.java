package org.pragmatica.vfmt.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.vfmt.text.SyntaxNode.leaf;
import static org.pragmatica.vfmt.text.TextStructure.textStructure;
import static org.pragmatica.vfmt.text.Token.token;

class TextStructureTest {
    private static final String SOURCE = "  wire a;\n  // done\n";

    private final Token wire = token(TokenKind.WIRE, 2);
    private final Token a = token(TokenKind.SYMBOL_IDENTIFIER, "a", 7);
    private final Token semicolon = token(TokenKind.SEMICOLON, 8);
    private final Token comment = token(TokenKind.EOL_COMMENT, "// done", 12);

    private final TextStructure structure = textStructure(SOURCE, List.of(wire, a, semicolon, comment), leaf(wire));

    @Test
    void covers_acceptsTokensMatchingTheSource() {
        assertThat(structure.covers(wire)).isTrue();
        assertThat(structure.covers(comment)).isTrue();
    }

    @Test
    void covers_rejectsMisplacedOrOverlongTokens() {
        assertThat(structure.covers(token(TokenKind.WIRE, 3))).isFalse();
        assertThat(structure.covers(token(TokenKind.EOL_COMMENT, "// done and more", 12))).isFalse();
    }

    @Test
    void textBetween_returnsGapBetweenTokens() {
        assertThat(structure.textBetween(wire, a)).isEqualTo(" ");
        assertThat(structure.textBetween(a, semicolon)).isEmpty();
        assertThat(structure.textBetween(semicolon, comment)).isEqualTo("\n  ");
    }

    @Test
    void leadingText_returnsTextBeforeFirstToken() {
        assertThat(structure.leadingText(wire)).isEqualTo("  ");
    }

    @Test
    void lineColumn_isOneBased() {
        assertThat(structure.lineColumn(0)).hasToString("1:1");
        assertThat(structure.lineColumn(comment.offset())).isEqualTo(new TextStructure.LineColumn(2, 3));
    }

    @Test
    void hasTree_isFalseWithoutRoot() {
        assertThat(structure.hasTree()).isTrue();
        assertThat(textStructure("", List.of(), null).hasTree()).isFalse();
    }
}
