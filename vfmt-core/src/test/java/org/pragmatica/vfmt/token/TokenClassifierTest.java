package org.pragmatica.vfmt.token;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.pragmatica.vfmt.text.TokenKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.vfmt.text.TokenKind.*;
import static org.pragmatica.vfmt.token.TokenClassifier.classify;

class TokenClassifierTest {

    @ParameterizedTest
    @EnumSource(TokenKind.class)
    void classify_isTotal(TokenKind kind) {
        assertThat(classify(kind)).isNotNull();
    }

    @ParameterizedTest
    @CsvSource({
            "LPAREN, OPEN_GROUP",
            "LBRACE, OPEN_GROUP",
            "RBRACKET, CLOSE_GROUP",
            "MACRO_CALL_CLOSE_TO_END_LINE, CLOSE_GROUP",
            "COMMA, SEPARATOR",
            "SEMICOLON, SEPARATOR",
            "DOT, HIERARCHY",
            "SCOPE_RES, HIERARCHY",
            "COLON, CONTEXTUAL_OPERATOR",
            "HASH, CONTEXTUAL_OPERATOR",
            "AT, CONTEXTUAL_OPERATOR",
            "TILDE, CONTEXTUAL_OPERATOR",
            "MINUS, BINARY_OPERATOR",
            "QUESTION, BINARY_OPERATOR",
            "LESS_EQ, BINARY_OPERATOR",
            "NXOR, BINARY_OPERATOR",
            "PIPE_ARROW2, BINARY_OPERATOR",
            "INCREMENT, UNARY_OPERATOR",
            "NAND, UNARY_OPERATOR",
            "POUND_POUND, UNARY_OPERATOR",
            "SYMBOL_IDENTIFIER, IDENTIFIER",
            "SYSTEM_TF_IDENTIFIER, IDENTIFIER",
            "PP_IDENTIFIER, IDENTIFIER",
            "MACRO_CALL_ID, MACRO",
            "MACRO_ARG, MACRO",
            "PP_DEFINE_BODY, MACRO",
            "DEC_NUMBER, NUMERIC_LITERAL",
            "HEX_DIGITS, NUMERIC_LITERAL",
            "TIME_LITERAL, NUMERIC_LITERAL",
            "BIN_BASE, NUMERIC_BASE",
            "HEX_BASE, NUMERIC_BASE",
            "STRING_LITERAL, STRING_LITERAL",
            "EOL_COMMENT, EOL_COMMENT",
            "BLOCK_COMMENT, BLOCK_COMMENT",
            "PP_IFDEF, PREPROCESSOR_DIRECTIVE",
            "PP_UNDEF, PREPROCESSOR_DIRECTIVE",
            "DR_TIMESCALE, KEYWORD",
            "ALWAYS, KEYWORD",
            "XOR, KEYWORD",
            "DOT_STAR, KEYWORD",
            "EDGE_DESCRIPTOR, EDGE_DESCRIPTOR",
            "LINE_CONTINUATION, UNKNOWN",
            "EOF, UNKNOWN"
    })
    void classify_mapsKindToCategory(TokenKind kind, TokenCategory expected) {
        assertThat(classify(kind)).isEqualTo(expected);
    }

    @Test
    void unaryOperators_includeOverloadedBinaryCharacters() {
        assertThat(TokenClassifier.isUnaryOperator(MINUS)).isTrue();
        assertThat(TokenClassifier.isUnaryOperator(AMPERSAND)).isTrue();
        assertThat(TokenClassifier.isUnaryOperator(TILDE)).isTrue();
        assertThat(TokenClassifier.isUnaryOperator(NXOR)).isTrue();
        assertThat(TokenClassifier.isUnaryOperator(STAR)).isFalse();
        assertThat(TokenClassifier.isUnaryOperator(ASSIGN)).isFalse();
    }

    @Test
    void ternaryOperators_areQuestionAndColon() {
        assertThat(TokenClassifier.isTernaryOperator(QUESTION)).isTrue();
        assertThat(TokenClassifier.isTernaryOperator(COLON)).isTrue();
        assertThat(TokenClassifier.isTernaryOperator(SCOPE_RES)).isFalse();
    }

    @Test
    void endKeywords_closeConstructs() {
        assertThat(TokenClassifier.isEndKeyword(END)).isTrue();
        assertThat(TokenClassifier.isEndKeyword(ENDMODULE)).isTrue();
        assertThat(TokenClassifier.isEndKeyword(JOIN_NONE)).isTrue();
        assertThat(TokenClassifier.isEndKeyword(BEGIN)).isFalse();
        assertThat(TokenClassifier.isEndKeyword(PP_ENDIF)).isFalse();
    }

    @Test
    void callableKeywords_coverArrayMethodsAndConstructors() {
        assertThat(TokenClassifier.isCallableKeyword(NEW)).isTrue();
        assertThat(TokenClassifier.isCallableKeyword(RANDOMIZE)).isTrue();
        assertThat(TokenClassifier.isCallableKeyword(UNIQUE)).isTrue();
        assertThat(TokenClassifier.isCallableKeyword(IF)).isFalse();
    }

    @Test
    void preprocessorPredicates_distinguishConditionals() {
        assertThat(TokenClassifier.isPreprocessorKeyword(PP_DEFINE)).isTrue();
        assertThat(TokenClassifier.isPreprocessorKeyword(DR_TIMESCALE)).isFalse();
        assertThat(TokenClassifier.isPreprocessorConditional(PP_ELSIF)).isTrue();
        assertThat(TokenClassifier.isPreprocessorConditional(PP_INCLUDE)).isFalse();
    }

    @Test
    void macroNames_excludeArgumentsAndBodies() {
        assertThat(TokenClassifier.isMacroName(MACRO_IDENTIFIER)).isTrue();
        assertThat(TokenClassifier.isMacroName(MACRO_CALL_ID)).isTrue();
        assertThat(TokenClassifier.isMacroName(MACRO_ARG)).isFalse();
        assertThat(TokenClassifier.isMacroName(PP_DEFINE_BODY)).isFalse();
    }

    @Test
    void categories_reportCommentsAndWordLikeTokens() {
        assertThat(TokenCategory.EOL_COMMENT.isComment()).isTrue();
        assertThat(TokenCategory.BLOCK_COMMENT.isComment()).isTrue();
        assertThat(TokenCategory.SEPARATOR.isComment()).isFalse();
        assertThat(TokenCategory.KEYWORD.isWordLike()).isTrue();
        assertThat(TokenCategory.MACRO.isWordLike()).isTrue();
        assertThat(TokenCategory.NUMERIC_LITERAL.isWordLike()).isFalse();
    }
}
