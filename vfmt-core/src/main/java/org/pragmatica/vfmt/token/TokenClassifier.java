package org.pragmatica.vfmt.token;

import org.pragmatica.vfmt.text.TokenKind;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.pragmatica.vfmt.text.TokenKind.*;

/**
 * Context-free classification of token kinds.
 */
public final class TokenClassifier {
    private static final Set<TokenKind> UNARY_OPERATORS = EnumSet.of(PLUS,
                                                                     MINUS,
                                                                     TILDE,
                                                                     AMPERSAND,
                                                                     BANG,
                                                                     PIPE,
                                                                     CARET,
                                                                     NAND,
                                                                     NOR,
                                                                     NXOR,
                                                                     INCREMENT,
                                                                     DECREMENT);

    private static final Set<TokenKind> END_KEYWORDS = EnumSet.of(END,
                                                                  ENDCASE,
                                                                  ENDCLASS,
                                                                  ENDCLOCKING,
                                                                  ENDFUNCTION,
                                                                  ENDGENERATE,
                                                                  ENDGROUP,
                                                                  ENDINTERFACE,
                                                                  ENDMODULE,
                                                                  ENDPACKAGE,
                                                                  ENDPRIMITIVE,
                                                                  ENDPROGRAM,
                                                                  ENDPROPERTY,
                                                                  ENDSEQUENCE,
                                                                  ENDSPECIFY,
                                                                  ENDTABLE,
                                                                  ENDTASK,
                                                                  JOIN,
                                                                  JOIN_ANY,
                                                                  JOIN_NONE);

    // Keywords that can be called like functions or methods
    private static final Set<TokenKind> CALLABLE_KEYWORDS = EnumSet.of(AND,
                                                                       FIND,
                                                                       MAX,
                                                                       MIN,
                                                                       NEW,
                                                                       OR,
                                                                       RANDOMIZE,
                                                                       SORT,
                                                                       SUM,
                                                                       UNIQUE,
                                                                       XOR);

    private static final Set<TokenKind> PREPROCESSOR_CONDITIONALS = EnumSet.of(PP_IFDEF,
                                                                               PP_IFNDEF,
                                                                               PP_ELSE,
                                                                               PP_ELSIF,
                                                                               PP_ENDIF);

    private static final Map<TokenKind, TokenCategory> CATEGORIES = buildCategories();

    private TokenClassifier() {}

    /**
     * Category of the token kind. Total: every kind maps to exactly one category.
     */
    public static TokenCategory classify(TokenKind kind) {
        return CATEGORIES.getOrDefault(kind, TokenCategory.UNKNOWN);
    }

    public static boolean isUnaryOperator(TokenKind kind) {
        return UNARY_OPERATORS.contains(kind);
    }

    public static boolean isTernaryOperator(TokenKind kind) {
        return kind == QUESTION || kind == COLON;
    }

    public static boolean isEndKeyword(TokenKind kind) {
        return END_KEYWORDS.contains(kind);
    }

    public static boolean isCallableKeyword(TokenKind kind) {
        return CALLABLE_KEYWORDS.contains(kind);
    }

    /// Name of a macro reference or macro call.
    public static boolean isMacroName(TokenKind kind) {
        return kind == MACRO_IDENTIFIER || kind == MACRO_CALL_ID || kind == MACRO_ID_ITEM;
    }

    public static boolean isPreprocessorKeyword(TokenKind kind) {
        return classify(kind) == TokenCategory.PREPROCESSOR_DIRECTIVE;
    }

    public static boolean isPreprocessorConditional(TokenKind kind) {
        return PREPROCESSOR_CONDITIONALS.contains(kind);
    }

    public static boolean isKeyword(TokenKind kind) {
        return classify(kind) == TokenCategory.KEYWORD;
    }

    private static Map<TokenKind, TokenCategory> buildCategories() {
        var map = new EnumMap<TokenKind, TokenCategory>(TokenKind.class);

        assign(map, TokenCategory.OPEN_GROUP, LPAREN, LBRACKET, LBRACE);
        assign(map, TokenCategory.CLOSE_GROUP, RPAREN, RBRACKET, RBRACE, MACRO_CALL_CLOSE_TO_END_LINE);
        assign(map, TokenCategory.SEPARATOR, COMMA, SEMICOLON);
        assign(map, TokenCategory.HIERARCHY, DOT, SCOPE_RES);
        assign(map, TokenCategory.CONTEXTUAL_OPERATOR, COLON, HASH, AT, APOSTROPHE, TILDE, BANG);

        // '?' is spaced like a binary operator, '=' like its compound forms
        assign(map,
               TokenCategory.BINARY_OPERATOR,
               QUESTION,
               ASSIGN,
               PLUS,
               MINUS,
               STAR,
               SLASH,
               PERCENT,
               AMPERSAND,
               PIPE,
               CARET,
               LESS,
               GREATER);
        EnumSet.range(LESS_EQ, COLON_DIV)
               .forEach(kind -> map.put(kind, TokenCategory.BINARY_OPERATOR));
        assign(map,
               TokenCategory.UNARY_OPERATOR,
               NAND,
               NOR,
               INCREMENT,
               DECREMENT,
               TRIGGER,
               NONBLOCKING_TRIGGER,
               POUND_POUND);
        assign(map, TokenCategory.KEYWORD, DOT_STAR);
        assign(map, TokenCategory.EDGE_DESCRIPTOR, EDGE_DESCRIPTOR);

        assign(map, TokenCategory.IDENTIFIER, SYMBOL_IDENTIFIER, ESCAPED_IDENTIFIER, SYSTEM_TF_IDENTIFIER, PP_IDENTIFIER);
        assign(map, TokenCategory.MACRO, MACRO_IDENTIFIER, MACRO_CALL_ID, MACRO_ID_ITEM, MACRO_ARG, PP_DEFINE_BODY);

        EnumSet.range(DEC_NUMBER, MACRO_NUMERIC_WIDTH)
               .forEach(kind -> map.put(kind, TokenCategory.NUMERIC_LITERAL));
        EnumSet.range(DEC_BASE, HEX_BASE)
               .forEach(kind -> map.put(kind, TokenCategory.NUMERIC_BASE));
        EnumSet.range(STRING_LITERAL, FILE_PATH)
               .forEach(kind -> map.put(kind, TokenCategory.STRING_LITERAL));

        assign(map, TokenCategory.EOL_COMMENT, EOL_COMMENT);
        assign(map, TokenCategory.BLOCK_COMMENT, BLOCK_COMMENT);

        EnumSet.range(PP_INCLUDE, PP_UNDEF)
               .forEach(kind -> map.put(kind, TokenCategory.PREPROCESSOR_DIRECTIVE));
        EnumSet.range(DR_TIMESCALE, XOR)
               .forEach(kind -> map.put(kind, TokenCategory.KEYWORD));
        return map;
    }

    private static void assign(Map<TokenKind, TokenCategory> map, TokenCategory category, TokenKind... kinds) {
        for (var kind : kinds) {
            map.put(kind, category);
        }
    }
}
