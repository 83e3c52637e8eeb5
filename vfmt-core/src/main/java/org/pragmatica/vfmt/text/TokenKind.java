package org.pragmatica.vfmt.text;

/**
 * Lexical token kinds of Verilog/SystemVerilog as produced by the lexer.
 *
 * Kinds with a fixed spelling carry it; kinds whose text varies (identifiers, numbers,
 * comments, macro arguments...) have an empty spelling.
 *
 * Declaration order is significant: keywords, preprocessor directives and numeric
 * literal parts are each declared contiguously and classified by range.
 */
public enum TokenKind {
    // Grouping and separators
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    LBRACE("{"),
    RBRACE("}"),
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    DOT("."),
    HASH("#"),
    AT("@"),
    QUESTION("?"),
    APOSTROPHE("'"),

    // Single character operators
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    AMPERSAND("&"),
    PIPE("|"),
    CARET("^"),
    TILDE("~"),
    BANG("!"),
    LESS("<"),
    GREATER(">"),

    // Multi character operators
    LESS_EQ("<="),
    GREATER_EQ(">="),
    LOGICAL_EQ("=="),
    LOGICAL_NE("!="),
    CASE_EQ("==="),
    CASE_NE("!=="),
    WILDCARD_EQ("==?"),
    WILDCARD_NE("!=?"),
    LOGICAL_AND("&&"),
    LOGICAL_OR("||"),
    TRIPLE_AND("&&&"),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    ARITH_SHIFT_RIGHT(">>>"),
    POWER("**"),
    NAND("~&"),
    NOR("~|"),
    NXOR("~^"),
    INCREMENT("++"),
    DECREMENT("--"),
    PLUS_ASSIGN("+="),
    MINUS_ASSIGN("-="),
    STAR_ASSIGN("*="),
    SLASH_ASSIGN("/="),
    PERCENT_ASSIGN("%="),
    AND_ASSIGN("&="),
    OR_ASSIGN("|="),
    XOR_ASSIGN("^="),
    SHIFT_LEFT_ASSIGN("<<="),
    SHIFT_RIGHT_ASSIGN(">>="),
    ARITH_SHIFT_RIGHT_ASSIGN(">>>="),
    LOGICAL_IMPLIES("->"),
    LOGICAL_EQUIV("<->"),
    PIPE_ARROW("|->"),
    PIPE_ARROW2("|=>"),
    COLON_EQ(":="),
    COLON_DIV(":/"),
    TRIGGER("->"),
    NONBLOCKING_TRIGGER("->>"),
    SCOPE_RES("::"),
    POUND_POUND("##"),
    DOT_STAR(".*"),
    LINE_CONTINUATION("\\"),
    EDGE_DESCRIPTOR(""),

    // Identifiers
    SYMBOL_IDENTIFIER(""),
    ESCAPED_IDENTIFIER(""),
    SYSTEM_TF_IDENTIFIER(""),

    // Macro related
    MACRO_IDENTIFIER(""),
    MACRO_CALL_ID(""),
    MACRO_ID_ITEM(""),
    MACRO_ARG(""),
    MACRO_CALL_CLOSE_TO_END_LINE(")"),
    PP_IDENTIFIER(""),
    PP_DEFINE_BODY(""),

    // Numeric literal parts: widths and digits, then bases
    DEC_NUMBER(""),
    UNBASED_NUMBER(""),
    REAL_TIME(""),
    TIME_LITERAL(""),
    DEC_DIGITS(""),
    BIN_DIGITS(""),
    OCT_DIGITS(""),
    HEX_DIGITS(""),
    MACRO_NUMERIC_WIDTH(""),
    DEC_BASE(""),
    BIN_BASE(""),
    OCT_BASE(""),
    HEX_BASE(""),

    // Strings
    STRING_LITERAL(""),
    EVAL_STRING_LITERAL(""),
    ANGLE_BRACKET_INCLUDE(""),
    FILE_PATH(""),

    // Comments
    EOL_COMMENT(""),
    BLOCK_COMMENT(""),

    // Preprocessor directives
    PP_INCLUDE("`include"),
    PP_DEFINE("`define"),
    PP_IFDEF("`ifdef"),
    PP_IFNDEF("`ifndef"),
    PP_ELSE("`else"),
    PP_ELSIF("`elsif"),
    PP_ENDIF("`endif"),
    PP_UNDEF("`undef"),

    // Compiler directives
    DR_TIMESCALE("`timescale"),
    DR_RESETALL("`resetall"),
    DR_DEFAULT_NETTYPE("`default_nettype"),
    DR_CELLDEFINE("`celldefine"),
    DR_ENDCELLDEFINE("`endcelldefine"),

    // Keywords
    ALWAYS("always"),
    ALWAYS_COMB("always_comb"),
    ALWAYS_FF("always_ff"),
    ALWAYS_LATCH("always_latch"),
    AND("and"),
    ASSIGN_KEYWORD("assign"),
    AUTOMATIC("automatic"),
    BEGIN("begin"),
    BIT("bit"),
    CASE("case"),
    CASEX("casex"),
    CASEZ("casez"),
    CLASS("class"),
    CLOCKING("clocking"),
    CONSTRAINT("constraint"),
    COVERGROUP("covergroup"),
    COVERPOINT("coverpoint"),
    DEFAULT("default"),
    DEFPARAM("defparam"),
    DISABLE("disable"),
    DO("do"),
    EDGE("edge"),
    ELSE("else"),
    END("end"),
    ENDCASE("endcase"),
    ENDCLASS("endclass"),
    ENDCLOCKING("endclocking"),
    ENDFUNCTION("endfunction"),
    ENDGENERATE("endgenerate"),
    ENDGROUP("endgroup"),
    ENDINTERFACE("endinterface"),
    ENDMODULE("endmodule"),
    ENDPACKAGE("endpackage"),
    ENDPRIMITIVE("endprimitive"),
    ENDPROGRAM("endprogram"),
    ENDPROPERTY("endproperty"),
    ENDSEQUENCE("endsequence"),
    ENDSPECIFY("endspecify"),
    ENDTABLE("endtable"),
    ENDTASK("endtask"),
    ENUM("enum"),
    EXTENDS("extends"),
    FIND("find"),
    FOR("for"),
    FOREACH("foreach"),
    FOREVER("forever"),
    FORK("fork"),
    FUNCTION("function"),
    GENERATE("generate"),
    GENVAR("genvar"),
    IF("if"),
    IMPORT("import"),
    INITIAL("initial"),
    INOUT("inout"),
    INPUT("input"),
    INSIDE("inside"),
    INT("int"),
    INTEGER("integer"),
    INTERFACE("interface"),
    JOIN("join"),
    JOIN_ANY("join_any"),
    JOIN_NONE("join_none"),
    LOCALPARAM("localparam"),
    LOGIC("logic"),
    MAX("max"),
    MIN("min"),
    MODULE("module"),
    NEGEDGE("negedge"),
    NEW("new"),
    NOT("not"),
    OR("or"),
    OUTPUT("output"),
    PACKAGE("package"),
    PARAMETER("parameter"),
    POSEDGE("posedge"),
    PRIMITIVE("primitive"),
    PROGRAM("program"),
    PROPERTY("property"),
    RANDOMIZE("randomize"),
    REG("reg"),
    REPEAT("repeat"),
    RETURN("return"),
    SEQUENCE("sequence"),
    SIGNED("signed"),
    SORT("sort"),
    SPECIFY("specify"),
    STRUCT("struct"),
    SUM("sum"),
    TABLE("table"),
    TASK("task"),
    TYPEDEF("typedef"),
    UNION("union"),
    UNIQUE("unique"),
    UNSIGNED("unsigned"),
    VOID("void"),
    WHILE("while"),
    WIRE("wire"),
    XOR("xor"),

    EOF("");

    private final String spelling;

    TokenKind(String spelling) {
        this.spelling = spelling;
    }

    /// Fixed source spelling, empty for kinds whose text varies.
    public String spelling() {
        return spelling;
    }

    public boolean hasFixedSpelling() {
        return !spelling.isEmpty();
    }
}
