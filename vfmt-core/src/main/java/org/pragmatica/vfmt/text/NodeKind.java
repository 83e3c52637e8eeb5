package org.pragmatica.vfmt.text;

/**
 * Grammar constructs of Verilog/SystemVerilog that appear as interior nodes of the
 * concrete syntax tree.
 */
public enum NodeKind {
    DESCRIPTION_LIST,

    // Modules, interfaces, packages, classes
    MODULE_DECLARATION,
    MODULE_HEADER,
    MODULE_ITEM_LIST,
    INTERFACE_DECLARATION,
    PACKAGE_DECLARATION,
    CLASS_DECLARATION,
    EXTENDS_LIST,

    // Ports and parameters
    PORT_DECLARATION_LIST,
    PORT_DECLARATION,
    PORT,
    PORT_ACTUAL_LIST,
    ACTUAL_NAMED_PORT,
    ACTUAL_POSITIONAL_PORT,
    FORMAL_PARAMETER_LIST,
    PARAMETER_DECLARATION,
    PARAM_BY_NAME,

    // Instances and declarations
    DATA_DECLARATION,
    NET_DECLARATION,
    INSTANTIATION_TYPE,
    INSTANTIATION_BASE,
    GATE_INSTANCE,
    PRIMITIVE_GATE_INSTANCE,
    BIND_TARGET_INSTANCE,
    TYPE_DECLARATION,
    DATA_TYPE,
    DATA_TYPE_IMPLICIT_BASIC_ID_DIMENSIONS,
    ENUM_TYPE,
    STRUCT_TYPE,

    // Identifiers and references
    UNQUALIFIED_ID,
    QUALIFIED_ID,
    LOCAL_ROOT,
    REFERENCE,

    // Expressions
    EXPRESSION,
    UNARY_PREFIX_EXPRESSION,
    BINARY_EXPRESSION,
    CONDITION_EXPRESSION,
    PAREN_GROUP,
    BRACE_GROUP,
    BRACKET_GROUP,
    CONCATENATION,
    STREAMING_CONCATENATION,
    FUNCTION_CALL,
    SYSTEM_TF_CALL,
    NUMBER,
    CAST,

    // Dimensions and selections
    PACKED_DIMENSIONS,
    UNPACKED_DIMENSIONS,
    DECLARATION_DIMENSIONS,
    DIMENSION_SCALAR,
    DIMENSION_RANGE,
    DIMENSION_SLICE,
    SELECT_VARIABLE_DIMENSION,
    CYCLE_DELAY_RANGE,
    VALUE_RANGE,

    // Statements and blocks
    ALWAYS_STATEMENT,
    INITIAL_STATEMENT,
    EVENT_CONTROL,
    EVENT_EXPRESSION_LIST,
    SEQ_BLOCK,
    PAR_BLOCK,
    BLOCK_IDENTIFIER,
    LABEL,
    LABELED_STATEMENT,
    GENERATE_REGION,
    GENERATE_BLOCK,
    IF_STATEMENT,
    IF_CLAUSE,
    ELSE_CLAUSE,
    CASE_STATEMENT,
    CASE_ITEM_LIST,
    CASE_ITEM,
    CASE_INSIDE_ITEM,
    CASE_PATTERN_ITEM,
    GENERATE_CASE_ITEM,
    PROPERTY_CASE_ITEM,
    RAND_SEQUENCE_CASE_ITEM,
    CONTINUOUS_ASSIGNMENT,
    NET_VARIABLE_ASSIGNMENT,
    BLOCKING_ASSIGNMENT,
    NONBLOCKING_ASSIGNMENT,
    DELAY,
    FUNCTION_DECLARATION,
    TASK_DECLARATION,
    RETURN_STATEMENT,

    // Verification constructs
    CONSTRAINT_DECLARATION,
    COVER_GROUP_DECLARATION,
    COVER_POINT,

    // User defined primitives
    UDP_BODY,
    UDP_COMB_ENTRY,
    UDP_SEQUENCE_ENTRY,

    // Preprocessing
    PREPROCESSOR_DEFINE,
    PREPROCESSOR_INCLUDE,
    PREPROCESSOR_IFDEF_STATEMENT,
    MACRO_CALL,
    MACRO_ARG_LIST
}
