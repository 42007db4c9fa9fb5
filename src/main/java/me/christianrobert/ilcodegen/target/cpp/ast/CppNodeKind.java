package me.christianrobert.ilcodegen.target.cpp.ast;

/**
 * Tags of the C++ target tree, grouped by the position a node may take.
 */
public enum CppNodeKind {

    // Top level and class members
    COMPILATION_UNIT,
    INCLUDE,
    CLASS,
    FIELD,
    FUNCTION,
    CONSTRUCTOR,
    PARAMETER,
    MEMBER_INITIALIZER,
    COMMENT,

    // Statements
    BLOCK,
    VARIABLE_DECLARATION,
    EXPRESSION_STATEMENT,
    RETURN,
    IF,
    FOR,
    RANGE_FOR,
    WHILE,
    DO_WHILE,
    SWITCH,
    SWITCH_CASE,
    BREAK,
    CONTINUE,
    THROW,
    TRY_CATCH,
    CATCH_CLAUSE,

    // Expressions
    LITERAL,
    IDENTIFIER,
    BINARY,
    UNARY,
    ASSIGNMENT,
    MEMBER_ACCESS,
    ELEMENT_ACCESS,
    CALL,
    OBJECT_CREATION,
    INITIALIZER_LIST,
    CAST,
    CONDITIONAL,
    LAMBDA,
    THIS
}
