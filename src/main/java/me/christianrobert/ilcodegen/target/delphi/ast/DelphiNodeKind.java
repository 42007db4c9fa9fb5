package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * Tags of the Delphi target tree, grouped by the position a node may take.
 */
public enum DelphiNodeKind {

    // Unit level and class members
    UNIT,
    CLASS,
    FIELD,
    PROPERTY,
    ROUTINE,
    PARAMETER,
    CONSTANT,
    VARIABLE,
    COMMENT,

    // Statements
    BLOCK,
    ASSIGNMENT,
    EXPRESSION_STATEMENT,
    IF,
    FOR,
    FOR_IN,
    WHILE,
    REPEAT,
    CASE,
    CASE_ARM,
    BREAK,
    CONTINUE,
    EXIT,
    RAISE,
    TRY_EXCEPT,
    TRY_FINALLY,

    // Expressions
    LITERAL,
    IDENTIFIER,
    BINARY,
    UNARY,
    MEMBER_ACCESS,
    INDEX,
    CALL,
    ARRAY_LITERAL,
    ANONYMOUS_METHOD
}
