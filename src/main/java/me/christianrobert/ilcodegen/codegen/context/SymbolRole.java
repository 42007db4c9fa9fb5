package me.christianrobert.ilcodegen.codegen.context;

/**
 * What a declared name stands for.
 */
public enum SymbolRole {
    PARAMETER,
    FIELD,
    LOCAL,
    CONSTANT,
    FUNCTION,
    TYPE
}
