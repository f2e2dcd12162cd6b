package com.aki.script.parser;

public enum ErrorKind {
    UNDEFINED_VARIABLE,
    TYPE_MISMATCH,
    DIVISION_BY_ZERO,
    MODULUS_BY_ZERO,
    INDEX_OUT_OF_BOUNDS,
    KEY_NOT_FOUND,
    ARITY_MISMATCH,
    INVALID_ASSIGNMENT_TARGET,
    UNKNOWN_FUNCTION,
    UNIMPLEMENTED_NODE_KIND,
    BUILTIN_FAILURE,
    STACK_OVERFLOW,
    INVALID_REFERENCE
}
