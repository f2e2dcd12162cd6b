package com.aki.script.parser;

public enum TokenType {
    // Literals
    INTEGER, FLOAT, STRING, TRUE, FALSE, IDENTIFIER,

    // Keywords
    LET, FUNC, IF, ELSE, WHILE, FOR, IN, RETURN, MOD, PUB, USE, STRUCT, IMPL, ASYNC, AWAIT,

    // Concurrency
    CHANNEL, SEND, RECV,

    // Types
    TYPE_I8, TYPE_I16, TYPE_I32, TYPE_I64,
    TYPE_U8, TYPE_U16, TYPE_U32, TYPE_U64,
    TYPE_F32, TYPE_F64, TYPE_BOOL, TYPE_STRING, TYPE_DYN,
    TYPE_VEC, TYPE_HASHMAP,

    // Ownership markers and attributes
    TILDE, AT,
    WEAK_ATTR, SYNC_ATTR, OWN_ATTR, ACTOR_ATTR,

    // Operators
    PLUS, PLUS_PLUS, PLUS_EQUAL,
    MINUS, MINUS_MINUS, MINUS_EQUAL, ARROW,
    STAR, SLASH, PERCENT,
    EQUAL, EQUAL_EQUAL, BANG, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR,

    // Delimiters
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, COLON, DOUBLE_COLON, SEMICOLON,

    EOF
}
