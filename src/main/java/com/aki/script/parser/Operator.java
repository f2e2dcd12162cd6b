package com.aki.script.parser;

public enum Operator {
    ASSIGN("="),
    ADD("+"),
    SELF_ADD("+="),
    INC("++"),
    SUB("-"),
    SELF_SUB("-="),
    DEC("--"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    GT(">"),
    LT_EQ("<="),
    GT_EQ(">="),
    AND("&&"),
    OR("||");

    public final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }
}
