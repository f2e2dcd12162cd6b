package com.aki.script.parser;

public enum UnaryOperator {
    NOT("!"),
    NEG("-"),
    INC("++"),
    DEC("--");

    public final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }
}
