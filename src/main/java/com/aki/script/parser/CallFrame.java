package com.aki.script.parser;

public class CallFrame {
    final String functionName;
    final int arity;

    CallFrame(String functionName, int arity) {
        this.functionName = functionName;
        this.arity = arity;
    }

    @Override
    public String toString() {
        return functionName + "/" + arity;
    }
}
