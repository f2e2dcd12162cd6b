package com.aki.script.parser;

/**
 * Lexical or syntax error. Parsing does not recover: the first one aborts the
 * whole source unit.
 */
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public ParseException(String message) {
        super(message);
        this.line = -1;
    }

    public ParseException(String message, int line) {
        super("[line " + line + "] " + message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }

    public boolean hasLocation() {
        return line >= 0;
    }
}
