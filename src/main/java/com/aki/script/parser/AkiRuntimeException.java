package com.aki.script.parser;

/**
 * Evaluation failure. Terminal for the enclosing expression: nothing inside the
 * interpreter catches it, it unwinds to the host.
 */
public class AkiRuntimeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private String callTrace;

    public AkiRuntimeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AkiRuntimeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Active user-function frames when the error was raised, innermost first; null at top level. */
    public String getCallTrace() {
        return callTrace;
    }

    // The innermost frame attaches first; outer frames leave it alone.
    void attachCallTrace(String trace) {
        if (callTrace == null) callTrace = trace;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        return (callTrace == null) ? base : base + " (in " + callTrace + ")";
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
