package com.aki.script;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.aki.script.parser.Ast.AstNode;
import com.aki.script.parser.Interpreter;
import com.aki.script.parser.Value;

/**
 * Incremental evaluation against one global environment, for the REPL.
 * Not thread-safe.
 */
public class AkiSession {
    private final AkiScript engine;
    private final Interpreter interpreter;

    AkiSession(AkiScript engine, Interpreter interpreter) {
        this.engine = engine;
        this.interpreter = interpreter;
    }

    /**
     * Parses and evaluates one chunk. Bindings made before a failing node are
     * kept; the session stays usable after an error.
     */
    public Value eval(String source) {
        return eval(source, value -> { });
    }

    /** As eval(source), passing every top-level node's value to onResult in order. */
    public Value eval(String source, Consumer<Value> onResult) {
        List<AstNode> program = engine.parse(source);
        return engine.execute(interpreter, program, onResult);
    }

    public Value get(String name) {
        return interpreter.environment().get(name);
    }

    public Map<String, Value> globals() {
        return interpreter.environment().localBindings();
    }
}
