package com.aki.script.parser;

import java.util.List;

import com.aki.script.parser.Ast.Block;
import com.aki.script.parser.Ast.Param;

/** Payload of a FUNC value: the declaration plus the scope captured when it ran. */
public class UserFunction {
    public final String name;
    final List<Param> params;
    final Block body;
    final Environment closure;
    final boolean isAsync;

    UserFunction(String name, List<Param> params, Block body, Environment closure, boolean isAsync) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
        this.isAsync = isAsync;
    }

    public int arity() {
        return params.size();
    }

    public Environment closure() {
        return closure;
    }

    Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new AkiRuntimeException(ErrorKind.ARITY_MISMATCH,
                    name + "() expects " + params.size() + " arguments, got " + args.size());
        }
        if (isAsync) {
            throw new AkiRuntimeException(ErrorKind.UNIMPLEMENTED_NODE_KIND,
                    "async function " + name + "() cannot be called: async execution is not supported");
        }

        Environment previous = interpreter.env;

        // New frame is a child of the closure (lexical scoping), not of the caller.
        interpreter.env = closure.childScope();

        try {
            for (int i = 0; i < params.size(); i++) {
                interpreter.env.define(params.get(i).name, args.get(i));
            }
            return body.accept(interpreter);
        } finally {
            interpreter.env = previous;
        }
    }
}
