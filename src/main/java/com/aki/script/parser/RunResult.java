package com.aki.script.parser;

import java.util.Map;

public class RunResult {
    private final Map<String, Value> env;
    private final Value value;

    public RunResult(Map<String, Value> env, Value value) {
        this.env = env;
        this.value = value;
    }

    /** Global bindings after the run. */
    public Map<String, Value> env() { return env; }

    /** Value of the last top-level node, Unit for an empty unit. */
    public Value value() { return value; }
}
