package com.aki.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One lexical scope: a name to value mapping plus a link to the enclosing scope.
 *
 * A global environment is created per interpreter, and every user-function call
 * gets a child of the function's captured closure. Blocks do not open scopes.
 */
public class Environment {

    public final Environment parent;

    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Root (global) scope. */
    public Environment() {
        this.parent = null;
    }

    /** Root scope pre-populated by the host. */
    public Environment(Map<String, Value> initial) {
        this.parent = null;
        if (initial != null) {
            values.putAll(initial);
        }
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Inserts or overwrites a binding in this scope only. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    public Value get(String name) {
        return lookup(name).orElseThrow(
                () -> new AkiRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable: " + name));
    }

    public Optional<Value> lookup(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return Optional.of(v);
        }
        return Optional.empty();
    }

    /**
     * Overwrites the nearest existing binding on the chain. A name bound nowhere
     * is defined in this scope.
     */
    public void assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value);
                return;
            }
        }
        values.put(name, value);
    }

    public Environment childScope() {
        return new Environment(this);
    }

    /**
     * Copies the whole chain. Values are shared (they are immutable); bindings are
     * not, so writes on either side stay invisible to the other.
     */
    public Environment snapshot() {
        Environment copy = new Environment(parent == null ? null : parent.snapshot());
        copy.values.putAll(values);
        return copy;
    }

    // -------------------------
    // Inspection
    // -------------------------

    /** Bindings of this scope only, in definition order. */
    public Map<String, Value> localBindings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
