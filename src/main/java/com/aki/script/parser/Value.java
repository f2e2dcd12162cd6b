package com.aki.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Value {
    public enum Type { INTEGER, FLOAT, STRING, BOOL, VECTOR, MAP, UNIT, FUNC, REFERENCE }

    private static final Value UNIT = new Value(Type.UNIT, null);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(int i) { return new Value(Type.INTEGER, i); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value vector(List<Value> items) { return new Value(Type.VECTOR, List.copyOf(items)); }
    public static Value map(Map<String, Value> m) {
        return new Value(Type.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(m)));
    }
    public static Value func(UserFunction fn) { return new Value(Type.FUNC, Objects.requireNonNull(fn)); }
    public static Value reference(int address) { return new Value(Type.REFERENCE, address); }
    public static Value unit() { return UNIT; }

    public Type getType() { return type; }

    public boolean isUnit() { return type == Type.UNIT; }

    public boolean isNumeric() { return type == Type.INTEGER || type == Type.FLOAT; }

    public int asInteger() {
        if (type != Type.INTEGER) throw mismatch("integer");
        return (int) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw mismatch("float");
        return (double) value;
    }

    /** Integer or float widened to double. */
    public double asNumber() {
        if (type == Type.INTEGER) return (int) value;
        if (type == Type.FLOAT) return (double) value;
        throw mismatch("number");
    }

    public String asString() {
        if (type != Type.STRING) throw mismatch("string");
        return (String) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw mismatch("bool");
        return (boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asVector() {
        if (type != Type.VECTOR) throw mismatch("vector");
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asMap() {
        if (type != Type.MAP) throw mismatch("map");
        return (Map<String, Value>) value;
    }

    public UserFunction asFunc() {
        if (type != Type.FUNC) throw mismatch("function");
        return (UserFunction) value;
    }

    public int asReference() {
        if (type != Type.REFERENCE) throw mismatch("reference");
        return (int) value;
    }

    private AkiRuntimeException mismatch(String expected) {
        return new AkiRuntimeException(ErrorKind.TYPE_MISMATCH, "Expected " + expected + ", got " + type);
    }

    /** Text form used by print/println/to_string: strings unquoted. */
    public String display() {
        switch (type) {
            case STRING:
                return (String) value;
            case VECTOR: {
                List<String> parts = new ArrayList<>();
                for (Value v : asVector()) parts.add(v.toString());
                return "[" + String.join(", ", parts) + "]";
            }
            default:
                return toString();
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case INTEGER:
                return Integer.toString(asInteger());
            case FLOAT:
                return Double.toString(asFloat());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case VECTOR:
                return asVector().toString();
            case MAP: {
                List<String> parts = new ArrayList<>();
                for (Map.Entry<String, Value> e : asMap().entrySet()) {
                    parts.add('"' + e.getKey() + "\": " + e.getValue());
                }
                return "{" + String.join(", ", parts) + "}";
            }
            case FUNC:
                return "<func " + asFunc().name + "/" + asFunc().arity() + ">";
            case REFERENCE:
                return "&" + asReference();
            default:
                return "()";
        }
    }

    // Functions compare by identity; everything else structurally.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.FUNC) return value == other.value;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.FUNC) return System.identityHashCode(value);
        return Objects.hash(type, value);
    }
}
