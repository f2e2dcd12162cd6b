package com.aki.script.plugins;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.aki.script.AkiScript;
import com.aki.script.parser.AkiRuntimeException;
import com.aki.script.parser.ErrorKind;
import com.aki.script.parser.Value;

/**
 * AkiStdLibPlugin
 *
 * Core builtins every engine starts with: console output, scalar conversions
 * and a few collection helpers. Collections are immutable values, so push and
 * insert return new ones.
 *
 * Usage:
 *   AkiStdLibPlugin.register(engine);   // done by the AkiScript constructor
 *
 * Then in scripts:
 *   println(to_string(42));
 *   let v = push([1, 2], 3);
 *   let m = insert(hashmap("a", 1), "b", 2);
 */
public final class AkiStdLibPlugin {

    private AkiStdLibPlugin() {}

    public static void register(AkiScript engine) {

        // Output goes through engine.out() at call time, so setOut() applies to later calls.
        engine.registerFunction("print", args -> {
            requireArgs("print", args, 1);
            engine.out().print(scalarText("print", args.get(0)));
            engine.out().flush();
            return Value.unit();
        });

        engine.registerFunction("println", args -> {
            requireArgs("println", args, 1);
            engine.out().println(scalarText("println", args.get(0)));
            return Value.unit();
        });

        engine.registerFunction("to_string", args -> {
            requireArgs("to_string", args, 1);
            return Value.string(scalarText("to_string", args.get(0)));
        });

        engine.registerFunction("to_int", args -> {
            requireArgs("to_int", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case INTEGER:
                    return v;
                case FLOAT:
                    return Value.integer((int) v.asFloat());
                case STRING:
                    try {
                        return Value.integer(Integer.parseInt(v.asString()));
                    } catch (NumberFormatException e) {
                        throw fail("to_int", "cannot parse '" + v.asString() + "' as integer", e);
                    }
                default:
                    throw fail("to_int", "cannot convert " + v.getType() + " to integer");
            }
        });

        engine.registerFunction("to_float", args -> {
            requireArgs("to_float", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case FLOAT:
                    return v;
                case INTEGER:
                    return Value.floating(v.asInteger());
                case STRING:
                    // parseDouble would silently trim; surrounding whitespace is rejected
                    if (v.asString().trim().length() != v.asString().length()) {
                        throw fail("to_float", "cannot parse '" + v.asString() + "' as float");
                    }
                    try {
                        return Value.floating(Double.parseDouble(v.asString()));
                    } catch (NumberFormatException e) {
                        throw fail("to_float", "cannot parse '" + v.asString() + "' as float", e);
                    }
                default:
                    throw fail("to_float", "cannot convert " + v.getType() + " to float");
            }
        });

        engine.registerFunction("to_bool", args -> {
            requireArgs("to_bool", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case BOOL:
                    return v;
                case INTEGER:
                    return Value.bool(v.asInteger() != 0);
                case STRING: {
                    String s = v.asString();
                    if (s.equals("true")) return Value.bool(true);
                    if (s.equals("false")) return Value.bool(false);
                    throw fail("to_bool", "cannot parse '" + s + "' as bool");
                }
                default:
                    throw fail("to_bool", "cannot convert " + v.getType() + " to bool");
            }
        });

        engine.registerFunction("len", args -> {
            requireArgs("len", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING:
                    return Value.integer(v.asString().length());
                case VECTOR:
                    return Value.integer(v.asVector().size());
                case MAP:
                    return Value.integer(v.asMap().size());
                default:
                    throw fail("len", "expected string, vector or map, got " + v.getType());
            }
        });

        engine.registerFunction("push", args -> {
            requireArgs("push", args, 2);
            List<Value> items = new ArrayList<>(vec("push", args.get(0)));
            items.add(args.get(1));
            return Value.vector(items);
        });

        engine.registerFunction("hashmap", args -> {
            if (args.size() % 2 != 0) {
                throw new AkiRuntimeException(ErrorKind.ARITY_MISMATCH,
                        "hashmap() expects key/value pairs, got " + args.size() + " arguments");
            }
            Map<String, Value> m = new LinkedHashMap<>();
            for (int i = 0; i < args.size(); i += 2) {
                m.put(key("hashmap", args.get(i)), args.get(i + 1));
            }
            return Value.map(m);
        });

        engine.registerFunction("insert", args -> {
            requireArgs("insert", args, 3);
            Map<String, Value> m = new LinkedHashMap<>(map("insert", args.get(0)));
            m.put(key("insert", args.get(1)), args.get(2));
            return Value.map(m);
        });

        engine.registerFunction("keys", args -> {
            requireArgs("keys", args, 1);
            List<Value> out = new ArrayList<>();
            for (String k : map("keys", args.get(0)).keySet()) out.add(Value.string(k));
            return Value.vector(out);
        });
    }

    // ---------- helpers ----------

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new AkiRuntimeException(ErrorKind.ARITY_MISMATCH,
                    fn + "() expects " + n + " argument" + (n == 1 ? "" : "s") + ", got " + args.size());
        }
    }

    private static String scalarText(String fn, Value v) {
        switch (v.getType()) {
            case INTEGER:
            case FLOAT:
            case STRING:
            case BOOL:
                return v.display();
            default:
                throw fail(fn, "unsupported type " + v.getType());
        }
    }

    private static List<Value> vec(String fn, Value v) {
        if (v.getType() != Value.Type.VECTOR) throw fail(fn, "expected vector, got " + v.getType());
        return v.asVector();
    }

    private static Map<String, Value> map(String fn, Value v) {
        if (v.getType() != Value.Type.MAP) throw fail(fn, "expected map, got " + v.getType());
        return v.asMap();
    }

    private static String key(String fn, Value v) {
        if (v.getType() != Value.Type.STRING) throw fail(fn, "map keys must be strings, got " + v.getType());
        return v.asString();
    }

    private static AkiRuntimeException fail(String fn, String message) {
        return new AkiRuntimeException(ErrorKind.BUILTIN_FAILURE, fn + "(): " + message);
    }

    private static AkiRuntimeException fail(String fn, String message, Throwable cause) {
        return new AkiRuntimeException(ErrorKind.BUILTIN_FAILURE, fn + "(): " + message, cause);
    }
}
