package com.aki.script;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import com.aki.debug.Debug;
import com.aki.script.parser.Ast.AstNode;
import com.aki.script.parser.Environment;
import com.aki.script.parser.Interpreter;
import com.aki.script.parser.Lexer;
import com.aki.script.parser.Parser;
import com.aki.script.parser.RunResult;
import com.aki.script.parser.Token;
import com.aki.script.parser.Value;
import com.aki.script.plugins.AkiStdLibPlugin;

/**
 * Core Aki engine.
 *
 * - Rust-flavoured syntax (let / func / if / else / while, type annotations parsed but not checked)
 * - Types: i32 integer, f64 float, string, bool, vector, map, unit, function, heap reference
 * - Everything is an expression: blocks, if and function bodies yield their last value
 * - Function calls:
 *     - User functions (func name(a: i32) -> i32 { ... }), lexically scoped closures
 *     - Built-ins (registered via registerFunction, see AkiStdLibPlugin)
 * - Policies:
 *     - AssignmentPolicy: where `x = v` writes when x lives in an outer scope
 *     - EntryPointPolicy: whether a top-level `func main()` runs on declaration
 */
public class AkiScript {
    private static final String TAG = "engine";

    /** Where assignment and compound assignment write. Default DEFINE_LOCAL. */
    public enum AssignmentPolicy {
        /** Always (re)define in the current scope; outer bindings are shadowed. */
        DEFINE_LOCAL,
        /** Overwrite the nearest existing binding; define locally if there is none. */
        MUTATE_ENCLOSING
    }

    /** Default AUTO_INVOKE_MAIN. */
    public enum EntryPointPolicy {
        AUTO_INVOKE_MAIN,
        NONE
    }

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    /**
     * Error hook. Called before the error is rethrown to the host; phase is
     * "parse" or "eval".
     */
    public interface ErrorReporter {
        void report(RuntimeException e, String phase, String message);
    }

    private static final ErrorReporter LOGGING_REPORTER = (e, phase, message) ->
            Debug.get().w(TAG, phase + " error: " + message, e);

    private final Map<String, BuiltinFunction> functions = new ConcurrentHashMap<>();

    private int maxCallDepth;
    private AssignmentPolicy assignmentPolicy;
    private EntryPointPolicy entryPointPolicy;
    private boolean builtinCallParsing;

    private PrintStream out = System.out;
    private ErrorReporter errorReporter = LOGGING_REPORTER;

    public AkiScript() {
        this(AkiConfig.defaults());
    }

    public AkiScript(AkiConfig config) {
        config.applyTo(this);
        AkiStdLibPlugin.register(this);
    }

    // ===================== OPTIONS =====================

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1, got " + depth);
        this.maxCallDepth = depth;
    }

    public AssignmentPolicy getAssignmentPolicy() {
        return assignmentPolicy;
    }

    public void setAssignmentPolicy(AssignmentPolicy policy) {
        this.assignmentPolicy = Objects.requireNonNull(policy, "policy");
    }

    public EntryPointPolicy getEntryPointPolicy() {
        return entryPointPolicy;
    }

    public void setEntryPointPolicy(EntryPointPolicy policy) {
        this.entryPointPolicy = Objects.requireNonNull(policy, "policy");
    }

    public boolean isBuiltinCallParsing() {
        return builtinCallParsing;
    }

    /** Compatibility parsing: a bare builtin name without "(" parses as a zero-argument call. */
    public void setBuiltinCallParsing(boolean enabled) {
        this.builtinCallParsing = enabled;
    }

    public PrintStream out() {
        return out;
    }

    /** Stream print/println write to. */
    public void setOut(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    /** Null restores the default, which logs through Debug. */
    public void setErrorReporter(ErrorReporter reporter) {
        this.errorReporter = (reporter == null) ? LOGGING_REPORTER : reporter;
    }

    // ===================== BUILTINS =====================

    public void registerFunction(String name, BuiltinFunction fn) {
        functions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(fn, "fn"));
    }

    public boolean isBuiltin(String name) {
        return functions.containsKey(name);
    }

    // ===================== FRONT END =====================

    public List<Token> tokenize(String source) {
        try {
            return new Lexer(source).tokenize();
        } catch (RuntimeException e) {
            throw report(e, "parse");
        }
    }

    public List<AstNode> parse(String source) {
        List<Token> tokens = tokenize(source);
        Parser parser = builtinCallParsing ? new Parser(tokens, this::isBuiltin) : new Parser(tokens);
        try {
            List<AstNode> program = parser.parse();
            Debug.get().d(TAG, "parsed " + program.size() + " top-level node(s)");
            return program;
        } catch (RuntimeException e) {
            throw report(e, "parse");
        }
    }

    // ===================== EXECUTION =====================

    /** Parses and evaluates a whole unit in a fresh interpreter; returns the last value. */
    public Value run(String source) {
        return runWithResult(source, null).value();
    }

    /** Like run(source), with the global scope pre-populated by the host. */
    public Value run(String source, Map<String, Value> initialEnv) {
        return runWithResult(source, initialEnv).value();
    }

    /** Evaluates a unit and returns both its value and the resulting global bindings. */
    public RunResult runWithResult(String source, Map<String, Value> initialEnv) {
        List<AstNode> program = parse(source);
        Interpreter interpreter = newInterpreter(new Environment(initialEnv));
        Value value = execute(interpreter, program);
        return new RunResult(interpreter.environment().localBindings(), value);
    }

    /**
     * Evaluates a unit for its declarations, then calls entryFunction with the
     * given arguments. A zero-parameter main also auto-runs during evaluation
     * unless the entry-point policy is NONE.
     */
    public Value call(String source, String entryFunction, List<Value> args) {
        List<AstNode> program = parse(source);
        Interpreter interpreter = newInterpreter(new Environment());
        execute(interpreter, program);
        try {
            return interpreter.invokeForHost(entryFunction, args);
        } catch (RuntimeException e) {
            throw report(e, "eval");
        }
    }

    /** A session keeps one interpreter, so bindings survive between eval calls. */
    public AkiSession newSession() {
        return new AkiSession(this, newInterpreter(new Environment()));
    }

    Interpreter newInterpreter(Environment env) {
        return new Interpreter(env, functions, maxCallDepth, assignmentPolicy, entryPointPolicy);
    }

    Value execute(Interpreter interpreter, List<AstNode> program) {
        return execute(interpreter, program, value -> { });
    }

    Value execute(Interpreter interpreter, List<AstNode> program, Consumer<Value> onResult) {
        try {
            Value result = interpreter.execute(program, onResult);
            Debug.get().d(TAG, "evaluated to " + result);
            return result;
        } catch (RuntimeException e) {
            throw report(e, "eval");
        }
    }

    /** Hands the error to the reporter and returns it for rethrowing. */
    RuntimeException report(RuntimeException e, String phase) {
        errorReporter.report(e, phase, e.getMessage());
        return e;
    }
}
