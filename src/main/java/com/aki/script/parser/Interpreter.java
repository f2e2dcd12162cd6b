package com.aki.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import com.aki.debug.Debug;
import com.aki.script.AkiScript.AssignmentPolicy;
import com.aki.script.AkiScript.BuiltinFunction;
import com.aki.script.AkiScript.EntryPointPolicy;
import com.aki.script.parser.Ast.Await;
import com.aki.script.parser.Ast.AstNode;
import com.aki.script.parser.Ast.AstVisitor;
import com.aki.script.parser.Ast.BinaryOp;
import com.aki.script.parser.Ast.Block;
import com.aki.script.parser.Ast.BooleanLiteral;
import com.aki.script.parser.Ast.ChannelCreate;
import com.aki.script.parser.Ast.CompoundAssign;
import com.aki.script.parser.Ast.FloatLiteral;
import com.aki.script.parser.Ast.FunctionCall;
import com.aki.script.parser.Ast.FunctionDecl;
import com.aki.script.parser.Ast.Identifier;
import com.aki.script.parser.Ast.IfExpr;
import com.aki.script.parser.Ast.IndexAccess;
import com.aki.script.parser.Ast.IntegerLiteral;
import com.aki.script.parser.Ast.Receive;
import com.aki.script.parser.Ast.Send;
import com.aki.script.parser.Ast.StringLiteral;
import com.aki.script.parser.Ast.UnaryOp;
import com.aki.script.parser.Ast.VariableDecl;
import com.aki.script.parser.Ast.VectorLiteral;
import com.aki.script.parser.Ast.WhileLoop;

/**
 * Tree-walking evaluator. The only mutable state is the current environment,
 * the call-frame stack and the heap; control flow is the Java call stack.
 */
public class Interpreter implements AstVisitor<Value> {
    private static final String TAG = "interpreter";
    private static final int MAX_TRACE_FRAMES = 8;

    Environment env;
    private final Map<String, BuiltinFunction> functions;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final Heap heap = new Heap();
    private final int maxDepth;
    private final AssignmentPolicy assignmentPolicy;
    private final EntryPointPolicy entryPointPolicy;

    public Interpreter(Environment env, Map<String, BuiltinFunction> functions, int maxDepth,
                       AssignmentPolicy assignmentPolicy, EntryPointPolicy entryPointPolicy) {
        this.env = env;
        this.functions = functions;
        this.maxDepth = maxDepth;
        this.assignmentPolicy = (assignmentPolicy == null) ? AssignmentPolicy.DEFINE_LOCAL : assignmentPolicy;
        this.entryPointPolicy = (entryPointPolicy == null) ? EntryPointPolicy.AUTO_INVOKE_MAIN : entryPointPolicy;
    }

    public Environment environment() {
        return env;
    }

    /** Evaluates a top-level sequence and returns the last value (Unit if empty). */
    public Value execute(List<AstNode> program) {
        return execute(program, value -> { });
    }

    /** As execute(program), handing each top-level node's value to onResult as it completes. */
    public Value execute(List<AstNode> program, Consumer<Value> onResult) {
        Value last = Value.unit();
        for (AstNode node : program) {
            last = executeTopLevel(node);
            onResult.accept(last);
        }
        return last;
    }

    public Value executeTopLevel(AstNode node) {
        Environment top = env;
        try {
            Value value = eval(node);
            if (entryPointPolicy == EntryPointPolicy.AUTO_INVOKE_MAIN && node instanceof FunctionDecl) {
                FunctionDecl decl = (FunctionDecl) node;
                if ("main".equals(decl.name) && decl.params.isEmpty()) {
                    Debug.get().d(TAG, "auto-invoking main()");
                    return callFunction(value.asFunc(), List.of());
                }
            }
            return value;
        } catch (StackOverflowError e) {
            throw nativeStackExhausted(e, top);
        }
    }

    public Value eval(AstNode node) { return node.accept(this); }

    /** Host entry: call a user function bound in the global scope, or a builtin. */
    public Value invokeForHost(String name, List<Value> args) {
        Environment top = env;
        try {
            return dispatch(name, new ArrayList<>(args));
        } catch (StackOverflowError e) {
            throw nativeStackExhausted(e, top);
        }
    }

    // Reached when maxCallDepth exceeds what the thread stack holds, or on a deeply
    // nested expression. A finally block may itself overflow while unwinding, so the
    // frame stack and environment are reset here rather than trusted.
    private AkiRuntimeException nativeStackExhausted(StackOverflowError e, Environment top) {
        callStack.clear();
        env = top;
        return new AkiRuntimeException(ErrorKind.STACK_OVERFLOW,
                "Evaluation exhausted the thread stack (maxCallDepth " + maxDepth + ")", e);
    }

    // -------------------------
    // Literals
    // -------------------------

    @Override
    public Value visitIntegerLiteral(IntegerLiteral node) { return Value.integer(node.value); }

    @Override
    public Value visitFloatLiteral(FloatLiteral node) { return Value.floating(node.value); }

    @Override
    public Value visitStringLiteral(StringLiteral node) { return Value.string(node.value); }

    @Override
    public Value visitBooleanLiteral(BooleanLiteral node) { return Value.bool(node.value); }

    @Override
    public Value visitVectorLiteral(VectorLiteral node) {
        List<Value> values = new ArrayList<>(node.elements.size());
        for (AstNode e : node.elements) values.add(eval(e));
        return Value.vector(values);
    }

    // -------------------------
    // Names and declarations
    // -------------------------

    @Override
    public Value visitIdentifier(Identifier node) {
        return env.get(node.name);
    }

    @Override
    public Value visitVariableDecl(VariableDecl node) {
        Value value = (node.initializer == null) ? Value.unit() : eval(node.initializer);
        env.define(node.name, value);
        return value;
    }

    @Override
    public Value visitFunctionDecl(FunctionDecl node) {
        Environment closure = env.snapshot();
        Value fn = Value.func(new UserFunction(node.name, node.params, node.body, closure, node.isAsync));

        // bound inside its own snapshot too, so the body can recurse
        closure.define(node.name, fn);
        env.define(node.name, fn);
        return fn;
    }

    @Override
    public Value visitFunctionCall(FunctionCall node) {
        List<Value> args = new ArrayList<>(node.args.size());
        for (AstNode arg : node.args) args.add(eval(arg));
        return dispatch(node.name, args);
    }

    /**
     * Resolution order: user binding in scope, interpreter intrinsics, builtin table.
     * A non-function binding under the name does not hide the builtin.
     */
    private Value dispatch(String name, List<Value> args) {
        Optional<Value> bound = env.lookup(name);
        if (bound.isPresent() && bound.get().getType() == Value.Type.FUNC) {
            return callFunction(bound.get().asFunc(), args);
        }

        switch (name) {
            case "alloc": {
                requireArgs(name, args, 1);
                return Value.reference(heap.allocate(args.get(0)));
            }
            case "deref": {
                requireArgs(name, args, 1);
                return heap.load(args.get(0).asReference());
            }
            default:
                break;
        }

        BuiltinFunction builtin = functions.get(name);
        if (builtin == null) {
            throw new AkiRuntimeException(ErrorKind.UNKNOWN_FUNCTION, "Unknown function: " + name);
        }
        try {
            Value out = builtin.call(args);
            return (out == null) ? Value.unit() : out;
        } catch (AkiRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AkiRuntimeException(ErrorKind.BUILTIN_FAILURE, name + "() failed: " + e.getMessage(), e);
        }
    }

    public Value callFunction(UserFunction fn, List<Value> args) {
        if (callStack.size() >= maxDepth) {
            throw new AkiRuntimeException(ErrorKind.STACK_OVERFLOW, "Max call depth exceeded (" + maxDepth + ") in " + fn.name + "()");
        }
        callStack.push(new CallFrame(fn.name, args.size()));
        try {
            return fn.call(this, args);
        } catch (AkiRuntimeException e) {
            e.attachCallTrace(callTrace());
            throw e;
        } finally {
            callStack.pop();
        }
    }

    /** "inner/1 <- outer/0", innermost frame first. */
    private String callTrace() {
        StringBuilder sb = new StringBuilder();
        int shown = 0;
        for (CallFrame frame : callStack) {
            if (shown == MAX_TRACE_FRAMES) {
                sb.append(" <- ... ").append(callStack.size() - shown).append(" more");
                break;
            }
            if (shown > 0) sb.append(" <- ");
            sb.append(frame);
            shown++;
        }
        return sb.toString();
    }

    private static void requireArgs(String name, List<Value> args, int n) {
        if (args.size() != n) {
            throw new AkiRuntimeException(ErrorKind.ARITY_MISMATCH, name + "() expects " + n + " arguments, got " + args.size());
        }
    }

    // -------------------------
    // Control flow
    // -------------------------

    // Same environment as the enclosing code: blocks do not open a scope.
    @Override
    public Value visitBlock(Block node) {
        Value last = Value.unit();
        for (AstNode stmt : node.statements) last = eval(stmt);
        return last;
    }

    @Override
    public Value visitIfExpr(IfExpr node) {
        if (requireCondition(eval(node.condition), "if")) {
            return eval(node.thenBranch);
        }
        return (node.elseBranch == null) ? Value.unit() : eval(node.elseBranch);
    }

    @Override
    public Value visitWhileLoop(WhileLoop node) {
        while (requireCondition(eval(node.condition), "while")) {
            eval(node.body);
        }
        return Value.unit();
    }

    private static boolean requireCondition(Value cond, String construct) {
        if (cond.getType() != Value.Type.BOOL) {
            throw new AkiRuntimeException(ErrorKind.TYPE_MISMATCH,
                    "Condition of '" + construct + "' must be a bool, got " + cond.getType());
        }
        return cond.asBool();
    }

    // -------------------------
    // Operations
    // -------------------------

    @Override
    public Value visitBinaryOp(BinaryOp node) {
        Value left = eval(node.left);
        Value right = eval(node.right);
        return applyBinary(node.operator, left, right);
    }

    /** Dispatch on (operator, left type, right type). */
    public Value applyBinary(Operator op, Value left, Value right) {
        Value.Type lt = left.getType();
        Value.Type rt = right.getType();
        boolean ints = lt == Value.Type.INTEGER && rt == Value.Type.INTEGER;
        boolean numbers = left.isNumeric() && right.isNumeric();
        boolean strings = lt == Value.Type.STRING && rt == Value.Type.STRING;
        boolean bools = lt == Value.Type.BOOL && rt == Value.Type.BOOL;

        switch (op) {
            case ADD:
                if (ints) return Value.integer(left.asInteger() + right.asInteger());
                if (numbers) return Value.floating(left.asNumber() + right.asNumber());
                if (strings) return Value.string(left.asString() + right.asString());
                break;
            case SUB:
                if (ints) return Value.integer(left.asInteger() - right.asInteger());
                if (numbers) return Value.floating(left.asNumber() - right.asNumber());
                break;
            case MUL:
                if (ints) return Value.integer(left.asInteger() * right.asInteger());
                if (numbers) return Value.floating(left.asNumber() * right.asNumber());
                break;
            case DIV:
                if (ints) {
                    if (right.asInteger() == 0) throw new AkiRuntimeException(ErrorKind.DIVISION_BY_ZERO, "Division by zero");
                    return Value.integer(left.asInteger() / right.asInteger());
                }
                if (numbers) return Value.floating(left.asNumber() / right.asNumber());
                break;
            case MOD:
                if (ints) {
                    if (right.asInteger() == 0) throw new AkiRuntimeException(ErrorKind.MODULUS_BY_ZERO, "Modulus by zero");
                    return Value.integer(left.asInteger() % right.asInteger());
                }
                if (numbers) return Value.floating(left.asNumber() % right.asNumber());
                break;

            case LT:
            case GT:
            case LT_EQ:
            case GT_EQ: {
                int cmp;
                if (ints) {
                    cmp = Integer.compare(left.asInteger(), right.asInteger());
                } else if (numbers) {
                    double a = left.asNumber();
                    double b = right.asNumber();
                    // NaN compares false against everything
                    if (Double.isNaN(a) || Double.isNaN(b)) return Value.bool(false);
                    cmp = Double.compare(a, b);
                } else if (strings) {
                    cmp = left.asString().compareTo(right.asString());
                } else {
                    break;
                }
                return Value.bool(compare(op, cmp));
            }

            case EQ:
            case NOT_EQ: {
                boolean eq;
                if (numbers && !ints) eq = left.asNumber() == right.asNumber();
                else if (lt == rt) eq = left.equals(right);
                else break;
                return Value.bool(op == Operator.EQ ? eq : !eq);
            }

            case AND:
                if (bools) return Value.bool(left.asBool() && right.asBool());
                break;
            case OR:
                if (bools) return Value.bool(left.asBool() || right.asBool());
                break;

            default:
                throw new AkiRuntimeException(ErrorKind.TYPE_MISMATCH, "'" + op.symbol + "' is not a binary operator");
        }
        throw new AkiRuntimeException(ErrorKind.TYPE_MISMATCH,
                "Unsupported operand types for '" + op.symbol + "': " + lt + ", " + rt);
    }

    private static boolean compare(Operator op, int cmp) {
        switch (op) {
            case LT: return cmp < 0;
            case GT: return cmp > 0;
            case LT_EQ: return cmp <= 0;
            default: return cmp >= 0;
        }
    }

    @Override
    public Value visitUnaryOp(UnaryOp node) {
        switch (node.operator) {
            case INC:
                return updateInPlace(node.operand, "++", Operator.ADD, Value.integer(1));
            case DEC:
                return updateInPlace(node.operand, "--", Operator.SUB, Value.integer(1));
            default:
                break;
        }

        Value operand = eval(node.operand);
        if (node.operator == UnaryOperator.NEG) {
            if (operand.getType() == Value.Type.INTEGER) return Value.integer(-operand.asInteger());
            if (operand.getType() == Value.Type.FLOAT) return Value.floating(-operand.asFloat());
        } else if (operand.getType() == Value.Type.BOOL) {
            return Value.bool(!operand.asBool());
        }
        throw new AkiRuntimeException(ErrorKind.TYPE_MISMATCH,
                "Unary '" + node.operator.symbol + "' not supported for " + operand.getType());
    }

    @Override
    public Value visitCompoundAssign(CompoundAssign node) {
        switch (node.operator) {
            case ASSIGN: {
                String name = targetName(node.target, node.operator.symbol);
                Value value = eval(node.value);
                write(name, value);
                return value;
            }
            case SELF_ADD:
                return updateInPlace(node.target, "+=", Operator.ADD, node.value);
            case SELF_SUB:
                return updateInPlace(node.target, "-=", Operator.SUB, node.value);
            case INC:
                return updateInPlace(node.target, "++", Operator.ADD, Value.integer(1));
            case DEC:
                return updateInPlace(node.target, "--", Operator.SUB, Value.integer(1));
            default:
                throw new AkiRuntimeException(ErrorKind.TYPE_MISMATCH,
                        "'" + node.operator.symbol + "' is not an assignment operator");
        }
    }

    // current value is read before the right-hand side is evaluated
    private Value updateInPlace(AstNode target, String symbol, Operator op, AstNode delta) {
        String name = targetName(target, symbol);
        Value current = env.get(name);
        Value result = applyBinary(op, current, eval(delta));
        write(name, result);
        return result;
    }

    private Value updateInPlace(AstNode target, String symbol, Operator op, Value delta) {
        String name = targetName(target, symbol);
        Value result = applyBinary(op, env.get(name), delta);
        write(name, result);
        return result;
    }

    private static String targetName(AstNode target, String symbol) {
        if (target instanceof Identifier) return ((Identifier) target).name;
        throw new AkiRuntimeException(ErrorKind.INVALID_ASSIGNMENT_TARGET,
                "Target of '" + symbol + "' must be a variable");
    }

    private void write(String name, Value value) {
        if (assignmentPolicy == AssignmentPolicy.MUTATE_ENCLOSING) {
            env.assign(name, value);
        } else {
            env.define(name, value);
        }
    }

    @Override
    public Value visitIndexAccess(IndexAccess node) {
        Value target = eval(node.target);
        Value index = eval(node.index);

        switch (target.getType()) {
            case VECTOR: {
                List<Value> list = target.asVector();
                int i = requireIndex(index);
                if (i < 0 || i >= list.size()) {
                    throw new AkiRuntimeException(ErrorKind.INDEX_OUT_OF_BOUNDS,
                            "Index " + i + " out of bounds for vector of length " + list.size());
                }
                return list.get(i);
            }
            case MAP: {
                if (index.getType() != Value.Type.STRING) {
                    throw new AkiRuntimeException(ErrorKind.TYPE_MISMATCH, "Map key must be a string, got " + index.getType());
                }
                Value v = target.asMap().get(index.asString());
                if (v == null) throw new AkiRuntimeException(ErrorKind.KEY_NOT_FOUND, "Key not found: " + index.asString());
                return v;
            }
            case STRING: {
                String s = target.asString();
                int i = requireIndex(index);
                if (i < 0 || i >= s.length()) {
                    throw new AkiRuntimeException(ErrorKind.INDEX_OUT_OF_BOUNDS,
                            "Index " + i + " out of bounds for string of length " + s.length());
                }
                return Value.string(String.valueOf(s.charAt(i)));
            }
            default:
                throw new AkiRuntimeException(ErrorKind.TYPE_MISMATCH, "Indexing not supported on type: " + target.getType());
        }
    }

    private static int requireIndex(Value index) {
        if (index.getType() != Value.Type.INTEGER) {
            throw new AkiRuntimeException(ErrorKind.TYPE_MISMATCH, "Index must be an integer, got " + index.getType());
        }
        return index.asInteger();
    }

    // -------------------------
    // Concurrency: grammar only
    // -------------------------

    @Override
    public Value visitChannelCreate(ChannelCreate node) { throw unimplemented("channel"); }

    @Override
    public Value visitSend(Send node) { throw unimplemented("send"); }

    @Override
    public Value visitReceive(Receive node) { throw unimplemented("recv"); }

    @Override
    public Value visitAwait(Await node) { throw unimplemented("await"); }

    private static AkiRuntimeException unimplemented(String construct) {
        return new AkiRuntimeException(ErrorKind.UNIMPLEMENTED_NODE_KIND,
                "'" + construct + "' has no runtime semantics");
    }
}
