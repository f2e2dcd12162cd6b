package com.aki.script.parser;

import java.util.List;

/**
 * Syntax tree produced by {@link Parser}. Every node is immutable once built;
 * the interpreter only ever reads it.
 */
public class Ast {

    public interface AstNode {
        <R> R accept(AstVisitor<R> visitor);
    }

    public interface AstVisitor<R> {
        R visitIntegerLiteral(IntegerLiteral node);
        R visitFloatLiteral(FloatLiteral node);
        R visitStringLiteral(StringLiteral node);
        R visitBooleanLiteral(BooleanLiteral node);
        R visitVectorLiteral(VectorLiteral node);
        R visitIdentifier(Identifier node);
        R visitVariableDecl(VariableDecl node);
        R visitFunctionDecl(FunctionDecl node);
        R visitFunctionCall(FunctionCall node);
        R visitBlock(Block node);
        R visitIfExpr(IfExpr node);
        R visitWhileLoop(WhileLoop node);
        R visitBinaryOp(BinaryOp node);
        R visitUnaryOp(UnaryOp node);
        R visitCompoundAssign(CompoundAssign node);
        R visitIndexAccess(IndexAccess node);

        // accepted by the grammar, no runtime semantics
        R visitChannelCreate(ChannelCreate node);
        R visitSend(Send node);
        R visitReceive(Receive node);
        R visitAwait(Await node);
    }

    // -------------------------
    // Literals
    // -------------------------

    public static final class IntegerLiteral implements AstNode {
        public final int value;

        public IntegerLiteral(int value) {
            this.value = value;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIntegerLiteral(this);
        }
    }

    public static final class FloatLiteral implements AstNode {
        public final double value;

        public FloatLiteral(double value) {
            this.value = value;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFloatLiteral(this);
        }
    }

    public static final class StringLiteral implements AstNode {
        public final String value;

        public StringLiteral(String value) {
            this.value = value;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    public static final class BooleanLiteral implements AstNode {
        public final boolean value;

        public BooleanLiteral(boolean value) {
            this.value = value;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBooleanLiteral(this);
        }
    }

    public static final class VectorLiteral implements AstNode {
        public final List<AstNode> elements;

        public VectorLiteral(List<AstNode> elements) {
            this.elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitVectorLiteral(this);
        }
    }

    // -------------------------
    // Names and declarations
    // -------------------------

    public static final class Identifier implements AstNode {
        public final String name;
        public final int line;

        public Identifier(String name, int line) {
            this.name = name;
            this.line = line;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    public static final class VariableDecl implements AstNode {
        public final String name;
        public final TypeAnnotation type;   // may be null
        public final AstNode initializer;   // may be null

        public VariableDecl(String name, TypeAnnotation type, AstNode initializer) {
            this.name = name;
            this.type = type;
            this.initializer = initializer;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitVariableDecl(this);
        }
    }

    public static final class Param {
        public final String name;
        public final TypeAnnotation type;

        public Param(String name, TypeAnnotation type) {
            this.name = name;
            this.type = type;
        }
    }

    public static final class FunctionDecl implements AstNode {
        public final String name;
        public final List<Param> params;
        public final TypeAnnotation returnType; // may be null
        public final Block body;
        public final List<Attribute> attributes;
        public final boolean isAsync;

        public FunctionDecl(String name, List<Param> params, TypeAnnotation returnType, Block body,
                            List<Attribute> attributes, boolean isAsync) {
            this.name = name;
            this.params = List.copyOf(params);
            this.returnType = returnType;
            this.body = body;
            this.attributes = List.copyOf(attributes);
            this.isAsync = isAsync;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFunctionDecl(this);
        }
    }

    public static final class FunctionCall implements AstNode {
        public final String name;
        public final List<AstNode> args;
        public final int line;

        public FunctionCall(String name, List<AstNode> args, int line) {
            this.name = name;
            this.args = List.copyOf(args);
            this.line = line;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    // -------------------------
    // Control flow
    // -------------------------

    public static final class Block implements AstNode {
        public final List<AstNode> statements;

        public Block(List<AstNode> statements) {
            this.statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    public static final class IfExpr implements AstNode {
        public final AstNode condition;
        public final AstNode thenBranch;
        public final AstNode elseBranch; // Block, nested IfExpr, or null

        public IfExpr(AstNode condition, AstNode thenBranch, AstNode elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIfExpr(this);
        }
    }

    public static final class WhileLoop implements AstNode {
        public final AstNode condition;
        public final AstNode body;

        public WhileLoop(AstNode condition, AstNode body) {
            this.condition = condition;
            this.body = body;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitWhileLoop(this);
        }
    }

    // -------------------------
    // Operations
    // -------------------------

    public static final class BinaryOp implements AstNode {
        public final AstNode left;
        public final Operator operator;
        public final AstNode right;

        public BinaryOp(AstNode left, Operator operator, AstNode right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    public static final class UnaryOp implements AstNode {
        public final UnaryOperator operator;
        public final AstNode operand;

        public UnaryOp(UnaryOperator operator, AstNode operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /** {@code target = value}, {@code target += value}, {@code target -= value}. */
    public static final class CompoundAssign implements AstNode {
        public final Operator operator;
        public final AstNode target;
        public final AstNode value;

        public CompoundAssign(Operator operator, AstNode target, AstNode value) {
            this.operator = operator;
            this.target = target;
            this.value = value;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitCompoundAssign(this);
        }
    }

    public static final class IndexAccess implements AstNode {
        public final AstNode target;
        public final AstNode index;

        public IndexAccess(AstNode target, AstNode index) {
            this.target = target;
            this.index = index;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitIndexAccess(this);
        }
    }

    // -------------------------
    // Concurrency
    // -------------------------

    public static final class ChannelCreate implements AstNode {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitChannelCreate(this);
        }
    }

    public static final class Send implements AstNode {
        public final AstNode channel;
        public final AstNode value;

        public Send(AstNode channel, AstNode value) {
            this.channel = channel;
            this.value = value;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitSend(this);
        }
    }

    public static final class Receive implements AstNode {
        public final AstNode channel;

        public Receive(AstNode channel) {
            this.channel = channel;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitReceive(this);
        }
    }

    public static final class Await implements AstNode {
        public final AstNode expression;

        public Await(AstNode expression) {
            this.expression = expression;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitAwait(this);
        }
    }
}
