package com.aki.script.tooling;

import java.util.List;

import com.aki.script.parser.Ast.AstNode;
import com.aki.script.parser.Ast.AstVisitor;
import com.aki.script.parser.Ast.Await;
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
import com.aki.script.parser.Ast.Param;
import com.aki.script.parser.Ast.Receive;
import com.aki.script.parser.Ast.Send;
import com.aki.script.parser.Ast.StringLiteral;
import com.aki.script.parser.Ast.UnaryOp;
import com.aki.script.parser.Ast.VariableDecl;
import com.aki.script.parser.Ast.VectorLiteral;
import com.aki.script.parser.Ast.WhileLoop;
import com.aki.script.parser.Attribute;
import com.aki.script.parser.TypeAnnotation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders parsed programs as JSON trees. Every node is an object with a
 * "node" discriminator; optional children are JSON null.
 */
public final class AstJsonPrinter implements AstVisitor<JsonNode> {

    private static final ObjectMapper om = new ObjectMapper();

    public ArrayNode toJson(List<AstNode> program) {
        ArrayNode out = om.createArrayNode();
        for (AstNode node : program) out.add(node.accept(this));
        return out;
    }

    public String print(List<AstNode> program) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(program));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render AST", e);
        }
    }

    private static ObjectNode node(String kind) {
        ObjectNode n = om.createObjectNode();
        n.put("node", kind);
        return n;
    }

    private JsonNode child(AstNode node) {
        return node == null ? om.nullNode() : node.accept(this);
    }

    private ArrayNode children(List<? extends AstNode> nodes) {
        ArrayNode arr = om.createArrayNode();
        for (AstNode n : nodes) arr.add(n.accept(this));
        return arr;
    }

    private static JsonNode type(TypeAnnotation type) {
        return type == null ? om.nullNode() : om.getNodeFactory().textNode(type.toString());
    }

    @Override
    public JsonNode visitIntegerLiteral(IntegerLiteral n) {
        return node("IntegerLiteral").put("value", n.value);
    }

    @Override
    public JsonNode visitFloatLiteral(FloatLiteral n) {
        return node("FloatLiteral").put("value", n.value);
    }

    @Override
    public JsonNode visitStringLiteral(StringLiteral n) {
        return node("StringLiteral").put("value", n.value);
    }

    @Override
    public JsonNode visitBooleanLiteral(BooleanLiteral n) {
        return node("BooleanLiteral").put("value", n.value);
    }

    @Override
    public JsonNode visitVectorLiteral(VectorLiteral n) {
        ObjectNode o = node("VectorLiteral");
        o.set("elements", children(n.elements));
        return o;
    }

    @Override
    public JsonNode visitIdentifier(Identifier n) {
        return node("Identifier").put("name", n.name);
    }

    @Override
    public JsonNode visitVariableDecl(VariableDecl n) {
        ObjectNode o = node("VariableDecl").put("name", n.name);
        o.set("type", type(n.type));
        o.set("initializer", child(n.initializer));
        return o;
    }

    @Override
    public JsonNode visitFunctionDecl(FunctionDecl n) {
        ObjectNode o = node("FunctionDecl").put("name", n.name);
        ArrayNode params = o.putArray("params");
        for (Param p : n.params) {
            ObjectNode po = params.addObject().put("name", p.name);
            po.set("type", type(p.type));
        }
        o.set("returnType", type(n.returnType));
        ArrayNode attrs = o.putArray("attributes");
        for (Attribute a : n.attributes) attrs.add(a.name().toLowerCase());
        o.put("async", n.isAsync);
        o.set("body", child(n.body));
        return o;
    }

    @Override
    public JsonNode visitFunctionCall(FunctionCall n) {
        ObjectNode o = node("FunctionCall").put("name", n.name);
        o.set("args", children(n.args));
        return o;
    }

    @Override
    public JsonNode visitBlock(Block n) {
        ObjectNode o = node("Block");
        o.set("statements", children(n.statements));
        return o;
    }

    @Override
    public JsonNode visitIfExpr(IfExpr n) {
        ObjectNode o = node("IfExpr");
        o.set("condition", child(n.condition));
        o.set("then", child(n.thenBranch));
        o.set("else", child(n.elseBranch));
        return o;
    }

    @Override
    public JsonNode visitWhileLoop(WhileLoop n) {
        ObjectNode o = node("WhileLoop");
        o.set("condition", child(n.condition));
        o.set("body", child(n.body));
        return o;
    }

    @Override
    public JsonNode visitBinaryOp(BinaryOp n) {
        ObjectNode o = node("BinaryOp").put("op", n.operator.symbol);
        o.set("left", child(n.left));
        o.set("right", child(n.right));
        return o;
    }

    @Override
    public JsonNode visitUnaryOp(UnaryOp n) {
        ObjectNode o = node("UnaryOp").put("op", n.operator.symbol);
        o.set("operand", child(n.operand));
        return o;
    }

    @Override
    public JsonNode visitCompoundAssign(CompoundAssign n) {
        ObjectNode o = node("CompoundAssign").put("op", n.operator.symbol);
        o.set("target", child(n.target));
        o.set("value", child(n.value));
        return o;
    }

    @Override
    public JsonNode visitIndexAccess(IndexAccess n) {
        ObjectNode o = node("IndexAccess");
        o.set("target", child(n.target));
        o.set("index", child(n.index));
        return o;
    }

    @Override
    public JsonNode visitChannelCreate(ChannelCreate n) {
        return node("ChannelCreate");
    }

    @Override
    public JsonNode visitSend(Send n) {
        ObjectNode o = node("Send");
        o.set("channel", child(n.channel));
        o.set("value", child(n.value));
        return o;
    }

    @Override
    public JsonNode visitReceive(Receive n) {
        ObjectNode o = node("Receive");
        o.set("channel", child(n.channel));
        return o;
    }

    @Override
    public JsonNode visitAwait(Await n) {
        ObjectNode o = node("Await");
        o.set("expression", child(n.expression));
        return o;
    }
}
