import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.aki.script.parser.Ast.AstNode;
import com.aki.script.parser.Ast.BinaryOp;
import com.aki.script.parser.Ast.Block;
import com.aki.script.parser.Ast.CompoundAssign;
import com.aki.script.parser.Ast.FunctionCall;
import com.aki.script.parser.Ast.FunctionDecl;
import com.aki.script.parser.Ast.Identifier;
import com.aki.script.parser.Ast.IfExpr;
import com.aki.script.parser.Ast.IndexAccess;
import com.aki.script.parser.Ast.IntegerLiteral;
import com.aki.script.parser.Ast.UnaryOp;
import com.aki.script.parser.Ast.VariableDecl;
import com.aki.script.parser.Ast.VectorLiteral;
import com.aki.script.parser.Ast.WhileLoop;
import com.aki.script.parser.Attribute;
import com.aki.script.parser.Lexer;
import com.aki.script.parser.Operator;
import com.aki.script.parser.ParseException;
import com.aki.script.parser.Parser;
import com.aki.script.parser.Token;
import com.aki.script.parser.TokenType;
import com.aki.script.parser.TypeAnnotation;
import com.aki.script.parser.UnaryOperator;

public class AkiParserTest {

    private static List<AstNode> parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parse();
    }

    private static AstNode single(String src) {
        List<AstNode> nodes = parse(src);
        assertEquals(1, nodes.size(), "Expected one top-level node");
        return nodes.get(0);
    }

    @Test
    void functionDeclAndCall() {
        List<AstNode> nodes = parse("func add(x: i32, y: i32) -> i32 { x + y } add(5, 3);");
        assertEquals(2, nodes.size());

        FunctionDecl decl = (FunctionDecl) nodes.get(0);
        assertEquals("add", decl.name);
        assertEquals(2, decl.params.size());
        assertEquals("y", decl.params.get(1).name);
        assertEquals(TypeAnnotation.of(TypeAnnotation.Kind.I32), decl.params.get(0).type);
        assertEquals(TypeAnnotation.of(TypeAnnotation.Kind.I32), decl.returnType);
        assertEquals(1, decl.body.statements.size());
        assertTrue(decl.body.statements.get(0) instanceof BinaryOp);

        FunctionCall call = (FunctionCall) nodes.get(1);
        assertEquals("add", call.name);
        assertEquals(2, call.args.size());
        assertEquals(5, ((IntegerLiteral) call.args.get(0)).value);
    }

    @Test
    void precedence_mulBindsTighterThanAdd() {
        BinaryOp add = (BinaryOp) single("1 + 2 * 3");
        assertEquals(Operator.ADD, add.operator);
        BinaryOp mul = (BinaryOp) add.right;
        assertEquals(Operator.MUL, mul.operator);
    }

    @Test
    void precedence_leftAssociative() {
        BinaryOp outer = (BinaryOp) single("10 - 4 - 3");
        assertEquals(Operator.SUB, outer.operator);
        assertTrue(outer.left instanceof BinaryOp);
        assertEquals(3, ((IntegerLiteral) outer.right).value);
    }

    @Test
    void precedence_logicalAndComparison() {
        BinaryOp or = (BinaryOp) single("a < b && c == d || e");
        assertEquals(Operator.OR, or.operator);
        BinaryOp and = (BinaryOp) or.left;
        assertEquals(Operator.AND, and.operator);
        assertEquals(Operator.LT, ((BinaryOp) and.left).operator);
        assertEquals(Operator.EQ, ((BinaryOp) and.right).operator);
    }

    @Test
    void unaryAndIndex() {
        UnaryOp neg = (UnaryOp) single("-v[1]");
        assertEquals(UnaryOperator.NEG, neg.operator);
        IndexAccess idx = (IndexAccess) neg.operand;
        assertEquals("v", ((Identifier) idx.target).name);

        UnaryOp not = (UnaryOp) single("!!flag");
        assertEquals(UnaryOperator.NOT, not.operator);
        assertTrue(not.operand instanceof UnaryOp);
    }

    @Test
    void assignment_isRightAssociative() {
        CompoundAssign outer = (CompoundAssign) single("a = b = 3;");
        assertEquals(Operator.ASSIGN, outer.operator);
        assertEquals("a", ((Identifier) outer.target).name);
        CompoundAssign inner = (CompoundAssign) outer.value;
        assertEquals("b", ((Identifier) inner.target).name);
    }

    @Test
    void compoundAndPostfixForms() {
        List<AstNode> nodes = parse("x += 2; x -= 1; x++; x--; ++x;");
        assertEquals(Operator.SELF_ADD, ((CompoundAssign) nodes.get(0)).operator);
        assertEquals(Operator.SELF_SUB, ((CompoundAssign) nodes.get(1)).operator);
        assertEquals(UnaryOperator.INC, ((UnaryOp) nodes.get(2)).operator);
        assertEquals(UnaryOperator.DEC, ((UnaryOp) nodes.get(3)).operator);
        assertEquals(UnaryOperator.INC, ((UnaryOp) nodes.get(4)).operator);
    }

    @Test
    void parserDoesNotValidateAssignmentTargets() {
        CompoundAssign node = (CompoundAssign) single("1 = 2;");
        assertTrue(node.target instanceof IntegerLiteral);
    }

    @Test
    void letWithTypeAndWithoutInitializer() {
        VariableDecl typed = (VariableDecl) single("let v: Vec<~i32> = [1, 2];");
        assertEquals(TypeAnnotation.vec(TypeAnnotation.unique(TypeAnnotation.of(TypeAnnotation.Kind.I32))), typed.type);
        assertEquals(2, ((VectorLiteral) typed.initializer).elements.size());

        VariableDecl bare = (VariableDecl) single("let m: HashMap<string, @dyn>;");
        assertEquals("HashMap<string, @dyn>", bare.type.toString());
        assertNull(bare.initializer);
    }

    @Test
    void letWithEmptyInitializer_isSyntaxError() {
        assertThrows(ParseException.class, () -> parse("let x: i32 = ;"));
    }

    @Test
    void letRequiresSemicolon() {
        ParseException ex = assertThrows(ParseException.class, () -> parse("let x = 1"));
        assertTrue(ex.getMessage().contains("end of input"), ex.getMessage());
    }

    @Test
    void deeplyNestedInput_isSyntaxError() {
        String src = "(".repeat(100_000) + "1" + ")".repeat(100_000);
        ParseException ex = assertThrows(ParseException.class, () -> parse(src));
        assertTrue(ex.getMessage().contains("nested too deeply"), ex.getMessage());
        assertTrue(ex.getCause() instanceof StackOverflowError);
    }

    @Test
    void moderateNesting_parses() {
        assertTrue(single("(".repeat(50) + "1" + ")".repeat(50)) instanceof IntegerLiteral);
    }

    @Test
    void expressionSemicolonIsOptional() {
        assertEquals(3, parse("a b; c").size());
    }

    @Test
    void ifElseIfChain() {
        IfExpr node = (IfExpr) single("if x < 1 { 1 } else if x < 2 { 2 } else { 3 }");
        assertTrue(node.thenBranch instanceof Block);
        IfExpr nested = (IfExpr) node.elseBranch;
        assertTrue(nested.elseBranch instanceof Block);
    }

    @Test
    void ifAsExpressionInLet() {
        VariableDecl decl = (VariableDecl) single("let y = if ok { 1 } else { 2 };");
        assertTrue(decl.initializer instanceof IfExpr);
    }

    @Test
    void ifWithoutBraces_isSyntaxError() {
        ParseException ex = assertThrows(ParseException.class, () -> parse("if x 1"));
        assertTrue(ex.getMessage().contains("'1'"), ex.getMessage());
    }

    @Test
    void whileLoop() {
        WhileLoop loop = (WhileLoop) single("while i < 10 { i += 1; }");
        assertEquals(Operator.LT, ((BinaryOp) loop.condition).operator);
    }

    @Test
    void functionAttributesAndAsync() {
        FunctionDecl decl = (FunctionDecl) single("func #sync #actor async worker() {}");
        assertEquals(List.of(Attribute.SYNC, Attribute.ACTOR), decl.attributes);
        assertTrue(decl.isAsync);
        assertNull(decl.returnType);
        assertTrue(decl.body.statements.isEmpty());
    }

    @Test
    void parameterWithoutType_isSyntaxError() {
        assertThrows(ParseException.class, () -> parse("func f(x) { x }"));
    }

    @Test
    void concurrencyForms() {
        List<AstNode> nodes = parse("let c = channel(); send(c, 1); recv(c); await f();");
        assertEquals(4, nodes.size());
    }

    @Test
    void bareIdentifier_isLoadUnlessCompat() {
        List<Token> tokens = new Lexer("now").tokenize();
        assertTrue(new Parser(tokens).parse().get(0) instanceof Identifier);

        AstNode compat = new Parser(new Lexer("now").tokenize(), Set.of("now")::contains).parse().get(0);
        FunctionCall call = (FunctionCall) compat;
        assertEquals("now", call.name);
        assertTrue(call.args.isEmpty());
    }

    @Test
    void tokensWithoutEof_areAccepted() {
        List<Token> tokens = List.of(
                new Token(TokenType.INTEGER, "1", 1, 1),
                new Token(TokenType.PLUS, "+", null, 1),
                new Token(TokenType.INTEGER, "2", 2, 1));
        assertTrue(new Parser(tokens).parse().get(0) instanceof BinaryOp);

        List<Token> truncated = List.of(
                new Token(TokenType.INTEGER, "1", 1, 1),
                new Token(TokenType.PLUS, "+", null, 1));
        assertThrows(ParseException.class, () -> new Parser(truncated).parse());
    }

    @Test
    void unclosedBlock_reportsLine() {
        ParseException ex = assertThrows(ParseException.class, () -> parse("func f() {\n  1 +\n"));
        assertTrue(ex.hasLocation());
    }
}
