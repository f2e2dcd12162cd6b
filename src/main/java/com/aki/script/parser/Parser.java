package com.aki.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.aki.script.parser.Ast.AstNode;
import com.aki.script.parser.Ast.BinaryOp;
import com.aki.script.parser.Ast.Block;
import com.aki.script.parser.Ast.CompoundAssign;
import com.aki.script.parser.Ast.FunctionCall;
import com.aki.script.parser.Ast.FunctionDecl;
import com.aki.script.parser.Ast.Identifier;
import com.aki.script.parser.Ast.IfExpr;
import com.aki.script.parser.Ast.IndexAccess;
import com.aki.script.parser.Ast.Param;
import com.aki.script.parser.Ast.UnaryOp;
import com.aki.script.parser.Ast.VariableDecl;
import com.aki.script.parser.Ast.WhileLoop;

/**
 * Recursive-descent parser with one token of lookahead.
 *
 * Precedence, lowest first:
 * <pre>
 *   =  +=  -=  postfix ++ --
 *   ||
 *   &amp;&amp;
 *   ==  !=
 *   &lt;  &gt;  &lt;=  &gt;=
 *   +  -
 *   *  /  %
 *   -  !  prefix ++ --
 *   target[index]
 *   primary
 * </pre>
 *
 * The first structural mismatch aborts the parse with a {@link ParseException}.
 */
public class Parser {
    private final List<Token> tokens;
    private final Predicate<String> builtinCallNames;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this(tokens, null);
    }

    /**
     * @param builtinCallNames when non-null, an identifier it accepts parses as a
     *                         call even without a following '(' (legacy scripts).
     */
    public Parser(List<Token> tokens, Predicate<String> builtinCallNames) {
        this.tokens = tokens;
        this.builtinCallNames = builtinCallNames;
    }

    public List<AstNode> parse() {
        List<AstNode> statements = new ArrayList<>();
        try {
            while (!isAtEnd()) {
                statements.add(statement());
            }
        } catch (StackOverflowError e) {
            ParseException pe = new ParseException("Input is nested too deeply.", peek().line);
            pe.initCause(e);
            throw pe;
        }
        return statements;
    }

    private AstNode statement() {
        if (match(TokenType.LET)) return varDeclaration();
        if (match(TokenType.FUNC)) return functionDeclaration();
        if (match(TokenType.IF)) return ifExpr();
        if (match(TokenType.WHILE)) return whileLoop();

        AstNode expr = expression();
        match(TokenType.SEMICOLON);
        return expr;
    }

    private AstNode varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name after 'let'.");

        TypeAnnotation type = null;
        if (match(TokenType.COLON)) {
            type = typeAnnotation();
        }

        AstNode initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }

        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new VariableDecl(name.lexeme, type, initializer);
    }

    private TypeAnnotation typeAnnotation() {
        if (match(TokenType.TILDE)) return TypeAnnotation.unique(typeAnnotation());
        if (match(TokenType.AT)) return TypeAnnotation.shared(typeAnnotation());

        if (match(TokenType.TYPE_VEC)) {
            consume(TokenType.LESS, "Expect '<' after 'Vec'.");
            TypeAnnotation element = typeAnnotation();
            consume(TokenType.GREATER, "Expect '>' after Vec element type.");
            return TypeAnnotation.vec(element);
        }

        if (match(TokenType.TYPE_HASHMAP)) {
            consume(TokenType.LESS, "Expect '<' after 'HashMap'.");
            TypeAnnotation key = typeAnnotation();
            consume(TokenType.COMMA, "Expect ',' between HashMap key and value types.");
            TypeAnnotation value = typeAnnotation();
            consume(TokenType.GREATER, "Expect '>' after HashMap value type.");
            return TypeAnnotation.hashMap(key, value);
        }

        TypeAnnotation.Kind kind = primitiveType(peek().type);
        if (kind == null) throw error(peek(), "Expect type.");
        advance();
        return TypeAnnotation.of(kind);
    }

    private static TypeAnnotation.Kind primitiveType(TokenType type) {
        switch (type) {
            case TYPE_I8: return TypeAnnotation.Kind.I8;
            case TYPE_I16: return TypeAnnotation.Kind.I16;
            case TYPE_I32: return TypeAnnotation.Kind.I32;
            case TYPE_I64: return TypeAnnotation.Kind.I64;
            case TYPE_U8: return TypeAnnotation.Kind.U8;
            case TYPE_U16: return TypeAnnotation.Kind.U16;
            case TYPE_U32: return TypeAnnotation.Kind.U32;
            case TYPE_U64: return TypeAnnotation.Kind.U64;
            case TYPE_F32: return TypeAnnotation.Kind.F32;
            case TYPE_F64: return TypeAnnotation.Kind.F64;
            case TYPE_BOOL: return TypeAnnotation.Kind.BOOL;
            case TYPE_STRING: return TypeAnnotation.Kind.STRING;
            case TYPE_DYN: return TypeAnnotation.Kind.DYNAMIC;
            default: return null;
        }
    }

    private AstNode functionDeclaration() {
        List<Attribute> attributes = new ArrayList<>();
        boolean isAsync = false;

        while (true) {
            if (match(TokenType.WEAK_ATTR)) attributes.add(Attribute.WEAK);
            else if (match(TokenType.SYNC_ATTR)) attributes.add(Attribute.SYNC);
            else if (match(TokenType.OWN_ATTR)) attributes.add(Attribute.OWN);
            else if (match(TokenType.ACTOR_ATTR)) attributes.add(Attribute.ACTOR);
            else if (match(TokenType.ASYNC)) isAsync = true;
            else break;
        }

        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Param> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token paramName = consume(TokenType.IDENTIFIER, "Expect parameter name.");
                consume(TokenType.COLON, "Expect ':' after parameter name.");
                params.add(new Param(paramName.lexeme, typeAnnotation()));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");

        TypeAnnotation returnType = null;
        if (match(TokenType.ARROW)) {
            returnType = typeAnnotation();
        }

        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
        Block body = block();
        return new FunctionDecl(name.lexeme, params, returnType, body, attributes, isAsync);
    }

    // 'if' already consumed; else-if recurses here
    private AstNode ifExpr() {
        AstNode condition = expression();
        consume(TokenType.LEFT_BRACE, "Expect '{' after if condition.");
        Block thenBranch = block();

        AstNode elseBranch = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                elseBranch = ifExpr();
            } else {
                consume(TokenType.LEFT_BRACE, "Expect '{' or 'if' after 'else'.");
                elseBranch = block();
            }
        }
        return new IfExpr(condition, thenBranch, elseBranch);
    }

    private AstNode whileLoop() {
        AstNode condition = expression();
        consume(TokenType.LEFT_BRACE, "Expect '{' after while condition.");
        Block body = block();
        return new WhileLoop(condition, body);
    }

    // '{' already consumed
    private Block block() {
        List<AstNode> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return new Block(statements);
    }

    private AstNode expression() { return assignment(); }

    private AstNode assignment() {
        AstNode expr = or();

        if (match(TokenType.EQUAL)) return new CompoundAssign(Operator.ASSIGN, expr, assignment());
        if (match(TokenType.PLUS_EQUAL)) return new CompoundAssign(Operator.SELF_ADD, expr, assignment());
        if (match(TokenType.MINUS_EQUAL)) return new CompoundAssign(Operator.SELF_SUB, expr, assignment());
        if (match(TokenType.PLUS_PLUS)) return new UnaryOp(UnaryOperator.INC, expr);
        if (match(TokenType.MINUS_MINUS)) return new UnaryOp(UnaryOperator.DEC, expr);

        return expr;
    }

    private AstNode or() {
        AstNode expr = and();
        while (match(TokenType.OR_OR)) {
            AstNode right = and();
            expr = new BinaryOp(expr, Operator.OR, right);
        }
        return expr;
    }

    private AstNode and() {
        AstNode expr = equality();
        while (match(TokenType.AND_AND)) {
            AstNode right = equality();
            expr = new BinaryOp(expr, Operator.AND, right);
        }
        return expr;
    }

    private AstNode equality() {
        AstNode expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Operator op = previous().type == TokenType.EQUAL_EQUAL ? Operator.EQ : Operator.NOT_EQ;
            AstNode right = comparison();
            expr = new BinaryOp(expr, op, right);
        }
        return expr;
    }

    private AstNode comparison() {
        AstNode expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Operator op;
            switch (previous().type) {
                case GREATER: op = Operator.GT; break;
                case GREATER_EQUAL: op = Operator.GT_EQ; break;
                case LESS: op = Operator.LT; break;
                default: op = Operator.LT_EQ;
            }
            AstNode right = term();
            expr = new BinaryOp(expr, op, right);
        }
        return expr;
    }

    private AstNode term() {
        AstNode expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Operator op = previous().type == TokenType.PLUS ? Operator.ADD : Operator.SUB;
            AstNode right = factor();
            expr = new BinaryOp(expr, op, right);
        }
        return expr;
    }

    private AstNode factor() {
        AstNode expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Operator op;
            switch (previous().type) {
                case STAR: op = Operator.MUL; break;
                case SLASH: op = Operator.DIV; break;
                default: op = Operator.MOD;
            }
            AstNode right = unary();
            expr = new BinaryOp(expr, op, right);
        }
        return expr;
    }

    private AstNode unary() {
        if (match(TokenType.MINUS)) return new UnaryOp(UnaryOperator.NEG, unary());
        if (match(TokenType.BANG)) return new UnaryOp(UnaryOperator.NOT, unary());
        if (match(TokenType.PLUS_PLUS)) return new UnaryOp(UnaryOperator.INC, unary());
        if (match(TokenType.MINUS_MINUS)) return new UnaryOp(UnaryOperator.DEC, unary());
        return postfix();
    }

    private AstNode postfix() {
        AstNode expr = primary();
        while (match(TokenType.LEFT_BRACKET)) {
            AstNode index = expression();
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
            expr = new IndexAccess(expr, index);
        }
        return expr;
    }

    private AstNode primary() {
        if (match(TokenType.INTEGER)) return new Ast.IntegerLiteral((Integer) previous().literal);
        if (match(TokenType.FLOAT)) return new Ast.FloatLiteral((Double) previous().literal);
        if (match(TokenType.STRING)) return new Ast.StringLiteral((String) previous().literal);
        if (match(TokenType.TRUE)) return new Ast.BooleanLiteral(true);
        if (match(TokenType.FALSE)) return new Ast.BooleanLiteral(false);

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) {
                return new FunctionCall(name.lexeme, arguments(), name.line);
            }
            if (builtinCallNames != null && builtinCallNames.test(name.lexeme)) {
                return new FunctionCall(name.lexeme, List.of(), name.line);
            }
            return new Identifier(name.lexeme, name.line);
        }

        if (match(TokenType.LEFT_PAREN)) {
            AstNode expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACE)) return block();

        if (match(TokenType.LEFT_BRACKET)) {
            List<AstNode> items = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after vector literal.");
            return new Ast.VectorLiteral(items);
        }

        if (match(TokenType.IF)) return ifExpr();
        if (match(TokenType.WHILE)) return whileLoop();

        if (match(TokenType.CHANNEL)) {
            if (match(TokenType.LEFT_PAREN)) {
                consume(TokenType.RIGHT_PAREN, "Expect ')' after 'channel('.");
            }
            return new Ast.ChannelCreate();
        }

        if (match(TokenType.SEND)) {
            consume(TokenType.LEFT_PAREN, "Expect '(' after 'send'.");
            AstNode channel = expression();
            consume(TokenType.COMMA, "Expect ',' after send channel.");
            AstNode value = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after send value.");
            return new Ast.Send(channel, value);
        }

        if (match(TokenType.RECV)) {
            consume(TokenType.LEFT_PAREN, "Expect '(' after 'recv'.");
            AstNode channel = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after recv channel.");
            return new Ast.Receive(channel);
        }

        if (match(TokenType.AWAIT)) return new Ast.Await(unary());

        throw error(peek(), "Expect expression.");
    }

    // '(' already consumed
    private List<AstNode> arguments() {
        List<AstNode> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return args;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    // The stream may end by exhaustion or with an explicit EOF token.
    private boolean isAtEnd() {
        return current >= tokens.size() || tokens.get(current).type == TokenType.EOF;
    }

    private Token peek() {
        if (current < tokens.size()) return tokens.get(current);
        int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line;
        return new Token(TokenType.EOF, "", null, line);
    }

    private Token previous() { return tokens.get(current - 1); }

    private ParseException error(Token token, String message) {
        String found = token.type == TokenType.EOF ? "end of input" : "'" + token.lexeme + "'";
        return new ParseException(message + " Unexpected " + found + ".", token.line);
    }
}
