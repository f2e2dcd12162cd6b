package com.aki.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    private static final Map<String, TokenType> keywords;
    private static final Map<String, TokenType> attributes;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("let", TokenType.LET);
        map.put("func", TokenType.FUNC);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("return", TokenType.RETURN);
        map.put("mod", TokenType.MOD);
        map.put("pub", TokenType.PUB);
        map.put("use", TokenType.USE);
        map.put("struct", TokenType.STRUCT);
        map.put("impl", TokenType.IMPL);
        map.put("async", TokenType.ASYNC);
        map.put("await", TokenType.AWAIT);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);

        map.put("channel", TokenType.CHANNEL);
        map.put("send", TokenType.SEND);
        map.put("recv", TokenType.RECV);

        map.put("i8", TokenType.TYPE_I8);
        map.put("i16", TokenType.TYPE_I16);
        map.put("i32", TokenType.TYPE_I32);
        map.put("i64", TokenType.TYPE_I64);
        map.put("u8", TokenType.TYPE_U8);
        map.put("u16", TokenType.TYPE_U16);
        map.put("u32", TokenType.TYPE_U32);
        map.put("u64", TokenType.TYPE_U64);
        map.put("f32", TokenType.TYPE_F32);
        map.put("f64", TokenType.TYPE_F64);
        map.put("bool", TokenType.TYPE_BOOL);
        map.put("string", TokenType.TYPE_STRING);
        map.put("dyn", TokenType.TYPE_DYN);
        map.put("Vec", TokenType.TYPE_VEC);
        map.put("HashMap", TokenType.TYPE_HASHMAP);
        keywords = Collections.unmodifiableMap(map);

        Map<String, TokenType> attrs = new HashMap<>();
        attrs.put("weak", TokenType.WEAK_ATTR);
        attrs.put("sync", TokenType.SYNC_ATTR);
        attrs.put("own", TokenType.OWN_ATTR);
        attrs.put("actor", TokenType.ACTOR_ATTR);
        attributes = Collections.unmodifiableMap(attrs);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '~': addToken(TokenType.TILDE); break;
            case '@': addToken(TokenType.AT); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case ':': addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON); break;
            case '+':
                if (match('=')) addToken(TokenType.PLUS_EQUAL);
                else if (match('+')) addToken(TokenType.PLUS_PLUS);
                else addToken(TokenType.PLUS);
                break;
            case '-':
                if (match('>')) addToken(TokenType.ARROW);
                else if (match('=')) addToken(TokenType.MINUS_EQUAL);
                else if (match('-')) addToken(TokenType.MINUS_MINUS);
                else addToken(TokenType.MINUS);
                break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else throw error("Unexpected '&'");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else throw error("Unexpected '|'");
                break;
            case '#':
                attribute();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                line++;
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.TRUE) addToken(type, Boolean.TRUE);
        else if (type == TokenType.FALSE) addToken(type, Boolean.FALSE);
        else addToken(type);
    }

    private void attribute() {
        while (isAlpha(peek())) advance();
        String name = source.substring(start + 1, current);
        TokenType type = attributes.get(name);
        if (type == null) throw error("Unknown attribute: #" + name);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            addToken(TokenType.FLOAT, Double.parseDouble(source.substring(start, current)));
            return;
        }
        String text = source.substring(start, current);
        try {
            addToken(TokenType.INTEGER, Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + text);
        }
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') line++;
            if (c == '\\' && !isAtEnd()) {
                char esc = advance();
                switch (esc) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    default: sb.append(esc);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private ParseException error(String msg) {
        return new ParseException(msg, line);
    }
}
