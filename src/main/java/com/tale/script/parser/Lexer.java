package com.tale.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.tale.script.diagnostics.TaleException;

/**
 * Tokenizes one canonical line. Every token carries the TALE source line the
 * text came from, so parse errors point back at the learner's program.
 */
public class Lexer {
    private final String source;
    private final int line;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("if", TokenType.IF);
        map.put("elif", TokenType.ELIF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("function", TokenType.FUNCTION);
        map.put("class", TokenType.CLASS);
        map.put("try", TokenType.TRY);
        map.put("catch", TokenType.CATCH);
        map.put("finally", TokenType.FINALLY);
        map.put("return", TokenType.RETURN);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("pass", TokenType.PASS);
        map.put("raise", TokenType.RAISE);
        map.put("import", TokenType.IMPORT);
        map.put("from", TokenType.FROM);
        map.put("as", TokenType.AS);
        map.put("global", TokenType.GLOBAL);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("null", TokenType.NULL);
        map.put("fn", TokenType.FN);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, int line) {
        this.source = source;
        this.line = line;
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
            case ':': addToken(TokenType.COLON); break;
            case '.':
                if (isDigit(peek())) number();
                else addToken(TokenType.DOT);
                break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(match('>') ? TokenType.ARROW : TokenType.MINUS); break;
            case '*': addToken(match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR); break;
            // '//' is floor division here; canonical text has no comments.
            case '/': addToken(match('/') ? TokenType.DOUBLE_SLASH : TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '!':
                if (match('=')) {
                    addToken(TokenType.BANG_EQUAL);
                } else if (source.startsWith("in", current) && !isAlphaNumeric(charAt(current + 2))) {
                    current += 2;
                    addToken(TokenType.NOT_IN);
                } else {
                    addToken(TokenType.BANG);
                }
                break;
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
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"':
                if (source.startsWith("\"\"", current)) {
                    current += 2;
                    tripleString();
                } else {
                    string('"');
                }
                break;
            case '\'':
                string('\'');
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
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        boolean decimal = source.charAt(start) == '.';
        if (peek() == '.' && !decimal) {
            advance();
            decimal = true;
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (isDigit(peek())) {
                decimal = true;
                while (isDigit(peek())) advance();
            } else {
                current = mark;
            }
        }
        String text = source.substring(start, current);
        if (decimal) {
            addToken(TokenType.DECIMAL, Double.parseDouble(text));
            return;
        }
        try {
            addToken(TokenType.INTEGER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Number is too large: " + text);
        }
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) sb.append(escape(advance()));
            else sb.append(c);
        }
        if (isAtEnd()) throw error("Text is missing its closing " + quote);
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private void tripleString() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && !source.startsWith("\"\"\"", current)) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) sb.append(escape(advance()));
            else sb.append(c);
        }
        if (isAtEnd()) throw error("Text is missing its closing \"\"\"");
        current += 3;
        addToken(TokenType.STRING, sb.toString());
    }

    private static String escape(char c) {
        switch (c) {
            case 'n': return "\n";
            case 't': return "\t";
            case 'r': return "\r";
            case '\\': return "\\";
            case '"': return "\"";
            case '\'': return "'";
            case '0': return "\0";
            default: return "\\" + c;
        }
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
    private char charAt(int i) { return i >= source.length() ? '\0' : source.charAt(i); }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private static boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private TaleException error(String msg) {
        return TaleException.validation(line, msg);
    }
}
