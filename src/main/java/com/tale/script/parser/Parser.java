package com.tale.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Expr.Assign;
import com.tale.script.parser.Expr.Binary;
import com.tale.script.parser.Expr.Comparison;
import com.tale.script.parser.Expr.Comprehension;
import com.tale.script.parser.Expr.GetExpr;
import com.tale.script.parser.Expr.IndexExpr;
import com.tale.script.parser.Expr.Lambda;
import com.tale.script.parser.Expr.ListLiteral;
import com.tale.script.parser.Expr.Literal;
import com.tale.script.parser.Expr.Logical;
import com.tale.script.parser.Expr.MapLiteral;
import com.tale.script.parser.Expr.MethodCallExpr;
import com.tale.script.parser.Expr.SetExpr;
import com.tale.script.parser.Expr.SetIndexExpr;
import com.tale.script.parser.Expr.SliceExpr;
import com.tale.script.parser.Expr.Ternary;
import com.tale.script.parser.Expr.TupleLiteral;
import com.tale.script.parser.Expr.Unary;
import com.tale.script.parser.Expr.Variable;
import com.tale.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser for one canonical line: either a statement list
 * ({@link #parseLine()}) or a block/branch header ({@link #parseHeader()}).
 * Block bodies are attached later from the block tree, so the parser never
 * sees braces around statements.
 */
public class Parser {
    private static final int MAX_PARAMS = 64;

    private final List<Token> tokens;
    private final int line;
    private int current = 0;

    public Parser(List<Token> tokens, int line) {
        this.tokens = tokens;
        this.line = line;
    }

    public static Parser of(String canonical, int line) {
        return new Parser(new Lexer(canonical, line).tokenize(), line);
    }

    /** Statements separated by ';'. */
    public List<Stmt> parseLine() {
        List<Stmt> statements = new ArrayList<>();
        do {
            if (isAtEnd()) break;
            statements.add(statement());
        } while (match(TokenType.SEMICOLON));
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "'");
        if (statements.isEmpty()) throw error(peek(), "Expected a statement");
        return statements;
    }

    public Expr.ExprInterface parseExpression() {
        Expr.ExprInterface expr = expression();
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "'");
        return expr;
    }

    public Header parseHeader() {
        Header header;
        if (match(TokenType.IF)) header = Header.conditional(Header.Kind.IF, line, parenthesized("if"));
        else if (match(TokenType.ELIF)) header = Header.conditional(Header.Kind.ELIF, line, parenthesized("elif"));
        else if (match(TokenType.WHILE)) header = Header.conditional(Header.Kind.WHILE, line, parenthesized("while"));
        else if (match(TokenType.ELSE)) header = Header.bare(Header.Kind.ELSE, line);
        else if (match(TokenType.TRY)) header = Header.bare(Header.Kind.TRY, line);
        else if (match(TokenType.FINALLY)) header = Header.bare(Header.Kind.FINALLY, line);
        else if (match(TokenType.FOR)) header = forHeader();
        else if (match(TokenType.FUNCTION)) header = functionHeader();
        else if (match(TokenType.CLASS)) header = classHeader();
        else if (match(TokenType.CATCH)) {
            consume(TokenType.LEFT_PAREN, "Expect '(' after 'catch'.");
            Token name = consume(TokenType.IDENTIFIER, "Expect a name for the caught error.");
            consume(TokenType.RIGHT_PAREN, "Expect ')' after the error name.");
            header = Header.catchHeader(line, name.lexeme);
        } else {
            throw error(peek(), "Expected a block header");
        }
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "' after block header");
        return header;
    }

    private Expr.ExprInterface parenthesized(String keyword) {
        consume(TokenType.LEFT_PAREN, "Expect '(' after '" + keyword + "'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after " + keyword + " condition.");
        return condition;
    }

    // for (x, y in items) or for (range(n))
    private Header forHeader() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");
        List<String> vars = new ArrayList<>();
        int mark = current;
        if (check(TokenType.IDENTIFIER)) {
            vars.add(advance().lexeme);
            while (match(TokenType.COMMA)) {
                if (!check(TokenType.IDENTIFIER)) break;
                vars.add(advance().lexeme);
            }
            if (!match(TokenType.IN)) {
                vars.clear();
                current = mark;
            }
        }
        Expr.ExprInterface iterable = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after for clause.");
        return Header.forEach(line, vars, iterable);
    }

    private Header functionHeader() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");
        List<String> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMS + ").");
                }
                Token p = consume(TokenType.IDENTIFIER, "Expect parameter name.");
                if (params.contains(p.lexeme)) throw error(p, "Parameter '" + p.lexeme + "' appears twice.");
                params.add(p.lexeme);
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        return Header.function(line, name.lexeme, params);
    }

    private Header classHeader() {
        Token name = consume(TokenType.IDENTIFIER, "Expect class name.");
        String base = null;
        if (match(TokenType.LEFT_PAREN)) {
            base = consume(TokenType.IDENTIFIER, "Expect base class name.").lexeme;
            consume(TokenType.RIGHT_PAREN, "Expect ')' after base class.");
        }
        return Header.classHeader(line, name.lexeme, base);
    }

    // ------------------------------------------------------------ statements

    private Stmt statement() {
        if (match(TokenType.RETURN)) {
            Token keyword = previous();
            return new Statement.ReturnStmt(keyword, endsStatement() ? null : expressionList());
        }
        if (match(TokenType.RAISE)) {
            Token keyword = previous();
            return new Statement.RaiseStmt(keyword, endsStatement() ? null : expression());
        }
        if (match(TokenType.BREAK)) return new Statement.BreakStmt(previous());
        if (match(TokenType.CONTINUE)) return new Statement.ContinueStmt(previous());
        if (match(TokenType.PASS)) return new Statement.PassStmt(previous());
        if (match(TokenType.IMPORT)) return importStatement();
        if (match(TokenType.FROM)) return fromImportStatement();
        if (match(TokenType.GLOBAL)) {
            Token keyword = previous();
            return new Statement.GlobalStmt(keyword, identifierList("Expect a name after 'global'."));
        }
        return exprStatement();
    }

    private Stmt importStatement() {
        Token keyword = previous();
        Token module = consume(TokenType.IDENTIFIER, "Expect a module name after 'import'.");
        if (check(TokenType.DOT)) throw error(peek(), "Only whole modules can be imported: " + module.lexeme);
        Token alias = null;
        if (match(TokenType.AS)) alias = consume(TokenType.IDENTIFIER, "Expect a name after 'as'.");
        return new Statement.ImportStmt(keyword, module, alias);
    }

    private Stmt fromImportStatement() {
        Token keyword = previous();
        Token module = consume(TokenType.IDENTIFIER, "Expect a module name after 'from'.");
        consume(TokenType.IMPORT, "Expect 'import' after the module name.");
        return new Statement.FromImportStmt(keyword, module, identifierList("Expect a name to import."));
    }

    private List<Token> identifierList(String message) {
        List<Token> names = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, message));
        } while (match(TokenType.COMMA));
        return names;
    }

    private Stmt exprStatement() {
        Token first = peek();
        List<Expr.ExprInterface> targets = new ArrayList<>();
        do {
            targets.add(expression());
        } while (match(TokenType.COMMA));

        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = expressionList();
            if (targets.size() > 1) {
                List<Token> names = new ArrayList<>();
                for (Expr.ExprInterface t : targets) {
                    if (!(t instanceof Variable)) throw error(equals, "Only names can be unpacked into.");
                    names.add(((Variable) t).name);
                }
                return new Statement.UnpackStmt(first.line, names, value);
            }
            return new Statement.ExprStmt(first.line, assignment(targets.get(0), equals, value));
        }
        if (targets.size() > 1) throw error(first, "Unexpected ','");
        return new Statement.ExprStmt(first.line, targets.get(0));
    }

    private Expr.ExprInterface assignment(Expr.ExprInterface target, Token equals, Expr.ExprInterface value) {
        if (target instanceof Variable) {
            return new Assign(((Variable) target).name, value);
        }
        if (target instanceof IndexExpr) {
            IndexExpr ix = (IndexExpr) target;
            return new SetIndexExpr(ix.target, ix.index, value, ix.bracket);
        }
        if (target instanceof GetExpr) {
            GetExpr g = (GetExpr) target;
            return new SetExpr(g.receiver, g.name, value);
        }
        throw error(equals, "Invalid assignment target.");
    }

    /** One expression, or several separated by commas forming a tuple. */
    private Expr.ExprInterface expressionList() {
        Expr.ExprInterface first = expression();
        if (!check(TokenType.COMMA)) return first;
        List<Expr.ExprInterface> items = new ArrayList<>();
        items.add(first);
        while (match(TokenType.COMMA)) {
            if (endsStatement()) break;
            items.add(expression());
        }
        return new TupleLiteral(items);
    }

    private boolean endsStatement() {
        return isAtEnd() || check(TokenType.SEMICOLON);
    }

    // ----------------------------------------------------------- expressions

    private Expr.ExprInterface expression() {
        if (match(TokenType.FN)) return lambda();
        return ternary();
    }

    private Expr.ExprInterface lambda() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'fn'.");
        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        consume(TokenType.ARROW, "Expect '->' before the lambda body.");
        return new Lambda(keyword, params, expression());
    }

    private Expr.ExprInterface ternary() {
        Expr.ExprInterface expr = or();
        if (match(TokenType.IF)) {
            Expr.ExprInterface condition = or();
            consume(TokenType.ELSE, "Expect 'else' in a conditional value.");
            Expr.ExprInterface otherwise = expression();
            return new Ternary(condition, expr, otherwise);
        }
        return expr;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = not();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            Expr.ExprInterface right = not();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface not() {
        if (match(TokenType.BANG)) {
            Token op = previous();
            return new Unary(op, not());
        }
        return comparison();
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        List<Expr.ExprInterface> operands = null;
        List<Token> operators = null;
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.IN, TokenType.NOT_IN)) {
            if (operands == null) {
                operands = new ArrayList<>();
                operators = new ArrayList<>();
                operands.add(expr);
            }
            operators.add(previous());
            operands.add(term());
        }
        if (operands == null) return expr;
        if (operators.size() == 1) return new Binary(operands.get(0), operators.get(0), operands.get(1));
        return new Comparison(operands, operators);
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.DOUBLE_SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.MINUS, TokenType.PLUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return power();
    }

    // right-associative and tighter than unary minus on its left: -2 ** 2 is -4
    private Expr.ExprInterface power() {
        Expr.ExprInterface expr = call();
        if (match(TokenType.DOUBLE_STAR)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                Token paren = previous();
                expr = new Expr.Call(expr, paren, arguments());
            } else if (match(TokenType.LEFT_BRACKET)) {
                expr = subscript(expr, previous());
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expect a name after '.'.");
                if (match(TokenType.LEFT_PAREN)) {
                    expr = new MethodCallExpr(expr, name, arguments());
                } else {
                    expr = new GetExpr(expr, name);
                }
            } else {
                break;
            }
        }

        return expr;
    }

    private List<Expr.ExprInterface> arguments() {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (check(TokenType.RIGHT_PAREN)) break;
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return arguments;
    }

    private Expr.ExprInterface subscript(Expr.ExprInterface target, Token bracket) {
        Expr.ExprInterface lower = null;
        if (!check(TokenType.COLON)) {
            lower = expression();
            if (match(TokenType.RIGHT_BRACKET)) return new IndexExpr(target, lower, bracket);
        }
        consume(TokenType.COLON, "Expect ']' after index.");
        Expr.ExprInterface upper = null;
        Expr.ExprInterface step = null;
        if (!check(TokenType.COLON) && !check(TokenType.RIGHT_BRACKET)) upper = expression();
        if (match(TokenType.COLON) && !check(TokenType.RIGHT_BRACKET)) step = expression();
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after slice.");
        return new SliceExpr(target, lower, upper, step, bracket);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NULL)) return new Literal(null);
        if (match(TokenType.INTEGER, TokenType.DECIMAL, TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());
        if (match(TokenType.FN)) return lambda();

        if (match(TokenType.LEFT_PAREN)) {
            if (match(TokenType.RIGHT_PAREN)) return new TupleLiteral(new ArrayList<>());
            Expr.ExprInterface expr = expression();
            if (match(TokenType.COMMA)) {
                List<Expr.ExprInterface> items = new ArrayList<>();
                items.add(expr);
                while (!check(TokenType.RIGHT_PAREN)) {
                    items.add(expression());
                    if (!match(TokenType.COMMA)) break;
                }
                consume(TokenType.RIGHT_PAREN, "Expect ')' after tuple.");
                return new TupleLiteral(items);
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            List<Expr.ExprInterface> items = new ArrayList<>();
            if (match(TokenType.RIGHT_BRACKET)) return new ListLiteral(items);
            Expr.ExprInterface first = expression();
            if (match(TokenType.FOR)) return comprehension(first);
            items.add(first);
            while (match(TokenType.COMMA)) {
                if (check(TokenType.RIGHT_BRACKET)) break;
                items.add(expression());
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after list.");
            return new ListLiteral(items);
        }

        if (match(TokenType.LEFT_BRACE)) {
            List<Expr.ExprInterface> keys = new ArrayList<>();
            List<Expr.ExprInterface> values = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACE)) {
                do {
                    if (check(TokenType.RIGHT_BRACE)) break;
                    keys.add(expression());
                    consume(TokenType.COLON, "Expect ':' after dict key.");
                    values.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACE, "Expect '}' after dict.");
            return new MapLiteral(keys, values);
        }

        if (isAtEnd()) throw error(peek(), "Expected a value at the end of the line.");
        throw error(peek(), "Expected a value but found '" + peek().lexeme + "'.");
    }

    private Expr.ExprInterface comprehension(Expr.ExprInterface element) {
        List<Token> vars = new ArrayList<>();
        do {
            vars.add(consume(TokenType.IDENTIFIER, "Expect a loop variable after 'for'."));
        } while (match(TokenType.COMMA));
        consume(TokenType.IN, "Expect 'in' in list comprehension.");
        Expr.ExprInterface iterable = or();
        Expr.ExprInterface condition = null;
        if (match(TokenType.IF)) condition = or();
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after list comprehension.");
        return new Comprehension(element, vars, iterable, condition);
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
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private TaleException error(Token token, String message) {
        return TaleException.validation(token.line, "I could not understand: " + message);
    }
}
