package com.tale.script.parser;

import java.util.Collections;
import java.util.List;

/**
 * A parsed block or branch header line such as {@code while (n > 0)} or
 * {@code catch (err)}. Only the fields relevant to {@link #kind} are set.
 */
public final class Header {

    public enum Kind { IF, ELIF, ELSE, WHILE, FOR, FUNCTION, CLASS, TRY, CATCH, FINALLY }

    public final Kind kind;
    public final int line;
    public final Expr.ExprInterface condition;
    public final Expr.ExprInterface iterable;
    public final List<String> names;
    public final String name;
    public final String base;

    private Header(Kind kind, int line, Expr.ExprInterface condition, Expr.ExprInterface iterable,
                   List<String> names, String name, String base) {
        this.kind = kind;
        this.line = line;
        this.condition = condition;
        this.iterable = iterable;
        this.names = names == null ? Collections.<String>emptyList() : Collections.unmodifiableList(names);
        this.name = name;
        this.base = base;
    }

    static Header conditional(Kind kind, int line, Expr.ExprInterface condition) {
        return new Header(kind, line, condition, null, null, null, null);
    }

    static Header bare(Kind kind, int line) {
        return new Header(kind, line, null, null, null, null, null);
    }

    /** Loop variables in {@link #names}; empty for a plain count loop. */
    static Header forEach(int line, List<String> vars, Expr.ExprInterface iterable) {
        return new Header(Kind.FOR, line, null, iterable, vars, null, null);
    }

    /** Parameters in {@link #names}. */
    static Header function(int line, String name, List<String> params) {
        return new Header(Kind.FUNCTION, line, null, null, params, name, null);
    }

    static Header classHeader(int line, String name, String base) {
        return new Header(Kind.CLASS, line, null, null, null, name, base);
    }

    /** The bound error variable is {@link #name}. */
    static Header catchHeader(int line, String name) {
        return new Header(Kind.CATCH, line, null, null, null, name, null);
    }

    /** Parameters of a function, or loop variables of a for. */
    public List<String> params() { return names; }
}
