package com.tale.script.transform;

/** Canonical text for one TALE line, never separated from the line it came from. */
public final class TransformedStatement {

    public enum Role { STATEMENT, BLOCK_HEADER, BRANCH_HEADER }

    private final int line;
    private final Role role;
    private final String source;
    private final String canonical;

    public TransformedStatement(int line, Role role, String source, String canonical) {
        if (line < 1) throw new IllegalArgumentException("line must be 1-based: " + line);
        this.line = line;
        this.role = role;
        this.source = source;
        this.canonical = canonical;
    }

    public int line() { return line; }
    public Role role() { return role; }

    /** The trimmed TALE text. */
    public String source() { return source; }

    public String canonical() { return canonical; }

    @Override
    public String toString() {
        return line + ": " + canonical;
    }
}
