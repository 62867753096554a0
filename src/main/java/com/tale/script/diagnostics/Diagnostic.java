package com.tale.script.diagnostics;

import java.util.Objects;

/** A line-numbered problem found without executing anything. */
public final class Diagnostic {

    public enum Severity { ERROR }

    private final int line;
    private final String message;
    private final Severity severity;
    private final ErrorKind kind;

    public Diagnostic(int line, String message, ErrorKind kind) {
        this.line = line;
        this.message = Objects.requireNonNull(message, "message");
        this.severity = Severity.ERROR;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static Diagnostic of(TaleException e) {
        return new Diagnostic(e.line(), e.detail(), e.kind());
    }

    public int line() { return line; }
    public String message() { return message; }
    public Severity severity() { return severity; }
    public ErrorKind kind() { return kind; }

    /** "Line 3: Unknown helper" style, the form shown to learners. */
    public String render() {
        return line > 0 ? "Line " + line + ": " + message : message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return line == that.line && message.equals(that.message) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, message, kind);
    }

    @Override
    public String toString() {
        return kind + " " + render();
    }
}
