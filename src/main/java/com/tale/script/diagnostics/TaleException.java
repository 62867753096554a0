package com.tale.script.diagnostics;

/**
 * Single unchecked carrier for every TALE failure. The line may be unknown (0) when
 * the fault is raised deep inside a builtin; the interpreter stamps the line of the
 * statement being executed before the exception leaves the sandbox.
 */
public class TaleException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String detail;
    private int line;
    private String suggestedFix;

    public TaleException(ErrorKind kind, int line, String detail) {
        this(kind, line, detail, null);
    }

    public TaleException(ErrorKind kind, int line, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.line = line;
        this.detail = detail;
    }

    public static TaleException structural(int line, String detail) {
        return new TaleException(ErrorKind.STRUCTURAL, line, detail);
    }

    public static TaleException transform(int line, String detail) {
        return new TaleException(ErrorKind.TRANSFORM, line, detail);
    }

    public static TaleException validation(int line, String detail) {
        return new TaleException(ErrorKind.VALIDATION, line, detail);
    }

    public static TaleException runtime(String detail) {
        return new TaleException(ErrorKind.RUNTIME, 0, detail);
    }

    public static TaleException resourceLimit(String detail) {
        return new TaleException(ErrorKind.RESOURCE_LIMIT, 0, detail);
    }

    public ErrorKind kind() { return kind; }
    public int line() { return line; }
    public String detail() { return detail; }

    /** The kind's standard advice unless a more specific hint was attached. */
    public String suggestedFix() {
        return suggestedFix != null ? suggestedFix : kind.suggestedFix();
    }

    public TaleException withSuggestedFix(String fix) {
        this.suggestedFix = fix;
        return this;
    }

    /** Attaches a line if none was known yet. Returns this for rethrow. */
    public TaleException atLine(int line) {
        if (this.line <= 0 && line > 0) this.line = line;
        return this;
    }

    @Override
    public String getMessage() {
        return line > 0 ? "[line " + line + "] " + detail : detail;
    }
}
