package com.tale.script.sandbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.diagnostics.TaleException;

/**
 * Exactly one of these comes back from every run: success with the captured
 * output, or a structured failure that still carries the output produced
 * before the fault.
 */
public final class ExecutionResult {

    private final boolean success;
    private final String output;
    private final String error;
    private final int errorLine;
    private final ErrorKind errorKind;
    private final String suggestedFix;
    private final String translated;
    private final Map<String, String> files;

    private ExecutionResult(boolean success, String output, String error, int errorLine, ErrorKind errorKind,
                            String suggestedFix, String translated, Map<String, String> files) {
        this.success = success;
        this.output = output == null ? "" : output;
        this.error = error;
        this.errorLine = errorLine;
        this.errorKind = errorKind;
        this.suggestedFix = suggestedFix;
        this.translated = translated;
        this.files = files == null ? Collections.<String, String>emptyMap() : files;
    }

    public static ExecutionResult success(String output, String translated, Map<String, String> files) {
        return new ExecutionResult(true, output, null, 0, null, null, translated, files);
    }

    public static ExecutionResult failure(String output, TaleException e, String translated, Map<String, String> files) {
        String rendered = e.line() > 0 ? "Line " + e.line() + ": " + e.detail() : e.detail();
        return new ExecutionResult(false, output, rendered, e.line(), e.kind(), e.suggestedFix(), translated, files);
    }

    /** Static problems stop a run before anything executes; the first one is reported. */
    public static ExecutionResult rejected(Diagnostic first, String translated) {
        return new ExecutionResult(false, "", first.render(), first.line(), first.kind(),
                first.kind().suggestedFix(), translated, null);
    }

    public boolean success() { return success; }
    public String output() { return output; }

    /** "Line N: message", or null on success. */
    public String error() { return error; }

    /** 0 when unknown or on success. */
    public int errorLine() { return errorLine; }

    public ErrorKind errorKind() { return errorKind; }
    public String suggestedFix() { return suggestedFix; }

    /** Canonical form of the program; null when it never got that far. */
    public String translated() { return translated; }

    /** The in-memory file workspace as the run left it. */
    public Map<String, String> files() { return files; }

    /** Wire form: {@code ok, output} plus the error fields on failure. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ok", success);
        m.put("output", output);
        if (!success) {
            m.put("error", error);
            if (errorLine > 0) m.put("errorLine", errorLine);
            m.put("kind", errorKind.name());
            m.put("suggestedFix", suggestedFix);
        }
        if (translated != null) m.put("translated", translated);
        return m;
    }

    @Override
    public String toString() {
        return success ? "ExecutionResult{ok, output=" + output.length() + " chars}"
                : "ExecutionResult{" + errorKind + ", " + error + "}";
    }
}
