package com.tale.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tale.script.diagnostics.Diagnostic;

/** What {@link TaleScript#analyze(String)} found, stamped with the request version. */
public final class AnalysisReport {

    private final List<Diagnostic> diagnostics;
    private final long version;
    private final String translated;

    AnalysisReport(List<Diagnostic> diagnostics, long version, String translated) {
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.version = version;
        this.translated = translated;
    }

    public boolean ok() { return diagnostics.isEmpty(); }

    public List<Diagnostic> diagnostics() { return diagnostics; }

    public long version() { return version; }

    /** Canonical form of the program; null when its structure could not be built. */
    public String translated() { return translated; }

    public Map<String, Object> toMap() {
        List<Map<String, Object>> diags = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("line", d.line() > 0 ? d.line() : null);
            m.put("message", d.render());
            m.put("kind", d.kind().name());
            diags.add(m);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", ok());
        out.put("diagnostics", diags);
        out.put("version", version);
        return out;
    }

    @Override
    public String toString() {
        return "AnalysisReport{v" + version + ", " + (ok() ? "ok" : diagnostics) + "}";
    }
}
