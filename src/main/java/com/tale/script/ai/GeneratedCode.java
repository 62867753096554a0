package com.tale.script.ai;

import java.util.LinkedHashMap;
import java.util.Map;

import com.tale.script.AnalysisReport;

/** Generated program text and what analyze said about it. */
public final class GeneratedCode {

    private final String code;
    private final AnalysisReport analysis;

    GeneratedCode(String code, AnalysisReport analysis) {
        this.code = code;
        this.analysis = analysis;
    }

    public String code() { return code; }

    public AnalysisReport analysis() { return analysis; }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("code", code);
        out.put("analysis", analysis.toMap());
        return out;
    }
}
