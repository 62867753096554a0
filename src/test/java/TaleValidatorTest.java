import java.util.List;

import com.tale.script.AnalysisReport;
import com.tale.script.TaleScript;
import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.sandbox.TaleSettings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TaleValidatorTest {

    private final TaleScript engine = new TaleScript(TaleSettings.defaults());

    private AnalysisReport analyze(String... lines) {
        return engine.analyze(String.join("\n", lines));
    }

    private static Diagnostic only(AnalysisReport r) {
        assertEquals(1, r.diagnostics().size(), () -> "diagnostics: " + r.diagnostics());
        return r.diagnostics().get(0);
    }

    @Test
    void clean_program_has_no_diagnostics_and_a_translation() {
        AnalysisReport r = analyze(
                "function add a b",
                "  return a + b",
                "end",
                "total is add 2 3",
                "say total"
        );
        assertTrue(r.ok(), () -> r.diagnostics().toString());
        assertEquals("function add(a, b) {\n    return a + b\n}\ntotal = add(2, 3)\nprint(total)\n", r.translated());
    }

    @Test
    void return_outside_function_is_rejected() {
        Diagnostic d = only(analyze("x is 1", "return x"));
        assertEquals(2, d.line());
        assertEquals(ErrorKind.VALIDATION, d.kind());
        assertEquals("'return' can only be used inside a function", d.message());
    }

    @Test
    void break_and_continue_need_a_loop() {
        assertEquals("'break' can only be used inside a loop", only(analyze("break")).message());
        assertEquals("'continue' can only be used inside a loop",
                only(analyze("if true", "  continue", "end")).message());
        assertTrue(analyze("repeat 3", "  if true", "    break", "  end", "end").ok());
    }

    @Test
    void a_function_body_is_not_inside_the_enclosing_loop() {
        Diagnostic d = only(analyze(
                "repeat 3",
                "  function f",
                "    break",
                "  end",
                "end"
        ));
        assertEquals(3, d.line());
    }

    @Test
    void disallowed_import_is_a_security_error() {
        Diagnostic d = only(analyze("import os"));
        assertEquals(ErrorKind.SECURITY, d.kind());
        assertEquals(1, d.line());
        assertEquals("Import not allowed: os. Available modules: math, random, datetime, json, csv", d.message());
        assertTrue(analyze("import math", "say math.sqrt(16)").ok());
    }

    @Test
    void allowed_modules_follow_settings() {
        TaleScript narrow = new TaleScript(TaleSettings.defaults().withAllowedModules("math"));
        assertTrue(narrow.analyze("import math").ok());
        assertEquals(ErrorKind.SECURITY, only(narrow.analyze("import random")).kind());
    }

    @Test
    void underscore_names_and_denied_builtins_are_security_errors() {
        Diagnostic underscore = only(analyze("_secret is 1"));
        assertEquals(ErrorKind.SECURITY, underscore.kind());

        Diagnostic eval = only(analyze("x is eval(\"1\")"));
        assertEquals(ErrorKind.SECURITY, eval.kind());
        assertEquals("'eval' is not available in TALE", eval.message());

        assertEquals(ErrorKind.SECURITY, only(analyze("list items", "say items._data")).kind());
    }

    @Test
    void unparseable_line_is_a_validation_error() {
        Diagnostic d = only(analyze("say 1", "x is 1 2"));
        assertEquals(2, d.line());
        assertEquals(ErrorKind.VALIDATION, d.kind());
        assertTrue(d.message().startsWith("I could not understand"), d.message());
        assertTrue(d.render().startsWith("Line 2: "));
    }

    @Test
    void every_bad_line_is_reported_in_line_order() {
        AnalysisReport r = analyze(
                "import os",
                "x is 1",
                "y = 2",
                "return x"
        );
        List<Diagnostic> ds = r.diagnostics();
        assertEquals(3, ds.size());
        assertEquals(1, ds.get(0).line());
        assertEquals(ErrorKind.SECURITY, ds.get(0).kind());
        assertEquals(3, ds.get(1).line());
        assertEquals(ErrorKind.TRANSFORM, ds.get(1).kind());
        assertEquals(4, ds.get(2).line());
        assertEquals(ErrorKind.VALIDATION, ds.get(2).kind());
    }

    @Test
    void structural_problem_is_the_only_diagnostic() {
        AnalysisReport r = analyze("if x > 0", "  say x");
        Diagnostic d = only(r);
        assertEquals(ErrorKind.STRUCTURAL, d.kind());
        assertEquals(1, d.line());
        assertNull(r.translated());
    }

    @Test
    void analyze_is_deterministic_and_versions_increase() {
        AnalysisReport a = analyze("y = 1");
        AnalysisReport b = analyze("y = 1");
        assertEquals(a.diagnostics(), b.diagnostics());
        assertTrue(b.version() > a.version());
        assertFalse(engine.isLatest(a.version()));
        assertTrue(engine.isLatest(b.version()));
    }

    @Test
    void report_map_matches_the_rpc_shape() {
        AnalysisReport r = analyze("say 1", "y = 2");
        java.util.Map<String, Object> m = r.toMap();
        assertEquals(false, m.get("ok"));
        assertEquals(r.version(), m.get("version"));
        @SuppressWarnings("unchecked")
        List<java.util.Map<String, Object>> diags = (List<java.util.Map<String, Object>>) m.get("diagnostics");
        assertEquals(2, diags.get(0).get("line"));
        assertEquals("TRANSFORM", diags.get(0).get("kind"));
        assertTrue(((String) diags.get(0).get("message")).startsWith("Line 2: Use 'is'"));
    }
}
