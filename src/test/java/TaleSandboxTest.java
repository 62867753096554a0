import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.diagnostics.InputExhaustedException;
import com.tale.script.diagnostics.SandboxViolationException;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.ExecutionResult;
import com.tale.script.sandbox.InputQueue;
import com.tale.script.sandbox.SandboxFiles;
import com.tale.script.sandbox.TaleSettings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TaleSandboxTest {

    // ===================== INPUTS =====================

    @Test
    void coerce_numbers_and_text() {
        assertEquals(Value.Type.INT, InputQueue.coerce("42").type);
        assertEquals(Value.integer(42), InputQueue.coerce(" 42 "));
        assertEquals(Value.Type.DECIMAL, InputQueue.coerce("-3.5").type);
        assertEquals(Value.Type.DECIMAL, InputQueue.coerce(".5").type);
        assertEquals(Value.text("forty-two"), InputQueue.coerce("forty-two"));
        assertEquals(Value.text(""), InputQueue.coerce(""));
        assertEquals(Value.Type.TEXT, InputQueue.coerce("1e3").type);
    }

    @Test
    void queue_is_consumed_in_order() {
        InputQueue q = new InputQueue(Arrays.asList("a", "2"));
        assertEquals(Value.text("a"), q.next(null));
        assertEquals(Value.integer(2), q.next("n?"));
        assertEquals(2, q.consumed());
        assertEquals(0, q.remaining());

        InputExhaustedException e = assertThrows(InputExhaustedException.class, () -> q.next("Third?"));
        assertEquals(3, e.askNumber());
        assertEquals(ErrorKind.INPUT_EXHAUSTED, e.kind());
        assertEquals("No more inputs were supplied for ask #3 (\"Third?\"); only 2 values were given."
                + " Add values in the Inputs box (one per line).", e.detail());
    }

    @Test
    void empty_queue_without_prompt() {
        InputExhaustedException e = assertThrows(InputExhaustedException.class,
                () -> new InputQueue(null).next(null));
        assertTrue(e.detail().startsWith("No more inputs were supplied for ask #1;"), e.detail());
    }

    // ===================== FILES =====================

    @Test
    void write_then_read_once() {
        SandboxFiles files = new SandboxFiles(1000, 4);
        SandboxFiles.FileHandle w = files.open("notes/today.txt", "w");
        files.write(w, "hi");
        files.write(w, " there");
        files.close(w);
        assertTrue(w.isClosed());

        SandboxFiles.FileHandle r = files.open("notes/today.txt", "r");
        assertEquals("hi there", files.read(r));
        assertEquals("", files.read(r));
        assertEquals(Collections.singletonMap("notes/today.txt", "hi there"), files.snapshot());
    }

    @Test
    void append_keeps_existing_content() {
        Map<String, String> initial = new HashMap<>();
        initial.put("log.txt", "one\n");
        SandboxFiles files = new SandboxFiles(1000, 4, initial);
        files.write(files.open("log.txt", "a"), "two\n");
        assertEquals("one\ntwo\n", files.readAll("log.txt"));
    }

    @Test
    void closed_and_wrong_mode_handles_fail() {
        SandboxFiles files = new SandboxFiles(1000, 4);
        SandboxFiles.FileHandle w = files.open("a.txt", "w");
        assertThrows(TaleException.class, () -> files.read(w));
        files.close(w);
        TaleException closed = assertThrows(TaleException.class, () -> files.write(w, "x"));
        assertEquals(ErrorKind.RUNTIME, closed.kind());
        assertEquals(ErrorKind.RUNTIME, assertThrows(TaleException.class, () -> files.open("missing.txt", "r")).kind());
    }

    @Test
    void paths_stay_inside_the_workspace() {
        SandboxFiles files = new SandboxFiles(1000, 4);
        for (String bad : new String[] {"/etc/passwd", "../up.txt", "a/../b.txt", "./a.txt", "C:x.txt",
                "a\\b.txt", "", "sp ace.txt"}) {
            assertThrows(SandboxViolationException.class, () -> files.open(bad, "w"), bad);
        }
        assertThrows(SandboxViolationException.class, () -> files.open("ok.txt", "rw"));
        assertEquals(ErrorKind.SECURITY,
                assertThrows(SandboxViolationException.class, () -> files.readAll("/x")).kind());
    }

    @Test
    void preloaded_files_are_checked_too() {
        Map<String, String> initial = new HashMap<>();
        initial.put("../escape.txt", "x");
        assertThrows(SandboxViolationException.class, () -> new SandboxFiles(1000, 4, initial));
    }

    @Test
    void file_limits() {
        SandboxFiles files = new SandboxFiles(10, 2);
        files.writeAll("a.txt", "1");
        files.writeAll("b.txt", "2");
        TaleException tooMany = assertThrows(TaleException.class, () -> files.writeAll("c.txt", "3"));
        assertEquals(ErrorKind.RESOURCE_LIMIT, tooMany.kind());

        TaleException tooBig = assertThrows(TaleException.class, () -> files.writeAll("a.txt", "0123456789"));
        assertEquals(ErrorKind.RESOURCE_LIMIT, tooBig.kind());
        // overwriting within the limit is fine
        files.writeAll("a.txt", "12345678");
        assertEquals("12345678", files.readAll("a.txt"));
    }

    // ===================== SETTINGS =====================

    @Test
    void defaults() {
        TaleSettings s = TaleSettings.defaults();
        assertEquals(2000, s.timeoutMillis());
        assertEquals(64, s.maxCallDepth());
        assertEquals(42L, s.randomSeed());
        assertEquals(Arrays.asList("math", "random", "datetime", "json", "csv"),
                Arrays.asList(s.allowedModules().toArray()));
        assertFalse(s.isModuleAllowed("os"));
    }

    @Test
    void properties_override_defaults() {
        Properties p = new Properties();
        p.setProperty("tale.sandbox.timeout-ms", "500");
        p.setProperty("tale.sandbox.max-steps", "1_000");
        p.setProperty("tale.modules.allowed", "math, json");
        TaleSettings s = TaleSettings.fromProperties(p);
        assertEquals(500, s.timeoutMillis());
        assertEquals(1000, s.maxSteps());
        assertTrue(s.isModuleAllowed("json"));
        assertFalse(s.isModuleAllowed("random"));
        assertEquals(64, s.maxCallDepth());
    }

    @Test
    void bad_settings_are_rejected() {
        Properties p = new Properties();
        p.setProperty("tale.sandbox.timeout-ms", "soon");
        assertThrows(IllegalArgumentException.class, () -> TaleSettings.fromProperties(p));
        assertThrows(IllegalArgumentException.class, () -> TaleSettings.defaults().withMaxSteps(0));
    }

    @Test
    void classpath_settings_load() {
        assertEquals(TaleSettings.defaults().maxSteps(), TaleSettings.load().maxSteps());
    }

    // ===================== RESULTS AND ERRORS =====================

    @Test
    void failure_result_map() {
        TaleException e = TaleException.runtime("Cannot divide by zero").atLine(3);
        ExecutionResult r = ExecutionResult.failure("partial\n", e, "x = 1 / 0\n", null);
        Map<String, Object> m = r.toMap();
        assertEquals(false, m.get("ok"));
        assertEquals("partial\n", m.get("output"));
        assertEquals("Line 3: Cannot divide by zero", m.get("error"));
        assertEquals(3, m.get("errorLine"));
        assertEquals("RUNTIME", m.get("kind"));
        assertEquals(ErrorKind.RUNTIME.suggestedFix(), m.get("suggestedFix"));
        assertTrue(r.files().isEmpty());
    }

    @Test
    void line_is_kept_once_known() {
        TaleException e = TaleException.runtime("boom").atLine(2).atLine(9);
        assertEquals(2, e.line());
        assertEquals("[line 2] boom", e.getMessage());
    }

    @Test
    void only_runtime_errors_are_catchable() {
        for (ErrorKind k : ErrorKind.values()) {
            assertEquals(k == ErrorKind.RUNTIME, k.catchableByProgram(), k.name());
            assertNotNull(k.suggestedFix());
        }
    }
}
