import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.tale.debug.Debug;
import com.tale.debug.DebugLevel;
import com.tale.script.AnalysisReport;
import com.tale.script.TaleScript;
import com.tale.script.sandbox.ExecutionResult;
import com.tale.script.sandbox.TaleSettings;

public class TaleDebugTest {

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
        Debug.get().setThreshold(DebugLevel.TRACE);
    }

    @Test
    void default_sink_is_silent_and_present() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().e("test", "nobody listens", new IllegalStateException("x")));
    }

    @Test
    void engine_runs_and_analyzes_without_an_installed_sink() {
        Debug.get().setSink(null);
        TaleScript engine = new TaleScript(TaleSettings.defaults());

        ExecutionResult result = assertDoesNotThrow(() -> engine.run("say \"hello\"", Collections.emptyList()));
        assertTrue(result.success(), result.error());
        assertEquals("hello\n", result.output());

        AnalysisReport report = assertDoesNotThrow(() -> engine.analyze("import os"));
        assertFalse(report.ok());
    }

    @Test
    void sink_receives_messages_at_or_above_threshold() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + " " + tag + " " + message));
        Debug.get().setThreshold(DebugLevel.WARN);

        Debug.get().d("tale.test", "hidden");
        Debug.get().w("tale.test", "shown");

        assertEquals(Collections.singletonList("WARN tale.test shown"), seen);
    }
}
