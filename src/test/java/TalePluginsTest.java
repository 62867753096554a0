import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;

import com.tale.script.TaleScript;
import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.sandbox.ExecutionResult;
import com.tale.script.sandbox.TaleSettings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TalePluginsTest {

    private final TaleScript engine = new TaleScript(TaleSettings.defaults());

    private String ok(String... lines) {
        ExecutionResult r = engine.run(String.join("\n", lines), Collections.<String>emptyList());
        assertTrue(r.success(), () -> "run failed: " + r.error());
        return r.output();
    }

    private ExecutionResult fail(String... lines) {
        ExecutionResult r = engine.run(String.join("\n", lines), Collections.<String>emptyList());
        assertFalse(r.success(), () -> "expected a failure, got: " + r.output());
        return r;
    }

    @Test
    void text_helpers() {
        assertEquals("ADA LOVELACE\nAda Lovelace\nodo loveloce\n", ok(
                "name is \"ada lovelace\"",
                "say upper name",
                "say title of name",
                "say replace name \"a\" \"o\""
        ));
        assertEquals("['a', 'b', 'c']\na-b\n", ok(
                "say split \"a,b,c\" \",\"",
                "say join \"-\" [\"a\", \"b\"]"
        ));
        assertEquals("true\n2\n", ok(
                "s is \"banana\"",
                "say startswith s \"ban\"",
                "say find s \"n\""
        ));
    }

    @Test
    void join_rejects_numbers() {
        ExecutionResult r = fail("say join \",\" [1, 2]");
        assertEquals(ErrorKind.RUNTIME, r.errorKind());
        assertTrue(r.error().contains("use str() on it first"), r.error());
    }

    @Test
    void collection_helpers() {
        assertEquals("3\n[1, 2]\n[2, 3]\n", ok(
                "list nums is [1, 2, 3]",
                "x is pop nums",
                "say x",
                "say nums",
                "a is {1, 2, 3}",
                "b is {2, 3, 4}",
                "c is intersection a b",
                "say sorted c"
        ));
        assertEquals("[5, 1]\n", ok(
                "list nums is [1]",
                "insert 5 into nums at 0",
                "say nums"
        ));
    }

    @Test
    void removing_a_missing_item_is_a_runtime_error() {
        assertEquals(ErrorKind.RUNTIME, fail("list nums is [1]", "remove 9 from nums").errorKind());
    }

    @Test
    void numbers_and_conversions() {
        assertEquals("2\n4\n7\n12\n", ok(
                "say round(2.5)",
                "say round(3.5)",
                "m is max 3, 7",
                "say m",
                "say number(\"5\") + 7"
        ));
        assertEquals("5.0\n", ok("say decimal(\"5\")"));
    }

    @Test
    void bad_conversion_explains_itself() {
        ExecutionResult r = fail("say number(\"five\")");
        assertEquals(ErrorKind.RUNTIME, r.errorKind());
        assertTrue(r.error().contains("Cannot turn 'five' into a whole number"), r.error());
    }

    @Test
    void math_imports() {
        assertEquals("3.0\n120\n", ok(
                "from math import sqrt",
                "import math as m",
                "say sqrt(9)",
                "say m.factorial(5)"
        ));
        assertEquals(ErrorKind.RUNTIME, fail("import math", "say math.sqrt(-1)").errorKind());
    }

    @Test
    void datetime_reads_the_run_clock() {
        Clock fixed = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);
        TaleScript atNoon = new TaleScript(TaleSettings.defaults(), TaleScript.standardCapabilities(), fixed);
        ExecutionResult r = atNoon.run(String.join("\n",
                "import datetime",
                "say datetime.today()",
                "say datetime.now()",
                "say datetime.year()",
                "say datetime.weekday()"
        ), null);
        assertTrue(r.success(), () -> r.error());
        assertEquals("2024-03-05\n2024-03-05 10:15:30\n2024\n1\n", r.output());
    }

    @Test
    void random_follows_the_configured_seed() {
        String program = "import random\nlist picks\nrepeat 5\n  add random.randint(1, 1000) to picks\nend\nsay picks";
        TaleScript a = new TaleScript(TaleSettings.defaults().withRandomSeed(7));
        TaleScript b = new TaleScript(TaleSettings.defaults().withRandomSeed(7));
        assertEquals(a.run(program, null).output(), b.run(program, null).output());

        assertEquals("true\n", ok(
                "import random",
                "n is random.randint(1, 6)",
                "say n >= 1 and n <= 6"
        ));
    }

    @Test
    void unknown_module_member() {
        ExecutionResult r = fail("import math", "say math.nope(1)");
        assertEquals(ErrorKind.RUNTIME, r.errorKind());
        assertTrue(r.error().contains("has no member 'nope'"), r.error());
    }
}
