import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.tale.script.TaleScript;
import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.sandbox.ExecutionResult;
import com.tale.script.sandbox.SandboxExecutor;
import com.tale.script.sandbox.TaleSettings;
import com.tale.script.structure.BlockStructureBuilder;
import com.tale.script.structure.SourceProgram;
import com.tale.script.transform.StatementTranslator;
import com.tale.script.validate.ValidatedProgram;
import com.tale.script.validate.Validator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TaleScriptRunTest {

    private final TaleScript engine = new TaleScript(TaleSettings.defaults());

    private ExecutionResult run(String... lines) {
        return engine.run(String.join("\n", lines), Collections.<String>emptyList());
    }

    private String ok(String... lines) {
        ExecutionResult r = run(lines);
        assertTrue(r.success(), () -> "run failed: " + r.error());
        return r.output();
    }

    @Test
    void hello_world() {
        ExecutionResult r = run("say \"hello\"");
        assertTrue(r.success());
        assertEquals("hello\n", r.output());
        assertEquals("print(\"hello\")\n", r.translated());
        assertNull(r.error());
    }

    @Test
    void if_else_picks_one_branch() {
        assertEquals("positive\n", ok(
                "x is 5",
                "if x > 0",
                "  say \"positive\"",
                "else",
                "  say \"negative\"",
                "end"
        ));
    }

    @Test
    void elif_chain() {
        assertEquals("two\n", ok(
                "x is 2",
                "if x is same as 1",
                "  say \"one\"",
                "elif x is same as 2",
                "  say \"two\"",
                "else",
                "  say \"many\"",
                "end"
        ));
    }

    @Test
    void missing_end_stops_the_run_before_anything_prints() {
        ExecutionResult r = run("say \"before\"", "if x > 0", "  say x");
        assertFalse(r.success());
        assertEquals("", r.output());
        assertEquals(ErrorKind.STRUCTURAL, r.errorKind());
        assertEquals(2, r.errorLine());
        assertEquals("Line 2: Missing closing marker 'end' for if opened at line 2", r.error());
        assertNotNull(r.suggestedFix());
    }

    @Test
    void transform_problem_is_reported_with_its_line() {
        ExecutionResult r = run("x is 1", "y = 2");
        assertFalse(r.success());
        assertEquals(ErrorKind.TRANSFORM, r.errorKind());
        assertEquals("Line 2: Use 'is' to store a value, for example: x is 5", r.error());
    }

    @Test
    void inputs_are_coerced_to_numbers_when_they_look_like_numbers() {
        assertEquals("43\n", engine.run("ask n\nsay n + 1", Arrays.asList("42")).output());
        assertEquals("6.28\n", engine.run("ask n\nsay n * 2", Arrays.asList("3.14")).output());
        assertEquals("text\n", engine.run("ask n\nsay type of n", Arrays.asList("forty-two")).output());
    }

    @Test
    void ask_prints_its_prompt() {
        ExecutionResult r = engine.run("ask \"Age?\" as age\nsay age", Arrays.asList("30"));
        assertTrue(r.success());
        assertEquals("Age?30\n", r.output());
    }

    @Test
    void running_out_of_inputs_keeps_earlier_output() {
        ExecutionResult r = engine.run(String.join("\n",
                "say \"start\"",
                "ask \"First?\" as a",
                "ask \"Second?\" as b",
                "say a"
        ), Arrays.asList("Ada"));
        assertFalse(r.success());
        assertEquals(ErrorKind.INPUT_EXHAUSTED, r.errorKind());
        assertEquals(3, r.errorLine());
        assertTrue(r.output().startsWith("start\n"), r.output());
        assertTrue(r.error().contains("ask #2 (\"Second?\")"), r.error());
        assertTrue(r.error().contains("only 1 value was given"), r.error());
    }

    @Test
    void endless_loop_times_out_and_cannot_be_caught() {
        TaleScript quick = new TaleScript(TaleSettings.defaults().withTimeoutMillis(300));
        ExecutionResult r = quick.run(String.join("\n",
                "x is 0",
                "try",
                "  while true",
                "    x is x + 1",
                "  end",
                "catch err",
                "  say \"caught\"",
                "end"
        ), null);
        assertFalse(r.success());
        assertEquals(ErrorKind.TIMEOUT, r.errorKind());
        assertFalse(r.output().contains("caught"));
    }

    @Test
    void step_limit_is_a_timeout_too() {
        TaleScript tight = new TaleScript(TaleSettings.defaults().withMaxSteps(1000));
        ExecutionResult r = tight.run("repeat 100000\n  x is 1\nend", null);
        assertEquals(ErrorKind.TIMEOUT, r.errorKind());
    }

    @Test
    void runtime_errors_can_be_caught() {
        assertEquals("Problem: Cannot divide by zero\nafter\n", ok(
                "try",
                "  x is 1 / 0",
                "catch err",
                "  say \"Problem:\", err",
                "end",
                "say \"after\""
        ));
    }

    @Test
    void finally_runs_after_catch() {
        assertEquals("caught\ncleanup\n", ok(
                "try",
                "  say missing",
                "catch",
                "  say \"caught\"",
                "finally",
                "  say \"cleanup\"",
                "end"
        ));
    }

    @Test
    void uncaught_runtime_error_reports_line_and_hint() {
        ExecutionResult r = run("say \"a\"", "say y");
        assertFalse(r.success());
        assertEquals("a\n", r.output());
        assertEquals(ErrorKind.RUNTIME, r.errorKind());
        assertEquals("Line 2: Unknown variable: name 'y' is not defined", r.error());
        assertEquals("Did you define the variable before using it?", r.suggestedFix());
    }

    @Test
    void classes_with_init_and_methods() {
        assertEquals("Rex says woof\nDog\n", ok(
                "class Dog",
                "  function init self name",
                "    self.name is name",
                "  end",
                "  function speak self",
                "    say self.name + \" says woof\"",
                "  end",
                "end",
                "d is Dog(\"Rex\")",
                "d.speak()",
                "say type of d"
        ));
    }

    @Test
    void functions_return_values() {
        assertEquals("5\n", ok(
                "function add a b",
                "  return a + b",
                "end",
                "total is add 2 3",
                "say total"
        ));
    }

    @Test
    void runaway_recursion_hits_the_depth_limit() {
        ExecutionResult r = run(
                "function f n",
                "  return f(n + 1)",
                "end",
                "f(0)"
        );
        assertFalse(r.success());
        assertEquals(ErrorKind.RESOURCE_LIMIT, r.errorKind());
        assertTrue(r.error().contains("Too many nested calls (limit 64)"), r.error());
    }

    @Test
    void repeat_with_counter_and_loop_control() {
        assertEquals("0\n1\n2\n", ok("repeat 3 as i", "  say i", "end"));
        assertEquals("0\n2\n", ok(
                "repeat 10 as i",
                "  if i is same as 1",
                "    continue",
                "  end",
                "  if i > 2",
                "    break",
                "  end",
                "  say i",
                "end"
        ));
    }

    @Test
    void for_each_over_dict_items() {
        assertEquals("ada 3\nbob 5\n", ok(
                "dict scores",
                "set scores ada to 3",
                "set scores bob to 5",
                "for each name, score in items scores",
                "  say name, score",
                "end"
        ));
    }

    @Test
    void list_statements() {
        assertEquals("[1, 2, 3, 4]\n3\n", ok(
                "list nums is [3, 1, 2]",
                "add 4 to nums",
                "sort nums",
                "say nums",
                "remove 1 from nums",
                "say len nums"
        ));
    }

    @Test
    void dict_get_and_set() {
        assertEquals("Ada\n{'name': 'Ada'}\n", ok(
                "dict user",
                "set user name to \"Ada\"",
                "say get user name",
                "say user"
        ));
    }

    @Test
    void formatted_text_and_lambdas() {
        assertEquals("Hi Ada!\n", ok("name is \"Ada\"", "say formatted \"Hi {name}!\""));
        assertEquals("[2, 4, 6]\n", ok(
                "list nums is [1, 2, 3]",
                "doubled is map lambda x -> x * 2, nums",
                "say doubled"
        ));
        assertEquals("[2, 3]\n", ok(
                "list nums is [1, 2, 3]",
                "big is filter lambda n -> n > 1, nums",
                "say big"
        ));
    }

    @Test
    void values_print_the_tale_way() {
        assertEquals("true\nnothing\n4.0\n", ok("say true", "say nothing", "say 8 / 2"));
        assertEquals("hello world\n", ok("say \"hello\" + \" world\""));
    }

    @Test
    void files_live_in_the_run_workspace() {
        ExecutionResult r = run(
                "open \"notes.txt\" for writing as f",
                "write f \"hello\"",
                "close f",
                "open \"notes.txt\" as g",
                "say read g",
                "close g"
        );
        assertTrue(r.success(), () -> r.error());
        assertEquals("hello\n", r.output());
        assertEquals("hello", r.files().get("notes.txt"));
    }

    @Test
    void preloaded_files_can_be_read() {
        Map<String, String> files = new HashMap<>();
        files.put("data.txt", "a,b");
        ExecutionResult r = engine.run("open \"data.txt\" as f\nsay read f", null, files);
        assertEquals("a,b\n", r.output());
    }

    @Test
    void file_names_cannot_escape_the_workspace() {
        ExecutionResult r = run("open \"../secret.txt\" as f");
        assertFalse(r.success());
        assertEquals(ErrorKind.SECURITY, r.errorKind());
        assertEquals(1, r.errorLine());
    }

    @Test
    void missing_file_is_a_runtime_error() {
        ExecutionResult r = run("open \"nope.txt\" as f");
        assertEquals(ErrorKind.RUNTIME, r.errorKind());
        assertTrue(r.error().contains("File not found: nope.txt"));
    }

    @Test
    void json_round_trip_through_a_file() {
        ExecutionResult r = run(
                "dict data",
                "set data name to \"Ada\"",
                "json write data to \"out.json\"",
                "loaded is json read \"out.json\"",
                "say get loaded name"
        );
        assertTrue(r.success(), () -> r.error());
        assertEquals("Ada\n", r.output());
        assertTrue(r.files().get("out.json").contains("\"name\""));
    }

    @Test
    void json_module_dumps_on_one_line() {
        assertEquals("{\"name\": \"Ada\", \"langs\": [\"tale\"]}\n", ok(
                "import json",
                "say json.dumps({name: \"Ada\", langs: [\"tale\"]})"
        ));
    }

    @Test
    void csv_round_trip_reads_cells_back_as_text() {
        ExecutionResult r = run(
                "list rows is [[\"name\", \"age\"], [\"Ada\", 36]]",
                "csv write rows to \"people.csv\"",
                "back is csv read \"people.csv\"",
                "say back"
        );
        assertTrue(r.success(), () -> r.error());
        assertEquals("[['name', 'age'], ['Ada', '36']]\n", r.output());
        assertEquals("name,age\nAda,36\n", r.files().get("people.csv"));
    }

    @Test
    void math_module() {
        assertEquals("4.0\n3\n", ok("import math", "say math.sqrt(16)", "say math.floor(7 / 2)"));
    }

    @Test
    void random_is_seeded_so_runs_repeat() {
        String program = "import random\nsay random.randint(1, 100)\nsay random.randint(1, 100)";
        assertEquals(engine.run(program, null).output(), engine.run(program, null).output());
    }

    @Test
    void output_limit_is_enforced() {
        TaleScript small = new TaleScript(TaleSettings.defaults().withMaxOutputChars(10));
        ExecutionResult r = small.run("repeat 100\n  say \"hello\"\nend", null);
        assertEquals(ErrorKind.RESOURCE_LIMIT, r.errorKind());
        assertEquals(10, r.output().length());
    }

    @Test
    void runs_do_not_share_state() {
        assertEquals("1\n", ok("x is 1", "say x"));
        ExecutionResult r = run("say x");
        assertEquals(ErrorKind.RUNTIME, r.errorKind());
    }

    @Test
    void floor_division_overflow_is_reported() {
        ExecutionResult r = run(
                "x is -9223372036854775807 - 1",
                "say x // -1"
        );
        assertFalse(r.success());
        assertEquals(ErrorKind.RUNTIME, r.errorKind());
        assertEquals(2, r.errorLine());
        assertEquals("Line 2: Number is too large", r.error());
    }

    @Test
    void collections_that_contain_themselves_still_print() {
        assertEquals("[1, [...]]\n", ok(
                "l is [1]",
                "l.append(l)",
                "say l"
        ));
        assertEquals("{'me': {...}}\n", ok(
                "dict d",
                "set d me to d",
                "say d"
        ));
    }

    @Test
    void disallowed_import_is_rejected_before_running() {
        ExecutionResult r = run("say \"before\"", "import os");
        assertFalse(r.success());
        assertEquals(ErrorKind.SECURITY, r.errorKind());
        assertEquals(2, r.errorLine());
        assertEquals("", r.output());
    }

    @Test
    void interpreter_checks_imports_again_at_run_time() {
        // validated under the default module list, executed under a narrower one
        TaleSettings wide = TaleSettings.defaults();
        ValidatedProgram program = new Validator(wide).validate(new StatementTranslator().translate(
                new BlockStructureBuilder().build(SourceProgram.of("say \"start\"\nimport math\nsay math.sqrt(16)"))));
        assertTrue(program.ok(), () -> String.valueOf(program.diagnostics()));

        SandboxExecutor narrow = new SandboxExecutor(wide.withAllowedModules("random"), TaleScript.standardCapabilities());
        ExecutionResult r = narrow.execute(program, Collections.<String>emptyList(), null);
        assertFalse(r.success());
        assertEquals(ErrorKind.SECURITY, r.errorKind());
        assertEquals(2, r.errorLine());
        assertEquals("start\n", r.output());
        assertTrue(r.error().contains("Import not allowed: math"), r.error());
    }

    @Test
    void interrupting_the_run_thread_cancels_the_program() throws Exception {
        TaleScript patient = new TaleScript(TaleSettings.defaults().withTimeoutMillis(60_000).withMaxSteps(Long.MAX_VALUE));
        AtomicReference<ExecutionResult> result = new AtomicReference<>();
        Thread runner = new Thread(() -> result.set(patient.run("say \"go\"\nwhile true\n  x is 1\nend", null)));
        runner.start();
        Thread.sleep(100);
        runner.interrupt();
        runner.join(10_000);

        assertFalse(runner.isAlive());
        ExecutionResult r = result.get();
        assertNotNull(r);
        assertFalse(r.success());
        assertEquals(ErrorKind.TIMEOUT, r.errorKind());
        assertTrue(r.error().contains("The run was cancelled"), r.error());
        assertEquals("go\n", r.output());
    }

    @Test
    void split_inputs_box() {
        assertEquals(Arrays.asList("a", "b"), TaleScript.splitInputs("a\nb\n"));
        assertEquals(Arrays.asList("a", "b"), TaleScript.splitInputs("a\r\nb"));
        assertEquals(Arrays.asList("a", "", "b"), TaleScript.splitInputs("a\n\nb"));
        List<String> none = TaleScript.splitInputs("");
        assertTrue(none.isEmpty());
        assertTrue(TaleScript.splitInputs(null).isEmpty());
    }
}
