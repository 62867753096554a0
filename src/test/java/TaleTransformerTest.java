import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.structure.BlockKind;
import com.tale.script.structure.BlockStructureBuilder;
import com.tale.script.structure.BranchKind;
import com.tale.script.structure.SourceProgram;
import com.tale.script.transform.ExpressionTransformer;
import com.tale.script.transform.StatementTranslator;
import com.tale.script.transform.TransformedProgram;
import com.tale.script.transform.TransformedStatement;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TaleTransformerTest {

    private final StatementTranslator st = new StatementTranslator();
    private final ExpressionTransformer ex = new ExpressionTransformer();

    private String stmt(String tale) {
        return st.statement(tale, 1);
    }

    private String expr(String tale) {
        return ex.transform(tale, 1);
    }

    private static TransformedProgram translate(String... lines) {
        return new StatementTranslator().translate(
                new BlockStructureBuilder().build(SourceProgram.of(String.join("\n", lines))));
    }

    @Test
    void assignment_and_output() {
        assertEquals("x = 5", stmt("x is 5"));
        assertEquals("print(\"hello\")", stmt("say \"hello\""));
        assertEquals("print(a, b)", stmt("say a, b"));
        assertEquals("print(\"Total: \" + total)", stmt("say \"Total: \" + total"));
        assertEquals("print(\"Hi \" + str(name) + \"!\")", stmt("say formatted \"Hi {name}!\""));
        assertEquals("print(\"true and false\")", stmt("say \"true and false\""));
    }

    @Test
    void ask_forms() {
        assertEquals("name = ask(); result = name", stmt("ask name"));
        assertEquals("age = ask(\"Age?\"); result = age", stmt("ask \"Age?\" as age"));
        assertEquals("result = ask(\"Ready?\")", stmt("ask \"Ready?\""));
    }

    @Test
    void declarations_and_collection_statements() {
        assertEquals("nums = []", stmt("list nums"));
        assertEquals("nums = [1, 2]", stmt("list nums is [1, 2]"));
        assertEquals("d = {}", stmt("dict d"));
        assertEquals("nums = add_to(nums, 4)", stmt("add 4 to nums"));
        assertEquals("insert(nums, 0, 5)", stmt("insert 5 into nums at 0"));
        assertEquals("remove(nums, 3)", stmt("remove 3 from nums"));
        assertEquals("user[\"name\"] = \"Ada\"", stmt("set user name to \"Ada\""));
        assertEquals("pop(d, \"key\")", stmt("pop d key"));
        assertEquals("sort(nums)", stmt("sort nums"));
        assertEquals("a, b = pair", stmt("unpack pair into a, b"));
    }

    @Test
    void file_statements() {
        assertEquals("f = open(\"notes.txt\", \"w\")", stmt("open \"notes.txt\" for writing as f"));
        assertEquals("f = open(\"notes.txt\", \"a\")", stmt("open \"notes.txt\" for appending as f"));
        assertEquals("f = open(\"notes.txt\", \"r\")", stmt("open \"notes.txt\" as f"));
        assertEquals("write(f, \"hi\")", stmt("write f \"hi\""));
        assertEquals("close(f)", stmt("close f"));
    }

    @Test
    void literals_and_operators() {
        assertEquals("a && ! b", expr("a and not b"));
        assertEquals("x == y", expr("x is same as y"));
        assertEquals("x != y", expr("x is not same as y"));
        assertEquals("true || false", expr("True or false"));
        assertEquals("null", expr("nothing"));
        assertEquals("x !in items", expr("x not in items"));
        assertEquals("int(\"5\")", expr("number(\"5\")"));
        assertEquals("\"and or not\"", expr("\"and or not\""));
    }

    @Test
    void brace_shorthand() {
        assertEquals("{\"name\": \"Alex\"}", expr("{name: \"Alex\"}"));
        assertEquals("set([1, 2])", expr("{1, 2}"));
        assertEquals("{}", expr("{}"));
    }

    @Test
    void named_helpers() {
        assertEquals("len(nums) + 1", expr("len nums + 1"));
        assertEquals("upper(name)", expr("upper of name"));
        assertEquals("replace(s, \"a\", \"b\")", expr("replace s \"a\" \"b\""));
        assertEquals("split(line, \",\")", expr("split line \",\""));
        assertEquals("get(scores, \"player\")", expr("get scores player"));
        assertEquals("get(d, \"k\")", expr("get \"k\" from d"));
        assertEquals("type(x)", expr("type of x"));
        assertEquals("read_json(\"d.json\")", expr("json read \"d.json\""));
        assertEquals("write_csv(rows, \"t.csv\")", expr("csv write rows to \"t.csv\""));
    }

    @Test
    void calls_and_lambdas() {
        assertEquals("greet(\"Ada\")", expr("call greet \"Ada\""));
        assertEquals("greet(\"Ada\", 3)", expr("greet \"Ada\" 3"));
        assertEquals("fn(x, y) -> x + y", expr("lambda x y -> x + y"));
        assertEquals("map(fn(x) -> x * 2, nums)", expr("map lambda x -> x * 2, nums"));
        assertEquals("filter(fn(n) -> n > 1, nums)", expr("filter lambda n -> n > 1, nums"));
        assertEquals("map(fn(a, b) -> a + b, pairs)", expr("map lambda a, b -> a + b, pairs"));

        TaleException e = assertThrows(TaleException.class, () -> expr("lambda x"));
        assertEquals(ErrorKind.TRANSFORM, e.kind());
    }

    @Test
    void block_headers() {
        assertEquals("if (x > 0)", st.header(BlockKind.IF, "x > 0", 1));
        assertEquals("while (x < 3)", st.header(BlockKind.WHILE, "x < 3", 1));
        assertEquals("for (range(3))", st.header(BlockKind.REPEAT, "3", 1));
        assertEquals("for (range(3))", st.header(BlockKind.REPEAT, "3 times", 1));
        assertEquals("for (i in range(5))", st.header(BlockKind.REPEAT, "5 as i", 1));
        assertEquals("for (n in numbers)", st.header(BlockKind.FOR_EACH, "n in numbers", 1));
        assertEquals("for (k, v in items(d))", st.header(BlockKind.FOR_EACH, "k, v in items d", 1));
        assertEquals("function greet(name, greeting)", st.header(BlockKind.FUNCTION, "greet name greeting", 1));
        assertEquals("function main()", st.header(BlockKind.FUNCTION, "main", 1));
        assertEquals("class Dog(Animal)", st.header(BlockKind.CLASS, "Dog(Animal)", 1));
        assertEquals("try", st.header(BlockKind.TRY, "", 1));

        assertEquals("elif (x < 3)", st.branch(BranchKind.ELIF, "x < 3", 1));
        assertEquals("else", st.branch(BranchKind.ELSE, "", 1));
        assertEquals("catch (error)", st.branch(BranchKind.CATCH, "", 1));
        assertEquals("catch (err)", st.branch(BranchKind.CATCH, "err", 1));
        assertEquals("catch (e)", st.branch(BranchKind.CATCH, "as e", 1));
        assertEquals("finally", st.branch(BranchKind.FINALLY, "", 1));
    }

    @Test
    void malformed_headers_are_transform_errors() {
        assertThrows(TaleException.class, () -> st.header(BlockKind.IF, "", 4));
        assertThrows(TaleException.class, () -> st.header(BlockKind.TRY, "now", 4));
        assertThrows(TaleException.class, () -> st.header(BlockKind.FOR_EACH, "n numbers", 4));
        TaleException e = assertThrows(TaleException.class, () -> st.header(BlockKind.FUNCTION, "1st x", 4));
        assertEquals(4, e.line());
        assertEquals(ErrorKind.TRANSFORM, e.kind());
    }

    @Test
    void foreign_syntax_is_rejected() {
        assertEquals("Use 'is' to store a value, for example: x is 5",
                assertThrows(TaleException.class, () -> stmt("x = 5")).detail());
        assertThrows(TaleException.class, () -> stmt("a is 1; b is 2"));
        assertThrows(TaleException.class, () -> stmt("x is `ls`"));
        assertThrows(TaleException.class, () -> stmt("x is $HOME"));
        assertThrows(TaleException.class, () -> stmt("x is __import__"));
        assertEquals("'yield' is not supported in TALE",
                assertThrows(TaleException.class, () -> stmt("yield 5")).detail());
        // the same characters are fine inside text
        assertEquals("print(\"a; b $ @\")", stmt("say \"a; b $ @\""));
    }

    @Test
    void translation_keeps_lines_and_roles() {
        TransformedProgram p = translate(
                "x is 1",
                "if x > 0",
                "  say \"positive\"",
                "end"
        );
        assertTrue(p.ok());
        assertEquals(TransformedStatement.Role.STATEMENT, p.at(1).role());
        assertEquals(TransformedStatement.Role.BLOCK_HEADER, p.at(2).role());
        assertEquals("if (x > 0)", p.at(2).canonical());
        assertEquals("say \"positive\"", p.at(3).source());
        assertNull(p.at(4));

        assertEquals("x = 1\nif (x > 0) {\n    print(\"positive\")\n}\n", p.render());
    }

    @Test
    void each_bad_line_gets_its_own_diagnostic() {
        TransformedProgram p = translate(
                "x is 1",
                "y = 2",
                "z is 3",
                "a; b"
        );
        assertFalse(p.ok());
        assertEquals(2, p.diagnostics().size());
        Diagnostic first = p.diagnostics().get(0);
        assertEquals(2, first.line());
        assertEquals(ErrorKind.TRANSFORM, first.kind());
        assertEquals(4, p.diagnostics().get(1).line());
        assertNotNull(p.at(1));
        assertNotNull(p.at(3));
        assertNull(p.at(2));
    }

    @Test
    void translation_is_deterministic() {
        String[] program = {"list nums is [3, 1, 2]", "for each n in sorted nums", "  say formatted \"n={n}\"", "end"};
        assertEquals(translate(program).render(), translate(program).render());
    }
}
