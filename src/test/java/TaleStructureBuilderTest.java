import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.structure.BlockKind;
import com.tale.script.structure.BlockNode;
import com.tale.script.structure.BlockStructureBuilder;
import com.tale.script.structure.BlockTree;
import com.tale.script.structure.BranchKind;
import com.tale.script.structure.SourceProgram;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TaleStructureBuilderTest {

    private static BlockTree build(String... lines) {
        return new BlockStructureBuilder().build(SourceProgram.of(String.join("\n", lines)));
    }

    private static TaleException fault(String... lines) {
        return assertThrows(TaleException.class, () -> build(lines));
    }

    @Test
    void nested_blocks_and_branches() {
        BlockTree tree = build(
                "if x > 0",
                "  repeat 3",
                "    say x",
                "  end",
                "else",
                "  say 0",
                "end"
        );

        assertEquals(1, tree.roots().size());
        BlockNode.Block ifBlock = (BlockNode.Block) tree.roots().get(0);
        assertEquals(BlockKind.IF, ifBlock.kind());
        assertEquals("x > 0", ifBlock.header());
        assertEquals(7, ifBlock.closingLine());

        assertEquals(1, ifBlock.children().size());
        BlockNode.Block repeat = (BlockNode.Block) ifBlock.children().get(0);
        assertEquals(BlockKind.REPEAT, repeat.kind());
        assertEquals(2, repeat.line());
        assertEquals(1, repeat.children().size());

        assertEquals(1, ifBlock.branches().size());
        assertEquals(BranchKind.ELSE, ifBlock.branches().get(0).kind());
        assertEquals(5, ifBlock.branches().get(0).line());
        assertEquals(6, ifBlock.branches().get(0).children().get(0).line());

        assertEquals(2, tree.depth());
    }

    @Test
    void missing_end_blames_the_opening_line() {
        TaleException e = fault(
                "x is 1",
                "if x > 0",
                "  say \"positive\""
        );
        assertEquals(ErrorKind.STRUCTURAL, e.kind());
        assertEquals(2, e.line());
        assertEquals("Missing closing marker 'end' for if opened at line 2", e.detail());
    }

    @Test
    void removing_one_end_from_nested_blocks_blames_the_outer_opener() {
        TaleException e = fault(
                "function check a",
                "  if a > 0",
                "    say a",
                "end"
        );
        assertEquals(1, e.line());
        assertTrue(e.detail().contains("function opened at line 1"));
    }

    @Test
    void innermost_unclosed_block_is_blamed() {
        TaleException e = fault(
                "while true",
                "  for each n in nums",
                "    say n"
        );
        assertEquals(2, e.line());
        assertTrue(e.detail().contains("for each"));
    }

    @Test
    void stray_end_is_reported_on_its_own_line() {
        TaleException e = fault("say 1", "end");
        assertEquals(ErrorKind.STRUCTURAL, e.kind());
        assertEquals(2, e.line());
        assertEquals("Unexpected closing marker 'end' at line 2", e.detail());
    }

    @Test
    void branch_outside_any_block() {
        TaleException e = fault("else", "say 1");
        assertEquals(1, e.line());
        assertEquals("'else' at line 1 has no open block to belong to", e.detail());
    }

    @Test
    void branch_order_rules() {
        TaleException twoElse = fault("if a", "else", "else", "end");
        assertEquals("'else' at line 3 does not belong to the open if block", twoElse.detail());

        TaleException elifAfterElse = fault("if a", "else", "elif b", "end");
        assertEquals(3, elifAfterElse.line());

        TaleException catchInIf = fault("if a", "catch err", "end");
        assertEquals("'catch' at line 2 does not belong to the open if block", catchInIf.detail());

        TaleException afterFinally = fault("try", "  x is 1", "finally", "  say 1", "catch", "end");
        assertEquals(5, afterFinally.line());

        TaleException elseInLoop = fault("while a", "else", "end");
        assertTrue(elseInLoop.detail().contains("open while block"));
    }

    @Test
    void try_needs_catch_or_finally() {
        TaleException e = fault("try", "  x is 1", "end");
        assertEquals(1, e.line());
        assertEquals("try opened at line 1 needs a catch or finally before end", e.detail());

        BlockTree ok = build("try", "  x is 1", "catch err", "  say err", "finally", "  say 2", "end");
        BlockNode.Block t = (BlockNode.Block) ok.roots().get(0);
        assertEquals(2, t.branches().size());
        assertEquals("err", t.branches().get(0).header());
    }

    @Test
    void comments_blank_lines_and_notes_keep_line_numbers() {
        BlockTree tree = build(
                "# a comment",
                "",
                "note \"\"\"",
                "this note spans",
                "several lines\"\"\"",
                "note \"\"\" one-liner \"\"\"",
                "say 1"
        );
        assertEquals(1, tree.roots().size());
        assertEquals(7, tree.roots().get(0).line());
    }

    @Test
    void unterminated_note_is_structural() {
        TaleException e = fault("note \"\"\"", "never closed");
        assertEquals(ErrorKind.STRUCTURAL, e.kind());
    }

    @Test
    void keywords_are_case_insensitive_and_need_a_word_boundary() {
        BlockTree tree = build("IF x > 0", "  iffy is 2", "End");
        BlockNode.Block b = (BlockNode.Block) tree.roots().get(0);
        assertEquals(BlockKind.IF, b.kind());
        assertTrue(b.children().get(0) instanceof BlockNode.Statement);
    }

    @Test
    void unsupported_block_openers_are_transform_errors() {
        TaleException e = fault("x is 1", "generator numbers", "end");
        assertEquals(ErrorKind.TRANSFORM, e.kind());
        assertEquals(2, e.line());
    }

    @Test
    void deep_nesting_does_not_recurse_on_input() {
        List<String> lines = new ArrayList<>();
        int depth = 2000;
        for (int i = 0; i < depth; i++) lines.add("if true");
        lines.add("say 1");
        for (int i = 0; i < depth; i++) lines.add("end");

        BlockTree tree = build(lines.toArray(new String[0]));
        assertEquals(1, tree.roots().size());

        lines.remove(lines.size() - 1);
        TaleException e = fault(lines.toArray(new String[0]));
        assertEquals(1, e.line());
    }

    @Test
    void empty_program_has_no_nodes() {
        assertTrue(build("").roots().isEmpty());
        assertEquals(2, SourceProgram.of("a\nb\n").lineCount());
    }
}
