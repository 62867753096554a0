package com.tale.script.structure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.tale.debug.Debug;
import com.tale.script.diagnostics.TaleException;

/**
 * Turns flat TALE lines into a {@link BlockTree} using an explicit stack of open
 * blocks. Never recurses on input depth, so deeply nested programs are fine.
 *
 * Blank lines, {@code #} comments and {@code note """ ... """} notes take no part
 * in the structure but still count for line numbers.
 */
public final class BlockStructureBuilder {

    private static final String TAG = "tale.structure";
    private static final String NOTE_DELIMITER = "\"\"\"";
    private static final Set<String> UNSUPPORTED_OPENERS = new HashSet<>(Arrays.asList("generator", "with", "async"));

    /**
     * @throws TaleException of kind STRUCTURAL for the first fault found
     */
    public BlockTree build(SourceProgram source) {
        List<BlockNode> roots = new ArrayList<>();
        Deque<BlockNode.Block> open = new ArrayDeque<>();
        boolean inNote = false;

        for (int n = 1; n <= source.lineCount(); n++) {
            String stripped = source.line(n).trim();

            if (inNote) {
                if (stripped.endsWith(NOTE_DELIMITER)) inNote = false;
                continue;
            }
            if (stripped.isEmpty() || stripped.startsWith("#")) continue;

            String lowered = stripped.toLowerCase(Locale.ROOT);
            if (lowered.startsWith("note " + NOTE_DELIMITER)) {
                // A note closes on its own line only if a second delimiter follows the first.
                String afterOpening = stripped.substring(5 + NOTE_DELIMITER.length());
                if (!afterOpening.contains(NOTE_DELIMITER)) inNote = true;
                continue;
            }

            if (lowered.equals(BlockKind.CLOSING_MARKER)) {
                if (open.isEmpty()) {
                    throw TaleException.structural(n, "Unexpected closing marker 'end' at line " + n);
                }
                BlockNode.Block done = open.pop();
                if (done.kind().branchRequired() && done.branches().isEmpty()) {
                    throw TaleException.structural(done.line(), done.kind().keyword() + " opened at line "
                            + done.line() + " needs a catch or finally before end");
                }
                done.close(n);
                continue;
            }

            String first = firstWord(stripped).toLowerCase(Locale.ROOT);
            if (UNSUPPORTED_OPENERS.contains(first)) {
                throw TaleException.transform(n, "'" + first + "' blocks are not supported in TALE");
            }

            BranchKind branch = BranchKind.recognize(first);
            if (branch != null) {
                attachBranch(open, branch, n, stripped);
                continue;
            }

            BlockKind kind = BlockKind.recognize(stripped);
            if (kind != null) {
                BlockNode.Block block = new BlockNode.Block(kind, n, stripped);
                target(open, roots).add(block);
                open.push(block);
                continue;
            }

            target(open, roots).add(new BlockNode.Statement(n, stripped));
        }

        if (inNote) {
            throw TaleException.structural(source.lineCount(), "A note was opened with \"\"\" but never closed");
        }
        if (!open.isEmpty()) {
            BlockNode.Block innermost = open.peek();
            throw TaleException.structural(innermost.line(), "Missing closing marker 'end' for "
                    + innermost.kind().keyword() + " opened at line " + innermost.line());
        }

        BlockTree tree = new BlockTree(source, roots);
        Debug.get().t(TAG, "built tree: " + tree.lineCount() + " lines, depth " + tree.depth());
        return tree;
    }

    private static void attachBranch(Deque<BlockNode.Block> open, BranchKind branch, int n, String stripped) {
        if (open.isEmpty()) {
            throw TaleException.structural(n, "'" + branch.keyword() + "' at line " + n
                    + " has no open block to belong to");
        }
        BlockNode.Block top = open.peek();
        if (!top.kind().accepts(branch)) {
            throw misplaced(branch, n, top);
        }
        BlockNode.Branch last = top.lastBranch();
        if (last != null && last.kind().last()) {
            throw misplaced(branch, n, top);
        }
        if (!branch.repeatable() && top.hasBranch(branch)) {
            throw misplaced(branch, n, top);
        }
        top.addBranch(new BlockNode.Branch(branch, n, stripped));
    }

    private static TaleException misplaced(BranchKind branch, int n, BlockNode.Block top) {
        return TaleException.structural(n, "'" + branch.keyword() + "' at line " + n
                + " does not belong to the open " + top.kind().keyword() + " block");
    }

    private static List<BlockNode> target(Deque<BlockNode.Block> open, List<BlockNode> roots) {
        return open.isEmpty() ? roots : open.peek().open();
    }

    private static String firstWord(String stripped) {
        return stripped.substring(0, BlockNode.firstWordLength(stripped));
    }
}
