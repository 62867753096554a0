package com.tale.script.structure;

import java.util.Collections;
import java.util.List;

/** Result of structure building: the top-level nodes of one program, in source order. */
public final class BlockTree {

    private final SourceProgram source;
    private final List<BlockNode> roots;

    BlockTree(SourceProgram source, List<BlockNode> roots) {
        this.source = source;
        this.roots = Collections.unmodifiableList(roots);
    }

    public SourceProgram source() { return source; }

    public List<BlockNode> roots() { return roots; }

    /** Deepest block nesting; 0 for a program without blocks. */
    public int depth() {
        return depthOf(roots);
    }

    private static int depthOf(List<BlockNode> nodes) {
        int max = 0;
        for (BlockNode n : nodes) {
            if (n instanceof BlockNode.Block) {
                BlockNode.Block b = (BlockNode.Block) n;
                int inner = depthOf(b.children());
                for (BlockNode.Branch br : b.branches()) inner = Math.max(inner, depthOf(br.children()));
                max = Math.max(max, inner + 1);
            }
        }
        return max;
    }

    /** Number of structural lines: statements, openers and branches. */
    public int lineCount() {
        return countOf(roots);
    }

    private static int countOf(List<BlockNode> nodes) {
        int n = 0;
        for (BlockNode node : nodes) {
            n++;
            if (node instanceof BlockNode.Block) {
                BlockNode.Block b = (BlockNode.Block) node;
                n += countOf(b.children());
                for (BlockNode.Branch br : b.branches()) n += 1 + countOf(br.children());
            }
        }
        return n;
    }
}
