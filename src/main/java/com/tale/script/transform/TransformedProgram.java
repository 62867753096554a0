package com.tale.script.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.structure.BlockNode;
import com.tale.script.structure.BlockTree;

/**
 * Every structural line of a program in canonical form, keyed by source line,
 * together with the transform diagnostics for the lines that could not be
 * rewritten.
 */
public final class TransformedProgram {

    private final BlockTree tree;
    private final Map<Integer, TransformedStatement> byLine;
    private final List<Diagnostic> diagnostics;

    TransformedProgram(BlockTree tree, Map<Integer, TransformedStatement> byLine, List<Diagnostic> diagnostics) {
        this.tree = tree;
        this.byLine = Collections.unmodifiableMap(new TreeMap<>(byLine));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public BlockTree tree() { return tree; }

    /** Null when the line failed to transform or is not structural. */
    public TransformedStatement at(int line) { return byLine.get(line); }

    public Map<Integer, TransformedStatement> statements() { return byLine; }

    public List<Diagnostic> diagnostics() { return diagnostics; }

    public boolean ok() { return diagnostics.isEmpty(); }

    /** The canonical program as indented, brace-delimited text. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        render(tree.roots(), 0, sb);
        return sb.toString();
    }

    private void render(List<BlockNode> nodes, int depth, StringBuilder sb) {
        for (BlockNode node : nodes) {
            if (node instanceof BlockNode.Block) {
                BlockNode.Block b = (BlockNode.Block) node;
                indent(depth, sb).append(text(b.line())).append(" {\n");
                render(b.children(), depth + 1, sb);
                for (BlockNode.Branch br : b.branches()) {
                    indent(depth, sb).append("} ").append(text(br.line())).append(" {\n");
                    render(br.children(), depth + 1, sb);
                }
                indent(depth, sb).append("}\n");
            } else {
                indent(depth, sb).append(text(node.line())).append('\n');
            }
        }
    }

    private String text(int line) {
        TransformedStatement ts = byLine.get(line);
        return ts == null ? "<line " + line + " not translated>" : ts.canonical();
    }

    private static StringBuilder indent(int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) sb.append("    ");
        return sb;
    }
}
