package com.tale.script.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the block tree. A {@link Statement} is a single non-block line; a
 * {@link Block} owns the lines between its opening keyword and its {@code end},
 * split into alternate {@link Branch}es for if/try.
 */
public abstract class BlockNode {

    public interface Visitor<R> {
        R visitStatement(Statement statement);
        R visitBlock(Block block);
    }

    private final int line;
    private final String text;

    BlockNode(int line, String text) {
        this.line = line;
        this.text = text;
    }

    /** 1-based source line this node starts on. */
    public int line() { return line; }

    /** Trimmed source text of the line. */
    public String text() { return text; }

    public abstract <R> R accept(Visitor<R> visitor);

    public static final class Statement extends BlockNode {
        Statement(int line, String text) {
            super(line, text);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStatement(this);
        }
    }

    public static final class Block extends BlockNode {
        private final BlockKind kind;
        private final String header;
        private final List<BlockNode> children = new ArrayList<>();
        private final List<Branch> branches = new ArrayList<>();
        private int closingLine;

        Block(BlockKind kind, int line, String text) {
            super(line, text);
            this.kind = kind;
            this.header = kind.headerOf(text);
        }

        public BlockKind kind() { return kind; }

        /** Text after the opening keyword, e.g. {@code x > 0} for {@code if x > 0}. */
        public String header() { return header; }

        /** Lines before the first branch. */
        public List<BlockNode> children() { return Collections.unmodifiableList(children); }

        public List<Branch> branches() { return Collections.unmodifiableList(branches); }

        public int closingLine() { return closingLine; }

        /** Where new lines currently land: the last branch if there is one. */
        List<BlockNode> open() {
            return branches.isEmpty() ? children : branches.get(branches.size() - 1).children;
        }

        void addBranch(Branch branch) { branches.add(branch); }

        void close(int line) { this.closingLine = line; }

        boolean hasBranch(BranchKind k) {
            for (Branch b : branches) if (b.kind == k) return true;
            return false;
        }

        Branch lastBranch() {
            return branches.isEmpty() ? null : branches.get(branches.size() - 1);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /** An elif/else/catch/finally section sharing its block's closing marker. */
    public static final class Branch {
        private final BranchKind kind;
        private final int line;
        private final String text;
        private final String header;
        private final List<BlockNode> children = new ArrayList<>();

        Branch(BranchKind kind, int line, String text) {
            this.kind = kind;
            this.line = line;
            this.text = text;
            this.header = text.substring(firstWordLength(text)).trim();
        }

        public BranchKind kind() { return kind; }
        public int line() { return line; }
        public String text() { return text; }
        public String header() { return header; }
        public List<BlockNode> children() { return Collections.unmodifiableList(children); }
    }

    static int firstWordLength(String text) {
        int i = 0;
        while (i < text.length() && !Character.isWhitespace(text.charAt(i))) i++;
        return i;
    }
}
