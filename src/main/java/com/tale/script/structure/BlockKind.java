package com.tale.script.structure;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Block-opening constructs and their transition table. Each constant states which
 * branches it accepts and whether one is mandatory, so a new kind cannot be added
 * without declaring its transitions.
 */
public enum BlockKind {
    IF("if", EnumSet.of(BranchKind.ELIF, BranchKind.ELSE), false),
    REPEAT("repeat", EnumSet.noneOf(BranchKind.class), false),
    WHILE("while", EnumSet.noneOf(BranchKind.class), false),
    FOR_EACH("for each", EnumSet.noneOf(BranchKind.class), false),
    FUNCTION("function", EnumSet.noneOf(BranchKind.class), false),
    CLASS("class", EnumSet.noneOf(BranchKind.class), false),
    TRY("try", EnumSet.of(BranchKind.CATCH, BranchKind.FINALLY), true);

    public static final String CLOSING_MARKER = "end";

    private final String keyword;
    private final Pattern opener;
    private final Set<BranchKind> branches;
    private final boolean branchRequired;

    BlockKind(String keyword, EnumSet<BranchKind> branches, boolean branchRequired) {
        this.keyword = keyword;
        this.opener = Pattern.compile("^" + keyword.replace(" ", "\\s+") + "(?=\\s|$)", Pattern.CASE_INSENSITIVE);
        this.branches = Collections.unmodifiableSet(branches);
        this.branchRequired = branchRequired;
    }

    public String keyword() { return keyword; }

    public Set<BranchKind> branches() { return branches; }

    public boolean accepts(BranchKind branch) { return branches.contains(branch); }

    /** A block of this kind must carry at least one branch before 'end'. */
    public boolean branchRequired() { return branchRequired; }

    public boolean loops() { return this == REPEAT || this == WHILE || this == FOR_EACH; }

    /**
     * Recognizes an opening line. Keywords are case-insensitive and must be followed by
     * whitespace or the end of the line, so {@code iffy is 2} is an ordinary statement.
     */
    public static BlockKind recognize(String trimmedLine) {
        for (BlockKind k : values()) {
            if (k.opener.matcher(trimmedLine).find()) return k;
        }
        return null;
    }

    /** Text after the keyword, trimmed. */
    public String headerOf(String trimmedLine) {
        Matcher m = opener.matcher(trimmedLine);
        if (!m.find()) throw new IllegalArgumentException("Not a " + keyword + " line: " + trimmedLine);
        return trimmedLine.substring(m.end()).trim();
    }
}
