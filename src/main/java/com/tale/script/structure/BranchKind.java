package com.tale.script.structure;

import java.util.Locale;

/** Alternate branches that share their block's single closing marker. */
public enum BranchKind {
    ELIF("elif", true, false),
    ELSE("else", false, true),
    CATCH("catch", false, false),
    FINALLY("finally", false, true);

    private final String keyword;
    private final boolean repeatable;
    private final boolean last;

    BranchKind(String keyword, boolean repeatable, boolean last) {
        this.keyword = keyword;
        this.repeatable = repeatable;
        this.last = last;
    }

    public String keyword() { return keyword; }

    /** May appear more than once in the same block. */
    public boolean repeatable() { return repeatable; }

    /** Nothing may follow this branch before 'end'. */
    public boolean last() { return last; }

    /** Recognizes a branch line by its first word; null when the line is not a branch. */
    public static BranchKind recognize(String firstWord) {
        if (firstWord == null) return null;
        String w = firstWord.toLowerCase(Locale.ROOT);
        for (BranchKind k : values()) {
            if (k.keyword.equals(w)) return k;
        }
        return null;
    }
}
