package com.tale.script.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Quote- and bracket-aware helpers over a single line of text. Every rewrite the
 * transformer performs goes through here so that nothing inside a string literal
 * is ever touched.
 *
 * Recognized literals: {@code "..."}, {@code '...'} and {@code """..."""}; a
 * backslash inside a literal escapes the next character.
 */
public final class TextScanner {

    private TextScanner() {}

    /** A run of either code or a complete string literal (quotes included). */
    public static final class Segment {
        public final String text;
        public final boolean literal;

        Segment(String text, boolean literal) {
            this.text = text;
            this.literal = literal;
        }
    }

    public static List<Segment> segments(String s) {
        List<Segment> out = new ArrayList<>();
        int i = 0;
        int codeStart = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"' || c == '\'') {
                if (i > codeStart) out.add(new Segment(s.substring(codeStart, i), false));
                int end = literalEnd(s, i);
                out.add(new Segment(s.substring(i, end), true));
                i = end;
                codeStart = i;
            } else {
                i++;
            }
        }
        if (codeStart < s.length()) out.add(new Segment(s.substring(codeStart), false));
        return out;
    }

    /** Index just past the literal starting at {@code start}, or the text length if unterminated. */
    static int literalEnd(String s, int start) {
        char q = s.charAt(start);
        boolean triple = q == '"' && s.startsWith("\"\"\"", start);
        int i = start + (triple ? 3 : 1);
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (triple) {
                if (s.startsWith("\"\"\"", i)) return i + 3;
            } else if (c == q) {
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    /** Applies {@code f} to every code run, leaving literals untouched. */
    public static String mapCode(String s, UnaryOperator<String> f) {
        StringBuilder sb = new StringBuilder(s.length() + 16);
        for (Segment seg : segments(s)) sb.append(seg.literal ? seg.text : f.apply(seg.text));
        return sb.toString();
    }

    /** The text with every literal blanked to spaces; positions are preserved. */
    public static String maskLiterals(String s) {
        return maskLiterals(s, ' ');
    }

    private static String maskLiterals(String s, char fill) {
        StringBuilder sb = new StringBuilder(s.length());
        for (Segment seg : segments(s)) {
            if (seg.literal) {
                for (int i = 0; i < seg.text.length(); i++) sb.append(fill);
            } else {
                sb.append(seg.text);
            }
        }
        return sb.toString();
    }

    public static boolean containsInCode(String s, String needle) {
        return maskLiterals(s).contains(needle);
    }

    /** True when the whole (trimmed) text is exactly one string literal. */
    public static boolean looksLikeString(String s) {
        String t = s.trim();
        if (t.isEmpty() || (t.charAt(0) != '"' && t.charAt(0) != '\'')) return false;
        int end = literalEnd(t, 0);
        if (end != t.length()) return false;
        boolean triple = t.startsWith("\"\"\"");
        return triple ? t.length() >= 6 && t.endsWith("\"\"\"") : t.length() >= 2 && t.charAt(t.length() - 1) == t.charAt(0);
    }

    /** Bracket depth of each position, outside literals. */
    private static int[] depths(String masked) {
        int[] d = new int[masked.length()];
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                d[i] = depth;
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                d[i] = depth;
            } else {
                d[i] = depth;
            }
        }
        return d;
    }

    /**
     * Index of {@code " word "} at bracket depth 0 outside literals, or -1. The
     * returned index points at the leading space.
     */
    public static int indexOfWord(String s, String word) {
        return indexOfWord(s, word, 0);
    }

    public static int indexOfWord(String s, String word, int from) {
        String masked = maskLiterals(s);
        int[] depth = depths(masked);
        String needle = " " + word + " ";
        int i = masked.indexOf(needle, from);
        while (i >= 0) {
            if (depth[i] == 0) return i;
            i = masked.indexOf(needle, i + 1);
        }
        return -1;
    }

    /** Index of {@code c} at depth 0 outside literals, or -1. */
    public static int indexOfTopLevel(String s, char c) {
        String masked = maskLiterals(s);
        int[] depth = depths(masked);
        for (int i = 0; i < masked.length(); i++) {
            if (masked.charAt(i) == c && depth[i] == 0) return i;
        }
        return -1;
    }

    /** Splits on {@code sep} at depth 0 outside literals. Pieces are trimmed. */
    public static List<String> splitTopLevel(String s, char sep) {
        String masked = maskLiterals(s);
        int[] depth = depths(masked);
        List<String> out = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < masked.length(); i++) {
            if (masked.charAt(i) == sep && depth[i] == 0) {
                out.add(s.substring(start, i).trim());
                start = i + 1;
            }
        }
        out.add(s.substring(start).trim());
        return out;
    }

    /**
     * Whitespace-separated words, keeping literals and bracket groups intact:
     * {@code greet "Ada Lovelace" [1, 2]} gives three words.
     */
    public static List<String> words(String s) {
        String masked = maskLiterals(s, '\u0001');
        int[] depth = depths(masked);
        List<String> out = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < masked.length(); i++) {
            boolean space = Character.isWhitespace(masked.charAt(i)) && depth[i] == 0;
            if (space) {
                if (start >= 0) {
                    out.add(s.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0) out.add(s.substring(start));
        return out;
    }

    /** Index of the bracket closing the one at {@code open}, or -1. */
    public static int matchingClose(String s, int open) {
        String masked = maskLiterals(s);
        int depth = 0;
        for (int i = open; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }
}
