package com.tale.script.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tale.script.diagnostics.TaleException;

/**
 * Rewrites TALE expression sugar into canonical expression text. Pure: the same
 * input always gives the same output and nothing outside string literals is left
 * in TALE-only form.
 *
 * Prefix helpers bind to the operand right after them, so {@code len nums + 1}
 * becomes {@code len(nums) + 1}.
 */
public final class ExpressionTransformer {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** One-operand helpers: TALE word to canonical builtin. */
    private static final Map<String, String> UNARY;
    /** Two-operand helpers. */
    private static final Map<String, String> BINARY;

    static {
        Map<String, String> u = new HashMap<>();
        for (String w : Arrays.asList("upper", "lower", "title", "strip", "isalpha", "isdigit", "isalnum",
                "len", "sum", "min", "max", "sorted", "any", "all", "copy", "enumerate", "read",
                "keys", "values", "items")) {
            u.put(w, w);
        }
        UNARY = Collections.unmodifiableMap(u);

        Map<String, String> b = new HashMap<>();
        for (String w : Arrays.asList("split", "join", "find", "count", "startswith", "endswith",
                "map", "filter", "union", "intersection", "difference", "issubset")) {
            b.put(w, w);
        }
        b.put("starts", "startswith");
        b.put("ends", "endswith");
        b.put("subset", "issubset");
        BINARY = Collections.unmodifiableMap(b);
    }

    /** Words that stop the {@code f a b} shorthand from applying. */
    private static final Set<String> NON_OPERANDS = new HashSet<>(Arrays.asList(
            "and", "or", "not", "in", "is", "if", "else", "elif", "for", "while", "fn", "lambda",
            "of", "as", "to", "from", "into", "at", "with", "same", "true", "false", "nothing",
            "none", "null", "return", "import", "global"));

    private static final Pattern CONTINUATION = Pattern.compile(
            "^(\\*\\*|//|==|!=|<=|>=|[-+*/%<>]|and\\b|or\\b|is not same as\\b|is same as\\b|not in\\b|in\\b)\\s*(.*)$",
            Pattern.DOTALL);

    private static final Pattern LAMBDA = Pattern.compile(
            "\\blambda\\s+((?:[A-Za-z_][A-Za-z0-9_]*)(?:\\s*,?\\s*[A-Za-z_][A-Za-z0-9_]*)*)?\\s*->");

    private static final Pattern[] WORD_PATTERNS = {
            Pattern.compile("(?i)\\bis\\s+not\\s+same\\s+as\\b"),
            Pattern.compile("(?i)\\bis\\s+same\\s+as\\b"),
            Pattern.compile("\\bnot\\s+in\\b"),
            Pattern.compile("(?i)\\btrue\\b"),
            Pattern.compile("(?i)\\bfalse\\b"),
            Pattern.compile("(?i)\\b(nothing|none)\\b"),
            Pattern.compile("\\band\\b"),
            Pattern.compile("\\bor\\b"),
            Pattern.compile("\\bnot\\b"),
            Pattern.compile("\\bnumber\\("),
            Pattern.compile("\\btext\\("),
            Pattern.compile("\\bdecimal\\("),
    };
    private static final String[] WORD_REPLACEMENTS = {
            "!=", "==", "!in", "true", "false", "null", "&&", "||", "!", "int(", "str(", "float(",
    };

    /**
     * @param line source line, used for error reporting only
     * @throws TaleException of kind TRANSFORM when the text is outside the grammar
     */
    public String transform(String expr, int line) {
        String e = expr.trim();
        if (e.isEmpty()) throw TaleException.transform(line, "Expected a value here");
        if (TextScanner.looksLikeString(e)) return e;

        String lowered = e.toLowerCase(Locale.ROOT);
        if (lowered.startsWith("type of ")) {
            return unaryCall("type", e.substring(8).trim(), line);
        }

        String first = firstWord(e);
        String rest = e.substring(first.length()).trim();
        boolean operandFollows = !rest.isEmpty() && startsOperand(rest) && e.length() > first.length()
                && Character.isWhitespace(e.charAt(first.length()))
                && (!isKeywordOperand(firstWord(rest)) || takesLambda(first, rest));

        if (operandFollows) {
            if (first.equals("json") || first.equals("csv")) {
                String structured = structuredData(first, rest, line);
                if (structured != null) return structured;
            }
            if (first.equals("call")) return explicitCall(rest, line);
            if (first.equals("get")) return getHelper(rest, line);
            if (first.equals("replace")) return replaceHelper(rest, line);
            if (first.equals("zip")) return "zip(" + joinTransformed(argumentList(rest), line) + ")";
            if (first.equals("lambda")) return lambda(e, line);
            if (UNARY.containsKey(first)) return unaryCall(UNARY.get(first), rest, line);
            if (BINARY.containsKey(first)) return binaryCall(BINARY.get(first), rest, line);

            String shorthand = positionalShorthand(e, line);
            if (shorthand != null) return shorthand;
        }
        return normalize(e, line);
    }

    /** Literal and keyword normalization over code runs only; no prefix helpers. */
    public String normalize(String e, int line) {
        String out = rewriteBraces(e, line);
        out = TextScanner.mapCode(out, code -> {
            String c = code;
            for (int i = 0; i < WORD_PATTERNS.length; i++) {
                c = WORD_PATTERNS[i].matcher(c).replaceAll(Matcher.quoteReplacement(WORD_REPLACEMENTS[i]));
            }
            return c;
        });
        out = rewriteLambdas(out, line);
        return out;
    }

    // ---------------------------------------------------------------- helpers

    private String unaryCall(String fn, String rest, int line) {
        String r = rest;
        if (r.startsWith("of ")) r = r.substring(3).trim();
        List<String> words = TextScanner.words(r);
        if (words.isEmpty()) throw TaleException.transform(line, "'" + fn + "' needs a value");
        if (words.size() == 1 || TextScanner.indexOfTopLevel(r, ',') >= 0 && fn.matches("min|max")) {
            // min a, b keeps its whole argument list
            return fn + "(" + transform(r, line) + ")";
        }
        String operand = words.get(0);
        String remainder = r.substring(r.indexOf(operand) + operand.length()).trim();
        return continueWith(fn + "(" + transform(operand, line) + ")", remainder, line);
    }

    private String binaryCall(String fn, String rest, int line) {
        int comma = TextScanner.indexOfTopLevel(rest, ',');
        if (firstWord(rest).equals("lambda")) {
            // lambda parameters may be comma separated; the sequence follows the last comma
            List<String> parts = TextScanner.splitTopLevel(rest, ',');
            if (parts.size() < 2) throw wrongCount(fn, line);
            String seq = parts.get(parts.size() - 1).trim();
            String fnPart = rest.substring(0, rest.lastIndexOf(seq)).trim();
            fnPart = fnPart.substring(0, fnPart.length() - 1).trim();
            if (seq.isEmpty() || TextScanner.containsInCode(seq, "->")) throw wrongCount(fn, line);
            return fn + "(" + transform(fnPart, line) + ", " + transform(seq, line) + ")";
        }
        if (comma >= 0) {
            String a = rest.substring(0, comma).trim();
            String b = rest.substring(comma + 1).trim();
            if (a.isEmpty() || b.isEmpty()) throw wrongCount(fn, line);
            return fn + "(" + transform(a, line) + ", " + transform(b, line) + ")";
        }
        List<String> words = TextScanner.words(rest);
        if (words.size() < 2) throw wrongCount(fn, line);
        String call = fn + "(" + transform(words.get(0), line) + ", " + transform(words.get(1), line) + ")";
        return continueWith(call, remainderAfter(rest, 2), line);
    }

    private String replaceHelper(String rest, int line) {
        List<String> words = TextScanner.words(rest);
        if (words.size() < 3) throw wrongCount("replace", line);
        String call = "replace(" + transform(words.get(0), line) + ", " + transform(words.get(1), line)
                + ", " + transform(words.get(2), line) + ")";
        return continueWith(call, remainderAfter(rest, 3), line);
    }

    /** {@code get d key} reads a key; a bare identifier key is taken as text. */
    private String getHelper(String rest, int line) {
        int from = TextScanner.indexOfWord(" " + rest, "from");
        if (from >= 0) {
            String padded = " " + rest;
            String key = padded.substring(0, from).trim();
            String target = padded.substring(from + 6).trim();
            return "get(" + transform(target, line) + ", " + key(key, line) + ")";
        }
        List<String> words = TextScanner.words(rest);
        if (words.size() < 2) throw wrongCount("get", line);
        String call = "get(" + transform(words.get(0), line) + ", " + key(words.get(1), line) + ")";
        return continueWith(call, remainderAfter(rest, 2), line);
    }

    String key(String raw, int line) {
        String k = raw.trim();
        if (IDENTIFIER.matcher(k).matches() && !NON_OPERANDS.contains(k.toLowerCase(Locale.ROOT))) {
            return "\"" + k + "\"";
        }
        return transform(k, line);
    }

    private String explicitCall(String body, int line) {
        if (TextScanner.containsInCode(body, "(")) return transform(body, line);
        List<String> words = TextScanner.words(body);
        String fn = words.get(0);
        if (!IDENTIFIER.matcher(fn).matches()) {
            throw TaleException.transform(line, "I could not understand: call " + body);
        }
        return fn + "(" + joinTransformed(words.subList(1, words.size()), line) + ")";
    }

    private String structuredData(String format, String rest, int line) {
        String fn = format.equals("json") ? "json" : "csv";
        if (rest.startsWith("read ")) {
            return "read_" + fn + "(" + transform(rest.substring(5), line) + ")";
        }
        if (rest.startsWith("write ")) {
            String body = rest.substring(6);
            int to = TextScanner.indexOfWord(body, "to");
            if (to < 0) throw TaleException.transform(line, fn + " write needs 'to' and a file name");
            return "write_" + fn + "(" + transform(body.substring(0, to), line) + ", "
                    + transform(body.substring(to + 4), line) + ")";
        }
        return null;
    }

    private String lambda(String e, int line) {
        if (!TextScanner.containsInCode(e, "->")) {
            throw TaleException.transform(line, "A lambda needs '->' between its parameters and its body");
        }
        return normalize(e, line);
    }

    /** {@code greet "Ada" 3} to {@code greet("Ada", 3)} when every word is a plain operand. */
    private String positionalShorthand(String e, int line) {
        String masked = TextScanner.maskLiterals(e);
        List<String> words = TextScanner.words(e);
        if (words.size() < 2) return null;
        String fn = words.get(0);
        if (!IDENTIFIER.matcher(fn).matches()) return null;
        for (String w : words) {
            if (NON_OPERANDS.contains(w.toLowerCase(Locale.ROOT))) return null;
        }
        String topLevel = stripGroups(masked);
        for (char op : "+-*/%<>=:.,!&|".toCharArray()) {
            if (topLevel.indexOf(op) >= 0) return null;
        }
        return fn + "(" + joinTransformed(words.subList(1, words.size()), line) + ")";
    }

    private String continueWith(String head, String remainder, int line) {
        if (remainder.isEmpty()) return head;
        Matcher m = CONTINUATION.matcher(remainder);
        if (m.matches()) {
            String op = normalize(m.group(1), line);
            String right = m.group(2).trim();
            if (right.isEmpty()) throw TaleException.transform(line, "Expected a value after '" + m.group(1) + "'");
            return head + " " + op + " " + transform(right, line);
        }
        return head + " " + normalize(remainder, line);
    }

    private String rewriteBraces(String s, int line) {
        String masked = TextScanner.maskLiterals(s);
        StringBuilder out = new StringBuilder();
        int last = 0;
        for (int i = 0; i < masked.length(); i++) {
            if (masked.charAt(i) != '{') continue;
            int close = TextScanner.matchingClose(s, i);
            if (close < 0) return s; // unbalanced; the parser reports it
            out.append(s, last, i);
            out.append(braceGroup(s.substring(i + 1, close), line));
            last = close + 1;
            i = close;
        }
        out.append(s.substring(last));
        return out.toString();
    }

    private String braceGroup(String inner, int line) {
        String body = rewriteBraces(inner, line);
        if (body.trim().isEmpty()) return "{}";
        List<String> parts = TextScanner.splitTopLevel(body, ',');
        boolean mapping = false;
        for (String p : parts) {
            if (TextScanner.indexOfTopLevel(p, ':') >= 0) mapping = true;
        }
        if (!mapping) {
            return "set([" + body.trim() + "])";
        }
        List<String> entries = new ArrayList<>();
        for (String p : parts) {
            if (p.isEmpty()) continue;
            int colon = TextScanner.indexOfTopLevel(p, ':');
            if (colon < 0) throw TaleException.transform(line, "Every dict entry needs 'key: value': " + p);
            String k = p.substring(0, colon).trim();
            String v = p.substring(colon + 1).trim();
            entries.add(key(k, line) + ": " + v);
        }
        return "{" + String.join(", ", entries) + "}";
    }

    private String rewriteLambdas(String s, int line) {
        String out = TextScanner.mapCode(s, code -> {
            Matcher m = LAMBDA.matcher(code);
            StringBuffer sb = new StringBuffer();
            while (m.find()) {
                String params = m.group(1) == null ? "" : String.join(", ", m.group(1).trim().split("[\\s,]+"));
                m.appendReplacement(sb, Matcher.quoteReplacement("fn(" + params + ") ->"));
            }
            m.appendTail(sb);
            return sb.toString();
        });
        if (Pattern.compile("\\blambda\\b").matcher(TextScanner.maskLiterals(out)).find()) {
            throw TaleException.transform(line, "A lambda needs '->' between its parameters and its body");
        }
        return out;
    }

    // ------------------------------------------------------------ utilities

    private String joinTransformed(List<String> parts, int line) {
        List<String> out = new ArrayList<>();
        for (String p : parts) {
            if (!p.isEmpty()) out.add(transform(p, line));
        }
        return String.join(", ", out);
    }

    private static List<String> argumentList(String rest) {
        if (TextScanner.indexOfTopLevel(rest, ',') >= 0) return TextScanner.splitTopLevel(rest, ',');
        return TextScanner.words(rest);
    }

    private static String remainderAfter(String text, int wordCount) {
        List<String> words = TextScanner.words(text);
        int pos = 0;
        for (int i = 0; i < wordCount && i < words.size(); i++) {
            pos = text.indexOf(words.get(i), pos) + words.get(i).length();
        }
        return text.substring(pos).trim();
    }

    private static String firstWord(String e) {
        int i = 0;
        while (i < e.length() && (Character.isLetterOrDigit(e.charAt(i)) || e.charAt(i) == '_')) i++;
        return e.substring(0, i);
    }

    // "upper of name" reads naturally, so 'of' may follow a helper.
    private static boolean isKeywordOperand(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        return !w.equals("of") && NON_OPERANDS.contains(w);
    }

    private static boolean takesLambda(String fn, String rest) {
        return (fn.equals("map") || fn.equals("filter")) && firstWord(rest).equals("lambda");
    }

    private static boolean startsOperand(String rest) {
        char c = rest.charAt(0);
        return Character.isLetterOrDigit(c) || c == '_' || c == '"' || c == '\'' || c == '(' || c == '[' || c == '{';
    }

    /** Masked text with the contents of every bracket group removed. */
    private static String stripGroups(String masked) {
        StringBuilder sb = new StringBuilder();
        int depth = 0;
        for (char c : masked.toCharArray()) {
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth = Math.max(0, depth - 1);
            else if (depth == 0) sb.append(c);
        }
        return sb.toString();
    }

    private static TaleException wrongCount(String helper, int line) {
        return TaleException.transform(line, "Wrong number of values for '" + helper + "'");
    }
}
