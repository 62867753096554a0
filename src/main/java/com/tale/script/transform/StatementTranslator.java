package com.tale.script.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.tale.debug.Debug;
import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.structure.BlockKind;
import com.tale.script.structure.BlockNode;
import com.tale.script.structure.BlockTree;
import com.tale.script.structure.BranchKind;

/**
 * Rewrites every line of a {@link BlockTree} into canonical text: statements,
 * block headers and branch headers. Each failing line yields one TRANSFORM
 * diagnostic and translation carries on with the next line.
 */
public final class StatementTranslator {

    private static final String TAG = "tale.transform";

    private static final Set<String> UNSUPPORTED = new HashSet<>(Arrays.asList(
            "yield", "with", "generator", "async", "await", "del", "exec", "eval"));

    private final ExpressionTransformer expressions;

    public StatementTranslator() {
        this(new ExpressionTransformer());
    }

    public StatementTranslator(ExpressionTransformer expressions) {
        this.expressions = expressions;
    }

    public TransformedProgram translate(BlockTree tree) {
        Map<Integer, TransformedStatement> out = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        walk(tree.roots(), out, diagnostics);
        Debug.get().t(TAG, "translated " + out.size() + " lines, " + diagnostics.size() + " problem(s)");
        return new TransformedProgram(tree, out, diagnostics);
    }

    private void walk(List<BlockNode> nodes, Map<Integer, TransformedStatement> out, List<Diagnostic> diagnostics) {
        for (BlockNode node : nodes) {
            try {
                if (node instanceof BlockNode.Block) {
                    BlockNode.Block b = (BlockNode.Block) node;
                    out.put(b.line(), new TransformedStatement(b.line(), TransformedStatement.Role.BLOCK_HEADER,
                            b.text(), header(b.kind(), b.header(), b.line())));
                } else {
                    out.put(node.line(), new TransformedStatement(node.line(), TransformedStatement.Role.STATEMENT,
                            node.text(), statement(node.text(), node.line())));
                }
            } catch (TaleException e) {
                diagnostics.add(Diagnostic.of(e.atLine(node.line())));
            }
            if (node instanceof BlockNode.Block) {
                BlockNode.Block b = (BlockNode.Block) node;
                walk(b.children(), out, diagnostics);
                for (BlockNode.Branch br : b.branches()) {
                    try {
                        out.put(br.line(), new TransformedStatement(br.line(), TransformedStatement.Role.BRANCH_HEADER,
                                br.text(), branch(br.kind(), br.header(), br.line())));
                    } catch (TaleException e) {
                        diagnostics.add(Diagnostic.of(e.atLine(br.line())));
                    }
                    walk(br.children(), out, diagnostics);
                }
            }
        }
    }

    // ------------------------------------------------------------ headers

    public String header(BlockKind kind, String header, int line) {
        rejectForeign(header, line);
        switch (kind) {
            case IF:
                return "if (" + condition("if", header, line) + ")";
            case WHILE:
                return "while (" + condition("while", header, line) + ")";
            case REPEAT:
                return repeat(header, line);
            case FOR_EACH:
                return forEach(header, line);
            case FUNCTION:
                return function(header, line);
            case CLASS:
                return classHeader(header, line);
            case TRY:
                requireEmpty("try", header, line);
                return "try";
            default:
                throw new IllegalStateException("Unhandled block kind " + kind);
        }
    }

    public String branch(BranchKind kind, String header, int line) {
        rejectForeign(header, line);
        switch (kind) {
            case ELIF:
                return "elif (" + condition("elif", header, line) + ")";
            case ELSE:
                requireEmpty("else", header, line);
                return "else";
            case CATCH: {
                String name = header;
                int as = TextScanner.indexOfWord(" " + header, "as");
                if (as >= 0) name = (" " + header).substring(as + 4).trim();
                if (name.isEmpty()) name = "error";
                requireName(name, line);
                return "catch (" + name + ")";
            }
            case FINALLY:
                requireEmpty("finally", header, line);
                return "finally";
            default:
                throw new IllegalStateException("Unhandled branch kind " + kind);
        }
    }

    private String condition(String keyword, String header, int line) {
        if (header.isEmpty()) throw TaleException.transform(line, "'" + keyword + "' needs a condition");
        return expressions.transform(header, line);
    }

    private String repeat(String header, int line) {
        String body = header;
        if (body.toLowerCase(Locale.ROOT).endsWith(" times")) body = body.substring(0, body.length() - 6).trim();
        if (body.isEmpty()) throw TaleException.transform(line, "'repeat' needs a count, for example: repeat 3");
        int as = TextScanner.indexOfWord(body, "as");
        if (as >= 0) {
            String var = body.substring(as + 4).trim();
            requireName(var, line);
            return "for (" + var + " in range(" + expressions.transform(body.substring(0, as), line) + "))";
        }
        return "for (range(" + expressions.transform(body, line) + "))";
    }

    private String forEach(String header, int line) {
        int in = TextScanner.indexOfWord(header, "in");
        if (in < 0) {
            throw TaleException.transform(line, "'for each' needs 'in', for example: for each n in numbers");
        }
        List<String> vars = TextScanner.splitTopLevel(header.substring(0, in), ',');
        for (String v : vars) requireName(v, line);
        return "for (" + String.join(", ", vars) + " in " + expressions.transform(header.substring(in + 4), line) + ")";
    }

    private String function(String header, int line) {
        String[] parts = header.trim().split("[\\s,()]+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            throw TaleException.transform(line, "'function' needs a name, for example: function greet name");
        }
        requireName(parts[0], line);
        List<String> params = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            if (parts[i].isEmpty()) continue;
            requireName(parts[i], line);
            params.add(parts[i]);
        }
        return "function " + parts[0] + "(" + String.join(", ", params) + ")";
    }

    private String classHeader(String header, int line) {
        String h = header.trim();
        int paren = h.indexOf('(');
        if (paren < 0) {
            requireName(h, line);
            return "class " + h;
        }
        if (!h.endsWith(")")) throw TaleException.transform(line, "I could not understand: class " + header);
        String name = h.substring(0, paren).trim();
        String base = h.substring(paren + 1, h.length() - 1).trim();
        requireName(name, line);
        requireName(base, line);
        return "class " + name + "(" + base + ")";
    }

    // --------------------------------------------------------- statements

    public String statement(String text, int line) {
        String s = text.trim();
        rejectForeign(s, line);
        String lowered = s.toLowerCase(Locale.ROOT);
        String first = lowered.split("\\s+", 2)[0];
        if (UNSUPPORTED.contains(first)) {
            throw TaleException.transform(line, "'" + first + "' is not supported in TALE");
        }

        if (startsWithWords(lowered, "say formatted")) {
            return "print(" + formatted(s.substring(13).trim(), line) + ")";
        }
        if (startsWithWords(lowered, "say")) return say(s.substring(3).trim(), line);
        if (startsWithWords(lowered, "ask")) return ask(s.substring(3).trim(), line);

        if (startsWithWords(lowered, "return")) return tail("return", s, line);
        if (startsWithWords(lowered, "raise")) return tail("raise", s, line);
        if (startsWithWords(lowered, "import") || startsWithWords(lowered, "from")
                || startsWithWords(lowered, "global")) {
            return s;
        }
        if (lowered.equals("break") || lowered.equals("continue") || lowered.equals("pass")) return lowered;

        String fileOp = fileStatement(s, lowered, line);
        if (fileOp != null) return fileOp;
        String collectionOp = collectionStatement(s, lowered, line);
        if (collectionOp != null) return collectionOp;

        if (startsWithWords(lowered, "list") || startsWithWords(lowered, "dict")) {
            String declared = declaration(s, lowered.startsWith("list") ? "[]" : "{}", line);
            if (declared != null) return declared;
        }

        String assignment = assignment(s, line);
        if (assignment != null) return assignment;

        if (hasBareEquals(s)) {
            throw TaleException.transform(line, "Use 'is' to store a value, for example: x is 5");
        }
        return expressions.transform(s, line);
    }

    private String say(String payload, int line) {
        if (payload.isEmpty()) return "print()";
        if (payload.startsWith("\"\"\"")) return "print(" + payload + ")";
        List<String> args = TextScanner.splitTopLevel(payload, ',');
        if (args.size() == 1) {
            List<String> pieces = TextScanner.splitTopLevel(payload, '+');
            boolean text = false;
            for (String p : pieces) text |= TextScanner.looksLikeString(p);
            if (pieces.size() > 1 && text) {
                List<String> joined = new ArrayList<>();
                for (String p : pieces) joined.add(expressions.transform(p, line));
                return "print(" + String.join(" + ", joined) + ")";
            }
        }
        List<String> out = new ArrayList<>();
        for (String a : args) out.add(expressions.transform(a, line));
        return "print(" + String.join(", ", out) + ")";
    }

    /** {@code "Hi {name}!"} to {@code "Hi " + str(name) + "!"}. */
    String formatted(String literal, int line) {
        String lit = literal;
        if (lit.startsWith("f\"") || lit.startsWith("f'")) lit = lit.substring(1);
        if (!TextScanner.looksLikeString(lit) || lit.startsWith("\"\"\"")) {
            throw TaleException.transform(line, "'say formatted' needs text in quotes, for example: say formatted \"Hi {name}\"");
        }
        char q = lit.charAt(0);
        String body = lit.substring(1, lit.length() - 1);
        List<String> pieces = new ArrayList<>();
        StringBuilder chunk = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '{' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                chunk.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < body.length() && body.charAt(i + 1) == '}') {
                chunk.append('}');
                i += 2;
            } else if (c == '{') {
                int close = body.indexOf('}', i);
                if (close < 0) throw TaleException.transform(line, "A '{' in formatted text is never closed");
                String inner = body.substring(i + 1, close).trim();
                if (inner.isEmpty()) throw TaleException.transform(line, "Empty {} in formatted text");
                if (chunk.length() > 0) pieces.add(q + chunk.toString() + q);
                chunk.setLength(0);
                pieces.add("str(" + expressions.transform(inner, line) + ")");
                i = close + 1;
            } else {
                chunk.append(c);
                i++;
            }
        }
        if (chunk.length() > 0 || pieces.isEmpty()) pieces.add(q + chunk.toString() + q);
        return String.join(" + ", pieces);
    }

    private String ask(String body, int line) {
        if (body.isEmpty()) throw TaleException.transform(line, "I could not understand: ask");
        int as = TextScanner.indexOfWord(body, "as");
        if (as >= 0) {
            String var = body.substring(as + 4).trim();
            requireName(var, line);
            return var + " = ask(" + expressions.transform(body.substring(0, as), line) + "); result = " + var;
        }
        if (ExpressionTransformer.IDENTIFIER.matcher(body).matches()) {
            requireName(body, line);
            return body + " = ask(); result = " + body;
        }
        return "result = ask(" + expressions.transform(body, line) + ")";
    }

    private String tail(String keyword, String s, int line) {
        String rest = s.substring(keyword.length()).trim();
        return rest.isEmpty() ? keyword : keyword + " " + expressions.transform(rest, line);
    }

    private String fileStatement(String s, String lowered, int line) {
        if (startsWithWords(lowered, "open")) {
            String body = s.substring(4).trim();
            int as = lastIndexOfWord(body, "as");
            if (as < 0) throw TaleException.transform(line, "'open' needs a name, for example: open \"notes.txt\" as f");
            String alias = body.substring(as + 4).trim();
            requireName(alias, line);
            String target = body.substring(0, as).trim();
            String mode = "r";
            int forIdx = TextScanner.indexOfWord(target, "for");
            if (forIdx >= 0) {
                String purpose = target.substring(forIdx + 5).trim().toLowerCase(Locale.ROOT);
                target = target.substring(0, forIdx).trim();
                if (purpose.equals("writing")) mode = "w";
                else if (purpose.equals("appending")) mode = "a";
                else if (!purpose.equals("reading")) {
                    throw TaleException.transform(line, "Open a file for reading, writing or appending");
                }
            }
            return alias + " = open(" + expressions.transform(target, line) + ", \"" + mode + "\")";
        }
        if (startsWithWords(lowered, "write") || startsWithWords(lowered, "append")) {
            String keyword = lowered.startsWith("write") ? "write" : "append";
            String body = s.substring(keyword.length()).trim();
            List<String> words = TextScanner.words(body);
            if (words.size() < 2) throw TaleException.transform(line, "Wrong number of values: " + s);
            String handle = words.get(0);
            String content = body.substring(handle.length()).trim();
            return "write(" + expressions.transform(handle, line) + ", " + expressions.transform(content, line) + ")";
        }
        if (startsWithWords(lowered, "close")) {
            return "close(" + expressions.transform(s.substring(5), line) + ")";
        }
        return null;
    }

    private String collectionStatement(String s, String lowered, int line) {
        if (startsWithWords(lowered, "add")) {
            int to = lastIndexOfWord(s, "to");
            if (to >= 0) {
                String target = s.substring(to + 4).trim();
                requireTarget(target, line);
                String target0 = expressions.normalize(target, line);
                return target0 + " = add_to(" + target0 + ", " + expressions.transform(s.substring(3, to), line) + ")";
            }
            return null;
        }
        if (startsWithWords(lowered, "extend")) {
            int with = TextScanner.indexOfWord(s, "with");
            if (with < 0) throw TaleException.transform(line, "'extend' needs 'with', for example: extend a with b");
            return "extend(" + expressions.transform(s.substring(6, with), line) + ", "
                    + expressions.transform(s.substring(with + 6), line) + ")";
        }
        if (startsWithWords(lowered, "insert")) {
            int into = TextScanner.indexOfWord(s, "into");
            int at = into < 0 ? -1 : TextScanner.indexOfWord(s, "at", into);
            if (into < 0 || at < 0) {
                throw TaleException.transform(line, "'insert' needs 'into' and 'at', for example: insert 5 into nums at 0");
            }
            return "insert(" + expressions.transform(s.substring(into + 6, at), line) + ", "
                    + expressions.transform(s.substring(at + 4), line) + ", "
                    + expressions.transform(s.substring(6, into), line) + ")";
        }
        if (startsWithWords(lowered, "remove")) {
            int from = lastIndexOfWord(s, "from");
            if (from < 0) return null;
            return "remove(" + expressions.transform(s.substring(from + 6), line) + ", "
                    + expressions.transform(s.substring(6, from), line) + ")";
        }
        for (String op : new String[] {"clear", "sort", "reverse", "copy", "keys", "values", "items"}) {
            if (startsWithWords(lowered, op) && lowered.length() > op.length()) {
                return op + "(" + expressions.transform(s.substring(op.length()), line) + ")";
            }
        }
        if (startsWithWords(lowered, "set")) {
            int to = TextScanner.indexOfWord(s, "to");
            if (to < 0) return null;
            List<String> words = TextScanner.words(s.substring(3, to).trim());
            if (words.size() != 2) throw TaleException.transform(line, "'set' needs a dict and a key, for example: set user name to \"Ada\"");
            return expressions.transform(words.get(0), line) + "[" + expressions.key(words.get(1), line) + "] = "
                    + expressions.transform(s.substring(to + 4), line);
        }
        if (startsWithWords(lowered, "pop") && lowered.length() > 3) {
            List<String> words = TextScanner.words(s.substring(3).trim());
            if (words.size() == 1) return "pop(" + expressions.transform(words.get(0), line) + ")";
            if (words.size() == 2) {
                return "pop(" + expressions.transform(words.get(0), line) + ", " + expressions.key(words.get(1), line) + ")";
            }
            throw TaleException.transform(line, "Wrong number of values: " + s);
        }
        if (startsWithWords(lowered, "unpack")) {
            int into = TextScanner.indexOfWord(s, "into");
            if (into < 0) throw TaleException.transform(line, "'unpack' needs 'into', for example: unpack pair into a, b");
            List<String> targets = TextScanner.splitTopLevel(s.substring(into + 6), ',');
            for (String t : targets) requireName(t, line);
            return String.join(", ", targets) + " = " + expressions.transform(s.substring(6, into), line);
        }
        return null;
    }

    private String declaration(String s, String empty, int line) {
        String body = s.substring(4).trim();
        int is = TextScanner.indexOfWord(body, "is");
        String name = is < 0 ? body : body.substring(0, is).trim();
        if (!ExpressionTransformer.IDENTIFIER.matcher(name).matches()) return null;
        requireName(name, line);
        return name + " = " + (is < 0 ? empty : expressions.transform(body.substring(is + 4), line));
    }

    private String assignment(String s, int line) {
        int is = TextScanner.indexOfWord(s, "is");
        if (is < 0) return null;
        String value = s.substring(is + 4).trim();
        String loweredValue = value.toLowerCase(Locale.ROOT);
        if (loweredValue.startsWith("same as") || loweredValue.startsWith("not same as")) return null;
        String target = s.substring(0, is).trim();
        List<String> targets = TextScanner.splitTopLevel(target, ',');
        if (targets.size() > 1) {
            for (String t : targets) requireName(t, line);
            return String.join(", ", targets) + " = " + expressions.transform(value, line);
        }
        requireTarget(target, line);
        return expressions.normalize(target, line) + " = " + expressions.transform(value, line);
    }

    // ----------------------------------------------------------- checks

    /** Characters and sequences that have no meaning in TALE outside text. */
    private static void rejectForeign(String s, int line) {
        String code = TextScanner.maskLiterals(s);
        if (code.indexOf(';') >= 0) {
            throw TaleException.transform(line, "Put each statement on its own line instead of using ';'");
        }
        for (char c : new char[] {'`', '$', '@'}) {
            if (code.indexOf(c) >= 0) throw TaleException.transform(line, "The character '" + c + "' is not part of TALE");
        }
        if (code.indexOf('\\') >= 0) {
            throw TaleException.transform(line, "Backslashes are only allowed inside text");
        }
        if (code.contains("__")) {
            throw TaleException.transform(line, "Names with double underscores are not allowed");
        }
    }

    private static void requireName(String name, int line) {
        if (!ExpressionTransformer.IDENTIFIER.matcher(name.trim()).matches()) {
            throw TaleException.transform(line, "'" + name.trim() + "' is not a valid name");
        }
    }

    /** A name, optionally followed by {@code .field} or {@code [key]} parts. */
    private static void requireTarget(String target, int line) {
        String t = target.trim();
        boolean ok = !t.isEmpty() && TextScanner.words(t).size() == 1
                && (Character.isLetter(t.charAt(0)) || t.charAt(0) == '_')
                && TextScanner.indexOfTopLevel(t, '(') < 0;
        if (!ok) throw TaleException.transform(line, "I could not understand: " + t + " is ...");
    }

    private static boolean hasBareEquals(String s) {
        String code = TextScanner.maskLiterals(s);
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) != '=') continue;
            char before = i > 0 ? code.charAt(i - 1) : ' ';
            char after = i + 1 < code.length() ? code.charAt(i + 1) : ' ';
            if (after == '=') {
                i++;
                continue;
            }
            if (before != '!' && before != '<' && before != '>' && before != '=') return true;
        }
        return false;
    }

    private static boolean startsWithWords(String lowered, String words) {
        return lowered.equals(words) || lowered.startsWith(words + " ");
    }

    private static int lastIndexOfWord(String s, String word) {
        int found = -1;
        int i = TextScanner.indexOfWord(s, word);
        while (i >= 0) {
            found = i;
            i = TextScanner.indexOfWord(s, word, i + 1);
        }
        return found;
    }

    private static void requireEmpty(String keyword, String header, int line) {
        if (!header.trim().isEmpty()) {
            throw TaleException.transform(line, "'" + keyword + "' takes nothing after it");
        }
    }
}
