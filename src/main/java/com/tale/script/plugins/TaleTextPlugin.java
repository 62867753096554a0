package com.tale.script.plugins;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;

/**
 * TaleTextPlugin
 *
 * Text helpers. Each one is also reachable as a method on text, so
 * {@code name.upper()} and {@code upper(name)} are the same call.
 */
public final class TaleTextPlugin {

    private TaleTextPlugin() {}

    public static void register(CapabilityTable.Builder builder) {

        builder.function("upper", (ctx, args) -> {
            Args.require("upper", args, 1);
            return Value.text(Args.text("upper", args, 0).toUpperCase(Locale.ROOT));
        });

        builder.function("lower", (ctx, args) -> {
            Args.require("lower", args, 1);
            return Value.text(Args.text("lower", args, 0).toLowerCase(Locale.ROOT));
        });

        builder.function("title", (ctx, args) -> {
            Args.require("title", args, 1);
            String s = Args.text("title", args, 0);
            StringBuilder sb = new StringBuilder(s.length());
            boolean startOfWord = true;
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (Character.isLetter(c)) {
                    sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                    startOfWord = false;
                } else {
                    sb.append(c);
                    startOfWord = true;
                }
            }
            return Value.text(sb.toString());
        });

        builder.function("strip", (ctx, args) -> {
            Args.requireBetween("strip", args, 1, 2);
            String s = Args.text("strip", args, 0);
            if (args.size() == 1 || args.get(1).isNull()) return Value.text(s.strip());
            String chars = Args.text("strip", args, 1);
            int start = 0;
            int end = s.length();
            while (start < end && chars.indexOf(s.charAt(start)) >= 0) start++;
            while (end > start && chars.indexOf(s.charAt(end - 1)) >= 0) end--;
            return Value.text(s.substring(start, end));
        });

        builder.function("isalpha", (ctx, args) -> {
            Args.require("isalpha", args, 1);
            String s = Args.text("isalpha", args, 0);
            return Value.bool(!s.isEmpty() && s.codePoints().allMatch(Character::isLetter));
        });

        builder.function("isdigit", (ctx, args) -> {
            Args.require("isdigit", args, 1);
            String s = Args.text("isdigit", args, 0);
            return Value.bool(!s.isEmpty() && s.codePoints().allMatch(Character::isDigit));
        });

        builder.function("isalnum", (ctx, args) -> {
            Args.require("isalnum", args, 1);
            String s = Args.text("isalnum", args, 0);
            return Value.bool(!s.isEmpty() && s.codePoints().allMatch(Character::isLetterOrDigit));
        });

        builder.function("replace", (ctx, args) -> {
            Args.require("replace", args, 3);
            String s = Args.text("replace", args, 0);
            String from = Args.text("replace", args, 1);
            String to = Args.text("replace", args, 2);
            String out;
            if (from.isEmpty()) {
                // empty pattern: the replacement goes around every character
                StringBuilder sb = new StringBuilder(to);
                for (int i = 0; i < s.length(); i++) sb.append(s.charAt(i)).append(to);
                out = sb.toString();
            } else {
                out = s.replace(from, to);
            }
            ctx.checkText(out.length());
            return Value.text(out);
        });

        builder.function("split", (ctx, args) -> {
            Args.requireBetween("split", args, 1, 2);
            String s = Args.text("split", args, 0);
            List<Value> parts = new ArrayList<>();
            if (args.size() == 1 || args.get(1).isNull()) {
                for (String p : s.strip().split("\\s+")) if (!p.isEmpty()) parts.add(Value.text(p));
            } else {
                String sep = Args.text("split", args, 1);
                if (sep.isEmpty()) throw TaleException.runtime("split() separator cannot be empty");
                int from = 0;
                int at;
                while ((at = s.indexOf(sep, from)) >= 0) {
                    parts.add(Value.text(s.substring(from, at)));
                    from = at + sep.length();
                }
                parts.add(Value.text(s.substring(from)));
            }
            ctx.checkSize(parts.size());
            return Value.list(parts);
        });

        builder.function("join", (ctx, args) -> {
            Args.require("join", args, 2);
            String sep = Args.text("join", args, 0);
            StringBuilder sb = new StringBuilder();
            Iterator<Value> it = Args.iterable("join", args, 1).iterator();
            boolean first = true;
            while (it.hasNext()) {
                Value v = it.next();
                if (v.type != Value.Type.TEXT) {
                    throw TaleException.runtime("join() can only join text, but found " + v.typeName()
                            + "; use str() on it first");
                }
                if (!first) sb.append(sep);
                first = false;
                sb.append(v.asText());
                ctx.checkText(sb.length());
            }
            return Value.text(sb.toString());
        });

        builder.function("find", (ctx, args) -> {
            Args.require("find", args, 2);
            return Value.integer(Args.text("find", args, 0).indexOf(Args.text("find", args, 1)));
        });

        builder.function("startswith", (ctx, args) -> {
            Args.require("startswith", args, 2);
            return Value.bool(Args.text("startswith", args, 0).startsWith(Args.text("startswith", args, 1)));
        });

        builder.function("endswith", (ctx, args) -> {
            Args.require("endswith", args, 2);
            return Value.bool(Args.text("endswith", args, 0).endsWith(Args.text("endswith", args, 1)));
        });

        builder.function("count", (ctx, args) -> {
            Args.require("count", args, 2);
            Value target = args.get(0);
            if (target.type == Value.Type.TEXT) {
                String s = target.asText();
                String sub = Args.text("count", args, 1);
                if (sub.isEmpty()) return Value.integer(s.length() + 1);
                long n = 0;
                int from = 0;
                int at;
                while ((at = s.indexOf(sub, from)) >= 0) {
                    n++;
                    from = at + sub.length();
                }
                return Value.integer(n);
            }
            if (target.type == Value.Type.LIST || target.type == Value.Type.TUPLE) {
                long n = 0;
                for (Value v : target.asList()) if (v.equals(args.get(1))) n++;
                return Value.integer(n);
            }
            throw TaleException.runtime("count() works on text or a list, not " + target.typeName());
        });
    }
}
