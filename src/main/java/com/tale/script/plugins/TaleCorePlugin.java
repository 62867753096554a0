package com.tale.script.plugins;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;
import com.tale.script.sandbox.SandboxContext;

/**
 * TaleCorePlugin
 *
 * The builtins every TALE program sees: output and input, conversions,
 * {@code range}, aggregates and the functional helpers.
 *
 * Usage:
 *   TaleCorePlugin.register(builder);
 *
 * Then in TALE:
 *   say "total: " + str(sum(nums))
 *   ask "How old are you?" as age
 */
public final class TaleCorePlugin {

    private static final Pattern WHOLE = Pattern.compile("[+-]?\\d+");

    private TaleCorePlugin() {}

    public static void register(CapabilityTable.Builder builder) {

        builder.function("print", (ctx, args) -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(args.get(i).toString());
            }
            ctx.print(sb.append('\n').toString());
            return Value.nil();
        });

        builder.function("ask", (ctx, args) -> {
            Args.requireBetween("ask", args, 0, 1);
            String prompt = args.isEmpty() || args.get(0).isNull() ? null : args.get(0).toString();
            if (prompt != null && !prompt.isEmpty()) ctx.print(prompt);
            return ctx.input().next(prompt);
        });

        builder.function("range", (ctx, args) -> {
            Args.requireBetween("range", args, 1, 3);
            long start = 0;
            long stop;
            long step = 1;
            if (args.size() == 1) {
                stop = Args.whole("range", args, 0);
            } else {
                start = Args.whole("range", args, 0);
                stop = Args.whole("range", args, 1);
                if (args.size() == 3) step = Args.whole("range", args, 2);
            }
            if (step == 0) throw TaleException.runtime("range() step cannot be zero");
            return Value.range(new Value.RangeValue(start, stop, step));
        });

        builder.function("len", (ctx, args) -> {
            Args.require("len", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case TEXT: return Value.integer(v.asText().codePointCount(0, v.asText().length()));
                case LIST:
                case TUPLE: return Value.integer(v.asList().size());
                case MAP: return Value.integer(v.asMap().size());
                case SET: return Value.integer(v.asSet().size());
                case RANGE: return Value.integer(v.asRange().size());
                default: throw TaleException.runtime("A " + v.typeName() + " has no length");
            }
        });

        // ===================== CONVERSIONS =====================

        builder.function("int", (ctx, args) -> {
            Args.requireBetween("int", args, 0, 1);
            if (args.isEmpty()) return Value.integer(0);
            return toInt(args.get(0));
        });

        builder.function("float", (ctx, args) -> {
            Args.requireBetween("float", args, 0, 1);
            if (args.isEmpty()) return Value.decimal(0);
            return toDecimal(args.get(0));
        });

        builder.function("str", (ctx, args) -> {
            Args.requireBetween("str", args, 0, 1);
            return Value.text(args.isEmpty() ? "" : args.get(0).toString());
        });

        builder.function("bool", (ctx, args) -> {
            Args.requireBetween("bool", args, 0, 1);
            return Value.bool(!args.isEmpty() && args.get(0).isTruthy());
        });

        builder.function("list", (ctx, args) -> {
            Args.requireBetween("list", args, 0, 1);
            if (args.isEmpty()) return Value.newList();
            List<Value> items = Args.iterable("list", args, 0).toList();
            ctx.checkSize(items.size());
            return Value.list(items);
        });

        builder.function("tuple", (ctx, args) -> {
            Args.requireBetween("tuple", args, 0, 1);
            if (args.isEmpty()) return Value.tuple(new ArrayList<>());
            return Value.tuple(Args.iterable("tuple", args, 0).toList());
        });

        builder.function("dict", (ctx, args) -> {
            Args.requireBetween("dict", args, 0, 1);
            if (args.isEmpty()) return Value.newMap();
            Value src = args.get(0);
            if (src.type == Value.Type.MAP) return Value.map(new LinkedHashMap<>(src.asMap()));
            Map<Value, Value> out = new LinkedHashMap<>();
            Iterator<Value> it = Args.iterable("dict", args, 0).iterator();
            while (it.hasNext()) {
                Value pair = it.next();
                if ((pair.type != Value.Type.LIST && pair.type != Value.Type.TUPLE) || pair.asList().size() != 2) {
                    throw TaleException.runtime("dict() needs pairs of (key, value) but got " + pair.repr());
                }
                out.put(pair.asList().get(0).requireHashable(), pair.asList().get(1));
            }
            ctx.checkSize(out.size());
            return Value.map(out);
        });

        builder.function("set", (ctx, args) -> {
            Args.requireBetween("set", args, 0, 1);
            Set<Value> out = new LinkedHashSet<>();
            if (!args.isEmpty()) {
                Iterator<Value> it = Args.iterable("set", args, 0).iterator();
                while (it.hasNext()) out.add(it.next().requireHashable());
            }
            ctx.checkSize(out.size());
            return Value.set(out);
        });

        builder.function("type", (ctx, args) -> {
            Args.require("type", args, 1);
            return Value.text(args.get(0).typeName());
        });

        builder.function("Exception", (ctx, args) -> {
            Args.requireBetween("Exception", args, 0, 1);
            return Value.error(args.isEmpty() ? "" : args.get(0).toString());
        });

        // ===================== NUMBERS =====================

        builder.function("abs", (ctx, args) -> {
            Args.require("abs", args, 1);
            Value v = Args.number("abs", args, 0);
            if (v.type == Value.Type.INT) {
                if (v.asInt() == Long.MIN_VALUE) throw TaleException.runtime("Number is too large");
                return Value.integer(Math.abs(v.asInt()));
            }
            return Value.decimal(Math.abs(v.asDouble()));
        });

        builder.function("round", (ctx, args) -> {
            Args.requireBetween("round", args, 1, 2);
            Value v = Args.number("round", args, 0);
            if (args.size() == 1 || args.get(1).isNull()) {
                if (v.type == Value.Type.INT) return v;
                double d = v.asDouble();
                if (Double.isNaN(d) || Double.isInfinite(d)) throw TaleException.runtime("Cannot round " + v);
                return Value.integer(new BigDecimal(d).setScale(0, RoundingMode.HALF_EVEN).longValueExact());
            }
            long digits = Args.whole("round", args, 1);
            if (v.type == Value.Type.INT && digits >= 0) return v;
            BigDecimal rounded = BigDecimal.valueOf(v.asDouble()).setScale((int) digits, RoundingMode.HALF_EVEN);
            return v.type == Value.Type.INT ? Value.integer(rounded.longValue()) : Value.decimal(rounded.doubleValue());
        });

        builder.function("min", (ctx, args) -> extreme("min", args, -1));
        builder.function("max", (ctx, args) -> extreme("max", args, 1));

        builder.function("sum", (ctx, args) -> {
            Args.requireBetween("sum", args, 1, 2);
            Value total = args.size() == 2 ? Args.number("sum", args, 1) : Value.integer(0);
            Iterator<Value> it = Args.iterable("sum", args, 0).iterator();
            while (it.hasNext()) {
                Value v = it.next();
                if (!v.isNumber()) throw TaleException.runtime("sum() can only add numbers, not " + v.typeName());
                if (total.type == Value.Type.INT && v.type == Value.Type.INT) {
                    try {
                        total = Value.integer(Math.addExact(total.asInt(), v.asInt()));
                    } catch (ArithmeticException e) {
                        throw TaleException.runtime("Number is too large");
                    }
                } else {
                    total = Value.decimal(total.asDouble() + v.asDouble());
                }
            }
            return total;
        });

        // ===================== ITERATION =====================

        builder.function("sorted", (ctx, args) -> {
            Args.requireBetween("sorted", args, 1, 2);
            List<Value> items = Args.iterable("sorted", args, 0).toList();
            sortInPlace(ctx, "sorted", items, args.size() == 2 ? args.get(1) : null);
            return Value.list(items);
        });

        builder.function("any", (ctx, args) -> {
            Args.require("any", args, 1);
            Iterator<Value> it = Args.iterable("any", args, 0).iterator();
            while (it.hasNext()) if (it.next().isTruthy()) return Value.TRUE;
            return Value.FALSE;
        });

        builder.function("all", (ctx, args) -> {
            Args.require("all", args, 1);
            Iterator<Value> it = Args.iterable("all", args, 0).iterator();
            while (it.hasNext()) if (!it.next().isTruthy()) return Value.FALSE;
            return Value.TRUE;
        });

        builder.function("enumerate", (ctx, args) -> {
            Args.requireBetween("enumerate", args, 1, 2);
            long i = args.size() == 2 ? Args.whole("enumerate", args, 1) : 0;
            List<Value> out = new ArrayList<>();
            Iterator<Value> it = Args.iterable("enumerate", args, 0).iterator();
            while (it.hasNext()) {
                List<Value> pair = new ArrayList<>(2);
                pair.add(Value.integer(i++));
                pair.add(it.next());
                out.add(Value.tuple(pair));
                ctx.checkSize(out.size());
            }
            return Value.list(out);
        });

        builder.function("zip", (ctx, args) -> {
            List<Iterator<Value>> its = new ArrayList<>();
            for (int i = 0; i < args.size(); i++) its.add(Args.iterable("zip", args, i).iterator());
            List<Value> out = new ArrayList<>();
            if (its.isEmpty()) return Value.list(out);
            while (true) {
                List<Value> row = new ArrayList<>(its.size());
                for (Iterator<Value> it : its) {
                    if (!it.hasNext()) return Value.list(out);
                    row.add(it.next());
                }
                out.add(Value.tuple(row));
                ctx.checkSize(out.size());
            }
        });

        builder.function("map", (ctx, args) -> {
            Args.require("map", args, 2);
            Value fn = Args.callable("map", args, 0);
            List<Value> out = new ArrayList<>();
            Iterator<Value> it = Args.iterable("map", args, 1).iterator();
            while (it.hasNext()) {
                out.add(ctx.call(fn, single(it.next())));
                ctx.checkSize(out.size());
            }
            return Value.list(out);
        });

        builder.function("filter", (ctx, args) -> {
            Args.require("filter", args, 2);
            Value fn = args.get(0).isNull() ? null : Args.callable("filter", args, 0);
            List<Value> out = new ArrayList<>();
            Iterator<Value> it = Args.iterable("filter", args, 1).iterator();
            while (it.hasNext()) {
                Value v = it.next();
                boolean keep = fn == null ? v.isTruthy() : ctx.call(fn, single(v)).isTruthy();
                if (keep) out.add(v);
            }
            return Value.list(out);
        });
    }

    // ===================== HELPERS =====================

    static Value toInt(Value v) {
        switch (v.type) {
            case INT: return v;
            case BOOL: return Value.integer(v.asBool() ? 1 : 0);
            case DECIMAL: {
                double d = v.asDouble();
                if (Double.isNaN(d) || Double.isInfinite(d)) throw TaleException.runtime("Cannot turn " + v + " into a whole number");
                if (Math.abs(d) >= 9.2e18) throw TaleException.runtime("Number is too large");
                return Value.integer((long) d);
            }
            case TEXT: {
                String s = v.asText().trim().replace("_", "");
                if (!WHOLE.matcher(s).matches()) {
                    throw TaleException.runtime("Cannot turn " + v.repr() + " into a whole number");
                }
                try {
                    return Value.integer(Long.parseLong(s));
                } catch (NumberFormatException e) {
                    throw TaleException.runtime("Number is too large");
                }
            }
            default:
                throw TaleException.runtime("Cannot turn a " + v.typeName() + " into a whole number");
        }
    }

    static Value toDecimal(Value v) {
        switch (v.type) {
            case INT: case DECIMAL: case BOOL: return Value.decimal(v.asDouble());
            case TEXT: {
                String s = v.asText().trim();
                try {
                    if (s.equalsIgnoreCase("inf") || s.equalsIgnoreCase("infinity")) return Value.decimal(Double.POSITIVE_INFINITY);
                    if (s.equalsIgnoreCase("-inf") || s.equalsIgnoreCase("-infinity")) return Value.decimal(Double.NEGATIVE_INFINITY);
                    if (s.isEmpty() || !s.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
                        throw new NumberFormatException(s);
                    }
                    return Value.decimal(Double.parseDouble(s));
                } catch (NumberFormatException e) {
                    throw TaleException.runtime("Cannot turn " + v.repr() + " into a decimal");
                }
            }
            default:
                throw TaleException.runtime("Cannot turn a " + v.typeName() + " into a decimal");
        }
    }

    private static Value extreme(String fn, List<Value> args, int sign) {
        Args.requireAtLeast(fn, args, 1);
        List<Value> items = args.size() == 1 ? Args.iterable(fn, args, 0).toList() : args;
        if (items.isEmpty()) throw TaleException.runtime(fn + "() was given nothing to compare");
        Value best = items.get(0);
        for (int i = 1; i < items.size(); i++) {
            if (Value.compare(items.get(i), best) * sign > 0) best = items.get(i);
        }
        return best;
    }

    /**
     * Stable sort. The optional second value is either a key function or a
     * boolean asking for descending order.
     */
    static void sortInPlace(SandboxContext ctx, String fn, List<Value> items, Value option) {
        if (option == null || option.isNull()) {
            items.sort(Value::compare);
            return;
        }
        if (option.type == Value.Type.BOOL) {
            items.sort(Value::compare);
            if (option.asBool()) Collections.reverse(items);
            return;
        }
        if (option.type != Value.Type.FUNC) {
            throw TaleException.runtime(fn + "() takes a key function or true for descending order, not " + option.typeName());
        }
        List<Value[]> keyed = new ArrayList<>(items.size());
        for (Value v : items) keyed.add(new Value[] {ctx.call(option, single(v)), v});
        keyed.sort((a, b) -> Value.compare(a[0], b[0]));
        items.clear();
        for (Value[] kv : keyed) items.add(kv[1]);
    }

    static List<Value> single(Value v) {
        List<Value> one = new ArrayList<>(1);
        one.add(v);
        return one;
    }
}
