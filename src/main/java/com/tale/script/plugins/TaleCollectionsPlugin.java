package com.tale.script.plugins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;
import com.tale.script.sandbox.SandboxContext;

/**
 * TaleCollectionsPlugin
 *
 * List, dict and set helpers behind statements such as {@code add x to items}
 * and {@code remove x from items}, and behind the matching methods
 * ({@code items.append(x)}, {@code d.keys()}).
 */
public final class TaleCollectionsPlugin {

    private TaleCollectionsPlugin() {}

    public static void register(CapabilityTable.Builder builder) {

        builder.function("add_to", (ctx, args) -> {
            Args.require("add_to", args, 2);
            return addTo(ctx, args.get(0), args.get(1));
        });

        builder.function("extend", (ctx, args) -> {
            Args.require("extend", args, 2);
            List<Value> target = Args.list("extend", args, 0);
            List<Value> more = Args.iterable("extend", args, 1).toList();
            ctx.checkSize((long) target.size() + more.size());
            target.addAll(more);
            return Value.nil();
        });

        builder.function("insert", (ctx, args) -> {
            Args.require("insert", args, 3);
            List<Value> target = Args.list("insert", args, 0);
            long at = Args.whole("insert", args, 1);
            int size = target.size();
            if (at < 0) at = Math.max(0, at + size);
            if (at > size) at = size;
            ctx.checkSize(size + 1L);
            target.add((int) at, args.get(2));
            return Value.nil();
        });

        builder.function("remove", (ctx, args) -> {
            Args.require("remove", args, 2);
            Value target = args.get(0);
            Value item = args.get(1);
            switch (target.type) {
                case LIST:
                    if (!target.asList().remove(item)) throw notIn(item, target);
                    return Value.nil();
                case SET:
                    if (!target.asSet().remove(item)) throw notIn(item, target);
                    return Value.nil();
                case MAP:
                    if (!target.asMap().containsKey(item)) throw notIn(item, target);
                    target.asMap().remove(item);
                    return Value.nil();
                default:
                    throw TaleException.runtime("Cannot remove items from a " + target.typeName());
            }
        });

        builder.function("clear", (ctx, args) -> {
            Args.require("clear", args, 1);
            Value target = args.get(0);
            switch (target.type) {
                case LIST: target.asList().clear(); break;
                case MAP: target.asMap().clear(); break;
                case SET: target.asSet().clear(); break;
                default: throw TaleException.runtime("Cannot clear a " + target.typeName());
            }
            return Value.nil();
        });

        builder.function("sort", (ctx, args) -> {
            Args.requireBetween("sort", args, 1, 2);
            TaleCorePlugin.sortInPlace(ctx, "sort", Args.list("sort", args, 0), args.size() == 2 ? args.get(1) : null);
            return Value.nil();
        });

        builder.function("reverse", (ctx, args) -> {
            Args.require("reverse", args, 1);
            Collections.reverse(Args.list("reverse", args, 0));
            return Value.nil();
        });

        builder.function("copy", (ctx, args) -> {
            Args.require("copy", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case LIST: return Value.list(new ArrayList<>(v.asList()));
                case MAP: return Value.map(new LinkedHashMap<>(v.asMap()));
                case SET: return Value.set(new LinkedHashSet<>(v.asSet()));
                default: return v;
            }
        });

        builder.function("pop", (ctx, args) -> {
            Args.requireBetween("pop", args, 1, 3);
            Value target = args.get(0);
            if (target.type == Value.Type.LIST) {
                Args.requireBetween("pop", args, 1, 2);
                List<Value> list = target.asList();
                if (list.isEmpty()) throw TaleException.runtime("Cannot pop from an empty list");
                long i = args.size() == 2 ? Args.whole("pop", args, 1) : list.size() - 1;
                if (i < 0) i += list.size();
                if (i < 0 || i >= list.size()) {
                    throw TaleException.runtime("Position " + args.get(1) + " is out of range for a list of "
                            + list.size() + (list.size() == 1 ? " item" : " items"));
                }
                return list.remove((int) i);
            }
            if (target.type == Value.Type.MAP) {
                Args.requireBetween("pop", args, 2, 3);
                Map<Value, Value> m = target.asMap();
                Value key = args.get(1);
                if (m.containsKey(key)) return m.remove(key);
                if (args.size() == 3) return args.get(2);
                throw TaleException.runtime("Key " + key.repr() + " is not in the dict");
            }
            throw TaleException.runtime("Cannot pop from a " + target.typeName());
        });

        builder.function("index", (ctx, args) -> {
            Args.require("index", args, 2);
            Value target = args.get(0);
            if (target.type == Value.Type.TEXT) {
                int at = target.asText().indexOf(Args.text("index", args, 1));
                if (at < 0) throw notIn(args.get(1), target);
                return Value.integer(at);
            }
            if (target.type == Value.Type.LIST || target.type == Value.Type.TUPLE) {
                int at = target.asList().indexOf(args.get(1));
                if (at < 0) throw notIn(args.get(1), target);
                return Value.integer(at);
            }
            throw TaleException.runtime("index() works on text or a list, not " + target.typeName());
        });

        // ===================== DICTS =====================

        builder.function("keys", (ctx, args) -> {
            Args.require("keys", args, 1);
            return Value.list(new ArrayList<>(dict("keys", args).keySet()));
        });

        builder.function("values", (ctx, args) -> {
            Args.require("values", args, 1);
            return Value.list(new ArrayList<>(dict("values", args).values()));
        });

        builder.function("items", (ctx, args) -> {
            Args.require("items", args, 1);
            List<Value> out = new ArrayList<>();
            for (Map.Entry<Value, Value> e : dict("items", args).entrySet()) {
                List<Value> pair = new ArrayList<>(2);
                pair.add(e.getKey());
                pair.add(e.getValue());
                out.add(Value.tuple(pair));
            }
            return Value.list(out);
        });

        builder.function("get", (ctx, args) -> {
            Args.requireBetween("get", args, 2, 3);
            Value v = dict("get", args).get(args.get(1));
            if (v != null) return v;
            return args.size() == 3 ? args.get(2) : Value.nil();
        });

        builder.function("update", (ctx, args) -> {
            Args.require("update", args, 2);
            Map<Value, Value> target = dict("update", args);
            Value other = args.get(1);
            if (other.type != Value.Type.MAP) {
                throw TaleException.runtime("update() needs a dict but got " + other.typeName());
            }
            target.putAll(other.asMap());
            ctx.checkSize(target.size());
            return Value.nil();
        });

        // ===================== SETS =====================

        builder.function("union", (ctx, args) -> {
            Args.require("union", args, 2);
            Set<Value> out = new LinkedHashSet<>(set("union", args));
            out.addAll(members("union", args, 1));
            ctx.checkSize(out.size());
            return Value.set(out);
        });

        builder.function("intersection", (ctx, args) -> {
            Args.require("intersection", args, 2);
            Set<Value> out = new LinkedHashSet<>(set("intersection", args));
            out.retainAll(members("intersection", args, 1));
            return Value.set(out);
        });

        builder.function("difference", (ctx, args) -> {
            Args.require("difference", args, 2);
            Set<Value> out = new LinkedHashSet<>(set("difference", args));
            out.removeAll(members("difference", args, 1));
            return Value.set(out);
        });

        builder.function("issubset", (ctx, args) -> {
            Args.require("issubset", args, 2);
            return Value.bool(members("issubset", args, 1).containsAll(set("issubset", args)));
        });
    }

    // ===================== HELPERS =====================

    /** Appends to lists and sets; anything else gets the value added with '+'. */
    static Value addTo(SandboxContext ctx, Value target, Value value) {
        switch (target.type) {
            case LIST: {
                List<Value> list = target.asList();
                ctx.checkSize(list.size() + 1L);
                list.add(value);
                return target;
            }
            case SET: {
                Set<Value> set = target.asSet();
                set.add(value.requireHashable());
                ctx.checkSize(set.size());
                return target;
            }
            case INT:
            case DECIMAL:
                if (value.isNumber()) {
                    if (target.type == Value.Type.INT && value.type == Value.Type.INT) {
                        try {
                            return Value.integer(Math.addExact(target.asInt(), value.asInt()));
                        } catch (ArithmeticException e) {
                            throw TaleException.runtime("Number is too large");
                        }
                    }
                    return Value.decimal(target.asDouble() + value.asDouble());
                }
                break;
            case TEXT: {
                String joined = target.asText() + value.toString();
                ctx.checkText(joined.length());
                return Value.text(joined);
            }
            case TUPLE:
                if (value.type == Value.Type.TUPLE) {
                    List<Value> out = new ArrayList<>(target.asList());
                    out.addAll(value.asList());
                    return Value.tuple(out);
                }
                break;
            default:
                break;
        }
        throw TaleException.runtime("Cannot add " + value.typeName() + " to a " + target.typeName());
    }

    private static Map<Value, Value> dict(String fn, List<Value> args) {
        Value v = args.get(0);
        if (v.type != Value.Type.MAP) throw TaleException.runtime(fn + "() needs a dict but got " + v.typeName());
        return v.asMap();
    }

    private static Set<Value> set(String fn, List<Value> args) {
        Value v = args.get(0);
        if (v.type != Value.Type.SET) throw TaleException.runtime(fn + "() needs a set but got " + v.typeName());
        return v.asSet();
    }

    private static Set<Value> members(String fn, List<Value> args, int idx) {
        Set<Value> out = new LinkedHashSet<>();
        Iterator<Value> it = Args.iterable(fn, args, idx).iterator();
        while (it.hasNext()) out.add(it.next().requireHashable());
        return out;
    }

    private static TaleException notIn(Value item, Value container) {
        return TaleException.runtime(item.repr() + " is not in the " + container.typeName());
    }
}
