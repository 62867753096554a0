package com.tale.script.plugins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;

/**
 * TaleRandomPlugin
 *
 * The {@code random} module. Every run draws from its own generator seeded
 * from the settings, so the same program with the same inputs prints the same
 * thing every time.
 */
public final class TaleRandomPlugin {

    private TaleRandomPlugin() {}

    public static void register(CapabilityTable.Builder builder) {
        builder.module("random")
                .function("random", (ctx, args) -> {
                    Args.require("random.random", args, 0);
                    return Value.decimal(ctx.random().nextDouble());
                })
                .function("randint", (ctx, args) -> {
                    Args.require("random.randint", args, 2);
                    long lo = Args.whole("random.randint", args, 0);
                    long hi = Args.whole("random.randint", args, 1);
                    if (hi < lo) throw TaleException.runtime("random.randint() needs the first number to be the smaller one");
                    return Value.integer(lo + between(ctx.random(), hi - lo + 1));
                })
                .function("randrange", (ctx, args) -> {
                    Args.requireBetween("random.randrange", args, 1, 3);
                    long start = args.size() == 1 ? 0 : Args.whole("random.randrange", args, 0);
                    long stop = Args.whole("random.randrange", args, args.size() == 1 ? 0 : 1);
                    long step = args.size() == 3 ? Args.whole("random.randrange", args, 2) : 1;
                    Value.RangeValue r = new Value.RangeValue(start, stop, step);
                    if (step == 0 || r.size() == 0) throw TaleException.runtime("random.randrange() was given an empty range");
                    return Value.integer(r.get(between(ctx.random(), r.size())));
                })
                .function("uniform", (ctx, args) -> {
                    Args.require("random.uniform", args, 2);
                    double a = Args.num("random.uniform", args, 0);
                    double b = Args.num("random.uniform", args, 1);
                    return Value.decimal(a + (b - a) * ctx.random().nextDouble());
                })
                .function("choice", (ctx, args) -> {
                    Args.require("random.choice", args, 1);
                    List<Value> items = Args.iterable("random.choice", args, 0).toList();
                    if (items.isEmpty()) throw TaleException.runtime("random.choice() cannot choose from an empty list");
                    return items.get((int) between(ctx.random(), items.size()));
                })
                .function("shuffle", (ctx, args) -> {
                    Args.require("random.shuffle", args, 1);
                    Collections.shuffle(Args.list("random.shuffle", args, 0), ctx.random());
                    return Value.nil();
                })
                .function("sample", (ctx, args) -> {
                    Args.require("random.sample", args, 2);
                    List<Value> pool = new ArrayList<>(Args.iterable("random.sample", args, 0).toList());
                    long k = Args.whole("random.sample", args, 1);
                    if (k < 0 || k > pool.size()) {
                        throw TaleException.runtime("random.sample() cannot take " + k + " items from " + pool.size());
                    }
                    List<Value> out = new ArrayList<>();
                    for (int i = 0; i < k; i++) out.add(pool.remove((int) between(ctx.random(), pool.size())));
                    return Value.list(out);
                })
                .function("seed", (ctx, args) -> {
                    Args.require("random.seed", args, 1);
                    ctx.random().setSeed(Args.whole("random.seed", args, 0));
                    return Value.nil();
                });
    }

    private static long between(Random random, long bound) {
        return random.nextLong(bound);
    }
}
