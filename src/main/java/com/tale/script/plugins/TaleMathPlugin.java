package com.tale.script.plugins;

import java.util.List;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;
import com.tale.script.sandbox.NativeFunction;

/**
 * TaleMathPlugin
 *
 * The {@code math} module. Only reachable after {@code import math}.
 *
 * Then in TALE:
 *   import math
 *   say math.sqrt(16)
 *   say math.floor(7 / 2)
 */
public final class TaleMathPlugin {

    private TaleMathPlugin() {}

    private interface Op {
        double apply(double x);
    }

    public static void register(CapabilityTable.Builder builder) {
        CapabilityTable.ModuleSpec math = builder.module("math")
                .constant("pi", Value.decimal(Math.PI))
                .constant("e", Value.decimal(Math.E))
                .constant("tau", Value.decimal(2 * Math.PI))
                .constant("inf", Value.decimal(Double.POSITIVE_INFINITY))
                .constant("nan", Value.decimal(Double.NaN));

        math.function("sqrt", unary("sqrt", Math::sqrt));
        math.function("exp", unary("exp", Math::exp));
        math.function("log10", unary("log10", Math::log10));
        math.function("log2", unary("log2", x -> Math.log(x) / Math.log(2)));
        math.function("fabs", unary("fabs", Math::abs));
        math.function("sin", unary("sin", Math::sin));
        math.function("cos", unary("cos", Math::cos));
        math.function("tan", unary("tan", Math::tan));
        math.function("asin", unary("asin", Math::asin));
        math.function("acos", unary("acos", Math::acos));
        math.function("atan", unary("atan", Math::atan));
        math.function("degrees", unary("degrees", Math::toDegrees));
        math.function("radians", unary("radians", Math::toRadians));

        math.function("log", (ctx, args) -> {
            Args.requireBetween("math.log", args, 1, 2);
            double x = Args.num("math.log", args, 0);
            if (x <= 0) throw domain("math.log");
            if (args.size() == 1) return Value.decimal(Math.log(x));
            double base = Args.num("math.log", args, 1);
            if (base <= 0 || base == 1) throw domain("math.log");
            return Value.decimal(Math.log(x) / Math.log(base));
        });

        math.function("pow", (ctx, args) -> {
            Args.require("math.pow", args, 2);
            return checked("math.pow", Math.pow(Args.num("math.pow", args, 0), Args.num("math.pow", args, 1)), args);
        });

        math.function("atan2", (ctx, args) -> {
            Args.require("math.atan2", args, 2);
            return Value.decimal(Math.atan2(Args.num("math.atan2", args, 0), Args.num("math.atan2", args, 1)));
        });

        math.function("hypot", (ctx, args) -> {
            Args.require("math.hypot", args, 2);
            return Value.decimal(Math.hypot(Args.num("math.hypot", args, 0), Args.num("math.hypot", args, 1)));
        });

        math.function("floor", (ctx, args) -> {
            Args.require("math.floor", args, 1);
            return whole("math.floor", Math.floor(Args.num("math.floor", args, 0)), args.get(0));
        });

        math.function("ceil", (ctx, args) -> {
            Args.require("math.ceil", args, 1);
            return whole("math.ceil", Math.ceil(Args.num("math.ceil", args, 0)), args.get(0));
        });

        math.function("trunc", (ctx, args) -> {
            Args.require("math.trunc", args, 1);
            double d = Args.num("math.trunc", args, 0);
            return whole("math.trunc", d < 0 ? Math.ceil(d) : Math.floor(d), args.get(0));
        });

        math.function("factorial", (ctx, args) -> {
            Args.require("math.factorial", args, 1);
            long n = Args.whole("math.factorial", args, 0);
            if (n < 0) throw TaleException.runtime("math.factorial() is not defined for negative numbers");
            long result = 1;
            try {
                for (long i = 2; i <= n; i++) result = Math.multiplyExact(result, i);
            } catch (ArithmeticException e) {
                throw TaleException.runtime("Number is too large");
            }
            return Value.integer(result);
        });

        math.function("gcd", (ctx, args) -> {
            Args.require("math.gcd", args, 2);
            long a = Math.abs(Args.whole("math.gcd", args, 0));
            long b = Math.abs(Args.whole("math.gcd", args, 1));
            while (b != 0) {
                long t = a % b;
                a = b;
                b = t;
            }
            return Value.integer(a);
        });

        math.function("isqrt", (ctx, args) -> {
            Args.require("math.isqrt", args, 1);
            long n = Args.whole("math.isqrt", args, 0);
            if (n < 0) throw domain("math.isqrt");
            long r = (long) Math.sqrt((double) n);
            while (r * r > n) r--;
            while ((r + 1) * (r + 1) <= n) r++;
            return Value.integer(r);
        });
    }

    // ===================== HELPERS =====================

    private static NativeFunction unary(String name, Op op) {
        String fn = "math." + name;
        return (ctx, args) -> {
            Args.require(fn, args, 1);
            return checked(fn, op.apply(Args.num(fn, args, 0)), args);
        };
    }

    /** NaN out of a non-NaN input means the input was outside the function's domain. */
    private static Value checked(String fn, double result, List<Value> args) {
        if (Double.isNaN(result)) {
            for (Value a : args) if (Double.isNaN(a.asDouble())) return Value.decimal(result);
            throw domain(fn);
        }
        return Value.decimal(result);
    }

    private static Value whole(String fn, double d, Value input) {
        if (input.type == Value.Type.INT) return input;
        if (Double.isNaN(d) || Double.isInfinite(d)) throw TaleException.runtime(fn + "() cannot turn " + input + " into a whole number");
        if (Math.abs(d) >= 9.2e18) throw TaleException.runtime("Number is too large");
        return Value.integer((long) d);
    }

    private static TaleException domain(String fn) {
        return TaleException.runtime(fn + "(): math domain error");
    }
}
