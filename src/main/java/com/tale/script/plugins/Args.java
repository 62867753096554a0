package com.tale.script.plugins;

import java.util.List;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;

/** Argument checks shared by the capability plugins. */
final class Args {

    private Args() {}

    static void require(String fn, List<Value> args, int n) {
        if (args.size() != n) throw count(fn, n == 1 ? "1 value" : n + " values", args.size());
    }

    static void requireBetween(String fn, List<Value> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw count(fn, "between " + min + " and " + max + " values", args.size());
        }
    }

    static void requireAtLeast(String fn, List<Value> args, int min) {
        if (args.size() < min) throw count(fn, "at least " + min + (min == 1 ? " value" : " values"), args.size());
    }

    private static TaleException count(String fn, String expected, int got) {
        return TaleException.runtime(fn + "() takes " + expected + " but " + got
                + (got == 1 ? " was" : " were") + " given");
    }

    static Value number(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (!v.isNumber()) {
            throw TaleException.runtime(fn + "() needs a number but got " + v.typeName());
        }
        return v;
    }

    static double num(String fn, List<Value> args, int idx) {
        return number(fn, args, idx).asDouble();
    }

    static long whole(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.type != Value.Type.INT) {
            throw TaleException.runtime(fn + "() needs a whole number but got " + v.typeName());
        }
        return v.asInt();
    }

    static String text(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.type != Value.Type.TEXT) {
            throw TaleException.runtime(fn + "() needs text but got " + v.typeName());
        }
        return v.asText();
    }

    static List<Value> list(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.type != Value.Type.LIST) {
            throw TaleException.runtime(fn + "() needs a list but got " + v.typeName());
        }
        return v.asList();
    }

    static Value iterable(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (!v.isIterable()) {
            throw TaleException.runtime(fn + "() needs something to loop over but got " + v.typeName());
        }
        return v;
    }

    static Value callable(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.type != Value.Type.FUNC && v.type != Value.Type.CLASS) {
            throw TaleException.runtime(fn + "() needs a function but got " + v.typeName());
        }
        return v;
    }
}
