package com.tale.script.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.tale.script.diagnostics.TaleException;

public class Value {
    public enum Type {
        INT("number"), DECIMAL("decimal"), BOOL("bool"), TEXT("text"), NULL("nothing"),
        LIST("list"), TUPLE("tuple"), MAP("dict"), SET("set"), RANGE("range"),
        FUNC("function"), CLASS("class"), INSTANCE("object"), MODULE("module"), FILE("file"), ERROR("error");

        private final String displayName;

        Type(String displayName) { this.displayName = displayName; }

        /** What {@code type of x} reports. */
        public String displayName() { return displayName; }
    }

    public static final Value NULL = new Value(Type.NULL, null);
    public static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.INT, l); }
    public static Value decimal(double d) { return new Value(Type.DECIMAL, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value text(String s) { return new Value(Type.TEXT, s); }
    public static Value list(List<Value> a) { return new Value(Type.LIST, a); }
    public static Value tuple(List<Value> a) { return new Value(Type.TUPLE, Collections.unmodifiableList(a)); }
    public static Value map(Map<Value, Value> m) { return new Value(Type.MAP, m); }
    public static Value set(Set<Value> s) { return new Value(Type.SET, s); }
    public static Value range(RangeValue r) { return new Value(Type.RANGE, r); }
    public static Value func(Callable c) { return new Value(Type.FUNC, c); }
    public static Value clazz(TaleClass c) { return new Value(Type.CLASS, c); }
    public static Value instance(TaleInstance i) { return new Value(Type.INSTANCE, i); }
    public static Value module(ModuleValue m) { return new Value(Type.MODULE, m); }
    public static Value error(String message) { return new Value(Type.ERROR, message); }
    public static Value file(Object handle) { return new Value(Type.FILE, handle); }
    public static Value nil() { return NULL; }

    public static Value newList() { return list(new ArrayList<>()); }
    public static Value newMap() { return map(new LinkedHashMap<>()); }
    public static Value newSet() { return set(new LinkedHashSet<>()); }

    /** A lazily counted {@code range(start, stop, step)}. */
    public static final class RangeValue {
        public final long start;
        public final long stop;
        public final long step;

        public RangeValue(long start, long stop, long step) {
            if (step == 0) throw TaleException.runtime("range() step must not be zero");
            this.start = start;
            this.stop = stop;
            this.step = step;
        }

        public long size() {
            if (step > 0) return start >= stop ? 0 : (stop - start - 1) / step + 1;
            return start <= stop ? 0 : (start - stop - 1) / (-step) + 1;
        }

        public long get(long i) { return start + i * step; }

        public boolean contains(long v) {
            if (step > 0 ? (v < start || v >= stop) : (v > start || v <= stop)) return false;
            return (v - start) % step == 0;
        }
    }

    /** A user class: attributes bound by the class body, methods among them. */
    public static final class TaleClass {
        public final String name;
        public final TaleClass base;
        public final Map<String, Value> attributes;

        public TaleClass(String name, TaleClass base, Map<String, Value> attributes) {
            this.name = name;
            this.base = base;
            this.attributes = attributes;
        }

        /** Looks through the base chain; null when missing. */
        public Value find(String attr) {
            for (TaleClass c = this; c != null; c = c.base) {
                Value v = c.attributes.get(attr);
                if (v != null) return v;
            }
            return null;
        }

        public boolean isSubclassOf(TaleClass other) {
            for (TaleClass c = this; c != null; c = c.base) {
                if (c == other) return true;
            }
            return false;
        }
    }

    public static final class TaleInstance {
        public final TaleClass clazz;
        public final Map<String, Value> fields = new LinkedHashMap<>();

        public TaleInstance(TaleClass clazz) {
            this.clazz = clazz;
        }
    }

    /** An allow-listed module such as {@code math}; members are read-only. */
    public static final class ModuleValue {
        public final String name;
        public final Map<String, Value> members;

        public ModuleValue(String name, Map<String, Value> members) {
            this.name = name;
            this.members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }
    }

    public Type getType() { return type; }

    public boolean isNumber() { return type == Type.INT || type == Type.DECIMAL; }
    public boolean isNull() { return type == Type.NULL; }

    public long asInt() {
        if (type == Type.INT) return (Long) value;
        if (type == Type.BOOL) return ((Boolean) value) ? 1 : 0;
        if (type == Type.DECIMAL) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d)) return (long) d;
        }
        throw expected("a whole number");
    }

    public double asDouble() {
        if (type == Type.INT) return (Long) value;
        if (type == Type.DECIMAL) return (Double) value;
        if (type == Type.BOOL) return ((Boolean) value) ? 1 : 0;
        throw expected("a number");
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw expected("true or false");
        return (Boolean) value;
    }

    public String asText() {
        if (type != Type.TEXT) throw expected("text");
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST && type != Type.TUPLE) throw expected("a list");
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<Value, Value> asMap() {
        if (type != Type.MAP) throw expected("a dict");
        return (Map<Value, Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Set<Value> asSet() {
        if (type != Type.SET) throw expected("a set");
        return (Set<Value>) value;
    }

    public RangeValue asRange() {
        if (type != Type.RANGE) throw expected("a range");
        return (RangeValue) value;
    }

    public Callable asFunc() {
        if (type != Type.FUNC) throw expected("a function");
        return (Callable) value;
    }

    public TaleClass asClass() {
        if (type != Type.CLASS) throw expected("a class");
        return (TaleClass) value;
    }

    public TaleInstance asInstance() {
        if (type != Type.INSTANCE) throw expected("an object");
        return (TaleInstance) value;
    }

    public ModuleValue asModule() {
        if (type != Type.MODULE) throw expected("a module");
        return (ModuleValue) value;
    }

    private TaleException expected(String what) {
        return TaleException.runtime("Expected " + what + " but got " + typeName());
    }

    /** The learner-facing type name, e.g. {@code number} or the class name of an object. */
    public String typeName() {
        if (type == Type.INSTANCE) return asInstance().clazz.name;
        return type.displayName();
    }

    // -------------------------
    // Truthiness, iteration, ordering
    // -------------------------

    public boolean isTruthy() {
        switch (type) {
            case NULL: return false;
            case BOOL: return (Boolean) value;
            case INT: return (Long) value != 0L;
            case DECIMAL: return (Double) value != 0.0;
            case TEXT: return !((String) value).isEmpty();
            case LIST:
            case TUPLE: return !asList().isEmpty();
            case MAP: return !asMap().isEmpty();
            case SET: return !asSet().isEmpty();
            case RANGE: return asRange().size() > 0;
            default: return true;
        }
    }

    /** True for the types a for-each loop can walk. */
    public boolean isIterable() {
        switch (type) {
            case TEXT: case LIST: case TUPLE: case MAP: case SET: case RANGE: return true;
            default: return false;
        }
    }

    /**
     * Iterates over a snapshot for mutable containers, so a loop body may change
     * the collection it walks. Ranges are never materialized.
     */
    public Iterator<Value> iterator() {
        switch (type) {
            case TEXT: {
                String s = (String) value;
                List<Value> chars = new ArrayList<>(s.length());
                s.codePoints().forEach(cp -> chars.add(Value.text(new String(Character.toChars(cp)))));
                return chars.iterator();
            }
            case LIST:
            case TUPLE: return new ArrayList<>(asList()).iterator();
            case MAP: return new ArrayList<>(asMap().keySet()).iterator();
            case SET: return new ArrayList<>(asSet()).iterator();
            case RANGE: {
                final RangeValue r = asRange();
                return new Iterator<Value>() {
                    long i = 0;
                    final long n = r.size();
                    @Override public boolean hasNext() { return i < n; }
                    @Override public Value next() { return Value.integer(r.get(i++)); }
                };
            }
            default:
                throw TaleException.runtime("'" + typeName() + "' cannot be looped over");
        }
    }

    /** Materializes any iterable into a new list. */
    public List<Value> toList() {
        List<Value> out = new ArrayList<>();
        Iterator<Value> it = iterator();
        while (it.hasNext()) out.add(it.next());
        return out;
    }

    public static int compare(Value a, Value b) {
        if (a.isNumber() && b.isNumber()) {
            if (a.type == Type.INT && b.type == Type.INT) return Long.compare((Long) a.value, (Long) b.value);
            return Double.compare(a.asDouble(), b.asDouble());
        }
        if (a.type == Type.BOOL && b.type == Type.BOOL) return Boolean.compare(a.asBool(), b.asBool());
        if (a.type == Type.TEXT && b.type == Type.TEXT) return a.asText().compareTo(b.asText());
        if ((a.type == Type.LIST && b.type == Type.LIST) || (a.type == Type.TUPLE && b.type == Type.TUPLE)) {
            List<Value> x = a.asList();
            List<Value> y = b.asList();
            for (int i = 0; i < Math.min(x.size(), y.size()); i++) {
                int c = compare(x.get(i), y.get(i));
                if (c != 0) return c;
            }
            return Integer.compare(x.size(), y.size());
        }
        throw TaleException.runtime("Cannot compare " + a.typeName() + " with " + b.typeName());
    }

    /** Rejects values that are mutable and so cannot be dict keys or set members. */
    public Value requireHashable() {
        if (type == Type.LIST || type == Type.MAP || type == Type.SET) {
            throw TaleException.runtime("A " + typeName() + " cannot be used as a dict key or set item");
        }
        if (type == Type.TUPLE) {
            for (Value v : asList()) v.requireHashable();
        }
        return this;
    }

    // -------------------------
    // Equality: numbers compare by value across int and decimal
    // -------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (isNumber() && other.isNumber()) {
            if (type == Type.INT && other.type == Type.INT) return value.equals(other.value);
            return asDouble() == other.asDouble();
        }
        if (type != other.type) return false;
        switch (type) {
            case NULL: return true;
            case RANGE: {
                RangeValue x = asRange();
                RangeValue y = other.asRange();
                return x.start == y.start && x.stop == y.stop && x.step == y.step;
            }
            case BOOL: case TEXT: case LIST: case TUPLE: case MAP: case SET: case ERROR:
                return Objects.equals(value, other.value);
            default:
                return value == other.value;
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case INT: return Long.hashCode((Long) value);
            case DECIMAL: {
                double d = (Double) value;
                if (d == Math.rint(d) && Math.abs(d) < 9.2e18) return Long.hashCode((long) d);
                return Double.hashCode(d);
            }
            case NULL: return 0;
            case BOOL: case TEXT: case TUPLE: case ERROR: return Objects.hashCode(value);
            default: return System.identityHashCode(value);
        }
    }

    // -------------------------
    // Display
    // -------------------------

    /** What {@code print} and {@code str} show. */
    @Override
    public String toString() {
        switch (type) {
            case TEXT: return (String) value;
            case ERROR: return (String) value;
            default: return repr();
        }
    }

    /** Display form used inside containers: text is quoted. */
    public String repr() {
        return repr(Collections.newSetFromMap(new IdentityHashMap<Object, Boolean>()));
    }

    // a container already on the path prints as [...] or {...}
    private String repr(Set<Object> visiting) {
        switch (type) {
            case NULL: return "nothing";
            case BOOL: return ((Boolean) value) ? "true" : "false";
            case INT: return Long.toString((Long) value);
            case DECIMAL: return formatDecimal((Double) value);
            case TEXT: return quote((String) value);
            case LIST:
            case TUPLE:
            case SET:
            case MAP: {
                if (!visiting.add(value)) {
                    if (type == Type.LIST) return "[...]";
                    return type == Type.TUPLE ? "(...)" : "{...}";
                }
                try {
                    return containerRepr(visiting);
                } finally {
                    visiting.remove(value);
                }
            }
            case RANGE: {
                RangeValue r = asRange();
                return r.step == 1 ? "range(" + r.start + ", " + r.stop + ")"
                        : "range(" + r.start + ", " + r.stop + ", " + r.step + ")";
            }
            case FUNC: return "<function " + asFunc().name() + ">";
            case CLASS: return "<class " + asClass().name + ">";
            case INSTANCE: return "<" + asInstance().clazz.name + " object>";
            case MODULE: return "<module " + asModule().name + ">";
            case FILE: return "<file>";
            case ERROR: return "error(" + quote((String) value) + ")";
            default: return String.valueOf(value);
        }
    }

    private String containerRepr(Set<Object> visiting) {
        switch (type) {
            case LIST: return join(asList(), "[", "]", visiting);
            case TUPLE: {
                List<Value> items = asList();
                return items.size() == 1 ? "(" + items.get(0).repr(visiting) + ",)" : join(items, "(", ")", visiting);
            }
            case SET: return asSet().isEmpty() ? "set()" : join(asSet(), "{", "}", visiting);
            default: {
                StringBuilder sb = new StringBuilder("{");
                boolean first = true;
                for (Map.Entry<Value, Value> e : asMap().entrySet()) {
                    if (!first) sb.append(", ");
                    first = false;
                    sb.append(e.getKey().repr(visiting)).append(": ").append(e.getValue().repr(visiting));
                }
                return sb.append('}').toString();
            }
        }
    }

    private static String join(Iterable<Value> items, String open, String close, Set<Object> visiting) {
        StringBuilder sb = new StringBuilder(open);
        boolean first = true;
        for (Value v : items) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(v.repr(visiting));
        }
        return sb.append(close).toString();
    }

    private static String quote(String s) {
        String q = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? "\"" : "'";
        String body = s.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t");
        if (q.equals("'")) body = body.replace("'", "\\'");
        return q + body + q;
    }

    /** 3.0, 0.1, 1e-05, 1e+16: the shortest form that reads back to the same number. */
    public static String formatDecimal(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16) {
            String whole = Long.toString((long) d);
            return (d == 0 && 1 / d < 0 ? "-" : "") + whole + ".0";
        }
        String s = Double.toString(d);
        int e = s.indexOf('E');
        int exp = e < 0 ? 0 : Integer.parseInt(s.substring(e + 1));
        if (e < 0 || (exp >= -4 && exp < 16)) {
            String plain = new BigDecimal(s).toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        String mantissa = s.substring(0, e);
        if (mantissa.endsWith(".0")) mantissa = mantissa.substring(0, mantissa.length() - 2);
        int abs = Math.abs(exp);
        return mantissa + "e" + (exp < 0 ? "-" : "+") + (abs < 10 ? "0" : "") + abs;
    }
}
