package com.tale.script.parser;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One namespace: the program's globals, a function call frame, or a class body.
 * Blocks share the namespace of the code around them. Assignment binds in the
 * current namespace unless the name was declared {@code global}.
 */
public class Environment {
    public final Environment parent;
    private final Environment root;
    private final Map<String, Value> values = new LinkedHashMap<>();
    private final Set<String> globalNames = new HashSet<>();

    /** A fresh root namespace for one run. */
    public Environment() {
        this.parent = null;
        this.root = this;
    }

    private Environment(Environment parent) {
        this.parent = parent;
        this.root = parent.root;
    }

    public Environment child() {
        return new Environment(this);
    }

    public Environment root() { return root; }

    public boolean isRoot() { return this == root; }

    /** Nearest binding up the chain, or null when the name is unbound. */
    public Value lookup(String name) {
        if (globalNames.contains(name)) return root.values.get(name);
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        return null;
    }

    public boolean exists(String name) {
        return lookup(name) != null;
    }

    public void assign(String name, Value value) {
        if (globalNames.contains(name)) {
            root.values.put(name, value);
        } else {
            values.put(name, value);
        }
    }

    /** Later assignments of {@code name} in this namespace go to the root. */
    public void declareGlobal(String name) {
        if (this != root) globalNames.add(name);
    }

    public Map<String, Value> values() {
        return Collections.unmodifiableMap(values);
    }
}
