package com.tale.script.sandbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.tale.script.parser.Value;

/**
 * Everything a TALE program may reach: top-level functions and allow-listed
 * modules. Immutable; built once per engine and bound to each run's context.
 * A name that is not in the table simply does not exist for the program.
 */
public final class CapabilityTable {

    private final Map<String, NativeFunction> functions;
    private final Map<String, ModuleSpec> modules;

    private CapabilityTable(Builder b) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(b.functions));
        Map<String, ModuleSpec> m = new LinkedHashMap<>();
        for (Map.Entry<String, ModuleSpec> e : b.modules.entrySet()) m.put(e.getKey(), e.getValue().freeze());
        this.modules = Collections.unmodifiableMap(m);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasFunction(String name) { return functions.containsKey(name); }

    public boolean hasModule(String name) { return modules.containsKey(name); }

    public Set<String> functionNames() { return functions.keySet(); }

    public Set<String> moduleNames() { return modules.keySet(); }

    /**
     * Binds every capability to {@code ctx}. Modules missing from the settings'
     * allow-list are left out entirely.
     */
    public Map<String, Value> bind(SandboxContext ctx) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, NativeFunction> e : functions.entrySet()) {
            out.put(e.getKey(), Value.func(new NativeBinding(e.getKey(), e.getValue(), ctx)));
        }
        for (Map.Entry<String, ModuleSpec> e : modules.entrySet()) {
            if (!ctx.settings().isModuleAllowed(e.getKey())) continue;
            out.put(e.getKey(), Value.module(e.getValue().bind(e.getKey(), ctx)));
        }
        return out;
    }

    /** Functions and constants of one module. */
    public static final class ModuleSpec {
        private final Map<String, NativeFunction> functions = new LinkedHashMap<>();
        private final Map<String, Value> constants = new LinkedHashMap<>();
        private boolean frozen;

        private ModuleSpec() {}

        public ModuleSpec function(String name, NativeFunction fn) {
            if (frozen) throw new IllegalStateException("capability table is already built");
            functions.put(name, fn);
            return this;
        }

        public ModuleSpec constant(String name, Value value) {
            if (frozen) throw new IllegalStateException("capability table is already built");
            constants.put(name, value);
            return this;
        }

        private ModuleSpec freeze() {
            frozen = true;
            return this;
        }

        private Value.ModuleValue bind(String moduleName, SandboxContext ctx) {
            Map<String, Value> members = new LinkedHashMap<>(constants);
            for (Map.Entry<String, NativeFunction> e : functions.entrySet()) {
                members.put(e.getKey(), Value.func(new NativeBinding(moduleName + "." + e.getKey(), e.getValue(), ctx)));
            }
            return new Value.ModuleValue(moduleName, members);
        }
    }

    public static final class Builder {
        private final Map<String, NativeFunction> functions = new LinkedHashMap<>();
        private final Map<String, ModuleSpec> modules = new LinkedHashMap<>();

        private Builder() {}

        public Builder function(String name, NativeFunction fn) {
            if (name == null || name.isEmpty() || name.startsWith("_")) {
                throw new IllegalArgumentException("Invalid capability name: " + name);
            }
            functions.put(name, fn);
            return this;
        }

        /** Returns the module being built, creating it on first use. */
        public ModuleSpec module(String name) {
            return modules.computeIfAbsent(name, n -> new ModuleSpec());
        }

        public CapabilityTable build() {
            return new CapabilityTable(this);
        }
    }
}
