package com.tale.script.sandbox;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import com.tale.script.diagnostics.SandboxViolationException;

/**
 * Name and import rules shared by static validation and the running
 * interpreter, so a program that slips past one still meets the other.
 */
public final class SandboxPolicy {

    public static final Set<String> DENIED_NAMES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "eval", "exec", "compile", "globals", "locals", "vars", "getattr", "setattr", "delattr",
            "input", "breakpoint", "exit", "quit", "help", "dir", "os", "sys", "subprocess", "socket", "system")));

    private SandboxPolicy() {}

    /** Names starting with '_' reach interpreter internals in most languages; TALE has none to offer. */
    public static boolean isIntrospective(String name) {
        return name.startsWith("_");
    }

    public static void checkName(String name, int line) {
        if (isIntrospective(name)) {
            throw new SandboxViolationException(line, "Names starting with '_' are not allowed: " + name);
        }
        if (DENIED_NAMES.contains(name)) {
            throw new SandboxViolationException(line, "'" + name + "' is not available in TALE");
        }
    }

    public static void checkAttribute(String attribute, int line) {
        if (isIntrospective(attribute)) {
            throw new SandboxViolationException(line, "Attributes starting with '_' are not allowed: " + attribute);
        }
    }

    public static void checkImport(TaleSettings settings, String module, int line) {
        if (!settings.isModuleAllowed(module)) {
            throw new SandboxViolationException(line, "Import not allowed: " + module
                    + ". Available modules: " + String.join(", ", settings.allowedModules()));
        }
    }
}
