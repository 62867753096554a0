package com.tale.script.sandbox;

import java.util.List;

import com.tale.script.parser.Value;

/** A capability implemented in Java. Failures are thrown as {@code TaleException}s. */
@FunctionalInterface
public interface NativeFunction {
    Value call(SandboxContext ctx, List<Value> args);
}
