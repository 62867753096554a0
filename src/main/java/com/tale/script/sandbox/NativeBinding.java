package com.tale.script.sandbox;

import java.util.List;

import com.tale.debug.Debug;
import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Callable;
import com.tale.script.parser.Interpreter;
import com.tale.script.parser.Value;

/** A {@link NativeFunction} bound to one run's context, callable from TALE code. */
final class NativeBinding implements Callable {

    private final String name;
    private final NativeFunction fn;
    private final SandboxContext ctx;

    NativeBinding(String name, NativeFunction fn, SandboxContext ctx) {
        this.name = name;
        this.fn = fn;
        this.ctx = ctx;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        try {
            return fn.call(ctx, args);
        } catch (TaleException e) {
            throw e;
        } catch (RuntimeException e) {
            // a Java-level fault inside a capability is still the program's runtime error
            Debug.get().d("tale.sandbox", "capability " + name + " failed: " + e);
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw new TaleException(ErrorKind.RUNTIME, 0, name + "(): " + msg, e);
        }
    }

    @Override
    public String name() {
        return name;
    }
}
