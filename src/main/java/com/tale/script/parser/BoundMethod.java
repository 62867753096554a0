package com.tale.script.parser;

import java.util.ArrayList;
import java.util.List;

/** A method looked up through an object: the object is passed as {@code self}. */
public class BoundMethod implements Callable {
    final Value self;
    final Callable method;

    BoundMethod(Value self, Callable method) {
        this.self = self;
        this.method = method;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        List<Value> full = new ArrayList<>(args.size() + 1);
        full.add(self);
        full.addAll(args);
        return method.call(interpreter, full);
    }

    @Override
    public String name() {
        return method.name();
    }
}
