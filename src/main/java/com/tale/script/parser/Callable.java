package com.tale.script.parser;

import java.util.List;

/** Anything a program can call: user functions, lambdas, bound methods and capabilities. */
public interface Callable {
    Value call(Interpreter interpreter, List<Value> args);

    String name();
}
