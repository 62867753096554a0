package com.tale.script.parser;

import java.util.List;

import com.tale.script.diagnostics.TaleException;

/** {@code fn(x, y) -> expr}: one expression evaluated in a fresh frame under the closure. */
public class LambdaFunction implements Callable {
    final List<String> params;
    final Expr.ExprInterface body;
    final Environment closure;

    LambdaFunction(List<String> params, Expr.ExprInterface body, Environment closure) {
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw TaleException.runtime("lambda takes " + params.size() + " value(s) but " + args.size() + " given");
        }
        Environment frame = closure.child();
        for (int i = 0; i < params.size(); i++) frame.assign(params.get(i), args.get(i));
        return interpreter.evaluateIn(body, frame);
    }

    @Override
    public String name() {
        return "lambda";
    }
}
