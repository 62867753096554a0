package com.tale.script.parser;

import java.util.List;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Interpreter.ReturnSignal;
import com.tale.script.parser.Statement.Stmt;

/** A {@code function} defined by the program. Calls run in a fresh frame under the closure. */
public class UserFunction implements Callable {
    final String name;
    final List<String> params;
    final List<Stmt> body;
    final Environment closure;

    UserFunction(String name, List<String> params, List<Stmt> body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw TaleException.runtime(name + "() takes " + params.size()
                    + (params.size() == 1 ? " value" : " values") + " but " + args.size()
                    + (args.size() == 1 ? " was" : " were") + " given");
        }

        Environment frame = closure.child();
        for (int i = 0; i < params.size(); i++) {
            frame.assign(params.get(i), args.get(i));
        }

        try {
            interpreter.executeBody(body, frame);
        } catch (ReturnSignal rs) {
            return rs.value;
        }
        return Value.nil();
    }

    @Override
    public String name() {
        return name;
    }

    public int arity() {
        return params.size();
    }
}
