package com.ram.script.parser;

import java.util.Map;

import com.ram.debug.Debug;
import com.ram.script.parser.Statement.FunctionDef;

/**
 * A function defined by {@code new function}. The body runs against a call
 * environment holding the caller's callables plus the named arguments; caller
 * variables are not visible and nothing assigned in the body leaks back.
 */
public class UserFunction implements RamCallable {
    private static final String TAG = "UserFunction";

    final FunctionDef def;

    UserFunction(FunctionDef def) {
        this.def = def;
    }

    @Override
    public String name() {
        return def.name;
    }

    @Override
    public Value call(Interpreter interpreter, Map<String, Value> arguments) {
        for (String p : arguments.keySet()) {
            if (!def.params.contains(p)) {
                Debug.get().w(TAG, def.name + " called with undeclared argument '" + p + "'");
            }
        }
        Debug.get().d(TAG, "call " + def.name + arguments.keySet());

        Environment previous = interpreter.env;
        interpreter.env = previous.forCall(arguments);
        try {
            interpreter.execute(def.body);
            return interpreter.eval(def.returnExpr);
        } finally {
            interpreter.env = previous;
        }
    }

    @Override
    public String toString() {
        return "<function " + def.name + ">";
    }
}
