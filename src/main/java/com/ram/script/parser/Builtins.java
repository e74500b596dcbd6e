package com.ram.script.parser;

import java.util.Iterator;
import java.util.Map;

import com.ram.script.RamGeneralException;
import com.ram.script.RamOperatorEvaluateException;

/**
 * Function records present in every top-level environment.
 *
 * Usage:
 *   Builtins.install(env);
 *
 * Then in scripts:
 *   set integer n to CONVERT_NUMBER[value="42"]
 *   set text name to GET_TEXT[prompt="name? "]
 *
 * Both take their first argument whatever it is named.
 */
public final class Builtins {

    private Builtins() {}

    /** Body of a builtin; receives the running interpreter and the evaluated arguments. */
    @FunctionalInterface
    public interface Body {
        Value apply(Interpreter interpreter, Map<String, Value> arguments);
    }

    /** Named {@link RamCallable} backed by a {@link Body}. */
    public static final class Builtin implements RamCallable {
        private final String name;
        private final Body body;

        public Builtin(String name, Body body) {
            this.name = name;
            this.body = body;
        }

        @Override
        public String name() { return name; }

        @Override
        public Value call(Interpreter interpreter, Map<String, Value> arguments) {
            return body.apply(interpreter, arguments);
        }

        @Override
        public String toString() { return "<builtin " + name + ">"; }
    }

    public static void install(Environment env) {
        env.assign(Keywords.CONVERT_NUMBER, Value.func(new Builtin(Keywords.CONVERT_NUMBER, (it, args) ->
                convertNumber(first(Keywords.CONVERT_NUMBER, args)))));

        env.assign(Keywords.GET_TEXT, Value.func(new Builtin(Keywords.GET_TEXT, (it, args) -> {
            if (!args.isEmpty()) {
                it.out().print(first(Keywords.GET_TEXT, args).toString());
                it.out().flush();
            }
            String line = it.readLine();
            return Value.string(line == null ? "" : line);
        })));
    }

    static Value convertNumber(Value v) {
        if (v.isNumber()) return v;
        if (v.type == Value.Type.STRING) {
            String s = v.asString().trim();
            try {
                return Value.number(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                throw new RamOperatorEvaluateException("Cannot convert '" + s + "' to a number.");
            }
        }
        throw new RamOperatorEvaluateException("Cannot convert " + v.typeName() + " to a number.");
    }

    private static Value first(String fn, Map<String, Value> args) {
        Iterator<Value> it = args.values().iterator();
        if (!it.hasNext()) {
            throw new RamGeneralException(fn + " expects one argument.");
        }
        return it.next();
    }
}
