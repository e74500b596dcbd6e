package com.ram.script.parser;

import java.util.Map;

/** A function record bound in an environment: user-defined or builtin. */
public interface RamCallable {

    String name();

    /**
     * @param interpreter the running interpreter (its environment is the caller's)
     * @param arguments   evaluated arguments keyed by parameter name
     */
    Value call(Interpreter interpreter, Map<String, Value> arguments);
}
