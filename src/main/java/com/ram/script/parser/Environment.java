package com.ram.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.ram.script.RamNameException;

/**
 * Mutable name -> value mapping used during evaluation.
 *
 * One instance per top-level module run; each function call gets a fresh
 * instance from {@link #forCall(Map)} holding only callables and the call's
 * arguments.
 */
public class Environment {
    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {}

    public Environment(Map<String, Value> initial) {
        if (initial != null) values.putAll(initial);
    }

    /** Binds {@code name}, overwriting any prior binding. */
    public void assign(String name, Value value) {
        values.put(name, value == null ? Value.nil() : value);
    }

    public Value get(String name) {
        Value v = values.get(name);
        if (v == null) throw new RamNameException(name);
        return v;
    }

    public boolean exists(String name) {
        return values.containsKey(name);
    }

    /**
     * Call-scope environment: every callable binding of this environment plus
     * the given arguments. Non-callable caller variables are not visible.
     */
    public Environment forCall(Map<String, Value> arguments) {
        Environment child = new Environment();
        for (Map.Entry<String, Value> e : values.entrySet()) {
            if (e.getValue().isCallable()) child.values.put(e.getKey(), e.getValue());
        }
        if (arguments != null) {
            for (Map.Entry<String, Value> e : arguments.entrySet()) child.assign(e.getKey(), e.getValue());
        }
        return child;
    }

    /** Read-only copy of the non-callable bindings. */
    public Map<String, Value> variables() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : values.entrySet()) {
            if (!e.getValue().isCallable()) out.put(e.getKey(), e.getValue());
        }
        return Collections.unmodifiableMap(out);
    }
}
