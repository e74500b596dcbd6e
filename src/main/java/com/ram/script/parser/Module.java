package com.ram.script.parser;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.ram.script.parser.Statement.Stmt;

/** Root of a parsed program: the ordered top-level statements. */
public final class Module {
    public final List<Stmt> body;

    public Module(List<Stmt> body) {
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    /**
     * Evaluates against a fresh environment seeded with the builtins, writing
     * to standard output and reading standard input.
     *
     * @return the top-level environment after the run
     */
    public Environment evaluate() {
        Environment env = new Environment();
        Builtins.install(env);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return evaluate(new Interpreter(env, System.out, in, Interpreter.DEFAULT_MAX_DEPTH));
    }

    public Environment evaluate(Interpreter interpreter) {
        interpreter.run(body);
        return interpreter.environment();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Stmt s : body) sb.append(s).append('\n');
        return sb.toString();
    }
}
