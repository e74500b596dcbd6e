package com.ram.script;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ram.debug.Debug;
import com.ram.script.parser.BlockStructurer;
import com.ram.script.parser.Builtins;
import com.ram.script.parser.Environment;
import com.ram.script.parser.Interpreter;
import com.ram.script.parser.Module;
import com.ram.script.parser.Parser;
import com.ram.script.parser.SourceLine;
import com.ram.script.parser.SourceNode;
import com.ram.script.parser.Value;

/**
 * Core Ram engine.
 *
 * - Line oriented: one statement, block header or closing brace per line
 * - Statements: set / reset / display / call, blocks: loop / if / new function
 * - Types: number (double), text, boolean, function record, absent
 * - Function calls use named arguments: f[x=1,y=2]
 * - Builtins: CONVERT_NUMBER, GET_TEXT, plus any registered via registerFunction
 *
 * Usage:
 * <pre>
 *   RamScript engine = new RamScript();
 *   engine.setOutput(System.out);
 *   Map&lt;String, Value&gt; env = engine.run("set integer x to 2 * 3\ndisplay x");
 * </pre>
 */
public class RamScript {
    private static final String TAG = "RamScript";

    private final Map<String, Builtins.Body> functions = new LinkedHashMap<>();
    private PrintStream out = System.out;
    private BufferedReader in;
    private int maxCallDepth = Interpreter.DEFAULT_MAX_DEPTH;

    public void setOutput(PrintStream out) {
        this.out = out == null ? System.out : out;
    }

    public void setInput(Reader reader) {
        this.in = reader == null ? null
                : (reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader));
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    /** Registers a host function callable from scripts as {@code name[arg=...]}. */
    public void registerFunction(String name, Builtins.Body fn) {
        functions.put(name, fn);
    }

    // ===================== PARSE =====================

    /** Parses numbered source lines; blank lines are dropped and the rest renumbered from 1. */
    public Module parse(List<SourceLine> lines) {
        List<SourceLine> normalized = SourceLine.normalize(lines);
        Debug.get().d(TAG, "parse " + normalized.size() + " lines");
        try {
            List<SourceNode> nodes = new BlockStructurer().structure(normalized);
            Module module = new Module(new Parser().parse(nodes));
            Debug.get().d(TAG, "parsed " + module.body.size() + " top-level statements");
            return module;
        } catch (RamException e) {
            Debug.get().e(TAG, e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "unclassified parse failure", e);
            throw new RamGeneralException(e);
        }
    }

    public Module parse(String source) {
        return parse(SourceLine.of(source));
    }

    // ===================== RUN =====================

    /** Interpreter over a fresh top-level environment seeded with every builtin. */
    public Interpreter newInterpreter() {
        return newInterpreter(new Environment());
    }

    private Interpreter newInterpreter(Environment env) {
        Builtins.install(env);
        for (Map.Entry<String, Builtins.Body> e : functions.entrySet()) {
            env.assign(e.getKey(), Value.func(new Builtins.Builtin(e.getKey(), e.getValue())));
        }
        BufferedReader reader = in != null ? in
                : new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return new Interpreter(env, out, reader, maxCallDepth);
    }

    /** Parses and evaluates; returns the final top-level variables (functions excluded). */
    public Map<String, Value> run(String source) {
        return run(parse(source));
    }

    /** Global-program mode: run with an initial environment. */
    public Map<String, Value> run(String source, Map<String, Value> initialEnv) {
        Module module = parse(source);
        return run(module, new Environment(initialEnv));
    }

    public Map<String, Value> run(Module module) {
        return run(module, new Environment());
    }

    private Map<String, Value> run(Module module, Environment env) {
        Interpreter interpreter = newInterpreter(env);
        Debug.get().d(TAG, "evaluate " + module.body.size() + " statements");
        module.evaluate(interpreter);
        out.flush();
        return interpreter.environment().variables();
    }
}
