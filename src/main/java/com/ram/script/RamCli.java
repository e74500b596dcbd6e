package com.ram.script;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.ram.debug.Debug;
import com.ram.debug.DebugLevel;
import com.ram.script.parser.Module;
import com.ram.script.parser.SourceLine;
import com.ram.script.parser.Value;
import com.ram.script.util.AstJson;

/**
 * {@code RamCli [--ast] [--env] [--debug] <file.ram>}
 *
 * --ast    print the parsed program as JSON before running
 * --env    print the final variables as JSON after running
 * --debug  log engine activity to stderr
 *
 * Exit codes: 2 usage, 3 file error, 1 script error.
 */
public final class RamCli {

    public static void main(String[] args) {
        boolean ast = false;
        boolean env = false;
        String file = null;
        for (String a : args) {
            switch (a) {
                case "--ast": ast = true; break;
                case "--env": env = true; break;
                case "--debug": Debug.get().setSink(Debug.printSink(System.err, DebugLevel.DEBUG)); break;
                default:
                    if (file != null || a.startsWith("--")) usage();
                    file = a;
            }
        }
        if (file == null) usage();

        final List<SourceLine> lines;
        try {
            RamFiles.verifyFileName(file);
            lines = RamFiles.readLines(Path.of(file));
        } catch (RamFileException e) {
            System.err.println(e.getMessage());
            System.exit(3);
            return;
        }

        RamScript engine = new RamScript();
        try {
            Module module = engine.parse(lines);
            if (ast) System.out.println(AstJson.pretty(AstJson.toJson(module)));
            Map<String, Value> vars = engine.run(module);
            if (env) System.out.println(AstJson.pretty(AstJson.toJson(vars)));
        } catch (RamException e) {
            System.err.println(e.getClass().getSimpleName() + ": " + e.getMessage());
            System.exit(1);
        }
    }

    private static void usage() {
        System.err.println("Usage: RamCli [--ast] [--env] [--debug] <file.ram>");
        System.exit(2);
    }

    private RamCli() {}
}
