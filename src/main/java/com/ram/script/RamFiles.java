package com.ram.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.ram.script.parser.SourceLine;

/** Reading {@code .ram} files into numbered source lines. */
public final class RamFiles {

    public static final String EXTENSION = "ram";

    private RamFiles() {}

    /** Requires exactly one '.' and the {@code .ram} extension. */
    public static void verifyFileName(String fileName) {
        if (fileName == null) throw new RamFileException("No file name given.");
        String base = Path.of(fileName).getFileName().toString();
        int dot = base.indexOf('.');
        if (dot < 0 || dot != base.lastIndexOf('.')) {
            throw new RamFileException("File name '" + base + "' must contain exactly one '.'.");
        }
        if (!EXTENSION.equals(base.substring(dot + 1))) {
            throw new RamFileException("File '" + base + "' must have the ." + EXTENSION + " extension.");
        }
    }

    /** UTF-8 lines, trimmed, numbered from 1. Blank lines are kept. */
    public static List<SourceLine> readLines(Path path) {
        if (!Files.exists(path)) throw new RamFileNotFoundException(path.toString());
        List<String> raw;
        try {
            raw = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RamFileException("Failed to read script file: " + path, e);
        }
        List<SourceLine> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            out.add(new SourceLine(raw.get(i), i + 1));
        }
        return out;
    }
}
