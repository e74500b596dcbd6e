package com.ram.script.parser;

import java.util.ArrayList;
import java.util.List;

/** One raw source line and its 1-based line number. */
public final class SourceLine {
    public final String text;
    public final int number;

    public SourceLine(String text, int number) {
        this.text = text == null ? "" : text.trim();
        this.number = number;
    }

    /** Splits text into trimmed, 1-based numbered lines (blank lines kept). */
    public static List<SourceLine> of(String source) {
        List<SourceLine> out = new ArrayList<>();
        if (source == null) return out;
        String[] raw = source.split("\r?\n", -1);
        for (int i = 0; i < raw.length; i++) {
            out.add(new SourceLine(raw[i], i + 1));
        }
        return out;
    }

    /** Drops blank lines and renumbers the rest contiguously from 1. */
    public static List<SourceLine> normalize(List<SourceLine> lines) {
        List<SourceLine> out = new ArrayList<>();
        for (SourceLine l : lines) {
            if (l == null || l.text.isEmpty()) continue;
            out.add(new SourceLine(l.text, out.size() + 1));
        }
        return out;
    }

    @Override
    public String toString() {
        return number + ": " + text;
    }
}
