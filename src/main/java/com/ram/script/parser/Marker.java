package com.ram.script.parser;

/**
 * A line holding both braces, such as {@code } else if (x) is (1) {}. It is
 * passed through unparsed and splits the enclosing conditional's body.
 */
public final class Marker implements SourceNode {
    private final SourceLine source;

    public Marker(SourceLine source) {
        this.source = source;
    }

    @Override
    public int number() { return source.number; }

    @Override
    public String text() { return source.text; }

    @Override
    public String toString() {
        return "Marker(" + source + ")";
    }
}
