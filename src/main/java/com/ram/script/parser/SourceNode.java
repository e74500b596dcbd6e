package com.ram.script.parser;

/** Output of the block structurer: a {@link Line}, a {@link Block} or a {@link Marker}. */
public interface SourceNode {
    /** 1-based line number of the line (or header line) this node came from. */
    int number();

    /** Raw text of the line (or header line). */
    String text();
}
