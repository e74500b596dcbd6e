package com.ram.script.parser;

import java.util.Collections;
import java.util.List;

import com.ram.script.RamBlockException;
import com.ram.script.RamKeywordException;
import com.ram.script.RamSyntaxException;

/**
 * A brace-delimited region: a header line up to its opening brace plus the
 * ordered child nodes before the matching closing brace.
 *
 * The variant is picked from the header keyword before construction; see
 * {@link #of(SourceLine, List)}.
 */
public abstract class Block implements SourceNode {

    public enum Kind { LOOP, IF, FUNCTION }

    private final SourceLine headerLine;
    private final String header;
    private final List<SourceNode> children;

    protected Block(SourceLine headerLine, List<SourceNode> children) {
        if (headerLine == null || children == null) {
            throw new RamBlockException("Undefined block created");
        }
        int brace = BlockStructurer.indexOfBrace(headerLine.text, '{');
        if (brace < 0) {
            throw new RamSyntaxException(headerLine.text, headerLine.number, "Block header must end with '{'.");
        }
        this.headerLine = headerLine;
        this.header = headerLine.text.substring(0, brace).trim();
        this.children = Collections.unmodifiableList(children);
    }

    /** Builds the variant named by the header's first word ({@code loop}, {@code if}, {@code new}). */
    public static Block of(SourceLine headerLine, List<SourceNode> children) {
        if (headerLine == null) throw new RamBlockException("Undefined block created");
        String[] words = Line.words(headerLine.text);
        String keyword = words.length == 0 ? "" : words[0];
        switch (keyword) {
            case Keywords.LOOP:
                return new LoopBlock(headerLine, children);
            case Keywords.IF:
                return new IfBlock(headerLine, children);
            case Keywords.NEW:
                return new FunctionBlock(headerLine, children);
            default:
                throw new RamKeywordException(headerLine.text, headerLine.number, keyword);
        }
    }

    public abstract Kind kind();

    /** Header text truncated at the first '{' outside a string. */
    public String header() { return header; }

    public String[] headerWords() { return Line.words(header); }

    public List<SourceNode> children() { return children; }

    @Override
    public int number() { return headerLine.number; }

    @Override
    public String text() { return headerLine.text; }

    @Override
    public String toString() {
        return kind() + "Block(" + headerLine + ", " + children.size() + " children)";
    }
}
