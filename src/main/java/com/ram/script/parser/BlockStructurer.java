package com.ram.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.ram.debug.Debug;
import com.ram.script.RamSyntaxException;

/**
 * Nests a flat list of source lines into {@link Line}s and {@link Block}s by
 * brace matching.
 *
 * <pre>
 *   1  loop with j from 1 to 2 {
 *   2      display j
 *   3  }
 *   4  display 0
 * </pre>
 * becomes {@code [LoopBlock(1, [Line(2)]), Line(4)]}. A line holding both
 * braces ({@code } else {}) is kept in the enclosing block as a {@link Marker}.
 *
 * Precondition: blank lines removed, numbers contiguous from 1
 * (see {@link SourceLine#normalize(List)}).
 */
public class BlockStructurer {
    private static final String TAG = "BlockStructurer";

    /** Nodes collected at one nesting level and the index of the first unconsumed line. */
    static final class Scan {
        final List<SourceNode> nodes;
        final int next;

        Scan(List<SourceNode> nodes, int next) {
            this.nodes = nodes;
            this.next = next;
        }
    }

    public List<SourceNode> structure(List<SourceLine> lines) {
        return scan(lines, 0, null).nodes;
    }

    /**
     * Collects nodes from {@code start} until the closing brace of {@code opener}
     * (or the end of input at top level). Exactly one closing line is consumed
     * per opened block.
     */
    private Scan scan(List<SourceLine> lines, int start, SourceLine opener) {
        List<SourceNode> nodes = new ArrayList<>();
        int i = start;

        while (i < lines.size()) {
            SourceLine line = lines.get(i);
            boolean opens = hasBrace(line.text, '{');
            boolean closes = hasBrace(line.text, '}');

            if (opens && closes) {
                if (opener == null) {
                    throw new RamSyntaxException(line.text, line.number, "Unmatched '}'.");
                }
                nodes.add(new Marker(line));
                i++;
            } else if (opens) {
                Scan body = scan(lines, i + 1, line);
                Block block = Block.of(line, body.nodes);
                Debug.get().t(TAG, block.kind() + " block at line " + line.number
                        + " with " + body.nodes.size() + " children");
                nodes.add(block);
                i = body.next;
            } else if (closes) {
                if (!line.text.equals("}")) {
                    throw new RamSyntaxException(line.text, line.number, "A closing '}' must be on its own line.");
                }
                if (opener == null) {
                    throw new RamSyntaxException(line.text, line.number, "Unmatched '}'.");
                }
                return new Scan(nodes, i + 1);
            } else {
                nodes.add(new Line(line));
                i++;
            }
        }

        if (opener != null) {
            throw new RamSyntaxException(opener.text, opener.number, "Block is never closed.");
        }
        return new Scan(nodes, i);
    }

    /** True if {@code brace} occurs outside double-quoted text. */
    static boolean hasBrace(String text, char brace) {
        return indexOfBrace(text, brace) >= 0;
    }

    /** First {@code brace} outside double-quoted strings, or -1. */
    static int indexOfBrace(String text, char brace) {
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') inString = !inString;
            else if (!inString && c == brace) return i;
        }
        return -1;
    }
}
