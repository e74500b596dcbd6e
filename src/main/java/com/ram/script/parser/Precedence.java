package com.ram.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Regroups flat operand/operator sequences into nested triples.
 *
 * <pre>
 *   pedmas([4, +, 2, *, 7, -, 1])        -> [4, +, [2, *, 7], -, 1]
 *   chainBoolean([a, or, b, and, c])     -> [[a, or, b], and, c]
 * </pre>
 */
public final class Precedence {

    private Precedence() {}

    /**
     * Collapses every multiplicative triple, leftmost first, until no ungrouped
     * {@code *} or {@code /} remains. Additive operators stay flat; the
     * expression parser associates them left to right.
     *
     * Precondition: odd length, no operator at either end.
     */
    public static List<Token> pedmas(List<Token> sequence) {
        return groupTier(sequence, Keywords.MULTIPLICATIVE);
    }

    /** Groups the leftmost operator of {@code tier} into a triple, repeatedly. */
    static List<Token> groupTier(List<Token> sequence, Set<String> tier) {
        List<Token> out = new ArrayList<>(sequence);
        int i = 1;
        while (i < out.size() - 1) {
            Token op = out.get(i);
            Token left = out.get(i - 1);
            Token right = out.get(i + 1);
            if (op.isWordIn(tier) && !left.isOperator() && !right.isOperator()) {
                Token triple = Token.group(List.of(left, op, right));
                out.subList(i - 1, i + 2).clear();
                out.add(i - 1, triple);
                // the next operator has shifted into position i
                continue;
            }
            i++;
        }
        return out;
    }

    /**
     * Nests a boolean chain strictly left to right in triples with no
     * precedence between {@code and} and {@code or}.
     *
     * Precondition: length >= 3.
     */
    public static List<Token> chainBoolean(List<Token> expression) {
        List<Token> out = new ArrayList<>(expression);
        while (out.size() > 3) {
            Token head = Token.group(out.subList(0, 3));
            out.subList(0, 3).clear();
            out.add(0, head);
        }
        return out;
    }
}
