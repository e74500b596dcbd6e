package com.ram.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.ram.script.RamSyntaxException;

/**
 * Turns the expression part of a line into a nested token sequence.
 *
 * <ol>
 *   <li>whitespace is inserted around {@code + - * /} so operators become words;</li>
 *   <li>balanced parentheses become nested groups, recursively;</li>
 *   <li>each level is regrouped: boolean chains by {@link Precedence#chainBoolean},
 *       arithmetic by {@link Precedence#pedmas}.</li>
 * </ol>
 *
 * Double-quoted strings and {@code name[...]} call arguments are kept as single words.
 */
public class Lexer {
    private final String source;
    private final String line;
    private final int lineNumber;

    public Lexer(String source, String line, int lineNumber) {
        this.source = source == null ? "" : source;
        this.line = line == null ? this.source : line;
        this.lineNumber = lineNumber;
    }

    public Lexer(String source) {
        this(source, source, 0);
    }

    /** Convenience for {@code new Lexer(text).lexify()}. */
    public static List<Token> lexify(String text) {
        return new Lexer(text).lexify();
    }

    public List<Token> lexify() {
        return lexifyLevel(formatWhitespace(source));
    }

    private List<Token> lexifyLevel(String text) {
        List<Token> flat = new ArrayList<>();
        for (Object block : identifyBracketBlocks(text)) {
            if (block instanceof String) {
                for (String w : splitWords((String) block)) flat.add(Token.word(w));
            } else {
                flat.add(Token.group(lexifyLevel(((StringBuilder) block).toString())));
            }
        }
        return regroup(flat);
    }

    /** Boolean keywords split the level into runs; each run is grouped arithmetically first. */
    List<Token> regroup(List<Token> flat) {
        boolean hasBoolean = false;
        for (Token t : flat) {
            if (t.isWordIn(Keywords.BOOLEAN)) { hasBoolean = true; break; }
        }
        if (!hasBoolean) return Precedence.pedmas(flat);

        List<Token> chain = new ArrayList<>();
        List<Token> run = new ArrayList<>();
        for (Token t : flat) {
            if (t.isWordIn(Keywords.BOOLEAN)) {
                if (run.isEmpty()) throw error("Operand missing before '" + t + "'.");
                chain.add(collapse(run));
                chain.add(t);
                run = new ArrayList<>();
            } else {
                run.add(t);
            }
        }
        if (run.isEmpty()) throw error("Operand missing after '" + chain.get(chain.size() - 1) + "'.");
        chain.add(collapse(run));
        return chain.size() >= 3 ? Precedence.chainBoolean(chain) : chain;
    }

    private static Token collapse(List<Token> run) {
        List<Token> grouped = Precedence.pedmas(run);
        return grouped.size() == 1 ? grouped.get(0) : Token.group(grouped);
    }

    /** Inserts whitespace around operator characters outside strings and call brackets. */
    static String formatWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        boolean inString = false;
        int square = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') inString = !inString;
            else if (!inString && c == '[') square++;
            else if (!inString && c == ']') square--;

            if (!inString && square == 0 && Keywords.OPERATOR_CHARS.indexOf(c) >= 0) {
                sb.append(' ').append(c).append(' ');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Splits text into plain segments (String) and parenthesised contents
     * (StringBuilder, brackets stripped) using a depth counter.
     */
    List<Object> identifyBracketBlocks(String text) {
        List<Object> blocks = new ArrayList<>();
        StringBuilder plain = new StringBuilder();
        StringBuilder inner = null;
        int depth = 0;
        boolean inString = false;
        int square = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') inString = !inString;
            boolean structural = !inString && square == 0;

            if (!inString && c == '[') square++;
            else if (!inString && c == ']') square--;

            if (structural && c == '(') {
                if (depth == 0) {
                    blocks.add(plain.toString());
                    plain = new StringBuilder();
                    inner = new StringBuilder();
                    depth++;
                    continue;
                }
                depth++;
            } else if (structural && c == ')') {
                depth--;
                if (depth < 0) throw error("Unbalanced ')'.");
                if (depth == 0) {
                    blocks.add(inner);
                    inner = null;
                    continue;
                }
            }

            if (depth == 0) plain.append(c);
            else inner.append(c);
        }

        if (inString) throw error("Unterminated string.");
        if (square != 0) throw error("Unbalanced '['.");
        if (depth != 0) throw error("Unbalanced '('.");
        blocks.add(plain.toString());
        return blocks;
    }

    /** Whitespace split that keeps quoted strings and call brackets intact. */
    static List<String> splitWords(String text) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inString = false;
        int square = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') inString = !inString;
            else if (!inString && c == '[') square++;
            else if (!inString && c == ']') square--;

            if (!inString && square == 0 && Character.isWhitespace(c)) {
                if (cur.length() > 0) {
                    out.add(cur.toString());
                    cur.setLength(0);
                }
            } else {
                cur.append(c);
            }
        }
        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }

    private RamSyntaxException error(String msg) {
        return new RamSyntaxException(line, lineNumber, msg);
    }
}
