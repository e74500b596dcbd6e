package com.ram.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.ram.script.RamKeywordException;
import com.ram.script.RamSyntaxException;

/**
 * A single statement line and its token form.
 *
 * <pre>
 *   set integer var1 to 10 + 5   -> [set, integer, var1, to, [10, +, 5]]
 *   display 10 * 2               -> [display, [[10, *, 2]]]
 *   send back x + y              -> [send, back, [x, +, y]]
 * </pre>
 */
public final class Line implements SourceNode {
    private final SourceLine source;
    private final List<Token> tokens;
    private final String keyword;

    public Line(SourceLine source) {
        this.source = source;
        String[] words = words(source.text);
        if (words.length < 2) {
            throw new RamSyntaxException(source.text, source.number, "Error parsing.");
        }
        this.keyword = words[0];
        this.tokens = Collections.unmodifiableList(tokenize(words));
    }

    private List<Token> tokenize(String[] words) {
        int head;
        switch (keyword) {
            case Keywords.SET:
            case Keywords.RESET:
                head = 4;
                break;
            case Keywords.SEND:
                head = 2;
                break;
            case Keywords.DISPLAY:
            case Keywords.CALL:
                head = 1;
                break;
            default:
                throw new RamKeywordException(source.text, source.number, keyword);
        }

        List<Token> out = new ArrayList<>();
        for (int i = 0; i < Math.min(head, words.length); i++) {
            out.add(Token.word(words[i]));
        }
        List<Token> rest = new Lexer(rest(head), source.text, source.number).lexify();
        if (!rest.isEmpty()) out.add(Token.group(rest));
        return out;
    }

    /** Raw text after the first {@code n} whitespace-separated words, trimmed. */
    public String rest(int n) {
        String t = source.text;
        int i = 0;
        for (int w = 0; w < n; w++) {
            while (i < t.length() && Character.isWhitespace(t.charAt(i))) i++;
            if (i >= t.length()) return "";
            while (i < t.length() && !Character.isWhitespace(t.charAt(i))) i++;
        }
        return t.substring(i).trim();
    }

    static String[] words(String text) {
        String t = text.trim();
        return t.isEmpty() ? new String[0] : t.split("\\s+");
    }

    public String keyword() { return keyword; }

    public List<Token> tokens() { return tokens; }

    @Override
    public int number() { return source.number; }

    @Override
    public String text() { return source.text; }

    @Override
    public String toString() {
        return "Line(" + source + ")";
    }
}
