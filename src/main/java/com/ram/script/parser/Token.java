package com.ram.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Element of a token sequence: either an atomic word (identifier, literal,
 * operator) or a nested group produced by parentheses or precedence grouping.
 */
public final class Token {
    public final String lexeme;       // null for groups
    public final List<Token> group;   // null for words

    private Token(String lexeme, List<Token> group) {
        this.lexeme = lexeme;
        this.group = group;
    }

    public static Token word(String lexeme) {
        return new Token(Objects.requireNonNull(lexeme), null);
    }

    public static Token group(List<Token> tokens) {
        return new Token(null, Collections.unmodifiableList(new ArrayList<>(tokens)));
    }

    public static List<Token> words(String... lexemes) {
        List<Token> out = new ArrayList<>(lexemes.length);
        for (String s : lexemes) out.add(word(s));
        return out;
    }

    public boolean isGroup() { return group != null; }

    public boolean isWord(String s) { return lexeme != null && lexeme.equals(s); }

    public boolean isWordIn(Set<String> set) { return lexeme != null && set.contains(lexeme); }

    public boolean isOperator() { return isWordIn(Keywords.OPERATORS); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return Objects.equals(lexeme, t.lexeme) && Objects.equals(group, t.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lexeme, group);
    }

    @Override
    public String toString() {
        return isGroup() ? group.toString() : lexeme;
    }
}
