package com.ram.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ram.script.RamOperatorException;
import com.ram.script.RamSyntaxException;

/**
 * Builds expression nodes from token sequences produced by {@link Lexer}.
 *
 * A multi-token sequence must alternate operand/operator; it is split at the
 * loosest-binding operator present ({@code is}, then {@code and}/{@code or},
 * then {@code + -}, then {@code * /}), at its last occurrence, so operators of
 * one tier associate to the left:
 * <pre>
 *   [5, +, 6, -, 2]          -> ((5 + 6) - 2)
 *   [x, is, [y, +, 1]]       -> (x is (y + 1))
 * </pre>
 */
public class ExpressionParser {

    private static final List<Set<String>> TIERS = List.of(
            Set.of(Keywords.IS),
            Keywords.BOOLEAN,
            Keywords.ADDITIVE,
            Keywords.MULTIPLICATIVE,
            Set.of(Keywords.NOT)
    );

    private final String line;
    private final int lineNumber;

    public ExpressionParser(String line, int lineNumber) {
        this.line = line;
        this.lineNumber = lineNumber;
    }

    public ExpressionParser() {
        this(null, 0);
    }

    /** Lexes and parses a piece of expression text. */
    public Expr.ExprInterface parseText(String text) {
        return parse(new Lexer(text, line == null ? text : line, lineNumber).lexify());
    }

    public Expr.ExprInterface parse(List<Token> values) {
        verifyOperators(values);

        if (values.isEmpty()) {
            return Expr.Empty.INSTANCE;
        }
        if (values.size() == 1) {
            Token only = values.get(0);
            return only.isGroup() ? parse(only.group) : single(only.lexeme);
        }
        return multiple(values);
    }

    /** Every odd position must hold a recognised operator and every even one an operand. */
    private void verifyOperators(List<Token> values) {
        for (int i = 0; i < values.size(); i++) {
            Token t = values.get(i);
            if (i % 2 == 1 && !t.isOperator()) {
                throw operatorError(t.toString());
            }
            if (i % 2 == 0 && t.isOperator()) {
                throw new RamSyntaxException(line, lineNumber, "Operand expected, found operator '" + t + "'.");
            }
        }
        if (values.size() > 1 && values.size() % 2 == 0) {
            throw new RamSyntaxException(line, lineNumber, "Expression ends with operator '" + values.get(values.size() - 1) + "'.");
        }
    }

    private Expr.ExprInterface multiple(List<Token> values) {
        int split = -1;
        String operator = null;
        for (Set<String> tier : TIERS) {
            for (int i = values.size() - 2; i >= 1; i -= 2) {
                if (values.get(i).isWordIn(tier)) {
                    split = i;
                    operator = values.get(i).lexeme;
                    break;
                }
            }
            if (split >= 0) break;
        }
        if (split < 0) {
            // unreachable after verifyOperators
            throw operatorError(values.get(1).toString());
        }

        Expr.ExprInterface left = parse(values.subList(0, split));
        Expr.ExprInterface right = parse(values.subList(split + 1, values.size()));

        if (Keywords.ARITHMETIC.contains(operator)) {
            return new Expr.Binary(left, operator, right);
        }
        if (Keywords.BOOLEAN.contains(operator)) {
            return new Expr.BoolOp(operator, List.of(left, right));
        }
        if (Keywords.IS.equals(operator)) {
            return new Expr.Equality(left, right);
        }
        // 'not' is reserved but has no binary form
        throw operatorError(operator);
    }

    /** Classifies a single word: number, boolean, string, call, input request, or name. */
    Expr.ExprInterface single(String value) {
        if (isDigits(value)) {
            return new Expr.NumberLiteral(Double.parseDouble(value));
        }
        if (Keywords.TRUE.equals(value) || Keywords.FALSE.equals(value)) {
            return new Expr.BoolLiteral(Keywords.TRUE.equals(value));
        }
        if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
            return new Expr.StringLiteral(value.substring(1, value.length() - 1));
        }
        int bracket = value.indexOf('[');
        if (bracket > 0 && value.endsWith("]")) {
            return call(value.substring(0, bracket), value.substring(bracket + 1, value.length() - 1));
        }
        if (Keywords.INPUT.equals(value)) {
            return new Expr.Input();
        }
        if (value.charAt(0) == '"') {
            throw new RamSyntaxException(line, lineNumber, "Unterminated string " + value + ".");
        }
        return new Expr.Variable(value);
    }

    private Expr.Call call(String name, String inner) {
        Map<String, Expr.ExprInterface> args = new LinkedHashMap<>();
        for (String part : splitArguments(inner)) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                throw new RamSyntaxException(line, lineNumber,
                        "Argument '" + part + "' of '" + name + "' must be written as name=value.");
            }
            String argName = part.substring(0, eq).trim();
            if (args.containsKey(argName)) {
                throw new RamSyntaxException(line, lineNumber, "Argument '" + argName + "' given twice.");
            }
            args.put(argName, parseText(part.substring(eq + 1)));
        }
        return new Expr.Call(name, args);
    }

    /** Splits on commas that are outside strings, parentheses and nested brackets. */
    static List<String> splitArguments(String inner) {
        List<String> parts = new ArrayList<>();
        if (inner.trim().isEmpty()) return parts;
        StringBuilder cur = new StringBuilder();
        boolean inString = false;
        int depth = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '"') inString = !inString;
            else if (!inString && (c == '[' || c == '(')) depth++;
            else if (!inString && (c == ']' || c == ')')) depth--;

            if (c == ',' && !inString && depth == 0) {
                parts.add(cur.toString().trim());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        parts.add(cur.toString().trim());
        return parts;
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    private RamOperatorException operatorError(String foreign) {
        return line == null ? new RamOperatorException(foreign) : new RamOperatorException(line, lineNumber, foreign);
    }
}
