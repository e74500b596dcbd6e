package com.ram.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Expression node set. Nodes are immutable; {@code toString()} renders Ram
 * text that parses back to an equivalent node.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitEmptyExpr(Empty expr);
        R visitNumberExpr(NumberLiteral expr);
        R visitStringExpr(StringLiteral expr);
        R visitBoolExpr(BoolLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitCallExpr(Call expr);
        R visitInputExpr(Input expr);
        R visitBinaryExpr(Binary expr);
        R visitBoolOpExpr(BoolOp expr);
        R visitEqualityExpr(Equality expr);
    }

    // -------------------------
    // Leaves
    // -------------------------

    /** Missing expression; evaluates to the absent value. */
    public static final class Empty implements ExprInterface {
        public static final Empty INSTANCE = new Empty();

        private Empty() {}

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitEmptyExpr(this);
        }

        @Override
        public String toString() { return ""; }
    }

    public static final class NumberLiteral implements ExprInterface {
        public final double value;

        public NumberLiteral(double value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumberExpr(this);
        }

        @Override
        public String toString() {
            if (value >= 0 && value == Math.rint(value) && value < 1e18) return Long.toString((long) value);
            return Double.toString(value);
        }
    }

    public static final class StringLiteral implements ExprInterface {
        public final String value;

        public StringLiteral(String value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStringExpr(this);
        }

        @Override
        public String toString() { return '"' + value + '"'; }
    }

    public static final class BoolLiteral implements ExprInterface {
        public final boolean value;

        public BoolLiteral(boolean value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBoolExpr(this);
        }

        @Override
        public String toString() { return value ? Keywords.TRUE : Keywords.FALSE; }
    }

    public static final class Variable implements ExprInterface {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }

        @Override
        public String toString() { return name; }
    }

    /** {@code name[arg=expr,...]}: named-argument function call. */
    public static final class Call implements ExprInterface {
        public final String name;
        public final Map<String, ExprInterface> arguments; // declaration order

        public Call(String name, Map<String, ExprInterface> arguments) {
            this.name = name;
            this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public String toString() {
            StringJoiner sj = new StringJoiner(",", name + "[", "]");
            for (Map.Entry<String, ExprInterface> e : arguments.entrySet()) {
                sj.add(e.getKey() + "=" + e.getValue());
            }
            return sj.toString();
        }
    }

    /** Reads a line of input and evaluates it as an expression. */
    public static final class Input implements ExprInterface {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInputExpr(this);
        }

        @Override
        public String toString() { return Keywords.INPUT; }
    }

    // -------------------------
    // Operators
    // -------------------------

    /** Arithmetic: {@code + - * /}. */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final String operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, String operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public String toString() { return "(" + left + " " + operator + " " + right + ")"; }
    }

    /** {@code and}/{@code or} over two or more operands. */
    public static final class BoolOp implements ExprInterface {
        public final String operator;
        public final List<ExprInterface> operands;

        public BoolOp(String operator, List<ExprInterface> operands) {
            this.operator = operator;
            this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBoolOpExpr(this);
        }

        @Override
        public String toString() {
            StringJoiner sj = new StringJoiner(" " + operator + " ", "(", ")");
            for (ExprInterface e : operands) sj.add(e.toString());
            return sj.toString();
        }
    }

    /** {@code left is right}. */
    public static final class Equality implements ExprInterface {
        public final ExprInterface left;
        public final ExprInterface right;

        public Equality(ExprInterface left, ExprInterface right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitEqualityExpr(this);
        }

        @Override
        public String toString() { return "(" + left + " " + Keywords.IS + " " + right + ")"; }
    }
}
