package com.ram.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitAssignStmt(Assign stmt);
        void visitDisplayStmt(Display stmt);
        void visitIfStmt(If stmt);
        void visitLoopStmt(Loop stmt);
        void visitFunctionStmt(FunctionDef stmt);
        void visitExprStmt(ExprStmt stmt);
    }

    /** {@code set|reset <type> <target> to <value>}. The declared type is advisory. */
    public static final class Assign implements Stmt {
        public final String declaredType;
        public final String target;
        public final Expr.ExprInterface value;

        public Assign(String declaredType, String target, Expr.ExprInterface value) {
            this.declaredType = declaredType;
            this.target = target;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitAssignStmt(this); }

        @Override
        public String toString() { return target + " = " + value; }
    }

    public static final class Display implements Stmt {
        public final Expr.ExprInterface argument;

        public Display(Expr.ExprInterface argument) { this.argument = argument; }

        public void accept(StmtVisitor visitor) { visitor.visitDisplayStmt(this); }

        @Override
        public String toString() { return "display " + argument; }
    }

    /** One {@code if} / {@code else if} arm. */
    public static final class Branch {
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        public Branch(Expr.ExprInterface condition, List<Stmt> body) {
            this.condition = condition;
            this.body = Collections.unmodifiableList(new ArrayList<>(body));
        }
    }

    /** Ordered branches, first true condition wins; otherwise {@code orElse} runs. */
    public static final class If implements Stmt {
        public final List<Branch> branches;
        public final List<Stmt> orElse;

        public If(List<Branch> branches, List<Stmt> orElse) {
            this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
            this.orElse = Collections.unmodifiableList(new ArrayList<>(orElse));
        }

        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < branches.size(); i++) {
                Branch b = branches.get(i);
                sb.append(i == 0 ? "if " : " else if ").append(b.condition)
                  .append(" {").append(b.body.size()).append(" statements}");
            }
            if (!orElse.isEmpty()) sb.append(" else {").append(orElse.size()).append(" statements}");
            return sb.toString();
        }
    }

    /** Counts {@code target} from start to stop inclusive. */
    public static final class Loop implements Stmt {
        public final String target;
        public final Expr.ExprInterface start;
        public final Expr.ExprInterface stop;
        public final List<Stmt> body;

        public Loop(String target, Expr.ExprInterface start, Expr.ExprInterface stop, List<Stmt> body) {
            this.target = target;
            this.start = start;
            this.stop = stop;
            this.body = Collections.unmodifiableList(new ArrayList<>(body));
        }

        public void accept(StmtVisitor visitor) { visitor.visitLoopStmt(this); }

        @Override
        public String toString() {
            return "loop with " + target + " from " + start + " to " + stop + " {" + body.size() + " statements}";
        }
    }

    public static final class FunctionDef implements Stmt {
        public final String name;
        public final List<String> params;
        public final List<Stmt> body;
        public final Expr.ExprInterface returnExpr; // Expr.Empty when there is none

        public FunctionDef(String name, List<String> params, List<Stmt> body, Expr.ExprInterface returnExpr) {
            this.name = name;
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
            this.body = Collections.unmodifiableList(new ArrayList<>(body));
            this.returnExpr = returnExpr == null ? Expr.Empty.INSTANCE : returnExpr;
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }

        @Override
        public String toString() {
            return "new function " + name + " takes (" + String.join(",", params) + ") {"
                    + body.size() + " statements} send back " + returnExpr;
        }
    }

    /** Expression evaluated for its effect: {@code call f[...]}, stray {@code send back}. */
    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }

        @Override
        public String toString() { return expression.toString(); }
    }
}
