package com.ram.script.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ram.debug.Debug;
import com.ram.script.RamException;
import com.ram.script.RamGeneralException;
import com.ram.script.RamNameException;
import com.ram.script.RamOperatorEvaluateException;
import com.ram.script.parser.Expr.ExprInterface;
import com.ram.script.parser.Expr.ExprVisitor;
import com.ram.script.parser.Statement.Stmt;
import com.ram.script.parser.Statement.StmtVisitor;

public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "Interpreter";

    public static final int DEFAULT_MAX_DEPTH = 64;

    Environment env;
    private final PrintStream out;
    private final BufferedReader in;
    private final int maxDepth;
    private int depth = 0;

    public Interpreter(Environment env, PrintStream out, BufferedReader in, int maxDepth) {
        this.env = env;
        this.out = out;
        this.in = in;
        this.maxDepth = maxDepth;
    }

    /** The environment currently in effect (the call environment while a function runs). */
    public Environment environment() {
        return env;
    }

    public PrintStream out() {
        return out;
    }

    public void execute(List<Stmt> statements) {
        for (Stmt s : statements) s.accept(this);
    }

    public Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    /** Calls a function record with evaluated named arguments, enforcing the depth limit. */
    public Value invoke(RamCallable fn, Map<String, Value> arguments) {
        if (depth >= maxDepth) {
            throw new RamGeneralException("Maximum call depth " + maxDepth + " exceeded calling '" + fn.name() + "'.");
        }
        depth++;
        try {
            return fn.call(this, arguments);
        } finally {
            depth--;
        }
    }

    /** Next input line, or null at end of input. */
    public String readLine() {
        if (in == null) return null;
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new RamGeneralException(e);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitAssignStmt(Statement.Assign stmt) {
        env.assign(stmt.target, eval(stmt.value));
    }

    @Override
    public void visitDisplayStmt(Statement.Display stmt) {
        out.println(eval(stmt.argument).toString());
    }

    @Override
    public void visitIfStmt(Statement.If stmt) {
        for (Statement.Branch branch : stmt.branches) {
            if (isTruthy(eval(branch.condition))) {
                execute(branch.body);
                return;
            }
        }
        execute(stmt.orElse);
    }

    @Override
    public void visitLoopStmt(Statement.Loop stmt) {
        long start = bound(eval(stmt.start), "start");
        long stop = bound(eval(stmt.stop), "stop");
        Debug.get().t(TAG, "loop " + stmt.target + " from " + start + " to " + stop);
        for (long i = start; i <= stop; i++) {
            env.assign(stmt.target, Value.integer(i));
            execute(stmt.body);
            if (i == Long.MAX_VALUE) break;
        }
    }

    private static long bound(Value v, String which) {
        if (!v.isNumber()) {
            throw new RamOperatorEvaluateException("Loop " + which + " must be a number, got " + v.typeName() + ".");
        }
        double d = v.asNumber();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new RamOperatorEvaluateException("Loop " + which + " must be finite, got " + v + ".");
        }
        return (long) d;
    }

    @Override
    public void visitFunctionStmt(Statement.FunctionDef stmt) {
        env.assign(stmt.name, Value.func(new UserFunction(stmt)));
    }

    @Override
    public void visitExprStmt(Statement.ExprStmt stmt) {
        eval(stmt.expression);
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitEmptyExpr(Expr.Empty expr) {
        return Value.nil();
    }

    @Override
    public Value visitNumberExpr(Expr.NumberLiteral expr) {
        return Value.number(expr.value);
    }

    @Override
    public Value visitStringExpr(Expr.StringLiteral expr) {
        return Value.string(expr.value);
    }

    @Override
    public Value visitBoolExpr(Expr.BoolLiteral expr) {
        return Value.bool(expr.value);
    }

    /** A bare name bound to a function calls it with no arguments. */
    @Override
    public Value visitVariableExpr(Expr.Variable expr) {
        Value v = env.get(expr.name);
        if (v.isCallable()) return invoke(v.asFunc(), new LinkedHashMap<>());
        return v;
    }

    @Override
    public Value visitCallExpr(Expr.Call expr) {
        Value callee = env.get(expr.name);
        if (!callee.isCallable()) throw RamNameException.notCallable(expr.name);

        // arguments are evaluated in the caller's environment
        Map<String, Value> args = new LinkedHashMap<>();
        for (Map.Entry<String, ExprInterface> e : expr.arguments.entrySet()) {
            args.put(e.getKey(), eval(e.getValue()));
        }
        return invoke(callee.asFunc(), args);
    }

    @Override
    public Value visitInputExpr(Expr.Input expr) {
        String line = readLine();
        if (line == null || line.trim().isEmpty()) return Value.nil();
        return eval(new ExpressionParser().parseText(line.trim()));
    }

    @Override
    public Value visitBinaryExpr(Expr.Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        if (!left.isNumber() || !right.isNumber()) {
            throw new RamOperatorEvaluateException(left.typeName(), expr.operator, right.typeName());
        }
        double l = left.asNumber();
        double r = right.asNumber();
        switch (expr.operator) {
            case "+": return Value.number(l + r);
            case "-": return Value.number(l - r);
            case "*": return Value.number(l * r);
            case "/":
                if (r == 0) throw new RamOperatorEvaluateException("Division by zero.");
                return Value.number(l / r);
            default:
                throw new RamOperatorEvaluateException(left.typeName(), expr.operator, right.typeName());
        }
    }

    /** Every operand is evaluated; there is no short circuit. */
    @Override
    public Value visitBoolOpExpr(Expr.BoolOp expr) {
        boolean and = Keywords.AND.equals(expr.operator);
        boolean result = and;
        for (ExprInterface operand : expr.operands) {
            boolean b = isTruthy(eval(operand));
            result = and ? (result && b) : (result || b);
        }
        return Value.bool(result);
    }

    @Override
    public Value visitEqualityExpr(Expr.Equality expr) {
        return Value.bool(isEqual(eval(expr.left), eval(expr.right)));
    }

    // -------------------------
    // Helpers
    // -------------------------

    static boolean isTruthy(Value v) {
        switch (v.type) {
            case BOOL:   return v.asBool();
            case NUMBER: return v.asNumber() != 0;
            case STRING: return !v.asString().isEmpty();
            case FUNC:   return true;
            default:     return false;
        }
    }

    static boolean isEqual(Value a, Value b) {
        return a.equals(b);
    }

    /** Runs a statement list, rewrapping unclassified failures. */
    public void run(List<Stmt> statements) {
        try {
            execute(statements);
        } catch (RamException e) {
            Debug.get().e(TAG, e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "unclassified failure", e);
            throw new RamGeneralException(e);
        } catch (StackOverflowError e) {
            throw new RamGeneralException("Nesting too deep to evaluate.");
        }
    }
}
