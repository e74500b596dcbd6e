package com.ram.script.util;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ram.script.RamGeneralException;
import com.ram.script.parser.Expr;
import com.ram.script.parser.Expr.ExprInterface;
import com.ram.script.parser.Module;
import com.ram.script.parser.Statement;
import com.ram.script.parser.Statement.Stmt;
import com.ram.script.parser.Value;

/**
 * Jackson trees for parsed programs and environments.
 *
 * Every node is an object with a {@code "node"} discriminator, e.g.
 * <pre>
 *   {"node":"Assign","type":"integer","target":"x",
 *    "value":{"node":"Binary","op":"*","left":{"node":"Number","value":4.0},...}}
 * </pre>
 */
public final class AstJson {

    private static final ObjectMapper om = new ObjectMapper();

    private AstJson() {}

    public static ObjectNode toJson(Module module) {
        ObjectNode root = om.createObjectNode();
        root.put("node", "Module");
        root.set("body", statements(module.body));
        return root;
    }

    public static ObjectNode toJson(Stmt stmt) {
        StmtWriter w = new StmtWriter();
        stmt.accept(w);
        return w.result;
    }

    public static ObjectNode toJson(ExprInterface expr) {
        return expr.accept(EXPR);
    }

    /** Variables as {@code name -> value}; numbers stay numeric, absent becomes JSON null. */
    public static ObjectNode toJson(Map<String, Value> env) {
        ObjectNode out = om.createObjectNode();
        for (Map.Entry<String, Value> e : env.entrySet()) {
            Value v = e.getValue();
            switch (v.type) {
                case NUMBER:
                    if (v.isIntegral()) out.put(e.getKey(), (Long) v.value);
                    else out.put(e.getKey(), v.asNumber());
                    break;
                case BOOL:
                    out.put(e.getKey(), v.asBool());
                    break;
                case STRING:
                    out.put(e.getKey(), v.asString());
                    break;
                case FUNC:
                    out.put(e.getKey(), v.toString());
                    break;
                default:
                    out.putNull(e.getKey());
            }
        }
        return out;
    }

    public static String pretty(Object tree) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new RamGeneralException(e);
        }
    }

    private static ArrayNode statements(List<Stmt> body) {
        ArrayNode arr = om.createArrayNode();
        for (Stmt s : body) arr.add(toJson(s));
        return arr;
    }

    private static ObjectNode node(String kind) {
        ObjectNode n = om.createObjectNode();
        n.put("node", kind);
        return n;
    }

    // -------------------------
    // Statements
    // -------------------------

    private static final class StmtWriter implements Statement.StmtVisitor {
        ObjectNode result;

        @Override
        public void visitAssignStmt(Statement.Assign stmt) {
            result = node("Assign");
            result.put("type", stmt.declaredType);
            result.put("target", stmt.target);
            result.set("value", toJson(stmt.value));
        }

        @Override
        public void visitDisplayStmt(Statement.Display stmt) {
            result = node("Display");
            result.set("argument", toJson(stmt.argument));
        }

        @Override
        public void visitIfStmt(Statement.If stmt) {
            result = node("If");
            ArrayNode branches = result.putArray("branches");
            for (Statement.Branch b : stmt.branches) {
                ObjectNode bn = om.createObjectNode();
                bn.set("condition", toJson(b.condition));
                bn.set("body", statements(b.body));
                branches.add(bn);
            }
            result.set("else", statements(stmt.orElse));
        }

        @Override
        public void visitLoopStmt(Statement.Loop stmt) {
            result = node("Loop");
            result.put("target", stmt.target);
            result.set("start", toJson(stmt.start));
            result.set("stop", toJson(stmt.stop));
            result.set("body", statements(stmt.body));
        }

        @Override
        public void visitFunctionStmt(Statement.FunctionDef stmt) {
            result = node("Function");
            result.put("name", stmt.name);
            ArrayNode params = result.putArray("params");
            for (String p : stmt.params) params.add(p);
            result.set("body", statements(stmt.body));
            result.set("return", toJson(stmt.returnExpr));
        }

        @Override
        public void visitExprStmt(Statement.ExprStmt stmt) {
            result = node("Expression");
            result.set("expression", toJson(stmt.expression));
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    private static final Expr.ExprVisitor<ObjectNode> EXPR = new Expr.ExprVisitor<ObjectNode>() {
        @Override
        public ObjectNode visitEmptyExpr(Expr.Empty expr) {
            return node("Empty");
        }

        @Override
        public ObjectNode visitNumberExpr(Expr.NumberLiteral expr) {
            ObjectNode n = node("Number");
            n.put("value", expr.value);
            return n;
        }

        @Override
        public ObjectNode visitStringExpr(Expr.StringLiteral expr) {
            ObjectNode n = node("String");
            n.put("value", expr.value);
            return n;
        }

        @Override
        public ObjectNode visitBoolExpr(Expr.BoolLiteral expr) {
            ObjectNode n = node("Boolean");
            n.put("value", expr.value);
            return n;
        }

        @Override
        public ObjectNode visitVariableExpr(Expr.Variable expr) {
            ObjectNode n = node("Variable");
            n.put("name", expr.name);
            return n;
        }

        @Override
        public ObjectNode visitCallExpr(Expr.Call expr) {
            ObjectNode n = node("Call");
            n.put("name", expr.name);
            ObjectNode args = n.putObject("arguments");
            for (Map.Entry<String, ExprInterface> e : expr.arguments.entrySet()) {
                args.set(e.getKey(), toJson(e.getValue()));
            }
            return n;
        }

        @Override
        public ObjectNode visitInputExpr(Expr.Input expr) {
            return node("Input");
        }

        @Override
        public ObjectNode visitBinaryExpr(Expr.Binary expr) {
            ObjectNode n = node("Binary");
            n.put("op", expr.operator);
            n.set("left", toJson(expr.left));
            n.set("right", toJson(expr.right));
            return n;
        }

        @Override
        public ObjectNode visitBoolOpExpr(Expr.BoolOp expr) {
            ObjectNode n = node("BoolOp");
            n.put("op", expr.operator);
            ArrayNode operands = n.putArray("operands");
            for (ExprInterface e : expr.operands) operands.add(toJson(e));
            return n;
        }

        @Override
        public ObjectNode visitEqualityExpr(Expr.Equality expr) {
            ObjectNode n = node("Equality");
            n.set("left", toJson(expr.left));
            n.set("right", toJson(expr.right));
            return n;
        }
    };
}
