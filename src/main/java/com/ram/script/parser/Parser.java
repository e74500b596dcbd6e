package com.ram.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.ram.debug.Debug;
import com.ram.script.RamKeywordException;
import com.ram.script.RamSyntaxException;
import com.ram.script.parser.Statement.Stmt;

/**
 * Turns structured {@link Line}s and {@link Block}s into statement nodes.
 *
 * <pre>
 *   set integer x to 4 * 3                     Assign
 *   display x                                  Display
 *   call f[a=1]                                ExprStmt
 *   loop with i from 1 to 3 { ... }            Loop
 *   if (x) is (1) { ... } else { ... }         If
 *   new function f takes (a,b) { ... }         FunctionDef
 * </pre>
 */
public class Parser {
    private static final String TAG = "Parser";

    public List<Stmt> parse(List<SourceNode> nodes) {
        List<Stmt> out = new ArrayList<>(nodes.size());
        for (SourceNode node : nodes) out.add(parseNode(node));
        return out;
    }

    public Stmt parseNode(SourceNode node) {
        if (node instanceof Line) return parseLine((Line) node);
        if (node instanceof LoopBlock) return parseLoop((LoopBlock) node);
        if (node instanceof IfBlock) return parseIf((IfBlock) node);
        if (node instanceof FunctionBlock) return parseFunction((FunctionBlock) node);
        // a Marker outside an if-block body
        throw new RamSyntaxException(node.text(), node.number(), "'else' without a matching 'if'.");
    }

    // -------------------------
    // Lines
    // -------------------------

    public Stmt parseLine(Line line) {
        switch (line.keyword()) {
            case Keywords.SET:
            case Keywords.RESET:
                return parseAssign(line);
            case Keywords.DISPLAY:
                return parseDisplay(line);
            case Keywords.SEND:
                // only meaningful as the last line of a function body
                return new Statement.ExprStmt(parseReturn(line));
            case Keywords.CALL:
                return new Statement.ExprStmt(expressions(line).parse(line.tokens().subList(1, line.tokens().size())));
            default:
                throw new RamKeywordException(line.text(), line.number(), line.keyword());
        }
    }

    private Stmt parseAssign(Line line) {
        List<Token> tokens = line.tokens();
        String varType = tokens.get(1).toString();
        if (!Keywords.VAR_TYPES.contains(varType)) {
            throw new RamKeywordException(line.text(), line.number(), varType);
        }
        if (tokens.size() < 5) {
            throw new RamSyntaxException(line.text(), line.number(), "Assignment needs a name, 'to' and a value.");
        }
        if (!tokens.get(3).isWord(Keywords.TO)) {
            throw new RamKeywordException(line.text(), line.number(), tokens.get(3).toString());
        }
        String target = tokens.get(2).toString();
        String rest = line.rest(4);
        Expr.ExprInterface value = isQuoted(rest)
                ? quoted(line, rest)
                : expressions(line).parse(tokens.subList(4, tokens.size()));
        return new Statement.Assign(varType, target, value);
    }

    private Stmt parseDisplay(Line line) {
        String rest = line.rest(1);
        if (isQuoted(rest)) {
            return new Statement.Display(quoted(line, rest));
        }
        return new Statement.Display(expressions(line).parse(line.tokens().subList(1, line.tokens().size())));
    }

    /** True when the remainder is a quoted string with nothing after its closing quote, or is never closed. */
    static boolean isQuoted(String rest) {
        if (!rest.startsWith("\"")) return false;
        int close = rest.indexOf('"', 1);
        return close < 0 || close == rest.length() - 1;
    }

    /** The remainder is taken verbatim as one string literal. */
    private Expr.ExprInterface quoted(Line line, String rest) {
        if (rest.length() < 2 || !rest.endsWith("\"")) {
            throw new RamSyntaxException(line.text(), line.number(), "Unterminated string.");
        }
        return new Expr.StringLiteral(rest.substring(1, rest.length() - 1));
    }

    /** {@code send back <expr>}: exactly three tokens. */
    public Expr.ExprInterface parseReturn(Line line) {
        List<Token> tokens = line.tokens();
        if (tokens.size() != 3) {
            throw new RamSyntaxException(line.text(), line.number(), "Return statement not parseable.");
        }
        if (!tokens.get(0).isWord(Keywords.SEND)) {
            throw new RamKeywordException(line.text(), line.number(), tokens.get(0).toString());
        }
        if (!tokens.get(1).isWord(Keywords.BACK)) {
            throw new RamKeywordException(line.text(), line.number(), tokens.get(1).toString());
        }
        return expressions(line).parse(tokens.subList(2, 3));
    }

    // -------------------------
    // Blocks
    // -------------------------

    /** {@code loop with <var> from <start> to <stop>} */
    public Stmt parseLoop(LoopBlock block) {
        String[] w = block.headerWords();
        if (w.length < 7) {
            throw new RamSyntaxException(block.header(), block.number(), "Loop header cannot be parsed.");
        }
        if (!Keywords.WITH.equals(w[1])) {
            throw new RamKeywordException(block.header(), block.number(), w[1]);
        }
        if (!Keywords.FROM.equals(w[3])) {
            throw new RamKeywordException(block.header(), block.number(), w[3]);
        }
        int to = -1;
        for (int i = 5; i < w.length - 1; i++) {
            if (Keywords.TO.equals(w[i])) { to = i; break; }
        }
        if (to < 0) {
            throw new RamKeywordException(block.header(), block.number(), w[5]);
        }

        ExpressionParser exprs = new ExpressionParser(block.header(), block.number());
        Expr.ExprInterface start = exprs.parseText(join(w, 4, to));
        Expr.ExprInterface stop = exprs.parseText(join(w, to + 1, w.length));
        return new Statement.Loop(w[2], start, stop, parse(block.children()));
    }

    /**
     * {@code if <left> is <right>} with optional {@code } else if ... {} and
     * {@code } else {} markers. Else-if arms are flattened into one branch list.
     */
    public Stmt parseIf(IfBlock block) {
        Expr.ExprInterface condition = condition(block);
        List<SourceNode> children = block.children();

        List<Stmt> body = new ArrayList<>();
        int i = 0;
        while (i < children.size() && !(children.get(i) instanceof Marker)) {
            body.add(parseNode(children.get(i)));
            i++;
        }

        List<Statement.Branch> branches = new ArrayList<>();
        branches.add(new Statement.Branch(condition, body));
        if (i == children.size()) {
            return new Statement.If(branches, List.of());
        }

        Marker marker = (Marker) children.get(i);
        String[] words = Line.words(marker.text());
        if (words.length < 3 || !"}".equals(words[0])) {
            throw new RamSyntaxException(marker.text(), marker.number(), "Else line cannot be parsed.");
        }
        if (!Keywords.ELSE.equals(words[1])) {
            throw new RamKeywordException(marker.text(), marker.number(), words[1]);
        }
        List<SourceNode> remaining = children.subList(i + 1, children.size());

        if (Keywords.IF.equals(words[2])) {
            String rewritten = marker.text().substring(marker.text().indexOf(Keywords.IF));
            IfBlock elseIf = new IfBlock(new SourceLine(rewritten, marker.number()), new ArrayList<>(remaining));
            Statement.If rest = (Statement.If) parseIf(elseIf);
            branches.addAll(rest.branches);
            return new Statement.If(branches, rest.orElse);
        }
        if (!"{".equals(words[2])) {
            throw new RamKeywordException(marker.text(), marker.number(), words[2]);
        }

        List<Stmt> orElse = new ArrayList<>();
        for (SourceNode node : remaining) {
            if (node instanceof Marker) {
                throw new RamSyntaxException(node.text(), node.number(), "'else' must be the last branch.");
            }
            orElse.add(parseNode(node));
        }
        return new Statement.If(branches, orElse);
    }

    /** Splits the header at a top-level {@code is}; each side is lexed on its own. */
    private Expr.ExprInterface condition(IfBlock block) {
        String[] w = block.headerWords();
        if (!Keywords.IF.equals(w[0])) {
            throw new RamKeywordException(block.header(), block.number(), w[0]);
        }
        String text = block.header().substring(Keywords.IF.length()).trim();
        if (text.isEmpty()) {
            throw new RamSyntaxException(block.header(), block.number(), "Condition missing.");
        }

        int is = indexOfIs(text);
        ExpressionParser exprs = new ExpressionParser(block.header(), block.number());
        if (is < 0) {
            return exprs.parseText(text);
        }
        List<Token> left = new Lexer(text.substring(0, is), block.header(), block.number()).lexify();
        List<Token> right = new Lexer(text.substring(is + Keywords.IS.length()), block.header(), block.number()).lexify();
        if (left.isEmpty() || right.isEmpty()) {
            throw new RamSyntaxException(block.header(), block.number(), "Both sides of 'is' are required.");
        }
        return exprs.parse(Arrays.asList(Token.group(left), Token.word(Keywords.IS), Token.group(right)));
    }

    /** Index of the first whole-word {@code is} outside brackets and strings, or -1. */
    static int indexOfIs(String text) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') inString = !inString;
            else if (!inString && (c == '(' || c == '[')) depth++;
            else if (!inString && (c == ')' || c == ']')) depth--;
            else if (!inString && depth == 0 && text.startsWith(Keywords.IS, i)
                    && (i == 0 || Character.isWhitespace(text.charAt(i - 1)) || text.charAt(i - 1) == ')')
                    && (i + 2 == text.length() || Character.isWhitespace(text.charAt(i + 2)) || text.charAt(i + 2) == '(')) {
                return i;
            }
        }
        return -1;
    }

    /** {@code new function <name> takes (<p1>,<p2>,...)} */
    public Stmt parseFunction(FunctionBlock block) {
        String[] w = block.headerWords();
        if (w.length < 5) {
            throw new RamSyntaxException(block.header(), block.number(), "Function header cannot be parsed.");
        }
        if (!Keywords.FUNCTION.equals(w[1])) {
            throw new RamKeywordException(block.header(), block.number(), w[1]);
        }
        if (!Keywords.TAKES.equals(w[3])) {
            throw new RamKeywordException(block.header(), block.number(), w[3]);
        }
        String paramText = join(w, 4, w.length).replace(" ", "");
        if (!paramText.startsWith("(") || !paramText.endsWith(")")) {
            throw new RamSyntaxException(block.header(), block.number(), "Parameters must be written as (a,b,...).");
        }
        List<String> params = new ArrayList<>();
        for (String p : paramText.substring(1, paramText.length() - 1).split(",")) {
            if (!p.isEmpty()) params.add(p);
        }

        List<SourceNode> children = block.children();
        Expr.ExprInterface returnExpr = Expr.Empty.INSTANCE;
        if (!children.isEmpty()) {
            SourceNode last = children.get(children.size() - 1);
            if (last instanceof Line && Keywords.SEND.equals(((Line) last).keyword())) {
                returnExpr = parseReturn((Line) last);
                children = children.subList(0, children.size() - 1);
            }
        }

        String name = w[2];
        Debug.get().t(TAG, "function " + name + params + " at line " + block.number());
        return new Statement.FunctionDef(name, params, parse(children), returnExpr);
    }

    private static ExpressionParser expressions(Line line) {
        return new ExpressionParser(line.text(), line.number());
    }

    private static String join(String[] words, int from, int to) {
        return String.join(" ", Arrays.copyOfRange(words, from, to));
    }
}
