import org.junit.jupiter.api.Test;

import com.ram.script.RamOperatorException;
import com.ram.script.RamSyntaxException;
import com.ram.script.parser.Builtins;
import com.ram.script.parser.Environment;
import com.ram.script.parser.Expr;
import com.ram.script.parser.ExpressionParser;
import com.ram.script.parser.Interpreter;
import com.ram.script.parser.Token;
import com.ram.script.parser.Value;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser();

    private static Interpreter interpreter(Environment env) {
        return new Interpreter(env, new PrintStream(new ByteArrayOutputStream()), null, Interpreter.DEFAULT_MAX_DEPTH);
    }

    @Test
    void additiveChain_evaluatesLeftToRight() {
        Expr.ExprInterface e = parser.parse(Token.words("5", "+", "6", "-", "2"));
        assertEquals(9.0, interpreter(new Environment()).eval(e).asNumber(), 1e-9);
        assertEquals("((5 + 6) - 2)", e.toString());
    }

    @Test
    void splitsAtLoosestOperator() {
        assertEquals("((10 - 3) - 2)", parser.parseText("10 - 3 - 2").toString());
        assertEquals("((4 + (2 * 7)) - 1)", parser.parseText("4 + 2 * 7 - 1").toString());
        assertEquals("(x is (y + 1))", parser.parseText("x is y + 1").toString());
    }

    @Test
    void singleWordClassification() {
        assertTrue(parser.parseText("42") instanceof Expr.NumberLiteral);
        assertEquals(42.0, ((Expr.NumberLiteral) parser.parseText("42")).value, 1e-9);
        assertTrue(parser.parseText("true") instanceof Expr.BoolLiteral);
        assertEquals("x y", ((Expr.StringLiteral) parser.parseText("\"x y\"")).value);
        assertTrue(parser.parseText("GET_INPUT") instanceof Expr.Input);
        assertEquals("count", ((Expr.Variable) parser.parseText("count")).name);
        assertSame(Expr.Empty.INSTANCE, parser.parse(List.of()));
    }

    @Test
    void callWithNamedArguments() {
        Expr.Call call = (Expr.Call) parser.parseText("f[b=1 + 2, a=\"s, t\"]");
        assertEquals("f", call.name);
        assertEquals(List.of("b", "a"), List.copyOf(call.arguments.keySet()));
        assertEquals("(1 + 2)", call.arguments.get("b").toString());
        assertEquals("\"s, t\"", call.arguments.get("a").toString());
    }

    @Test
    void badCallArguments_areSyntaxErrors() {
        assertThrows(RamSyntaxException.class, () -> parser.parseText("f[1]"));
        assertThrows(RamSyntaxException.class, () -> parser.parseText("f[a=1, a=2]"));
    }

    @Test
    void nonOperatorInOperatorPosition() {
        RamOperatorException e = assertThrows(RamOperatorException.class,
                () -> parser.parse(Token.words("1", "%", "2")));
        assertEquals("%", e.foreign());
    }

    @Test
    void notHasNoBinaryForm() {
        assertThrows(RamOperatorException.class, () -> parser.parse(Token.words("a", "not", "b")));
    }

    @Test
    void danglingOperator_isSyntaxError() {
        assertThrows(RamSyntaxException.class, () -> parser.parse(Token.words("1", "+")));
    }

    @Test
    void operatorInOperandPosition_isSyntaxError() {
        assertThrows(RamSyntaxException.class, () -> parser.parse(Token.words("1", "+", "*", "+", "2")));
        assertThrows(RamSyntaxException.class, () -> parser.parse(Token.words("-", "3")));
        assertThrows(RamSyntaxException.class, () -> parser.parseText("1 + * + 2"));
    }

    @Test
    void renderedTextParsesBackToTheSameValue() {
        Environment env = new Environment();
        env.assign("x", Value.number(3));
        env.assign("y", Value.number(4));
        env.assign("f", Value.func(new Builtins.Builtin("f", (it, args) -> Value.number(args.get("a").asNumber() * 10))));
        Interpreter it = interpreter(env);

        String[] sources = {
                "4 + 2 * 7 - 1",
                "(2 + 3) * 4",
                "10 - 3 - 2",
                "x * (y + 1) / 2",
                "1 is 1 and x is 3",
                "true or false and false",
                "\"hi there\"",
                "f[a=x + 1] - y",
                ""
        };
        for (String src : sources) {
            Expr.ExprInterface first = parser.parseText(src);
            Expr.ExprInterface second = parser.parseText(first.toString());
            assertEquals(it.eval(first), it.eval(second), src);
            assertEquals(first.toString(), second.toString(), src);
        }
    }
}
