import org.junit.jupiter.api.Test;

import com.ram.script.RamGeneralException;
import com.ram.script.RamKeywordException;
import com.ram.script.RamNameException;
import com.ram.script.RamOperatorEvaluateException;
import com.ram.script.RamOperatorException;
import com.ram.script.RamScript;
import com.ram.script.RamSyntaxException;
import com.ram.script.parser.Environment;
import com.ram.script.parser.Module;
import com.ram.script.parser.Value;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RamScriptTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private RamScript engine() {
        RamScript rs = new RamScript();
        rs.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        rs.setInput(new StringReader(""));
        return rs;
    }

    private String[] output() {
        String s = buffer.toString(StandardCharsets.UTF_8);
        return s.isEmpty() ? new String[0] : s.split("\\R");
    }

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Expected variable in env: " + name);
        return val;
    }

    @Test
    void assignmentAndArithmetic() {
        Map<String, Value> env = engine().run(String.join("\n",
                "set integer a to 4 + 2 * 7 - 1",
                "set integer b to (2 + 3) * 4",
                "set integer c to 10 - 3 - 2",
                "set integer d to 20 / 2 / 5",
                "reset integer a to a + 1"
        ));

        assertEquals(18.0, v(env, "a").asNumber(), 1e-9);
        assertEquals(20.0, v(env, "b").asNumber(), 1e-9);
        assertEquals(5.0, v(env, "c").asNumber(), 1e-9);
        assertEquals(2.0, v(env, "d").asNumber(), 1e-9);
    }

    @Test
    void display_formatsByType() {
        engine().run(String.join("\n",
                "set integer x to 10 + 5",
                "set text s to \"hello world\"",
                "set boolean b to true",
                "display x",
                "display s",
                "display b",
                "display \"a + (b\"",
                "display 1 is 2"
        ));

        assertArrayEquals(new String[] {"15.0", "hello world", "True", "a + (b", "False"}, output());
    }

    @Test
    void blankLinesAreIgnored() {
        engine().run("\n\nset integer x to 1\n\n\ndisplay x\n");
        assertArrayEquals(new String[] {"1.0"}, output());
    }

    @Test
    void stringComparison_isNotTakenAsOneLiteral() {
        Map<String, Value> env = engine().run("set boolean same to \"a\" is \"a\"");
        assertTrue(v(env, "same").asBool());
    }

    @Test
    void booleanChains() {
        Map<String, Value> env = engine().run(String.join("\n",
                "set boolean p to 1 is 1 and 2 is 3",
                "set boolean q to 1 is 1 or 2 is 3",
                "set boolean r to false or false or true"
        ));

        assertFalse(v(env, "p").asBool());
        assertTrue(v(env, "q").asBool());
        assertTrue(v(env, "r").asBool());
    }

    @Test
    void ifElseIfElse_firstTrueBranchOnly() {
        String src = String.join("\n",
                "set integer x to 2",
                "if (x) is (1) {",
                "    display \"one\"",
                "} else if (x) is (2) {",
                "    display \"two\"",
                "} else if (x) is (2) {",
                "    display \"again\"",
                "} else {",
                "    display \"other\"",
                "}",
                "display \"done\""
        );
        engine().run(src);
        assertArrayEquals(new String[] {"two", "done"}, output());
    }

    @Test
    void ifConditionMayCompareBraceText() {
        engine().run(String.join("\n",
                "set text s to \"{\"",
                "if (s) is (\"{\") {",
                "    display \"open\"",
                "} else if (s) is (\"}\") {",
                "    display \"close\"",
                "}"
        ));
        assertArrayEquals(new String[] {"open"}, output());
    }

    @Test
    void ifFallsThroughToElse() {
        engine().run(String.join("\n",
                "if (1) is (2) {",
                "    display \"yes\"",
                "} else {",
                "    display \"no\"",
                "}"
        ));
        assertArrayEquals(new String[] {"no"}, output());
    }

    @Test
    void loop_isInclusive_andSharesEnvironment() {
        Map<String, Value> env = engine().run(String.join("\n",
                "set integer total to 0",
                "loop with i from 1 to 4 {",
                "    reset integer total to total + i",
                "    display i",
                "}",
                "display total"
        ));

        assertArrayEquals(new String[] {"1", "2", "3", "4", "10.0"}, output());
        assertEquals(4.0, v(env, "i").asNumber(), 1e-9);
    }

    @Test
    void loop_emptyWhenStartAfterStop_andBoundsTruncate() {
        engine().run(String.join("\n",
                "loop with i from 3 to 1 {",
                "    display i",
                "}",
                "loop with j from 1 to 5 / 2 {",
                "    display j",
                "}"
        ));
        assertArrayEquals(new String[] {"1", "2"}, output());
    }

    @Test
    void nestedLoops() {
        engine().run(String.join("\n",
                "loop with i from 1 to 2 {",
                "    loop with j from 1 to 2 {",
                "        display i * j",
                "    }",
                "}"
        ));
        assertArrayEquals(new String[] {"1.0", "2.0", "2.0", "4.0"}, output());
    }

    @Test
    void functionCall_isolatesCallerVariables() {
        Map<String, Value> env = engine().run(String.join("\n",
                "new function add takes (x, y) {",
                "    set integer z to x + y",
                "    send back z",
                "}",
                "set integer r to add[x=10,y=5]",
                "display r"
        ));

        assertArrayEquals(new String[] {"15.0"}, output());
        assertNull(env.get("z"));
        assertNull(env.get("add"), "functions are not reported as variables");
    }

    @Test
    void function_cannotSeeCallerLocals() {
        RamScript rs = engine();
        RamNameException e = assertThrows(RamNameException.class, () -> rs.run(String.join("\n",
                "set integer secret to 7",
                "new function peek takes () {",
                "    send back secret",
                "}",
                "display peek[]"
        )));
        assertEquals("secret", e.name());
    }

    @Test
    void function_seesOtherFunctions_andArgsAreExpressions() {
        engine().run(String.join("\n",
                "new function square takes (n) {",
                "    send back n * n",
                "}",
                "new function sumSquares takes (a, b) {",
                "    set integer s to square[n=a] + square[n=b]",
                "    send back s",
                "}",
                "display sumSquares[a=1 + 2, b=4]"
        ));
        assertArrayEquals(new String[] {"25.0"}, output());
    }

    @Test
    void functionWithoutReturn_yieldsNone() {
        Map<String, Value> env = engine().run(String.join("\n",
                "new function greet takes (name) {",
                "    display name",
                "}",
                "call greet[name=\"Ada\"]",
                "set text r to greet[name=\"Bob\"]"
        ));
        assertArrayEquals(new String[] {"Ada", "Bob"}, output());
        assertEquals(Value.Type.NULL, v(env, "r").type);
    }

    @Test
    void runawayRecursion_hitsCallDepth() {
        RamScript rs = engine();
        rs.setMaxCallDepth(10);
        assertThrows(RamGeneralException.class, () -> rs.run(String.join("\n",
                "new function f takes (n) {",
                "    set integer m to f[n=n + 1]",
                "    send back m",
                "}",
                "call f[n=1]"
        )));
    }

    @Test
    void builtins_convertNumberAndGetText() {
        RamScript rs = engine();
        rs.setInput(new StringReader("Ada\n"));
        Map<String, Value> env = rs.run(String.join("\n",
                "set integer n to CONVERT_NUMBER[value=\"42\"] + 1",
                "set text name to GET_TEXT[prompt=\"Name? \"]",
                "display name"
        ));

        assertEquals(43.0, v(env, "n").asNumber(), 1e-9);
        assertArrayEquals(new String[] {"Name? Ada"}, output());
    }

    @Test
    void convertNumber_rejectsNonNumericText() {
        RamScript rs = engine();
        assertThrows(RamOperatorEvaluateException.class,
                () -> rs.run("set integer n to CONVERT_NUMBER[value=\"abc\"]"));
    }

    @Test
    void getInput_evaluatesTheLineRead() {
        RamScript rs = engine();
        rs.setInput(new StringReader("3 + 4\n"));
        Map<String, Value> env = rs.run("set integer x to GET_INPUT");
        assertEquals(7.0, v(env, "x").asNumber(), 1e-9);
    }

    @Test
    void registeredFunction_usesNamedArguments() {
        RamScript rs = engine();
        rs.registerFunction("twice", (it, args) -> Value.number(args.get("n").asNumber() * 2));
        Map<String, Value> env = rs.run("set integer x to twice[n=4]");
        assertEquals(8.0, v(env, "x").asNumber(), 1e-9);
    }

    @Test
    void initialEnvironment_isVisible() {
        Map<String, Value> env = engine().run("set integer y to x * 2", Map.of("x", Value.number(21)));
        assertEquals(42.0, v(env, "y").asNumber(), 1e-9);
    }

    @Test
    void module_evaluatesAgainstConfiguredInterpreter() {
        RamScript rs = engine();
        Module module = rs.parse("set integer x to 6 * 7\ndisplay x");

        Environment env = module.evaluate(rs.newInterpreter());

        assertEquals(42.0, env.get("x").asNumber(), 1e-9);
        assertTrue(env.get("CONVERT_NUMBER").isCallable());
        assertArrayEquals(new String[] {"42.0"}, output());
    }

    @Test
    void module_evaluatesWithDefaults() {
        Environment env = new RamScript().parse("set integer x to 1 + 1").evaluate();
        assertEquals(2.0, env.get("x").asNumber(), 1e-9);
    }

    // -------------------------
    // Errors
    // -------------------------

    @Test
    void undefinedVariable_isNameError() {
        RamScript rs = engine();
        RamNameException e = assertThrows(RamNameException.class, () -> rs.run("display y"));
        assertEquals("y", e.name());
    }

    @Test
    void callingAVariable_isNameError() {
        RamScript rs = engine();
        assertThrows(RamNameException.class, () -> rs.run("set integer x to 1\ncall x[a=1]"));
    }

    @Test
    void arithmeticOnText_isOperatorEvaluateError() {
        RamScript rs = engine();
        assertThrows(RamOperatorEvaluateException.class,
                () -> rs.run("set text s to \"a\"\nset integer x to s + 1"));
    }

    @Test
    void infiniteLoopBound_isOperatorEvaluateError() {
        RamScript rs = engine();
        String huge = "9".repeat(400);
        assertThrows(RamOperatorEvaluateException.class, () -> rs.run(String.join("\n",
                "loop with i from 1 to " + huge + " {",
                "    display i",
                "}")));
        assertEquals(0, output().length);
    }

    @Test
    void loopEndingAtLargestCounter_stops() {
        engine().run(String.join("\n",
                "loop with i from 9223372036854775807 to 10000000000000000000 {",
                "    display \"once\"",
                "}"));
        assertArrayEquals(new String[] {"once"}, output());
    }

    @Test
    void divisionByZero_isOperatorEvaluateError() {
        RamScript rs = engine();
        assertThrows(RamOperatorEvaluateException.class, () -> rs.run("set integer x to 1 / 0"));
    }

    @Test
    void nonNumericLoopBound_isOperatorEvaluateError() {
        RamScript rs = engine();
        assertThrows(RamOperatorEvaluateException.class, () -> rs.run(String.join("\n",
                "loop with i from \"a\" to 3 {",
                "    display i",
                "}"
        )));
    }

    @Test
    void missingTo_isKeywordError_withLineContext() {
        RamScript rs = engine();
        RamKeywordException e = assertThrows(RamKeywordException.class,
                () -> rs.run("display 1\n\nset integer x is 5"));
        assertEquals("is", e.foreign());
        assertEquals(2, e.lineNumber());
        assertEquals("set integer x is 5", e.line());
        assertEquals("Keyword 'is' invalid.", e.detail());
        assertTrue(e.getMessage().startsWith("Line 2: 'set integer x is 5'"));
    }

    @Test
    void unknownTypeOrKeyword_isKeywordError() {
        RamScript rs = engine();
        assertEquals("number",
                assertThrows(RamKeywordException.class, () -> rs.parse("set number x to 5")).foreign());
        assertEquals("print",
                assertThrows(RamKeywordException.class, () -> rs.parse("print x")).foreign());
        assertEquals("over",
                assertThrows(RamKeywordException.class, () -> rs.parse("loop over i from 1 to 3 {\n}")).foreign());
        assertEquals("while",
                assertThrows(RamKeywordException.class, () -> rs.parse("while x {\n}")).foreign());
    }

    @Test
    void malformedLines_areSyntaxErrors() {
        RamScript rs = engine();
        assertThrows(RamSyntaxException.class, () -> rs.parse("display"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("set integer x 5"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("set integer x to (1 + 2"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("set integer x to 1 +"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("new function f {\n}"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("}"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("loop with i from 1 to 2 {\ndisplay i"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("display b and"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("display and true"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("display true and and false"));
        assertThrows(RamSyntaxException.class, () -> rs.parse("display 1 + * + 2"));
    }

    @Test
    void unknownOperator_isOperatorError() {
        RamScript rs = engine();
        RamOperatorException e = assertThrows(RamOperatorException.class,
                () -> rs.parse("set integer x to 5 % 2"));
        assertEquals("%", e.foreign());
    }
}
