import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ram.script.RamScript;
import com.ram.script.parser.Module;
import com.ram.script.parser.Value;
import com.ram.script.util.AstJson;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonTest {

    @Test
    void moduleTree() {
        Module m = new RamScript().parse(String.join("\n",
                "set integer x to 2 * 3",
                "new function f takes (a) {",
                "    send back a",
                "}",
                "if (x) is (6) {",
                "    call f[a=x]",
                "}"));

        ObjectNode root = AstJson.toJson(m);
        assertEquals("Module", root.get("node").asText());

        JsonNode assign = root.get("body").get(0);
        assertEquals("Assign", assign.get("node").asText());
        assertEquals("integer", assign.get("type").asText());
        assertEquals("*", assign.get("value").get("op").asText());
        assertEquals(3.0, assign.get("value").get("right").get("value").asDouble(), 1e-9);

        JsonNode fn = root.get("body").get(1);
        assertEquals("Function", fn.get("node").asText());
        assertEquals("a", fn.get("params").get(0).asText());
        assertEquals("Variable", fn.get("return").get("node").asText());

        JsonNode cond = root.get("body").get(2);
        JsonNode call = cond.get("branches").get(0).get("body").get(0).get("expression");
        assertEquals("Call", call.get("node").asText());
        assertEquals("x", call.get("arguments").get("a").get("name").asText());
        assertEquals(0, cond.get("else").size());
    }

    @Test
    void environmentValues() {
        RamScript rs = new RamScript();
        rs.setOutput(new PrintStream(new ByteArrayOutputStream()));
        Map<String, Value> env = rs.run(String.join("\n",
                "set integer n to 1 + 1",
                "set text s to \"hi\"",
                "loop with i from 1 to 2 {",
                "}"));

        Map<String, Value> withNone = new LinkedHashMap<>(env);
        withNone.put("nothing", Value.nil());
        ObjectNode json = AstJson.toJson(withNone);

        assertEquals(2.0, json.get("n").asDouble(), 1e-9);
        assertEquals("hi", json.get("s").asText());
        assertTrue(json.get("i").isIntegralNumber());
        assertTrue(json.get("nothing").isNull());
    }

    @Test
    void prettyPrinting() {
        String text = AstJson.pretty(AstJson.toJson(new RamScript().parse("display \"x\"")));
        assertTrue(text.contains("\"node\" : \"Display\""));
        assertTrue(text.contains("\n"));
    }
}
