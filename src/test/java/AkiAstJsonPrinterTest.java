import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.aki.script.AkiScript;
import com.aki.script.tooling.AstJsonPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

public class AkiAstJsonPrinterTest {

    private static ArrayNode json(String src) {
        return new AstJsonPrinter().toJson(new AkiScript().parse(src));
    }

    @Test
    void functionDeclShape() {
        ArrayNode program = json("func #own add(x: i32, y: Vec<f64>) -> i32 { x + 1 } add(1, [2.0]);");
        assertEquals(2, program.size());

        JsonNode decl = program.get(0);
        assertEquals("FunctionDecl", decl.get("node").asText());
        assertEquals("add", decl.get("name").asText());
        assertEquals("Vec<f64>", decl.get("params").get(1).get("type").asText());
        assertEquals("i32", decl.get("returnType").asText());
        assertEquals("own", decl.get("attributes").get(0).asText());
        assertFalse(decl.get("async").asBoolean());

        JsonNode body = decl.get("body").get("statements").get(0);
        assertEquals("BinaryOp", body.get("node").asText());
        assertEquals("+", body.get("op").asText());
        assertEquals(1, body.get("right").get("value").asInt());

        JsonNode call = program.get(1);
        assertEquals("FunctionCall", call.get("node").asText());
        assertEquals("VectorLiteral", call.get("args").get(1).get("node").asText());
        assertEquals(2.0, call.get("args").get(1).get("elements").get(0).get("value").asDouble(), 1e-9);
    }

    @Test
    void optionalChildrenAreNull() {
        ArrayNode program = json("let x; if a { 1 }");
        assertTrue(program.get(0).get("type").isNull());
        assertTrue(program.get(0).get("initializer").isNull());
        assertTrue(program.get(1).get("else").isNull());
    }

    @Test
    void printedTextIsValidJson() throws Exception {
        AkiScript es = new AkiScript();
        String text = new AstJsonPrinter().print(es.parse("let s = \"quote \\\" inside\"; s += \"!\";"));
        JsonNode parsed = new ObjectMapper().readTree(text);
        assertEquals("quote \" inside", parsed.get(0).get("initializer").get("value").asText());
        assertEquals("+=", parsed.get(1).get("op").asText());
    }
}
