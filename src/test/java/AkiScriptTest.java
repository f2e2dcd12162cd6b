import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.aki.debug.Debug;
import com.aki.debug.DebugLevel;
import com.aki.script.AkiScript;
import com.aki.script.AkiSession;
import com.aki.script.parser.AkiRuntimeException;
import com.aki.script.parser.Ast.FunctionCall;
import com.aki.script.parser.Ast.Identifier;
import com.aki.script.parser.ErrorKind;
import com.aki.script.parser.ParseException;
import com.aki.script.parser.Value;

public class AkiScriptTest {

    @AfterEach
    void resetDebugSink() {
        Debug.get().setSink(null);
    }

    @Test
    void sessionKeepsBindingsAcrossEvals() {
        AkiSession s = new AkiScript().newSession();
        s.eval("let a = 2;");
        s.eval("func sq(x: i32) -> i32 { x * x }");
        assertEquals(Value.integer(4), s.eval("sq(a)"));
        assertEquals(List.of("a", "sq"), List.copyOf(s.globals().keySet()));
    }

    @Test
    void sessionSurvivesErrors() {
        AkiSession s = new AkiScript().newSession();
        s.eval("let a = 1;");
        assertThrows(ParseException.class, () -> s.eval("let = 3;"));
        assertThrows(AkiRuntimeException.class, () -> s.eval("let b = 5; a / 0"));
        assertEquals(Value.integer(6), s.eval("a + b"));
    }

    @Test
    void runsAreIsolated() {
        AkiScript es = new AkiScript();
        es.run("let leaked = 1;");
        AkiRuntimeException ex = assertThrows(AkiRuntimeException.class, () -> es.run("leaked"));
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, ex.getKind());
    }

    @Test
    void errorReporterSeesErrorBeforeRethrow() {
        List<String> seen = new ArrayList<>();
        AkiScript es = new AkiScript();
        es.setErrorReporter((e, phase, message) -> seen.add(phase + ":" + e.getClass().getSimpleName()));

        assertThrows(ParseException.class, () -> es.run("let x = ;"));
        assertThrows(AkiRuntimeException.class, () -> es.run("undefined_thing"));
        assertThrows(ParseException.class, () -> es.run("\"open"));

        assertEquals(List.of("parse:ParseException", "eval:AkiRuntimeException", "parse:ParseException"), seen);
    }

    @Test
    void defaultReporterLogsThroughDebug() {
        List<DebugLevel> levels = new ArrayList<>();
        List<String> tags = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (error != null) {
                levels.add(level);
                tags.add(tag);
            }
        });

        AkiScript es = new AkiScript();
        assertThrows(AkiRuntimeException.class, () -> es.run("1 / 0"));
        assertEquals(List.of(DebugLevel.WARN), levels);
        assertEquals(List.of("engine"), tags);
    }

    @Test
    void builtinCallParsing_compatibilityMode() {
        AkiScript es = new AkiScript();
        es.registerFunction("answer", args -> Value.integer(42));

        assertTrue(es.parse("answer").get(0) instanceof Identifier);
        assertEquals(ErrorKind.UNDEFINED_VARIABLE,
                assertThrows(AkiRuntimeException.class, () -> es.run("answer")).getKind());

        es.setBuiltinCallParsing(true);
        assertTrue(es.parse("answer").get(0) instanceof FunctionCall);
        assertEquals(Value.integer(42), es.run("answer"));
        assertEquals(Value.integer(43), es.run("answer + 1"));
    }

    @Test
    void initialEnvironmentIsVisible() {
        Value v = new AkiScript().run("limit * 2", java.util.Map.of("limit", Value.integer(21)));
        assertEquals(Value.integer(42), v);
    }

    @Test
    void tokenizeIsExposed() {
        assertEquals(4, new AkiScript().tokenize("a + b").size());
    }

    @Test
    void nullArgumentsRejected() {
        AkiScript es = new AkiScript();
        assertThrows(NullPointerException.class, () -> es.registerFunction(null, args -> Value.unit()));
        assertThrows(NullPointerException.class, () -> es.setAssignmentPolicy(null));
        assertThrows(IllegalArgumentException.class, () -> es.setMaxCallDepth(0));
    }
}
