import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.aki.debug.Debug;
import com.aki.debug.DebugLevel;
import com.aki.script.AkiScript;
import com.aki.script.parser.AkiRuntimeException;
import com.aki.script.parser.ErrorKind;
import com.aki.script.parser.ParseException;
import com.aki.script.parser.Value;

// Nothing here installs a sink: the engine must work with the hub's default.
public class AkiDefaultDebugSinkTest {

    @Test
    void defaultSinkIsPresent() {
        assertNotNull(Debug.get().getSink());
        Debug.get().log(DebugLevel.WARN, "test", "dropped", null);
    }

    @Test
    void engineRunsWithoutInstalledSink() {
        assertEquals(Value.integer(3), new AkiScript().run("1 + 2"));
    }

    @Test
    void errorsStillSurfaceAsScriptExceptions() {
        AkiScript es = new AkiScript();
        AkiRuntimeException ex = assertThrows(AkiRuntimeException.class, () -> es.run("1 / 0"));
        assertEquals(ErrorKind.DIVISION_BY_ZERO, ex.getKind());
        assertThrows(ParseException.class, () -> es.run("let = 1;"));
    }
}
