import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.aki.script.AkiConfig;
import com.aki.script.AkiScript;
import com.aki.script.AkiScript.AssignmentPolicy;
import com.aki.script.AkiScript.EntryPointPolicy;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;

public class AkiConfigTest {

    @Test
    void classpathDefaults() {
        AkiConfig c = AkiConfig.defaults();
        assertEquals(256, c.getMaxCallDepth());
        assertEquals(AssignmentPolicy.DEFINE_LOCAL, c.getAssignmentPolicy());
        assertEquals(EntryPointPolicy.AUTO_INVOKE_MAIN, c.getEntryPoint());
        assertFalse(c.isBuiltinCallParsing());
    }

    @Test
    void partialFile_overlaysDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("aki.json");
        Files.writeString(file, "{ \"assignmentPolicy\": \"MUTATE_ENCLOSING\", \"maxCallDepth\": 32 }",
                StandardCharsets.UTF_8);

        AkiConfig c = AkiConfig.load(file);
        assertEquals(32, c.getMaxCallDepth());
        assertEquals(AssignmentPolicy.MUTATE_ENCLOSING, c.getAssignmentPolicy());
        assertEquals(EntryPointPolicy.AUTO_INVOKE_MAIN, c.getEntryPoint());
    }

    @Test
    void unknownKey_isRejected() {
        assertThrows(UnrecognizedPropertyException.class, () -> AkiConfig.parse("{ \"maxDepth\": 3 }"));
    }

    @Test
    void badEnumValue_isRejected() {
        assertThrows(IOException.class, () -> AkiConfig.parse("{ \"entryPoint\": \"SOMETIMES\" }"));
    }

    @Test
    void appliesToEngine() throws IOException {
        AkiConfig c = AkiConfig.parse("{ \"entryPoint\": \"NONE\", \"builtinCallParsing\": true, \"maxCallDepth\": 8 }");
        AkiScript es = new AkiScript(c);
        assertEquals(EntryPointPolicy.NONE, es.getEntryPointPolicy());
        assertTrue(es.isBuiltinCallParsing());
        assertEquals(8, es.getMaxCallDepth());
    }

    @Test
    void nonPositiveDepth_isRejectedByEngine() throws IOException {
        AkiConfig c = AkiConfig.parse("{ \"maxCallDepth\": 0 }");
        assertThrows(IllegalArgumentException.class, () -> new AkiScript(c));
    }
}
