package com.aki.script;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.aki.script.AkiScript.AssignmentPolicy;
import com.aki.script.AkiScript.EntryPointPolicy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Engine options, bound from JSON with Jackson.
 *
 * Defaults come from aki-defaults.json on the classpath; a user file only has
 * to name the keys it changes. Unknown keys are rejected.
 */
public class AkiConfig {

    static final String DEFAULTS_RESOURCE = "/aki-defaults.json";

    private static final ObjectMapper om = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private int maxCallDepth = 256;
    private AssignmentPolicy assignmentPolicy = AssignmentPolicy.DEFINE_LOCAL;
    private EntryPointPolicy entryPoint = EntryPointPolicy.AUTO_INVOKE_MAIN;
    private boolean builtinCallParsing = false;

    public static AkiConfig defaults() {
        AkiConfig config = new AkiConfig();
        try (InputStream in = AkiConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) return config;
            return om.readerForUpdating(config).readValue(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Defaults overlaid with the keys present in the given JSON file. */
    public static AkiConfig load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return om.readerForUpdating(defaults()).readValue(in);
        }
    }

    public static AkiConfig parse(String json) throws IOException {
        return om.readerForUpdating(defaults()).readValue(json);
    }

    public void applyTo(AkiScript engine) {
        engine.setMaxCallDepth(maxCallDepth);
        engine.setAssignmentPolicy(assignmentPolicy);
        engine.setEntryPointPolicy(entryPoint);
        engine.setBuiltinCallParsing(builtinCallParsing);
    }

    public int getMaxCallDepth() { return maxCallDepth; }
    public void setMaxCallDepth(int maxCallDepth) { this.maxCallDepth = maxCallDepth; }

    public AssignmentPolicy getAssignmentPolicy() { return assignmentPolicy; }
    public void setAssignmentPolicy(AssignmentPolicy assignmentPolicy) { this.assignmentPolicy = assignmentPolicy; }

    public EntryPointPolicy getEntryPoint() { return entryPoint; }
    public void setEntryPoint(EntryPointPolicy entryPoint) { this.entryPoint = entryPoint; }

    public boolean isBuiltinCallParsing() { return builtinCallParsing; }
    public void setBuiltinCallParsing(boolean builtinCallParsing) { this.builtinCallParsing = builtinCallParsing; }
}
