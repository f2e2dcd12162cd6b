package com.aki.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.aki.debug.Debug;
import com.aki.debug.Slf4jDebugSink;
import com.aki.script.parser.AkiRuntimeException;
import com.aki.script.parser.ErrorKind;
import com.aki.script.parser.ParseException;
import com.aki.script.parser.Value;
import com.aki.script.tooling.AstJsonPrinter;

/**
 * Command line entry point.
 *
 *   AkiCli                          interactive REPL
 *   AkiCli script.aki               run a file, echoing results; exit 1 on error
 *   AkiCli --ast script.aki         print the parsed AST as JSON
 *   AkiCli --config opts.json ...   load engine options first
 */
public final class AkiCli {
    private static final String TAG = "cli";

    static final String PROMPT = "aki> ";

    public static void main(String[] args) {
        Debug.get().setSink(new Slf4jDebugSink());
        System.exit(run(args, System.in, System.out, System.err));
    }

    /** Returns the process exit code: 0 ok, 1 script error, 2 usage, 3 I/O. */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Path configPath = null;
        Path scriptPath = null;
        boolean ast = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals("--config")) {
                if (++i >= args.length) return usage(err);
                configPath = Path.of(args[i]);
            } else if (a.equals("--ast")) {
                ast = true;
            } else if (a.startsWith("--") || scriptPath != null) {
                return usage(err);
            } else {
                scriptPath = Path.of(a);
            }
        }
        if (ast && scriptPath == null) return usage(err);

        final AkiScript engine;
        try {
            engine = (configPath == null) ? new AkiScript() : new AkiScript(AkiConfig.load(configPath));
        } catch (IOException e) {
            err.println("Failed to load config " + configPath + ": " + e.getMessage());
            return 3;
        }
        engine.setOut(out);

        BufferedReader stdin = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        registerReadLine(engine, stdin);

        if (scriptPath == null) {
            repl(engine, stdin, out);
            return 0;
        }

        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath + " (" + e.getMessage() + ")");
            return 3;
        }

        try {
            if (ast) {
                out.println(new AstJsonPrinter().print(engine.parse(script)));
            } else {
                engine.newSession().eval(script, value -> echo(out, value));
            }
            return 0;
        } catch (ParseException | AkiRuntimeException e) {
            err.println("Error: " + describe(e));
            return 1;
        }
    }

    static void repl(AkiScript engine, BufferedReader stdin, PrintStream out) {
        AkiSession session = engine.newSession();
        Debug.get().i(TAG, "REPL started");
        while (true) {
            out.print(PROMPT);
            out.flush();

            String line;
            try {
                line = stdin.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read input", e);
            }
            if (line == null) break;

            String input = line.trim();
            if (input.isEmpty()) continue;
            if (input.equals("exit") || input.equals("quit")) break;

            try {
                session.eval(input, value -> echo(out, value));
            } catch (ParseException | AkiRuntimeException e) {
                out.println("Error: " + describe(e));
            }
        }
        Debug.get().i(TAG, "REPL finished");
    }

    // Every non-Unit top-level result is shown, in the REPL and when running a file.
    private static void echo(PrintStream out, Value value) {
        if (!value.isUnit()) out.println("=> " + value);
    }

    private static String describe(RuntimeException e) {
        if (e instanceof AkiRuntimeException) {
            return ((AkiRuntimeException) e).getKind() + ": " + e.getMessage();
        }
        return e.getMessage();
    }

    // read_line() for interactive scripts; returns "" at end of input.
    private static void registerReadLine(AkiScript engine, BufferedReader stdin) {
        engine.registerFunction("read_line", (List<Value> args) -> {
            if (!args.isEmpty()) {
                throw new AkiRuntimeException(ErrorKind.ARITY_MISMATCH, "read_line() expects 0 arguments, got " + args.size());
            }
            try {
                String line = stdin.readLine();
                return Value.string(line == null ? "" : line);
            } catch (IOException ioe) {
                throw new UncheckedIOException("read_line() failed: " + ioe.getMessage(), ioe);
            }
        });
    }

    private static int usage(PrintStream err) {
        err.println("Usage: AkiCli [--config <options.json>] [--ast] [script-file]");
        return 2;
    }

    private AkiCli() {}
}
