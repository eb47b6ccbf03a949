package com.forge.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.forge.debug.Debug;
import com.forge.debug.DebugLevel;
import com.forge.script.diagnostics.DiagnosticJson;
import com.forge.script.error.ForgeException;
import com.forge.script.host.StdHostIO;
import com.forge.script.parser.Value;

/**
 * {@code forge [--json] [--debug] [script-file]}
 *
 * With a file, runs it once: exit 0 on success, 1 on a lex, parse or runtime error, 2 on
 * bad usage and 3 when the file cannot be read. Without one, starts a REPL on stdin.
 */
public final class ForgeCli {
    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_READ = 3;

    private static final String USAGE = "Usage: forge [--json] [--debug] [script-file]";
    private static final String PROMPT = "> ";

    private final PrintStream out;
    private final PrintStream err;
    private boolean json = false;

    private ForgeCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        ForgeCli cli = new ForgeCli(out, err);
        String path = null;
        for (String arg : args) {
            if ("--json".equals(arg)) {
                cli.json = true;
            } else if ("--debug".equals(arg)) {
                Debug.get().setSink(Debug.streamSink(err, DebugLevel.DEBUG));
            } else if (arg.startsWith("--") || path != null) {
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                path = arg;
            }
        }

        BufferedReader stdin = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        ForgeScript engine = new ForgeScript();
        engine.setIO(new StdHostIO(stdin, new OutputStreamWriter(out, StandardCharsets.UTF_8)));

        if (path == null) return cli.repl(engine, stdin);
        return cli.script(engine, Path.of(path));
    }

    private int script(ForgeScript engine, Path scriptPath) {
        final String source;
        try {
            source = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath + " (" + e.getMessage() + ")");
            return EXIT_READ;
        }

        try {
            engine.run(source);
            return EXIT_OK;
        } catch (ForgeException e) {
            report(engine, e, source);
            return EXIT_ERROR;
        }
    }

    private int repl(ForgeScript engine, BufferedReader stdin) {
        ExecutionState state = engine.newState();
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line;
            try {
                line = stdin.readLine();
            } catch (IOException e) {
                err.println("Failed to read input: " + e.getMessage());
                return EXIT_READ;
            }
            if (line == null) {
                out.println();
                return EXIT_OK;
            }
            if (line.trim().isEmpty()) continue;

            try {
                Value result = engine.eval(line, state);
                if (result != null && !result.isNull()) out.println(result);
            } catch (ForgeException e) {
                // the unit is abandoned; the session keeps its state
                report(engine, e, line);
            }
        }
    }

    private void report(ForgeScript engine, ForgeException e, String source) {
        if (json) {
            err.println(DiagnosticJson.toJsonString(e, source));
        } else {
            err.print(engine.report(e, source));
        }
        err.flush();
    }
}
