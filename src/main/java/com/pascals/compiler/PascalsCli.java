package com.pascals.compiler;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.pascals.compiler.automaton.DfaConfig;
import com.pascals.compiler.automaton.DfaConfigLoader;
import com.pascals.compiler.error.CompilerException;
import com.pascals.compiler.util.ErrorContext;
import com.pascals.compiler.util.JsonReports;
import com.pascals.debug.Debug;
import com.pascals.debug.DebugLevel;
import com.pascals.debug.DebugSink;

/**
 * Command line driver.
 *
 * <pre>
 *   PascalsCli &lt;file.pas&gt; [--tokens|--ast|--symbols|--decorated] [--verbose] [--config &lt;dfa.json&gt;]
 * </pre>
 *
 * Exit codes: 0 ok, 1 compile error, 2 usage, 3 I/O, 4 internal error.
 */
public final class PascalsCli {
    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_INTERNAL = 4;

    private static final String TAG = "pascals.cli";
    private static final String USAGE =
            "Usage: PascalsCli <file.pas> [--tokens|--ast|--symbols|--decorated] [--verbose] [--config <dfa.json>]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        String file = null;
        String mode = null;
        String configPath = null;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--tokens":
                case "--ast":
                case "--symbols":
                case "--decorated":
                    if (mode != null) return usage(err, "only one output mode may be given");
                    mode = a;
                    break;
                case "--verbose":
                    verbose = true;
                    break;
                case "--config":
                    if (i + 1 >= args.length) return usage(err, "--config needs a path");
                    configPath = args[++i];
                    break;
                default:
                    if (a.startsWith("--")) return usage(err, "unknown option " + a);
                    if (file != null) return usage(err, "more than one source file");
                    file = a;
            }
        }
        if (file == null) return usage(err, null);

        DebugSink previous = Debug.get().getSink();
        Debug.get().setSink(DebugSink.printing(err, verbose ? DebugLevel.TRACE : DebugLevel.WARN));
        try {
            return execute(Path.of(file), mode, configPath, out, err);
        } finally {
            Debug.get().setSink(previous);
        }
    }

    private static int execute(Path file, String mode, String configPath, PrintStream out, PrintStream err) {
        final String source;
        final DfaConfig config;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
            config = configPath == null ? DfaConfigLoader.loadDefault() : DfaConfigLoader.loadFile(Path.of(configPath));
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        } catch (CompilerException e) {
            err.println("Invalid DFA configuration: " + e.getMessage());
            return EXIT_COMPILE_ERROR;
        }

        try {
            PascalsFrontend frontend = new PascalsFrontend(config);
            Debug.get().i(TAG, "compiling " + file);

            if ("--tokens".equals(mode)) {
                out.println(JsonReports.pretty(JsonReports.tokens(frontend.tokenize(source))));
                return EXIT_OK;
            }
            if ("--ast".equals(mode)) {
                out.println(JsonReports.pretty(JsonReports.ast(frontend.parse(source))));
                return EXIT_OK;
            }

            AnalysisResult result = frontend.analyze(source);
            if ("--symbols".equals(mode)) {
                out.println(JsonReports.pretty(JsonReports.symbolTable(result.getSymbolTable())));
            } else if ("--decorated".equals(mode)) {
                out.println(JsonReports.pretty(JsonReports.decoratedAst(result.getProgram(), result.getDecorations())));
            } else {
                out.println("OK: program '" + result.getProgram().name + "', "
                        + result.getSymbolTable().getEntries().size() + " symbols");
            }
            return EXIT_OK;
        } catch (CompilerException e) {
            err.println(e.getClass().getSimpleName() + ": " + e.getMessage());
            ErrorContext.Location loc = ErrorContext.locate(source, e);
            if (loc != null) {
                err.println("at line " + loc.line + ", column " + loc.column);
                err.print(ErrorContext.format(source, loc));
            }
            return EXIT_COMPILE_ERROR;
        } catch (RuntimeException e) {
            err.println("Internal error:");
            e.printStackTrace(err);
            Debug.get().e(TAG, "internal error while compiling " + file, e);
            return EXIT_INTERNAL;
        }
    }

    private static int usage(PrintStream err, String problem) {
        if (problem != null) err.println(problem);
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private PascalsCli() {}
}
