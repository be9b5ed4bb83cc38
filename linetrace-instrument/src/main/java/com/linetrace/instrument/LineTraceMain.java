package com.linetrace.instrument;

import com.linetrace.instrument.link.CompanionSource;
import com.linetrace.instrument.rewrite.DefinitionParser;
import com.linetrace.instrument.rewrite.Instrumenter;
import com.linetrace.instrument.rewrite.ParsedDefinition;
import com.linetrace.instrument.source.SourceLocator;
import com.linetrace.instrument.source.SourceNormalizer;
import com.linetrace.instrument.source.SourceSnippet;
import com.linetrace.runtime.TraceDocument;
import com.linetrace.runtime.TraceEntry;
import com.linetrace.runtime.TraceReader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry point.
 *
 * Usage:
 *   java -jar linetrace-instrument.jar instrument \
 *     --source <File.java> --method <name> [--output <dir>] [--unsupported fail|pass]
 *   java -jar linetrace-instrument.jar inspect --trace <record_*.json>
 */
public class LineTraceMain {

    private static final String USAGE =
        "Usage: java -jar linetrace-instrument.jar instrument --source <File.java> --method <name> "
        + "[--output <dir>] [--unsupported fail|pass]\n"
        + "       java -jar linetrace-instrument.jar inspect --trace <record_*.json>";

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[linetrace] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[linetrace] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        switch (args[0]) {
            case "instrument" -> instrument(args, out);
            case "inspect"    -> inspect(args, out);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    // -----------------------------------------------------------------------
    // instrument
    // -----------------------------------------------------------------------

    private static void instrument(String[] args, PrintStream out) {
        String source = null;
        String method = null;
        String output = null;
        UnsupportedConstructPolicy policy = UnsupportedConstructPolicy.FAIL;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source"      -> source = requireNext(args, i++, "--source");
                case "--method"      -> method = requireNext(args, i++, "--method");
                case "--output"      -> output = requireNext(args, i++, "--output");
                case "--unsupported" -> policy = parsePolicy(requireNext(args, i++, "--unsupported"));
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (source == null) throw new UsageException("--source is required");
        if (method == null) throw new UsageException("--method is required");

        Path sourceFile = Paths.get(source);
        SourceSnippet snippet = new SourceLocator(List.of()).locate(sourceFile, method);
        ParsedDefinition parsed = new DefinitionParser().parse(SourceNormalizer.stripIndent(snippet.text()));
        ParsedDefinition instrumented = new Instrumenter(policy).instrument(parsed, snippet.members());

        String companionName = CompanionSource.fixedName(snippet.ownerFlatName());
        String companion = CompanionSource.render(snippet, companionName, instrumented.method());

        if (output == null) {
            out.print(companion);
            return;
        }
        Path outputDir = Paths.get(output);
        Path target = outputDir.resolve(snippet.packageName().replace('.', '/')).resolve(companionName + ".java");
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, companion, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Could not write " + target + ": " + e.getMessage(), e);
        }
        System.err.println("[linetrace] Instrumented " + snippet.ownerCanonicalName() + "." + method
            + " written: " + target);
    }

    private static UnsupportedConstructPolicy parsePolicy(String value) {
        return switch (value) {
            case "fail" -> UnsupportedConstructPolicy.FAIL;
            case "pass" -> UnsupportedConstructPolicy.PASS_THROUGH;
            default -> throw new UsageException("--unsupported must be fail or pass, got: " + value);
        };
    }

    // -----------------------------------------------------------------------
    // inspect
    // -----------------------------------------------------------------------

    private static void inspect(String[] args, PrintStream out) {
        String trace = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--trace" -> trace = requireNext(args, i++, "--trace");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (trace == null) throw new UsageException("--trace is required");

        TraceDocument doc = new TraceReader().read(Paths.get(trace));
        out.println(doc.function + " (" + doc.sourceFile + ")");
        for (TraceEntry entry : doc.data) {
            out.println(entry.position() + " (line " + doc.origin().sourceLine(entry.position()) + "): "
                + entry.snapshot());
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
