package com.linetrace.runtime;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings for trace collection and trace files.
 *
 * Parsed from the same comma-separated {@code key=value} string the recorder accepts, e.g.
 * {@code output=/tmp/traces,max_depth=32,report=false}. Keys this class does not know are ignored
 * so one option string can carry settings for both modules.
 *
 * Keys:
 *   output   : directory trace files are written to (default: java.io.tmpdir)
 *   max_depth: deepest object nesting a snapshot may copy (default: 64)
 *   report   : "true"/"false", print the trace file location on flush (default: true)
 */
public record TraceOptions(Path outputDir, int maxDepth, boolean report) {

    public static final int DEFAULT_MAX_DEPTH = 64;

    public static TraceOptions defaults() {
        return new TraceOptions(Paths.get(System.getProperty("java.io.tmpdir")), DEFAULT_MAX_DEPTH, true);
    }

    public static TraceOptions parse(String args) {
        Path outputDir = Paths.get(System.getProperty("java.io.tmpdir"));
        int maxDepth = DEFAULT_MAX_DEPTH;
        boolean report = true;

        if (args != null && !args.isBlank()) {
            for (String part : args.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    switch (kv[0].trim()) {
                        case "output"    -> outputDir = Paths.get(kv[1].trim());
                        case "report"    -> report    = !"false".equalsIgnoreCase(kv[1].trim());
                        case "max_depth" -> {
                            try { maxDepth = Integer.parseInt(kv[1].trim()); } catch (NumberFormatException ignored) {}
                        }
                        default -> { }
                    }
                }
            }
        }
        return new TraceOptions(outputDir, maxDepth, report);
    }

    public TraceOptions withOutputDir(Path dir) {
        return new TraceOptions(dir, maxDepth, report);
    }
}
