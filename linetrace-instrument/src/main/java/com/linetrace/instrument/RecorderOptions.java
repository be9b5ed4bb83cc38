package com.linetrace.instrument;

import com.linetrace.instrument.source.SourceRootResolver;
import com.linetrace.runtime.TraceOptions;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Recorder configuration, parsed from a comma-separated {@code key=value} string.
 *
 * Keys (besides those of {@link TraceOptions}):
 *   project    : project root used to find source roots (default: user.dir)
 *   sources    : explicit source roots, separated by the platform path separator
 *   unsupported: fail | pass (default: fail)
 *
 * {@link #fromSystemProperties()} reads the string from the {@code linetrace.options} property.
 */
public record RecorderOptions(
    TraceOptions trace,
    Path projectRoot,
    List<Path> sources,
    UnsupportedConstructPolicy unsupported
) {

    public static final String PROPERTY = "linetrace.options";

    public RecorderOptions {
        sources = List.copyOf(sources);
    }

    public static RecorderOptions defaults() {
        return parse(null);
    }

    public static RecorderOptions fromSystemProperties() {
        return parse(System.getProperty(PROPERTY));
    }

    public static RecorderOptions parse(String args) {
        Path projectRoot = Paths.get(System.getProperty("user.dir"));
        List<Path> sources = new ArrayList<>();
        UnsupportedConstructPolicy unsupported = UnsupportedConstructPolicy.FAIL;

        if (args != null && !args.isBlank()) {
            for (String part : args.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    String value = kv[1].trim();
                    switch (kv[0].trim()) {
                        case "project"     -> projectRoot = Paths.get(value);
                        case "unsupported" -> unsupported = UnsupportedConstructPolicy.parse(value);
                        case "sources"     -> {
                            for (String root : value.split(File.pathSeparator)) {
                                if (!root.isBlank()) sources.add(Paths.get(root.trim()));
                            }
                        }
                        default -> { }
                    }
                }
            }
        }
        return new RecorderOptions(TraceOptions.parse(args), projectRoot, sources, unsupported);
    }

    /** Explicit source roots when given, otherwise the roots declared by the project's build file. */
    public List<Path> resolveSourceRoots() {
        if (!sources.isEmpty()) {
            return sources;
        }
        return new SourceRootResolver().resolve(projectRoot).all();
    }

    public RecorderOptions withSources(List<Path> roots) {
        return new RecorderOptions(trace, projectRoot, roots, unsupported);
    }

    public RecorderOptions withTrace(TraceOptions traceOptions) {
        return new RecorderOptions(traceOptions, projectRoot, sources, unsupported);
    }

    public RecorderOptions withUnsupported(UnsupportedConstructPolicy policy) {
        return new RecorderOptions(trace, projectRoot, sources, policy);
    }
}
