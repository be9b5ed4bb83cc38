package com.linetrace.runtime;

import com.google.gson.Gson;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists a trace buffer to a new, uniquely named {@code record_*.json} file.
 * Every call creates a fresh file; existing trace files are never overwritten.
 */
public class TraceWriter {

    private static final Gson GSON = TraceEntryAdapter.gson();

    private final Path outputDir;
    private final boolean report;

    public TraceWriter(Path outputDir, boolean report) {
        this.outputDir = outputDir;
        this.report = report;
    }

    public static class TraceStorageException extends RuntimeException {
        public TraceStorageException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code entries} under the output directory (created if absent).
     *
     * @return path of the file written
     * @throws TraceStorageException if the directory or file cannot be created or written
     */
    public Path write(TraceOrigin origin, List<TraceEntry> entries) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new TraceStorageException("Could not create trace directory: " + outputDir, e);
        }

        Path file;
        try {
            file = Files.createTempFile(outputDir, "record_", ".json");
        } catch (IOException e) {
            throw new TraceStorageException("Could not create trace file in " + outputDir + ": " + e.getMessage(), e);
        }

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(TraceDocument.of(origin, entries), w);
        } catch (IOException e) {
            throw new TraceStorageException("Failed to write " + file + ": " + e.getMessage(), e);
        }

        if (report) {
            System.err.println("[linetrace] Recorded execution of " + origin.function() + " in " + file);
        }
        return file;
    }

    public Path outputDir() {
        return outputDir;
    }
}
