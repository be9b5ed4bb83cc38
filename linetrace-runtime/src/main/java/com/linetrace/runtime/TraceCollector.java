package com.linetrace.runtime;

import com.google.gson.JsonElement;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory trace buffer for one decorated method.
 *
 * Generated code calls {@link #emit} after each statement and {@link #flush} on every exit path.
 * The buffer is append-only: flushing writes everything collected so far and keeps it, so each
 * file holds the complete history of the recorded function up to that return.
 *
 * Not thread-safe. A collector belongs to the thread that runs the recorded function.
 */
public final class TraceCollector {

    private final TraceOrigin origin;
    private final ValueCopier copier;
    private final TraceWriter writer;

    private final List<TraceEntry> entries = new ArrayList<>();
    private final List<Path> flushedFiles = new ArrayList<>();

    public TraceCollector(TraceOrigin origin, TraceOptions options) {
        this(origin, new ValueCopier(options.maxDepth()), new TraceWriter(options.outputDir(), options.report()));
    }

    TraceCollector(TraceOrigin origin, ValueCopier copier, TraceWriter writer) {
        this.origin = origin;
        this.copier = copier;
        this.writer = writer;
    }

    // -----------------------------------------------------------------------
    // Called from instrumented code
    // -----------------------------------------------------------------------

    /**
     * Appends one entry. Every value is deep-copied before this returns.
     *
     * @throws ValueCopier.SnapshotCopyException if a value cannot be copied
     */
    public void emit(int position, Map<String, ?> locals) {
        Map<String, JsonElement> snapshot = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : locals.entrySet()) {
            snapshot.put(e.getKey(), copier.copy(e.getKey(), e.getValue()));
        }
        entries.add(new TraceEntry(position, snapshot));
    }

    /**
     * Writes the whole buffer to a new trace file.
     *
     * @return the file written
     * @throws TraceWriter.TraceStorageException if the file cannot be written
     */
    public Path flush() {
        Path file = writer.write(origin, entries);
        flushedFiles.add(file);
        return file;
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public List<TraceEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Path> flushedFiles() {
        return Collections.unmodifiableList(flushedFiles);
    }

    public TraceOrigin origin() {
        return origin;
    }
}
