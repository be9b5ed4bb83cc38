package com.linetrace.runtime;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * Gson model for a {@code record_*.json} trace file.
 */
public class TraceDocument {

    public String function;

    @SerializedName("source_file")
    public String sourceFile;

    @SerializedName("first_line")
    public int firstLine;

    /** Serialized as {@code [[position, {name: value, ...}], ...]}. */
    public List<TraceEntry> data = new ArrayList<>();

    public TraceOrigin origin() {
        return new TraceOrigin(function, sourceFile, firstLine);
    }

    static TraceDocument of(TraceOrigin origin, List<TraceEntry> entries) {
        TraceDocument doc = new TraceDocument();
        doc.function = origin.function();
        doc.sourceFile = origin.sourceFile();
        doc.firstLine = origin.firstLine();
        doc.data = new ArrayList<>(entries);
        return doc;
    }
}
