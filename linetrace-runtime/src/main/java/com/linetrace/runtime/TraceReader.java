package com.linetrace.runtime;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class TraceReader {

    private static final Gson GSON = TraceEntryAdapter.gson();

    /**
     * Reads a trace file written by {@link TraceWriter}.
     *
     * @throws TraceReadException if the file is missing, empty or not a trace document
     */
    public TraceDocument read(Path traceFile) {
        if (!Files.exists(traceFile)) {
            throw new TraceReadException("Trace file not found: " + traceFile);
        }
        try (Reader reader = Files.newBufferedReader(traceFile, StandardCharsets.UTF_8)) {
            TraceDocument doc = GSON.fromJson(reader, TraceDocument.class);
            if (doc == null || doc.data == null) {
                throw new TraceReadException("Trace file is empty or has no data: " + traceFile);
            }
            return doc;
        } catch (NoSuchFileException e) {
            throw new TraceReadException("Trace file not found: " + traceFile, e);
        } catch (JsonParseException e) {
            throw new TraceReadException("Malformed trace file " + traceFile + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TraceReadException("Failed to read trace file " + traceFile + ": " + e.getMessage(), e);
        }
    }

    public static class TraceReadException extends RuntimeException {
        public TraceReadException(String message) { super(message); }
        public TraceReadException(String message, Throwable cause) { super(message, cause); }
    }
}
