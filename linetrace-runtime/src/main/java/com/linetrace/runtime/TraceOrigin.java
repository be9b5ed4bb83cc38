package com.linetrace.runtime;

/**
 * Identifies the method a trace belongs to.
 *
 * @param function   display name, e.g. {@code com.example.Samples.simple(int)}
 * @param sourceFile absolute path of the file the method was read from, or null when unknown
 * @param firstLine  line of {@code sourceFile} that position 1 corresponds to
 */
public record TraceOrigin(String function, String sourceFile, int firstLine) {

    /** Maps a trace position back to a line of {@link #sourceFile()}. */
    public int sourceLine(int position) {
        return firstLine + position - 1;
    }
}
