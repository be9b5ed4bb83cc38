package com.linetrace.instrument.source;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of source root resolution: main and test source directories, absolute.
 */
public record SourceRoots(
    List<Path> mainRoots,
    List<Path> testRoots
) {

    public SourceRoots {
        mainRoots = List.copyOf(mainRoots);
        testRoots = List.copyOf(testRoots);
    }

    /** Main roots first, then test roots. */
    public List<Path> all() {
        List<Path> all = new ArrayList<>(mainRoots);
        all.addAll(testRoots);
        return all;
    }
}
