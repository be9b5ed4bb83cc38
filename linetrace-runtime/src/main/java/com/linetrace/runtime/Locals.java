package com.linetrace.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the local-variable map handed to {@link TraceCollector#emit(int, Map)} by generated code.
 */
public final class Locals {

    private Locals() {}

    /**
     * @param namesAndValues alternating variable names and values: {@code "x", x, "y", y}
     * @return names mapped to values, in argument order
     */
    public static Map<String, Object> of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        Map<String, Object> locals = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String name)) {
                throw new IllegalArgumentException("Variable name at index " + i + " is not a String: " + namesAndValues[i]);
            }
            locals.put(name, namesAndValues[i + 1]);
        }
        return locals;
    }
}
