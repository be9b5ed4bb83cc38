package com.linetrace.runtime;

import com.google.gson.JsonElement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observation: the source position a statement began on, and the locals visible right after it ran.
 * The snapshot is an unmodifiable copy in declaration order.
 */
public record TraceEntry(int position, Map<String, JsonElement> snapshot) {

    public TraceEntry {
        snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(snapshot));
    }
}
