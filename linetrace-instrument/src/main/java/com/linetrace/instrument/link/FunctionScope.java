package com.linetrace.instrument.link;

import com.linetrace.instrument.RecordedFunction;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name bindings of recorded functions, one scope per owner class.
 *
 * Binding a name replaces any earlier binding, so the latest decoration of a method is the one
 * callers resolve. Overloads share a name; the last one decorated wins.
 */
public final class FunctionScope {

    static final ConcurrentHashMap<Class<?>, FunctionScope> scopes = new ConcurrentHashMap<>();

    private final Class<?> owner;
    private final Map<String, RecordedFunction> bindings = new ConcurrentHashMap<>();

    private FunctionScope(Class<?> owner) {
        this.owner = owner;
    }

    public static FunctionScope of(Class<?> owner) {
        return scopes.computeIfAbsent(owner, FunctionScope::new);
    }

    /** @return the binding replaced, if any */
    public Optional<RecordedFunction> bind(String name, RecordedFunction function) {
        return Optional.ofNullable(bindings.put(name, function));
    }

    public Optional<RecordedFunction> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public Set<String> names() {
        return new TreeSet<>(bindings.keySet());
    }

    public Class<?> owner() {
        return owner;
    }

    // For testing
    public static void reset() {
        scopes.clear();
    }
}
