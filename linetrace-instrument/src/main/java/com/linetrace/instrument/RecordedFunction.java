package com.linetrace.instrument;

import com.linetrace.runtime.TraceCollector;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Optional;

/**
 * Handle to a recorded method.
 *
 * {@link #invoke} calls the instrumented copy, which appends to {@link #collector()} and writes a
 * trace file on every return. A handle produced by a re-entrant decoration wraps the original
 * method and has no collector.
 */
public final class RecordedFunction {

    private final Method original;
    private final Method target;
    private final TraceCollector collector;

    public RecordedFunction(Method original, Method target, TraceCollector collector) {
        this.original = original;
        this.target = target;
        this.collector = collector;
        if (!target.canAccess(null)) {
            target.setAccessible(true);
        }
    }

    /** A handle that calls {@code original} unchanged. */
    public static RecordedFunction undecorated(Method original) {
        return new RecordedFunction(original, original, null);
    }

    public static class RecordedInvocationException extends RuntimeException {
        public RecordedInvocationException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Calls the method with {@code args}. Unchecked exceptions thrown by the method propagate as they are;
     * checked ones are wrapped.
     *
     * @throws RecordedInvocationException wrapping a checked exception, or when the arguments do not fit
     */
    public Object invoke(Object... args) {
        try {
            return target.invoke(null, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new RecordedInvocationException(name() + " threw " + cause, cause);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new RecordedInvocationException("Cannot invoke " + name() + ": " + e.getMessage(), e);
        }
    }

    public boolean isInstrumented() {
        return collector != null;
    }

    public String name() {
        return original.getName();
    }

    public Method original() {
        return original;
    }

    /** The method {@link #invoke} calls: the companion's copy, or the original when undecorated. */
    public Method target() {
        return target;
    }

    public Optional<TraceCollector> collector() {
        return Optional.ofNullable(collector);
    }
}
