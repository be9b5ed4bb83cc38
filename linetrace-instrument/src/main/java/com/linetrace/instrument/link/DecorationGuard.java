package com.linetrace.instrument.link;

import java.lang.reflect.Method;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.stream.Collectors;

/**
 * Per-thread stack of decorations in progress.
 *
 * Decorating a method while the same method is already being decorated on this thread is a no-op:
 * the caller gets the original back instead of a second, nested instrumentation.
 */
public final class DecorationGuard {

    private DecorationGuard() {}

    static final ThreadLocal<Deque<String>> active =
        ThreadLocal.withInitial(ArrayDeque::new);

    /** Stable key for a method, e.g. {@code com.example.Samples#simple(int)}. */
    public static String key(Method method) {
        return method.getDeclaringClass().getName() + "#" + method.getName()
            + Arrays.stream(method.getParameterTypes()).map(Class::getName).collect(Collectors.joining(",", "(", ")"));
    }

    /** @return false when {@code key} is already being decorated on this thread; nothing is pushed then */
    public static boolean enter(String key) {
        Deque<String> stack = active.get();
        if (stack.contains(key)) {
            return false;
        }
        stack.push(key);
        return true;
    }

    public static void exit(String key) {
        active.get().remove(key);
    }

    public static boolean isActive(String key) {
        return active.get().contains(key);
    }

    // For testing
    static void reset() {
        active.get().clear();
    }
}
