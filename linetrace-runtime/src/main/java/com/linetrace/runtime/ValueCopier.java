package com.linetrace.runtime;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Deep-copies a local variable's value into a Gson JSON tree.
 *
 * The tree is detached from the original object graph, so later mutation of the variable does not
 * change a snapshot that was already taken.
 *
 * Rules:
 * - null: JSON null
 * - Boolean, Character, String and other CharSequences: JSON primitive (by value)
 * - Numbers: JSON number; mutable numbers (AtomicInteger, LongAdder, ...) are read once
 * - Enums: constant name
 * - Arrays, Collections and other Iterables: JSON array with every element
 * - Maps: JSON object keyed by String.valueOf(key)
 * - Other JDK-defined types (java.time, Optional, Path, ...): their toString()
 * - Everything else: JSON object of instance fields, walking superclasses up to Object,
 *   skipping static, synthetic and transient fields
 * - A cycle, or nesting beyond {@code maxDepth}, is a {@link SnapshotCopyException}
 */
public final class ValueCopier {

    private final int maxDepth;

    public ValueCopier(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public static class SnapshotCopyException extends RuntimeException {
        public SnapshotCopyException(String msg) { super(msg); }
        public SnapshotCopyException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * @param name  variable name, used in error messages
     * @param value the variable's current value
     */
    public JsonElement copy(String name, Object value) {
        return copyInto(value, name, 0, new IdentityHashMap<>());
    }

    private JsonElement copyInto(Object obj, String path, int depth, IdentityHashMap<Object, Boolean> visiting) {
        if (obj == null) {
            return JsonNull.INSTANCE;
        }

        Class<?> cls = obj.getClass();

        if (obj instanceof Boolean b)      return new JsonPrimitive(b);
        if (obj instanceof Character c)    return new JsonPrimitive(c);
        if (obj instanceof CharSequence s) return new JsonPrimitive(s.toString());
        if (obj instanceof Number n)       return copyNumber(n);
        if (cls.isEnum() || obj instanceof Enum<?>) return new JsonPrimitive(((Enum<?>) obj).name());

        if (depth >= maxDepth) {
            throw new SnapshotCopyException("Value of '" + path + "' is nested deeper than " + maxDepth + " levels");
        }
        if (visiting.containsKey(obj)) {
            throw new SnapshotCopyException("Value of '" + path + "' contains a cycle back to a "
                + cls.getSimpleName());
        }

        visiting.put(obj, Boolean.TRUE);
        try {
            if (cls.isArray()) {
                return copyArray(obj, path, depth, visiting);
            }
            if (obj instanceof Map<?, ?> map) {
                return copyMap(map, path, depth, visiting);
            }
            if (obj instanceof Collection<?> col) {
                return copyIterable(col, path, depth, visiting);
            }
            if (isJdkType(cls)) {
                return new JsonPrimitive(String.valueOf(obj));
            }
            if (obj instanceof Iterable<?> it) {
                return copyIterable(it, path, depth, visiting);
            }
            return copyFields(obj, cls, path, depth, visiting);
        } finally {
            visiting.remove(obj);
        }
    }

    private JsonElement copyNumber(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof Double || n instanceof Float
                || n instanceof BigInteger || n instanceof BigDecimal) {
            return new JsonPrimitive(n);
        }
        // AtomicLong, LongAdder and friends keep changing; freeze the current value
        try {
            return new JsonPrimitive(new BigDecimal(n.toString()));
        } catch (NumberFormatException e) {
            return new JsonPrimitive(n.doubleValue());
        }
    }

    private JsonElement copyArray(Object arr, String path, int depth, IdentityHashMap<Object, Boolean> visiting) {
        JsonArray out = new JsonArray();
        int len = Array.getLength(arr);
        for (int i = 0; i < len; i++) {
            out.add(copyInto(Array.get(arr, i), path + "[" + i + "]", depth + 1, visiting));
        }
        return out;
    }

    private JsonElement copyIterable(Iterable<?> it, String path, int depth, IdentityHashMap<Object, Boolean> visiting) {
        JsonArray out = new JsonArray();
        int i = 0;
        for (Object elem : it) {
            out.add(copyInto(elem, path + "[" + i + "]", depth + 1, visiting));
            i++;
        }
        return out;
    }

    private JsonElement copyMap(Map<?, ?> map, String path, int depth, IdentityHashMap<Object, Boolean> visiting) {
        JsonObject out = new JsonObject();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            out.add(key, copyInto(entry.getValue(), path + "[" + key + "]", depth + 1, visiting));
        }
        return out;
    }

    private JsonElement copyFields(Object obj, Class<?> cls, String path, int depth, IdentityHashMap<Object, Boolean> visiting) {
        // Walk class hierarchy (including superclasses) up to Object
        List<Field> fields = new ArrayList<>();
        Class<?> c = cls;
        while (c != null && c != Object.class) {
            for (Field f : c.getDeclaredFields()) {
                int mods = f.getModifiers();
                if (f.isSynthetic() || Modifier.isStatic(mods) || Modifier.isTransient(mods)) continue;
                fields.add(f);
            }
            c = c.getSuperclass();
        }

        JsonObject out = new JsonObject();
        for (Field field : fields) {
            String fieldPath = path + "." + field.getName();
            Object fieldValue;
            try {
                field.setAccessible(true);
                fieldValue = field.get(obj);
            } catch (RuntimeException | IllegalAccessException e) {
                // InaccessibleObjectException (module system) lands here too
                throw new SnapshotCopyException("Cannot read '" + fieldPath + "': " + e.getMessage(), e);
            }
            out.add(field.getName(), copyInto(fieldValue, fieldPath, depth + 1, visiting));
        }
        return out;
    }

    /** Classes defined by the JDK itself; their fields are implementation details. */
    static boolean isJdkType(Class<?> cls) {
        ClassLoader loader = cls.getClassLoader();
        return loader == null || loader == ClassLoader.getPlatformClassLoader();
    }
}
