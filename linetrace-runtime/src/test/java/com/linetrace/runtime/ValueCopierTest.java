package com.linetrace.runtime;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ValueCopierTest {

    private final ValueCopier copier = new ValueCopier(TraceOptions.DEFAULT_MAX_DEPTH);

    // --- Scalars ---

    @Test
    void nullBecomesJsonNull() {
        assertTrue(copier.copy("x", null).isJsonNull());
    }

    @Test
    void numbersStayNumbers() {
        assertEquals(42, copier.copy("x", 42).getAsInt());
        assertEquals(3.5, copier.copy("x", 3.5).getAsDouble());
        assertEquals(7L, copier.copy("x", 7L).getAsLong());
    }

    @Test
    void mutableNumberIsFrozen() {
        AtomicInteger counter = new AtomicInteger(5);
        JsonElement copy = copier.copy("counter", counter);
        counter.incrementAndGet();
        assertEquals(5, copy.getAsInt());
    }

    @Test
    void stringsAndCharsByValue() {
        assertEquals("hello", copier.copy("s", "hello").getAsString());
        assertEquals("c", copier.copy("c", 'c').getAsString());
        StringBuilder sb = new StringBuilder("ab");
        JsonElement copy = copier.copy("sb", sb);
        sb.append("c");
        assertEquals("ab", copy.getAsString());
    }

    enum Color { RED, GREEN }

    @Test
    void enumByName() {
        assertEquals("GREEN", copier.copy("c", Color.GREEN).getAsString());
    }

    @Test
    void jdkValueTypeByToString() {
        assertEquals("2024-02-29", copier.copy("d", LocalDate.of(2024, 2, 29)).getAsString());
    }

    // --- Containers ---

    @Test
    void listIsDeepCopied() {
        List<String> items = new ArrayList<>(List.of("a"));
        JsonElement copy = copier.copy("items", items);
        items.add("b");

        JsonArray arr = copy.getAsJsonArray();
        assertEquals(1, arr.size());
        assertEquals("a", arr.get(0).getAsString());
    }

    @Test
    void arraysIncludingPrimitiveArrays() {
        JsonArray arr = copier.copy("xs", new int[] {1, 2, 3}).getAsJsonArray();
        assertEquals(3, arr.size());
        assertEquals(3, arr.get(2).getAsInt());
    }

    @Test
    void mapKeysUseStringValueOf() {
        Map<Integer, String> map = new LinkedHashMap<>();
        map.put(1, "one");
        map.put(2, null);
        JsonObject obj = copier.copy("m", map).getAsJsonObject();
        assertEquals("one", obj.get("1").getAsString());
        assertTrue(obj.get("2").isJsonNull());
    }

    // --- Objects ---

    static class Base {
        String id = "b-1";
    }

    static class Point extends Base {
        int x = 1;
        int y = 2;
        transient int cached = 99;
        static int instances = 0;
    }

    @Test
    void objectFieldsIncludeSuperclassAndSkipTransientAndStatic() {
        JsonObject obj = copier.copy("p", new Point()).getAsJsonObject();
        assertEquals(1, obj.get("x").getAsInt());
        assertEquals(2, obj.get("y").getAsInt());
        assertEquals("b-1", obj.get("id").getAsString());
        assertFalse(obj.has("cached"));
        assertFalse(obj.has("instances"));
    }

    static class Node {
        String name;
        Node next;
        Node(String name) { this.name = name; }
    }

    @Test
    void sharedReferencesAreNotCycles() {
        Node shared = new Node("shared");
        List<Node> both = List.of(shared, shared);
        JsonArray arr = copier.copy("both", both).getAsJsonArray();
        assertEquals("shared", arr.get(1).getAsJsonObject().get("name").getAsString());
    }

    // --- Failures ---

    @Test
    void cycleIsRejected() {
        Node a = new Node("a");
        Node b = new Node("b");
        a.next = b;
        b.next = a;
        ValueCopier.SnapshotCopyException ex =
            assertThrows(ValueCopier.SnapshotCopyException.class, () -> copier.copy("a", a));
        assertTrue(ex.getMessage().contains("cycle"));
    }

    @Test
    void selfContainingListIsRejected() {
        List<Object> list = new ArrayList<>();
        list.add(list);
        assertThrows(ValueCopier.SnapshotCopyException.class, () -> copier.copy("list", list));
    }

    @Test
    void nestingBeyondMaxDepthIsRejected() {
        ValueCopier shallow = new ValueCopier(2);
        List<Object> deep = List.of(List.of(List.of(1)));
        ValueCopier.SnapshotCopyException ex =
            assertThrows(ValueCopier.SnapshotCopyException.class, () -> shallow.copy("deep", deep));
        assertTrue(ex.getMessage().contains("deep"));
    }

    @Test
    void scalarsIgnoreDepthLimit() {
        ValueCopier none = new ValueCopier(0);
        assertEquals(1, none.copy("x", 1).getAsInt());
    }
}
