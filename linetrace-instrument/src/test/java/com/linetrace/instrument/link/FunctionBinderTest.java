package com.linetrace.instrument.link;

import com.linetrace.instrument.RecordedFunction;
import org.junit.jupiter.api.Test;

import java.util.function.BiFunction;
import java.util.function.IntBinaryOperator;
import java.util.function.IntUnaryOperator;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class FunctionBinderTest {

    public static class Api {
        public static int negate(int x) {
            return -x;
        }
    }

    static String join(String a, Integer b) {
        return a + b;
    }

    private static RecordedFunction handle(String name, Class<?>... params) throws NoSuchMethodException {
        return RecordedFunction.undecorated(FunctionBinderTest.class.getDeclaredMethod(name, params));
    }

    private static RecordedFunction negate() throws NoSuchMethodException {
        return RecordedFunction.undecorated(Api.class.getDeclaredMethod("negate", int.class));
    }

    @Test
    void publicTargetIsCalledDirectly() throws Exception {
        IntUnaryOperator op = FunctionBinder.bind(IntUnaryOperator.class, negate());
        assertEquals(-4, op.applyAsInt(4));
    }

    @Test
    void nonPublicTargetGoesThroughHandle() throws Exception {
        @SuppressWarnings("unchecked")
        BiFunction<String, Integer, String> fn =
            FunctionBinder.bind(BiFunction.class, handle("join", String.class, Integer.class));
        assertEquals("a1", fn.apply("a", 1));
    }

    @Test
    void arityMismatchIsRejected() throws Exception {
        assertThrows(Linker.LinkException.class,
            () -> FunctionBinder.bind(IntBinaryOperator.class, negate()));
    }

    @Test
    void nonFunctionalTypesAreRejected() throws Exception {
        assertThrows(Linker.LinkException.class, () -> FunctionBinder.singleAbstractMethod(String.class));
        assertThrows(Linker.LinkException.class, () -> FunctionBinder.singleAbstractMethod(java.util.List.class));
        assertEquals("get", FunctionBinder.singleAbstractMethod(Supplier.class).getName());
    }
}
