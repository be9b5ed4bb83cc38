package com.linetrace.instrument.link;

import com.linetrace.instrument.RecordedFunction;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.implementation.Implementation;
import net.bytebuddy.implementation.MethodCall;
import net.bytebuddy.implementation.bytecode.assign.Assigner;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

import static net.bytebuddy.matcher.ElementMatchers.isAbstract;
import static net.bytebuddy.matcher.ElementMatchers.named;
import static net.bytebuddy.matcher.ElementMatchers.takesArguments;

/**
 * Implements a functional interface on top of a recorded function, so callers keep the
 * calling convention they had with a method reference.
 *
 * When the target is public the generated method calls it directly; otherwise it goes
 * through {@link RecordedFunction#invoke(Object...)}. Arguments and results are cast and
 * (un)boxed as needed.
 */
public final class FunctionBinder {

    private FunctionBinder() {}

    public static <F> F bind(Class<F> functionType, RecordedFunction function) {
        Method sam = singleAbstractMethod(functionType);
        Method target = function.target();
        if (sam.getParameterCount() != target.getParameterCount()) {
            throw new Linker.LinkException(functionType.getName() + "." + sam.getName() + " takes "
                + sam.getParameterCount() + " argument(s) but " + function.name() + " takes "
                + target.getParameterCount());
        }

        boolean direct = Modifier.isPublic(target.getModifiers())
            && Modifier.isPublic(target.getDeclaringClass().getModifiers());
        Implementation call;
        try {
            call = direct
                ? MethodCall.invoke(target).withAllArguments()
                    .withAssigner(Assigner.DEFAULT, Assigner.Typing.DYNAMIC)
                : MethodCall.invoke(RecordedFunction.class.getMethod("invoke", Object[].class))
                    .on(function, RecordedFunction.class)
                    .withArgumentArray()
                    .withAssigner(Assigner.DEFAULT, Assigner.Typing.DYNAMIC);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException(e);
        }

        ClassLoader loader = target.getDeclaringClass().getClassLoader();
        try {
            Class<? extends F> type = new ByteBuddy()
                .subclass(functionType)
                .method(named(sam.getName()).and(takesArguments(sam.getParameterCount())).and(isAbstract()))
                .intercept(call)
                .make()
                .load(loader, ClassLoadingStrategy.Default.WRAPPER)
                .getLoaded();
            return type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | IllegalStateException | IllegalArgumentException e) {
            throw new Linker.LinkException("Cannot implement " + functionType.getName() + " with "
                + function.name() + ": " + e.getMessage(), e);
        }
    }

    static Method singleAbstractMethod(Class<?> functionType) {
        if (!functionType.isInterface()) {
            throw new Linker.LinkException(functionType.getName() + " is not an interface");
        }
        List<Method> abstracts = new ArrayList<>();
        for (Method m : functionType.getMethods()) {
            if (Modifier.isAbstract(m.getModifiers()) && !isObjectMethod(m)) {
                abstracts.add(m);
            }
        }
        if (abstracts.size() != 1) {
            throw new Linker.LinkException(functionType.getName() + " is not a functional interface: "
                + abstracts.size() + " abstract methods");
        }
        return abstracts.get(0);
    }

    private static boolean isObjectMethod(Method m) {
        try {
            Object.class.getMethod(m.getName(), m.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
