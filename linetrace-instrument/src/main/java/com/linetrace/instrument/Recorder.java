package com.linetrace.instrument;

import com.linetrace.instrument.link.DecorationGuard;
import com.linetrace.instrument.link.FunctionBinder;
import com.linetrace.instrument.link.FunctionScope;
import com.linetrace.instrument.link.Linker;
import com.linetrace.instrument.rewrite.DefinitionParser;
import com.linetrace.instrument.rewrite.Instrumenter;
import com.linetrace.instrument.rewrite.ParsedDefinition;
import com.linetrace.instrument.source.SourceLocator;
import com.linetrace.instrument.source.SourceNormalizer;
import com.linetrace.instrument.source.SourceSnippet;
import com.linetrace.runtime.TraceCollector;
import com.linetrace.runtime.TraceOrigin;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Records the execution of static methods.
 *
 * Usage:
 * <pre>
 *   IntUnaryOperator sign = Recorder.record(IntUnaryOperator.class, Samples.class, "sign");
 *   sign.applyAsInt(-5);   // writes record_*.json on return
 * </pre>
 *
 * Decorating reads the method's source from the configured source roots, rewrites it to report
 * its locals after every statement, compiles the result next to the owner class and binds it in
 * the owner's {@link FunctionScope}. Each decoration gets its own {@link TraceCollector}.
 */
public class Recorder {

    private static volatile Recorder shared;

    private final RecorderOptions options;
    private final SourceLocator locator;
    private final DefinitionParser parser = new DefinitionParser();
    private final Instrumenter instrumenter;
    private final Linker linker;

    public Recorder(RecorderOptions options) {
        this(options, new Linker());
    }

    public Recorder(RecorderOptions options, Linker linker) {
        this.options = options;
        this.locator = new SourceLocator(options.resolveSourceRoots());
        this.instrumenter = new Instrumenter(options.unsupported());
        this.linker = linker;
    }

    // -----------------------------------------------------------------------
    // Static entry points (options from the linetrace.options system property)
    // -----------------------------------------------------------------------

    public static RecordedFunction record(Class<?> owner, String methodName) {
        return shared().decorate(owner, methodName);
    }

    public static <F> F record(Class<F> functionType, Class<?> owner, String methodName) {
        return shared().decorate(functionType, owner, methodName);
    }

    /** The function currently bound under {@code methodName} in the owner's scope. */
    public static Optional<RecordedFunction> lookup(Class<?> owner, String methodName) {
        return FunctionScope.of(owner).lookup(methodName);
    }

    private static Recorder shared() {
        Recorder r = shared;
        if (r == null) {
            synchronized (Recorder.class) {
                r = shared;
                if (r == null) {
                    r = new Recorder(RecorderOptions.fromSystemProperties());
                    shared = r;
                }
            }
        }
        return r;
    }

    // -----------------------------------------------------------------------
    // Decoration
    // -----------------------------------------------------------------------

    public RecordedFunction decorate(Class<?> owner, String methodName) {
        return decorate(findMethod(owner, methodName));
    }

    public <F> F decorate(Class<F> functionType, Class<?> owner, String methodName) {
        return FunctionBinder.bind(functionType, decorate(owner, methodName));
    }

    /**
     * @throws MalformedInputException if the source cannot be found or parsed
     * @throws Instrumenter.UnsupportedConstructException if the method cannot be instrumented
     * @throws Linker.LinkException if the instrumented copy cannot be compiled or loaded
     */
    public RecordedFunction decorate(Method method) {
        String key = DecorationGuard.key(method);
        if (!DecorationGuard.enter(key)) {
            return RecordedFunction.undecorated(method);
        }
        try {
            SourceSnippet snippet = locator.locate(method);
            ParsedDefinition parsed = parser.parse(SourceNormalizer.stripIndent(snippet.text()));
            ParsedDefinition instrumented = instrumenter.instrument(parsed, snippet.members());

            TraceOrigin origin = new TraceOrigin(displayName(method), snippet.file().toString(), snippet.firstLine());
            TraceCollector collector = new TraceCollector(origin, options.trace());

            RecordedFunction function = linker.link(method, snippet, instrumented, collector);
            FunctionScope.of(method.getDeclaringClass()).bind(method.getName(), function);
            return function;
        } finally {
            DecorationGuard.exit(key);
        }
    }

    public RecorderOptions options() {
        return options;
    }

    static Method findMethod(Class<?> owner, String methodName) {
        List<Method> candidates = new ArrayList<>();
        for (Method m : owner.getDeclaredMethods()) {
            if (m.getName().equals(methodName) && !m.isSynthetic() && !m.isBridge()) {
                candidates.add(m);
            }
        }
        if (candidates.isEmpty()) {
            throw new MalformedInputException("No method " + methodName + " in " + owner.getName());
        }
        if (candidates.size() > 1) {
            throw new MalformedInputException("Method " + methodName + " of " + owner.getName()
                + " is overloaded; pass the java.lang.reflect.Method to decorate");
        }
        return candidates.get(0);
    }

    static String displayName(Method method) {
        return method.getDeclaringClass().getName() + "." + method.getName()
            + Arrays.stream(method.getParameterTypes()).map(Class::getSimpleName).collect(Collectors.joining(", ", "(", ")"));
    }
}
