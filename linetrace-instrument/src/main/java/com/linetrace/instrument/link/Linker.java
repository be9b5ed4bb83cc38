package com.linetrace.instrument.link;

import com.linetrace.instrument.RecordedFunction;
import com.linetrace.instrument.rewrite.ParsedDefinition;
import com.linetrace.instrument.source.SourceSnippet;
import com.linetrace.runtime.TraceCollector;
import net.bytebuddy.dynamic.loading.ClassInjector;

import java.io.File;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an instrumented definition into a callable method next to its owner.
 *
 * The definition is rendered into a companion class, compiled against the running class path and
 * injected into the owner's class loader and package, where it can reach the owner's
 * package-private members. The companion's collector field is set before the handle is returned.
 */
public class Linker {

    public static class LinkException extends RuntimeException {
        public LinkException(String msg) { super(msg); }
        public LinkException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final CompanionCompiler compiler;

    public Linker() {
        this(new CompanionCompiler());
    }

    public Linker(CompanionCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * @param original     the method whose source was instrumented
     * @param snippet      where the source came from (package and imports are reused)
     * @param instrumented the rewritten definition
     * @param collector    the buffer the companion reports to
     * @throws LinkException if the companion does not compile, cannot be injected or lacks the method
     */
    public RecordedFunction link(Method original, SourceSnippet snippet, ParsedDefinition instrumented,
                                 TraceCollector collector) {
        Class<?> owner = original.getDeclaringClass();
        String companionName = CompanionSource.nextName(snippet.ownerFlatName());
        String qualifiedName = CompanionSource.qualifiedName(owner.getPackageName(), companionName);
        String source = CompanionSource.render(snippet, companionName, instrumented.method());

        Map<String, byte[]> classes = compiler.compile(qualifiedName, source, classpathFor(owner));
        Map<String, Class<?>> loaded = inject(owner, classes);

        Class<?> companion = loaded.get(qualifiedName);
        if (companion == null) {
            throw new LinkException("Compiler did not produce " + qualifiedName);
        }
        try {
            companion.getField(CompanionSource.RECORDER_FIELD).set(null, collector);
            Method target = companion.getMethod(original.getName(), original.getParameterTypes());
            return new RecordedFunction(original, target, collector);
        } catch (ReflectiveOperationException e) {
            throw new LinkException("Linked companion " + qualifiedName + " is unusable: " + e.getMessage(), e);
        }
    }

    private static Map<String, Class<?>> inject(Class<?> owner, Map<String, byte[]> classes) {
        if (!ClassInjector.UsingLookup.isAvailable()) {
            throw new LinkException("Class injection through method handles lookup is not available on this JVM");
        }
        try {
            MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(owner, MethodHandles.lookup());
            return ClassInjector.UsingLookup.of(lookup).injectRaw(classes);
        } catch (IllegalAccessException e) {
            throw new LinkException("No access to the package of " + owner.getName() + ": " + e.getMessage(), e);
        } catch (RuntimeException | LinkageError e) {
            throw new LinkException("Could not define companion of " + owner.getName() + ": " + e.getMessage(), e);
        }
    }

    /** The running class path plus wherever the owner and the runtime were loaded from. */
    static List<Path> classpathFor(Class<?> owner) {
        Set<Path> entries = new LinkedHashSet<>();
        for (String entry : System.getProperty("java.class.path", "").split(File.pathSeparator)) {
            if (!entry.isBlank()) entries.add(Paths.get(entry));
        }
        addCodeSource(entries, owner);
        addCodeSource(entries, TraceCollector.class);
        return new ArrayList<>(entries);
    }

    private static void addCodeSource(Set<Path> entries, Class<?> type) {
        CodeSource codeSource = type.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return;
        }
        try {
            entries.add(Paths.get(codeSource.getLocation().toURI()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            System.err.println("[linetrace] Warning: cannot use code source " + codeSource.getLocation()
                + " of " + type.getName() + " on the companion class path");
        }
    }
}
