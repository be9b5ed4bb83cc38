package com.linetrace.instrument.link;

import com.linetrace.instrument.source.SourceSnippet;
import com.linetrace.runtime.Locals;
import com.linetrace.runtime.TraceCollector;
import org.eclipse.jdt.core.dom.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders the companion class that hosts an instrumented method.
 *
 * The companion lives in the owner's package, imports what the owner's file imports plus the
 * static members of the owner and of every type enclosing it, and supplies the {@code $emit}/{@code $flush} helpers the rewritten
 * body calls. The collector is injected through the public static {@code $recorder} field.
 */
public final class CompanionSource {

    public static final String RECORDER_FIELD = "$recorder";
    static final String SUFFIX = "$LineTrace";

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private CompanionSource() {}

    /** A companion name not used before in this JVM, e.g. {@code Samples$LineTrace3}. */
    public static String nextName(String ownerFlatName) {
        return ownerFlatName + SUFFIX + COUNTER.incrementAndGet();
    }

    /** Stable companion name for build-time output, e.g. {@code Samples$LineTrace}. */
    public static String fixedName(String ownerFlatName) {
        return ownerFlatName + SUFFIX;
    }

    public static String qualifiedName(String packageName, String simpleName) {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    public static String render(SourceSnippet snippet, String companionName, MethodDeclaration instrumented) {
        String pkg = snippet.packageName();
        StringBuilder sb = new StringBuilder();
        if (!pkg.isEmpty()) {
            sb.append("package ").append(pkg).append(";\n\n");
        }
        for (String imp : snippet.imports()) {
            sb.append(imp).append('\n');
        }
        // static members of a class in the unnamed package cannot be imported
        if (!pkg.isEmpty()) {
            String enclosing = pkg;
            for (String type : snippet.typePath()) {
                enclosing = enclosing + "." + type;
                sb.append("import static ").append(enclosing).append(".*;\n");
            }
            // a single import shadows the on-demand ones, as the innermost declaration does in the owner
            for (Map.Entry<String, String> shadowed : snippet.members().shadowedStatics().entrySet()) {
                sb.append("import static ").append(shadowed.getValue()).append('.')
                  .append(shadowed.getKey()).append(";\n");
            }
        }
        sb.append('\n');

        sb.append("public final class ").append(companionName).append(" {\n\n");
        sb.append("    public static ").append(TraceCollector.class.getName()).append(' ')
          .append(RECORDER_FIELD).append(";\n\n");
        sb.append("    private ").append(companionName).append("() {}\n\n");
        sb.append("    private static void $emit(int position, Object... namesAndValues) {\n");
        sb.append("        ").append(RECORDER_FIELD).append(".emit(position, ")
          .append(Locals.class.getName()).append(".of(namesAndValues));\n");
        sb.append("    }\n\n");
        sb.append("    private static void $flush() {\n");
        sb.append("        ").append(RECORDER_FIELD).append(".flush();\n");
        sb.append("    }\n\n");
        sb.append(publicCopy(instrumented));
        sb.append("}\n");
        return sb.toString();
    }

    /** Copy of the method with its access modifier replaced by {@code public}. */
    @SuppressWarnings("unchecked")
    static String publicCopy(MethodDeclaration method) {
        AST ast = method.getAST();
        MethodDeclaration copy = (MethodDeclaration) ASTNode.copySubtree(ast, method);
        copy.setJavadoc(null);

        List<IExtendedModifier> modifiers = copy.modifiers();
        modifiers.removeIf(m -> m instanceof Modifier mod
            && (mod.isPublic() || mod.isProtected() || mod.isPrivate()));
        int firstKeyword = 0;
        while (firstKeyword < modifiers.size() && modifiers.get(firstKeyword).isAnnotation()) {
            firstKeyword++;
        }
        modifiers.add(firstKeyword, ast.newModifier(Modifier.ModifierKeyword.PUBLIC_KEYWORD));
        return copy.toString();
    }
}
