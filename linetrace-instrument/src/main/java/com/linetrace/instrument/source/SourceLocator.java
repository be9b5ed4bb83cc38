package com.linetrace.instrument.source;

import com.linetrace.instrument.MalformedInputException;
import com.linetrace.instrument.rewrite.DefinitionParser;
import org.eclipse.jdt.core.dom.*;

import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Finds the source text of a method on the configured source roots.
 *
 * The declaring class must be a named class whose top-level type lives in
 * {@code <package path>/<TopLevelType>.java}.
 */
public class SourceLocator {

    private final List<Path> sourceRoots;

    public SourceLocator(List<Path> sourceRoots) {
        this.sourceRoots = List.copyOf(sourceRoots);
    }

    /**
     * @throws MalformedInputException if the source file or the declaration cannot be found
     */
    public SourceSnippet locate(Method method) {
        Class<?> owner = method.getDeclaringClass();
        List<String> typePath = typePath(owner);
        String pkg = owner.getPackageName();

        Path relative = Path.of(pkg.replace('.', '/'), typePath.get(0) + ".java");
        Path file = sourceRoots.stream()
            .map(root -> root.resolve(relative))
            .filter(Files::isRegularFile)
            .findFirst()
            .orElseThrow(() -> new MalformedInputException("Source of " + owner.getName()
                + " not found: looked for " + relative + " under " + sourceRoots));

        String source = read(file);
        CompilationUnit cu = DefinitionParser.parseUnit(source);
        AbstractTypeDeclaration type = findType(cu, typePath, owner);

        MethodDeclaration decl = pickOverload(type, method);
        return snippet(source, file, cu, decl);
    }

    /**
     * File-based variant: the method name must be unique within the file.
     *
     * @throws MalformedInputException if the file cannot be read or the name matches zero or several methods
     */
    public SourceSnippet locate(Path file, String methodName) {
        String source = read(file);
        CompilationUnit cu = DefinitionParser.parseUnit(source);

        List<MethodDeclaration> matches = new ArrayList<>();
        cu.accept(new ASTVisitor() {
            @Override
            public boolean visit(MethodDeclaration node) {
                if (!node.isConstructor() && node.getName().getIdentifier().equals(methodName)) {
                    matches.add(node);
                }
                return false;
            }

            @Override
            public boolean visit(AnonymousClassDeclaration node) {
                return false;
            }
        });

        if (matches.isEmpty()) {
            throw new MalformedInputException("No method named '" + methodName + "' in " + file);
        }
        if (matches.size() > 1) {
            throw new MalformedInputException("Method name '" + methodName + "' is ambiguous in " + file
                + ": " + matches.size() + " declarations");
        }
        return snippet(source, file, cu, matches.get(0));
    }

    public List<Path> sourceRoots() {
        return sourceRoots;
    }

    // -----------------------------------------------------------------------
    // Declaration lookup
    // -----------------------------------------------------------------------

    private static List<String> typePath(Class<?> owner) {
        Deque<String> path = new ArrayDeque<>();
        for (Class<?> c = owner; c != null; c = c.getDeclaringClass()) {
            if (c.isAnonymousClass() || c.isLocalClass() || c.isHidden()) {
                throw new MalformedInputException("Methods of local, anonymous or hidden classes cannot be located: "
                    + owner.getName());
            }
            path.addFirst(c.getSimpleName());
        }
        return new ArrayList<>(path);
    }

    private static List<AbstractTypeDeclaration> enclosingTypes(MethodDeclaration decl) {
        Deque<AbstractTypeDeclaration> path = new ArrayDeque<>();
        for (ASTNode n = decl.getParent(); n != null; n = n.getParent()) {
            if (n instanceof AbstractTypeDeclaration type) {
                path.addFirst(type);
            }
        }
        return new ArrayList<>(path);
    }

    private static AbstractTypeDeclaration findType(CompilationUnit cu, List<String> typePath, Class<?> owner) {
        List<?> members = cu.types();
        AbstractTypeDeclaration current = null;
        for (String name : typePath) {
            current = null;
            for (Object member : members) {
                if (member instanceof AbstractTypeDeclaration type && type.getName().getIdentifier().equals(name)) {
                    current = type;
                    break;
                }
            }
            if (current == null) {
                throw new MalformedInputException("Type " + name + " of " + owner.getName()
                    + " not declared in its source file");
            }
            members = current.bodyDeclarations();
        }
        return current;
    }

    /**
     * Picks the declaration matching name, arity and erased parameter simple names.
     * Type variables erase differently in source and class files, so a unique name and arity match
     * is accepted when no declaration matches exactly.
     */
    private static MethodDeclaration pickOverload(AbstractTypeDeclaration type, Method method) {
        List<String> wanted = new ArrayList<>();
        for (Class<?> p : method.getParameterTypes()) {
            wanted.add(p.getSimpleName());
        }

        List<MethodDeclaration> sameArity = new ArrayList<>();
        for (Object member : type.bodyDeclarations()) {
            if (!(member instanceof MethodDeclaration decl) || decl.isConstructor()) continue;
            if (!decl.getName().getIdentifier().equals(method.getName())) continue;
            if (decl.parameters().size() != wanted.size()) continue;
            if (erasedParameterNames(decl).equals(wanted)) {
                return decl;
            }
            sameArity.add(decl);
        }

        if (sameArity.size() == 1) {
            return sameArity.get(0);
        }
        throw new MalformedInputException("No unique declaration of " + method.getName() + wanted
            + " in " + type.getName().getIdentifier() + " (" + sameArity.size() + " candidates)");
    }

    static List<String> erasedParameterNames(MethodDeclaration decl) {
        List<String> names = new ArrayList<>();
        for (Object p : decl.parameters()) {
            SingleVariableDeclaration param = (SingleVariableDeclaration) p;
            int dims = param.getExtraDimensions() + (param.isVarargs() ? 1 : 0);
            names.add(erasedName(param.getType()) + "[]".repeat(dims));
        }
        return names;
    }

    private static String erasedName(Type type) {
        if (type instanceof ArrayType array) {
            return erasedName(array.getElementType()) + "[]".repeat(array.getDimensions());
        }
        if (type instanceof ParameterizedType parameterized) {
            return erasedName(parameterized.getType());
        }
        if (type instanceof SimpleType simple) {
            Name name = simple.getName();
            return name.isQualifiedName() ? ((QualifiedName) name).getName().getIdentifier() : name.getFullyQualifiedName();
        }
        if (type instanceof QualifiedType qualified) {
            return qualified.getName().getIdentifier();
        }
        if (type instanceof NameQualifiedType qualified) {
            return qualified.getName().getIdentifier();
        }
        return type.toString();
    }

    // -----------------------------------------------------------------------
    // Text extraction
    // -----------------------------------------------------------------------

    private static SourceSnippet snippet(String source, Path file, CompilationUnit cu, MethodDeclaration decl) {
        int start = firstTokenAfterJavadoc(decl);
        int lineStart = source.lastIndexOf('\n', start - 1) + 1;
        int end = decl.getStartPosition() + decl.getLength();
        String text = source.substring(lineStart, end).replace("\r\n", "\n");

        String pkg = cu.getPackage() == null ? "" : cu.getPackage().getName().getFullyQualifiedName();
        List<String> imports = new ArrayList<>();
        for (Object i : cu.imports()) {
            imports.add(i.toString().trim());
        }
        OwnerMembers members = OwnerMembers.of(pkg, enclosingTypes(decl));
        return new SourceSnippet(text, file.toAbsolutePath(), cu.getLineNumber(start), pkg, imports,
            members.typeNames(), members);
    }

    private static int firstTokenAfterJavadoc(MethodDeclaration decl) {
        if (decl.getJavadoc() == null) {
            return decl.getStartPosition();
        }
        int start = decl.getName().getStartPosition();
        List<ASTNode> leading = new ArrayList<>();
        for (Object m : decl.modifiers()) leading.add((ASTNode) m);
        for (Object t : decl.typeParameters()) leading.add((ASTNode) t);
        if (decl.getReturnType2() != null) leading.add(decl.getReturnType2());
        for (ASTNode n : leading) {
            start = Math.min(start, n.getStartPosition());
        }
        return start;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MalformedInputException("Could not read source file " + file + ": " + e.getMessage(), e);
        }
    }
}
