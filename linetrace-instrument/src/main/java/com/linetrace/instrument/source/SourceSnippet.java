package com.linetrace.instrument.source;

import java.nio.file.Path;
import java.util.List;

/**
 * The text of one method as it appears in its source file.
 *
 * @param text        method text from the start of its first line to its closing brace, still indented
 * @param file        the source file, or null when the text did not come from a file
 * @param firstLine   line of {@code file} holding the first line of {@code text}
 * @param packageName package of the file, empty for the unnamed package
 * @param imports     import declarations of the file, e.g. {@code import java.util.List;}
 * @param typePath    simple names from the top-level type down to the declaring type
 * @param members     what the method can see of its enclosing types
 */
public record SourceSnippet(
    String text,
    Path file,
    int firstLine,
    String packageName,
    List<String> imports,
    List<String> typePath,
    OwnerMembers members
) {

    public SourceSnippet {
        imports = List.copyOf(imports);
        typePath = List.copyOf(typePath);
        members = members == null ? OwnerMembers.none() : members;
    }

    public SourceSnippet(String text, Path file, int firstLine, String packageName,
                         List<String> imports, List<String> typePath) {
        this(text, file, firstLine, packageName, imports, typePath, OwnerMembers.none());
    }

    /** Source-level name of the declaring type, e.g. {@code com.example.Outer.Inner}. */
    public String ownerCanonicalName() {
        String nested = String.join(".", typePath);
        return packageName.isEmpty() ? nested : packageName + "." + nested;
    }

    /** Declaring type's name within its package as the class file names it, e.g. {@code Outer$Inner}. */
    public String ownerFlatName() {
        return String.join("$", typePath);
    }
}
