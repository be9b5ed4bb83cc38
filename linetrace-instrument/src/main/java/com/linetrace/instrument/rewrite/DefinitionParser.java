package com.linetrace.instrument.rewrite;

import com.linetrace.instrument.MalformedInputException;
import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Wrapper around Eclipse JDT's ASTParser for a single method definition.
 *
 * A method is not a compilation unit by itself, so the text is placed inside a one-line holder
 * class before parsing. Line 1 of the text is line 2 of the unit; {@link ParsedDefinition#lineOf}
 * undoes the shift. No bindings are resolved.
 */
public class DefinitionParser {

    static final String HOLDER_NAME = "$LineTraceHolder";
    private static final String HOLDER_OPEN = "class " + HOLDER_NAME + " {\n";

    /**
     * @param text normalized method text, starting at column 0
     * @throws MalformedInputException if the text has syntax errors or is not exactly one method with a body
     */
    public ParsedDefinition parse(String text) {
        CompilationUnit unit = parseUnit(HOLDER_OPEN + text + "\n}\n");
        IProblem[] errors = errors(unit);
        if (errors.length > 0) {
            IProblem first = errors[0];
            throw new MalformedInputException("Method text does not parse (line "
                + (first.getSourceLineNumber() - 1) + "): " + first.getMessage());
        }

        if (unit.types().size() != 1 || !(unit.types().get(0) instanceof TypeDeclaration holder)) {
            throw new MalformedInputException("Text must contain a single method declaration");
        }
        List<?> members = holder.bodyDeclarations();
        if (members.size() != 1 || !(members.get(0) instanceof MethodDeclaration method)) {
            throw new MalformedInputException("Text must contain exactly one method declaration, found "
                + members.size() + " member(s)");
        }
        if (method.isConstructor()) {
            throw new MalformedInputException("Constructors cannot be recorded");
        }
        if (method.getBody() == null) {
            throw new MalformedInputException("Method " + method.getName().getIdentifier() + " has no body");
        }
        return new ParsedDefinition(unit, method, text);
    }

    /** Parses a whole compilation unit at Java 17 source level, without bindings. */
    public static CompilationUnit parseUnit(String source) {
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(false);
        parser.setStatementsRecovery(false);

        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        parser.setCompilerOptions(options);

        parser.setSource(source.toCharArray());
        return (CompilationUnit) parser.createAST(null);
    }

    private static IProblem[] errors(CompilationUnit unit) {
        return Arrays.stream(unit.getProblems())
            .filter(IProblem::isError)
            .toArray(IProblem[]::new);
    }

}
