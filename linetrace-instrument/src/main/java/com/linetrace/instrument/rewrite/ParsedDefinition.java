package com.linetrace.instrument.rewrite;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.MethodDeclaration;

/**
 * A parsed method definition: the holder unit, the method inside it, and the text it came from.
 * The tree is mutable; {@link Instrumenter} rewrites the method in place.
 */
public record ParsedDefinition(CompilationUnit unit, MethodDeclaration method, String text) {

    /**
     * Source position of a node parsed from {@link #text()}: the 1-based line of the text it starts on.
     * Nodes created after parsing have no position.
     */
    public int lineOf(ASTNode node) {
        if (node.getStartPosition() < 0) {
            throw new IllegalArgumentException("Node was not parsed from source: " + node);
        }
        return unit.getLineNumber(node.getStartPosition()) - 1;
    }

    public String methodName() {
        return method.getName().getIdentifier();
    }
}
