package com.linetrace.instrument.rewrite;

import org.eclipse.jdt.core.dom.*;

import java.util.*;

/**
 * Resolves which statement each {@code break} and {@code continue} of a method body leaves.
 *
 * An unlabeled jump targets the innermost enclosing loop (or switch, for break). A labeled jump
 * targets the loop under the label, or the labeled statement itself when it is not a loop.
 * Lambda bodies and class bodies are not entered: jumps cannot leave them.
 */
class BreakTargets extends ASTVisitor {

    private final Deque<Statement> breakable = new ArrayDeque<>();
    private final Deque<Statement> loops = new ArrayDeque<>();
    private final Map<String, LabeledStatement> labels = new HashMap<>();

    private final Map<BreakStatement, Statement> breakTarget = new IdentityHashMap<>();
    private final Map<ContinueStatement, Statement> continueTarget = new IdentityHashMap<>();

    static BreakTargets of(Block body) {
        BreakTargets targets = new BreakTargets();
        body.accept(targets);
        return targets;
    }

    /** The statement the break leaves, or null when it has no target within the body. */
    Statement targetOf(BreakStatement node) {
        return breakTarget.get(node);
    }

    Statement targetOf(ContinueStatement node) {
        return continueTarget.get(node);
    }

    List<BreakStatement> breaksOf(Statement target) {
        List<BreakStatement> result = new ArrayList<>();
        breakTarget.forEach((b, t) -> { if (t == target) result.add(b); });
        return result;
    }

    boolean hasBreakTo(Statement target) {
        return breakTarget.containsValue(target);
    }

    boolean hasContinueTo(Statement target) {
        return continueTarget.containsValue(target);
    }

    static boolean isLoop(ASTNode node) {
        return node instanceof WhileStatement || node instanceof DoStatement
            || node instanceof ForStatement || node instanceof EnhancedForStatement;
    }

    // -----------------------------------------------------------------------
    // Traversal
    // -----------------------------------------------------------------------

    @Override
    public void preVisit(ASTNode node) {
        if (isLoop(node)) {
            breakable.push((Statement) node);
            loops.push((Statement) node);
        } else if (node instanceof SwitchStatement sw) {
            breakable.push(sw);
        } else if (node instanceof LabeledStatement labeled) {
            labels.put(labeled.getLabel().getIdentifier(), labeled);
        }
    }

    @Override
    public void postVisit(ASTNode node) {
        if (isLoop(node)) {
            breakable.pop();
            loops.pop();
        } else if (node instanceof SwitchStatement) {
            breakable.pop();
        } else if (node instanceof LabeledStatement labeled) {
            labels.remove(labeled.getLabel().getIdentifier());
        }
    }

    @Override
    public boolean visit(BreakStatement node) {
        Statement target = node.getLabel() == null
            ? breakable.peek()
            : labeledTarget(node.getLabel().getIdentifier());
        if (target != null) {
            breakTarget.put(node, target);
        }
        return false;
    }

    @Override
    public boolean visit(ContinueStatement node) {
        Statement target = node.getLabel() == null
            ? loops.peek()
            : labeledTarget(node.getLabel().getIdentifier());
        if (target != null) {
            continueTarget.put(node, target);
        }
        return false;
    }

    private Statement labeledTarget(String label) {
        LabeledStatement labeled = labels.get(label);
        if (labeled == null) return null;
        return isLoop(labeled.getBody()) ? labeled.getBody() : labeled;
    }

    @Override
    public boolean visit(LambdaExpression node) {
        return false;
    }

    @Override
    public boolean visit(AnonymousClassDeclaration node) {
        return false;
    }

    @Override
    public boolean visit(TypeDeclarationStatement node) {
        return false;
    }

    @Override
    public boolean visit(SwitchExpression node) {
        return false;
    }
}
