package com.linetrace.instrument.rewrite;

import com.linetrace.instrument.source.OwnerMembers;
import org.eclipse.jdt.core.dom.*;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the first place a method body names a private member of its enclosing types.
 *
 * The instrumented copy lives in a separate class, where those members are out of reach.
 * Without bindings the scan goes by name: a field name also declared as a local or parameter
 * anywhere in the method is not reported.
 */
final class PrivateReferences extends ASTVisitor {

    record Reference(String kind, String name, ASTNode node) {
        String describe() {
            return "reference to private " + kind + " " + name;
        }
    }

    private final OwnerMembers owner;
    private final String self;
    private final Set<String> locals;
    private Reference found;

    private PrivateReferences(OwnerMembers owner, String self, Set<String> locals) {
        this.owner = owner;
        this.self = self;
        this.locals = locals;
    }

    static Optional<Reference> first(MethodDeclaration method, OwnerMembers owner) {
        if (method.getBody() == null || (owner.privateMethods().isEmpty()
                && owner.privateFields().isEmpty() && owner.privateTypes().isEmpty())) {
            return Optional.empty();
        }
        PrivateReferences scan = new PrivateReferences(owner, method.getName().getIdentifier(), localNames(method));
        for (Object p : method.parameters()) {
            if (scan.found == null) ((ASTNode) p).accept(scan);
        }
        if (method.getReturnType2() != null && scan.found == null) {
            method.getReturnType2().accept(scan);
        }
        if (scan.found == null) {
            method.getBody().accept(scan);
        }
        return Optional.ofNullable(scan.found);
    }

    private static Set<String> localNames(MethodDeclaration method) {
        Set<String> names = new HashSet<>();
        method.accept(new ASTVisitor() {
            @Override
            public boolean visit(SingleVariableDeclaration node) {
                names.add(node.getName().getIdentifier());
                return true;
            }

            @Override
            public boolean visit(VariableDeclarationFragment node) {
                names.add(node.getName().getIdentifier());
                return true;
            }
        });
        return names;
    }

    @Override
    public boolean preVisit2(ASTNode node) {
        return found == null;
    }

    @Override
    public boolean visit(MethodInvocation node) {
        String name = node.getName().getIdentifier();
        if (owner.privateMethods().contains(name) && !name.equals(self) && isOwnerQualifier(node.getExpression())) {
            found = new Reference("method", name, node);
            return false;
        }
        return true;
    }

    @Override
    public boolean visit(ExpressionMethodReference node) {
        String name = node.getName().getIdentifier();
        if (owner.privateMethods().contains(name) && node.getExpression() instanceof Name qualifier
                && isOwnerQualifier(qualifier)) {
            found = new Reference("method", name, node);
            return false;
        }
        return true;
    }

    @Override
    public boolean visit(QualifiedName node) {
        String name = node.getName().getIdentifier();
        if (isOwnerType(node.getQualifier())) {
            if (owner.privateFields().contains(name)) {
                found = new Reference("field", name, node);
            } else if (owner.privateTypes().contains(name)) {
                found = new Reference("type", name, node);
            }
        }
        return found == null;
    }

    @Override
    public boolean visit(SimpleName node) {
        if (node.isDeclaration() || isMemberName(node)) {
            return false;
        }
        String name = node.getIdentifier();
        boolean typePosition = node.getParent() instanceof SimpleType;
        if (!typePosition && owner.privateFields().contains(name) && !locals.contains(name)) {
            found = new Reference("field", name, node);
        } else if (owner.privateTypes().contains(name) && (typePosition || !locals.contains(name))) {
            found = new Reference("type", name, node);
        }
        return false;
    }

    /** Null, or a name of one of the enclosing types. */
    private boolean isOwnerQualifier(Expression qualifier) {
        return qualifier == null || (qualifier instanceof Name name && isOwnerType(name));
    }

    private boolean isOwnerType(Name name) {
        String last = name.isSimpleName()
            ? ((SimpleName) name).getIdentifier()
            : ((QualifiedName) name).getName().getIdentifier();
        return owner.typeNames().contains(last);
    }

    /** Names that select a member of something else, or that name a label or annotation element. */
    private static boolean isMemberName(SimpleName node) {
        StructuralPropertyDescriptor location = node.getLocationInParent();
        return location == MethodInvocation.NAME_PROPERTY
            || location == SuperMethodInvocation.NAME_PROPERTY
            || location == FieldAccess.NAME_PROPERTY
            || location == SuperFieldAccess.NAME_PROPERTY
            || location == QualifiedName.NAME_PROPERTY
            || location == QualifiedType.NAME_PROPERTY
            || location == NameQualifiedType.NAME_PROPERTY
            || location == ExpressionMethodReference.NAME_PROPERTY
            || location == TypeMethodReference.NAME_PROPERTY
            || location == SuperMethodReference.NAME_PROPERTY
            || location == MemberValuePair.NAME_PROPERTY
            || location == LabeledStatement.LABEL_PROPERTY
            || location == BreakStatement.LABEL_PROPERTY
            || location == ContinueStatement.LABEL_PROPERTY;
    }
}
