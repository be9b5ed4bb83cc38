package com.linetrace.instrument.rewrite;

import org.eclipse.jdt.core.dom.*;

import java.util.List;

/**
 * Builds the statements inserted into an instrumented method.
 * All nodes belong to the AST of the method being rewritten.
 */
class EmissionFactory {

    static final String EMIT = "$emit";
    static final String FLUSH = "$flush";
    static final String RETVAL = "$retval";
    static final String BROKE_PREFIX = "$broke";

    private final AST ast;

    EmissionFactory(AST ast) {
        this.ast = ast;
    }

    /** {@code $emit(position, "a", a, "b", b);} */
    @SuppressWarnings("unchecked")
    ExpressionStatement emit(int position, List<String> names) {
        MethodInvocation call = ast.newMethodInvocation();
        call.setName(ast.newSimpleName(EMIT));
        List<Expression> args = call.arguments();
        args.add(ast.newNumberLiteral(Integer.toString(position)));
        for (String name : names) {
            StringLiteral literal = ast.newStringLiteral();
            literal.setLiteralValue(name);
            args.add(literal);
            args.add(ast.newSimpleName(name));
        }
        return ast.newExpressionStatement(call);
    }

    /** {@code $flush();} */
    ExpressionStatement flush() {
        MethodInvocation call = ast.newMethodInvocation();
        call.setName(ast.newSimpleName(FLUSH));
        return ast.newExpressionStatement(call);
    }

    /** {@code <type> $retval = <value>;}; {@code value} must be detached from its parent. */
    VariableDeclarationStatement retval(Type type, Expression value) {
        VariableDeclarationFragment fragment = ast.newVariableDeclarationFragment();
        fragment.setName(ast.newSimpleName(RETVAL));
        fragment.setInitializer(value);
        VariableDeclarationStatement decl = ast.newVariableDeclarationStatement(fragment);
        decl.setType(type);
        return decl;
    }

    /** {@code return $retval;} */
    ReturnStatement returnRetval() {
        ReturnStatement ret = ast.newReturnStatement();
        ret.setExpression(ast.newSimpleName(RETVAL));
        return ret;
    }

    /** {@code boolean <flag> = false;} */
    VariableDeclarationStatement flagDeclaration(String flag) {
        VariableDeclarationFragment fragment = ast.newVariableDeclarationFragment();
        fragment.setName(ast.newSimpleName(flag));
        fragment.setInitializer(ast.newBooleanLiteral(false));
        VariableDeclarationStatement decl = ast.newVariableDeclarationStatement(fragment);
        decl.setType(ast.newPrimitiveType(PrimitiveType.BOOLEAN));
        return decl;
    }

    /** {@code <flag> = true;} */
    ExpressionStatement flagSet(String flag) {
        Assignment assignment = ast.newAssignment();
        assignment.setLeftHandSide(ast.newSimpleName(flag));
        assignment.setRightHandSide(ast.newBooleanLiteral(true));
        return ast.newExpressionStatement(assignment);
    }

    /** {@code if (!<flag>) { <statement> }} */
    @SuppressWarnings("unchecked")
    IfStatement unlessFlag(String flag, Statement statement) {
        PrefixExpression not = ast.newPrefixExpression();
        not.setOperator(PrefixExpression.Operator.NOT);
        not.setOperand(ast.newSimpleName(flag));
        Block then = ast.newBlock();
        then.statements().add(statement);
        IfStatement guard = ast.newIfStatement();
        guard.setExpression(not);
        guard.setThenStatement(then);
        return guard;
    }

    /** {@code @com.linetrace.runtime.Instrumented} */
    MarkerAnnotation instrumentedMarker() {
        MarkerAnnotation marker = ast.newMarkerAnnotation();
        marker.setTypeName(ast.newName(Instrumenter.MARKER));
        return marker;
    }

    Block newBlock() {
        return ast.newBlock();
    }
}
