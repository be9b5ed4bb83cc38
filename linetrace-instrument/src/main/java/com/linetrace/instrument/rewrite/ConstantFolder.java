package com.linetrace.instrument.rewrite;

import org.eclipse.jdt.core.dom.*;

import java.util.*;

/**
 * Evaluates constant expressions the way the compiler does when it decides reachability.
 *
 * Covers literals, casts to primitive types and String, unary and binary operators, the conditional
 * operator, and names of constant variables: final locals of the method and the owner's
 * {@code static final} fields. Constants inherited from supertypes or statically imported from
 * other types are not known here.
 */
final class ConstantFolder {

    private final Map<String, VariableDeclarationFragment> constants;
    private final Set<VariableDeclarationFragment> resolving = Collections.newSetFromMap(new IdentityHashMap<>());

    ConstantFolder(Map<String, VariableDeclarationFragment> constants) {
        this.constants = constants;
    }

    /**
     * Owner constants plus the final locals of {@code method}. A parameter or a non-final local
     * hides an owner constant of the same name.
     */
    static ConstantFolder forMethod(MethodDeclaration method, Map<String, VariableDeclarationFragment> ownerConstants) {
        Map<String, VariableDeclarationFragment> visible = new HashMap<>(ownerConstants);
        Set<String> hidden = new HashSet<>();
        for (Object p : method.parameters()) {
            hidden.add(((SingleVariableDeclaration) p).getName().getIdentifier());
        }
        Map<String, VariableDeclarationFragment> locals = new HashMap<>();
        if (method.getBody() != null) {
            method.getBody().accept(new ASTVisitor() {
                @Override
                public boolean visit(VariableDeclarationStatement node) {
                    boolean constant = Modifier.isFinal(node.getModifiers()) && isConstantType(node.getType());
                    for (Object f : node.fragments()) {
                        VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
                        String name = fragment.getName().getIdentifier();
                        if (constant && fragment.getInitializer() != null && fragment.getExtraDimensions() == 0) {
                            locals.put(name, fragment);
                        } else {
                            hidden.add(name);
                        }
                    }
                    return true;
                }

                @Override
                public boolean visit(VariableDeclarationExpression node) {
                    for (Object f : node.fragments()) {
                        hidden.add(((VariableDeclarationFragment) f).getName().getIdentifier());
                    }
                    return true;
                }

                @Override
                public boolean visit(LambdaExpression node) {
                    for (Object p : node.parameters()) {
                        hidden.add(((VariableDeclaration) p).getName().getIdentifier());
                    }
                    return true;
                }

                @Override
                public boolean visit(SingleVariableDeclaration node) {
                    hidden.add(node.getName().getIdentifier());
                    return true;
                }
            });
        }
        visible.keySet().removeAll(hidden);
        visible.putAll(locals);
        return new ConstantFolder(visible);
    }

    /** True for an absent condition or a condition that folds to {@code true}. */
    boolean isConstantTrue(Expression condition) {
        return condition == null || Boolean.TRUE.equals(value(condition));
    }

    /**
     * The value of {@code e} as Boolean, Character, Integer, Long, Float, Double or String,
     * or null when {@code e} is not a constant expression.
     */
    Object value(Expression e) {
        if (e instanceof BooleanLiteral literal) return literal.booleanValue();
        if (e instanceof CharacterLiteral literal) return literal.charValue();
        if (e instanceof StringLiteral literal) return literal.getLiteralValue();
        if (e instanceof TextBlock block) return block.getLiteralValue();
        if (e instanceof NumberLiteral literal) return number(literal.getToken());
        if (e instanceof ParenthesizedExpression p) return value(p.getExpression());
        if (e instanceof CastExpression cast) return convert(value(cast.getExpression()), cast.getType());
        if (e instanceof PrefixExpression prefix) return prefix(prefix.getOperator(), value(prefix.getOperand()));
        if (e instanceof InfixExpression infix) return infix(infix);
        if (e instanceof ConditionalExpression c) return conditional(c);
        if (e instanceof SimpleName name) return named(name.getIdentifier());
        if (e instanceof QualifiedName name) return qualified(name);
        return null;
    }

    // -----------------------------------------------------------------------
    // Names
    // -----------------------------------------------------------------------

    private Object named(String key) {
        VariableDeclarationFragment fragment = constants.get(key);
        if (fragment == null || !resolving.add(fragment)) {
            return null;
        }
        try {
            return convert(value(fragment.getInitializer()), declaredType(fragment));
        } finally {
            resolving.remove(fragment);
        }
    }

    private Object qualified(QualifiedName name) {
        Name qualifier = name.getQualifier();
        String typeName = qualifier.isSimpleName()
            ? ((SimpleName) qualifier).getIdentifier()
            : ((QualifiedName) qualifier).getName().getIdentifier();
        return named(typeName + "." + name.getName().getIdentifier());
    }

    private static Type declaredType(VariableDeclarationFragment fragment) {
        ASTNode parent = fragment.getParent();
        if (parent instanceof FieldDeclaration field) return field.getType();
        if (parent instanceof VariableDeclarationStatement statement) return statement.getType();
        return null;
    }

    private static boolean isConstantType(Type type) {
        if (type instanceof PrimitiveType) return true;
        if (type instanceof SimpleType simple) {
            String name = simple.getName().getFullyQualifiedName();
            return name.equals("String") || name.equals("java.lang.String") || name.equals("var");
        }
        return false;
    }

    // -----------------------------------------------------------------------
    // Literals and conversions
    // -----------------------------------------------------------------------

    private static Object number(String token) {
        if (token.startsWith("-")) {
            // the parser folds the sign into MIN_VALUE literals
            return prefix(PrefixExpression.Operator.MINUS, number(token.substring(1).trim()));
        }
        String t = token.replace("_", "");
        String lower = t.toLowerCase(Locale.ROOT);
        boolean hex = lower.startsWith("0x");
        try {
            if (lower.endsWith("f") && !hex) return Float.parseFloat(t);
            if (lower.endsWith("d") && !hex) return Double.parseDouble(t);
            if (hex ? lower.contains("p") : (lower.contains(".") || lower.contains("e"))) {
                return lower.endsWith("f") ? Float.parseFloat(t) : Double.parseDouble(t);
            }
            boolean isLong = lower.endsWith("l");
            String digits = isLong ? lower.substring(0, lower.length() - 1) : lower;
            long value;
            if (hex) {
                value = Long.parseUnsignedLong(digits.substring(2), 16);
            } else if (digits.startsWith("0b")) {
                value = Long.parseUnsignedLong(digits.substring(2), 2);
            } else if (digits.length() > 1 && digits.startsWith("0")) {
                value = Long.parseUnsignedLong(digits.substring(1), 8);
            } else {
                value = Long.parseUnsignedLong(digits);
            }
            return isLong ? (Object) value : (Object) (int) value;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static Object convert(Object v, Type type) {
        if (v == null || type == null) {
            return null;
        }
        if (type instanceof SimpleType simple) {
            String name = simple.getName().getFullyQualifiedName();
            if (name.equals("var")) return v;
            return (name.equals("String") || name.equals("java.lang.String")) && v instanceof String ? v : null;
        }
        if (!(type instanceof PrimitiveType primitive)) {
            return null;
        }
        PrimitiveType.Code code = primitive.getPrimitiveTypeCode();
        if (code == PrimitiveType.BOOLEAN) {
            return v instanceof Boolean ? v : null;
        }
        if (!isNumeric(v)) {
            return null;
        }
        if (code == PrimitiveType.INT) return toLong(v) == null ? (int) toDouble(v) : (int) (long) toLong(v);
        if (code == PrimitiveType.LONG) return toLong(v) == null ? (long) toDouble(v) : toLong(v);
        if (code == PrimitiveType.SHORT) return (int) (short) intOf(v);
        if (code == PrimitiveType.BYTE) return (int) (byte) intOf(v);
        if (code == PrimitiveType.CHAR) return (char) intOf(v);
        if (code == PrimitiveType.FLOAT) return (float) toDouble(v);
        if (code == PrimitiveType.DOUBLE) return toDouble(v);
        return null;
    }

    private static int intOf(Object v) {
        Long l = toLong(v);
        return l == null ? (int) toDouble(v) : (int) (long) l;
    }

    // -----------------------------------------------------------------------
    // Operators
    // -----------------------------------------------------------------------

    private static Object prefix(PrefixExpression.Operator op, Object v) {
        if (v == null) return null;
        if (op == PrefixExpression.Operator.NOT) {
            return v instanceof Boolean b ? !b : null;
        }
        if (!isNumeric(v)) return null;
        Class<?> kind = promote(v, v);
        if (op == PrefixExpression.Operator.PLUS) {
            return kind == Integer.class ? (Object) intOf(v) : v;
        }
        if (op == PrefixExpression.Operator.MINUS) {
            if (kind == Double.class) return -toDouble(v);
            if (kind == Float.class) return -(float) toDouble(v);
            if (kind == Long.class) return -toLong(v);
            return -intOf(v);
        }
        if (op == PrefixExpression.Operator.COMPLEMENT) {
            if (kind == Long.class) return ~toLong(v);
            if (kind == Integer.class) return ~intOf(v);
        }
        return null;
    }

    private Object infix(InfixExpression infix) {
        InfixExpression.Operator op = infix.getOperator();
        Object result = binary(op, value(infix.getLeftOperand()), value(infix.getRightOperand()));
        for (Object extended : infix.extendedOperands()) {
            result = binary(op, result, value((Expression) extended));
        }
        return result;
    }

    private Object conditional(ConditionalExpression c) {
        Object test = value(c.getExpression());
        Object then = value(c.getThenExpression());
        Object otherwise = value(c.getElseExpression());
        if (!(test instanceof Boolean b) || then == null || otherwise == null) {
            return null;
        }
        Object chosen = b ? then : otherwise;
        if (isNumeric(then) && isNumeric(otherwise)) {
            Class<?> kind = promote(then, otherwise);
            if (kind == Double.class) return toDouble(chosen);
            if (kind == Float.class) return (float) toDouble(chosen);
            if (kind == Long.class) return toLong(chosen);
        }
        return chosen;
    }

    private static Object binary(InfixExpression.Operator op, Object l, Object r) {
        if (l == null || r == null) {
            return null;
        }
        if (op == InfixExpression.Operator.PLUS && (l instanceof String || r instanceof String)) {
            return String.valueOf(l) + r;
        }
        if (l instanceof Boolean a && r instanceof Boolean b) {
            if (op == InfixExpression.Operator.CONDITIONAL_AND || op == InfixExpression.Operator.AND) return a && b;
            if (op == InfixExpression.Operator.CONDITIONAL_OR || op == InfixExpression.Operator.OR) return a || b;
            if (op == InfixExpression.Operator.XOR || op == InfixExpression.Operator.NOT_EQUALS) return a ^ b;
            if (op == InfixExpression.Operator.EQUALS) return a.equals(b);
            return null;
        }
        if (l instanceof String a && r instanceof String b) {
            if (op == InfixExpression.Operator.EQUALS) return a.equals(b);
            if (op == InfixExpression.Operator.NOT_EQUALS) return !a.equals(b);
            return null;
        }
        if (!isNumeric(l) || !isNumeric(r)) {
            return null;
        }
        if (op == InfixExpression.Operator.LEFT_SHIFT
                || op == InfixExpression.Operator.RIGHT_SHIFT_SIGNED
                || op == InfixExpression.Operator.RIGHT_SHIFT_UNSIGNED) {
            return shift(op, l, r);
        }
        Class<?> kind = promote(l, r);
        if (kind == Double.class || kind == Float.class) {
            double a = toDouble(l);
            double b = toDouble(r);
            Object compared = compare(op, a == b, a < b, a > b);
            if (compared != null) return compared;
            Double d = floating(op, a, b);
            if (d == null) return null;
            return kind == Float.class ? (Object) (float) (double) d : d;
        }
        long a = toLong(l);
        long b = toLong(r);
        Object compared = compare(op, a == b, a < b, a > b);
        if (compared != null) return compared;
        Long n = integral(op, a, b, kind == Integer.class);
        if (n == null) return null;
        return kind == Integer.class ? (Object) (int) (long) n : n;
    }

    private static Object compare(InfixExpression.Operator op, boolean eq, boolean lt, boolean gt) {
        if (op == InfixExpression.Operator.EQUALS) return eq;
        if (op == InfixExpression.Operator.NOT_EQUALS) return !eq;
        if (op == InfixExpression.Operator.LESS) return lt;
        if (op == InfixExpression.Operator.GREATER) return gt;
        if (op == InfixExpression.Operator.LESS_EQUALS) return lt || eq;
        if (op == InfixExpression.Operator.GREATER_EQUALS) return gt || eq;
        return null;
    }

    private static Double floating(InfixExpression.Operator op, double a, double b) {
        if (op == InfixExpression.Operator.PLUS) return a + b;
        if (op == InfixExpression.Operator.MINUS) return a - b;
        if (op == InfixExpression.Operator.TIMES) return a * b;
        if (op == InfixExpression.Operator.DIVIDE) return a / b;
        if (op == InfixExpression.Operator.REMAINDER) return a % b;
        return null;
    }

    private static Long integral(InfixExpression.Operator op, long a, long b, boolean asInt) {
        if (op == InfixExpression.Operator.PLUS) return a + b;
        if (op == InfixExpression.Operator.MINUS) return a - b;
        if (op == InfixExpression.Operator.TIMES) return asInt ? (long) ((int) a * (int) b) : a * b;
        if (op == InfixExpression.Operator.DIVIDE) {
            if (b == 0) return null;
            return asInt ? (long) ((int) a / (int) b) : a / b;
        }
        if (op == InfixExpression.Operator.REMAINDER) {
            if (b == 0) return null;
            return asInt ? (long) ((int) a % (int) b) : a % b;
        }
        if (op == InfixExpression.Operator.AND) return a & b;
        if (op == InfixExpression.Operator.OR) return a | b;
        if (op == InfixExpression.Operator.XOR) return a ^ b;
        return null;
    }

    private static Object shift(InfixExpression.Operator op, Object l, Object r) {
        Long distance = toLong(r);
        if (distance == null) return null;
        Class<?> kind = promote(l, l);
        if (kind == Long.class) {
            long a = toLong(l);
            int d = (int) (distance & 0x3f);
            if (op == InfixExpression.Operator.LEFT_SHIFT) return a << d;
            if (op == InfixExpression.Operator.RIGHT_SHIFT_SIGNED) return a >> d;
            return a >>> d;
        }
        if (kind == Integer.class) {
            int a = intOf(l);
            int d = (int) (distance & 0x1f);
            if (op == InfixExpression.Operator.LEFT_SHIFT) return a << d;
            if (op == InfixExpression.Operator.RIGHT_SHIFT_SIGNED) return a >> d;
            return a >>> d;
        }
        return null;
    }

    // -----------------------------------------------------------------------
    // Numeric promotion
    // -----------------------------------------------------------------------

    private static boolean isNumeric(Object v) {
        return v instanceof Number || v instanceof Character;
    }

    private static Class<?> promote(Object l, Object r) {
        if (l instanceof Double || r instanceof Double) return Double.class;
        if (l instanceof Float || r instanceof Float) return Float.class;
        if (l instanceof Long || r instanceof Long) return Long.class;
        return Integer.class;
    }

    /** Integral value, or null for floating-point values. */
    private static Long toLong(Object v) {
        if (v instanceof Character c) return (long) c;
        if (v instanceof Double || v instanceof Float) return null;
        return ((Number) v).longValue();
    }

    private static double toDouble(Object v) {
        if (v instanceof Character c) return c;
        return ((Number) v).doubleValue();
    }
}
