package com.linetrace.instrument.source;

import org.eclipse.jdt.core.dom.*;

import java.util.*;

/**
 * What a method can see of the types enclosing it, read from the owner's compilation unit.
 *
 * @param typeNames        simple names from the top-level type down to the declaring type
 * @param constants        {@code static final} primitive or String fields with an initializer, keyed by
 *                         simple name (innermost declaration wins) and by {@code Type.NAME}
 * @param privateMethods   names whose every declaration in the enclosing types is private
 * @param privateFields    private field names of the enclosing types
 * @param privateTypes     private member types of the enclosing types
 * @param shadowedStatics  static member names declared in more than one enclosing type, mapped to the
 *                         canonical name of the innermost one
 * @param privateOwner     simple name of the first private type on the path, or null
 */
public record OwnerMembers(
    List<String> typeNames,
    Map<String, VariableDeclarationFragment> constants,
    Set<String> privateMethods,
    Set<String> privateFields,
    Set<String> privateTypes,
    Map<String, String> shadowedStatics,
    String privateOwner
) {

    public OwnerMembers {
        typeNames = List.copyOf(typeNames);
        constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
        privateMethods = Set.copyOf(privateMethods);
        privateFields = Set.copyOf(privateFields);
        privateTypes = Set.copyOf(privateTypes);
        shadowedStatics = Collections.unmodifiableMap(new TreeMap<>(shadowedStatics));
    }

    /** Nothing known about the enclosing types; used for method text parsed on its own. */
    public static OwnerMembers none() {
        return new OwnerMembers(List.of(), Map.of(), Set.of(), Set.of(), Set.of(), Map.of(), null);
    }

    /**
     * Summarizes {@code path}, ordered from the top-level type down to the declaring type.
     */
    public static OwnerMembers of(String packageName, List<AbstractTypeDeclaration> path) {
        List<String> typeNames = new ArrayList<>();
        Map<String, VariableDeclarationFragment> constants = new LinkedHashMap<>();
        Set<String> privateMethodNames = new HashSet<>();
        Set<String> accessibleMethodNames = new HashSet<>();
        Set<String> privateFields = new HashSet<>();
        Set<String> privateTypes = new HashSet<>();
        Map<String, List<String>> declarers = new HashMap<>();
        String privateOwner = null;

        String canonical = packageName;
        for (AbstractTypeDeclaration type : path) {
            String simple = type.getName().getIdentifier();
            typeNames.add(simple);
            canonical = canonical.isEmpty() ? simple : canonical + "." + simple;
            if (privateOwner == null && Modifier.isPrivate(type.getModifiers())) {
                privateOwner = simple;
            }
            boolean implicitlyStatic = type instanceof AnnotationTypeDeclaration
                || (type instanceof TypeDeclaration td && td.isInterface());

            if (type instanceof EnumDeclaration enumType) {
                for (Object c : enumType.enumConstants()) {
                    String name = ((EnumConstantDeclaration) c).getName().getIdentifier();
                    declarers.computeIfAbsent(name, k -> new ArrayList<>()).add(canonical);
                }
            }
            for (Object member : type.bodyDeclarations()) {
                if (member instanceof FieldDeclaration field) {
                    int mods = field.getModifiers();
                    boolean isStatic = implicitlyStatic || Modifier.isStatic(mods);
                    boolean isFinal = implicitlyStatic || Modifier.isFinal(mods);
                    for (Object f : field.fragments()) {
                        VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
                        String name = fragment.getName().getIdentifier();
                        if (Modifier.isPrivate(mods)) {
                            privateFields.add(name);
                        } else if (isStatic) {
                            declarers.computeIfAbsent(name, k -> new ArrayList<>()).add(canonical);
                        }
                        if (isStatic && isFinal && fragment.getInitializer() != null
                                && fragment.getExtraDimensions() == 0 && isConstantType(field.getType())) {
                            constants.put(name, fragment);
                            constants.put(simple + "." + name, fragment);
                        }
                    }
                } else if (member instanceof MethodDeclaration method && !method.isConstructor()) {
                    String name = method.getName().getIdentifier();
                    if (Modifier.isPrivate(method.getModifiers())) {
                        privateMethodNames.add(name);
                    } else {
                        accessibleMethodNames.add(name);
                        if (implicitlyStatic || Modifier.isStatic(method.getModifiers())) {
                            declarers.computeIfAbsent(name, k -> new ArrayList<>()).add(canonical);
                        }
                    }
                } else if (member instanceof AbstractTypeDeclaration nested) {
                    String name = nested.getName().getIdentifier();
                    if (Modifier.isPrivate(nested.getModifiers())) {
                        privateTypes.add(name);
                    } else {
                        declarers.computeIfAbsent(name, k -> new ArrayList<>()).add(canonical);
                    }
                }
            }
        }

        privateMethodNames.removeAll(accessibleMethodNames);
        Map<String, String> shadowed = new HashMap<>();
        for (Map.Entry<String, List<String>> e : declarers.entrySet()) {
            List<String> owners = e.getValue();
            if (new HashSet<>(owners).size() > 1) {
                shadowed.put(e.getKey(), owners.get(owners.size() - 1));
            }
        }
        return new OwnerMembers(typeNames, constants, privateMethodNames, privateFields, privateTypes,
            shadowed, privateOwner);
    }

    private static boolean isConstantType(Type type) {
        if (type instanceof PrimitiveType) {
            return true;
        }
        if (type instanceof SimpleType simple) {
            String name = simple.getName().getFullyQualifiedName();
            return name.equals("String") || name.equals("java.lang.String");
        }
        return false;
    }
}
