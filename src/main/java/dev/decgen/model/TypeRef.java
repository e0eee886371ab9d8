package dev.decgen.model;

import java.util.Objects;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.TypeName;

/**
 * Resolved reference to a type.
 *
 * @param qualifiedName erasure, e.g. {@code java.util.List} or {@code com.acme.Item[]}
 * @param kind          classification used for validation and zero values
 * @param scalar        underlying scalar for {@link TypeKind#SCALAR} and {@link TypeKind#NAMED_SCALAR}, else null
 * @param javaType      the type as it is written in generated code, generic arguments included
 */
public record TypeRef(
        String qualifiedName,
        TypeKind kind,
        ScalarKind scalar,
        TypeName javaType
) {

    /** Terminal error carrier: whatever a Java method can throw. */
    public static final TypeRef ERROR = new TypeRef(
            "java.lang.Throwable", TypeKind.ERROR, null, ClassName.get(Throwable.class));

    public TypeRef {
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(javaType, "javaType");
        if ((kind == TypeKind.SCALAR || kind == TypeKind.NAMED_SCALAR) && scalar == null) {
            throw new IllegalArgumentException("scalar kind required for " + qualifiedName);
        }
    }

    public static TypeRef of(String qualifiedName, TypeKind kind, TypeName javaType) {
        return new TypeRef(qualifiedName, kind, null, javaType);
    }

    public static TypeRef scalar(ScalarKind scalar, TypeName javaType, boolean wrapper) {
        final String name = javaType.isPrimitive() ? javaType.toString() : scalar.className();
        return new TypeRef(name, wrapper ? TypeKind.NAMED_SCALAR : TypeKind.SCALAR, scalar, javaType);
    }

    public boolean isContext() {
        return kind == TypeKind.CONTEXT;
    }
}
