package dev.decgen.model;

import java.util.Optional;

/**
 * Underlying representation of primitives, their wrappers and {@code String}.
 */
public enum ScalarKind {
    INT("int", "java.lang.Integer"),
    LONG("long", "java.lang.Long"),
    SHORT("short", "java.lang.Short"),
    BYTE("byte", "java.lang.Byte"),
    CHAR("char", "java.lang.Character"),
    FLOAT("float", "java.lang.Float"),
    DOUBLE("double", "java.lang.Double"),
    BOOLEAN("boolean", "java.lang.Boolean"),
    STRING(null, "java.lang.String");

    private final String primitive;
    private final String className;

    ScalarKind(String primitive, String className) {
        this.primitive = primitive;
        this.className = className;
    }

    public String className() {
        return className;
    }

    public static Optional<ScalarKind> ofPrimitive(String name) {
        for (ScalarKind kind : values()) {
            if (kind.primitive != null && kind.primitive.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Wrapper classes only; {@code String} is a scalar of its own and not a wrapper.
     */
    public static Optional<ScalarKind> ofWrapper(String fqcn) {
        for (ScalarKind kind : values()) {
            if (kind.primitive != null && kind.className.equals(fqcn)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
