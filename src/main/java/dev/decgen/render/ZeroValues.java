package dev.decgen.render;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import dev.decgen.error.ZeroValueException;
import dev.decgen.model.ScalarKind;
import dev.decgen.model.TypeRef;

/**
 * Literal "empty" values for result types.
 * <p>
 * Scalars map through two fixed tables. A primitive number takes a plain {@code 0}, which
 * Java widens to any numeric type; a wrapper is boxed from its literal, so {@code Long},
 * {@code Float} and {@code Double} need a typed one. Object references become {@code null}.
 * Arrays, interfaces, enums and the context carrier have no value the generator may
 * fabricate and are refused.
 */
public final class ZeroValues {

    private static final Map<ScalarKind, String> PRIMITIVE_LITERALS;
    private static final Map<ScalarKind, String> BOXED_LITERALS;

    static {
        final Map<ScalarKind, String> primitive = new EnumMap<>(ScalarKind.class);
        for (ScalarKind kind : ScalarKind.values()) {
            primitive.put(kind, "0");
        }
        primitive.put(ScalarKind.BOOLEAN, "false");
        primitive.put(ScalarKind.STRING, "\"\"");
        PRIMITIVE_LITERALS = Collections.unmodifiableMap(primitive);

        final Map<ScalarKind, String> boxed = new EnumMap<>(primitive);
        boxed.put(ScalarKind.LONG, "0L");
        boxed.put(ScalarKind.FLOAT, "0F");
        boxed.put(ScalarKind.DOUBLE, "0D");
        BOXED_LITERALS = Collections.unmodifiableMap(boxed);
    }

    private ZeroValues() {
    }

    public static String zeroValueOf(TypeRef type) throws ZeroValueException {
        return switch (type.kind()) {
            case SCALAR -> PRIMITIVE_LITERALS.get(type.scalar());
            case NAMED_SCALAR -> BOXED_LITERALS.get(type.scalar());
            case REFERENCE -> "null";
            case ARRAY -> throw new ZeroValueException(type.qualifiedName(), "arrays are not supported");
            case INTERFACE -> throw new ZeroValueException(type.qualifiedName(), "interfaces are not supported");
            case ENUM -> throw new ZeroValueException(type.qualifiedName(), "enums have no empty constant");
            case CONTEXT -> throw new ZeroValueException(type.qualifiedName(), "the context carrier is not a result type");
            case ERROR -> throw new ZeroValueException(type.qualifiedName(), "terminal errors are propagated, not zeroed");
        };
    }
}
