package dev.decgen.model;

import java.util.Objects;

/**
 * Method parameter at a fixed position. A varargs parameter carries its array type.
 */
public record Parameter(int index, TypeRef type, boolean variadic) {

    public Parameter {
        Objects.requireNonNull(type, "type");
        if (index < 0) {
            throw new IllegalArgumentException("negative index: " + index);
        }
    }
}
