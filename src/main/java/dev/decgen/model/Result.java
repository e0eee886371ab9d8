package dev.decgen.model;

import java.util.Objects;

/**
 * Method result at a fixed position: the returned value, or the terminal error.
 */
public record Result(int index, TypeRef type, boolean terminalError) {

    public Result {
        Objects.requireNonNull(type, "type");
    }
}
