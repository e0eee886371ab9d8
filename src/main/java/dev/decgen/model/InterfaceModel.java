package dev.decgen.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Method set of one interface, keyed by {@link MethodSignature#key()}.
 * Iteration follows declaration order.
 */
public record InterfaceModel(
        String name,
        String packageName,
        Map<String, MethodSignature> methods
) {

    public InterfaceModel {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(packageName, "packageName");
        methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    public String qualifiedName() {
        return packageName.isEmpty() ? name : packageName + "." + name;
    }
}
