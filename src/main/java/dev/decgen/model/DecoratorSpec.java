package dev.decgen.model;

import java.util.Objects;

/**
 * What to generate: which decorator, the generated class name and the decorated interface.
 */
public record DecoratorSpec(
        DecoratorKind kind,
        String structName,
        String interfaceQualifiedName
) {

    public DecoratorSpec {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(structName, "structName");
        Objects.requireNonNull(interfaceQualifiedName, "interfaceQualifiedName");
    }

    public String interfaceSimpleName() {
        return TypeNames.simpleNameOfFqcn(interfaceQualifiedName);
    }

    public String interfacePackage() {
        return TypeNames.packageOfFqcn(interfaceQualifiedName);
    }
}
