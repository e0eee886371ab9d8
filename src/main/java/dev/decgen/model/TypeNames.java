package dev.decgen.model;

import java.util.List;
import java.util.Objects;

public final class TypeNames {

    private static final String ARRAY_SUFFIX = "[]";

    private TypeNames() {
    }

    /**
     * Key for a method: {@code name(erasure1,erasure2)} over fully qualified erasures with every
     * array dimension kept. A variadic last parameter ends in {@code ...} instead of its
     * outermost {@code []}. Two methods of one interface share a key only if Java would reject them.
     */
    public static String methodKey(String name, List<Parameter> parameters) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(parameters, "parameters");
        final var sb = new StringBuilder();
        sb.append(name).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            final var p = parameters.get(i);
            final String erasure = p.type().qualifiedName();
            if (p.variadic() && erasure.endsWith(ARRAY_SUFFIX)) {
                sb.append(erasure, 0, erasure.length() - ARRAY_SUFFIX.length()).append("...");
            } else {
                sb.append(erasure);
            }
        }
        sb.append(')');
        return sb.toString();
    }

    public static String simpleNameOfFqcn(String fqcn) {
        final int i = fqcn.lastIndexOf('.');
        return i >= 0 ? fqcn.substring(i + 1) : fqcn;
    }

    public static String packageOfFqcn(String fqcn) {
        final int i = fqcn.lastIndexOf('.');
        return i >= 0 ? fqcn.substring(0, i) : "";
    }
}
