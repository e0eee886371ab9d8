package dev.decgen.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pattern-agnostic description of one interface method.
 * <p>
 * Results hold the returned value (none for {@code void}) followed by the terminal error
 * when the method declares a {@code throws} clause. {@code thrownTypes} keeps the declared
 * exceptions in source order so they can be redeclared.
 */
public record MethodSignature(
        String name,
        List<Parameter> parameters,
        List<Result> results,
        List<TypeRef> thrownTypes
) {

    public MethodSignature {
        Objects.requireNonNull(name, "name");
        parameters = List.copyOf(parameters);
        results = List.copyOf(results);
        thrownTypes = List.copyOf(thrownTypes);
    }

    public static MethodSignature of(String name, List<TypeRef> parameterTypes, boolean lastIsVariadic,
                                     TypeRef returnType, List<TypeRef> thrownTypes) {
        final List<Parameter> params = new ArrayList<>(parameterTypes.size());
        for (int i = 0; i < parameterTypes.size(); i++) {
            final boolean variadic = lastIsVariadic && i == parameterTypes.size() - 1;
            params.add(new Parameter(i, parameterTypes.get(i), variadic));
        }
        final List<Result> results = new ArrayList<>(2);
        if (returnType != null) {
            results.add(new Result(0, returnType, false));
        }
        if (!thrownTypes.isEmpty()) {
            results.add(new Result(results.size(), TypeRef.ERROR, true));
        }
        return new MethodSignature(name, params, results, thrownTypes);
    }

    public String key() {
        return TypeNames.methodKey(name, parameters);
    }

    public boolean hasTerminalError() {
        return !results.isEmpty() && results.get(results.size() - 1).terminalError();
    }

    /**
     * Results other than the terminal error, in order.
     */
    public List<Result> valueResults() {
        final List<Result> out = new ArrayList<>(results.size());
        for (var r : results) {
            if (!r.terminalError()) {
                out.add(r);
            }
        }
        return out;
    }
}
