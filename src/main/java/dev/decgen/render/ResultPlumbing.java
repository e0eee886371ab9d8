package dev.decgen.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import dev.decgen.error.ZeroValueException;
import dev.decgen.model.MethodSignature;
import dev.decgen.model.Result;

/**
 * How results travel through a generated method: the bindings the delegated call
 * fills, the values left on the failure path and the values returned on success.
 * Shared by every decorator kind.
 */
public final class ResultPlumbing {

    private final MethodSignature signature;
    private final List<String> zeroValues;

    private ResultPlumbing(MethodSignature signature, List<String> zeroValues) {
        this.signature = signature;
        this.zeroValues = List.copyOf(zeroValues);
    }

    public static ResultPlumbing of(MethodSignature signature) throws ZeroValueException {
        Objects.requireNonNull(signature, "signature");
        final List<String> zeros = new ArrayList<>();
        for (Result r : signature.valueResults()) {
            try {
                zeros.add(ZeroValues.zeroValueOf(r.type()));
            } catch (ZeroValueException ex) {
                throw ex.inMethod(signature.name());
            }
        }
        return new ResultPlumbing(signature, zeros);
    }

    /**
     * Zero values of the non-error results followed by the error binding, by result index.
     * The generated body starts every result binding from this path.
     */
    public List<String> errorPath() {
        final List<String> out = new ArrayList<>(zeroValues);
        if (signature.hasTerminalError()) {
            out.add(ParameterNames.ERROR);
        }
        return out;
    }

    /**
     * Result bindings followed by {@code null} in the error slot, by result index.
     * The generated body returns the value slot of this path.
     */
    public List<String> successPath() {
        final List<String> out = new ArrayList<>();
        for (Result r : signature.results()) {
            out.add(r.terminalError() ? "null" : ParameterNames.bindingOf(r));
        }
        return out;
    }

    /**
     * Left-hand side of the delegated call: empty when nothing but the error comes back.
     */
    public String assignment() {
        final List<Result> values = signature.valueResults();
        if (values.isEmpty()) {
            return "";
        }
        final List<String> bindings = new ArrayList<>(values.size());
        for (Result r : values) {
            bindings.add(ParameterNames.bindingOf(r));
        }
        return String.join(", ", bindings) + " = ";
    }

    public Optional<Result> valueResult() {
        final List<Result> values = signature.valueResults();
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }
}
