package dev.decgen.validate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import dev.decgen.error.ValidationException;
import dev.decgen.model.InterfaceModel;
import dev.decgen.model.MethodSignature;

/**
 * Ordered list of {@link SignatureRule}s applied to every method of an interface.
 * <p>
 * For one method the rules run in registration order and stop at the first failure.
 * All methods are checked before the run is rejected, so one failure report names
 * every offending method.
 */
public final class ValidationPipeline {

    private final List<SignatureRule> rules;

    private ValidationPipeline(List<SignatureRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ValidationPipeline of(SignatureRule... rules) {
        return new ValidationPipeline(Arrays.asList(rules));
    }

    public ValidationPipeline with(SignatureRule rule) {
        final List<SignatureRule> next = new ArrayList<>(rules);
        next.add(rule);
        return new ValidationPipeline(next);
    }

    public Optional<String> check(MethodSignature signature) {
        for (SignatureRule rule : rules) {
            final Optional<String> failure = rule.check(signature);
            if (failure.isPresent()) {
                return failure;
            }
        }
        return Optional.empty();
    }

    public void validate(InterfaceModel model) throws ValidationException {
        final List<ValidationException.MethodFailure> failures = new ArrayList<>();
        for (MethodSignature signature : model.methods().values()) {
            check(signature).ifPresent(msg ->
                    failures.add(new ValidationException.MethodFailure(signature.name(), msg)));
        }
        if (!failures.isEmpty()) {
            throw new ValidationException(failures);
        }
    }
}
