package dev.decgen.validate;

import java.util.Optional;

import dev.decgen.model.DecoratorKind;

public final class SignatureRules {

    private SignatureRules() {
    }

    /**
     * Every decorated method takes the context carrier as its first parameter.
     */
    public static SignatureRule firstParameterIsContext(String contextType) {
        return signature -> {
            if (signature.parameters().isEmpty() || !signature.parameters().get(0).type().isContext()) {
                return Optional.of("first param must be " + contextType);
            }
            return Optional.empty();
        };
    }

    public static SignatureRule minimumParameters(int count) {
        return signature -> signature.parameters().size() < count
                ? Optional.of("expected at least " + count + " params, found " + signature.parameters().size())
                : Optional.empty();
    }

    /**
     * The rules a decorator kind adds on top of the context rule.
     * The RPC adapter drops the trailing parameter, so it needs one besides the context.
     */
    public static ValidationPipeline forKind(DecoratorKind kind, String contextType) {
        final ValidationPipeline pipeline = ValidationPipeline.of(firstParameterIsContext(contextType));
        if (kind == DecoratorKind.RPC_ADAPTER) {
            return pipeline.with(minimumParameters(2));
        }
        return pipeline;
    }
}
