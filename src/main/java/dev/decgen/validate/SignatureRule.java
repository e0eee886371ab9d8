package dev.decgen.validate;

import java.util.Optional;

import dev.decgen.model.MethodSignature;

/**
 * A check on one method. Returns the failure message, or empty when the method passes.
 * Rules hold no state and may be composed freely.
 */
@FunctionalInterface
public interface SignatureRule {

    Optional<String> check(MethodSignature signature);
}
