package dev.decgen.error;

import java.util.List;

/**
 * One or more methods failed a signature rule.
 */
public class ValidationException extends GenerationException {

    private final List<MethodFailure> failures;

    public ValidationException(List<MethodFailure> failures) {
        super(describe(failures));
        this.failures = List.copyOf(failures);
    }

    public List<MethodFailure> failures() {
        return failures;
    }

    private static String describe(List<MethodFailure> failures) {
        final var sb = new StringBuilder();
        for (var f : failures) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append("failed to validate method '").append(f.method()).append("': ").append(f.message());
        }
        return sb.toString();
    }

    public record MethodFailure(String method, String message) {
    }
}
