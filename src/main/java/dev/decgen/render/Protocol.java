package dev.decgen.render;

import java.util.Objects;

import com.squareup.javapoet.CodeBlock;

/**
 * Per-method hooks of a decorator around the delegated call.
 *
 * @param target           expression the call is made on, e.g. {@code next}
 * @param dropLastArgument forward every parameter but the last
 * @param before           statements ahead of the call, outside the guarded block
 * @param after            statements after a successful call, inside the guarded block
 * @param onError          statements run when the call (or an after step) fails, before rethrowing
 * @param always           statements run on every exit
 */
public record Protocol(
        String target,
        boolean dropLastArgument,
        CodeBlock before,
        CodeBlock after,
        CodeBlock onError,
        CodeBlock always
) {

    private static final CodeBlock NONE = CodeBlock.builder().build();

    public Protocol {
        Objects.requireNonNull(target, "target");
        before = before == null ? NONE : before;
        after = after == null ? NONE : after;
        onError = onError == null ? NONE : onError;
        always = always == null ? NONE : always;
    }

    public static Protocol delegateTo(String target) {
        return new Protocol(target, false, NONE, NONE, NONE, NONE);
    }

    public Protocol withoutLastArgument() {
        return new Protocol(target, true, before, after, onError, always);
    }

    public Protocol withBefore(CodeBlock code) {
        return new Protocol(target, dropLastArgument, code, after, onError, always);
    }

    public Protocol withAfter(CodeBlock code) {
        return new Protocol(target, dropLastArgument, before, code, onError, always);
    }

    public Protocol withOnError(CodeBlock code) {
        return new Protocol(target, dropLastArgument, before, after, code, always);
    }

    public Protocol withAlways(CodeBlock code) {
        return new Protocol(target, dropLastArgument, before, after, onError, code);
    }

    /**
     * True when the call needs a try block: something must run on failure or on every exit.
     */
    public boolean guarded() {
        return !onError.isEmpty() || !always.isEmpty();
    }

    public boolean hasHooks() {
        return guarded() || !before.isEmpty() || !after.isEmpty();
    }
}
