package dev.decgen.error;

public class RenderException extends GenerationException {

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
