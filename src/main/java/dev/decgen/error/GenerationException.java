package dev.decgen.error;

/**
 * Base of every failure that aborts a generation run. None of them is retried.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
