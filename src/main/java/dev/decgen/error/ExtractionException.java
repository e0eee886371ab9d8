package dev.decgen.error;

/**
 * The interface (or the packages around it) could not be read from source.
 */
public class ExtractionException extends GenerationException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
