package dev.decgen.error;

public class TypeResolutionException extends ExtractionException {

    public TypeResolutionException(String message) {
        super(message);
    }
}
