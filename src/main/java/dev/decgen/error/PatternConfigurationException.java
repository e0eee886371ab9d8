package dev.decgen.error;

public class PatternConfigurationException extends GenerationException {

    public PatternConfigurationException(String message) {
        super(message);
    }
}
