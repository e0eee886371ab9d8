package dev.decgen.error;

public class ZeroValueException extends GenerationException {

    private final String typeName;
    private final String reason;

    public ZeroValueException(String typeName, String reason) {
        super("no zero value known for type " + typeName + ": " + reason);
        this.typeName = typeName;
        this.reason = reason;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Same failure, naming the method whose result needed the zero value.
     */
    public ZeroValueException inMethod(String method) {
        return new ZeroValueException(typeName, reason + " (result of method '" + method + "')");
    }
}
