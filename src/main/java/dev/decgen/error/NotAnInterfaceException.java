package dev.decgen.error;

public class NotAnInterfaceException extends ExtractionException {

    public NotAnInterfaceException(String typeName, String actualKind) {
        super("'" + typeName + "' is a " + actualKind + ", not an interface");
    }
}
