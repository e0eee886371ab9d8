package dev.decgen.error;

public class InterfaceNotFoundException extends ExtractionException {

    public InterfaceNotFoundException(String interfaceName, String location) {
        super("no type declaration named '" + interfaceName + "' in " + location);
    }
}
