package dev.decgen.error;

import java.nio.file.Path;

public class PackageResolutionException extends ExtractionException {

    public PackageResolutionException(Path dir) {
        super("cannot determine the Java package of " + dir + " (pass --package)");
    }
}
