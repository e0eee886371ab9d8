package dev.decgen.error;

import java.nio.file.Path;

public class WriteException extends GenerationException {

    public WriteException(Path file, Throwable cause) {
        super("failed to write " + file + ": " + cause.getMessage(), cause);
    }
}
