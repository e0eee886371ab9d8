package dev.decgen.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import dev.decgen.error.WriteException;

/**
 * Writes a rendered compilation unit. The content goes to a temporary file next to the
 * target first and is then moved over it, so readers never see a half-written file.
 */
public final class GeneratedFileWriter {

    public Path write(Path target, String content) throws WriteException {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(content, "content");

        final Path file = target.toAbsolutePath().normalize();
        final Path dir = file.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + file.getFileName(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            move(tmp, file);
            return file;
        } catch (IOException ex) {
            deleteQuietly(tmp);
            throw new WriteException(file, ex);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ex) {
            System.err.println("WARN: failed to remove temporary file " + tmp + " -> " + ex.getMessage());
        }
    }
}
