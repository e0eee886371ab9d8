package dev.decgen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Small source trees for tests, laid out under {@code src/main/java}.
 */
public final class SourceFixtures {

    public static final String STORE_PACKAGE = "com.acme.store";
    public static final String CTX = STORE_PACKAGE + ".Ctx";

    private SourceFixtures() {
    }

    public static Path write(Path dir, String fileName, String... lines) throws IOException {
        Files.createDirectories(dir);
        final Path file = dir.resolve(fileName);
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    public static Path packageDir(Path root, String packageName) {
        return root.resolve("src/main/java").resolve(packageName.replace('.', '/'));
    }

    /**
     * A store package whose methods take the OpenTelemetry context first.
     */
    public static Path otelStore(Path root) throws IOException {
        final Path dir = packageDir(root, STORE_PACKAGE);
        write(dir, "Item.java",
                "package com.acme.store;",
                "",
                "public record Item(String id, String name) {",
                "}");
        write(dir, "StoreException.java",
                "package com.acme.store;",
                "",
                "public class StoreException extends Exception {",
                "    public StoreException(String message) {",
                "        super(message);",
                "    }",
                "}");
        write(dir, "Store.java",
                "package com.acme.store;",
                "",
                "import io.opentelemetry.context.Context;",
                "",
                "public interface Store {",
                "    Item get(Context ctx, String id) throws StoreException;",
                "",
                "    void put(Context ctx, Item item) throws StoreException;",
                "",
                "    long count(Context ctx);",
                "",
                "    boolean rename(Context ctx, String id, String name) throws StoreException;",
                "}");
        return dir;
    }

    /**
     * A store package using its own {@code Ctx} type, so generated code compiles with the JDK alone.
     */
    public static Path plainStore(Path root) throws IOException {
        final Path dir = packageDir(root, STORE_PACKAGE);
        write(dir, "Ctx.java",
                "package com.acme.store;",
                "",
                "public interface Ctx {",
                "}");
        write(dir, "StoreException.java",
                "package com.acme.store;",
                "",
                "public class StoreException extends Exception {",
                "    public StoreException(String message) {",
                "        super(message);",
                "    }",
                "}");
        write(dir, "Store.java",
                "package com.acme.store;",
                "",
                "public interface Store {",
                "    String get(Ctx ctx, String id) throws StoreException;",
                "",
                "    void put(Ctx ctx, String id, String value) throws StoreException;",
                "",
                "    int count(Ctx ctx);",
                "}");
        write(dir, "GreeterClient.java",
                "package com.acme.store;",
                "",
                "public interface GreeterClient {",
                "    String greet(Ctx ctx, String name, String... options) throws StoreException;",
                "}");
        write(dir, "GreeterServer.java",
                "package com.acme.store;",
                "",
                "public interface GreeterServer {",
                "    String greet(Ctx ctx, String name) throws StoreException;",
                "}");
        return dir;
    }
}
