package dev.decgen.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Settings shared by every generation run, read from a JSON file.
 * <pre>
 * {
 *   "contextType": "io.opentelemetry.context.Context",
 *   "readOnlyMethods": ["get", "count"],
 *   "packageName": "com.acme.store.gen"
 * }
 * </pre>
 *
 * @param contextType     fully qualified name of the type every method must take first
 * @param readOnlyMethods method names the transaction decorator runs without a transaction
 * @param packageName     package of the generated class; located from the output directory when null
 */
public record GeneratorConfig(
        String contextType,
        List<String> readOnlyMethods,
        String packageName
) {

    public static final String DEFAULT_CONTEXT_TYPE = "io.opentelemetry.context.Context";

    public GeneratorConfig {
        if (contextType == null || contextType.isBlank()) {
            contextType = DEFAULT_CONTEXT_TYPE;
        }
        readOnlyMethods = readOnlyMethods == null ? List.of() : List.copyOf(readOnlyMethods);
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, null, null);
    }

    public static GeneratorConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Config file not found: " + file);
        }
        final ObjectMapper mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper.readValue(file.toFile(), GeneratorConfig.class);
    }

    public GeneratorConfig withContextType(String value) {
        return new GeneratorConfig(value, readOnlyMethods, packageName);
    }

    public GeneratorConfig withPackageName(String value) {
        return new GeneratorConfig(contextType, readOnlyMethods, value);
    }

    public boolean isReadOnly(String methodName) {
        return readOnlyMethods.contains(methodName);
    }
}
