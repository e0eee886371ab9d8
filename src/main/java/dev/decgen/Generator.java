package dev.decgen;

import java.nio.file.Path;
import java.util.Objects;

import dev.decgen.config.GeneratorConfig;
import dev.decgen.error.GenerationException;
import dev.decgen.error.PatternConfigurationException;
import dev.decgen.io.GeneratedFileWriter;
import dev.decgen.model.DecoratorKind;
import dev.decgen.model.DecoratorSpec;
import dev.decgen.model.InterfaceModel;
import dev.decgen.render.DecoratorRenderer;
import dev.decgen.scan.InterfaceExtractor;
import dev.decgen.scan.PackageLocator;
import dev.decgen.scan.SourcePackage;
import dev.decgen.scan.SourcePackageScanner;
import dev.decgen.validate.SignatureRules;

/**
 * One generation run: scan the package, extract and validate the interface, render the
 * decorator and write it. Nothing touches the output file before rendering succeeded.
 */
public final class Generator {

    private final GeneratorConfig config;
    private final SourcePackageScanner scanner;
    private final PackageLocator packageLocator;
    private final GeneratedFileWriter writer;

    public Generator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.scanner = new SourcePackageScanner();
        this.packageLocator = new PackageLocator();
        this.writer = new GeneratedFileWriter();
    }

    public Path generate(Path sourceDir, String interfaceName, DecoratorKind kind, String structName, Path outputFile)
            throws GenerationException {
        Objects.requireNonNull(sourceDir, "sourceDir");
        Objects.requireNonNull(interfaceName, "interfaceName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(structName, "structName");
        Objects.requireNonNull(outputFile, "outputFile");

        final Path target = outputFile.toAbsolutePath().normalize();
        final String expectedFile = structName + ".java";
        if (!expectedFile.equals(target.getFileName().toString())) {
            throw new PatternConfigurationException("output file must be named " + expectedFile
                    + " to hold public class " + structName + ", got " + target.getFileName());
        }

        if (kind == DecoratorKind.TRACE && !GeneratorConfig.DEFAULT_CONTEXT_TYPE.equals(config.contextType())) {
            throw new PatternConfigurationException("trace decorators parent spans on "
                    + GeneratorConfig.DEFAULT_CONTEXT_TYPE + ", not on context type " + config.contextType());
        }

        // Step 1: parse the package holding the interface
        final SourcePackage source = scanner.scan(sourceDir);
        if (scanner.parseWarningCount() > 0) {
            System.err.println("WARN: parse warnings: " + scanner.parseWarningCount());
        }

        // Step 2: extract and validate
        final InterfaceModel model = new InterfaceExtractor(config.contextType()).extract(source, interfaceName);
        SignatureRules.forKind(kind, config.contextType()).validate(model);

        if (kind == DecoratorKind.TRANSACTION_WRAP && config.readOnlyMethods().isEmpty()) {
            System.out.println("NOTE: every method of " + interfaceName + " runs in a transaction;"
                    + " list read-only methods under readOnlyMethods in the config to skip it");
        }

        // Step 3: render, then write
        final String destinationPackage = packageLocator.locate(target.getParent(), target, source, config.packageName());
        final DecoratorSpec spec = new DecoratorSpec(kind, structName, model.qualifiedName());
        final String content = new DecoratorRenderer(destinationPackage, config::isReadOnly).render(spec, model);
        return writer.write(target, content);
    }
}
