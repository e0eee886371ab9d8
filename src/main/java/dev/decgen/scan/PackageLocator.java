package dev.decgen.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.PackageDeclaration;

import dev.decgen.error.PackageResolutionException;

/**
 * Determines the Java package that a generated file in a given directory belongs to.
 * Strategy:
 * 1) explicit package name
 * 2) package declaration of another .java file already in the directory
 * 3) the source package, when writing next to the interface
 * 4) path segments below a .../src/(main|test|...)/java source root
 */
public final class PackageLocator {

    private final JavaParser parser;

    public PackageLocator() {
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public String locate(Path dir, Path outputFile, SourcePackage source, String explicitPackage)
            throws PackageResolutionException {

        if (explicitPackage != null && !explicitPackage.isBlank()) {
            return explicitPackage.trim();
        }

        final Path abs = dir.toAbsolutePath().normalize();
        final Optional<String> declared = declaredPackage(abs, outputFile);
        if (declared.isPresent()) {
            return declared.get();
        }

        if (abs.equals(source.dir())) {
            return source.packageName();
        }

        return fromSourceRoot(abs).orElseThrow(() -> new PackageResolutionException(abs));
    }

    private Optional<String> declaredPackage(Path dir, Path outputFile) {
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        final Path self = outputFile.toAbsolutePath().normalize();
        final List<Path> siblings;
        try (var paths = Files.list(dir)) {
            siblings = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".java"))
                    .filter(path -> !path.toAbsolutePath().normalize().equals(self))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            System.err.println("WARN: failed to list " + dir + " -> " + ex.getMessage());
            return Optional.empty();
        }

        for (var file : siblings) {
            try {
                final var res = parser.parse(file);
                final var pkg = res.getResult()
                        .flatMap(cu -> cu.getPackageDeclaration())
                        .map(PackageDeclaration::getNameAsString);
                if (pkg.isPresent()) {
                    return pkg;
                }
            } catch (IOException ex) {
                System.err.println("WARN: failed to read " + file + " -> " + ex.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * .../src/main/java/com/acme/store -> com.acme.store
     */
    static Optional<String> fromSourceRoot(Path dir) {
        final int n = dir.getNameCount();
        for (int i = n - 3; i >= 0; i--) {
            final String src = dir.getName(i).toString();
            final String set = dir.getName(i + 1).toString();
            final String java = dir.getName(i + 2).toString();
            if (!"src".equals(src) || set.isBlank() || !"java".equals(java)) {
                continue;
            }
            final List<String> segments = new ArrayList<>();
            for (int j = i + 3; j < n; j++) {
                segments.add(dir.getName(j).toString());
            }
            return Optional.of(String.join(".", segments));
        }
        return Optional.empty();
    }
}
