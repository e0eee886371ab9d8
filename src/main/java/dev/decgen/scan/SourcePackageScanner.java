package dev.decgen.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.PackageDeclaration;

import dev.decgen.error.ExtractionException;

/**
 * Parses every {@code .java} file directly inside one package directory.
 * Sub-directories are other packages and are not visited.
 */
public final class SourcePackageScanner {

    private final JavaParser parser;
    private int parseWarnings;

    public SourcePackageScanner() {
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public SourcePackage scan(Path dir) throws ExtractionException {
        Objects.requireNonNull(dir, "dir");
        final Path root = dir.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new ExtractionException("source location is not a directory: " + root);
        }

        final List<Path> javaFiles;
        try (var paths = Files.list(root)) {
            javaFiles = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".java"))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new ExtractionException("failed to list " + root, ex);
        }

        final List<SourceFile> files = new ArrayList<>(javaFiles.size());
        String packageName = null;
        for (var file : javaFiles) {
            final SourceFile parsed = parseFile(file);
            if (parsed == null) {
                continue;
            }
            final String pkg = parsed.unit().getPackageDeclaration()
                    .map(PackageDeclaration::getNameAsString)
                    .orElse("");
            if (packageName == null) {
                packageName = pkg;
            } else if (!packageName.equals(pkg)) {
                System.err.println("WARN: " + file + " declares package '" + pkg
                        + "', expected '" + packageName + "'");
            }
            files.add(parsed);
        }

        return new SourcePackage(root, packageName == null ? "" : packageName, files);
    }

    private SourceFile parseFile(Path file) {
        try {
            final var res = parser.parse(file);
            if (!res.getProblems().isEmpty()) {
                parseWarnings++;
                final String msg = safeMsg(res.getProblems().get(0).getMessage());
                System.err.println("WARN: parse problems in " + file + " -> " + msg);
            }
            return res.getResult().map(cu -> new SourceFile(file, cu)).orElse(null);
        } catch (IOException ex) {
            parseWarnings++;
            System.err.println("WARN: failed to read " + file + " -> " + safeMsg(ex.getMessage()));
            return null;
        }
    }

    public int parseWarningCount() {
        return parseWarnings;
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
