package dev.decgen.scan;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.github.javaparser.ast.body.TypeDeclaration;

/**
 * All parsed compilation units of one package directory.
 */
public record SourcePackage(
        Path dir,
        String packageName,
        List<SourceFile> files
) {

    public SourcePackage {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(packageName, "packageName");
        files = List.copyOf(files);
    }

    public Optional<DeclaredType> findTopLevel(String simpleName) {
        for (var file : files) {
            for (TypeDeclaration<?> td : file.unit().getTypes()) {
                if (td.getNameAsString().equals(simpleName)) {
                    return Optional.of(new DeclaredType(file, td));
                }
            }
        }
        return Optional.empty();
    }

    public boolean declaresTopLevel(String simpleName) {
        return findTopLevel(simpleName).isPresent();
    }

    /**
     * A top-level type declaration together with the file that declares it.
     */
    public record DeclaredType(SourceFile file, TypeDeclaration<?> declaration) {
    }
}
