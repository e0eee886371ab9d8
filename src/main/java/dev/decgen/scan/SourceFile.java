package dev.decgen.scan;

import java.nio.file.Path;

import com.github.javaparser.ast.CompilationUnit;

public record SourceFile(Path path, CompilationUnit unit) {
}
