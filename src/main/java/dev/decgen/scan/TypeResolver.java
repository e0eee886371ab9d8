package dev.decgen.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.WildcardType;
import com.squareup.javapoet.ArrayTypeName;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.WildcardTypeName;

import dev.decgen.error.TypeResolutionException;
import dev.decgen.model.ScalarKind;
import dev.decgen.model.TypeKind;
import dev.decgen.model.TypeRef;

/**
 * Light, import-based resolution of source type references.
 * <p>
 * A simple name is looked up, in order, among the member types of the owning declaration,
 * single-type imports, the top-level types of the scanned package, {@code java.lang}, and
 * on-demand imports whose candidate class can be loaded. Dotted names starting with a
 * lower-case segment are taken as fully qualified.
 */
public final class TypeResolver {

    private final SourcePackage sourcePackage;
    private final String contextType;

    public TypeResolver(SourcePackage sourcePackage, String contextType) {
        this.sourcePackage = Objects.requireNonNull(sourcePackage, "sourcePackage");
        this.contextType = Objects.requireNonNull(contextType, "contextType");
    }

    public TypeRef resolve(Type type, CompilationUnit unit, TypeDeclaration<?> owner) throws TypeResolutionException {
        if (type.isPrimitiveType()) {
            final String name = type.asPrimitiveType().asString();
            final ScalarKind scalar = ScalarKind.ofPrimitive(name)
                    .orElseThrow(() -> new TypeResolutionException("unknown primitive type '" + name + "'"));
            return TypeRef.scalar(scalar, primitive(scalar), false);
        }
        if (type.isArrayType()) {
            return arrayOf(resolve(type.asArrayType().getComponentType(), unit, owner));
        }
        if (type.isClassOrInterfaceType()) {
            return resolveDeclared(type.asClassOrInterfaceType(), unit, owner);
        }
        throw new TypeResolutionException("unsupported type '" + type + "'");
    }

    public TypeRef arrayOf(TypeRef component) {
        return TypeRef.of(component.qualifiedName() + "[]", TypeKind.ARRAY, ArrayTypeName.of(component.javaType()));
    }

    public ClassName resolveClassName(String dotted, CompilationUnit unit, TypeDeclaration<?> owner)
            throws TypeResolutionException {
        final int dot = dotted.indexOf('.');
        final String first = dot < 0 ? dotted : dotted.substring(0, dot);
        if (dot > 0 && Character.isLowerCase(first.charAt(0))) {
            try {
                return ClassName.bestGuess(dotted);
            } catch (IllegalArgumentException ex) {
                throw new TypeResolutionException("cannot resolve qualified type '" + dotted + "'");
            }
        }

        ClassName base = resolveSimple(first, unit, owner);
        if (dot > 0) {
            for (String segment : dotted.substring(dot + 1).split("\\.")) {
                base = base.nestedClass(segment);
            }
        }
        return base;
    }

    private TypeRef resolveDeclared(ClassOrInterfaceType type, CompilationUnit unit, TypeDeclaration<?> owner)
            throws TypeResolutionException {
        final ClassName raw = resolveClassName(type.getNameWithScope(), unit, owner);
        final String fqcn = raw.canonicalName();

        if ("java.lang.String".equals(fqcn)) {
            return TypeRef.scalar(ScalarKind.STRING, raw, false);
        }
        final Optional<ScalarKind> wrapped = ScalarKind.ofWrapper(fqcn);
        if (wrapped.isPresent()) {
            return TypeRef.scalar(wrapped.get(), raw, true);
        }

        TypeName javaType = raw;
        if (type.getTypeArguments().isPresent()) {
            final List<TypeName> args = new ArrayList<>();
            for (Type arg : type.getTypeArguments().get()) {
                args.add(typeArgument(arg, unit, owner));
            }
            if (!args.isEmpty()) {
                javaType = ParameterizedTypeName.get(raw, args.toArray(new TypeName[0]));
            }
        }
        return TypeRef.of(fqcn, classify(raw), javaType);
    }

    private TypeName typeArgument(Type arg, CompilationUnit unit, TypeDeclaration<?> owner)
            throws TypeResolutionException {
        if (arg instanceof WildcardType wildcard) {
            if (wildcard.getExtendedType().isPresent()) {
                return WildcardTypeName.subtypeOf(resolve(wildcard.getExtendedType().get(), unit, owner).javaType());
            }
            if (wildcard.getSuperType().isPresent()) {
                return WildcardTypeName.supertypeOf(resolve(wildcard.getSuperType().get(), unit, owner).javaType());
            }
            return WildcardTypeName.subtypeOf(Object.class);
        }
        return resolve(arg, unit, owner).javaType();
    }

    private ClassName resolveSimple(String name, CompilationUnit unit, TypeDeclaration<?> owner)
            throws TypeResolutionException {
        if (owner != null) {
            final ClassName ownerName = ClassName.get(sourcePackage.packageName(), owner.getNameAsString());
            if (owner.getNameAsString().equals(name)) {
                return ownerName;
            }
            for (BodyDeclaration<?> member : owner.getMembers()) {
                if (member instanceof TypeDeclaration<?> nested && nested.getNameAsString().equals(name)) {
                    return ownerName.nestedClass(name);
                }
            }
        }

        for (ImportDeclaration imp : unit.getImports()) {
            if (imp.isStatic() || imp.isAsterisk()) {
                continue;
            }
            final String imported = imp.getNameAsString();
            if (imported.equals(name) || imported.endsWith("." + name)) {
                return ClassName.bestGuess(imported);
            }
        }

        if (sourcePackage.declaresTopLevel(name)) {
            return ClassName.get(sourcePackage.packageName(), name);
        }

        if (loadClass("java.lang." + name).isPresent()) {
            return ClassName.get("java.lang", name);
        }

        for (ImportDeclaration imp : unit.getImports()) {
            if (imp.isStatic() || !imp.isAsterisk()) {
                continue;
            }
            final String candidate = imp.getNameAsString() + "." + name;
            final Optional<Class<?>> loaded = loadClass(candidate);
            if (loaded.isPresent()) {
                return ClassName.get(loaded.get());
            }
        }

        final String where = unit.getStorage().map(s -> s.getPath().getFileName().toString()).orElse("<source>");
        throw new TypeResolutionException("cannot resolve type '" + name + "' in " + where
                + "; declare it in the package or import it by name");
    }

    /**
     * Classifies a declared type from the scanned package or, failing that, the class path.
     * Types visible in neither place are opaque references.
     */
    TypeKind classify(ClassName name) {
        if (name.canonicalName().equals(contextType)) {
            return TypeKind.CONTEXT;
        }
        if (name.packageName().equals(sourcePackage.packageName())) {
            final Optional<TypeDeclaration<?>> decl = findDeclaration(name);
            if (decl.isPresent()) {
                return kindOf(decl.get());
            }
        }
        final Optional<Class<?>> loaded = loadClass(name.reflectionName());
        if (loaded.isPresent()) {
            final Class<?> c = loaded.get();
            if (c.isEnum()) {
                return TypeKind.ENUM;
            }
            return c.isInterface() ? TypeKind.INTERFACE : TypeKind.REFERENCE;
        }
        return TypeKind.REFERENCE;
    }

    private Optional<TypeDeclaration<?>> findDeclaration(ClassName name) {
        final List<String> simpleNames = name.simpleNames();
        final var top = sourcePackage.findTopLevel(simpleNames.get(0));
        if (top.isEmpty()) {
            return Optional.empty();
        }
        TypeDeclaration<?> current = top.get().declaration();
        for (int i = 1; i < simpleNames.size(); i++) {
            TypeDeclaration<?> next = null;
            for (BodyDeclaration<?> member : current.getMembers()) {
                if (member instanceof TypeDeclaration<?> nested && nested.getNameAsString().equals(simpleNames.get(i))) {
                    next = nested;
                    break;
                }
            }
            if (next == null) {
                return Optional.empty();
            }
            current = next;
        }
        return Optional.of(current);
    }

    private static TypeKind kindOf(TypeDeclaration<?> decl) {
        if (decl instanceof EnumDeclaration) {
            return TypeKind.ENUM;
        }
        if (decl instanceof AnnotationDeclaration) {
            return TypeKind.INTERFACE;
        }
        if (decl instanceof ClassOrInterfaceDeclaration cid && cid.isInterface()) {
            return TypeKind.INTERFACE;
        }
        return TypeKind.REFERENCE;
    }

    private static TypeName primitive(ScalarKind scalar) {
        return switch (scalar) {
            case INT -> TypeName.INT;
            case LONG -> TypeName.LONG;
            case SHORT -> TypeName.SHORT;
            case BYTE -> TypeName.BYTE;
            case CHAR -> TypeName.CHAR;
            case FLOAT -> TypeName.FLOAT;
            case DOUBLE -> TypeName.DOUBLE;
            case BOOLEAN -> TypeName.BOOLEAN;
            case STRING -> ClassName.get(String.class);
        };
    }

    private static Optional<Class<?>> loadClass(String binaryName) {
        try {
            return Optional.of(Class.forName(binaryName, false, TypeResolver.class.getClassLoader()));
        } catch (ClassNotFoundException | LinkageError ex) {
            return Optional.empty();
        }
    }
}
