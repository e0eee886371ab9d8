package dev.decgen.scan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.ReferenceType;
import com.squareup.javapoet.ClassName;

import dev.decgen.error.ExtractionException;
import dev.decgen.error.InterfaceNotFoundException;
import dev.decgen.error.NotAnInterfaceException;
import dev.decgen.error.TypeResolutionException;
import dev.decgen.model.InterfaceModel;
import dev.decgen.model.MethodSignature;
import dev.decgen.model.TypeRef;

/**
 * Finds one interface among the top-level types of a package and turns its abstract
 * methods into {@link MethodSignature}s. Super-interfaces declared in the same package
 * contribute their methods after the interface's own.
 */
public final class InterfaceExtractor {

    private final String contextType;

    public InterfaceExtractor(String contextType) {
        this.contextType = Objects.requireNonNull(contextType, "contextType");
    }

    public InterfaceModel extract(SourcePackage sourcePackage, String interfaceName) throws ExtractionException {
        Objects.requireNonNull(sourcePackage, "sourcePackage");
        Objects.requireNonNull(interfaceName, "interfaceName");

        final var found = sourcePackage.findTopLevel(interfaceName)
                .orElseThrow(() -> new InterfaceNotFoundException(interfaceName, sourcePackage.dir().toString()));
        final ClassOrInterfaceDeclaration iface = asInterface(found.declaration());

        final TypeResolver resolver = new TypeResolver(sourcePackage, contextType);
        final Map<String, MethodSignature> methods = new LinkedHashMap<>();
        final Set<String> visited = new HashSet<>();
        visited.add(interfaceName);
        collect(sourcePackage, resolver, found.file().unit(), iface, methods, visited);

        return new InterfaceModel(interfaceName, sourcePackage.packageName(), methods);
    }

    private void collect(SourcePackage sourcePackage,
                         TypeResolver resolver,
                         CompilationUnit unit,
                         ClassOrInterfaceDeclaration iface,
                         Map<String, MethodSignature> methods,
                         Set<String> visited) throws ExtractionException {

        if (iface.getTypeParameters().isNonEmpty()) {
            throw new TypeResolutionException("generic interface '" + iface.getNameAsString() + "' is not supported");
        }

        final Set<String> declared = new HashSet<>();
        for (MethodDeclaration md : iface.getMethods()) {
            if (md.isDefault() || md.isStatic() || md.isPrivate()) {
                continue;
            }
            final MethodSignature signature = signatureOf(resolver, unit, iface, md);
            if (!declared.add(signature.key())) {
                throw new TypeResolutionException("method '" + md.getNameAsString() + "' of '"
                        + iface.getNameAsString() + "' is declared twice as " + signature.key());
            }
            // the first declaration seen wins over one inherited again through another path
            methods.putIfAbsent(signature.key(), signature);
        }

        for (ClassOrInterfaceType parent : iface.getExtendedTypes()) {
            final ClassName parentName = resolver.resolveClassName(parent.getNameWithScope(), unit, iface);
            final boolean local = parentName.packageName().equals(sourcePackage.packageName())
                    && parentName.simpleNames().size() == 1;
            final Optional<SourcePackage.DeclaredType> parentDecl = local
                    ? sourcePackage.findTopLevel(parentName.simpleName())
                    : Optional.empty();
            if (parentDecl.isEmpty()) {
                throw new TypeResolutionException("super-interface '" + parentName + "' of '"
                        + iface.getNameAsString() + "' is not declared in " + sourcePackage.dir());
            }
            if (parent.getTypeArguments().isPresent()) {
                throw new TypeResolutionException("generic super-interface '" + parent + "' of '"
                        + iface.getNameAsString() + "' is not supported");
            }
            if (!visited.add(parentName.simpleName())) {
                continue;
            }
            final var decl = parentDecl.get();
            collect(sourcePackage, resolver, decl.file().unit(), asInterface(decl.declaration()), methods, visited);
        }
    }

    private static MethodSignature signatureOf(TypeResolver resolver,
                                               CompilationUnit unit,
                                               ClassOrInterfaceDeclaration owner,
                                               MethodDeclaration md) throws TypeResolutionException {
        final String where = "method '" + md.getNameAsString() + "' of '" + owner.getNameAsString() + "'";
        if (md.getTypeParameters().isNonEmpty()) {
            throw new TypeResolutionException("generic " + where + " is not supported");
        }

        try {
            final NodeList<Parameter> params = md.getParameters();
            final List<TypeRef> parameterTypes = new ArrayList<>(params.size());
            for (var p : params) {
                final TypeRef t = resolver.resolve(p.getType(), unit, owner);
                parameterTypes.add(p.isVarArgs() ? resolver.arrayOf(t) : t);
            }
            final boolean lastIsVariadic = !params.isEmpty() && params.get(params.size() - 1).isVarArgs();

            final TypeRef returnType = md.getType().isVoidType() ? null : resolver.resolve(md.getType(), unit, owner);

            final List<TypeRef> thrown = new ArrayList<>();
            for (ReferenceType rt : md.getThrownExceptions()) {
                thrown.add(resolver.resolve(rt, unit, owner));
            }

            return MethodSignature.of(md.getNameAsString(), parameterTypes, lastIsVariadic, returnType, thrown);
        } catch (TypeResolutionException ex) {
            throw new TypeResolutionException(where + ": " + ex.getMessage());
        }
    }

    private static ClassOrInterfaceDeclaration asInterface(TypeDeclaration<?> decl) throws NotAnInterfaceException {
        if (decl instanceof ClassOrInterfaceDeclaration cid && cid.isInterface()) {
            return cid;
        }
        throw new NotAnInterfaceException(decl.getNameAsString(), kindName(decl));
    }

    private static String kindName(TypeDeclaration<?> decl) {
        if (decl instanceof EnumDeclaration) {
            return "enum";
        }
        if (decl instanceof RecordDeclaration) {
            return "record";
        }
        if (decl instanceof AnnotationDeclaration) {
            return "annotation type";
        }
        return "class";
    }
}
