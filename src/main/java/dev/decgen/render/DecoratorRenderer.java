package dev.decgen.render;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;

import javax.lang.model.element.Modifier;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;

import dev.decgen.error.GenerationException;
import dev.decgen.error.PatternConfigurationException;
import dev.decgen.error.RenderException;
import dev.decgen.error.ZeroValueException;
import dev.decgen.model.DecoratorSpec;
import dev.decgen.model.InterfaceModel;
import dev.decgen.model.MethodSignature;
import dev.decgen.model.Parameter;
import dev.decgen.model.Result;
import dev.decgen.model.TypeRef;

/**
 * Renders one decorator class for an interface.
 * <p>
 * Every kind contributes a class shell (fields, constructor, Javadoc) and a {@link Protocol}
 * per method; the method bodies themselves all come out of {@link #body}.
 */
public final class DecoratorRenderer {

    public static final String HEADER = "Code generated by decgen. DO NOT EDIT.";

    static final ClassName TRACER = ClassName.get("io.opentelemetry.api.trace", "Tracer");
    static final ClassName SPAN = ClassName.get("io.opentelemetry.api.trace", "Span");
    static final ClassName STATUS_CODE = ClassName.get("io.opentelemetry.api.trace", "StatusCode");
    static final ClassName DATA_SOURCE = ClassName.get("javax.sql", "DataSource");
    static final ClassName CONNECTION = ClassName.get("java.sql", "Connection");
    static final ClassName SQL_EXCEPTION = ClassName.get("java.sql", "SQLException");

    private static final String FAILURE = "failure";
    private static final String CLIENT_SUFFIX = "Client";
    private static final String SERVER_SUFFIX = "Server";

    private final String destinationPackage;
    private final Predicate<String> readOnly;

    /**
     * @param destinationPackage package of the generated class
     * @param readOnly           names of methods the transaction decorator runs without a transaction
     */
    public DecoratorRenderer(String destinationPackage, Predicate<String> readOnly) {
        this.destinationPackage = Objects.requireNonNull(destinationPackage, "destinationPackage");
        this.readOnly = Objects.requireNonNull(readOnly, "readOnly");
    }

    public String render(DecoratorSpec spec, InterfaceModel model) throws GenerationException {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(model, "model");

        if (!spec.interfaceQualifiedName().equals(model.qualifiedName())) {
            throw new PatternConfigurationException("decorator for " + spec.interfaceQualifiedName()
                    + " cannot be rendered from " + model.qualifiedName());
        }
        if (spec.structName().equals(spec.interfaceSimpleName())
                && destinationPackage.equals(spec.interfacePackage())) {
            throw new PatternConfigurationException("struct name '" + spec.structName()
                    + "' clashes with the decorated interface");
        }

        try {
            final ClassName iface = ClassName.get(spec.interfacePackage(), spec.interfaceSimpleName());
            final TypeSpec type = switch (spec.kind()) {
                case SERIALIZE_ACCESS -> serializeAccess(spec, model, iface);
                case TRACE -> trace(spec, model, iface);
                case TRANSACTION_WRAP -> transactionWrap(spec, model, iface);
                case RPC_ADAPTER -> rpcAdapter(spec, model, iface);
            };
            return JavaFile.builder(destinationPackage, type)
                    .addFileComment(HEADER)
                    .skipJavaLangImports(true)
                    .indent("    ")
                    .build()
                    .toString();
        } catch (IllegalArgumentException ex) {
            throw new RenderException("failed to render " + spec.structName() + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * {@code FooClient} is adapted to a {@code FooServer} of the same package.
     */
    public static String delegateTypeName(String interfaceName) throws PatternConfigurationException {
        if (!interfaceName.endsWith(CLIENT_SUFFIX)) {
            throw new PatternConfigurationException("the specified interface wasn't a client: '"
                    + interfaceName + "' must end with " + CLIENT_SUFFIX);
        }
        return interfaceName.substring(0, interfaceName.length() - CLIENT_SUFFIX.length()) + SERVER_SUFFIX;
    }

    private static TypeSpec serializeAccess(DecoratorSpec spec, InterfaceModel model, ClassName iface)
            throws ZeroValueException {
        final ClassName lock = ClassName.get(ReentrantLock.class);
        final FieldSpec next = field(iface, "next");
        final TypeSpec.Builder type = shell(spec, iface)
                .addJavadoc("$L ensures that only one call can be active at a time.\n", spec.structName())
                .addField(next)
                .addField(FieldSpec.builder(lock, "lock", Modifier.PRIVATE, Modifier.FINAL)
                        .initializer("new $T()", lock)
                        .build())
                .addMethod(constructor(List.of(next)));

        final Protocol protocol = Protocol.delegateTo("next")
                .withBefore(CodeBlock.builder().addStatement("lock.lock()").build())
                .withAlways(CodeBlock.builder().addStatement("lock.unlock()").build());
        for (MethodSignature sig : model.methods().values()) {
            type.addMethod(method(sig, protocol,
                    CodeBlock.of("Calls the underlying {@code $L} while holding the lock.\n", model.name())));
        }
        return type.build();
    }

    private static TypeSpec trace(DecoratorSpec spec, InterfaceModel model, ClassName iface)
            throws ZeroValueException {
        final FieldSpec next = field(iface, "next");
        final FieldSpec tracer = field(TRACER, "tracer");
        final FieldSpec prefix = field(ClassName.get(String.class), "prefix");
        final TypeSpec.Builder type = shell(spec, iface)
                .addJavadoc("$L traces any calls to the next {@code $L} using OpenTelemetry.\n"
                        + "Span names are the prefix followed by {@code .$L.<method>}.\n",
                        spec.structName(), model.name(), model.name())
                .addField(next)
                .addField(tracer)
                .addField(prefix)
                .addMethod(constructor(List.of(next, tracer, prefix)));

        for (MethodSignature sig : model.methods().values()) {
            final String spanName = "." + model.name() + "." + sig.name();
            final Protocol protocol = Protocol.delegateTo("next")
                    .withBefore(CodeBlock.builder()
                            .addStatement("$T span = tracer.spanBuilder(prefix + $S).setParent($L).startSpan()",
                                    SPAN, spanName, ParameterNames.CONTEXT)
                            .addStatement("$L = $L.with(span)", ParameterNames.CONTEXT, ParameterNames.CONTEXT)
                            .build())
                    .withOnError(CodeBlock.builder()
                            .addStatement("span.recordException($L)", ParameterNames.ERROR)
                            .addStatement("span.setStatus($T.ERROR)", STATUS_CODE)
                            .build())
                    .withAlways(CodeBlock.builder().addStatement("span.end()").build());
            type.addMethod(method(sig, protocol,
                    CodeBlock.of("Calls the underlying {@code $L} inside a new span.\n", model.name())));
        }
        return type.build();
    }

    private TypeSpec transactionWrap(DecoratorSpec spec, InterfaceModel model, ClassName iface)
            throws ZeroValueException {
        final FieldSpec dataSource = field(DATA_SOURCE, "dataSource");
        final FieldSpec constructor = field(
                ParameterizedTypeName.get(ClassName.get(Function.class), CONNECTION, iface), "constructor");
        final TypeSpec.Builder type = shell(spec, iface)
                .addJavadoc("$L manages transactions around {@code $L} implementations.\n"
                        + "Each call runs on an implementation built by {@code constructor} for its own connection.\n",
                        spec.structName(), model.name())
                .addField(dataSource)
                .addField(constructor)
                .addMethod(constructor(List.of(dataSource, constructor)));

        final Protocol mutating = Protocol.delegateTo("constructor.apply(tx)")
                .withBefore(CodeBlock.builder()
                        .addStatement("$T tx = begin()", CONNECTION)
                        .addStatement("$T $L = null", Throwable.class, FAILURE)
                        .build())
                .withAfter(CodeBlock.builder().addStatement("commit(tx)").build())
                .withOnError(CodeBlock.builder()
                        .addStatement("$L = $L", FAILURE, ParameterNames.ERROR)
                        .addStatement("rollback(tx, $L)", ParameterNames.ERROR)
                        .build())
                .withAlways(CodeBlock.builder().addStatement("release(tx, $L)", FAILURE).build());
        final Protocol plain = Protocol.delegateTo("constructor.apply(conn)")
                .withBefore(CodeBlock.builder()
                        .addStatement("$T conn = connect()", CONNECTION)
                        .addStatement("$T $L = null", Throwable.class, FAILURE)
                        .build())
                .withOnError(CodeBlock.builder().addStatement("$L = $L", FAILURE, ParameterNames.ERROR).build())
                .withAlways(CodeBlock.builder().addStatement("release(conn, $L)", FAILURE).build());

        boolean anyMutating = false;
        for (MethodSignature sig : model.methods().values()) {
            if (readOnly.test(sig.name())) {
                type.addMethod(method(sig, plain,
                        CodeBlock.of("Calls the underlying {@code $L} without a transaction.\n", model.name())));
            } else {
                anyMutating = true;
                type.addMethod(method(sig, mutating,
                        CodeBlock.of("Calls the underlying {@code $L} inside a transaction.\n", model.name())));
            }
        }

        type.addMethod(connectHelper());
        if (anyMutating) {
            type.addMethod(beginHelper());
            type.addMethod(commitHelper());
            type.addMethod(rollbackHelper());
        }
        type.addMethod(releaseHelper());
        return type.build();
    }

    private static TypeSpec rpcAdapter(DecoratorSpec spec, InterfaceModel model, ClassName iface)
            throws GenerationException {
        final ClassName server = ClassName.get(model.packageName(), delegateTypeName(model.name()));
        final FieldSpec next = field(server, "next");
        final TypeSpec.Builder type = shell(spec, iface)
                .addJavadoc("$L lets a {@code $L} be used where a {@code $L} is expected.\n",
                        spec.structName(), server.simpleName(), model.name())
                .addField(next)
                .addMethod(constructor(List.of(next)));

        final Protocol protocol = Protocol.delegateTo("next").withoutLastArgument();
        for (MethodSignature sig : model.methods().values()) {
            type.addMethod(method(sig, protocol,
                    CodeBlock.of("Calls the underlying {@code $L}; the trailing call options are dropped.\n",
                            server.simpleName())));
        }
        return type.build();
    }

    private static TypeSpec.Builder shell(DecoratorSpec spec, ClassName iface) {
        return TypeSpec.classBuilder(spec.structName())
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addSuperinterface(iface);
    }

    private static FieldSpec field(TypeName type, String name) {
        return FieldSpec.builder(type, name, Modifier.PRIVATE, Modifier.FINAL).build();
    }

    private static MethodSpec constructor(List<FieldSpec> fields) {
        final MethodSpec.Builder ctor = MethodSpec.constructorBuilder().addModifiers(Modifier.PUBLIC);
        for (FieldSpec f : fields) {
            ctor.addParameter(f.type, f.name);
            ctor.addStatement("this.$N = $T.requireNonNull($N, $S)", f.name, Objects.class, f.name, f.name);
        }
        return ctor.build();
    }

    private static MethodSpec method(MethodSignature sig, Protocol protocol, CodeBlock javadoc)
            throws ZeroValueException {
        final ResultPlumbing plumbing = ResultPlumbing.of(sig);
        final List<Parameter> params = sig.parameters();
        final List<String> names = ParameterNames.namesOf(params);

        final MethodSpec.Builder m = MethodSpec.methodBuilder(sig.name())
                .addJavadoc(javadoc)
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC);
        for (Parameter p : params) {
            m.addParameter(p.type().javaType(), names.get(p.index()));
        }
        if (!params.isEmpty() && params.get(params.size() - 1).variadic()) {
            m.varargs(true);
        }
        plumbing.valueResult().ifPresent(r -> m.returns(r.type().javaType()));
        for (TypeRef thrown : sig.thrownTypes()) {
            m.addException(thrown.javaType());
        }

        final String args = ParameterNames.callArguments(params, protocol.dropLastArgument());
        return m.addCode(body(sig, plumbing, protocol, args)).build();
    }

    static CodeBlock body(MethodSignature sig, ResultPlumbing plumbing, Protocol protocol, String args) {
        final CodeBlock.Builder code = CodeBlock.builder();
        final Optional<Result> value = plumbing.valueResult();
        final String call = protocol.target() + "." + sig.name() + "(" + args + ")";

        if (!protocol.hasHooks()) {
            if (value.isPresent()) {
                code.addStatement("return $L", call);
            } else {
                code.addStatement("$L", call);
            }
            return code.build();
        }

        final List<String> returned = plumbing.successPath();
        if (!protocol.guarded()) {
            code.add(protocol.before());
            if (value.isPresent()) {
                code.addStatement("$T $L$L", value.get().type().javaType(), plumbing.assignment(), call);
            } else {
                code.addStatement("$L", call);
            }
            code.add(protocol.after());
            value.ifPresent(r -> code.addStatement("return $L", returned.get(r.index())));
            return code.build();
        }

        final List<String> zeros = plumbing.errorPath();
        for (Result r : sig.valueResults()) {
            code.addStatement("$T $L = $L", r.type().javaType(), returned.get(r.index()), zeros.get(r.index()));
        }
        code.add(protocol.before());
        code.beginControlFlow("try");
        code.addStatement("$L$L", plumbing.assignment(), call);
        code.add(protocol.after());
        if (!protocol.onError().isEmpty()) {
            code.nextControlFlow("catch ($T $L)", Throwable.class, ParameterNames.ERROR);
            code.add(protocol.onError());
            code.addStatement("throw $L", ParameterNames.ERROR);
        }
        if (!protocol.always().isEmpty()) {
            code.nextControlFlow("finally");
            code.add(protocol.always());
        }
        code.endControlFlow();
        value.ifPresent(r -> code.addStatement("return $L", returned.get(r.index())));
        return code.build();
    }

    private static MethodSpec connectHelper() {
        return MethodSpec.methodBuilder("connect")
                .addModifiers(Modifier.PRIVATE)
                .returns(CONNECTION)
                .beginControlFlow("try")
                .addStatement("return dataSource.getConnection()")
                .nextControlFlow("catch ($T e)", SQL_EXCEPTION)
                .addStatement("throw new $T($S, e)", IllegalStateException.class, "unable to open connection")
                .endControlFlow()
                .build();
    }

    private static MethodSpec beginHelper() {
        return MethodSpec.methodBuilder("begin")
                .addModifiers(Modifier.PRIVATE)
                .returns(CONNECTION)
                .addStatement("$T tx = connect()", CONNECTION)
                .beginControlFlow("try")
                .addStatement("tx.setAutoCommit(false)")
                .nextControlFlow("catch ($T e)", SQL_EXCEPTION)
                .addStatement("release(tx, e)")
                .addStatement("throw new $T($S, e)", IllegalStateException.class, "unable to start transaction")
                .endControlFlow()
                .addStatement("return tx")
                .build();
    }

    private static MethodSpec commitHelper() {
        return MethodSpec.methodBuilder("commit")
                .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
                .addParameter(CONNECTION, "tx")
                .beginControlFlow("try")
                .addStatement("tx.commit()")
                .nextControlFlow("catch ($T e)", SQL_EXCEPTION)
                .addStatement("throw new $T($S, e)", IllegalStateException.class, "failed to commit transaction")
                .endControlFlow()
                .build();
    }

    private static MethodSpec rollbackHelper() {
        return MethodSpec.methodBuilder("rollback")
                .addJavadoc("Rolls back after {@code failure}. A failed rollback is reported together with it.\n")
                .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
                .addParameter(CONNECTION, "tx")
                .addParameter(Throwable.class, "failure")
                .beginControlFlow("try")
                .addStatement("tx.rollback()")
                .nextControlFlow("catch ($T e)", SQL_EXCEPTION)
                .addStatement("$T combined = new $T($S + e.getMessage() + $S + failure, failure)",
                        IllegalStateException.class, IllegalStateException.class,
                        "failed to rollback transaction (", ") for error: ")
                .addStatement("combined.addSuppressed(e)")
                .addStatement("throw combined")
                .endControlFlow()
                .build();
    }

    private static MethodSpec releaseHelper() {
        return MethodSpec.methodBuilder("release")
                .addJavadoc("Closes {@code conn}. When a call already failed with {@code failure}, a failed close\n"
                        + "is attached to it as suppressed so that the call's own error is what propagates.\n")
                .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
                .addParameter(CONNECTION, "conn")
                .addParameter(Throwable.class, FAILURE)
                .beginControlFlow("try")
                .addStatement("conn.close()")
                .nextControlFlow("catch ($T e)", SQL_EXCEPTION)
                .beginControlFlow("if ($L == null)", FAILURE)
                .addStatement("throw new $T($S, e)", IllegalStateException.class, "failed to release connection")
                .endControlFlow()
                .addStatement("$L.addSuppressed(e)", FAILURE)
                .endControlFlow()
                .build();
    }
}
