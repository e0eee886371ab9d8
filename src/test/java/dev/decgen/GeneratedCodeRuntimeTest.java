package dev.decgen;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import javax.sql.DataSource;
import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.decgen.config.GeneratorConfig;
import dev.decgen.model.DecoratorKind;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;

/**
 * Generates decorators for a small package, compiles them with the JDK compiler and runs them
 * against proxy fakes.
 */
class GeneratedCodeRuntimeTest {

    @TempDir
    Path tempDir;

    private Path dir;
    private String contextType = SourceFixtures.CTX;
    private URLClassLoader loader;

    @BeforeEach
    void setUp() throws Exception {
        dir = SourceFixtures.plainStore(tempDir);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (loader != null) {
            loader.close();
        }
    }

    private Class<?> generateAndLoad(DecoratorKind kind, String iface, String struct, List<String> readOnly)
            throws Exception {
        final GeneratorConfig config = new GeneratorConfig(contextType, readOnly, null);
        new Generator(config).generate(dir, iface, kind, struct, dir.resolve(struct + ".java"));

        final Path classes = Files.createDirectories(tempDir.resolve("classes"));
        final List<String> args = new ArrayList<>(List.of("-d", classes.toString(), "-classpath", otelClassPath()));
        try (var files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".java"))
                    .sorted()
                    .forEach(p -> args.add(p.toString()));
        }

        final JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
        assertThat(javac).as("a JDK compiler").isNotNull();
        final ByteArrayOutputStream diagnostics = new ByteArrayOutputStream();
        final int status = javac.run(null, null, diagnostics, args.toArray(new String[0]));
        assertThat(status).as(diagnostics.toString(UTF_8)).isZero();

        loader = new URLClassLoader(new URL[]{classes.toUri().toURL()}, getClass().getClassLoader());
        return loader.loadClass(SourceFixtures.STORE_PACKAGE + "." + struct);
    }

    /**
     * The OpenTelemetry API and context jars the traced package compiles against.
     */
    private static String otelClassPath() throws URISyntaxException {
        return Path.of(Span.class.getProtectionDomain().getCodeSource().getLocation().toURI())
                + File.pathSeparator
                + Path.of(Context.class.getProtectionDomain().getCodeSource().getLocation().toURI());
    }

    private Class<?> type(String simpleName) throws ClassNotFoundException {
        return loader.loadClass(SourceFixtures.STORE_PACKAGE + "." + simpleName);
    }

    private Object proxy(Class<?> type, InvocationHandler handler) {
        return Proxy.newProxyInstance(loader, new Class<?>[]{type}, handler);
    }

    private Object ctx() throws ClassNotFoundException {
        return proxy(type("Ctx"), (p, m, a) -> null);
    }

    private Throwable storeException(String message) throws Exception {
        return (Throwable) type("StoreException").getConstructor(String.class).newInstance(message);
    }

    /**
     * Unwraps the reflective call so assertions see what the decorator threw.
     */
    private static Throwable failureOf(Method method, Object target, Object... args) {
        final Throwable thrown = catchThrowable(() -> method.invoke(target, args));
        assertThat(thrown).isInstanceOf(InvocationTargetException.class);
        return thrown.getCause();
    }

    @Nested
    @DisplayName("mutex")
    class SerializeAccess {

        @Test
        @DisplayName("concurrent calls never overlap")
        void serializesCalls() throws Exception {
            final Class<?> mutex = generateAndLoad(DecoratorKind.SERIALIZE_ACCESS, "Store", "StoreMutex", List.of());
            final AtomicInteger inFlight = new AtomicInteger();
            final AtomicInteger maxInFlight = new AtomicInteger();
            final AtomicInteger calls = new AtomicInteger();
            final Object delegate = proxy(type("Store"), (p, m, a) -> {
                final int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                Thread.sleep(2);
                inFlight.decrementAndGet();
                calls.incrementAndGet();
                return 7;
            });
            final Object decorator = mutex.getConstructor(type("Store")).newInstance(delegate);
            final Method count = mutex.getMethod("count", type("Ctx"));
            final Object ctx = ctx();

            final ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                final List<Future<Object>> results = new ArrayList<>();
                for (int i = 0; i < 40; i++) {
                    results.add(pool.submit(() -> count.invoke(decorator, ctx)));
                }
                for (Future<Object> f : results) {
                    assertThat(f.get(10, TimeUnit.SECONDS)).isEqualTo(7);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(calls).hasValue(40);
            assertThat(maxInFlight).hasValue(1);
        }

        @Test
        @DisplayName("a failing call releases the lock and keeps its exception")
        void releasesOnFailure() throws Exception {
            final Class<?> mutex = generateAndLoad(DecoratorKind.SERIALIZE_ACCESS, "Store", "StoreMutex", List.of());
            final Throwable boom = storeException("boom");
            final Object decorator = mutex.getConstructor(type("Store"))
                    .newInstance(proxy(type("Store"), (p, m, a) -> {
                        throw boom;
                    }));

            final Throwable failure = failureOf(mutex.getMethod("get", type("Ctx"), String.class), decorator, ctx(), "k");

            assertThat(failure).isSameAs(boom);
            final Field lock = mutex.getDeclaredField("lock");
            lock.setAccessible(true);
            assertThat(((ReentrantLock) lock.get(decorator)).isLocked()).isFalse();
        }
    }

    @Nested
    @DisplayName("sqltx")
    class TransactionWrap {

        private final List<String> log = Collections.synchronizedList(new ArrayList<>());
        private boolean failCommit;
        private boolean failRollback;
        private boolean failPut;
        private boolean failClose;

        private Throwable boom;

        private Object decorator(Class<?> tx) throws Exception {
            boom = storeException("boom");
            final Object connection = Proxy.newProxyInstance(loader, new Class<?>[]{Connection.class}, (p, m, a) -> {
                switch (m.getName()) {
                    case "setAutoCommit":
                        log.add("autoCommit=" + a[0]);
                        return null;
                    case "commit":
                        log.add("commit");
                        if (failCommit) {
                            throw new SQLException("disk full");
                        }
                        return null;
                    case "rollback":
                        log.add("rollback");
                        if (failRollback) {
                            throw new SQLException("rollback broke");
                        }
                        return null;
                    case "close":
                        log.add("close");
                        if (failClose) {
                            throw new SQLException("close broke");
                        }
                        return null;
                    default:
                        throw new UnsupportedOperationException(m.getName());
                }
            });
            final Object dataSource = Proxy.newProxyInstance(loader, new Class<?>[]{DataSource.class},
                    (p, m, a) -> connection);
            final Object store = proxy(type("Store"), (p, m, a) -> {
                log.add(m.getName());
                if ("put".equals(m.getName()) && failPut) {
                    throw boom;
                }
                return "count".equals(m.getName()) ? (Object) 3 : "value-" + a[1];
            });
            final Function<Object, Object> constructor = conn -> store;
            return tx.getConstructor(DataSource.class, Function.class).newInstance(dataSource, constructor);
        }

        private Method put(Class<?> tx) throws Exception {
            return tx.getMethod("put", type("Ctx"), String.class, String.class);
        }

        @Test
        @DisplayName("success commits and releases the connection")
        void commitsOnSuccess() throws Exception {
            final Class<?> tx = generateAndLoad(DecoratorKind.TRANSACTION_WRAP, "Store", "StoreTx", List.of());
            final Object decorator = decorator(tx);

            final Object value = tx.getMethod("get", type("Ctx"), String.class).invoke(decorator, ctx(), "k");

            assertThat(value).isEqualTo("value-k");
            assertThat(log).containsExactly("autoCommit=false", "get", "commit", "close");
        }

        @Test
        @DisplayName("a failing call rolls back and surfaces the original exception")
        void rollsBackOnFailure() throws Exception {
            final Class<?> tx = generateAndLoad(DecoratorKind.TRANSACTION_WRAP, "Store", "StoreTx", List.of());
            final Object decorator = decorator(tx);
            failPut = true;

            final Throwable failure = failureOf(put(tx), decorator, ctx(), "k", "v");

            assertThat(failure.getClass().getName()).isEqualTo("com.acme.store.StoreException");
            assertThat(log).containsExactly("autoCommit=false", "put", "rollback", "close");
        }

        @Test
        @DisplayName("a failed rollback is reported together with the call's failure")
        void rollbackFailureNamesBoth() throws Exception {
            final Class<?> tx = generateAndLoad(DecoratorKind.TRANSACTION_WRAP, "Store", "StoreTx", List.of());
            final Object decorator = decorator(tx);
            failPut = true;
            failRollback = true;

            final Throwable failure = failureOf(put(tx), decorator, ctx(), "k", "v");

            assertThat(failure).isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("rollback broke")
                    .hasMessageContaining("boom");
            assertThat(failure.getCause().getClass().getName()).isEqualTo("com.acme.store.StoreException");
            assertThat(failure.getSuppressed()).hasSize(1);
            assertThat(failure.getSuppressed()[0]).isInstanceOf(SQLException.class);
            assertThat(log).endsWith("rollback", "close");
        }

        @Test
        @DisplayName("a failed commit is rolled back and reported")
        void commitFailure() throws Exception {
            final Class<?> tx = generateAndLoad(DecoratorKind.TRANSACTION_WRAP, "Store", "StoreTx", List.of());
            final Object decorator = decorator(tx);
            failCommit = true;

            final Throwable failure = failureOf(put(tx), decorator, ctx(), "k", "v");

            assertThat(failure).isInstanceOf(IllegalStateException.class)
                    .hasMessage("failed to commit transaction")
                    .hasCauseInstanceOf(SQLException.class);
            assertThat(log).containsExactly("autoCommit=false", "put", "commit", "rollback", "close");
        }

        @Test
        @DisplayName("a failed close does not replace the call's own exception")
        void closeFailureAfterCallFailure() throws Exception {
            final Class<?> tx = generateAndLoad(DecoratorKind.TRANSACTION_WRAP, "Store", "StoreTx", List.of());
            final Object decorator = decorator(tx);
            failPut = true;
            failClose = true;

            final Throwable failure = failureOf(put(tx), decorator, ctx(), "k", "v");

            assertThat(failure).isSameAs(boom);
            assertThat(failure.getSuppressed()).hasSize(1);
            assertThat(failure.getSuppressed()[0]).isInstanceOf(SQLException.class).hasMessage("close broke");
            assertThat(log).containsExactly("autoCommit=false", "put", "rollback", "close");
        }

        @Test
        @DisplayName("a failed close after a read-only failure is attached to that failure")
        void closeFailureAfterReadOnlyFailure() throws Exception {
            final Class<?> tx = generateAndLoad(DecoratorKind.TRANSACTION_WRAP, "Store", "StoreTx", List.of("put"));
            final Object decorator = decorator(tx);
            failPut = true;
            failClose = true;

            final Throwable failure = failureOf(put(tx), decorator, ctx(), "k", "v");

            assertThat(failure).isSameAs(boom);
            assertThat(failure.getSuppressed()).extracting(Throwable::getMessage).containsExactly("close broke");
            assertThat(log).containsExactly("put", "close");
        }

        @Test
        @DisplayName("a failed close after a successful call is reported")
        void closeFailureAfterSuccess() throws Exception {
            final Class<?> tx = generateAndLoad(DecoratorKind.TRANSACTION_WRAP, "Store", "StoreTx", List.of());
            final Object decorator = decorator(tx);
            failClose = true;

            final Throwable failure = failureOf(tx.getMethod("get", type("Ctx"), String.class), decorator, ctx(), "k");

            assertThat(failure).isInstanceOf(IllegalStateException.class)
                    .hasMessage("failed to release connection")
                    .hasCauseInstanceOf(SQLException.class);
            assertThat(log).containsExactly("autoCommit=false", "get", "commit", "close");
        }

        @Test
        @DisplayName("read-only methods run on a plain connection")
        void readOnlyMethods() throws Exception {
            final Class<?> tx = generateAndLoad(DecoratorKind.TRANSACTION_WRAP, "Store", "StoreTx", List.of("count"));
            final Object decorator = decorator(tx);

            final Object value = tx.getMethod("count", type("Ctx")).invoke(decorator, ctx());

            assertThat(value).isEqualTo(3);
            assertThat(log).containsExactly("count", "close");
        }
    }

    @Nested
    @DisplayName("trace")
    class Trace {

        private final InMemorySpanExporter exporter = InMemorySpanExporter.create();
        private final SdkTracerProvider provider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();
        private final Tracer tracer = provider.get("decgen-test");

        @BeforeEach
        void useOpenTelemetryContext() throws Exception {
            dir = SourceFixtures.otelStore(tempDir.resolve("otel"));
            contextType = GeneratorConfig.DEFAULT_CONTEXT_TYPE;
        }

        @AfterEach
        void closeProvider() {
            provider.close();
        }

        private Object decorator(Class<?> traced, Object delegate) throws Exception {
            return traced.getConstructor(type("Store"), Tracer.class, String.class)
                    .newInstance(delegate, tracer, "app");
        }

        private Method get(Class<?> traced) throws Exception {
            return traced.getMethod("get", Context.class, String.class);
        }

        @Test
        @DisplayName("a successful call ends one span and the delegate runs inside it")
        void endsSpanOnSuccess() throws Exception {
            final Class<?> traced = generateAndLoad(DecoratorKind.TRACE, "Store", "StoreTracer", List.of());
            final List<String> seenSpanIds = new ArrayList<>();
            final Object delegate = proxy(type("Store"), (p, m, a) -> {
                seenSpanIds.add(Span.fromContext((Context) a[0]).getSpanContext().getSpanId());
                return type("Item").getConstructor(String.class, String.class).newInstance(a[1], "widget");
            });

            final Object item = get(traced).invoke(decorator(traced, delegate), Context.root(), "k");

            assertThat(item).hasToString("Item[id=k, name=widget]");
            final List<SpanData> spans = exporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            final SpanData span = spans.get(0);
            assertThat(span.getName()).isEqualTo("app.Store.get");
            assertThat(span.hasEnded()).isTrue();
            assertThat(span.getStatus().getStatusCode()).isIn(StatusCode.UNSET, StatusCode.OK);
            assertThat(span.getEvents()).isEmpty();
            assertThat(seenSpanIds).containsExactly(span.getSpanId());
        }

        @Test
        @DisplayName("the span is a child of the span carried by the caller's context")
        void parentsOnCallerContext() throws Exception {
            final Class<?> traced = generateAndLoad(DecoratorKind.TRACE, "Store", "StoreTracer", List.of());
            final Object delegate = proxy(type("Store"), (p, m, a) -> 5L);
            final Span parent = tracer.spanBuilder("caller").startSpan();

            final Object count = traced.getMethod("count", Context.class)
                    .invoke(decorator(traced, delegate), Context.root().with(parent));
            parent.end();

            assertThat(count).isEqualTo(5L);
            final SpanData span = exporter.getFinishedSpanItems().get(0);
            assertThat(span.getName()).isEqualTo("app.Store.count");
            assertThat(span.getParentSpanId()).isEqualTo(parent.getSpanContext().getSpanId());
            assertThat(span.getTraceId()).isEqualTo(parent.getSpanContext().getTraceId());
        }

        @Test
        @DisplayName("a failing call ends its span with error status and the recorded exception")
        void marksSpanOnFailure() throws Exception {
            final Class<?> traced = generateAndLoad(DecoratorKind.TRACE, "Store", "StoreTracer", List.of());
            final Throwable boom = storeException("boom");
            final Object delegate = proxy(type("Store"), (p, m, a) -> {
                throw boom;
            });

            final Throwable failure = failureOf(get(traced), decorator(traced, delegate), Context.root(), "k");

            assertThat(failure).isSameAs(boom);
            final List<SpanData> spans = exporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            final SpanData span = spans.get(0);
            assertThat(span.hasEnded()).isTrue();
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(span.getEvents()).extracting(EventData::getName).containsExactly("exception");
            assertThat(span.getEvents().get(0).getAttributes().get(AttributeKey.stringKey("exception.message")))
                    .isEqualTo("boom");
        }
    }

    @Nested
    @DisplayName("grpcadapter")
    class RpcAdapter {

        @Test
        @DisplayName("the server sees every argument but the call options")
        void dropsCallOptions() throws Exception {
            final Class<?> adapter = generateAndLoad(DecoratorKind.RPC_ADAPTER, "GreeterClient", "GreeterAdapter",
                    List.of());
            final List<Integer> arity = new ArrayList<>();
            final Object server = proxy(type("GreeterServer"), (p, m, a) -> {
                arity.add(a.length);
                return "hello " + a[1];
            });
            final Object decorator = adapter.getConstructor(type("GreeterServer")).newInstance(server);
            final Method greet = adapter.getMethod("greet", type("Ctx"), String.class, String[].class);

            assertThat(greet.isVarArgs()).isTrue();
            assertThat(greet.invoke(decorator, ctx(), "bob", new String[]{"deadline=1s"})).isEqualTo("hello bob");
            assertThat(arity).containsExactly(2);
        }
    }
}
