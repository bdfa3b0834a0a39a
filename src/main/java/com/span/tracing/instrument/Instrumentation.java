package com.span.tracing.instrument;

import com.span.tracing.Span;
import com.span.tracing.Tracer;
import com.span.tracing.TracedCall;
import com.span.tracing.TracedRunnable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Wraps calls and iterations in spans.
 *
 * <p>A traced call opens a span named after {@link TraceOptions#name()} or, when
 * none is given, after the calling method. The span carries {@code code.function}
 * and {@code code.module}, the static attributes of the options and, when
 * requested, SHA-256 fingerprints of the arguments and the result. An exception
 * thrown by the call is recorded on the span and rethrown unchanged. The span is
 * always ended exactly once.</p>
 *
 * <pre>
 * Instrumentation instrumentation = new Instrumentation(Tracing.getTracer());
 * Report report = instrumentation.call(TraceOptions.named("report.build"), () -> builder.build());
 * </pre>
 */
public class Instrumentation {
    private static final Logger log = LoggerFactory.getLogger(Instrumentation.class);

    public static final String CODE_FUNCTION = "code.function";
    public static final String CODE_MODULE = "code.module";
    public static final String ARGS_HASH = "code.args_hash";
    public static final String RESULT_HASH = "code.result_hash";
    public static final String ITEM_COUNT = "generator.item_count";

    private static final StackWalker WALKER = StackWalker.getInstance();

    private final Tracer tracer;
    private final ContentTagger contentTagger;

    public Instrumentation(Tracer tracer) {
        this(tracer, new ContentTagger(false));
    }

    public Instrumentation(Tracer tracer, ContentTagger contentTagger) {
        this.tracer = tracer;
        this.contentTagger = contentTagger;
    }

    public Tracer tracer() {
        return tracer;
    }

    public ContentTagger contentTagger() {
        return contentTagger;
    }

    /**
     * Runs {@code body} in a span and returns its result.
     */
    public <T, E extends Throwable> T call(TraceOptions options, TracedCall<T, E> body) throws E {
        CallSite site = callSite();
        return invoke(options, site, null, body);
    }

    public <E extends Throwable> void run(TraceOptions options, TracedRunnable<E> body) throws E {
        CallSite site = callSite();
        invoke(options, site, null, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Returns a function that traces every application of {@code function}.
     * The span name defaults to the method that created the wrapper.
     */
    public <A, R> Function<A, R> wrap(TraceOptions options, Function<A, R> function) {
        CallSite site = callSite();
        return argument -> invoke(options, site, new Object[]{argument}, () -> function.apply(argument));
    }

    public <T> Supplier<T> wrap(TraceOptions options, Supplier<T> supplier) {
        CallSite site = callSite();
        return () -> invoke(options, site, null, supplier::get);
    }

    /**
     * Opens a span and iterates the iterator produced by {@code source} inside it.
     * Exhaust or close the returned iterator to end the span.
     */
    public <T> TracedIterator<T> iterate(TraceOptions options, Supplier<? extends Iterator<T>> source) {
        CallSite site = callSite();
        return iterate(options, site, source, null);
    }

    /**
     * Stream variant of {@link #iterate(TraceOptions, Supplier)}. The span ends when the
     * stream is fully consumed or closed.
     */
    public <T> Stream<T> stream(TraceOptions options, Supplier<? extends Stream<T>> source) {
        CallSite site = callSite();
        return traceStream(options, site, source);
    }

    /**
     * Returns a proxy for {@code target} that traces the methods of {@code type}
     * annotated with {@link Traced} or {@link TracedGenerator}. Other methods are
     * forwarded unchanged.
     *
     * @throws IllegalArgumentException if {@code type} is not an interface, or a
     *                                  {@code TracedGenerator} method returns neither an
     *                                  {@code Iterator} nor a {@code Stream}
     */
    @SuppressWarnings("unchecked")
    public <T> T proxy(Class<T> type, T target) {
        if (!type.isInterface()) {
            throw new IllegalArgumentException(type.getName() + " is not an interface");
        }
        for (Method method : type.getMethods()) {
            if (method.isAnnotationPresent(TracedGenerator.class)
                    && !Iterator.class.equals(method.getReturnType())
                    && !Stream.class.equals(method.getReturnType())) {
                throw new IllegalArgumentException("@TracedGenerator method " + type.getSimpleName() + "."
                        + method.getName() + " must return Iterator or Stream");
            }
        }
        return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type},
                new TracedInvocationHandler(this, type, target));
    }

    <T, E extends Throwable> T invoke(TraceOptions options, CallSite site, Object[] args,
                                      TracedCall<T, E> body) throws E {
        Span span = open(options, site);
        if (options.recordArgs() && args != null) {
            span.setAttribute(ARGS_HASH, Fingerprints.shortHash(Arrays.asList(args)));
        }
        try {
            T result = body.call();
            if (options.recordResult() && result != null) {
                span.setAttribute(RESULT_HASH, Fingerprints.shortHash(result));
            }
            return result;
        } catch (Throwable t) {
            span.recordException(t);
            throw t;
        } finally {
            span.close();
        }
    }

    <T> TracedIterator<T> iterate(TraceOptions options, CallSite site, Supplier<? extends Iterator<T>> source,
                                  Runnable onClose) {
        Span span = open(options, site);
        Iterator<T> iterator;
        try {
            iterator = source.get();
        } catch (Throwable t) {
            span.recordException(t);
            span.end();
            throw t;
        }
        return new TracedIterator<>(span, iterator, onClose);
    }

    <T> Stream<T> traceStream(TraceOptions options, CallSite site, Supplier<? extends Stream<T>> source) {
        Span span = open(options, site);
        Stream<T> stream;
        try {
            stream = source.get();
        } catch (Throwable t) {
            span.recordException(t);
            span.end();
            throw t;
        }
        TracedIterator<T> iterator = new TracedIterator<>(span, stream.iterator(), stream::close);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false)
                .onClose(iterator::close);
    }

    private Span open(TraceOptions options, CallSite site) {
        String name = options.name() != null ? options.name() : site.spanName();
        Span span = tracer.startSpan(name, null, options.kind(), options.attributes());
        span.setAttribute(CODE_FUNCTION, site.function());
        span.setAttribute(CODE_MODULE, site.module());
        log.trace("Traced call {} in span {}", name, span.spanId());
        return span;
    }

    private static CallSite callSite() {
        String self = Instrumentation.class.getName();
        Optional<StackWalker.StackFrame> caller = WALKER.walk(frames -> frames
                .filter(frame -> !frame.getClassName().equals(self))
                .findFirst());
        return caller
                .map(frame -> new CallSite(frame.getClassName(), frame.getMethodName(),
                        simpleName(frame.getClassName()) + "." + frame.getMethodName()))
                .orElseGet(() -> new CallSite("unknown", "unknown", "unknown"));
    }

    private static String simpleName(String className) {
        return className.substring(className.lastIndexOf('.') + 1);
    }

    /**
     * Where a traced call was declared: module is the class name, function the
     * method name.
     */
    record CallSite(String module, String function, String spanName) {

        static CallSite of(Class<?> type, Method method) {
            return new CallSite(type.getName(), method.getName(), type.getSimpleName() + "." + method.getName());
        }
    }
}
