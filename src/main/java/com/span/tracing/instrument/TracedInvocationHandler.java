package com.span.tracing.instrument;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Proxy handler behind {@link Instrumentation#proxy(Class, Object)}.
 * Exceptions thrown by the target are rethrown as-is, so the proxy keeps the
 * interface's exception contract.
 */
final class TracedInvocationHandler implements InvocationHandler {

    private final Instrumentation instrumentation;
    private final Class<?> type;
    private final Object target;

    TracedInvocationHandler(Instrumentation instrumentation, Class<?> type, Object target) {
        this.instrumentation = instrumentation;
        this.type = type;
        this.target = target;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, method, args);
        }
        Traced traced = method.getAnnotation(Traced.class);
        if (traced != null) {
            TraceOptions options = TraceOptions.builder()
                    .name(traced.value())
                    .kind(traced.kind())
                    .recordArgs(traced.recordArgs())
                    .recordResult(traced.recordResult())
                    .build();
            return instrumentation.invoke(options, Instrumentation.CallSite.of(type, method), args,
                    () -> invokeTarget(method, args));
        }
        TracedGenerator generator = method.getAnnotation(TracedGenerator.class);
        if (generator != null) {
            TraceOptions options = TraceOptions.builder()
                    .name(generator.value())
                    .kind(generator.kind())
                    .build();
            Instrumentation.CallSite site = Instrumentation.CallSite.of(type, method);
            if (Stream.class.equals(method.getReturnType())) {
                return instrumentation.traceStream(options, site, () -> (Stream<Object>) callUnchecked(method, args));
            }
            return instrumentation.iterate(options, site, () -> (Iterator<Object>) callUnchecked(method, args), null);
        }
        return invokeTarget(method, args);
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) throws Throwable {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "Traced" + type.getSimpleName() + "{" + target + "}";
            default:
                return invokeTarget(method, args);
        }
    }

    private Object invokeTarget(Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    /**
     * For producing an iterator or stream inside a supplier. Checked exceptions
     * cannot escape a supplier, so they are rethrown without being declared.
     */
    private Object callUnchecked(Method method, Object[] args) {
        try {
            return invokeTarget(method, args);
        } catch (Throwable t) {
            throw TracedInvocationHandler.<RuntimeException>sneakyThrow(t);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }
}
