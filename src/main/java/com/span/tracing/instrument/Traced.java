package com.span.tracing.instrument;

import com.span.tracing.SpanKind;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an interface method whose calls are wrapped in a span when the
 * implementation is obtained through {@link Instrumentation#proxy(Class, Object)}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Traced {

    /**
     * The span name. Defaults to {@code InterfaceName.methodName}.
     */
    String value() default "";

    SpanKind kind() default SpanKind.INTERNAL;

    /**
     * Records a fingerprint of the arguments as {@code code.args_hash}.
     */
    boolean recordArgs() default false;

    /**
     * Records a fingerprint of a non-null return value as {@code code.result_hash}.
     */
    boolean recordResult() default false;
}
