package com.span.tracing.instrument;

import com.span.tracing.SpanKind;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an interface method returning an {@link java.util.Iterator} or a
 * {@link java.util.stream.Stream}. One span covers the whole iteration and records
 * the number of items produced.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface TracedGenerator {

    /**
     * The span name. Defaults to {@code InterfaceName.methodName}.
     */
    String value() default "";

    SpanKind kind() default SpanKind.INTERNAL;
}
