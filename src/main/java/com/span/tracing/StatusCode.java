package com.span.tracing;

/**
 * Completion status of a span. Every span starts as {@link #UNSET}.
 */
public enum StatusCode {
    UNSET,
    OK,
    ERROR
}
