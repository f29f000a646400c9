package com.simario.model.result;

/**
 * A result with no usable structure, such as a bare number vector.
 */
public record Unrecognized(
    Object value
) implements AnnotatedResult {}
