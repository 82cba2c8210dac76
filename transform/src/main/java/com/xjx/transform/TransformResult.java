package com.xjx.transform;

/**
 * Outcome of one transformer call: either a (possibly new) value to keep, or removal of the target.
 */
public record TransformResult<T>(T value, boolean removed) {

    public static <T> TransformResult<T> keep(T value) {
        return new TransformResult<>(value, false);
    }

    public static <T> TransformResult<T> remove() {
        return new TransformResult<>(null, true);
    }
}
