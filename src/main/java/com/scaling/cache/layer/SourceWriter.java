package com.scaling.cache.layer;

/**
 * Persists a value to the source of truth behind a cache category.
 *
 * @param <T> Value type
 */
@FunctionalInterface
public interface SourceWriter<T> {

    void write(T value) throws Exception;
}
