package io.insights.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A finite producer of records. Everything a source emits is already materialized in memory
 * by the time {@link #poll()} returns it.
 */
public interface Source<T> extends Closeable {
    /**
     * Next record, or empty once the source is exhausted.
     */
    Optional<Record<T>> poll();

    /**
     * Whether the source will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() {}
}
