package io.insights.core;

import java.io.Closeable;

/**
 * Sink consumes records in the order the pipeline produced them.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
