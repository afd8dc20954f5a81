package io.insights.core;

import java.util.List;

/**
 * Transform converts an input record into zero or more output records.
 * Implementations keep no state between calls and carry the input's seq and origin onto their outputs.
 */
public interface Transform<I, O> {
    List<Record<O>> apply(Record<I> input) throws Exception;

    /**
     * Convenience for one-to-one transforms.
     */
    static <I, O> Transform<I, O> mapping(PayloadFunction<I, O> fn) {
        return in -> List.of(in.withPayload(fn.apply(in.payload())));
    }

    @FunctionalInterface
    interface PayloadFunction<I, O> {
        O apply(I payload) throws Exception;
    }
}
