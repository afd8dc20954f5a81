package io.insights.source;

import io.insights.core.Record;
import io.insights.core.Source;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Emits a fixed list of payloads as records, then completes.
 */
public class ListSource<T> implements Source<T> {
    private final List<T> items;
    private final Function<T, String> originOf;
    private int idx = 0;

    public ListSource(List<T> items) { this(items, t -> ""); }

    public ListSource(List<T> items, Function<T, String> originOf) {
        this.items = List.copyOf(items);
        this.originOf = originOf;
    }

    @Override
    public Optional<Record<T>> poll() {
        if (idx >= items.size()) return Optional.empty();
        T item = items.get(idx);
        Record<T> r = new Record<>(idx, originOf.apply(item), item);
        idx++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return idx >= items.size();
    }
}
