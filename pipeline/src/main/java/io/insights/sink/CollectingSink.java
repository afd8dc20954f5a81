package io.insights.sink;

import io.insights.core.Record;
import io.insights.core.Sink;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps everything it receives in memory, in arrival order.
 */
public class CollectingSink<T> implements Sink<T> {
    private final List<Record<T>> records = new ArrayList<>();

    @Override
    public void accept(Record<T> record) {
        records.add(record);
    }

    public List<Record<T>> records() { return List.copyOf(records); }

    public List<T> payloads() {
        List<T> out = new ArrayList<>(records.size());
        for (Record<T> r : records) out.add(r.payload());
        return out;
    }
}
