package io.insights.core;

import java.util.Objects;

/**
 * A payload tagged with its origin (a file or dataset name) and its position within that origin.
 */
public final class Record<T> implements Comparable<Record<?>> {
    private final long seq; // position within the source, starting at 0
    private final String origin;
    private final T payload;

    public Record(long seq, String origin, T payload) {
        this.seq = seq;
        this.origin = origin == null ? "" : origin;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public String origin() { return origin; }
    public T payload() { return payload; }

    /** Same position and origin, new payload. */
    public <R> Record<R> withPayload(R next) {
        return new Record<>(seq, origin, next);
    }

    @Override
    public int compareTo(Record<?> o) {
        return Long.compare(this.seq, o.seq);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && origin.equals(that.origin) && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, origin, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", origin='" + origin + '\'' +
                ", payload=" + payload +
                '}';
    }
}
