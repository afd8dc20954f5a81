package io.insights.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.insights.core.Record;
import io.insights.core.Sink;
import io.insights.core.Source;
import io.insights.core.Transform;
import io.insights.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-source -> single-transform -> single-sink pipeline, drained synchronously on the calling thread.
 * Records reach the sink in source order. The first failing stage ends the run with a {@link StageException}.
 */
public class Pipeline<I, O> {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final String name;
    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;

    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    Pipeline(String name, Source<I> source, Transform<I, O> transform, Sink<O> sink, Metrics metrics) {
        this.name = Objects.requireNonNull(name);
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.transformTimer = metrics.timer(name + ".transform.time");
        this.sinkTimer = metrics.timer(name + ".sink.time");
        this.inMeter = metrics.meter(name + ".input.rate");
        this.outMeter = metrics.meter(name + ".output.rate");
        this.errorMeter = metrics.meter(name + ".error.rate");
    }

    public String name() { return name; }

    /**
     * Drains the source. Closes the source and sink when done, whether or not the run succeeded.
     */
    public RunStats run() {
        long t0 = System.nanoTime();
        long in = 0;
        long out = 0;
        Source<I> src = source;
        Sink<O> snk = sink;
        try (src; snk) {
            while (!source.isFinished()) {
                Optional<Record<I>> next = source.poll();
                if (next.isEmpty()) break;
                Record<I> record = next.get();
                in++;
                inMeter.mark();
                List<Record<O>> outputs = applyTransform(record);
                for (Record<O> o : outputs) {
                    deliver(o);
                    out++;
                }
            }
        }
        long elapsed = System.nanoTime() - t0;
        log.debug("{} finished: in={} out={} elapsedMs={}", name, in, out, elapsed / 1_000_000);
        return new RunStats(in, out, elapsed);
    }

    private List<Record<O>> applyTransform(Record<I> record) {
        try (Timer.Context ignored = transformTimer.time()) {
            List<Record<O>> outputs = transform.apply(record);
            return outputs == null ? List.of() : outputs;
        } catch (Exception e) {
            errorMeter.mark();
            throw new StageException("transform", record.seq(), record.origin(), e);
        }
    }

    private void deliver(Record<O> record) {
        try (Timer.Context ignored = sinkTimer.time()) {
            sink.accept(record);
            outMeter.mark();
        } catch (Exception e) {
            errorMeter.mark();
            throw new StageException("sink", record.seq(), record.origin(), e);
        }
    }
}
