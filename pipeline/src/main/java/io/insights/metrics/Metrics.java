package io.insights.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public <T> T time(String name, Callable<T> work) throws Exception {
        return registry.timer(name).time(work);
    }

    /** Counter and meter counts keyed by name, sorted, for printing. */
    public Map<String, Long> counts() {
        Map<String, Long> out = new TreeMap<>();
        registry.getCounters().forEach((k, c) -> out.put(k, c.getCount()));
        registry.getMeters().forEach((k, m) -> out.put(k, m.getCount()));
        return out;
    }
}
