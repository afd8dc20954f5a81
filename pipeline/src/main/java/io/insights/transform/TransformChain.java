package io.insights.transform;

import io.insights.core.Record;
import io.insights.core.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequentially applies transforms, flattening outputs between stages. Every output keeps the seq and
 * origin of the record that entered the chain.
 */
public final class TransformChain<I, O> implements Transform<I, O> {
    private final List<Transform<?, ?>> stages;

    private TransformChain(List<Transform<?, ?>> stages) {
        this.stages = List.copyOf(stages);
    }

    public static <I, O> TransformChain<I, O> of(Transform<I, O> first) {
        return new TransformChain<>(List.of(first));
    }

    public <R> TransformChain<I, R> then(Transform<O, R> next) {
        List<Transform<?, ?>> extended = new ArrayList<>(stages);
        extended.add(next);
        return new TransformChain<>(extended);
    }

    public int size() { return stages.size(); }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public List<Record<O>> apply(Record<I> input) throws Exception {
        List<Record<?>> current = List.of(input);
        for (Transform stage : stages) {
            List<Record<?>> next = new ArrayList<>();
            for (Record<?> r : current) {
                List<Record<?>> out = stage.apply(r);
                if (out != null) next.addAll(out);
            }
            if (next.isEmpty()) return List.of();
            current = next;
        }
        List<Record<O>> result = new ArrayList<>(current.size());
        for (Record<?> r : current) {
            result.add(new Record<>(input.seq(), input.origin(), (O) r.payload()));
        }
        return result;
    }
}
