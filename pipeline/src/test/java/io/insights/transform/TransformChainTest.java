package io.insights.transform;

import io.insights.core.Record;
import io.insights.core.Transform;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformChainTest {
    @Test
    void applies_stages_in_order_and_keeps_input_position() throws Exception {
        Transform<String, String> stage1 = r -> List.of(new Record<>(3, "other", r.payload() + "A"));
        Transform<String, Integer> stage2 = Transform.mapping(s -> (s + "B").length());
        TransformChain<String, Integer> chain = TransformChain.of(stage1).then(stage2);
        List<Record<Integer>> out = chain.apply(new Record<>(42, "in.csv", "xy"));
        assertEquals(1, out.size());
        assertEquals(42, out.get(0).seq());
        assertEquals("in.csv", out.get(0).origin());
        assertEquals(4, out.get(0).payload());
        assertEquals(2, chain.size());
    }

    @Test
    void fans_out_and_stops_when_a_stage_emits_nothing() throws Exception {
        Transform<String, String> split = r -> List.of(r.withPayload("a"), r.withPayload("b"));
        Transform<String, String> upper = Transform.mapping(String::toUpperCase);
        List<Record<String>> out = TransformChain.of(split).then(upper).apply(new Record<>(0, "", "ignored"));
        assertEquals(List.of("A", "B"), out.stream().map(Record::payload).toList());

        Transform<String, String> drop = r -> List.of();
        assertTrue(TransformChain.of(drop).then(upper).apply(new Record<>(1, "", "x")).isEmpty());
    }

    @Test
    void stage_failure_propagates() {
        Transform<String, String> boom = r -> { throw new IllegalStateException("boom"); };
        TransformChain<String, String> chain = TransformChain.of(Transform.<String, String>mapping(s -> s)).then(boom);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.apply(new Record<>(0, "", "x")));
        assertEquals("boom", e.getMessage());
    }
}
