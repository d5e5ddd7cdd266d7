package br.edu.ifba.graphmemory.community;

import br.edu.ifba.graphmemory.core.EntityEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelPropagationTest {

    private static EntityEdge link(String a, String b) {
        return EntityEdge.builder()
            .namespace("acme")
            .sourceId(a)
            .targetId(b)
            .relationName("KNOWS")
            .validAt(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    }

    private static final List<String> NODES = List.of("a", "b", "c", "x", "y", "z", "solo");

    private static final List<EntityEdge> TWO_TRIANGLES = List.of(
        link("a", "b"), link("b", "c"), link("c", "a"),
        link("x", "y"), link("y", "z"), link("z", "x"));

    @Test
    @DisplayName("disconnected triangles end up in separate groups, isolated nodes alone")
    void testSeparatesComponents() {
        LabelPropagation.Result result = new LabelPropagation(100, 42).run(NODES, TWO_TRIANGLES);

        assertEquals(List.of(List.of("a", "b", "c"), List.of("solo"), List.of("x", "y", "z")), result.groups());
        assertTrue(result.converged());
    }

    @Test
    @DisplayName("the same seed gives the same labels")
    void testDeterministic() {
        List<EntityEdge> edges = new ArrayList<>(TWO_TRIANGLES);
        edges.add(link("c", "x"));

        LabelPropagation.Result first = new LabelPropagation(100, 7).run(NODES, edges);
        LabelPropagation.Result second = new LabelPropagation(100, 7).run(NODES, edges);

        assertEquals(first.labels(), second.labels());
        assertEquals(first.passes(), second.passes());
    }

    @Test
    @DisplayName("the pass limit stops propagation before convergence")
    void testPassLimit() {
        LabelPropagation.Result result = new LabelPropagation(1, 42).run(NODES, TWO_TRIANGLES);

        assertEquals(1, result.passes());
        assertFalse(result.converged());
    }

    @Test
    @DisplayName("self-loops and edges leaving the node set are ignored")
    void testIgnoredEdges() {
        LabelPropagation.Result result = new LabelPropagation(100, 42).run(
            List.of("a", "b"), List.of(link("a", "a"), link("b", "outsider")));

        assertEquals(List.of(List.of("a"), List.of("b")), result.groups());
        assertEquals(1, result.passes());
    }

    @Test
    void testInvalidPassLimit() {
        assertThrows(IllegalArgumentException.class, () -> new LabelPropagation(0, 42));
    }
}
