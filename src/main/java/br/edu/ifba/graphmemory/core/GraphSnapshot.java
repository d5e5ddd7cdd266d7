package br.edu.ifba.graphmemory.core;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Nodes and edges of a namespace that were valid at a given instant.
 *
 * @param namespace the namespace the view was taken from
 * @param asOf      the instant the view describes
 * @param nodes     nodes with {@code validAt <= asOf < invalidAt}
 * @param edges     edges with {@code validAt <= asOf < invalidAt}
 */
public record GraphSnapshot(
    @NotNull String namespace,
    @NotNull Instant asOf,
    @NotNull List<EntityNode> nodes,
    @NotNull List<EntityEdge> edges
) {

    public GraphSnapshot {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
