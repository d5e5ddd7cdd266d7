package br.edu.ifba.graphmemory.search;

import br.edu.ifba.graphmemory.core.EntityEdge;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Breadth-first neighbourhood of a center node over an undirected view of the given edges.
 *
 * <p>A node at hop distance {@code h} scores {@code 1 / h}; an edge scores {@code 1 / h} where
 * {@code h} is the hop at which it is first crossed, so the center's own edges score 1.</p>
 */
public final class GraphTraversal {

    private final Map<String, Integer> nodeHops;
    private final Map<String, Integer> edgeHops;

    private GraphTraversal(Map<String, Integer> nodeHops, Map<String, Integer> edgeHops) {
        this.nodeHops = nodeHops;
        this.edgeHops = edgeHops;
    }

    /**
     * @param edges    edges that may be crossed
     * @param maxDepth hop bound, at least 1
     */
    @NotNull
    public static GraphTraversal from(@NotNull String centerId, @NotNull Collection<EntityEdge> edges, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got: " + maxDepth);
        }
        Map<String, List<EntityEdge>> adjacency = new HashMap<>();
        for (EntityEdge edge : edges) {
            adjacency.computeIfAbsent(edge.getSourceId(), id -> new ArrayList<>()).add(edge);
            adjacency.computeIfAbsent(edge.getTargetId(), id -> new ArrayList<>()).add(edge);
        }

        Map<String, Integer> nodeHops = new LinkedHashMap<>();
        Map<String, Integer> edgeHops = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        nodeHops.put(centerId, 0);
        queue.add(centerId);
        while (!queue.isEmpty()) {
            String nodeId = queue.poll();
            int hop = nodeHops.get(nodeId);
            if (hop >= maxDepth) {
                continue;
            }
            for (EntityEdge edge : adjacency.getOrDefault(nodeId, List.of())) {
                edgeHops.putIfAbsent(edge.getUuid(), hop + 1);
                String neighbour = edge.otherEnd(nodeId);
                if (neighbour != null && !nodeHops.containsKey(neighbour)) {
                    nodeHops.put(neighbour, hop + 1);
                    queue.add(neighbour);
                }
            }
        }
        return new GraphTraversal(nodeHops, edgeHops);
    }

    /**
     * Reached nodes except the center, by descending {@link #nodeScore}; ties keep discovery order.
     */
    @NotNull
    public List<String> rankedNodes() {
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : nodeHops.entrySet()) {
            if (entry.getValue() > 0) {
                ids.add(entry.getKey());
            }
        }
        ids.sort(Comparator.comparingDouble(this::nodeScore).reversed());
        return ids;
    }

    /**
     * Crossed edges, by descending {@link #edgeScore}; ties keep discovery order.
     */
    @NotNull
    public List<String> rankedEdges() {
        List<String> ids = new ArrayList<>(edgeHops.keySet());
        ids.sort(Comparator.comparingDouble(this::edgeScore).reversed());
        return ids;
    }

    public double nodeScore(@NotNull String nodeId) {
        Integer hop = nodeHops.get(nodeId);
        return hop == null || hop == 0 ? 0.0 : 1.0 / hop;
    }

    public double edgeScore(@NotNull String edgeId) {
        Integer hop = edgeHops.get(edgeId);
        return hop == null ? 0.0 : 1.0 / hop;
    }
}
