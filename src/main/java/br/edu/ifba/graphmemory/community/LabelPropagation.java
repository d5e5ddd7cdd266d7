package br.edu.ifba.graphmemory.community;

import br.edu.ifba.graphmemory.core.EntityEdge;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

/**
 * Weighted label propagation.
 *
 * <p>Every node starts with its own id as label. Each pass visits the nodes in a shuffled
 * order and gives each node the label with the largest total edge weight among its
 * neighbours, where the weight between two nodes is the number of edges connecting them.
 * On a tie the node keeps its current label if it is among the best, otherwise takes the
 * smallest one. Passes stop once a pass changes nothing or the pass limit is reached.</p>
 */
public class LabelPropagation {

    private final int maxIterations;
    private final long seed;

    public LabelPropagation(int maxIterations, long seed) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    /**
     * @param nodeIds nodes to partition
     * @param edges   edges among them; edges with an endpoint outside {@code nodeIds} are ignored
     * @return final label per node id
     */
    @NotNull
    public Result run(@NotNull Collection<String> nodeIds, @NotNull Collection<EntityEdge> edges) {
        Set<String> nodes = new LinkedHashSet<>(nodeIds);
        Map<String, Map<String, Integer>> weights = weights(nodes, edges);

        Map<String, String> labels = new HashMap<>();
        for (String node : nodes) {
            labels.put(node, node);
        }

        List<String> order = new ArrayList<>(nodes);
        Collections.sort(order);
        Random random = new Random(seed);
        int passes = 0;
        boolean changed = true;
        while (changed && passes < maxIterations) {
            changed = false;
            passes++;
            Collections.shuffle(order, random);
            for (String node : order) {
                Map<String, Integer> neighbours = weights.get(node);
                if (neighbours == null || neighbours.isEmpty()) {
                    continue;
                }
                String next = bestLabel(labels.get(node), neighbours, labels);
                if (!next.equals(labels.get(node))) {
                    labels.put(node, next);
                    changed = true;
                }
            }
        }
        return new Result(labels, passes, !changed);
    }

    private static String bestLabel(String current, Map<String, Integer> neighbours, Map<String, String> labels) {
        Map<String, Integer> totals = new TreeMap<>();
        for (Map.Entry<String, Integer> neighbour : neighbours.entrySet()) {
            totals.merge(labels.get(neighbour.getKey()), neighbour.getValue(), Integer::sum);
        }
        int best = Collections.max(totals.values());
        if (totals.getOrDefault(current, 0) == best) {
            return current;
        }
        for (Map.Entry<String, Integer> total : totals.entrySet()) {
            if (total.getValue() == best) {
                return total.getKey();
            }
        }
        return current;
    }

    private static Map<String, Map<String, Integer>> weights(Set<String> nodes, Collection<EntityEdge> edges) {
        Map<String, Map<String, Integer>> weights = new HashMap<>();
        for (EntityEdge edge : edges) {
            String a = edge.getSourceId();
            String b = edge.getTargetId();
            if (a.equals(b) || !nodes.contains(a) || !nodes.contains(b)) {
                continue;
            }
            weights.computeIfAbsent(a, k -> new HashMap<>()).merge(b, 1, Integer::sum);
            weights.computeIfAbsent(b, k -> new HashMap<>()).merge(a, 1, Integer::sum);
        }
        return weights;
    }

    /**
     * @param labels    final label per node
     * @param passes    passes run
     * @param converged false when the pass limit stopped propagation
     */
    public record Result(@NotNull Map<String, String> labels, int passes, boolean converged) {

        public Result {
            labels = Map.copyOf(labels);
        }

        /**
         * Members per label, each list sorted by node id, groups ordered by their smallest member.
         */
        @NotNull
        public List<List<String>> groups() {
            Map<String, List<String>> byLabel = new TreeMap<>();
            for (Map.Entry<String, String> entry : labels.entrySet()) {
                byLabel.computeIfAbsent(entry.getValue(), k -> new ArrayList<>()).add(entry.getKey());
            }
            List<List<String>> groups = new ArrayList<>();
            for (List<String> members : byLabel.values()) {
                Collections.sort(members);
                groups.add(members);
            }
            groups.sort((x, y) -> x.get(0).compareTo(y.get(0)));
            return groups;
        }
    }
}
