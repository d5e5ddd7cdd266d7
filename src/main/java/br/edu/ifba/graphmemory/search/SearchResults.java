package br.edu.ifba.graphmemory.search;

import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Ranked results per scope.
 *
 * @param degraded true when a step fell back (reranker or query embedding unavailable); the
 *                 results are then partial or in pre-rerank order, and {@code warnings} says why
 */
public record SearchResults(
    @NotNull List<SearchHit<EntityEdge>> edges,
    @NotNull List<SearchHit<EntityNode>> nodes,
    @NotNull List<SearchHit<CommunityNode>> communities,
    boolean degraded,
    @NotNull List<String> warnings
) {

    public SearchResults {
        edges = List.copyOf(edges);
        nodes = List.copyOf(nodes);
        communities = List.copyOf(communities);
        warnings = List.copyOf(warnings);
    }

    public static SearchResults empty() {
        return new SearchResults(List.of(), List.of(), List.of(), false, List.of());
    }

    public boolean isEmpty() {
        return edges.isEmpty() && nodes.isEmpty() && communities.isEmpty();
    }
}
