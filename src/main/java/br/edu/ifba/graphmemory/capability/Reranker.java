package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Cross-encoder reranking of search candidates.
 *
 * <p>Contract:
 * <ul>
 *   <li>Returns at most one score per candidate; candidates without a score keep their fused order after the scored ones</li>
 *   <li>Failures and timeouts never fail a search: the engine falls back to the pre-rerank order</li>
 * </ul>
 */
public interface Reranker {

    /**
     * Scores candidates against the query.
     *
     * @param query      the search query (required)
     * @param candidates candidates to score (required, non-empty)
     * @return one score per candidate, in any order
     */
    CompletableFuture<List<RerankScore>> score(@NotNull String query, @NotNull List<RerankCandidate> candidates);

    /**
     * Gets the provider name.
     *
     * @return provider identifier (e.g., "cohere", "jina", "none")
     */
    @NotNull
    String getProviderName();
}
