package br.edu.ifba.graphmemory.search;

import org.jetbrains.annotations.NotNull;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Which retrieval methods run, how their rankings are post-processed and which scopes are returned.
 *
 * <p>Presets cover the common combinations; {@code withX} methods derive variants.</p>
 *
 * @param methods retrieval methods fused with reciprocal rank fusion
 * @param scopes  record kinds to return
 * @param mmr     re-order fused results with maximal marginal relevance
 * @param rerank  re-score the top fused results with the reranker
 */
public record SearchConfig(
    @NotNull Set<SearchMethod> methods,
    @NotNull Set<SearchScope> scopes,
    boolean mmr,
    boolean rerank
) {

    /** All methods over edges and nodes, fused with RRF only. */
    public static final SearchConfig HYBRID = new SearchConfig(
        EnumSet.allOf(SearchMethod.class), EnumSet.of(SearchScope.EDGES, SearchScope.NODES), false, false);

    /** {@link #HYBRID} followed by maximal marginal relevance. */
    public static final SearchConfig HYBRID_MMR = HYBRID.withMmr(true);

    /** {@link #HYBRID} followed by cross-encoder reranking. */
    public static final SearchConfig HYBRID_RERANK = HYBRID.withRerank(true);

    /** Edge facts only. */
    public static final SearchConfig EDGES_ONLY = HYBRID.withScopes(EnumSet.of(SearchScope.EDGES));

    /** Entity nodes only. */
    public static final SearchConfig NODES_ONLY = HYBRID.withScopes(EnumSet.of(SearchScope.NODES));

    /** Community summaries only; graph traversal does not apply to communities. */
    public static final SearchConfig COMMUNITIES_ONLY = new SearchConfig(
        EnumSet.of(SearchMethod.SEMANTIC, SearchMethod.BM25), EnumSet.of(SearchScope.COMMUNITIES), false, false);

    /** Every scope, every method, MMR and reranking. */
    public static final SearchConfig FULL = new SearchConfig(
        EnumSet.allOf(SearchMethod.class), EnumSet.allOf(SearchScope.class), true, true);

    public SearchConfig {
        Objects.requireNonNull(methods, "methods must not be null");
        Objects.requireNonNull(scopes, "scopes must not be null");
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("at least one search method is required");
        }
        if (scopes.isEmpty()) {
            throw new IllegalArgumentException("at least one search scope is required");
        }
        methods = Set.copyOf(methods);
        scopes = Set.copyOf(scopes);
    }

    public boolean uses(@NotNull SearchMethod method) {
        return methods.contains(method);
    }

    public boolean returns(@NotNull SearchScope scope) {
        return scopes.contains(scope);
    }

    public SearchConfig withMethods(@NotNull Set<SearchMethod> newMethods) {
        return new SearchConfig(newMethods, scopes, mmr, rerank);
    }

    public SearchConfig withScopes(@NotNull Set<SearchScope> newScopes) {
        return new SearchConfig(methods, newScopes, mmr, rerank);
    }

    public SearchConfig withMmr(boolean enabled) {
        return new SearchConfig(methods, scopes, enabled, rerank);
    }

    public SearchConfig withRerank(boolean enabled) {
        return new SearchConfig(methods, scopes, mmr, enabled);
    }
}
