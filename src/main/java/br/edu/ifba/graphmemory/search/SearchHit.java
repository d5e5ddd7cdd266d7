package br.edu.ifba.graphmemory.search;

import br.edu.ifba.graphmemory.core.GraphElement;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Set;

/**
 * One ranked search result.
 *
 * <p>Hits are ordered by {@code rerankScore} where the reranker scored them, then in fused order,
 * so {@code score} need not decrease along a reranked list.</p>
 *
 * @param item        the matched record
 * @param score       reciprocal rank fusion score; only comparable within one result list
 * @param methods     retrieval methods that returned the record
 * @param rerankScore reranker score, null when the record was not reranked
 */
public record SearchHit<T extends GraphElement>(
    @NotNull T item,
    double score,
    @NotNull Set<SearchMethod> methods,
    @Nullable Double rerankScore
) {

    public SearchHit {
        Objects.requireNonNull(item, "item must not be null");
        methods = Set.copyOf(methods);
    }

    public SearchHit(@NotNull T item, double score, @NotNull Set<SearchMethod> methods) {
        this(item, score, methods, null);
    }

    public boolean isReranked() {
        return rerankScore != null;
    }
}
