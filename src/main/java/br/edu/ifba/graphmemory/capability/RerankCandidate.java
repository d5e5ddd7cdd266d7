package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A search result handed to the reranker.
 *
 * @param id   result identifier, echoed back in {@link RerankScore}
 * @param text text the reranker scores against the query
 */
public record RerankCandidate(@NotNull String id, @NotNull String text) {

    public RerankCandidate {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
