package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Regenerates an entity summary when a merge brings in new descriptions.
 */
@FunctionalInterface
public interface EntitySummarizer {

    /**
     * @param entityName   the canonical entity name
     * @param descriptions existing summary first, then the newly merged descriptions
     * @return a single summary covering all descriptions
     */
    CompletableFuture<String> summarize(@NotNull String entityName, @NotNull List<String> descriptions);
}
