package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Model-backed confirmation that a candidate entity is one of the shortlisted existing entities.
 */
@FunctionalInterface
public interface DeduplicationJudge {

    /**
     * @param request candidate, shortlist and episode context
     * @return the matching uuid, or a "new entity" decision
     */
    CompletableFuture<DedupDecision> judge(@NotNull DedupRequest request);
}
