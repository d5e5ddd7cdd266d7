package br.edu.ifba.graphmemory.capability;

import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Writes the summary of a community from its most central members.
 */
@FunctionalInterface
public interface CommunitySummarizer {

    /**
     * @param members most central members, highest weighted degree first
     * @param facts   open edges between those members
     * @return a short summary of what the members have in common
     */
    CompletableFuture<String> summarize(@NotNull List<EntityNode> members, @NotNull List<EntityEdge> facts);
}
