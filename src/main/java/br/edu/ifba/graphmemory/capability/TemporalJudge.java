package br.edu.ifba.graphmemory.capability;

import br.edu.ifba.graphmemory.core.EntityEdge;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Model-backed contradiction judgment between a new edge and an existing open edge.
 *
 * <p>The judge receives both facts with their valid times; it does not decide which one is
 * older, the pipeline does.</p>
 */
@FunctionalInterface
public interface TemporalJudge {

    CompletableFuture<EdgeJudgment> judge(@NotNull EntityEdge newEdge, @NotNull EntityEdge existingEdge);
}
