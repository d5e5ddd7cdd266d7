package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Model-backed extraction of entities and relationships from an episode.
 *
 * <p>Implementations signal provider failures by completing exceptionally with a
 * {@link br.edu.ifba.graphmemory.exception.CapabilityException}: rate limiting, empty or
 * malformed output are retried, refusals are not.</p>
 */
public interface Extractor {

    /**
     * Extracts candidate entities and relationships.
     *
     * @param request episode, recent context, declared types and optional hints
     * @return the extracted candidates
     */
    CompletableFuture<ExtractionResult> extract(@NotNull ExtractionRequest request);

    /**
     * Asks whether an obviously named entity is missing from {@code extracted}.
     *
     * <p>The default implementation never reports anything, which ends the reflexion loop
     * after the first pass.</p>
     *
     * @param request   the request of the pass being checked
     * @param extracted what has been extracted so far
     * @return names of missed entities; empty when nothing was missed
     */
    default CompletableFuture<List<String>> findMissedEntities(
            @NotNull ExtractionRequest request, @NotNull ExtractionResult extracted) {
        return CompletableFuture.completedFuture(List.of());
    }
}
