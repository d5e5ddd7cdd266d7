package br.edu.ifba.graphmemory.capability;

import br.edu.ifba.graphmemory.core.EntityNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Input of the "is this the same entity" judgment.
 *
 * @param candidate      the newly extracted entity
 * @param shortlist      existing entities that passed the name pre-filter, best first
 * @param episodeContext body of the episode the candidate came from
 */
public record DedupRequest(
    @NotNull CandidateEntity candidate,
    @NotNull List<EntityNode> shortlist,
    @NotNull String episodeContext
) {

    public DedupRequest {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(episodeContext, "episodeContext must not be null");
        shortlist = List.copyOf(shortlist);
    }
}
