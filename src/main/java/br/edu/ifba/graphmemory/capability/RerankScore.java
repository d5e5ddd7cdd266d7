package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Cross-encoder score of one candidate.
 *
 * @param candidateId the id of the scored {@link RerankCandidate}
 * @param score       relevance score (0.0 - 1.0)
 */
public record RerankScore(@NotNull String candidateId, double score) {

    /**
     * @throws IllegalArgumentException if score is not in [0.0, 1.0]
     */
    public RerankScore {
        Objects.requireNonNull(candidateId, "candidateId must not be null");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got: " + score);
        }
    }
}
