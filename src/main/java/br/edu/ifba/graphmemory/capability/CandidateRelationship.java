package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * A relationship proposed by the extractor. Endpoints are candidate entity names.
 *
 * @param sourceName   name of the source candidate entity
 * @param targetName   name of the target candidate entity
 * @param relationName relation label, e.g. {@code HOLDS_POSITION}
 * @param fact         natural-language statement of the relationship
 * @param validAt      when the fact became true, if the text says so
 * @param invalidAt    when the fact stopped being true, if the text says so
 */
public record CandidateRelationship(
    @NotNull String sourceName,
    @NotNull String targetName,
    @NotNull String relationName,
    @NotNull String fact,
    @Nullable Instant validAt,
    @Nullable Instant invalidAt
) {

    public CandidateRelationship {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(relationName, "relationName must not be null");
        Objects.requireNonNull(fact, "fact must not be null");
    }

    public static CandidateRelationship of(
            @NotNull String sourceName, @NotNull String relationName, @NotNull String targetName, @NotNull String fact) {
        return new CandidateRelationship(sourceName, targetName, relationName, fact, null, null);
    }
}
