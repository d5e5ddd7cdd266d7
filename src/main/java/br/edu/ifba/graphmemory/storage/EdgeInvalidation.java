package br.edu.ifba.graphmemory.storage;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Closes an existing edge at {@code invalidAt}, recording what caused it.
 *
 * @param edgeId        edge to close
 * @param invalidAt     end of the edge's validity
 * @param invalidatedBy ids of the edges or episodes that caused the invalidation
 */
public record EdgeInvalidation(
    @NotNull String edgeId,
    @NotNull Instant invalidAt,
    @NotNull List<String> invalidatedBy
) {

    public EdgeInvalidation {
        Objects.requireNonNull(edgeId, "edgeId must not be null");
        Objects.requireNonNull(invalidAt, "invalidAt must not be null");
        invalidatedBy = List.copyOf(invalidatedBy);
    }
}
