package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Result of the "is this the same entity" judgment.
 *
 * @param matchedUuid uuid of the matching shortlisted entity, or null for a new entity
 */
public record DedupDecision(@Nullable String matchedUuid) {

    private static final DedupDecision NEW_ENTITY = new DedupDecision(null);

    public static DedupDecision newEntity() {
        return NEW_ENTITY;
    }

    public static DedupDecision match(@NotNull String uuid) {
        return new DedupDecision(uuid);
    }

    public boolean isMatch() {
        return matchedUuid != null;
    }
}
