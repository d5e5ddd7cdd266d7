package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * An entity proposed by the extractor, before deduplication.
 *
 * @param name       proposed name
 * @param type       proposed type label, may be null or blank when the extractor could not type it
 * @param summary    short description, may be empty
 * @param attributes raw attributes, validated against the entity type registry by the pipeline
 */
public record CandidateEntity(
    @NotNull String name,
    @Nullable String type,
    @NotNull String summary,
    @NotNull Map<String, Object> attributes
) {

    public CandidateEntity {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        name = name.trim();
        summary = summary != null ? summary.trim() : "";
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static CandidateEntity of(@NotNull String name, @Nullable String type) {
        return new CandidateEntity(name, type, "", Map.of());
    }

    public CandidateEntity withType(@Nullable String newType) {
        return new CandidateEntity(name, newType, summary, attributes);
    }

    public CandidateEntity withAttributes(@NotNull Map<String, Object> newAttributes) {
        return new CandidateEntity(name, type, summary, newAttributes);
    }
}
