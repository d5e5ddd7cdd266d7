package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Entities and relationships extracted from one episode.
 */
public record ExtractionResult(
    @NotNull List<CandidateEntity> entities,
    @NotNull List<CandidateRelationship> relationships
) {

    public ExtractionResult {
        entities = List.copyOf(entities);
        relationships = List.copyOf(relationships);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }

    /**
     * Lowercased entity names.
     */
    @NotNull
    public Set<String> entityKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (CandidateEntity entity : entities) {
            keys.add(key(entity.name()));
        }
        return keys;
    }

    /**
     * Combines two passes. Entities are keyed by lowercased name and the first occurrence wins,
     * with summaries and attributes of later occurrences filling gaps. Relationships are
     * deduplicated on (source, relation, target, fact).
     */
    @NotNull
    public ExtractionResult merge(@NotNull ExtractionResult other) {
        Map<String, CandidateEntity> merged = new LinkedHashMap<>();
        for (CandidateEntity entity : entities) {
            merged.merge(key(entity.name()), entity, ExtractionResult::combine);
        }
        for (CandidateEntity entity : other.entities) {
            merged.merge(key(entity.name()), entity, ExtractionResult::combine);
        }

        Map<String, CandidateRelationship> relations = new LinkedHashMap<>();
        for (CandidateRelationship relationship : relationships) {
            relations.putIfAbsent(relationKey(relationship), relationship);
        }
        for (CandidateRelationship relationship : other.relationships) {
            relations.putIfAbsent(relationKey(relationship), relationship);
        }
        return new ExtractionResult(new ArrayList<>(merged.values()), new ArrayList<>(relations.values()));
    }

    @NotNull
    public static String key(@NotNull String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static CandidateEntity combine(CandidateEntity first, CandidateEntity second) {
        Map<String, Object> attributes = new LinkedHashMap<>(first.attributes());
        second.attributes().forEach(attributes::putIfAbsent);
        String summary = first.summary().isBlank() ? second.summary() : first.summary();
        String type = first.type() == null || first.type().isBlank() ? second.type() : first.type();
        return new CandidateEntity(first.name(), type, summary, attributes);
    }

    private static String relationKey(CandidateRelationship r) {
        return key(r.sourceName()) + "|" + r.relationName().toUpperCase(Locale.ROOT) + "|" + key(r.targetName())
            + "|" + r.fact().trim().toLowerCase(Locale.ROOT);
    }
}
