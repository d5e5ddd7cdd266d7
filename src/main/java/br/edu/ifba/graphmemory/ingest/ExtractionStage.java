package br.edu.ifba.graphmemory.ingest;

import br.edu.ifba.graphmemory.capability.CandidateEntity;
import br.edu.ifba.graphmemory.capability.CandidateRelationship;
import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.ExtractionRequest;
import br.edu.ifba.graphmemory.capability.ExtractionResult;
import br.edu.ifba.graphmemory.capability.Extractor;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.schema.AttributeValidation;
import br.edu.ifba.graphmemory.schema.EntityTypeRegistry;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * EXTRACTING: candidate entities and relationships of one episode.
 *
 * <p>Runs a bounded reflexion loop:</p>
 * <ol>
 *   <li>Initial extraction</li>
 *   <li>Ask the extractor which obviously named entities were missed</li>
 *   <li>Re-extract with those names as hints and merge the passes</li>
 *   <li>Stop when nothing is reported missing, a pass adds no entity, or the attempt cap is reached</li>
 * </ol>
 *
 * <p>The result is normalized at this boundary: entity types become declared type names and
 * attributes are validated against the type's schema.</p>
 */
public class ExtractionStage {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionStage.class);

    static final String DEFAULT_RELATION = "RELATES_TO";

    private final Extractor extractor;
    private final CapabilityGate gate;
    private final EntityTypeRegistry registry;
    private final GraphMemoryConfig.Extraction config;

    public ExtractionStage(
            @NotNull Extractor extractor,
            @NotNull CapabilityGate gate,
            @NotNull EntityTypeRegistry registry,
            @NotNull GraphMemoryConfig.Extraction config) {
        this.extractor = extractor;
        this.gate = gate;
        this.registry = registry;
        this.config = config;
    }

    /**
     * @param context most recent prior episodes of the namespace, oldest first
     */
    @NotNull
    ExtractionResult run(@NotNull EpisodeRun run, @NotNull List<Episode> context) {
        Episode episode = run.episode();
        ExtractionRequest request = new ExtractionRequest(episode, context, registry, List.of());
        ExtractionResult accumulated = gate.call("extract", () -> extractor.extract(request));
        int attempts = 1;

        while (config.reflexionEnabled() && attempts < config.maxAttempts()) {
            run.checkpoint();
            ExtractionResult extracted = accumulated;
            List<String> reported = gate.call("reflexion", () -> extractor.findMissedEntities(request, extracted));
            List<String> hints = newNames(reported, accumulated.entityKeys());
            if (hints.isEmpty()) {
                logger.debug("Reflexion for episode {} found nothing missing after {} attempt(s)", episode.getUuid(), attempts);
                break;
            }

            run.checkpoint();
            ExtractionRequest hinted = request.withHints(hints);
            ExtractionResult pass = gate.call("extract", () -> extractor.extract(hinted));
            attempts++;

            int before = accumulated.entities().size();
            accumulated = accumulated.merge(pass);
            int added = accumulated.entities().size() - before;
            logger.debug("Reflexion pass {}/{} for episode {} added {} entities (hints: {})",
                attempts, config.maxAttempts(), episode.getUuid(), added, hints);
            if (added == 0) {
                break;
            }
        }

        return normalize(run, accumulated);
    }

    private static List<String> newNames(List<String> reported, Set<String> known) {
        Set<String> names = new LinkedHashSet<>();
        if (reported == null) {
            return List.of();
        }
        for (String name : reported) {
            if (name != null && !name.isBlank() && !known.contains(ExtractionResult.key(name))) {
                names.add(name.trim());
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Canonical types, validated attributes, relation names in UPPER_SNAKE_CASE, and only
     * relationships whose endpoints were extracted.
     */
    @NotNull
    ExtractionResult normalize(@NotNull EpisodeRun run, @NotNull ExtractionResult raw) {
        List<CandidateEntity> entities = new ArrayList<>();
        for (CandidateEntity entity : raw.entities()) {
            AttributeValidation validation = registry.validate(entity.type(), entity.name(), entity.attributes());
            run.warnAll(validation.warnings());
            entities.add(entity.withType(validation.type()).withAttributes(validation.values()));
        }

        Set<String> keys = new ExtractionResult(entities, List.of()).entityKeys();
        List<CandidateRelationship> relationships = new ArrayList<>();
        for (CandidateRelationship relationship : raw.relationships()) {
            String source = ExtractionResult.key(relationship.sourceName());
            String target = ExtractionResult.key(relationship.targetName());
            if (!keys.contains(source) || !keys.contains(target)) {
                run.warn(String.format("Dropped relationship '%s': endpoint '%s' or '%s' was not extracted",
                    relationship.fact(), relationship.sourceName(), relationship.targetName()));
                continue;
            }
            if (source.equals(target)) {
                run.warn(String.format("Dropped self-referencing relationship '%s' on '%s'",
                    relationship.fact(), relationship.sourceName()));
                continue;
            }
            relationships.add(new CandidateRelationship(
                relationship.sourceName(),
                relationship.targetName(),
                normalizeRelationName(relationship.relationName()),
                relationship.fact().isBlank() ? relationship.sourceName() + " " + relationship.relationName()
                    + " " + relationship.targetName() : relationship.fact().trim(),
                relationship.validAt(),
                relationship.invalidAt()));
        }
        return new ExtractionResult(entities, relationships);
    }

    /**
     * "works for" and "Works-For" both become {@code WORKS_FOR}.
     */
    @NotNull
    static String normalizeRelationName(@NotNull String relationName) {
        String normalized = relationName.trim()
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .replaceAll("[^A-Za-z0-9]+", "_")
            .replaceAll("^_+|_+$", "")
            .toUpperCase(Locale.ROOT);
        return normalized.isEmpty() ? DEFAULT_RELATION : normalized;
    }
}
