package br.edu.ifba.graphmemory.llm;

import br.edu.ifba.graphmemory.capability.CandidateEntity;
import br.edu.ifba.graphmemory.capability.CandidateRelationship;
import br.edu.ifba.graphmemory.capability.ExtractionRequest;
import br.edu.ifba.graphmemory.capability.ExtractionResult;
import br.edu.ifba.graphmemory.capability.Extractor;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.schema.AttributeType;
import br.edu.ifba.graphmemory.schema.EntityTypeDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Extractor} backed by a language model answering in JSON.
 *
 * <h2>Output format:</h2>
 * <pre>{@code
 * {
 *   "entities": [{"name": "Alice", "type": "Person", "summary": "...", "attributes": {"age": 34}}],
 *   "relationships": [{"source": "Alice", "target": "Acme", "relation": "WORKS_FOR",
 *                      "fact": "Alice works for Acme", "valid_at": "2024-01-01T00:00:00Z", "invalid_at": null}]
 * }
 * }</pre>
 */
public class LlmExtractor implements Extractor {

    private static final Logger logger = LoggerFactory.getLogger(LlmExtractor.class);

    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {};

    private static final String EXTRACTION_SYSTEM_PROMPT = """
        You extract a knowledge graph from a single episode of text.

        Extract:
        1. Entities: people, organizations, places, products, concepts and events that are explicitly named.
           Give each entity one of the declared types, or "Entity" when none fits.
        2. Relationships between extracted entities, each stated as a short self-contained fact.
           Use an UPPER_SNAKE_CASE relation name such as WORKS_FOR or LIVES_IN.
           Set valid_at / invalid_at (ISO-8601) only when the text says when the fact started or ended,
           resolving relative dates against the episode reference time.

        Rules:
        - Use previous episodes only to resolve pronouns and references; do not extract from them
        - Every relationship source and target must be the name of an extracted entity
        - Only use attributes declared for the entity's type
        - Answer with a single JSON object and nothing else:
          {"entities": [{"name": "", "type": "", "summary": "", "attributes": {}}],
           "relationships": [{"source": "", "target": "", "relation": "", "fact": "", "valid_at": null, "invalid_at": null}]}
        """;

    private static final String REFLEXION_SYSTEM_PROMPT = """
        You review an entity extraction. Given an episode and the entity names already extracted,
        list the clearly named entities the extraction missed.

        Answer with a single JSON object and nothing else:
        {"missed_entities": ["name", ...]}
        Answer {"missed_entities": []} when nothing is missing.
        """;

    private final LLMFunction llmFunction;

    public LlmExtractor(@NotNull LLMFunction llmFunction) {
        this.llmFunction = llmFunction;
    }

    @Override
    public CompletableFuture<ExtractionResult> extract(@NotNull ExtractionRequest request) {
        String prompt = buildExtractionPrompt(request);
        logger.debug("Extracting episode {} ({} hints)", request.episode().getUuid(), request.hints().size());
        return llmFunction.apply(prompt, EXTRACTION_SYSTEM_PROMPT)
            .thenApply(response -> parseExtraction(LlmJson.parseObject(response, "extract")));
    }

    @Override
    public CompletableFuture<List<String>> findMissedEntities(
            @NotNull ExtractionRequest request, @NotNull ExtractionResult extracted) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Episode:\n").append(request.episode().getBody()).append("\n\nExtracted entities:\n");
        for (CandidateEntity entity : extracted.entities()) {
            prompt.append("- ").append(entity.name()).append('\n');
        }
        return llmFunction.apply(prompt.toString(), REFLEXION_SYSTEM_PROMPT).thenApply(response -> {
            JsonNode root = LlmJson.parseObject(response, "reflexion");
            List<String> missed = new ArrayList<>();
            JsonNode names = root.path("missed_entities");
            for (JsonNode name : names) {
                String value = name.asText().trim();
                if (!value.isEmpty()) {
                    missed.add(value);
                }
            }
            return missed;
        });
    }

    String buildExtractionPrompt(ExtractionRequest request) {
        Episode episode = request.episode();
        StringBuilder prompt = new StringBuilder();

        prompt.append("Declared entity types:\n");
        for (EntityTypeDefinition type : request.schema().definitions()) {
            prompt.append("- ").append(type.name());
            if (!type.description().isBlank()) {
                prompt.append(": ").append(type.description());
            }
            if (!type.attributes().isEmpty()) {
                prompt.append(" (attributes: ");
                List<String> attributes = new ArrayList<>();
                for (Map.Entry<String, AttributeType> attribute : type.attributes().entrySet()) {
                    attributes.add(attribute.getKey() + " " + attribute.getValue().name().toLowerCase(Locale.ROOT));
                }
                prompt.append(String.join(", ", attributes)).append(')');
            }
            prompt.append('\n');
        }

        if (!request.context().isEmpty()) {
            prompt.append("\nPrevious episodes (context only):\n");
            for (Episode previous : request.context()) {
                prompt.append("[").append(previous.getReferenceTime()).append("] ").append(previous.getBody()).append('\n');
            }
        }

        prompt.append("\nEpisode type: ").append(episode.getType())
            .append("\nReference time: ").append(episode.getReferenceTime());
        if (!episode.getSourceDescription().isBlank()) {
            prompt.append("\nSource: ").append(episode.getSourceDescription());
        }
        prompt.append("\n\nEpisode:\n").append(episode.getBody()).append('\n');

        if (!request.hints().isEmpty()) {
            prompt.append("\nThese entities were missed previously, make sure to extract them: ")
                .append(String.join(", ", request.hints())).append('\n');
        }
        return prompt.toString();
    }

    ExtractionResult parseExtraction(JsonNode root) {
        List<CandidateEntity> entities = new ArrayList<>();
        for (JsonNode node : root.path("entities")) {
            String name = LlmJson.text(node, "name");
            if (name == null) {
                logger.debug("Skipping extracted entity without a name: {}", node);
                continue;
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            JsonNode rawAttributes = node.get("attributes");
            if (rawAttributes != null && rawAttributes.isObject()) {
                attributes.putAll(LlmJson.MAPPER.convertValue(rawAttributes, ATTRIBUTES));
                attributes.values().removeIf(Objects::isNull);
            }
            String summary = LlmJson.text(node, "summary");
            entities.add(new CandidateEntity(name, LlmJson.text(node, "type"), summary != null ? summary : "", attributes));
        }

        List<CandidateRelationship> relationships = new ArrayList<>();
        for (JsonNode node : root.path("relationships")) {
            String source = LlmJson.text(node, "source");
            String target = LlmJson.text(node, "target");
            String relation = LlmJson.text(node, "relation");
            if (source == null || target == null || relation == null) {
                logger.debug("Skipping incomplete extracted relationship: {}", node);
                continue;
            }
            String fact = LlmJson.text(node, "fact");
            relationships.add(new CandidateRelationship(source, target, relation, fact != null ? fact : "",
                LlmJson.instant(node, "valid_at"), LlmJson.instant(node, "invalid_at")));
        }
        return new ExtractionResult(entities, relationships);
    }
}
