package br.edu.ifba.graphmemory.llm;

import br.edu.ifba.graphmemory.capability.CandidateEntity;
import br.edu.ifba.graphmemory.capability.DedupDecision;
import br.edu.ifba.graphmemory.capability.DedupRequest;
import br.edu.ifba.graphmemory.capability.DeduplicationJudge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.exception.MalformedOutputException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link DeduplicationJudge} backed by a language model.
 *
 * <p>Shortlisted nodes are presented by index so the model never has to echo a uuid; an
 * index outside the shortlist is malformed output.</p>
 */
public class LlmDeduplicationJudge implements DeduplicationJudge {

    private static final String DEDUP_SYSTEM_PROMPT = """
        You decide whether a newly mentioned entity is the same real-world entity as one of
        a few existing entities. Names may differ (initials, nicknames, abbreviations).
        Only answer with a match when the episode makes it clear they are the same.

        Answer with a single JSON object and nothing else:
        {"duplicate_index": <index of the existing entity>} or {"duplicate_index": -1}
        """;

    private final LLMFunction llmFunction;

    public LlmDeduplicationJudge(@NotNull LLMFunction llmFunction) {
        this.llmFunction = llmFunction;
    }

    @Override
    public CompletableFuture<DedupDecision> judge(@NotNull DedupRequest request) {
        return llmFunction.apply(buildPrompt(request), DEDUP_SYSTEM_PROMPT)
            .thenApply(response -> parseDecision(LlmJson.parseObject(response, "dedup-judge"), request.shortlist()));
    }

    String buildPrompt(DedupRequest request) {
        CandidateEntity candidate = request.candidate();
        StringBuilder prompt = new StringBuilder();
        prompt.append("Episode:\n").append(request.episodeContext()).append("\n\n");
        prompt.append("New entity: ").append(candidate.name());
        if (candidate.type() != null) {
            prompt.append(" (").append(candidate.type()).append(')');
        }
        if (!candidate.summary().isBlank()) {
            prompt.append(" - ").append(candidate.summary());
        }
        prompt.append("\n\nExisting entities:\n");
        List<EntityNode> shortlist = request.shortlist();
        for (int i = 0; i < shortlist.size(); i++) {
            EntityNode node = shortlist.get(i);
            prompt.append(i).append(". ").append(node.getName()).append(" (").append(node.getPrimaryLabel()).append(')');
            if (!node.getSummary().isBlank()) {
                prompt.append(" - ").append(node.getSummary());
            }
            prompt.append('\n');
        }
        return prompt.toString();
    }

    static DedupDecision parseDecision(JsonNode root, List<EntityNode> shortlist) {
        JsonNode index = root.get("duplicate_index");
        if (index == null || index.isNull()) {
            return DedupDecision.newEntity();
        }
        if (!index.canConvertToInt()) {
            throw new MalformedOutputException("dedup-judge returned a non-integer duplicate_index: " + index);
        }
        int value = index.asInt();
        if (value < 0) {
            return DedupDecision.newEntity();
        }
        if (value >= shortlist.size()) {
            throw new MalformedOutputException(String.format(
                "dedup-judge returned duplicate_index %d for a shortlist of %d", value, shortlist.size()));
        }
        return DedupDecision.match(shortlist.get(value).getUuid());
    }
}
