package br.edu.ifba.graphmemory.llm;

import br.edu.ifba.graphmemory.capability.CommunitySummarizer;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link CommunitySummarizer} backed by a language model answering in plain text.
 */
public class LlmCommunitySummarizer implements CommunitySummarizer {

    private static final String COMMUNITY_SYSTEM_PROMPT = """
        You summarize a group of related entities from a knowledge graph in one or two sentences,
        describing what connects them. Answer with the summary only.
        """;

    private final LLMFunction llmFunction;

    public LlmCommunitySummarizer(@NotNull LLMFunction llmFunction) {
        this.llmFunction = llmFunction;
    }

    @Override
    public CompletableFuture<String> summarize(@NotNull List<EntityNode> members, @NotNull List<EntityEdge> facts) {
        StringBuilder prompt = new StringBuilder("Entities:\n");
        for (EntityNode member : members) {
            prompt.append("- ").append(member.getName());
            if (!member.getSummary().isBlank()) {
                prompt.append(": ").append(member.getSummary());
            }
            prompt.append('\n');
        }
        if (!facts.isEmpty()) {
            prompt.append("\nFacts:\n");
            for (EntityEdge fact : facts) {
                prompt.append("- ").append(fact.getFact()).append('\n');
            }
        }
        return llmFunction.apply(prompt.toString(), COMMUNITY_SYSTEM_PROMPT)
            .thenApply(response -> LlmJson.requireText(response, "summarize-community"));
    }
}
