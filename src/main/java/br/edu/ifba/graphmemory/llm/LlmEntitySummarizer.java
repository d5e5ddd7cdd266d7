package br.edu.ifba.graphmemory.llm;

import br.edu.ifba.graphmemory.capability.EntitySummarizer;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link EntitySummarizer} that asks a language model to merge entity descriptions.
 */
public class LlmEntitySummarizer implements EntitySummarizer {

    private static final String SUMMARIZATION_SYSTEM_PROMPT = """
        You merge several descriptions of the same entity into one concise summary.
        Keep every distinct fact, drop repetitions, and do not add information.
        Answer with the summary only.
        """;

    private final LLMFunction llmFunction;

    public LlmEntitySummarizer(@NotNull LLMFunction llmFunction) {
        this.llmFunction = llmFunction;
    }

    @Override
    public CompletableFuture<String> summarize(@NotNull String entityName, @NotNull List<String> descriptions) {
        StringBuilder prompt = new StringBuilder("Entity: ").append(entityName).append("\n\nDescriptions:\n");
        for (String description : descriptions) {
            prompt.append("- ").append(description).append('\n');
        }
        return llmFunction.apply(prompt.toString(), SUMMARIZATION_SYSTEM_PROMPT)
            .thenApply(response -> LlmJson.requireText(response, "summarize-entity"));
    }
}
