package br.edu.ifba.graphmemory.llm;

import br.edu.ifba.graphmemory.capability.EdgeJudgment;
import br.edu.ifba.graphmemory.capability.TemporalJudge;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.exception.MalformedOutputException;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * {@link TemporalJudge} backed by a language model.
 */
public class LlmTemporalJudge implements TemporalJudge {

    private static final String TEMPORAL_SYSTEM_PROMPT = """
        You compare a new fact with an existing fact from a knowledge graph.

        - CORROBORATES: both state the same thing
        - CONTRADICTS: both cannot be true at the same time, so the newer one replaces the older one
        - INDEPENDENT: they can both be true

        Answer with a single JSON object and nothing else:
        {"judgment": "CORROBORATES" | "CONTRADICTS" | "INDEPENDENT"}
        """;

    private final LLMFunction llmFunction;

    public LlmTemporalJudge(@NotNull LLMFunction llmFunction) {
        this.llmFunction = llmFunction;
    }

    @Override
    public CompletableFuture<EdgeJudgment> judge(@NotNull EntityEdge newEdge, @NotNull EntityEdge existingEdge) {
        String prompt = String.format("Existing fact (valid from %s): %s%nNew fact (valid from %s): %s",
            existingEdge.getValidAt(), existingEdge.getFact(), newEdge.getValidAt(), newEdge.getFact());
        return llmFunction.apply(prompt, TEMPORAL_SYSTEM_PROMPT).thenApply(response -> {
            String judgment = LlmJson.text(LlmJson.parseObject(response, "temporal-judge"), "judgment");
            if (judgment == null) {
                throw new MalformedOutputException("temporal-judge returned no judgment");
            }
            try {
                return EdgeJudgment.valueOf(judgment.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new MalformedOutputException("temporal-judge returned unknown judgment: " + judgment, e);
            }
        });
    }
}
