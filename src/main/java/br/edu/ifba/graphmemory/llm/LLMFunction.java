package br.edu.ifba.graphmemory.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for Large Language Model completion.
 * Implementations handle the API calls to a provider and report provider failures as
 * {@link br.edu.ifba.graphmemory.exception.CapabilityException} subclasses
 * ({@code RateLimitedException}, {@code RefusedException}, ...).
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Generate a completion from the LLM.
     *
     * @param prompt The user prompt
     * @param systemPrompt Optional system prompt for context
     * @param historyMessages Optional conversation history
     * @param kwargs Additional parameters (temperature, max_tokens, etc.)
     * @return CompletableFuture with the generated response text
     */
    CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @Nullable List<Message> historyMessages,
        @NotNull Map<String, Object> kwargs
    );

    /**
     * Convenience method with system prompt but no history.
     */
    default CompletableFuture<String> apply(@NotNull String prompt, @Nullable String systemPrompt) {
        return apply(prompt, systemPrompt, null, Map.of());
    }

    /**
     * Represents a message in the conversation history.
     */
    record Message(
        @NotNull Role role,
        @NotNull String content
    ) {
        public enum Role {
            SYSTEM, USER, ASSISTANT
        }
    }
}
