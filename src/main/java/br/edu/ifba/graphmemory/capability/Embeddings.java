package br.edu.ifba.graphmemory.capability;

import br.edu.ifba.graphmemory.exception.MalformedOutputException;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Batch embedding through the capability gate.
 */
public final class Embeddings {

    private Embeddings() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * One vector per text, in order. A response of the wrong size is retried like any
     * other malformed capability output.
     */
    @NotNull
    public static List<float[]> embedAll(
            @NotNull CapabilityGate gate, @NotNull Embedder embedder, @NotNull String operation, @NotNull List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        return gate.call(operation, () -> embedder.embedBatch(texts).thenApply(vectors -> {
            if (vectors == null || vectors.size() != texts.size()) {
                throw new MalformedOutputException(String.format("%s returned %d vectors for %d texts",
                    operation, vectors == null ? 0 : vectors.size(), texts.size()));
            }
            return vectors;
        }));
    }
}
