package br.edu.ifba.graphmemory.capability;

import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.schema.EntityTypeRegistry;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Input of one extraction call.
 *
 * @param episode  the episode being ingested
 * @param context  most recent prior episodes of the same namespace, oldest first
 * @param schema   declared entity types
 * @param hints    entity names the previous pass missed; empty on the first pass
 */
public record ExtractionRequest(
    @NotNull Episode episode,
    @NotNull List<Episode> context,
    @NotNull EntityTypeRegistry schema,
    @NotNull List<String> hints
) {

    public ExtractionRequest {
        Objects.requireNonNull(episode, "episode must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        context = List.copyOf(context);
        hints = List.copyOf(hints);
    }

    public ExtractionRequest withHints(@NotNull List<String> newHints) {
        return new ExtractionRequest(episode, context, schema, newHints);
    }
}
