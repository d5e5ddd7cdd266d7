package br.edu.ifba.graphmemory.schema;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Outcome of validating a raw attribute map against an entity type.
 *
 * @param type     the resolved type label
 * @param values   the accepted, coerced attributes
 * @param warnings one message per dropped attribute
 */
public record AttributeValidation(
    @NotNull String type,
    @NotNull Map<String, Object> values,
    @NotNull List<String> warnings
) {

    public AttributeValidation {
        values = Map.copyOf(values);
        warnings = List.copyOf(warnings);
    }
}
