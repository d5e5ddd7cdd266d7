package br.edu.ifba.graphmemory.schema;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A declared entity type: its label, a description handed to the extractor, and typed attributes.
 *
 * @param name        the type label, e.g. {@code Person}
 * @param description what the type represents
 * @param attributes  attribute names mapped to their declared types
 */
public record EntityTypeDefinition(
    @NotNull String name,
    @NotNull String description,
    @NotNull Map<String, AttributeType> attributes
) {

    public EntityTypeDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(description, "description must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        attributes = Map.copyOf(attributes);
    }

    public static Builder builder(@NotNull String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String description = "";
        private final Map<String, AttributeType> attributes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(@NotNull String description) {
            this.description = description;
            return this;
        }

        public Builder attribute(@NotNull String attribute, @NotNull AttributeType type) {
            this.attributes.put(attribute, type);
            return this;
        }

        public EntityTypeDefinition build() {
            return new EntityTypeDefinition(name, description, attributes);
        }
    }
}
