package br.edu.ifba.graphmemory.schema;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Declared entity types, used to validate extracted attributes at the ingestion boundary.
 *
 * <p>Type labels are matched case-insensitively and returned in their declared spelling.
 * Attributes of undeclared types, undeclared attributes and values that cannot be coerced
 * to their declared type are dropped with a warning.</p>
 */
public final class EntityTypeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(EntityTypeRegistry.class);

    /** Label given to candidates extracted without a type. */
    public static final String DEFAULT_TYPE = "Entity";

    private final Map<String, EntityTypeDefinition> types;

    private EntityTypeRegistry(Collection<EntityTypeDefinition> definitions) {
        Map<String, EntityTypeDefinition> map = new LinkedHashMap<>();
        for (EntityTypeDefinition definition : definitions) {
            map.put(definition.name().toLowerCase(Locale.ROOT), definition);
        }
        this.types = Collections.unmodifiableMap(map);
    }

    public static EntityTypeRegistry of(@NotNull Collection<EntityTypeDefinition> definitions) {
        return new EntityTypeRegistry(Objects.requireNonNull(definitions, "definitions must not be null"));
    }

    /**
     * Registry with general-purpose types for people, organizations, places, roles, events and concepts.
     */
    public static EntityTypeRegistry defaults() {
        return new EntityTypeRegistry(defaultDefinitions());
    }

    /**
     * Creates a registry with the default types plus {@code extra}, where extra definitions win on name clashes.
     */
    public static EntityTypeRegistry defaultsWith(@NotNull Collection<EntityTypeDefinition> extra) {
        List<EntityTypeDefinition> all = new ArrayList<>(defaultDefinitions());
        all.addAll(extra);
        return new EntityTypeRegistry(all);
    }

    @NotNull
    public Collection<EntityTypeDefinition> definitions() {
        return types.values();
    }

    @Nullable
    public EntityTypeDefinition find(@Nullable String typeName) {
        if (typeName == null) {
            return null;
        }
        return types.get(typeName.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the declared spelling of a type label, the label itself when undeclared, or
     * {@link #DEFAULT_TYPE} when it is blank.
     */
    @NotNull
    public String canonicalType(@Nullable String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return DEFAULT_TYPE;
        }
        EntityTypeDefinition definition = find(typeName);
        return definition != null ? definition.name() : typeName.trim();
    }

    /**
     * Validates raw extracted attributes against the declared type.
     *
     * @param typeName   the candidate's type label
     * @param entityName the candidate's name, for warnings
     * @param raw        raw attributes, may be null
     * @return accepted values and warnings for what was dropped
     */
    @NotNull
    public AttributeValidation validate(@Nullable String typeName, @NotNull String entityName, @Nullable Map<String, ?> raw) {
        String type = canonicalType(typeName);
        if (raw == null || raw.isEmpty()) {
            return new AttributeValidation(type, Map.of(), List.of());
        }

        EntityTypeDefinition definition = find(type);
        List<String> warnings = new ArrayList<>();
        Map<String, Object> accepted = new LinkedHashMap<>();

        if (definition == null) {
            warnings.add(String.format("Dropped %d attribute(s) of '%s': type '%s' is not declared",
                raw.size(), entityName, type));
        } else {
            for (Map.Entry<String, ?> entry : raw.entrySet()) {
                AttributeType declared = definition.attributes().get(entry.getKey());
                if (declared == null) {
                    warnings.add(String.format("Dropped attribute '%s' of '%s': not declared on %s",
                        entry.getKey(), entityName, type));
                    continue;
                }
                Object value = declared.coerce(entry.getValue());
                if (value == null) {
                    if (entry.getValue() != null) {
                        warnings.add(String.format("Dropped attribute '%s' of '%s': value '%s' is not a valid %s",
                            entry.getKey(), entityName, entry.getValue(), declared));
                    }
                    continue;
                }
                accepted.put(entry.getKey(), value);
            }
        }

        if (!warnings.isEmpty() && logger.isDebugEnabled()) {
            logger.debug("Attribute validation for '{}' ({}): {}", entityName, type, warnings);
        }
        return new AttributeValidation(type, accepted, warnings);
    }

    private static List<EntityTypeDefinition> defaultDefinitions() {
        return List.of(
            EntityTypeDefinition.builder("Person")
                .description("A human being, real or fictional")
                .attribute("title", AttributeType.STRING)
                .attribute("email", AttributeType.STRING)
                .attribute("age", AttributeType.INTEGER)
                .attribute("aliases", AttributeType.STRING_LIST)
                .attribute("birth_date", AttributeType.DATE_TIME)
                .build(),
            EntityTypeDefinition.builder("Organization")
                .description("A company, institution, team or other group of people")
                .attribute("industry", AttributeType.STRING)
                .attribute("founded_year", AttributeType.INTEGER)
                .attribute("headquarters", AttributeType.STRING)
                .attribute("website", AttributeType.STRING)
                .build(),
            EntityTypeDefinition.builder("Location")
                .description("A geographic place")
                .attribute("country", AttributeType.STRING)
                .attribute("latitude", AttributeType.NUMBER)
                .attribute("longitude", AttributeType.NUMBER)
                .build(),
            EntityTypeDefinition.builder("Role")
                .description("A position or job title someone can hold")
                .attribute("department", AttributeType.STRING)
                .attribute("seniority", AttributeType.STRING)
                .build(),
            EntityTypeDefinition.builder("Event")
                .description("Something that happened at a point or span of time")
                .attribute("start", AttributeType.DATE_TIME)
                .attribute("end", AttributeType.DATE_TIME)
                .attribute("recurring", AttributeType.BOOLEAN)
                .build(),
            EntityTypeDefinition.builder("Concept")
                .description("An idea, topic, preference or any other abstract thing")
                .attribute("category", AttributeType.STRING)
                .build(),
            EntityTypeDefinition.builder(DEFAULT_TYPE)
                .description("Anything that does not fit a more specific type")
                .build()
        );
    }
}
