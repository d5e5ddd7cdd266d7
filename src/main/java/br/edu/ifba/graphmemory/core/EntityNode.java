package br.edu.ifba.graphmemory.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A deduplicated real-world entity in the knowledge graph.
 *
 * <p>Nodes are immutable; every change produces a copy through one of the {@code withX}
 * methods. A node merged into another is never deleted: it is marked as superseded,
 * which closes its validity interval at the merge time.</p>
 */
public final class EntityNode implements GraphElement {

    @NotNull
    private final String uuid;

    @NotNull
    private final String namespace;

    @NotNull
    private final String name;

    /** Type labels, the first one being the primary type. */
    @NotNull
    private final List<String> labels;

    @NotNull
    private final String summary;

    /** Embedding of name and summary. */
    @Nullable
    private final float[] nameEmbedding;

    @NotNull
    private final Map<String, Object> attributes;

    /** Episodes that contributed evidence, in arrival order. */
    @NotNull
    private final List<String> episodeIds;

    @NotNull
    private final Instant createdAt;

    @NotNull
    private final Instant validAt;

    @Nullable
    private final Instant invalidAt;

    @Nullable
    private final String supersededBy;

    private EntityNode(Builder builder) {
        this.uuid = builder.uuid != null ? builder.uuid : UUID.randomUUID().toString();
        this.namespace = Objects.requireNonNull(builder.namespace, "namespace must not be null");
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        if (builder.labels.isEmpty()) {
            throw new IllegalArgumentException("EntityNode requires at least one label");
        }
        this.labels = Collections.unmodifiableList(new ArrayList<>(builder.labels));
        this.summary = builder.summary != null ? builder.summary : "";
        this.nameEmbedding = builder.nameEmbedding;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.episodeIds = Collections.unmodifiableList(new ArrayList<>(builder.episodeIds));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.validAt = builder.validAt != null ? builder.validAt : this.createdAt;
        this.invalidAt = builder.invalidAt;
        this.supersededBy = builder.supersededBy;
    }

    @Override
    @NotNull
    public String getUuid() {
        return uuid;
    }

    @Override
    @NotNull
    public String getNamespace() {
        return namespace;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public List<String> getLabels() {
        return labels;
    }

    @NotNull
    public String getPrimaryLabel() {
        return labels.get(0);
    }

    public boolean hasLabel(@NotNull String label) {
        for (String l : labels) {
            if (l.equalsIgnoreCase(label)) {
                return true;
            }
        }
        return false;
    }

    @NotNull
    public String getSummary() {
        return summary;
    }

    @Nullable
    public float[] getNameEmbedding() {
        return nameEmbedding;
    }

    @NotNull
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @NotNull
    public List<String> getEpisodeIds() {
        return episodeIds;
    }

    @Override
    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Reference time of the first episode that mentioned the entity.
     */
    @NotNull
    public Instant getValidAt() {
        return validAt;
    }

    @Nullable
    public Instant getInvalidAt() {
        return invalidAt;
    }

    /**
     * Uuid of the node this one was merged into, or null while the node is canonical.
     */
    @Nullable
    public String getSupersededBy() {
        return supersededBy;
    }

    public boolean isActive() {
        return supersededBy == null && invalidAt == null;
    }

    /**
     * @return true if {@code validAt <= instant < invalidAt}, with an open end when invalidAt is null
     */
    public boolean isValidAt(@NotNull Instant instant) {
        return !validAt.isAfter(instant) && (invalidAt == null || instant.isBefore(invalidAt));
    }

    @Override
    @NotNull
    public GraphKind getKind() {
        return GraphKind.NODE;
    }

    /**
     * Text used for the name embedding and for lexical search.
     */
    @NotNull
    public String embeddingText() {
        return summary.isBlank() ? name : name + ": " + summary;
    }

    public EntityNode withSummary(@NotNull String newSummary) {
        return toBuilder().summary(newSummary).build();
    }

    public EntityNode withNameEmbedding(@Nullable float[] embedding) {
        return toBuilder().nameEmbedding(embedding).build();
    }

    public EntityNode withAttributes(@NotNull Map<String, Object> newAttributes) {
        return toBuilder().attributes(newAttributes).build();
    }

    public EntityNode withLabels(@NotNull List<String> newLabels) {
        return toBuilder().labels(newLabels).build();
    }

    /**
     * Creates a copy with an additional contributing episode. Returns this node if the id is already present.
     *
     * @param episodeId the episode id to add
     * @return node carrying the episode as provenance
     */
    public EntityNode addEpisodeId(@NotNull String episodeId) {
        Objects.requireNonNull(episodeId, "episodeId must not be null");
        if (episodeIds.contains(episodeId)) {
            return this;
        }
        List<String> newList = new ArrayList<>(episodeIds);
        newList.add(episodeId);
        return toBuilder().episodeIds(newList).build();
    }

    /**
     * Creates a copy marked as merged into {@code targetId} at {@code mergedAt}.
     */
    public EntityNode supersede(@NotNull String targetId, @NotNull Instant mergedAt) {
        Objects.requireNonNull(targetId, "targetId must not be null");
        if (targetId.equals(uuid)) {
            throw new IllegalArgumentException("A node cannot be superseded by itself: " + uuid);
        }
        Instant end = mergedAt.isBefore(validAt) ? validAt : mergedAt;
        return toBuilder().supersededBy(targetId).invalidAt(end).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .uuid(uuid)
            .namespace(namespace)
            .name(name)
            .labels(labels)
            .summary(summary)
            .nameEmbedding(nameEmbedding)
            .attributes(attributes)
            .episodeIds(episodeIds)
            .createdAt(createdAt)
            .validAt(validAt)
            .invalidAt(invalidAt)
            .supersededBy(supersededBy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        EntityNode node = (EntityNode) obj;
        return uuid.equals(node.uuid) &&
               namespace.equals(node.namespace) &&
               name.equals(node.name) &&
               labels.equals(node.labels) &&
               summary.equals(node.summary) &&
               Arrays.equals(nameEmbedding, node.nameEmbedding) &&
               attributes.equals(node.attributes) &&
               episodeIds.equals(node.episodeIds) &&
               createdAt.equals(node.createdAt) &&
               validAt.equals(node.validAt) &&
               Objects.equals(invalidAt, node.invalidAt) &&
               Objects.equals(supersededBy, node.supersededBy);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(uuid, namespace, name, labels, summary, attributes, episodeIds,
            createdAt, validAt, invalidAt, supersededBy);
        return 31 * result + Arrays.hashCode(nameEmbedding);
    }

    @Override
    public String toString() {
        return "EntityNode{" +
                "uuid='" + uuid + '\'' +
                ", namespace='" + namespace + '\'' +
                ", name='" + name + '\'' +
                ", labels=" + labels +
                ", summary='" + summary + '\'' +
                ", attributes=" + attributes +
                ", episodeIds=" + episodeIds +
                ", validAt=" + validAt +
                ", invalidAt=" + invalidAt +
                ", supersededBy='" + supersededBy + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for EntityNode instances.
     */
    public static class Builder {
        private String uuid;
        private String namespace;
        private String name;
        private List<String> labels = new ArrayList<>();
        private String summary;
        private float[] nameEmbedding;
        private Map<String, Object> attributes = new LinkedHashMap<>();
        private List<String> episodeIds = new ArrayList<>();
        private Instant createdAt;
        private Instant validAt;
        private Instant invalidAt;
        private String supersededBy;

        public Builder uuid(@Nullable String uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder namespace(@NotNull String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder name(@NotNull String name) {
            this.name = name;
            return this;
        }

        public Builder label(@NotNull String label) {
            if (!this.labels.contains(label)) {
                this.labels.add(label);
            }
            return this;
        }

        public Builder labels(@NotNull List<String> labels) {
            this.labels = new ArrayList<>(labels);
            return this;
        }

        public Builder summary(@Nullable String summary) {
            this.summary = summary;
            return this;
        }

        public Builder nameEmbedding(@Nullable float[] nameEmbedding) {
            this.nameEmbedding = nameEmbedding;
            return this;
        }

        public Builder attributes(@NotNull Map<String, Object> attributes) {
            this.attributes = new LinkedHashMap<>(attributes);
            return this;
        }

        public Builder attribute(@NotNull String key, @NotNull Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder episodeIds(@NotNull List<String> episodeIds) {
            this.episodeIds = new ArrayList<>(episodeIds);
            return this;
        }

        public Builder episodeId(@NotNull String episodeId) {
            if (!this.episodeIds.contains(episodeId)) {
                this.episodeIds.add(episodeId);
            }
            return this;
        }

        public Builder createdAt(@Nullable Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder validAt(@Nullable Instant validAt) {
            this.validAt = validAt;
            return this;
        }

        public Builder invalidAt(@Nullable Instant invalidAt) {
            this.invalidAt = invalidAt;
            return this;
        }

        public Builder supersededBy(@Nullable String supersededBy) {
            this.supersededBy = supersededBy;
            return this;
        }

        public EntityNode build() {
            return new EntityNode(this);
        }
    }
}
