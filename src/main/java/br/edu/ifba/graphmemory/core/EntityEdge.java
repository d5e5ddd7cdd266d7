package br.edu.ifba.graphmemory.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A directed, named relationship between two entity nodes, carrying bi-temporal fields.
 *
 * <ul>
 *   <li>{@code validAt}: when the fact became true in the world</li>
 *   <li>{@code invalidAt}: when it stopped being true, null while still valid</li>
 *   <li>{@code createdAt}: when the system learned it</li>
 *   <li>{@code invalidatedBy}: edges or episodes that caused the invalidation</li>
 * </ul>
 *
 * <p>Once {@code invalidAt} is set the only permitted change is appending to
 * {@code invalidatedBy}; the store rejects any other update.</p>
 */
public final class EntityEdge implements GraphElement {

    @NotNull
    private final String uuid;

    @NotNull
    private final String namespace;

    @NotNull
    private final String sourceId;

    @NotNull
    private final String targetId;

    @NotNull
    private final String relationName;

    @NotNull
    private final String fact;

    @Nullable
    private final float[] factEmbedding;

    @NotNull
    private final List<String> episodeIds;

    @NotNull
    private final Instant createdAt;

    @NotNull
    private final Instant validAt;

    @Nullable
    private final Instant invalidAt;

    @NotNull
    private final List<String> invalidatedBy;

    private EntityEdge(Builder builder) {
        this.uuid = builder.uuid != null ? builder.uuid : UUID.randomUUID().toString();
        this.namespace = Objects.requireNonNull(builder.namespace, "namespace must not be null");
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId must not be null");
        this.targetId = Objects.requireNonNull(builder.targetId, "targetId must not be null");
        this.relationName = Objects.requireNonNull(builder.relationName, "relationName must not be null");
        this.fact = builder.fact != null ? builder.fact : "";
        this.factEmbedding = builder.factEmbedding;
        this.episodeIds = Collections.unmodifiableList(new ArrayList<>(builder.episodeIds));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.validAt = Objects.requireNonNull(builder.validAt, "validAt must not be null");
        this.invalidAt = builder.invalidAt;
        this.invalidatedBy = Collections.unmodifiableList(new ArrayList<>(builder.invalidatedBy));
        if (invalidAt != null && invalidAt.isBefore(validAt)) {
            throw new IllegalArgumentException(String.format(
                "Edge %s has invalidAt %s before validAt %s", uuid, invalidAt, validAt));
        }
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
    public String getSourceId() {
        return sourceId;
    }

    @NotNull
    public String getTargetId() {
        return targetId;
    }

    @NotNull
    public String getRelationName() {
        return relationName;
    }

    @NotNull
    public String getFact() {
        return fact;
    }

    @Nullable
    public float[] getFactEmbedding() {
        return factEmbedding;
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

    @NotNull
    public Instant getValidAt() {
        return validAt;
    }

    @Nullable
    public Instant getInvalidAt() {
        return invalidAt;
    }

    @NotNull
    public List<String> getInvalidatedBy() {
        return invalidatedBy;
    }

    @Override
    @NotNull
    public GraphKind getKind() {
        return GraphKind.EDGE;
    }

    /**
     * An edge is open while its invalidAt is unset.
     */
    public boolean isOpen() {
        return invalidAt == null;
    }

    /**
     * @return true if {@code validAt <= instant < invalidAt}, with an open end when invalidAt is null
     */
    public boolean isValidAt(@NotNull Instant instant) {
        return !validAt.isAfter(instant) && (invalidAt == null || instant.isBefore(invalidAt));
    }

    public boolean touches(@NotNull String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }

    /**
     * The other endpoint of this edge, or null when {@code nodeId} is not an endpoint.
     */
    @Nullable
    public String otherEnd(@NotNull String nodeId) {
        if (sourceId.equals(nodeId)) {
            return targetId;
        }
        if (targetId.equals(nodeId)) {
            return sourceId;
        }
        return null;
    }

    /**
     * Key of the ordered (source, target, relation) triple on which at most one edge may be open.
     */
    @NotNull
    public String tripleKey() {
        return tripleKey(sourceId, targetId, relationName);
    }

    @NotNull
    public static String tripleKey(@NotNull String sourceId, @NotNull String targetId, @NotNull String relationName) {
        return sourceId + "|" + targetId + "|" + relationName;
    }

    public EntityEdge addEpisodeId(@NotNull String episodeId) {
        Objects.requireNonNull(episodeId, "episodeId must not be null");
        if (episodeIds.contains(episodeId)) {
            return this;
        }
        List<String> newList = new ArrayList<>(episodeIds);
        newList.add(episodeId);
        return toBuilder().episodeIds(newList).build();
    }

    public EntityEdge withFactEmbedding(@Nullable float[] embedding) {
        return toBuilder().factEmbedding(embedding).build();
    }

    public EntityEdge withEndpoints(@NotNull String newSourceId, @NotNull String newTargetId) {
        return toBuilder().sourceId(newSourceId).targetId(newTargetId).build();
    }

    /**
     * Creates a copy closed at {@code at}, recording what invalidated it.
     * Calling this on an edge that is already closed only appends provenance.
     */
    public EntityEdge invalidate(@NotNull Instant at, @NotNull Collection<String> causes) {
        Objects.requireNonNull(at, "at must not be null");
        List<String> by = new ArrayList<>(invalidatedBy);
        for (String cause : causes) {
            if (!by.contains(cause)) {
                by.add(cause);
            }
        }
        Instant end = invalidAt != null ? invalidAt : (at.isBefore(validAt) ? validAt : at);
        return toBuilder().invalidAt(end).invalidatedBy(by).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .uuid(uuid)
            .namespace(namespace)
            .sourceId(sourceId)
            .targetId(targetId)
            .relationName(relationName)
            .fact(fact)
            .factEmbedding(factEmbedding)
            .episodeIds(episodeIds)
            .createdAt(createdAt)
            .validAt(validAt)
            .invalidAt(invalidAt)
            .invalidatedBy(invalidatedBy);
    }

    /**
     * True when {@code other} differs from this edge only by additional invalidatedBy entries.
     */
    public boolean differsOnlyInInvalidatedBy(@NotNull EntityEdge other) {
        return uuid.equals(other.uuid) &&
               namespace.equals(other.namespace) &&
               sourceId.equals(other.sourceId) &&
               targetId.equals(other.targetId) &&
               relationName.equals(other.relationName) &&
               fact.equals(other.fact) &&
               Arrays.equals(factEmbedding, other.factEmbedding) &&
               episodeIds.equals(other.episodeIds) &&
               createdAt.equals(other.createdAt) &&
               validAt.equals(other.validAt) &&
               Objects.equals(invalidAt, other.invalidAt) &&
               other.invalidatedBy.containsAll(invalidatedBy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        EntityEdge edge = (EntityEdge) obj;
        return differsOnlyInInvalidatedBy(edge) && invalidatedBy.equals(edge.invalidatedBy);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(uuid, namespace, sourceId, targetId, relationName, fact, episodeIds,
            createdAt, validAt, invalidAt, invalidatedBy);
        return 31 * result + Arrays.hashCode(factEmbedding);
    }

    @Override
    public String toString() {
        return "EntityEdge{" +
                "uuid='" + uuid + '\'' +
                ", " + sourceId + " -[" + relationName + "]-> " + targetId +
                ", fact='" + fact + '\'' +
                ", validAt=" + validAt +
                ", invalidAt=" + invalidAt +
                ", invalidatedBy=" + invalidatedBy +
                ", episodeIds=" + episodeIds +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for EntityEdge instances.
     */
    public static class Builder {
        private String uuid;
        private String namespace;
        private String sourceId;
        private String targetId;
        private String relationName;
        private String fact;
        private float[] factEmbedding;
        private List<String> episodeIds = new ArrayList<>();
        private Instant createdAt;
        private Instant validAt;
        private Instant invalidAt;
        private List<String> invalidatedBy = new ArrayList<>();

        public Builder uuid(@Nullable String uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder namespace(@NotNull String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder sourceId(@NotNull String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder targetId(@NotNull String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder relationName(@NotNull String relationName) {
            this.relationName = relationName;
            return this;
        }

        public Builder fact(@Nullable String fact) {
            this.fact = fact;
            return this;
        }

        public Builder factEmbedding(@Nullable float[] factEmbedding) {
            this.factEmbedding = factEmbedding;
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

        public Builder validAt(@NotNull Instant validAt) {
            this.validAt = validAt;
            return this;
        }

        public Builder invalidAt(@Nullable Instant invalidAt) {
            this.invalidAt = invalidAt;
            return this;
        }

        public Builder invalidatedBy(@NotNull List<String> invalidatedBy) {
            this.invalidatedBy = new ArrayList<>(invalidatedBy);
            return this;
        }

        public EntityEdge build() {
            return new EntityEdge(this);
        }
    }
}
