package br.edu.ifba.graphmemory.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One immutable unit of raw input submitted for ingestion.
 * 
 * <p>Episodes are never mutated. Every node and edge they contribute to references
 * them by uuid. The namespace is not validated here so that an invalid one can be
 * reported by the pipeline as a typed failure.</p>
 */
public final class Episode implements GraphElement {

    private final String uuid;
    private final String namespace;
    private final String name;
    private final String body;
    private final String sourceDescription;
    private final EpisodeType type;
    private final Instant referenceTime;
    private final Instant createdAt;

    private Episode(Builder builder) {
        this.uuid = builder.uuid != null ? builder.uuid : UUID.randomUUID().toString();
        this.namespace = Objects.requireNonNull(builder.namespace, "namespace must not be null");
        this.body = Objects.requireNonNull(builder.body, "body must not be null");
        this.name = builder.name != null ? builder.name : "episode-" + this.uuid.substring(0, 8);
        this.sourceDescription = builder.sourceDescription != null ? builder.sourceDescription : "";
        this.type = builder.type != null ? builder.type : EpisodeType.TEXT;
        this.referenceTime = Objects.requireNonNull(builder.referenceTime, "referenceTime must not be null");
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
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
    public String getBody() {
        return body;
    }

    @NotNull
    public String getSourceDescription() {
        return sourceDescription;
    }

    @NotNull
    public EpisodeType getType() {
        return type;
    }

    /**
     * Caller-supplied time the episode refers to. Used as the default valid time of the facts it carries.
     */
    @NotNull
    public Instant getReferenceTime() {
        return referenceTime;
    }

    @Override
    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    @NotNull
    public GraphKind getKind() {
        return GraphKind.EPISODE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Episode episode = (Episode) o;
        return uuid.equals(episode.uuid) &&
               namespace.equals(episode.namespace) &&
               name.equals(episode.name) &&
               body.equals(episode.body) &&
               sourceDescription.equals(episode.sourceDescription) &&
               type == episode.type &&
               referenceTime.equals(episode.referenceTime) &&
               createdAt.equals(episode.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, namespace, name, body, sourceDescription, type, referenceTime, createdAt);
    }

    @Override
    public String toString() {
        return "Episode{" +
               "uuid='" + uuid + '\'' +
               ", namespace='" + namespace + '\'' +
               ", name='" + name + '\'' +
               ", type=" + type +
               ", referenceTime=" + referenceTime +
               ", bodyLength=" + body.length() +
               '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String uuid;
        private String namespace;
        private String name;
        private String body;
        private String sourceDescription;
        private EpisodeType type;
        private Instant referenceTime;
        private Instant createdAt;

        public Builder uuid(@Nullable String uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder namespace(@NotNull String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        public Builder body(@NotNull String body) {
            this.body = body;
            return this;
        }

        public Builder sourceDescription(@Nullable String sourceDescription) {
            this.sourceDescription = sourceDescription;
            return this;
        }

        public Builder type(@Nullable EpisodeType type) {
            this.type = type;
            return this;
        }

        public Builder referenceTime(@NotNull Instant referenceTime) {
            this.referenceTime = referenceTime;
            return this;
        }

        public Builder createdAt(@Nullable Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Episode build() {
            return new Episode(this);
        }
    }
}
