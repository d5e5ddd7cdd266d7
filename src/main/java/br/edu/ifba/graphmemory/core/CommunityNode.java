package br.edu.ifba.graphmemory.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A cluster of densely connected entity nodes with a generated summary.
 *
 * <p>Communities are replaced as a whole when their members change, never edited in place.</p>
 */
public final class CommunityNode implements GraphElement {

    private final String uuid;
    private final String namespace;
    private final String name;
    private final String summary;
    private final int level;
    private final List<String> memberIds;
    private final Instant createdAt;
    @Nullable
    private final float[] summaryEmbedding;

    public CommunityNode(
            @Nullable String uuid,
            @NotNull String namespace,
            @NotNull String name,
            @NotNull String summary,
            int level,
            @NotNull List<String> memberIds,
            @Nullable Instant createdAt,
            @Nullable float[] summaryEmbedding) {
        this.uuid = uuid != null ? uuid : UUID.randomUUID().toString();
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        if (level < 0) {
            throw new IllegalArgumentException("level must be >= 0, got: " + level);
        }
        this.level = level;
        this.memberIds = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(memberIds, "memberIds must not be null")));
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.summaryEmbedding = summaryEmbedding;
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
    public String getSummary() {
        return summary;
    }

    public int getLevel() {
        return level;
    }

    @NotNull
    public List<String> getMemberIds() {
        return memberIds;
    }

    @Override
    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Nullable
    public float[] getSummaryEmbedding() {
        return summaryEmbedding;
    }

    @Override
    @NotNull
    public GraphKind getKind() {
        return GraphKind.COMMUNITY;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        CommunityNode that = (CommunityNode) obj;
        return level == that.level &&
               uuid.equals(that.uuid) &&
               namespace.equals(that.namespace) &&
               name.equals(that.name) &&
               summary.equals(that.summary) &&
               memberIds.equals(that.memberIds) &&
               createdAt.equals(that.createdAt) &&
               Arrays.equals(summaryEmbedding, that.summaryEmbedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(uuid, namespace, name, summary, level, memberIds, createdAt)
            + Arrays.hashCode(summaryEmbedding);
    }

    @Override
    public String toString() {
        return "CommunityNode{" +
                "uuid='" + uuid + '\'' +
                ", name='" + name + '\'' +
                ", level=" + level +
                ", members=" + memberIds.size() +
                ", summary='" + summary + '\'' +
                '}';
    }
}
