package br.edu.ifba.graphmemory.storage;

import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Every mutation produced by one pipeline run, committed atomically.
 *
 * <p>Stores apply a batch in this order: episode, node upserts, invalidations, edge upserts.
 * Either all of it becomes visible or none of it does.</p>
 */
public final class GraphWriteBatch {

    private final String namespace;
    @Nullable
    private final Episode episode;
    private final List<EntityNode> nodes;
    private final List<EdgeInvalidation> invalidations;
    private final List<EntityEdge> edges;

    private GraphWriteBatch(Builder builder) {
        this.namespace = Objects.requireNonNull(builder.namespace, "namespace must not be null");
        this.episode = builder.episode;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(builder.nodes));
        this.invalidations = Collections.unmodifiableList(new ArrayList<>(builder.invalidations));
        this.edges = Collections.unmodifiableList(new ArrayList<>(builder.edges));
    }

    @NotNull
    public String getNamespace() {
        return namespace;
    }

    @Nullable
    public Episode getEpisode() {
        return episode;
    }

    @NotNull
    public List<EntityNode> getNodes() {
        return nodes;
    }

    @NotNull
    public List<EdgeInvalidation> getInvalidations() {
        return invalidations;
    }

    @NotNull
    public List<EntityEdge> getEdges() {
        return edges;
    }

    public boolean isEmpty() {
        return episode == null && nodes.isEmpty() && invalidations.isEmpty() && edges.isEmpty();
    }

    @Override
    public String toString() {
        return "GraphWriteBatch{" +
                "namespace='" + namespace + '\'' +
                ", episode=" + (episode != null ? episode.getUuid() : null) +
                ", nodes=" + nodes.size() +
                ", invalidations=" + invalidations.size() +
                ", edges=" + edges.size() +
                '}';
    }

    public static Builder builder(@NotNull String namespace) {
        return new Builder(namespace);
    }

    public static class Builder {
        private final String namespace;
        private Episode episode;
        private final List<EntityNode> nodes = new ArrayList<>();
        private final List<EdgeInvalidation> invalidations = new ArrayList<>();
        private final List<EntityEdge> edges = new ArrayList<>();

        private Builder(String namespace) {
            this.namespace = namespace;
        }

        public Builder episode(@Nullable Episode episode) {
            this.episode = episode;
            return this;
        }

        public Builder node(@NotNull EntityNode node) {
            this.nodes.add(node);
            return this;
        }

        public Builder nodes(@NotNull List<EntityNode> nodes) {
            this.nodes.addAll(nodes);
            return this;
        }

        public Builder invalidation(@NotNull EdgeInvalidation invalidation) {
            this.invalidations.add(invalidation);
            return this;
        }

        public Builder edge(@NotNull EntityEdge edge) {
            this.edges.add(edge);
            return this;
        }

        public Builder edges(@NotNull List<EntityEdge> edges) {
            this.edges.addAll(edges);
            return this;
        }

        public GraphWriteBatch build() {
            return new GraphWriteBatch(this);
        }
    }
}
