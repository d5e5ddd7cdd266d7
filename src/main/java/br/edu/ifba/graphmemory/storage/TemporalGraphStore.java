package br.edu.ifba.graphmemory.storage;

import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.GraphElement;
import br.edu.ifba.graphmemory.core.GraphKind;
import br.edu.ifba.graphmemory.core.GraphSnapshot;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Namespace-partitioned storage of episodes, entity nodes, temporal edges and communities.
 *
 * <p>The store is the only shared mutable state of the system. Writes that belong to one
 * episode go through {@link #commit(GraphWriteBatch)} and are atomic. Stores enforce two
 * integrity rules on every write and reject violations with {@link IllegalStateException}:</p>
 * <ul>
 *   <li>at most one open edge per ordered (source, target, relation) triple</li>
 *   <li>an invalidated edge only ever gains further {@code invalidatedBy} entries</li>
 * </ul>
 *
 * <p>Infrastructure failures complete the returned futures with
 * {@link br.edu.ifba.graphmemory.exception.StoreUnavailableException}.</p>
 */
public interface TemporalGraphStore extends AutoCloseable {

    /**
     * Initializes the store (creates schema, opens connections).
     */
    CompletableFuture<Void> initialize();

    /**
     * Creates secondary indices. Safe to call repeatedly.
     */
    CompletableFuture<Void> buildIndices();

    /**
     * Applies every mutation of the batch in one transaction.
     */
    CompletableFuture<Void> commit(@NotNull GraphWriteBatch batch);

    CompletableFuture<Void> upsertNode(@NotNull EntityNode node);

    CompletableFuture<Void> upsertEdge(@NotNull EntityEdge edge);

    /**
     * Closes an edge. On an edge that is already closed only {@code invalidatedBy} is extended.
     *
     * @throws IllegalArgumentException (through the future) if the edge does not exist
     */
    CompletableFuture<Void> invalidateEdge(@NotNull String edgeId, @NotNull Instant invalidAt, @NotNull List<String> invalidatedBy);

    /**
     * @return the node, or null if absent
     */
    CompletableFuture<EntityNode> getNode(@NotNull String uuid);

    /**
     * @return the edge, or null if absent
     */
    CompletableFuture<EntityEdge> getEdge(@NotNull String uuid);

    /**
     * @return the episode, or null if absent
     */
    CompletableFuture<Episode> getEpisode(@NotNull String uuid);

    /**
     * Open and historical edges from {@code sourceId} to {@code targetId}, ordered by validAt.
     *
     * @param relationName restricts to one relation when not null
     */
    CompletableFuture<List<EntityEdge>> getEdgesBetween(
        @NotNull String sourceId, @NotNull String targetId, @Nullable String relationName);

    /**
     * Open and historical edges with {@code nodeId} as source or target.
     */
    CompletableFuture<List<EntityEdge>> getEdgesForNode(@NotNull String nodeId);

    /**
     * Nodes and edges with {@code validAt <= timestamp < invalidAt}, with a missing invalidAt treated as +infinity.
     */
    CompletableFuture<GraphSnapshot> pointInTimeView(@NotNull String namespace, @NotNull Instant timestamp);

    /**
     * Records of one kind in a namespace, most recently created first.
     *
     * @param since only records created at or after this instant, when not null
     * @param limit maximum number of records, when not null
     */
    CompletableFuture<List<GraphElement>> getByNamespace(
        @NotNull String namespace, @NotNull GraphKind kind, @Nullable Instant since, @Nullable Integer limit);

    /**
     * The {@code limit} episodes with the latest reference time, returned oldest first.
     */
    CompletableFuture<List<Episode>> getRecentEpisodes(@NotNull String namespace, int limit);

    /**
     * Replaces stale communities and inserts new ones in one transaction.
     *
     * @param affectedNodeIds communities with any of these members are removed; null removes every community of the namespace
     * @param communities     replacements
     */
    CompletableFuture<Void> replaceCommunities(
        @NotNull String namespace, @Nullable Collection<String> affectedNodeIds, @NotNull List<CommunityNode> communities);

    /**
     * Deletes every record of a namespace.
     */
    CompletableFuture<Void> purgeNamespace(@NotNull String namespace);

    default CompletableFuture<List<EntityNode>> getNodes(@NotNull String namespace) {
        return getByNamespace(namespace, GraphKind.NODE, null, null).thenApply(TemporalGraphStore::nodesOf);
    }

    default CompletableFuture<List<EntityEdge>> getEdges(@NotNull String namespace) {
        return getByNamespace(namespace, GraphKind.EDGE, null, null).thenApply(TemporalGraphStore::edgesOf);
    }

    default CompletableFuture<List<CommunityNode>> getCommunities(@NotNull String namespace) {
        return getByNamespace(namespace, GraphKind.COMMUNITY, null, null).thenApply(elements -> {
            List<CommunityNode> communities = new ArrayList<>(elements.size());
            for (GraphElement element : elements) {
                communities.add((CommunityNode) element);
            }
            return communities;
        });
    }

    /**
     * Nodes that have not been merged into another node.
     */
    default CompletableFuture<List<EntityNode>> getActiveNodes(@NotNull String namespace) {
        return getNodes(namespace).thenApply(nodes -> {
            List<EntityNode> active = new ArrayList<>(nodes.size());
            for (EntityNode node : nodes) {
                if (node.getSupersededBy() == null) {
                    active.add(node);
                }
            }
            return active;
        });
    }

    private static List<EntityNode> nodesOf(List<GraphElement> elements) {
        List<EntityNode> nodes = new ArrayList<>(elements.size());
        for (GraphElement element : elements) {
            nodes.add((EntityNode) element);
        }
        return nodes;
    }

    private static List<EntityEdge> edgesOf(List<GraphElement> elements) {
        List<EntityEdge> edges = new ArrayList<>(elements.size());
        for (GraphElement element : elements) {
            edges.add((EntityEdge) element);
        }
        return edges;
    }

    @Override
    void close();
}
