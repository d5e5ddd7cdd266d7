package br.edu.ifba.graphmemory.storage.impl;

import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.GraphElement;
import br.edu.ifba.graphmemory.core.GraphKind;
import br.edu.ifba.graphmemory.core.GraphSnapshot;
import br.edu.ifba.graphmemory.storage.EdgeInvalidation;
import br.edu.ifba.graphmemory.storage.GraphIntegrity;
import br.edu.ifba.graphmemory.storage.GraphWriteBatch;
import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory temporal graph store.
 *
 * <p>Keeps adjacency lists of edge ids per node and an index of the open edge of every
 * (source, target, relation) triple. Batches are staged and validated before anything
 * is applied, then applied under the write lock, so readers see either the whole batch
 * or none of it.</p>
 */
public class InMemoryTemporalGraphStore implements TemporalGraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTemporalGraphStore.class);

    private static final Comparator<GraphElement> NEWEST_FIRST =
        Comparator.comparing(GraphElement::getCreatedAt).reversed().thenComparing(GraphElement::getUuid);

    private final Map<String, Episode> episodes = new HashMap<>();
    private final Map<String, EntityNode> nodes = new HashMap<>();
    private final Map<String, EntityEdge> edges = new HashMap<>();
    private final Map<String, CommunityNode> communities = new HashMap<>();

    // nodeId -> ids of edges with that node as source or target
    private final Map<String, Set<String>> adjacency = new HashMap<>();

    // tripleKey -> id of the open edge on that triple
    private final Map<String, String> openEdges = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryTemporalGraphStore initialized");
            }
        });
    }

    @Override
    public CompletableFuture<Void> buildIndices() {
        ensureInitialized();
        // adjacency and open-edge indices are maintained on every write
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> commit(@NotNull GraphWriteBatch batch) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> write(() -> {
            applyBatch(batch);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> upsertNode(@NotNull EntityNode node) {
        return commit(GraphWriteBatch.builder(node.getNamespace()).node(node).build());
    }

    @Override
    public CompletableFuture<Void> upsertEdge(@NotNull EntityEdge edge) {
        return commit(GraphWriteBatch.builder(edge.getNamespace()).edge(edge).build());
    }

    @Override
    public CompletableFuture<Void> invalidateEdge(
            @NotNull String edgeId, @NotNull Instant invalidAt, @NotNull List<String> invalidatedBy) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> write(() -> {
            EntityEdge edge = edges.get(edgeId);
            if (edge == null) {
                throw new IllegalArgumentException("Unknown edge: " + edgeId);
            }
            applyBatch(GraphWriteBatch.builder(edge.getNamespace())
                .invalidation(new EdgeInvalidation(edgeId, invalidAt, invalidatedBy))
                .build());
            return null;
        }));
    }

    @Override
    public CompletableFuture<EntityNode> getNode(@NotNull String uuid) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> read(() -> nodes.get(uuid)));
    }

    @Override
    public CompletableFuture<EntityEdge> getEdge(@NotNull String uuid) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> read(() -> edges.get(uuid)));
    }

    @Override
    public CompletableFuture<Episode> getEpisode(@NotNull String uuid) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> read(() -> episodes.get(uuid)));
    }

    @Override
    public CompletableFuture<List<EntityEdge>> getEdgesBetween(
            @NotNull String sourceId, @NotNull String targetId, @Nullable String relationName) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> read(() -> {
            List<EntityEdge> result = new ArrayList<>();
            for (String edgeId : adjacency.getOrDefault(sourceId, Set.of())) {
                EntityEdge edge = edges.get(edgeId);
                if (edge.getSourceId().equals(sourceId) && edge.getTargetId().equals(targetId)
                        && (relationName == null || relationName.equals(edge.getRelationName()))) {
                    result.add(edge);
                }
            }
            result.sort(Comparator.comparing(EntityEdge::getValidAt).thenComparing(EntityEdge::getCreatedAt));
            return result;
        }));
    }

    @Override
    public CompletableFuture<List<EntityEdge>> getEdgesForNode(@NotNull String nodeId) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> read(() -> {
            List<EntityEdge> result = new ArrayList<>();
            for (String edgeId : adjacency.getOrDefault(nodeId, Set.of())) {
                result.add(edges.get(edgeId));
            }
            result.sort(Comparator.comparing(EntityEdge::getValidAt).thenComparing(EntityEdge::getUuid));
            return result;
        }));
    }

    @Override
    public CompletableFuture<GraphSnapshot> pointInTimeView(@NotNull String namespace, @NotNull Instant timestamp) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> read(() -> {
            List<EntityNode> validNodes = new ArrayList<>();
            for (EntityNode node : nodes.values()) {
                if (node.getNamespace().equals(namespace) && node.isValidAt(timestamp)) {
                    validNodes.add(node);
                }
            }
            List<EntityEdge> validEdges = new ArrayList<>();
            for (EntityEdge edge : edges.values()) {
                if (edge.getNamespace().equals(namespace) && edge.isValidAt(timestamp)) {
                    validEdges.add(edge);
                }
            }
            validNodes.sort(Comparator.comparing(EntityNode::getUuid));
            validEdges.sort(Comparator.comparing(EntityEdge::getUuid));
            return new GraphSnapshot(namespace, timestamp, validNodes, validEdges);
        }));
    }

    @Override
    public CompletableFuture<List<GraphElement>> getByNamespace(
            @NotNull String namespace, @NotNull GraphKind kind, @Nullable Instant since, @Nullable Integer limit) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> read(() -> {
            Collection<? extends GraphElement> source = switch (kind) {
                case EPISODE -> episodes.values();
                case NODE -> nodes.values();
                case EDGE -> edges.values();
                case COMMUNITY -> communities.values();
            };
            List<GraphElement> result = new ArrayList<>();
            for (GraphElement element : source) {
                if (element.getNamespace().equals(namespace)
                        && (since == null || !element.getCreatedAt().isBefore(since))) {
                    result.add(element);
                }
            }
            result.sort(NEWEST_FIRST);
            if (limit != null && result.size() > limit) {
                return new ArrayList<>(result.subList(0, Math.max(0, limit)));
            }
            return result;
        }));
    }

    @Override
    public CompletableFuture<List<Episode>> getRecentEpisodes(@NotNull String namespace, int limit) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> read(() -> {
            List<Episode> result = new ArrayList<>();
            for (Episode episode : episodes.values()) {
                if (episode.getNamespace().equals(namespace)) {
                    result.add(episode);
                }
            }
            result.sort(Comparator.comparing(Episode::getReferenceTime)
                .thenComparing(Episode::getCreatedAt)
                .thenComparing(Episode::getUuid));
            int from = Math.max(0, result.size() - Math.max(0, limit));
            return new ArrayList<>(result.subList(from, result.size()));
        }));
    }

    @Override
    public CompletableFuture<Void> replaceCommunities(
            @NotNull String namespace, @Nullable Collection<String> affectedNodeIds, @NotNull List<CommunityNode> replacements) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> write(() -> {
            for (CommunityNode community : replacements) {
                if (!community.getNamespace().equals(namespace)) {
                    throw new IllegalStateException(String.format(
                        "Community %s belongs to namespace '%s', not '%s'",
                        community.getUuid(), community.getNamespace(), namespace));
                }
            }
            Set<String> affected = affectedNodeIds != null ? new HashSet<>(affectedNodeIds) : null;
            int removed = 0;
            var iterator = communities.values().iterator();
            while (iterator.hasNext()) {
                CommunityNode community = iterator.next();
                if (!community.getNamespace().equals(namespace)) {
                    continue;
                }
                if (affected == null || community.getMemberIds().stream().anyMatch(affected::contains)) {
                    iterator.remove();
                    removed++;
                }
            }
            for (CommunityNode community : replacements) {
                communities.put(community.getUuid(), community);
            }
            logger.debug("Replaced {} communities with {} in namespace {}", removed, replacements.size(), namespace);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> purgeNamespace(@NotNull String namespace) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> write(() -> {
            episodes.values().removeIf(e -> e.getNamespace().equals(namespace));
            communities.values().removeIf(c -> c.getNamespace().equals(namespace));
            List<String> edgeIds = new ArrayList<>();
            for (EntityEdge edge : edges.values()) {
                if (edge.getNamespace().equals(namespace)) {
                    edgeIds.add(edge.getUuid());
                }
            }
            for (String edgeId : edgeIds) {
                EntityEdge edge = edges.remove(edgeId);
                openEdges.remove(edge.tripleKey(), edgeId);
            }
            List<String> nodeIds = new ArrayList<>();
            for (EntityNode node : nodes.values()) {
                if (node.getNamespace().equals(namespace)) {
                    nodeIds.add(node.getUuid());
                }
            }
            for (String nodeId : nodeIds) {
                nodes.remove(nodeId);
                adjacency.remove(nodeId);
            }
            logger.info("Purged namespace {}: {} nodes, {} edges", namespace, nodeIds.size(), edgeIds.size());
            return null;
        }));
    }

    @Override
    public void close() {
        initialized = false;
        logger.debug("InMemoryTemporalGraphStore closed");
    }

    /**
     * Stages the batch, validates it against the current state, then applies it.
     * Must be called with the write lock held.
     */
    private void applyBatch(GraphWriteBatch batch) {
        GraphIntegrity.checkNamespaces(batch);
        for (EntityNode node : batch.getNodes()) {
            EntityNode stored = nodes.get(node.getUuid());
            if (stored != null && !stored.getNamespace().equals(node.getNamespace())) {
                throw new IllegalStateException("Node " + node.getUuid() + " belongs to namespace " + stored.getNamespace());
            }
        }

        Map<String, EntityEdge> staged = new LinkedHashMap<>();
        for (EdgeInvalidation invalidation : batch.getInvalidations()) {
            EntityEdge current = staged.getOrDefault(invalidation.edgeId(), edges.get(invalidation.edgeId()));
            if (current == null) {
                throw new IllegalArgumentException("Unknown edge: " + invalidation.edgeId());
            }
            if (!current.getNamespace().equals(batch.getNamespace())) {
                throw new IllegalStateException("Edge " + current.getUuid() + " belongs to namespace " + current.getNamespace());
            }
            staged.put(current.getUuid(), current.invalidate(invalidation.invalidAt(), invalidation.invalidatedBy()));
        }
        for (EntityEdge edge : batch.getEdges()) {
            EntityEdge current = staged.getOrDefault(edge.getUuid(), edges.get(edge.getUuid()));
            GraphIntegrity.checkEdgeUpdate(current, edge);
            staged.put(edge.getUuid(), edge);
        }
        checkExclusivity(staged);

        if (batch.getEpisode() != null) {
            episodes.put(batch.getEpisode().getUuid(), batch.getEpisode());
        }
        for (EntityNode node : batch.getNodes()) {
            nodes.put(node.getUuid(), node);
        }
        for (EntityEdge edge : staged.values()) {
            storeEdge(edge);
        }
        logger.debug("Committed {}", batch);
    }

    private void checkExclusivity(Map<String, EntityEdge> staged) {
        Map<String, Set<String>> openByTriple = new HashMap<>();
        for (EntityEdge edge : staged.values()) {
            Set<String> open = openByTriple.computeIfAbsent(edge.tripleKey(), k -> new LinkedHashSet<>());
            if (edge.isOpen()) {
                open.add(edge.getUuid());
            }
        }
        for (Map.Entry<String, Set<String>> entry : openByTriple.entrySet()) {
            String existingOpen = openEdges.get(entry.getKey());
            if (existingOpen != null) {
                EntityEdge stagedVersion = staged.get(existingOpen);
                boolean stillOpen = stagedVersion == null
                    || (stagedVersion.isOpen() && stagedVersion.tripleKey().equals(entry.getKey()));
                if (stillOpen) {
                    entry.getValue().add(existingOpen);
                }
            }
            GraphIntegrity.checkOpenEdges(entry.getKey(), entry.getValue());
        }
    }

    private void storeEdge(EntityEdge edge) {
        EntityEdge previous = edges.put(edge.getUuid(), edge);
        if (previous != null) {
            openEdges.remove(previous.tripleKey(), previous.getUuid());
            unlink(previous.getSourceId(), previous.getUuid());
            unlink(previous.getTargetId(), previous.getUuid());
        }
        adjacency.computeIfAbsent(edge.getSourceId(), k -> new LinkedHashSet<>()).add(edge.getUuid());
        adjacency.computeIfAbsent(edge.getTargetId(), k -> new LinkedHashSet<>()).add(edge.getUuid());
        if (edge.isOpen()) {
            openEdges.put(edge.tripleKey(), edge.getUuid());
        }
    }

    private void unlink(String nodeId, String edgeId) {
        Set<String> ids = adjacency.get(nodeId);
        if (ids != null) {
            ids.remove(edgeId);
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
