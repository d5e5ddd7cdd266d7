package br.edu.ifba.graphmemory;

import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.CommunitySummarizer;
import br.edu.ifba.graphmemory.capability.DeduplicationJudge;
import br.edu.ifba.graphmemory.capability.Embedder;
import br.edu.ifba.graphmemory.capability.EntitySummarizer;
import br.edu.ifba.graphmemory.capability.Extractor;
import br.edu.ifba.graphmemory.capability.Reranker;
import br.edu.ifba.graphmemory.capability.TemporalJudge;
import br.edu.ifba.graphmemory.community.CommunityDetector;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.config.GraphMemoryConfigLoader;
import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.core.GraphSnapshot;
import br.edu.ifba.graphmemory.core.Namespaces;
import br.edu.ifba.graphmemory.dedup.DeduplicationEngine;
import br.edu.ifba.graphmemory.dedup.EntityMerger;
import br.edu.ifba.graphmemory.ingest.EpisodePipeline;
import br.edu.ifba.graphmemory.ingest.EpisodeSubmission;
import br.edu.ifba.graphmemory.ingest.ExtractionStage;
import br.edu.ifba.graphmemory.ingest.InvalidationStage;
import br.edu.ifba.graphmemory.ingest.NamespaceSequencer;
import br.edu.ifba.graphmemory.schema.EntityTypeRegistry;
import br.edu.ifba.graphmemory.search.SearchEngine;
import br.edu.ifba.graphmemory.search.SearchRequest;
import br.edu.ifba.graphmemory.search.SearchResults;
import br.edu.ifba.graphmemory.storage.EdgeInvalidation;
import br.edu.ifba.graphmemory.storage.GraphWriteBatch;
import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the temporal knowledge graph.
 *
 * <p>Every capability is handed in explicitly through the {@link Builder}; nothing is looked up
 * globally. Writes to a namespace (episodes, community detection, entity merges, purges) are
 * queued on that namespace's sequential worker, so they never interleave.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * GraphMemory memory = GraphMemory.builder()
 *     .store(new SQLiteTemporalGraphStore("/data/graph.db"))
 *     .extractor(new LlmExtractor(llm))
 *     .embedder(embedder)
 *     .deduplicationJudge(new LlmDeduplicationJudge(llm))
 *     .temporalJudge(new LlmTemporalJudge(llm))
 *     .build();
 * memory.initialize().join();
 *
 * EpisodeResult result = memory.addEpisode(episode).result().join();
 * SearchResults hits = memory.search(SearchRequest.builder().query("who leads sales?").namespace("acme").build()).join();
 * }</pre>
 */
public class GraphMemory implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GraphMemory.class);

    private final GraphMemoryConfig config;
    private final TemporalGraphStore store;
    private final EntityMerger merger;
    private final DeduplicationEngine deduplication;
    private final CommunityDetector communities;
    private final SearchEngine searchEngine;
    private final NamespaceSequencer sequencer;
    private final EpisodePipeline pipeline;
    private volatile boolean closed = false;

    private GraphMemory(Builder builder) {
        this.config = builder.config != null ? builder.config : GraphMemoryConfigLoader.load();
        this.store = builder.store;

        CapabilityGate gate = new CapabilityGate(config.capability());
        EntityTypeRegistry registry = builder.entityTypes != null ? builder.entityTypes : EntityTypeRegistry.defaults();
        this.merger = builder.entitySummarizer != null
            ? new EntityMerger(builder.entitySummarizer, gate)
            : new EntityMerger();
        this.deduplication = new DeduplicationEngine(config.dedup(), merger, builder.deduplicationJudge, gate);
        this.communities = new CommunityDetector(store, gate, builder.embedder, builder.communitySummarizer, config.community());
        this.searchEngine = new SearchEngine(store, builder.embedder, builder.reranker, gate, config.search(), config.capability());
        this.sequencer = new NamespaceSequencer();
        this.pipeline = new EpisodePipeline(
            store,
            config,
            gate,
            builder.embedder,
            new ExtractionStage(builder.extractor, gate, registry, config.extraction()),
            deduplication,
            new InvalidationStage(store, gate, builder.embedder, builder.temporalJudge, config.invalidation()),
            communities,
            sequencer);
    }

    /**
     * Initializes the store. Must complete before any other call.
     */
    public CompletableFuture<Void> initialize() {
        logger.info("Initializing graph memory...");
        return store.initialize().thenRun(() -> logger.info("Graph memory initialized"));
    }

    /**
     * Queues an episode for ingestion behind the earlier episodes of its namespace.
     *
     * @return a handle whose result always completes normally, with a failed result on error
     */
    @NotNull
    public EpisodeSubmission addEpisode(@NotNull Episode episode) {
        ensureOpen();
        return pipeline.submit(episode);
    }

    /**
     * Convenience for a text episode.
     */
    @NotNull
    public EpisodeSubmission addEpisode(@NotNull String namespace, @NotNull String body, @NotNull Instant referenceTime) {
        return addEpisode(Episode.builder()
            .namespace(namespace)
            .body(body)
            .referenceTime(referenceTime)
            .build());
    }

    public CompletableFuture<SearchResults> search(@NotNull SearchRequest request) {
        ensureOpen();
        return searchEngine.search(request);
    }

    /**
     * Nodes and edges valid at {@code timestamp}.
     */
    public CompletableFuture<GraphSnapshot> pointInTimeView(@NotNull String namespace, @NotNull Instant timestamp) {
        ensureOpen();
        try {
            Namespaces.requireValid(namespace);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return store.pointInTimeView(namespace, timestamp);
    }

    /**
     * Rebuilds the namespace's communities once its queued episodes are done.
     */
    public CompletableFuture<List<CommunityNode>> detectCommunities(@NotNull String namespace) {
        ensureOpen();
        try {
            Namespaces.requireValid(namespace);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sequencer.submit(namespace, () -> communities.detect(namespace));
    }

    /**
     * Merges {@code sourceId} into {@code targetId}: the source is marked superseded by the
     * target, its open edges are moved to the target and their evidence is unioned.
     *
     * @return the target node after the merge
     */
    public CompletableFuture<EntityNode> mergeEntities(
            @NotNull String namespace, @NotNull String sourceId, @NotNull String targetId) {
        ensureOpen();
        try {
            Namespaces.requireValid(namespace);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sequencer.submit(namespace, () -> merge(namespace, sourceId, targetId));
    }

    private EntityNode merge(String namespace, String sourceId, String targetId) {
        if (sourceId.equals(targetId)) {
            throw new IllegalArgumentException("Cannot merge an entity into itself: " + sourceId);
        }
        EntityNode source = requireActive(namespace, sourceId);
        EntityNode target = requireActive(namespace, targetId);
        Instant now = Instant.now();

        List<String> warnings = new ArrayList<>();
        EntityNode merged = merger.absorb(target, source, warnings);
        for (String warning : warnings) {
            logger.warn("[data-quality] {}", warning);
        }

        Map<String, EntityEdge> openByTriple = new HashMap<>();
        for (EntityEdge edge : store.getEdgesForNode(targetId).join()) {
            if (edge.isOpen() && !edge.getSourceId().equals(sourceId) && !edge.getTargetId().equals(sourceId)) {
                openByTriple.put(edge.tripleKey(), edge);
            }
        }

        GraphWriteBatch.Builder batch = GraphWriteBatch.builder(namespace)
            .node(merged)
            .node(source.supersede(targetId, now));
        List<EntityEdge> moved = new ArrayList<>();
        int closedEdges = 0;
        for (EntityEdge edge : store.getEdgesForNode(sourceId).join()) {
            if (!edge.isOpen()) {
                continue;
            }
            String newSource = edge.getSourceId().equals(sourceId) ? targetId : edge.getSourceId();
            String newTarget = edge.getTargetId().equals(sourceId) ? targetId : edge.getTargetId();
            if (newSource.equals(newTarget)) {
                batch.invalidation(new EdgeInvalidation(edge.getUuid(), now, List.of(sourceId)));
                closedEdges++;
                continue;
            }
            String triple = EntityEdge.tripleKey(newSource, newTarget, edge.getRelationName());
            EntityEdge existing = openByTriple.get(triple);
            if (existing != null) {
                for (String episodeId : edge.getEpisodeIds()) {
                    existing = existing.addEpisodeId(episodeId);
                }
                openByTriple.put(triple, existing);
                batch.invalidation(new EdgeInvalidation(edge.getUuid(), now, List.of(existing.getUuid())));
                closedEdges++;
            } else {
                EntityEdge relocated = edge.withEndpoints(newSource, newTarget);
                openByTriple.put(triple, relocated);
                moved.add(relocated);
            }
        }
        // every open edge on the target side, updated or not, is rewritten once
        store.commit(batch.edges(new ArrayList<>(openByTriple.values())).build()).join();
        deduplication.recordMerge(namespace, targetId, sourceId);

        logger.info("Merged entity {} into {} in {}: {} edges moved, {} edges closed",
            sourceId, targetId, namespace, moved.size(), closedEdges);
        return merged;
    }

    private EntityNode requireActive(String namespace, String nodeId) {
        EntityNode node = store.getNode(nodeId).join();
        if (node == null || !node.getNamespace().equals(namespace)) {
            throw new IllegalArgumentException("No entity " + nodeId + " in namespace " + namespace);
        }
        if (!node.isActive()) {
            throw new IllegalArgumentException("Entity " + nodeId + " was already merged into " + node.getSupersededBy());
        }
        return node;
    }

    /**
     * The {@code limit} most recent episodes of a namespace, oldest first.
     */
    public CompletableFuture<List<Episode>> recentEpisodes(@NotNull String namespace, int limit) {
        ensureOpen();
        try {
            Namespaces.requireValid(namespace);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return store.getRecentEpisodes(namespace, limit);
    }

    /**
     * Deletes every record of a namespace once its queued work is done.
     */
    public CompletableFuture<Void> purgeNamespace(@NotNull String namespace) {
        ensureOpen();
        try {
            Namespaces.requireValid(namespace);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sequencer.submit(namespace, () -> {
            store.purgeNamespace(namespace).join();
            deduplication.forget(namespace);
            logger.info("Purged namespace {}", namespace);
            return null;
        });
    }

    public CompletableFuture<Void> buildIndices() {
        ensureOpen();
        return store.buildIndices();
    }

    @NotNull
    public GraphMemoryConfig getConfig() {
        return config;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Graph memory is closed");
        }
    }

    /**
     * Waits for queued work, then closes the store.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Closing graph memory...");
        pipeline.close();
        store.close();
        logger.info("Graph memory closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for GraphMemory instances.
     */
    public static class Builder {
        private GraphMemoryConfig config;
        private TemporalGraphStore store;
        private Extractor extractor;
        private Embedder embedder;
        private Reranker reranker;
        private DeduplicationJudge deduplicationJudge;
        private TemporalJudge temporalJudge;
        private CommunitySummarizer communitySummarizer;
        private EntitySummarizer entitySummarizer;
        private EntityTypeRegistry entityTypes;

        /**
         * Defaults to {@link GraphMemoryConfigLoader#load()}.
         */
        public Builder config(@Nullable GraphMemoryConfig config) {
            this.config = config;
            return this;
        }

        public Builder store(@NotNull TemporalGraphStore store) {
            this.store = store;
            return this;
        }

        public Builder extractor(@NotNull Extractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder embedder(@NotNull Embedder embedder) {
            this.embedder = embedder;
            return this;
        }

        /**
         * Without a reranker, rerank requests keep the fused order.
         */
        public Builder reranker(@Nullable Reranker reranker) {
            this.reranker = reranker;
            return this;
        }

        /**
         * Without a judge, only known aliases and exact name matches are merged.
         */
        public Builder deduplicationJudge(@Nullable DeduplicationJudge deduplicationJudge) {
            this.deduplicationJudge = deduplicationJudge;
            return this;
        }

        /**
         * Without a judge, a new edge only supersedes the open edge on its own triple.
         */
        public Builder temporalJudge(@Nullable TemporalJudge temporalJudge) {
            this.temporalJudge = temporalJudge;
            return this;
        }

        public Builder communitySummarizer(@Nullable CommunitySummarizer communitySummarizer) {
            this.communitySummarizer = communitySummarizer;
            return this;
        }

        public Builder entitySummarizer(@Nullable EntitySummarizer entitySummarizer) {
            this.entitySummarizer = entitySummarizer;
            return this;
        }

        /**
         * Defaults to {@link EntityTypeRegistry#defaults()}.
         */
        public Builder entityTypes(@Nullable EntityTypeRegistry entityTypes) {
            this.entityTypes = entityTypes;
            return this;
        }

        public GraphMemory build() {
            if (store == null) {
                throw new IllegalStateException("store is required");
            }
            if (extractor == null) {
                throw new IllegalStateException("extractor is required");
            }
            if (embedder == null) {
                throw new IllegalStateException("embedder is required");
            }
            return new GraphMemory(this);
        }
    }
}
