package br.edu.ifba.graphmemory.search;

import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.Embedder;
import br.edu.ifba.graphmemory.capability.RerankCandidate;
import br.edu.ifba.graphmemory.capability.RerankScore;
import br.edu.ifba.graphmemory.capability.Reranker;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.GraphElement;
import br.edu.ifba.graphmemory.core.Namespaces;
import br.edu.ifba.graphmemory.exception.CapabilityUnavailableException;
import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import br.edu.ifba.graphmemory.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Hybrid search over edges, nodes and communities.
 *
 * <p>For every requested scope the enabled methods run in parallel:</p>
 * <ol>
 *   <li>SEMANTIC: cosine between the query embedding and stored embeddings</li>
 *   <li>BM25: lexical relevance of facts, names and summaries</li>
 *   <li>GRAPH_TRAVERSAL: breadth-first from the center entity, when one is given</li>
 * </ol>
 * <p>Their rankings are fused with reciprocal rank fusion, optionally diversified with maximal
 * marginal relevance and optionally reranked. A failing query embedding or reranker never
 * fails the search: the results are marked degraded and carry a warning.</p>
 */
public class SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    private final TemporalGraphStore store;
    private final Embedder embedder;
    @Nullable
    private final Reranker reranker;
    private final CapabilityGate gate;
    private final GraphMemoryConfig.Search config;
    private final Duration embedTimeout;
    private final Duration rerankTimeout;

    public SearchEngine(
            @NotNull TemporalGraphStore store,
            @NotNull Embedder embedder,
            @Nullable Reranker reranker,
            @NotNull CapabilityGate gate,
            @NotNull GraphMemoryConfig.Search config,
            @NotNull GraphMemoryConfig.Capability capabilityConfig) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
        this.reranker = reranker;
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.embedTimeout = Duration.ofMillis(capabilityConfig.searchEmbedTimeoutMs());
        this.rerankTimeout = Duration.ofMillis(capabilityConfig.rerankTimeoutMs());
    }

    /**
     * Runs a search.
     *
     * @return the ranked results; fails with
     *         {@link br.edu.ifba.graphmemory.exception.InvalidNamespaceException} on a malformed namespace
     *         and with {@link br.edu.ifba.graphmemory.exception.StoreUnavailableException} when the store is unreachable
     */
    public CompletableFuture<SearchResults> search(@NotNull SearchRequest request) {
        try {
            for (String namespace : request.getNamespaces()) {
                Namespaces.requireValid(namespace);
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (request.getQuery().isBlank() && request.getCenterNodeId() == null) {
            return CompletableFuture.completedFuture(SearchResults.empty());
        }

        long start = System.nanoTime();
        Context context = new Context(request);
        return load(context)
            .thenCompose(ignored -> embedQuery(context))
            .thenCompose(ignored -> rankScopes(context))
            .thenApply(results -> {
                logger.info("Search '{}' in {} returned {} edges, {} nodes, {} communities{} in {} ms",
                    abbreviate(request.getQuery()), request.getNamespaces(), results.edges().size(),
                    results.nodes().size(), results.communities().size(),
                    results.degraded() ? " (degraded)" : "", (System.nanoTime() - start) / 1_000_000);
                return results;
            });
    }

    private CompletableFuture<Void> load(Context context) {
        SearchRequest request = context.request;
        List<CompletableFuture<Void>> loads = new ArrayList<>();
        for (String namespace : request.getNamespaces()) {
            loads.add(store.getEdges(namespace).thenAccept(edges -> {
                synchronized (context) {
                    for (EntityEdge edge : edges) {
                        if (visible(edge, request)) {
                            context.edges.put(edge.getUuid(), edge);
                        }
                    }
                }
            }));
            if (request.getConfig().returns(SearchScope.NODES)) {
                loads.add(store.getActiveNodes(namespace).thenAccept(nodes -> {
                    synchronized (context) {
                        for (EntityNode node : nodes) {
                            if (request.getAsOf() == null || node.isValidAt(request.getAsOf())) {
                                context.nodes.put(node.getUuid(), node);
                            }
                        }
                    }
                }));
            }
            if (request.getConfig().returns(SearchScope.COMMUNITIES)) {
                loads.add(store.getCommunities(namespace).thenAccept(communities -> {
                    synchronized (context) {
                        for (CommunityNode community : communities) {
                            context.communities.put(community.getUuid(), community);
                        }
                    }
                }));
            }
        }
        return CompletableFuture.allOf(loads.toArray(new CompletableFuture[0]));
    }

    /**
     * Open edges by default; with {@code asOf} the edges valid at that instant; everything when
     * invalidated edges are requested.
     */
    static boolean visible(@NotNull EntityEdge edge, @NotNull SearchRequest request) {
        Instant asOf = request.getAsOf();
        if (asOf != null) {
            return edge.isValidAt(asOf);
        }
        return request.isIncludeInvalidated() || edge.isOpen();
    }

    private CompletableFuture<Void> embedQuery(Context context) {
        SearchRequest request = context.request;
        if (!request.getConfig().uses(SearchMethod.SEMANTIC) || request.getQuery().isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            try {
                context.queryEmbedding = gate.call("embed-query", () -> embedder.embed(request.getQuery()), embedTimeout);
            } catch (CapabilityUnavailableException e) {
                context.degrade("Query embedding unavailable, semantic search skipped: " + e.getMessage());
                logger.warn("[search-degraded] Query embedding failed for '{}', continuing without semantic search",
                    abbreviate(request.getQuery()), e);
            }
        });
    }

    private CompletableFuture<SearchResults> rankScopes(Context context) {
        SearchConfig searchConfig = context.request.getConfig();
        GraphTraversal traversal = traversal(context);

        CompletableFuture<List<SearchHit<EntityEdge>>> edges = searchConfig.returns(SearchScope.EDGES)
            ? rank(context, SearchScope.EDGES, context.edges, EntityEdge::getFact, EntityEdge::getFactEmbedding,
                traversal != null ? traversal.rankedEdges() : null)
            : CompletableFuture.completedFuture(List.of());
        CompletableFuture<List<SearchHit<EntityNode>>> nodes = searchConfig.returns(SearchScope.NODES)
            ? rank(context, SearchScope.NODES, context.nodes, EntityNode::embeddingText, EntityNode::getNameEmbedding,
                traversal != null ? traversal.rankedNodes() : null)
            : CompletableFuture.completedFuture(List.of());
        CompletableFuture<List<SearchHit<CommunityNode>>> communities = searchConfig.returns(SearchScope.COMMUNITIES)
            ? rank(context, SearchScope.COMMUNITIES, context.communities,
                c -> c.getName() + ": " + c.getSummary(), CommunityNode::getSummaryEmbedding, null)
            : CompletableFuture.completedFuture(List.of());

        return CompletableFuture.allOf(edges, nodes, communities).thenApply(ignored -> new SearchResults(
            edges.join(), nodes.join(), communities.join(), context.isDegraded(), context.warnings()));
    }

    @Nullable
    private GraphTraversal traversal(Context context) {
        String center = context.request.getCenterNodeId();
        if (center == null || !context.request.getConfig().uses(SearchMethod.GRAPH_TRAVERSAL)) {
            return null;
        }
        return GraphTraversal.from(center, context.edges.values(), config.maxDepth());
    }

    private <T extends GraphElement> CompletableFuture<List<SearchHit<T>>> rank(
            Context context,
            SearchScope scope,
            Map<String, T> items,
            Function<T, String> text,
            Function<T, float[]> embedding,
            @Nullable List<String> traversalRanking) {
        if (items.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        SearchRequest request = context.request;
        Map<SearchMethod, CompletableFuture<List<String>>> retrievals = new EnumMap<>(SearchMethod.class);
        if (request.getConfig().uses(SearchMethod.SEMANTIC) && context.queryEmbedding != null) {
            float[] query = context.queryEmbedding;
            retrievals.put(SearchMethod.SEMANTIC, CompletableFuture.supplyAsync(() -> semantic(items, embedding, query)));
        }
        if (request.getConfig().uses(SearchMethod.BM25) && !request.getQuery().isBlank()) {
            retrievals.put(SearchMethod.BM25, CompletableFuture.supplyAsync(() -> bm25(items, text, request.getQuery())));
        }
        if (traversalRanking != null) {
            List<String> reached = new ArrayList<>();
            for (String id : traversalRanking) {
                if (items.containsKey(id) && reached.size() < config.perMethodLimit()) {
                    reached.add(id);
                }
            }
            retrievals.put(SearchMethod.GRAPH_TRAVERSAL, CompletableFuture.completedFuture(reached));
        }

        return CompletableFuture.allOf(retrievals.values().toArray(new CompletableFuture[0]))
            .thenApplyAsync(ignored -> {
                List<List<String>> rankings = new ArrayList<>();
                Map<String, Set<SearchMethod>> methods = new HashMap<>();
                for (Map.Entry<SearchMethod, CompletableFuture<List<String>>> retrieval : retrievals.entrySet()) {
                    List<String> ranking = retrieval.getValue().join();
                    logger.debug("{} {} candidates from {}", ranking.size(), scope, retrieval.getKey());
                    rankings.add(ranking);
                    for (String id : ranking) {
                        methods.computeIfAbsent(id, k -> EnumSet.noneOf(SearchMethod.class)).add(retrieval.getKey());
                    }
                }
                LinkedHashMap<String, Double> fused = ReciprocalRankFusion.fuse(rankings, config.rrfK());
                Map<String, Double> rerankScores = new HashMap<>();
                List<String> ordered = new ArrayList<>(fused.keySet());

                if (request.getConfig().mmr()) {
                    Map<String, float[]> embeddings = new HashMap<>();
                    for (String id : ordered) {
                        float[] vector = embedding.apply(items.get(id));
                        if (vector != null) {
                            embeddings.put(id, vector);
                        }
                    }
                    ordered = MaximalMarginalRelevance.rerank(
                        ordered, embeddings, context.queryEmbedding, fused, config.mmrLambda());
                }
                if (request.getConfig().rerank()) {
                    ordered = rerank(context, scope, ordered, items, text, rerankScores);
                }

                int limit = request.getLimit() != null ? request.getLimit() : config.defaultLimit();
                List<SearchHit<T>> hits = new ArrayList<>();
                for (String id : ordered.subList(0, Math.min(limit, ordered.size()))) {
                    hits.add(new SearchHit<>(items.get(id), fused.get(id), methods.get(id), rerankScores.get(id)));
                }
                return hits;
            });
    }

    private <T> List<String> semantic(Map<String, T> items, Function<T, float[]> embedding, float[] query) {
        Map<String, Double> similarities = new HashMap<>();
        for (Map.Entry<String, T> item : items.entrySet()) {
            float[] vector = embedding.apply(item.getValue());
            if (vector != null && vector.length == query.length) {
                similarities.put(item.getKey(), EmbeddingUtil.cosineSimilarity(query, vector));
            }
        }
        List<String> ids = new ArrayList<>(similarities.keySet());
        ids.sort(Comparator.<String>comparingDouble(similarities::get).reversed().thenComparing(Comparator.naturalOrder()));
        return new ArrayList<>(ids.subList(0, Math.min(ids.size(), config.perMethodLimit())));
    }

    private <T> List<String> bm25(Map<String, T> items, Function<T, String> text, String query) {
        Bm25Index index = new Bm25Index(config.bm25K1(), config.bm25B());
        for (Map.Entry<String, T> item : items.entrySet()) {
            index.add(item.getKey(), text.apply(item.getValue()));
        }
        List<String> ids = new ArrayList<>();
        for (Bm25Index.Scored scored : index.search(query, config.perMethodLimit())) {
            ids.add(scored.id());
        }
        return ids;
    }

    /**
     * Re-scores the head of the ranking. Scored candidates come first by descending score;
     * unscored ones and the tail keep their fused order. Reranker scores are added to {@code rerankScores}.
     */
    private <T> List<String> rerank(
            Context context,
            SearchScope scope,
            List<String> ordered,
            Map<String, T> items,
            Function<T, String> text,
            Map<String, Double> rerankScores) {
        if (reranker == null || ordered.isEmpty()) {
            return ordered;
        }
        List<String> head = ordered.subList(0, Math.min(config.rerankTopN(), ordered.size()));
        List<RerankCandidate> candidates = new ArrayList<>(head.size());
        for (String id : head) {
            candidates.add(new RerankCandidate(id, text.apply(items.get(id))));
        }

        List<RerankScore> scored;
        try {
            scored = gate.call("rerank",
                () -> reranker.score(context.request.getQuery(), candidates), rerankTimeout);
        } catch (CapabilityUnavailableException e) {
            context.degrade(String.format("Reranking of %s unavailable, returning fused order: %s",
                scope.name().toLowerCase(Locale.ROOT), e.getMessage()));
            logger.warn("[search-degraded] Reranker {} failed for {} candidates, falling back to fused order",
                reranker.getProviderName(), candidates.size(), e);
            return ordered;
        }

        Map<String, Double> byId = new HashMap<>();
        for (RerankScore score : scored) {
            if (head.contains(score.candidateId())) {
                byId.putIfAbsent(score.candidateId(), score.score());
            }
        }
        List<String> result = new ArrayList<>(byId.keySet());
        result.sort(Comparator.<String>comparingDouble(byId::get).reversed().thenComparingInt(head::indexOf));
        for (String id : ordered) {
            if (!byId.containsKey(id)) {
                result.add(id);
            }
        }
        rerankScores.putAll(byId);
        logger.debug("Reranked {} {} candidates with {}", byId.size(), scope, reranker.getProviderName());
        return result;
    }

    private static String abbreviate(String query) {
        return query.length() > 50 ? query.substring(0, 50) + "..." : query;
    }

    /**
     * Data and degradations of one search.
     */
    private static final class Context {
        final SearchRequest request;
        final Map<String, EntityEdge> edges = new LinkedHashMap<>();
        final Map<String, EntityNode> nodes = new LinkedHashMap<>();
        final Map<String, CommunityNode> communities = new LinkedHashMap<>();
        final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
        volatile float[] queryEmbedding;
        volatile boolean degraded;

        Context(SearchRequest request) {
            this.request = request;
        }

        void degrade(String warning) {
            warnings.add(warning);
            degraded = true;
        }

        boolean isDegraded() {
            return degraded;
        }

        List<String> warnings() {
            synchronized (warnings) {
                return new ArrayList<>(warnings);
            }
        }
    }
}
