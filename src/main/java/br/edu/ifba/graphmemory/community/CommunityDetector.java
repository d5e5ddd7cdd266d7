package br.edu.ifba.graphmemory.community;

import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.CommunitySummarizer;
import br.edu.ifba.graphmemory.capability.Embedder;
import br.edu.ifba.graphmemory.capability.Embeddings;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.exception.CapabilityUnavailableException;
import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Groups active entity nodes into communities with {@link LabelPropagation} over open edges.
 *
 * <p>Communities smaller than the configured minimum are discarded. Each community is
 * summarized from its highest weighted-degree members; when the summarizer is missing or
 * fails the summary falls back to {@code "cluster of N related entities"}.</p>
 *
 * <p>{@link #refresh(String, Collection)} only recomputes the connected components that
 * contain the given nodes, plus any community that overlapped them, leaving the rest of
 * the namespace's communities untouched.</p>
 */
public class CommunityDetector {

    private static final Logger logger = LoggerFactory.getLogger(CommunityDetector.class);

    private static final int NAME_MEMBERS = 3;

    private final TemporalGraphStore store;
    private final CapabilityGate gate;
    private final Embedder embedder;
    @Nullable
    private final CommunitySummarizer summarizer;
    private final GraphMemoryConfig.Community config;
    private final LabelPropagation propagation;

    public CommunityDetector(
            @NotNull TemporalGraphStore store,
            @NotNull CapabilityGate gate,
            @NotNull Embedder embedder,
            @Nullable CommunitySummarizer summarizer,
            @NotNull GraphMemoryConfig.Community config) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
        this.summarizer = summarizer;
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.propagation = new LabelPropagation(config.maxIterations(), config.seed());
    }

    /**
     * Rebuilds every community of the namespace.
     *
     * @return the communities now stored
     */
    @NotNull
    public List<CommunityNode> detect(@NotNull String namespace) {
        Graph graph = load(namespace);
        List<CommunityNode> communities = build(namespace, graph, graph.nodes.keySet());
        store.replaceCommunities(namespace, null, communities).join();
        logger.info("Detected {} communities over {} entities in {}", communities.size(), graph.nodes.size(), namespace);
        return communities;
    }

    /**
     * Recomputes the communities around {@code changedNodeIds}.
     *
     * @return the communities that replaced the stale ones
     */
    @NotNull
    public List<CommunityNode> refresh(@NotNull String namespace, @NotNull Collection<String> changedNodeIds) {
        if (changedNodeIds.isEmpty()) {
            return List.of();
        }
        Graph graph = load(namespace);
        List<CommunityNode> existing = store.getCommunities(namespace).join();

        Set<String> affected = new LinkedHashSet<>(changedNodeIds);
        boolean grew = true;
        while (grew) {
            int before = affected.size();
            affected.addAll(graph.componentsOf(affected));
            for (CommunityNode community : existing) {
                if (overlaps(community.getMemberIds(), affected)) {
                    affected.addAll(community.getMemberIds());
                }
            }
            grew = affected.size() > before;
        }

        Set<String> activeAffected = new LinkedHashSet<>();
        for (String id : affected) {
            if (graph.nodes.containsKey(id)) {
                activeAffected.add(id);
            }
        }
        List<CommunityNode> communities = build(namespace, graph, activeAffected);
        store.replaceCommunities(namespace, affected, communities).join();
        logger.debug("Refreshed {} communities around {} entities in {}", communities.size(), affected.size(), namespace);
        return communities;
    }

    private Graph load(String namespace) {
        Map<String, EntityNode> nodes = new LinkedHashMap<>();
        for (EntityNode node : store.getActiveNodes(namespace).join()) {
            nodes.put(node.getUuid(), node);
        }
        List<EntityEdge> edges = new ArrayList<>();
        for (EntityEdge edge : store.getEdges(namespace).join()) {
            if (edge.isOpen() && nodes.containsKey(edge.getSourceId()) && nodes.containsKey(edge.getTargetId())) {
                edges.add(edge);
            }
        }
        return new Graph(nodes, edges);
    }

    private List<CommunityNode> build(String namespace, Graph graph, Set<String> nodeIds) {
        List<EntityEdge> edges = new ArrayList<>();
        for (EntityEdge edge : graph.edges) {
            if (nodeIds.contains(edge.getSourceId()) && nodeIds.contains(edge.getTargetId())) {
                edges.add(edge);
            }
        }
        LabelPropagation.Result result = propagation.run(nodeIds, edges);
        if (!result.converged()) {
            logger.debug("Label propagation in {} stopped after {} passes without converging", namespace, result.passes());
        }

        List<CommunityNode> communities = new ArrayList<>();
        for (List<String> members : result.groups()) {
            if (members.size() < config.minSize()) {
                continue;
            }
            List<EntityNode> central = centralMembers(graph, members, edges);
            communities.add(new CommunityNode(null, namespace, name(central, members.size()),
                summarize(central, edges, members.size()), 0, members, Instant.now(), null));
        }
        return embed(communities);
    }

    /**
     * Members by descending weighted degree inside the community, then by name.
     */
    private List<EntityNode> centralMembers(Graph graph, List<String> members, List<EntityEdge> edges) {
        Set<String> memberSet = new HashSet<>(members);
        Map<String, Integer> degree = new HashMap<>();
        for (EntityEdge edge : edges) {
            if (memberSet.contains(edge.getSourceId()) && memberSet.contains(edge.getTargetId())) {
                degree.merge(edge.getSourceId(), 1, Integer::sum);
                degree.merge(edge.getTargetId(), 1, Integer::sum);
            }
        }
        List<EntityNode> nodes = new ArrayList<>();
        for (String id : members) {
            nodes.add(graph.nodes.get(id));
        }
        nodes.sort(Comparator.<EntityNode>comparingInt(n -> degree.getOrDefault(n.getUuid(), 0)).reversed()
            .thenComparing(EntityNode::getName));
        return nodes.subList(0, Math.min(nodes.size(), config.summaryMembers()));
    }

    private String summarize(List<EntityNode> central, List<EntityEdge> edges, int size) {
        String fallback = "cluster of " + size + " related entities";
        if (summarizer == null) {
            return fallback;
        }
        Set<String> ids = new HashSet<>();
        for (EntityNode node : central) {
            ids.add(node.getUuid());
        }
        List<EntityEdge> facts = new ArrayList<>();
        for (EntityEdge edge : edges) {
            if (ids.contains(edge.getSourceId()) && ids.contains(edge.getTargetId())) {
                facts.add(edge);
            }
        }
        try {
            String summary = gate.call("summarize-community", () -> summarizer.summarize(central, facts));
            if (summary == null || summary.isBlank()) {
                logger.warn("[data-quality] Empty community summary for {}, using fallback", central.get(0).getName());
                return fallback;
            }
            return summary.trim();
        } catch (CapabilityUnavailableException e) {
            logger.warn("[data-quality] Community summary for {} unavailable, using fallback: {}",
                central.get(0).getName(), e.getMessage());
            return fallback;
        }
    }

    private static String name(List<EntityNode> central, int size) {
        List<String> names = new ArrayList<>();
        for (EntityNode node : central.subList(0, Math.min(NAME_MEMBERS, central.size()))) {
            names.add(node.getName());
        }
        String name = String.join(", ", names);
        return size > names.size() ? name + " and " + (size - names.size()) + " more" : name;
    }

    private List<CommunityNode> embed(List<CommunityNode> communities) {
        List<String> texts = new ArrayList<>(communities.size());
        for (CommunityNode community : communities) {
            texts.add(community.getName() + ": " + community.getSummary());
        }
        List<float[]> vectors;
        try {
            vectors = Embeddings.embedAll(gate, embedder, "embed-communities", texts);
        } catch (CapabilityUnavailableException e) {
            logger.warn("[data-quality] Community summaries stored without embeddings: {}", e.getMessage());
            return communities;
        }
        List<CommunityNode> embedded = new ArrayList<>(communities.size());
        for (int i = 0; i < communities.size(); i++) {
            CommunityNode c = communities.get(i);
            embedded.add(new CommunityNode(c.getUuid(), c.getNamespace(), c.getName(), c.getSummary(), c.getLevel(),
                c.getMemberIds(), c.getCreatedAt(), vectors.get(i)));
        }
        return embedded;
    }

    private static boolean overlaps(List<String> members, Set<String> ids) {
        for (String member : members) {
            if (ids.contains(member)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Active nodes and the open edges among them.
     */
    private static final class Graph {
        final Map<String, EntityNode> nodes;
        final List<EntityEdge> edges;
        final Map<String, List<String>> adjacency = new HashMap<>();

        Graph(Map<String, EntityNode> nodes, List<EntityEdge> edges) {
            this.nodes = nodes;
            this.edges = edges;
            for (EntityEdge edge : edges) {
                adjacency.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge.getTargetId());
                adjacency.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge.getSourceId());
            }
        }

        /**
         * Every node connected to one of {@code seeds}, the seeds included.
         */
        Set<String> componentsOf(Set<String> seeds) {
            Set<String> reached = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            for (String seed : seeds) {
                if (nodes.containsKey(seed) && reached.add(seed)) {
                    queue.add(seed);
                }
            }
            while (!queue.isEmpty()) {
                for (String next : adjacency.getOrDefault(queue.poll(), List.of())) {
                    if (reached.add(next)) {
                        queue.add(next);
                    }
                }
            }
            return reached;
        }
    }
}
