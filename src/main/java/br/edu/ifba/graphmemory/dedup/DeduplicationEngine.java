package br.edu.ifba.graphmemory.dedup;

import br.edu.ifba.graphmemory.capability.CandidateEntity;
import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.DedupDecision;
import br.edu.ifba.graphmemory.capability.DedupRequest;
import br.edu.ifba.graphmemory.capability.DeduplicationJudge;
import br.edu.ifba.graphmemory.capability.ExtractionResult;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.exception.CapabilityUnavailableException;
import br.edu.ifba.graphmemory.schema.EntityTypeRegistry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps candidate entities to canonical nodes.
 *
 * <p>Per namespace, a union-find forest groups node ids with the alias keys
 * ({@code type|normalized name}) that resolved to them, so a name seen before resolves
 * without another judgment. Unknown names are compared against existing nodes of the
 * same type; the best pre-filter matches form a shortlist that the
 * {@link DeduplicationJudge} confirms or rejects.</p>
 *
 * <p>A failed judgment yields a new entity, never a merge. Forests are only mutated by
 * the owning namespace's sequential worker, through copies installed after commit.</p>
 */
public class DeduplicationEngine {

    private static final Logger logger = LoggerFactory.getLogger(DeduplicationEngine.class);

    private final GraphMemoryConfig.Dedup config;
    private final EntitySimilarityCalculator similarityCalculator;
    private final EntityMerger merger;
    @Nullable
    private final DeduplicationJudge judge;
    private final CapabilityGate gate;

    private final Map<String, UnionFind<String>> forests = new ConcurrentHashMap<>();

    public DeduplicationEngine(
            @NotNull GraphMemoryConfig.Dedup config,
            @NotNull EntityMerger merger,
            @Nullable DeduplicationJudge judge,
            @NotNull CapabilityGate gate) {
        this.config = config;
        this.similarityCalculator = new EntitySimilarityCalculator(config);
        this.merger = merger;
        this.judge = judge;
        this.gate = gate;
        if (judge == null) {
            logger.info("No deduplication judge configured: only previously seen names and exact matches are merged");
        }
    }

    /**
     * Starts a resolution over a copy of the namespace forest.
     *
     * @param storedNodes every node of the namespace currently in the store, superseded ones included
     */
    @NotNull
    public ResolutionSession begin(@NotNull String namespace, @NotNull Collection<EntityNode> storedNodes) {
        UnionFind<String> forest = forests.getOrDefault(namespace, new UnionFind<>()).copy();
        seed(forest, storedNodes);
        return new ResolutionSession(namespace, forest, storedNodes);
    }

    /**
     * Publishes the session's forest once its nodes are committed.
     */
    public void install(@NotNull ResolutionSession session) {
        forests.put(session.getNamespace(), session.forest());
    }

    /**
     * Drops the forest of a purged namespace.
     */
    public void forget(@NotNull String namespace) {
        forests.remove(namespace);
    }

    /**
     * Records an administrative merge of {@code sourceId} into {@code targetId}.
     */
    public void recordMerge(@NotNull String namespace, @NotNull String targetId, @NotNull String sourceId) {
        forests.computeIfPresent(namespace, (ns, forest) -> {
            UnionFind<String> updated = forest.copy();
            updated.union(targetId, sourceId);
            return updated;
        });
    }

    /**
     * Resolves one candidate whose type is already canonical.
     *
     * @return the canonical node after merging the candidate in
     */
    @NotNull
    public EntityNode resolve(@NotNull ResolutionSession session, @NotNull CandidateEntity candidate, @NotNull Episode episode) {
        String candidateKey = ExtractionResult.key(candidate.name());
        String type = candidate.type() != null ? candidate.type() : EntityTypeRegistry.DEFAULT_TYPE;
        String alias = aliasKey(type, candidate.name());
        UnionFind<String> forest = session.forest();

        EntityNode match = null;
        if (forest.contains(alias)) {
            match = session.activeNode(forest.find(alias));
            if (match != null) {
                logger.debug("'{}' resolved through known alias to {}", candidate.name(), match.getUuid());
            }
        }
        if (match == null && config.exactMatchFastPath()) {
            match = exactMatch(session, type, candidate.name());
        }
        if (match == null) {
            match = judgeShortlist(session, candidate, type, episode);
        }

        EntityNode resolved;
        if (match != null) {
            resolved = merger.merge(match, candidate, episode.getUuid(), episode.getReferenceTime(), session.warnings());
            boolean joined = forest.union(match.getUuid(), alias);
            session.recordMatched(joined);
        } else {
            resolved = newNode(session.getNamespace(), candidate, type, episode);
            forest.add(resolved.getUuid());
            forest.union(resolved.getUuid(), alias);
            session.recordCreated();
        }
        session.put(resolved);
        session.map(candidateKey, resolved.getUuid());
        return resolved;
    }

    @Nullable
    private EntityNode exactMatch(ResolutionSession session, String type, String name) {
        String normalized = EntitySimilarityCalculator.normalizeName(name);
        for (EntityNode node : session.activeNodes()) {
            if (node.hasLabel(type) && EntitySimilarityCalculator.normalizeName(node.getName()).equals(normalized)) {
                return node;
            }
        }
        return null;
    }

    @Nullable
    private EntityNode judgeShortlist(ResolutionSession session, CandidateEntity candidate, String type, Episode episode) {
        List<EntityNode> shortlist = shortlist(session, candidate.name(), type);
        if (shortlist.isEmpty()) {
            return null;
        }
        if (judge == null) {
            return null;
        }
        try {
            DedupRequest request = new DedupRequest(candidate, shortlist, episode.getBody());
            DedupDecision decision = gate.call("dedup-judge", () -> judge.judge(request));
            if (decision == null || !decision.isMatch()) {
                return null;
            }
            for (EntityNode node : shortlist) {
                if (node.getUuid().equals(decision.matchedUuid())) {
                    return node;
                }
            }
            warn(session, String.format("Judge matched '%s' to %s, which is not on the shortlist; treating as new",
                candidate.name(), decision.matchedUuid()));
            return null;
        } catch (CapabilityUnavailableException e) {
            warn(session, String.format("Deduplication judgment for '%s' failed, treating as new entity: %s",
                candidate.name(), e.getMessage()));
            return null;
        }
    }

    /**
     * Active nodes of the same type scoring at least the pre-filter threshold, best first.
     */
    @NotNull
    List<EntityNode> shortlist(@NotNull ResolutionSession session, @NotNull String name, @NotNull String type) {
        List<ScoredNode> scored = new ArrayList<>();
        for (EntityNode node : session.activeNodes()) {
            if (!node.hasLabel(type)) {
                continue;
            }
            double score = similarityCalculator.preFilterScore(name, node.getName());
            if (score >= config.prefilterThreshold()) {
                scored.add(new ScoredNode(node, score));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredNode::score).reversed()
            .thenComparing(s -> s.node().getName()));
        List<EntityNode> shortlist = new ArrayList<>();
        for (ScoredNode s : scored.subList(0, Math.min(scored.size(), config.shortlistSize()))) {
            shortlist.add(s.node());
        }
        return shortlist;
    }

    private void seed(UnionFind<String> forest, Collection<EntityNode> storedNodes) {
        for (EntityNode node : storedNodes) {
            if (forest.add(node.getUuid())) {
                String alias = aliasKey(node.getPrimaryLabel(), node.getName());
                if (!forest.contains(alias)) {
                    forest.union(node.getUuid(), alias);
                }
            }
        }
        for (EntityNode node : storedNodes) {
            if (node.getSupersededBy() != null) {
                forest.union(node.getSupersededBy(), node.getUuid());
            }
        }
    }

    private static EntityNode newNode(String namespace, CandidateEntity candidate, String type, Episode episode) {
        return EntityNode.builder()
            .namespace(namespace)
            .name(candidate.name())
            .label(type)
            .summary(candidate.summary())
            .attributes(candidate.attributes())
            .episodeId(episode.getUuid())
            .createdAt(Instant.now())
            .validAt(episode.getReferenceTime())
            .build();
    }

    private static void warn(ResolutionSession session, String warning) {
        session.warn(warning);
        logger.warn("[data-quality] {}", warning);
    }

    @NotNull
    public static String aliasKey(@NotNull String type, @NotNull String name) {
        return type + "|" + EntitySimilarityCalculator.normalizeName(name);
    }

    private record ScoredNode(EntityNode node, double score) {
    }
}
