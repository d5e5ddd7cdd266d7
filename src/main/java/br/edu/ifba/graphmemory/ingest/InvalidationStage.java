package br.edu.ifba.graphmemory.ingest;

import br.edu.ifba.graphmemory.capability.CandidateRelationship;
import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.EdgeJudgment;
import br.edu.ifba.graphmemory.capability.Embedder;
import br.edu.ifba.graphmemory.capability.Embeddings;
import br.edu.ifba.graphmemory.capability.ExtractionResult;
import br.edu.ifba.graphmemory.capability.TemporalJudge;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.dedup.ResolutionSession;
import br.edu.ifba.graphmemory.exception.CapabilityUnavailableException;
import br.edu.ifba.graphmemory.exception.TemporalConflictUnresolvedException;
import br.edu.ifba.graphmemory.storage.EdgeInvalidation;
import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import br.edu.ifba.graphmemory.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * INVALIDATING: turns resolved relationships into edges and closes the edges they supersede.
 *
 * <p>For every new edge the open edges it may conflict with are collected: edges between the
 * same (source, target) pair whose relation name is equal or embedding-similar, and, when
 * enabled, edges sharing one endpoint under the same relation name. Each pair is judged:</p>
 * <ul>
 *   <li>CORROBORATES on the same pair: the existing edge gains the episode as provenance and
 *       the new edge is dropped</li>
 *   <li>CONTRADICTS: the edge with the earlier validAt is closed at the other's validAt</li>
 *   <li>INDEPENDENT: nothing changes, except on the same triple where only one edge may stay open</li>
 * </ul>
 *
 * <p>A failed judgment is reported as an unresolved temporal conflict: the new edge is kept
 * open and, on the same triple, the older edge is closed so the triple keeps a single open edge.</p>
 */
public class InvalidationStage {

    private static final Logger logger = LoggerFactory.getLogger(InvalidationStage.class);

    private static final int MAX_SHARED_ENDPOINT_CANDIDATES = 10;

    private final TemporalGraphStore store;
    private final CapabilityGate gate;
    private final Embedder embedder;
    @Nullable
    private final TemporalJudge judge;
    private final GraphMemoryConfig.Invalidation config;

    public InvalidationStage(
            @NotNull TemporalGraphStore store,
            @NotNull CapabilityGate gate,
            @NotNull Embedder embedder,
            @Nullable TemporalJudge judge,
            @NotNull GraphMemoryConfig.Invalidation config) {
        this.store = store;
        this.gate = gate;
        this.embedder = embedder;
        this.judge = judge;
        this.config = config;
    }

    /**
     * Edge mutations of one episode.
     *
     * @param createdEdges  new edges, with fact embeddings
     * @param updatedEdges  stored edges whose provenance changed, in their final version
     * @param invalidations stored edges that are only being closed
     */
    public record Outcome(
        @NotNull List<EntityEdge> createdEdges,
        @NotNull List<EntityEdge> updatedEdges,
        @NotNull List<EdgeInvalidation> invalidations,
        int invalidatedCount,
        int corroboratedCount
    ) {
    }

    @NotNull
    Outcome run(@NotNull EpisodeRun run, @NotNull ResolutionSession session, @NotNull List<CandidateRelationship> relationships) {
        Work work = new Work(run);

        for (CandidateRelationship relationship : relationships) {
            run.checkpoint();
            EntityEdge edge = toEdge(run, session, relationship);
            if (edge == null) {
                continue;
            }
            edge = applyHistory(edge, work);
            for (EntityEdge existing : candidates(edge, work)) {
                edge = judge(edge, existing, work);
                if (edge == null) {
                    break;
                }
            }
            if (edge != null) {
                work.created.put(edge.getUuid(), edge);
            }
        }

        List<EntityEdge> created = embedFacts(new ArrayList<>(work.created.values()));
        List<EntityEdge> updated = new ArrayList<>();
        List<EdgeInvalidation> invalidations = new ArrayList<>();
        for (EntityEdge current : work.touched.values()) {
            EntityEdge original = work.originals.get(current.getUuid());
            boolean onlyClosed = original.isOpen() && !current.isOpen()
                && original.getEpisodeIds().equals(current.getEpisodeIds());
            if (onlyClosed) {
                invalidations.add(new EdgeInvalidation(current.getUuid(), current.getInvalidAt(), current.getInvalidatedBy()));
            } else {
                updated.add(current);
            }
        }
        return new Outcome(created, updated, invalidations, work.invalidated, work.corroborated);
    }

    @Nullable
    private EntityEdge toEdge(EpisodeRun run, ResolutionSession session, CandidateRelationship relationship) {
        Episode episode = run.episode();
        String sourceId = session.canonicalId(ExtractionResult.key(relationship.sourceName()));
        String targetId = session.canonicalId(ExtractionResult.key(relationship.targetName()));
        if (sourceId == null || targetId == null) {
            run.warn("Dropped relationship '" + relationship.fact() + "': an endpoint was not resolved");
            return null;
        }
        if (sourceId.equals(targetId)) {
            run.warn("Dropped relationship '" + relationship.fact() + "': both endpoints resolved to the same entity");
            return null;
        }
        Instant validAt = relationship.validAt() != null ? relationship.validAt() : episode.getReferenceTime();
        Instant invalidAt = relationship.invalidAt();
        if (invalidAt != null && invalidAt.isBefore(validAt)) {
            run.warn(String.format("Ignored end time %s of '%s': it precedes the start time %s",
                invalidAt, relationship.fact(), validAt));
            invalidAt = null;
        }
        return EntityEdge.builder()
            .namespace(session.getNamespace())
            .sourceId(sourceId)
            .targetId(targetId)
            .relationName(relationship.relationName())
            .fact(relationship.fact())
            .episodeId(episode.getUuid())
            .createdAt(Instant.now())
            .validAt(validAt)
            .invalidAt(invalidAt)
            .build();
    }

    /**
     * An open edge arriving after a later version of the same triple has been recorded ends
     * where that later version starts.
     */
    private EntityEdge applyHistory(EntityEdge edge, Work work) {
        if (!edge.isOpen()) {
            return edge;
        }
        EntityEdge successor = null;
        for (EntityEdge stored : storedBetween(edge.getSourceId(), edge.getTargetId(), work)) {
            if (stored.getRelationName().equals(edge.getRelationName())
                    && !stored.isOpen()
                    && stored.getValidAt().isAfter(edge.getValidAt())
                    && (successor == null || stored.getValidAt().isBefore(successor.getValidAt()))) {
                successor = stored;
            }
        }
        if (successor == null) {
            return edge;
        }
        logger.debug("Edge {} predates recorded history of {}, closing it at {}",
            edge.getUuid(), edge.tripleKey(), successor.getValidAt());
        work.invalidated++;
        return edge.invalidate(successor.getValidAt(), List.of(successor.getUuid()));
    }

    private List<EntityEdge> candidates(EntityEdge edge, Work work) {
        Map<String, EntityEdge> candidates = new LinkedHashMap<>();
        for (EntityEdge existing : storedBetween(edge.getSourceId(), edge.getTargetId(), work)) {
            if (existing.isOpen() && relationsOverlap(existing.getRelationName(), edge.getRelationName(), work)) {
                candidates.put(existing.getUuid(), existing);
            }
        }
        for (EntityEdge pending : work.created.values()) {
            if (pending.isOpen() && pending.getSourceId().equals(edge.getSourceId())
                    && pending.getTargetId().equals(edge.getTargetId())
                    && relationsOverlap(pending.getRelationName(), edge.getRelationName(), work)) {
                candidates.put(pending.getUuid(), pending);
            }
        }
        if (config.sharedEndpointCandidates()) {
            List<EntityEdge> shared = new ArrayList<>();
            for (EntityEdge existing : storedAround(edge.getTargetId(), work)) {
                if (existing.getTargetId().equals(edge.getTargetId()) && !existing.getSourceId().equals(edge.getSourceId())) {
                    shared.add(existing);
                }
            }
            for (EntityEdge existing : storedAround(edge.getSourceId(), work)) {
                if (existing.getSourceId().equals(edge.getSourceId()) && !existing.getTargetId().equals(edge.getTargetId())) {
                    shared.add(existing);
                }
            }
            for (EntityEdge pending : work.created.values()) {
                if (pending.touches(edge.getSourceId()) || pending.touches(edge.getTargetId())) {
                    shared.add(pending);
                }
            }
            shared.removeIf(e -> !e.isOpen() || !e.getRelationName().equals(edge.getRelationName())
                || (e.getSourceId().equals(edge.getSourceId()) && e.getTargetId().equals(edge.getTargetId())));
            shared.sort(Comparator.comparing(EntityEdge::getValidAt).reversed());
            int added = 0;
            for (EntityEdge existing : shared) {
                if (added == MAX_SHARED_ENDPOINT_CANDIDATES) {
                    break;
                }
                if (candidates.putIfAbsent(existing.getUuid(), existing) == null) {
                    added++;
                }
            }
        }
        return new ArrayList<>(candidates.values());
    }

    @Nullable
    private EntityEdge judge(EntityEdge edge, EntityEdge existing, Work work) {
        // the candidate list is computed once, an earlier judgment may have closed this edge
        EntityEdge current = work.current(existing);
        if (!current.isOpen()) {
            return edge;
        }
        boolean sameTriple = current.tripleKey().equals(edge.tripleKey());
        boolean samePair = current.getSourceId().equals(edge.getSourceId())
            && current.getTargetId().equals(edge.getTargetId());

        if (sameTriple && sameFact(current, edge)) {
            corroborate(current, work);
            return null;
        }
        if (judge == null) {
            return sameTriple ? supersedeOlder(edge, current, work) : edge;
        }

        EdgeJudgment judgment;
        try {
            judgment = gate.call("temporal-judge", () -> judge.judge(edge, current));
        } catch (CapabilityUnavailableException e) {
            TemporalConflictUnresolvedException conflict =
                new TemporalConflictUnresolvedException(edge.getUuid(), current.getUuid(), e);
            work.run.warn(conflict.getMessage());
            logger.warn("[temporal-conflict] {} (new fact: '{}', existing fact: '{}')",
                conflict.getMessage(), edge.getFact(), current.getFact());
            return sameTriple ? supersedeOlder(edge, current, work) : edge;
        }

        logger.debug("Judged '{}' against '{}': {}", edge.getFact(), current.getFact(), judgment);
        switch (judgment) {
            case CORROBORATES:
                if (samePair) {
                    corroborate(current, work);
                    return null;
                }
                return edge;
            case CONTRADICTS:
                return supersedeOlder(edge, current, work);
            case INDEPENDENT:
            default:
                return sameTriple ? supersedeOlder(edge, current, work) : edge;
        }
    }

    private EntityEdge supersedeOlder(EntityEdge edge, EntityEdge existing, Work work) {
        if (edge.getInvalidAt() != null && !edge.getInvalidAt().isAfter(existing.getValidAt())) {
            // the new fact ended before the existing one started
            return edge;
        }
        work.invalidated++;
        if (!existing.getValidAt().isAfter(edge.getValidAt())) {
            work.put(existing.invalidate(edge.getValidAt(), List.of(edge.getUuid())));
            return edge;
        }
        // the new fact is older than the one already recorded
        return edge.invalidate(existing.getValidAt(), List.of(existing.getUuid()));
    }

    private void corroborate(EntityEdge existing, Work work) {
        work.put(existing.addEpisodeId(work.run.episode().getUuid()));
        work.corroborated++;
    }

    private static boolean sameFact(EntityEdge a, EntityEdge b) {
        return a.getFact().trim().equalsIgnoreCase(b.getFact().trim());
    }

    private boolean relationsOverlap(String a, String b, Work work) {
        if (a.equals(b)) {
            return true;
        }
        double similarity = EmbeddingUtil.safeCosine(work.relationEmbedding(a), work.relationEmbedding(b));
        return similarity >= config.relationSimilarityThreshold();
    }

    private List<EntityEdge> storedBetween(String sourceId, String targetId, Work work) {
        List<EntityEdge> edges = new ArrayList<>();
        for (EntityEdge stored : store.getEdgesBetween(sourceId, targetId, null).join()) {
            work.originals.putIfAbsent(stored.getUuid(), stored);
            edges.add(work.current(stored));
        }
        return edges;
    }

    private List<EntityEdge> storedAround(String nodeId, Work work) {
        List<EntityEdge> edges = new ArrayList<>();
        for (EntityEdge stored : store.getEdgesForNode(nodeId).join()) {
            work.originals.putIfAbsent(stored.getUuid(), stored);
            edges.add(work.current(stored));
        }
        return edges;
    }

    private List<EntityEdge> embedFacts(List<EntityEdge> edges) {
        List<String> facts = new ArrayList<>(edges.size());
        for (EntityEdge edge : edges) {
            facts.add(edge.getFact());
        }
        List<float[]> vectors = Embeddings.embedAll(gate, embedder, "embed-facts", facts);
        List<EntityEdge> embedded = new ArrayList<>(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            embedded.add(edges.get(i).withFactEmbedding(vectors.get(i)));
        }
        return embedded;
    }

    /**
     * Staged edge versions of one run.
     */
    private final class Work {
        final EpisodeRun run;
        final Map<String, EntityEdge> created = new LinkedHashMap<>();
        final Map<String, EntityEdge> touched = new LinkedHashMap<>();
        final Map<String, EntityEdge> originals = new HashMap<>();
        final Map<String, float[]> relationEmbeddings = new HashMap<>();
        int invalidated;
        int corroborated;

        Work(EpisodeRun run) {
            this.run = run;
        }

        EntityEdge current(EntityEdge edge) {
            EntityEdge pending = created.get(edge.getUuid());
            if (pending != null) {
                return pending;
            }
            return touched.getOrDefault(edge.getUuid(), edge);
        }

        void put(EntityEdge edge) {
            if (created.containsKey(edge.getUuid())) {
                created.put(edge.getUuid(), edge);
                return;
            }
            touched.put(edge.getUuid(), edge);
        }

        float[] relationEmbedding(String relationName) {
            return relationEmbeddings.computeIfAbsent(relationName, name -> {
                String text = name.replace('_', ' ').toLowerCase(Locale.ROOT);
                return Embeddings.embedAll(gate, embedder, "embed-relation", List.of(text)).get(0);
            });
        }
    }
}
