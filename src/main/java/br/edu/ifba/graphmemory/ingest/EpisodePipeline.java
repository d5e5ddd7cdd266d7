package br.edu.ifba.graphmemory.ingest;

import br.edu.ifba.graphmemory.capability.CandidateEntity;
import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.Embedder;
import br.edu.ifba.graphmemory.capability.Embeddings;
import br.edu.ifba.graphmemory.capability.ExtractionResult;
import br.edu.ifba.graphmemory.community.CommunityDetector;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.core.EpisodeType;
import br.edu.ifba.graphmemory.core.Namespaces;
import br.edu.ifba.graphmemory.dedup.DeduplicationEngine;
import br.edu.ifba.graphmemory.dedup.ResolutionSession;
import br.edu.ifba.graphmemory.exception.EpisodeCancelledException;
import br.edu.ifba.graphmemory.exception.ErrorKind;
import br.edu.ifba.graphmemory.exception.GraphMemoryException;
import br.edu.ifba.graphmemory.exception.InvalidEpisodeException;
import br.edu.ifba.graphmemory.storage.EdgeInvalidation;
import br.edu.ifba.graphmemory.storage.GraphWriteBatch;
import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Drives episodes through RECEIVED, EXTRACTING, RESOLVING, INVALIDATING and PERSISTED.
 *
 * <p>Episodes of one namespace run one at a time in submission order; different namespaces
 * run concurrently and only share the capability gate. Every write of an episode is staged
 * and applied with a single {@link TemporalGraphStore#commit(GraphWriteBatch)}, so a failed
 * or cancelled episode leaves the store exactly as it was.</p>
 */
public class EpisodePipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EpisodePipeline.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private final TemporalGraphStore store;
    private final GraphMemoryConfig config;
    private final CapabilityGate gate;
    private final Embedder embedder;
    private final ExtractionStage extraction;
    private final DeduplicationEngine deduplication;
    private final InvalidationStage invalidation;
    @Nullable
    private final CommunityDetector communities;
    private final NamespaceSequencer sequencer;

    public EpisodePipeline(
            @NotNull TemporalGraphStore store,
            @NotNull GraphMemoryConfig config,
            @NotNull CapabilityGate gate,
            @NotNull Embedder embedder,
            @NotNull ExtractionStage extraction,
            @NotNull DeduplicationEngine deduplication,
            @NotNull InvalidationStage invalidation,
            @Nullable CommunityDetector communities,
            @NotNull NamespaceSequencer sequencer) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
        this.extraction = Objects.requireNonNull(extraction, "extraction must not be null");
        this.deduplication = Objects.requireNonNull(deduplication, "deduplication must not be null");
        this.invalidation = Objects.requireNonNull(invalidation, "invalidation must not be null");
        this.communities = communities;
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer must not be null");
    }

    /**
     * Queues an episode behind the earlier episodes of its namespace.
     *
     * <p>An invalid namespace fails immediately without queueing.</p>
     */
    @NotNull
    public EpisodeSubmission submit(@NotNull Episode episode) {
        EpisodeRun run = new EpisodeRun(episode);
        if (!Namespaces.isValid(episode.getNamespace())) {
            logger.warn("Rejected episode {}: invalid namespace '{}'", episode.getUuid(), episode.getNamespace());
            run.failed();
            EpisodeResult result = EpisodeResult.failure(episode.getUuid(), episode.getNamespace(),
                EpisodeStage.RECEIVED, ErrorKind.INVALID_NAMESPACE,
                "Invalid namespace: '" + episode.getNamespace() + "'", List.of(), Duration.ZERO);
            return new EpisodeSubmission(run, CompletableFuture.completedFuture(result));
        }
        logger.debug("Queued episode {} in namespace {}", episode.getUuid(), episode.getNamespace());
        CompletableFuture<EpisodeResult> result = sequencer.submit(episode.getNamespace(), () -> process(run));
        return new EpisodeSubmission(run, result);
    }

    @NotNull
    EpisodeResult process(@NotNull EpisodeRun run) {
        Episode episode = run.episode();
        String namespace = episode.getNamespace();
        long start = System.nanoTime();
        try {
            validate(episode);

            run.enter(EpisodeStage.EXTRACTING);
            List<Episode> context = previousEpisodes(episode);
            ExtractionResult extracted = extraction.run(run, context);
            logger.debug("Episode {} extracted {} entities and {} relationships",
                episode.getUuid(), extracted.entities().size(), extracted.relationships().size());

            run.enter(EpisodeStage.RESOLVING);
            List<EntityNode> storedNodes = store.getNodes(namespace).join();
            ResolutionSession session = deduplication.begin(namespace, storedNodes);
            for (CandidateEntity candidate : extracted.entities()) {
                run.checkpoint();
                deduplication.resolve(session, candidate, episode);
            }
            run.warnAll(session.warnings());
            embedNodes(session, storedNodes);

            run.enter(EpisodeStage.INVALIDATING);
            InvalidationStage.Outcome outcome = invalidation.run(run, session, extracted.relationships());

            run.beginCommit();
            GraphWriteBatch.Builder batch = GraphWriteBatch.builder(namespace)
                .episode(episode)
                .nodes(session.touchedNodes());
            for (EdgeInvalidation edgeInvalidation : outcome.invalidations()) {
                batch.invalidation(edgeInvalidation);
            }
            store.commit(batch
                .edges(outcome.updatedEdges())
                .edges(outcome.createdEdges())
                .build()).join();
            run.persisted();
            deduplication.install(session);

            refreshCommunities(run, session, outcome);

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            EpisodeResult result = EpisodeResult.success(episode.getUuid(), namespace,
                session.createdCount(), session.matchedCount(), outcome.createdEdges().size(),
                outcome.invalidatedCount(), outcome.corroboratedCount(), run.warnings(), duration);
            logger.info("Persisted episode {} in {}: {} new entities, {} merged, {} new edges, {} invalidated, {} corroborated ({} ms)",
                episode.getUuid(), namespace, result.entitiesCreated(), result.entitiesMerged(), result.edgesCreated(),
                result.edgesInvalidated(), result.edgesCorroborated(), duration.toMillis());
            return result;
        } catch (RuntimeException e) {
            return fail(run, unwrap(e), start);
        }
    }

    private void validate(Episode episode) {
        String body = episode.getBody();
        if (body == null || body.isBlank()) {
            throw new InvalidEpisodeException("Episode body is empty");
        }
        int max = config.episode().maxBodyLength();
        if (body.length() > max) {
            throw new InvalidEpisodeException(String.format(
                "Episode body has %d characters, the maximum is %d", body.length(), max));
        }
        if (episode.getType() == EpisodeType.JSON) {
            try {
                JSON.readTree(body);
            } catch (JsonProcessingException e) {
                throw new InvalidEpisodeException("Episode body is not valid JSON: " + e.getOriginalMessage(), e);
            }
        }
    }

    private List<Episode> previousEpisodes(Episode episode) {
        int window = config.episode().contextWindow();
        if (window <= 0) {
            return List.of();
        }
        List<Episode> context = new ArrayList<>();
        for (Episode previous : store.getRecentEpisodes(episode.getNamespace(), window).join()) {
            if (!previous.getUuid().equals(episode.getUuid())) {
                context.add(previous);
            }
        }
        return context;
    }

    /**
     * Embeds touched nodes that are new or whose name or summary changed.
     */
    private void embedNodes(ResolutionSession session, List<EntityNode> storedNodes) {
        Map<String, EntityNode> stored = new HashMap<>();
        for (EntityNode node : storedNodes) {
            stored.put(node.getUuid(), node);
        }
        List<EntityNode> pending = new ArrayList<>();
        for (EntityNode node : session.touchedNodes()) {
            EntityNode before = stored.get(node.getUuid());
            if (node.getNameEmbedding() == null || before == null
                    || !before.embeddingText().equals(node.embeddingText())) {
                pending.add(node);
            }
        }
        List<String> texts = new ArrayList<>(pending.size());
        for (EntityNode node : pending) {
            texts.add(node.embeddingText());
        }
        List<float[]> vectors = Embeddings.embedAll(gate, embedder, "embed-nodes", texts);
        for (int i = 0; i < pending.size(); i++) {
            session.replaceTouched(pending.get(i).withNameEmbedding(vectors.get(i)));
        }
    }

    private void refreshCommunities(EpisodeRun run, ResolutionSession session, InvalidationStage.Outcome outcome) {
        if (communities == null || !config.community().updateOnIngest()) {
            return;
        }
        Set<String> affected = new LinkedHashSet<>();
        for (EntityNode node : session.touchedNodes()) {
            affected.add(node.getUuid());
        }
        for (EntityEdge edge : outcome.createdEdges()) {
            affected.add(edge.getSourceId());
            affected.add(edge.getTargetId());
        }
        try {
            communities.refresh(session.getNamespace(), affected);
        } catch (RuntimeException e) {
            // the episode is already committed; stale communities are rebuilt on the next refresh
            run.warn("Community update failed: " + e.getMessage());
            logger.warn("Community update after episode {} failed", run.episode().getUuid(), e);
        }
    }

    private EpisodeResult fail(EpisodeRun run, Throwable error, long start) {
        Episode episode = run.episode();
        EpisodeStage stage = run.failingStage();
        ErrorKind kind = error instanceof GraphMemoryException graphMemoryException
            ? graphMemoryException.getKind()
            : ErrorKind.INTERNAL;
        run.failed();

        if (error instanceof EpisodeCancelledException) {
            logger.info("Episode {} cancelled during {}", episode.getUuid(), stage);
        } else if (kind == ErrorKind.INTERNAL) {
            logger.error("Episode {} failed during {} with an internal error", episode.getUuid(), stage, error);
        } else {
            logger.error("Episode {} failed during {}: [{}] {}", episode.getUuid(), stage, kind, error.getMessage());
        }
        return EpisodeResult.failure(episode.getUuid(), episode.getNamespace(), stage, kind, error.getMessage(),
            run.warnings(), Duration.ofNanos(System.nanoTime() - start));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        sequencer.close();
    }
}
