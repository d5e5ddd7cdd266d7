package br.edu.ifba.graphmemory.ingest;

import br.edu.ifba.graphmemory.GraphMemory;
import br.edu.ifba.graphmemory.capability.ExtractionRequest;
import br.edu.ifba.graphmemory.capability.ExtractionResult;
import br.edu.ifba.graphmemory.capability.Extractor;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.core.EpisodeType;
import br.edu.ifba.graphmemory.core.GraphSnapshot;
import br.edu.ifba.graphmemory.exception.ErrorKind;
import br.edu.ifba.graphmemory.exception.RateLimitedException;
import br.edu.ifba.graphmemory.exception.StoreUnavailableException;
import br.edu.ifba.graphmemory.storage.GraphWriteBatch;
import br.edu.ifba.graphmemory.storage.impl.InMemoryTemporalGraphStore;
import br.edu.ifba.graphmemory.support.HashingEmbedder;
import br.edu.ifba.graphmemory.support.RuleBasedJudges;
import br.edu.ifba.graphmemory.support.RuleBasedJudges.CountingTemporalJudge;
import br.edu.ifba.graphmemory.support.ScriptedExtractor;
import br.edu.ifba.graphmemory.support.TestConfigs;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests of episode ingestion against the in-memory store.
 */
class EpisodePipelineTest {

    private static final String NS = "acme";
    private static final Instant T1 = Instant.parse("2024-01-10T09:00:00Z");
    private static final Instant T2 = Instant.parse("2024-06-01T09:00:00Z");

    private static final String BOB_BODY = "Bob is the VP of Sales.";
    private static final String ALICE_BODY = "Alice took over as VP of Sales.";

    private InMemoryTemporalGraphStore store;
    private ScriptedExtractor extractor;
    private CountingTemporalJudge temporalJudge;
    private GraphMemory memory;

    @BeforeEach
    void setUp() {
        extractor = new ScriptedExtractor()
            .on(BOB_BODY, ScriptedExtractor.script()
                .entity("Bob", "Person")
                .entity("VP of Sales", "Role")
                .relation("Bob", "holds role", "VP of Sales", "Bob is the VP of Sales")
                .build())
            .on(ALICE_BODY, ScriptedExtractor.script()
                .entity("Alice", "Person")
                .entity("VP of Sales", "Role")
                .relation("Alice", "holds role", "VP of Sales", "Alice is the VP of Sales")
                .build());
        temporalJudge = RuleBasedJudges.relationJudge();
        memory = memory(TestConfigs.fast(), extractor, temporalJudge);
    }

    @AfterEach
    void tearDown() {
        memory.close();
    }

    private GraphMemory memory(GraphMemoryConfig config, Extractor extractor, CountingTemporalJudge judge) {
        return memory(config, extractor, judge, new HashingEmbedder());
    }

    /**
     * Fresh store and memory; closing a memory closes its store.
     */
    private GraphMemory memory(
            GraphMemoryConfig config, Extractor extractor, CountingTemporalJudge judge, HashingEmbedder embedder) {
        return memory(config, extractor, judge, embedder, new InMemoryTemporalGraphStore());
    }

    private GraphMemory memory(GraphMemoryConfig config, Extractor extractor, CountingTemporalJudge judge,
            HashingEmbedder embedder, InMemoryTemporalGraphStore graphStore) {
        store = graphStore;
        GraphMemory graphMemory = GraphMemory.builder()
            .config(config)
            .store(store)
            .extractor(extractor)
            .embedder(embedder)
            .temporalJudge(judge)
            .build();
        graphMemory.initialize().join();
        return graphMemory;
    }

    private EpisodeResult ingest(String body, Instant at) {
        return memory.addEpisode(NS, body, at).result().join();
    }

    private EntityNode node(String name) {
        return store.getNodes(NS).join().stream()
            .filter(n -> n.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no node named " + name));
    }

    private EntityEdge edgeFrom(String sourceName) {
        String sourceId = node(sourceName).getUuid();
        return store.getEdges(NS).join().stream()
            .filter(e -> e.getSourceId().equals(sourceId))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no edge from " + sourceName));
    }

    private static void awaitStage(EpisodeSubmission submission, EpisodeStage stage) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (submission.currentStage() != stage) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("episode never reached " + stage + ", still " + submission.currentStage());
            }
            Thread.sleep(5);
        }
    }

    @Nested
    @DisplayName("Temporal invalidation")
    class TemporalInvalidation {

        @Test
        @DisplayName("a new holder of a role closes the previous holder's edge at the new start time")
        void testRoleHandover() {
            EpisodeResult first = ingest(BOB_BODY, T1);
            EpisodeResult second = ingest(ALICE_BODY, T2);

            assertTrue(first.isSuccess());
            assertEquals(2, first.entitiesCreated());
            assertEquals(1, first.edgesCreated());

            assertTrue(second.isSuccess());
            assertEquals(1, second.entitiesCreated());
            assertEquals(1, second.entitiesMerged());
            assertEquals(1, second.edgesInvalidated());

            EntityEdge bob = edgeFrom("Bob");
            EntityEdge alice = edgeFrom("Alice");
            assertEquals("HOLDS_ROLE", bob.getRelationName());
            assertEquals(T1, bob.getValidAt());
            assertEquals(T2, bob.getInvalidAt());
            assertEquals(List.of(alice.getUuid()), bob.getInvalidatedBy());
            assertTrue(alice.isOpen());
            assertEquals(1, temporalJudge.calls());
        }

        @Test
        @DisplayName("point-in-time views before and after the handover show one holder each")
        void testPointInTimeAcrossHandover() {
            ingest(BOB_BODY, T1);
            ingest(ALICE_BODY, T2);
            String bobId = node("Bob").getUuid();
            String aliceId = node("Alice").getUuid();

            GraphSnapshot before = memory.pointInTimeView(NS, T2.minusSeconds(1)).join();
            GraphSnapshot after = memory.pointInTimeView(NS, T2).join();

            assertEquals(1, before.edges().size());
            assertEquals(bobId, before.edges().get(0).getSourceId());
            assertEquals(1, after.edges().size());
            assertEquals(aliceId, after.edges().get(0).getSourceId());
        }

        @Test
        @DisplayName("the same fact from a later episode corroborates instead of duplicating")
        void testCorroboration() {
            String again = "Reminder: Bob is the VP of Sales.";
            extractor.on(again, ScriptedExtractor.script()
                .entity("Bob", "Person")
                .entity("VP of Sales", "Role")
                .relation("Bob", "HOLDS_ROLE", "VP of Sales", "Bob is the VP of Sales")
                .build());

            EpisodeResult first = ingest(BOB_BODY, T1);
            EpisodeResult second = ingest(again, T2);

            assertEquals(0, second.edgesCreated());
            assertEquals(1, second.edgesCorroborated());
            assertEquals(0, second.edgesInvalidated());
            List<EntityEdge> edges = store.getEdges(NS).join();
            assertEquals(1, edges.size());
            assertEquals(List.of(first.episodeId(), second.episodeId()), edges.get(0).getEpisodeIds());
            assertEquals(0, temporalJudge.calls());
        }

        @Test
        @DisplayName("a failed judgment on the same triple keeps one open edge and reports a warning")
        void testFailedJudgmentSupersedesOlderEdge() {
            memory.close();
            CountingTemporalJudge failing = RuleBasedJudges.failingTemporalJudge();
            memory = memory(TestConfigs.fast(), extractor, failing);
            String update = "Bob is still running sales, now as VP of Sales EMEA.";
            extractor.on(update, ScriptedExtractor.script()
                .entity("Bob", "Person")
                .entity("VP of Sales", "Role")
                .relation("Bob", "holds role", "VP of Sales", "Bob is the VP of Sales for EMEA")
                .build());

            ingest(BOB_BODY, T1);
            EpisodeResult result = ingest(update, T2);

            assertTrue(result.isSuccess());
            assertEquals(1, result.edgesInvalidated());
            assertEquals(1, result.warnings().size());
            assertEquals(1, failing.calls());
            List<EntityEdge> open = store.getEdges(NS).join().stream().filter(EntityEdge::isOpen).toList();
            assertEquals(1, open.size());
            assertEquals("Bob is the VP of Sales for EMEA", open.get(0).getFact());
        }

        @Test
        @DisplayName("an episode describing an older state closes its own edge at the recorded start")
        void testOutOfOrderEpisode() {
            ingest(ALICE_BODY, T2);
            EpisodeResult late = ingest(BOB_BODY, T1);

            assertTrue(late.isSuccess());
            EntityEdge bob = edgeFrom("Bob");
            assertEquals(T2, bob.getInvalidAt());
            assertTrue(edgeFrom("Alice").isOpen());
        }
    }

    @Nested
    @DisplayName("Atomicity")
    class Atomicity {

        @Test
        @DisplayName("a failing extractor leaves nothing behind and reports the stage")
        void testExtractionFailureCommitsNothing() {
            String body = "This one never gets through.";
            extractor.failOn(body, new RateLimitedException("429 Too Many Requests"));

            EpisodeResult result = ingest(body, T1);

            assertFalse(result.isSuccess());
            assertEquals(EpisodeStage.FAILED, result.stage());
            assertEquals(EpisodeStage.EXTRACTING, result.failedStage());
            assertEquals(ErrorKind.CAPABILITY_UNAVAILABLE, result.errorKind());
            assertEquals(3, extractor.calls());
            assertTrue(store.getRecentEpisodes(NS, 10).join().isEmpty());
            assertTrue(store.getNodes(NS).join().isEmpty());
        }

        @Test
        @DisplayName("an embedder outage after extraction fails the run without a partial write")
        void testEmbeddingFailureCommitsNothing() {
            memory.close();
            HashingEmbedder embedder = new HashingEmbedder();
            memory = memory(TestConfigs.fast(), extractor, temporalJudge, embedder);
            embedder.failNext(10);

            EpisodeResult result = ingest(BOB_BODY, T1);

            assertEquals(EpisodeStage.RESOLVING, result.failedStage());
            assertEquals(ErrorKind.CAPABILITY_UNAVAILABLE, result.errorKind());
            assertTrue(store.getNodes(NS).join().isEmpty());
            assertTrue(store.getEdges(NS).join().isEmpty());
        }

        @Test
        @DisplayName("a store failure during the commit is reported against the persist stage")
        void testCommitFailureStage() {
            memory.close();
            InMemoryTemporalGraphStore unwritable = new InMemoryTemporalGraphStore() {
                @Override
                public CompletableFuture<Void> commit(@NotNull GraphWriteBatch batch) {
                    return CompletableFuture.failedFuture(
                        new StoreUnavailableException("commit", new SQLException("disk I/O error")));
                }
            };
            memory = memory(TestConfigs.fast(), extractor, temporalJudge, new HashingEmbedder(), unwritable);

            EpisodeSubmission submission = memory.addEpisode(NS, BOB_BODY, T1);
            EpisodeResult result = submission.result().join();

            assertEquals(EpisodeStage.FAILED, result.stage());
            assertEquals(EpisodeStage.PERSISTED, result.failedStage());
            assertEquals(ErrorKind.STORE_UNAVAILABLE, result.errorKind());
            assertEquals(EpisodeStage.FAILED, submission.currentStage());
            assertTrue(store.getNodes(NS).join().isEmpty());
        }

        @Test
        @DisplayName("a cancelled episode stops at the next stage boundary and commits nothing")
        void testCancellation() throws Exception {
            CountDownLatch release = extractor.holdOn(BOB_BODY);
            EpisodeSubmission submission = memory.addEpisode(NS, BOB_BODY, T1);
            awaitStage(submission, EpisodeStage.EXTRACTING);

            assertTrue(submission.cancel());
            release.countDown();
            EpisodeResult result = submission.result().get(5, TimeUnit.SECONDS);

            assertEquals(ErrorKind.CANCELLED, result.errorKind());
            assertEquals(EpisodeStage.EXTRACTING, result.failedStage());
            assertTrue(submission.isCancelled());
            assertTrue(store.getNodes(NS).join().isEmpty());
            assertNull(store.getEpisode(submission.getEpisodeId()).join());
        }

        @Test
        @DisplayName("a finished episode can no longer be cancelled")
        void testCancelAfterCommit() {
            EpisodeSubmission submission = memory.addEpisode(NS, BOB_BODY, T1);
            submission.result().join();

            assertFalse(submission.cancel());
            assertEquals(EpisodeStage.PERSISTED, submission.currentStage());
            assertEquals(2, store.getNodes(NS).join().size());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest(name = "namespace \"{0}\" is rejected")
        @ValueSource(strings = {"", "acme corp", "acme/prod", "ação"})
        void testInvalidNamespace(String namespace) {
            EpisodeResult result = memory.addEpisode(namespace, BOB_BODY, T1).result().join();

            assertEquals(EpisodeStage.RECEIVED, result.failedStage());
            assertEquals(ErrorKind.INVALID_NAMESPACE, result.errorKind());
            assertEquals(0, extractor.calls());
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "blank body           | '   '          | TEXT",
            "malformed JSON       | '{\"a\": '      | JSON",
            "JSON without closing | '[1, 2'         | JSON"
        })
        void testInvalidEpisode(String description, String body, EpisodeType type) {
            Episode episode = Episode.builder().namespace(NS).body(body).type(type).referenceTime(T1).build();

            EpisodeResult result = memory.addEpisode(episode).result().join();

            assertEquals(EpisodeStage.RECEIVED, result.failedStage(), description);
            assertEquals(ErrorKind.INVALID_EPISODE, result.errorKind(), description);
            assertEquals(0, extractor.calls());
        }

        @Test
        @DisplayName("a body longer than the configured maximum is rejected")
        void testBodyTooLong() {
            memory.close();
            memory = memory(TestConfigs.fast(Map.of("graph-memory.episode.max-body-length", "10")), extractor, temporalJudge);

            EpisodeResult result = ingest(BOB_BODY, T1);

            assertEquals(ErrorKind.INVALID_EPISODE, result.errorKind());
            assertTrue(result.errorMessage().contains("maximum is 10"));
        }

        @Test
        @DisplayName("a JSON episode that parses is ingested")
        void testValidJsonEpisode() {
            String body = "{\"customer\": \"Bob\", \"role\": \"VP of Sales\"}";
            extractor.on(body, ScriptedExtractor.script().entity("Bob", "Person").build());
            Episode episode = Episode.builder().namespace(NS).body(body).type(EpisodeType.JSON).referenceTime(T1).build();

            assertTrue(memory.addEpisode(episode).result().join().isSuccess());
        }

        @Test
        @DisplayName("relationships with unextracted endpoints are dropped with a warning")
        void testDanglingRelationshipDropped() {
            String body = "Bob reports to Carol.";
            extractor.on(body, ScriptedExtractor.script()
                .entity("Bob", "Person")
                .relation("Bob", "reports to", "Carol", "Bob reports to Carol")
                .build());

            EpisodeResult result = ingest(body, T1);

            assertTrue(result.isSuccess());
            assertEquals(0, result.edgesCreated());
            assertEquals(1, result.warnings().size());
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("episodes of one namespace run in submission order, other namespaces are not blocked")
        void testPerNamespaceOrdering() throws Exception {
            String later = "Later that day Bob hired Alice.";
            String elsewhere = "Unrelated tenant update.";
            CountDownLatch release = extractor.holdOn(BOB_BODY);

            EpisodeSubmission first = memory.addEpisode(NS, BOB_BODY, T1);
            EpisodeSubmission second = memory.addEpisode(NS, later, T1.plusSeconds(3600));
            EpisodeSubmission other = memory.addEpisode("globex", elsewhere, T1);

            assertTrue(other.result().get(5, TimeUnit.SECONDS).isSuccess());
            assertFalse(second.result().isDone());
            assertTrue(extractor.requests().stream().noneMatch(r -> r.episode().getBody().equals(later)));

            release.countDown();
            assertTrue(first.result().get(5, TimeUnit.SECONDS).isSuccess());
            assertTrue(second.result().get(5, TimeUnit.SECONDS).isSuccess());

            ExtractionRequest secondRequest = extractor.requests().stream()
                .filter(r -> r.episode().getBody().equals(later))
                .findFirst()
                .orElseThrow();
            assertEquals(List.of(first.getEpisodeId()),
                secondRequest.context().stream().map(Episode::getUuid).toList());
        }
    }

    @Nested
    @DisplayName("Reflexion")
    class Reflexion {

        private final String body = "Alice joined Acme Corp in March.";

        /**
         * Misses Acme Corp on the first pass and finds it once hinted.
         */
        private final class ForgetfulExtractor implements Extractor {
            final List<List<String>> hints = new CopyOnWriteArrayList<>();
            int missedQueries;

            @Override
            public CompletableFuture<ExtractionResult> extract(@NotNull ExtractionRequest request) {
                hints.add(request.hints());
                ScriptedExtractor.Script script = ScriptedExtractor.script().entity("Alice", "Person");
                if (request.hints().contains("Acme Corp")) {
                    script.entity("Acme Corp", "Organization")
                        .relation("Alice", "works at", "Acme Corp", "Alice works at Acme Corp");
                }
                return CompletableFuture.completedFuture(script.build());
            }

            @Override
            public CompletableFuture<List<String>> findMissedEntities(
                    @NotNull ExtractionRequest request, @NotNull ExtractionResult extracted) {
                missedQueries++;
                boolean hasAcme = extracted.entityKeys().contains(ExtractionResult.key("Acme Corp"));
                return CompletableFuture.completedFuture(hasAcme ? List.of() : List.of("Acme Corp"));
            }
        }

        @Test
        @DisplayName("a missed entity is recovered by a hinted second pass")
        void testReflexionRecoversMissedEntity() {
            ForgetfulExtractor forgetful = new ForgetfulExtractor();
            memory.close();
            memory = memory(TestConfigs.fast(), forgetful, temporalJudge);

            EpisodeResult result = ingest(body, T1);

            assertTrue(result.isSuccess());
            assertEquals(2, result.entitiesCreated());
            assertEquals(1, result.edgesCreated());
            assertEquals(List.of(List.of(), List.of("Acme Corp")), forgetful.hints);
            assertEquals(2, forgetful.missedQueries);
        }

        @Test
        @DisplayName("with reflexion disabled only the first pass runs")
        void testReflexionDisabled() {
            ForgetfulExtractor forgetful = new ForgetfulExtractor();
            memory.close();
            memory = memory(TestConfigs.fast(Map.of("graph-memory.extraction.reflexion.enabled", "false")),
                forgetful, temporalJudge);

            EpisodeResult result = ingest(body, T1);

            assertEquals(1, result.entitiesCreated());
            assertEquals(1, forgetful.hints.size());
            assertEquals(0, forgetful.missedQueries);
        }
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
        "works for, WORKS_FOR",
        "Works-For, WORKS_FOR",
        "worksFor, WORKS_FOR",
        "HOLDS_ROLE, HOLDS_ROLE",
        "'  --  ', RELATES_TO"
    })
    void testRelationNameNormalization(String raw, String expected) {
        assertEquals(expected, ExtractionStage.normalizeRelationName(raw));
    }

    @Test
    @DisplayName("runs report their duration")
    void testDurationReported() {
        EpisodeResult result = ingest(BOB_BODY, T1);

        assertFalse(result.duration().isNegative());
        assertTrue(result.duration().compareTo(Duration.ofSeconds(30)) < 0);
    }
}
