package br.edu.ifba.graphmemory;

import br.edu.ifba.graphmemory.capability.EdgeJudgment;
import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.exception.ErrorKind;
import br.edu.ifba.graphmemory.exception.GraphMemoryException;
import br.edu.ifba.graphmemory.ingest.EpisodeResult;
import br.edu.ifba.graphmemory.storage.impl.InMemoryTemporalGraphStore;
import br.edu.ifba.graphmemory.support.HashingEmbedder;
import br.edu.ifba.graphmemory.support.ScriptedExtractor;
import br.edu.ifba.graphmemory.support.TestConfigs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests of the administrative operations of {@link GraphMemory}.
 */
class GraphMemoryTest {

    private static final String NS = "acme";
    private static final Instant T1 = Instant.parse("2024-01-10T09:00:00Z");
    private static final Instant T2 = Instant.parse("2024-02-10T09:00:00Z");
    private static final Instant T3 = Instant.parse("2024-03-10T09:00:00Z");

    private static final String BOB_BODY = "Bob Smith runs Sales and reports to Carol.";
    private static final String ROBERT_BODY = "Robert Smith runs Sales.";
    private static final String MEETING_BODY = "Bob Smith met Robert Smith.";
    private static final String LATER_BODY = "Bob Smith closed a deal.";

    private InMemoryTemporalGraphStore store;
    private ScriptedExtractor extractor;
    private GraphMemory memory;

    @BeforeEach
    void setUp() {
        extractor = new ScriptedExtractor()
            .on(BOB_BODY, ScriptedExtractor.script()
                .entity("Bob Smith", "Person")
                .entity("Sales", "Organization")
                .entity("Carol", "Person")
                .relation("Bob Smith", "LEADS", "Sales", "Bob Smith runs Sales")
                .relation("Bob Smith", "REPORTS_TO", "Carol", "Bob Smith reports to Carol")
                .build())
            .on(ROBERT_BODY, ScriptedExtractor.script()
                .entity("Robert Smith", "Person")
                .entity("Sales", "Organization")
                .relation("Robert Smith", "LEADS", "Sales", "Robert Smith runs Sales")
                .build())
            .on(MEETING_BODY, ScriptedExtractor.script()
                .entity("Bob Smith", "Person")
                .entity("Robert Smith", "Person")
                .relation("Bob Smith", "MET", "Robert Smith", "Bob Smith met Robert Smith")
                .build())
            .on(LATER_BODY, ScriptedExtractor.script()
                .entity("Bob Smith", "Person")
                .build());
        store = new InMemoryTemporalGraphStore();
        memory = GraphMemory.builder()
            .config(TestConfigs.fast())
            .store(store)
            .extractor(extractor)
            .embedder(new HashingEmbedder())
            .temporalJudge((newEdge, existing) -> CompletableFuture.completedFuture(EdgeJudgment.INDEPENDENT))
            .build();
        memory.initialize().join();
    }

    @AfterEach
    void tearDown() {
        memory.close();
    }

    private EpisodeResult ingest(String namespace, String body, Instant at) {
        EpisodeResult result = memory.addEpisode(namespace, body, at).result().join();
        assertTrue(result.isSuccess(), () -> "ingestion failed: " + result.errorMessage());
        return result;
    }

    private void ingestAll() {
        ingest(NS, BOB_BODY, T1);
        ingest(NS, ROBERT_BODY, T2);
        ingest(NS, MEETING_BODY, T3);
    }

    private EntityNode node(String name) {
        return store.getNodes(NS).join().stream()
            .filter(n -> n.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no node named " + name));
    }

    private List<EntityEdge> openEdges() {
        return store.getEdges(NS).join().stream().filter(EntityEdge::isOpen).collect(Collectors.toList());
    }

    private static Throwable causeOf(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return e.getCause();
    }

    @Nested
    @DisplayName("Merging entities")
    class MergeTests {

        @Test
        @DisplayName("the source is superseded and its open edges move to the target")
        void testMerge() {
            ingestAll();
            EntityNode bob = node("Bob Smith");
            EntityNode robert = node("Robert Smith");
            String carolId = node("Carol").getUuid();
            String salesId = node("Sales").getUuid();

            EntityNode merged = memory.mergeEntities(NS, bob.getUuid(), robert.getUuid()).join();

            assertEquals(robert.getUuid(), merged.getUuid());
            assertTrue(merged.getEpisodeIds().containsAll(bob.getEpisodeIds()));
            EntityNode superseded = store.getNode(bob.getUuid()).join();
            assertFalse(superseded.isActive());
            assertEquals(robert.getUuid(), superseded.getSupersededBy());

            List<EntityEdge> open = openEdges();
            assertEquals(2, open.size());
            assertTrue(open.stream().noneMatch(e -> e.touches(bob.getUuid())));
            EntityEdge reportsTo = open.stream()
                .filter(e -> e.getRelationName().equals("REPORTS_TO"))
                .findFirst()
                .orElseThrow();
            assertEquals(robert.getUuid(), reportsTo.getSourceId());
            assertEquals(carolId, reportsTo.getTargetId());

            EntityEdge leads = open.stream()
                .filter(e -> e.getRelationName().equals("LEADS"))
                .findFirst()
                .orElseThrow();
            assertEquals(salesId, leads.getTargetId());
            assertEquals(2, leads.getEpisodeIds().size());
        }

        @Test
        @DisplayName("edges between the merged pair become closed self-loops")
        void testSelfLoopClosed() {
            ingestAll();
            EntityNode bob = node("Bob Smith");
            EntityNode robert = node("Robert Smith");

            memory.mergeEntities(NS, bob.getUuid(), robert.getUuid()).join();

            EntityEdge met = store.getEdges(NS).join().stream()
                .filter(e -> e.getRelationName().equals("MET"))
                .findFirst()
                .orElseThrow();
            assertFalse(met.isOpen());
            assertNotNull(met.getInvalidAt());
        }

        @Test
        @DisplayName("later mentions of the merged name resolve to the target")
        void testLaterMentionsResolve() {
            ingestAll();
            EntityNode bob = node("Bob Smith");
            EntityNode robert = node("Robert Smith");
            memory.mergeEntities(NS, bob.getUuid(), robert.getUuid()).join();
            int nodesBefore = store.getNodes(NS).join().size();

            EpisodeResult result = ingest(NS, LATER_BODY, T3.plusSeconds(60));

            assertEquals(0, result.entitiesCreated());
            assertEquals(nodesBefore, store.getNodes(NS).join().size());
            assertEquals(4, store.getNode(robert.getUuid()).join().getEpisodeIds().size());
        }

        @Test
        @DisplayName("merging an entity into itself is rejected")
        void testMergeIntoItself() {
            ingestAll();
            String bobId = node("Bob Smith").getUuid();

            assertInstanceOf(IllegalArgumentException.class, causeOf(memory.mergeEntities(NS, bobId, bobId)));
        }

        @Test
        @DisplayName("an already merged or unknown entity cannot be merged")
        void testMergeInactive() {
            ingestAll();
            String bobId = node("Bob Smith").getUuid();
            String robertId = node("Robert Smith").getUuid();
            String carolId = node("Carol").getUuid();
            memory.mergeEntities(NS, bobId, robertId).join();

            assertInstanceOf(IllegalArgumentException.class, causeOf(memory.mergeEntities(NS, bobId, carolId)));
            assertInstanceOf(IllegalArgumentException.class, causeOf(memory.mergeEntities(NS, "missing", carolId)));
        }

        @Test
        @DisplayName("an entity from another namespace is not found")
        void testMergeAcrossNamespaces() {
            ingestAll();
            ingest("globex", BOB_BODY, T1);
            String globexBob = store.getNodes("globex").join().stream()
                .filter(n -> n.getName().equals("Bob Smith"))
                .findFirst()
                .orElseThrow()
                .getUuid();

            Throwable cause = causeOf(memory.mergeEntities(NS, globexBob, node("Robert Smith").getUuid()));

            assertInstanceOf(IllegalArgumentException.class, cause);
        }
    }

    @Nested
    @DisplayName("Namespaces")
    class NamespaceTests {

        @Test
        @DisplayName("purging a namespace leaves other namespaces intact")
        void testPurge() {
            ingest(NS, BOB_BODY, T1);
            ingest("globex", ROBERT_BODY, T1);

            memory.purgeNamespace(NS).join();

            assertTrue(store.getNodes(NS).join().isEmpty());
            assertTrue(store.getEdges(NS).join().isEmpty());
            assertTrue(memory.recentEpisodes(NS, 10).join().isEmpty());
            assertEquals(2, store.getNodes("globex").join().size());
        }

        @Test
        @DisplayName("a purged namespace starts from scratch")
        void testIngestAfterPurge() {
            ingest(NS, BOB_BODY, T1);
            String oldBob = node("Bob Smith").getUuid();
            memory.purgeNamespace(NS).join();

            EpisodeResult result = ingest(NS, BOB_BODY, T2);

            assertEquals(3, result.entitiesCreated());
            assertFalse(node("Bob Smith").getUuid().equals(oldBob));
        }

        @Test
        @DisplayName("recent episodes come back oldest first")
        void testRecentEpisodes() {
            ingestAll();

            List<Episode> recent = memory.recentEpisodes(NS, 2).join();

            assertEquals(List.of(ROBERT_BODY, MEETING_BODY), recent.stream().map(Episode::getBody).toList());
        }

        @Test
        @DisplayName("operations on an invalid namespace fail with INVALID_NAMESPACE")
        void testInvalidNamespace() {
            List<CompletableFuture<?>> calls = List.of(
                memory.pointInTimeView("acme corp", T1),
                memory.recentEpisodes("acme corp", 5),
                memory.detectCommunities("acme/prod"),
                memory.mergeEntities("", "a", "b"),
                memory.purgeNamespace("ação"));

            for (CompletableFuture<?> call : calls) {
                Throwable cause = call.handle((ignored, error) -> error).join();
                assertInstanceOf(GraphMemoryException.class, cause);
                assertEquals(ErrorKind.INVALID_NAMESPACE, ((GraphMemoryException) cause).getKind());
            }
        }
    }

    @Test
    @DisplayName("community detection stores groups of connected entities")
    void testDetectCommunities() {
        ingestAll();

        List<CommunityNode> communities = memory.detectCommunities(NS).join();

        assertFalse(communities.isEmpty());
        Set<String> nodeIds = store.getNodes(NS).join().stream().map(EntityNode::getUuid).collect(Collectors.toSet());
        for (CommunityNode community : communities) {
            assertTrue(community.getMemberIds().size() >= 2);
            assertTrue(nodeIds.containsAll(community.getMemberIds()));
        }
        assertEquals(communities.size(), store.getCommunities(NS).join().size());
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("store, extractor and embedder are required")
        void testBuilderValidation() {
            assertThrows(IllegalStateException.class, () -> GraphMemory.builder()
                .extractor(extractor).embedder(new HashingEmbedder()).build());
            assertThrows(IllegalStateException.class, () -> GraphMemory.builder()
                .store(new InMemoryTemporalGraphStore()).embedder(new HashingEmbedder()).build());
            assertThrows(IllegalStateException.class, () -> GraphMemory.builder()
                .store(new InMemoryTemporalGraphStore()).extractor(extractor).build());
        }

        @Test
        @DisplayName("a closed memory rejects further calls")
        void testClosed() {
            memory.close();

            assertThrows(IllegalStateException.class, () -> memory.addEpisode(NS, BOB_BODY, T1));
            assertThrows(IllegalStateException.class, () -> memory.pointInTimeView(NS, T1));
            assertThrows(IllegalStateException.class, () -> memory.purgeNamespace(NS));
        }

        @Test
        @DisplayName("the configuration is exposed")
        void testConfig() {
            assertEquals(60, memory.getConfig().search().rrfK());
        }
    }
}
