package br.edu.ifba.graphmemory.community;

import br.edu.ifba.graphmemory.capability.CapabilityGate;
import br.edu.ifba.graphmemory.capability.CommunitySummarizer;
import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.exception.RefusedException;
import br.edu.ifba.graphmemory.storage.GraphWriteBatch;
import br.edu.ifba.graphmemory.storage.impl.InMemoryTemporalGraphStore;
import br.edu.ifba.graphmemory.support.HashingEmbedder;
import br.edu.ifba.graphmemory.support.TestConfigs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommunityDetectorTest {

    private static final String NS = "acme";
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final GraphMemoryConfig config = TestConfigs.fast();
    private final CapabilityGate gate = new CapabilityGate(config.capability());

    private InMemoryTemporalGraphStore store;
    private EntityNode alice;
    private EntityNode bob;
    private EntityNode carol;
    private EntityNode dave;
    private EntityNode erin;
    private EntityNode frank;

    @BeforeEach
    void setUp() {
        store = new InMemoryTemporalGraphStore();
        store.initialize().join();
        alice = person("Alice");
        bob = person("Bob");
        carol = person("Carol");
        dave = person("Dave");
        erin = person("Erin");
        frank = person("Frank");
        store.commit(GraphWriteBatch.builder(NS)
            .nodes(List.of(alice, bob, carol, dave, erin, frank))
            .edges(List.of(
                link(alice, bob), link(bob, carol), link(carol, alice),
                link(dave, erin)))
            .build()).join();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static EntityNode person(String name) {
        return EntityNode.builder().namespace(NS).name(name).label("Person").validAt(T0).build();
    }

    private static EntityEdge link(EntityNode a, EntityNode b) {
        return EntityEdge.builder()
            .namespace(NS)
            .sourceId(a.getUuid())
            .targetId(b.getUuid())
            .relationName("WORKS_WITH")
            .fact(a.getName() + " works with " + b.getName())
            .validAt(T0)
            .build();
    }

    private CommunityDetector detector(CommunitySummarizer summarizer) {
        return new CommunityDetector(store, gate, new HashingEmbedder(), summarizer, config.community());
    }

    private static Set<String> ids(EntityNode... nodes) {
        Set<String> ids = new HashSet<>();
        for (EntityNode node : nodes) {
            ids.add(node.getUuid());
        }
        return ids;
    }

    private static CommunityNode containing(List<CommunityNode> communities, EntityNode member) {
        return communities.stream()
            .filter(c -> c.getMemberIds().contains(member.getUuid()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no community contains " + member.getName()));
    }

    @Test
    @DisplayName("connected groups become communities, singletons are dropped")
    void testDetect() {
        List<CommunityNode> communities = detector(null).detect(NS);

        assertEquals(2, communities.size());
        CommunityNode team = containing(communities, alice);
        assertEquals(ids(alice, bob, carol), Set.copyOf(team.getMemberIds()));
        assertEquals("Alice, Bob, Carol", team.getName());
        assertEquals("cluster of 3 related entities", team.getSummary());
        assertNotNull(team.getSummaryEmbedding());
        assertEquals(ids(dave, erin), Set.copyOf(containing(communities, dave).getMemberIds()));
        assertTrue(communities.stream().noneMatch(c -> c.getMemberIds().contains(frank.getUuid())));
        assertEquals(2, store.getCommunities(NS).join().size());
    }

    @Test
    @DisplayName("summaries come from the summarizer, with a fallback when it fails")
    void testSummaries() {
        AtomicInteger calls = new AtomicInteger();
        CommunitySummarizer summarizer = (members, facts) -> {
            calls.incrementAndGet();
            if (members.size() == 2) {
                return CompletableFuture.failedFuture(new RefusedException("no"));
            }
            return CompletableFuture.completedFuture("  The core team, " + facts.size() + " working relationships ");
        };

        List<CommunityNode> communities = detector(summarizer).detect(NS);

        assertEquals("The core team, 3 working relationships", containing(communities, alice).getSummary());
        assertEquals("cluster of 2 related entities", containing(communities, dave).getSummary());
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("closed edges do not hold a community together")
    void testClosedEdgesIgnored() {
        EntityEdge pair = store.getEdgesBetween(dave.getUuid(), erin.getUuid(), null).join().get(0);
        store.invalidateEdge(pair.getUuid(), T0.plusSeconds(60), List.of()).join();

        List<CommunityNode> communities = detector(null).detect(NS);

        assertEquals(1, communities.size());
        assertEquals(ids(alice, bob, carol), Set.copyOf(communities.get(0).getMemberIds()));
    }

    @Test
    @DisplayName("a refresh only rebuilds the communities around the changed entities")
    void testRefresh() {
        CommunityDetector detector = detector(null);
        List<CommunityNode> initial = detector.detect(NS);
        CommunityNode team = containing(initial, alice);
        EntityNode gina = person("Gina");
        store.commit(GraphWriteBatch.builder(NS).node(gina).edge(link(erin, gina)).build()).join();

        List<CommunityNode> refreshed = detector.refresh(NS, List.of(gina.getUuid()));

        assertEquals(1, refreshed.size());
        assertEquals(ids(dave, erin, gina), Set.copyOf(refreshed.get(0).getMemberIds()));
        List<CommunityNode> stored = store.getCommunities(NS).join();
        assertEquals(2, stored.size());
        assertEquals(team.getUuid(), containing(stored, alice).getUuid());
        assertEquals(refreshed.get(0).getUuid(), containing(stored, gina).getUuid());
    }

    @Test
    @DisplayName("an empty change set refreshes nothing")
    void testEmptyRefresh() {
        CommunityDetector detector = detector(null);
        detector.detect(NS);

        assertTrue(detector.refresh(NS, List.of()).isEmpty());
        assertEquals(2, store.getCommunities(NS).join().size());
    }
}
