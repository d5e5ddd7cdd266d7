package br.edu.ifba.graphmemory.storage.impl;

import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.core.GraphKind;
import br.edu.ifba.graphmemory.core.GraphSnapshot;
import br.edu.ifba.graphmemory.storage.EdgeInvalidation;
import br.edu.ifba.graphmemory.storage.GraphWriteBatch;
import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behaviour every {@link TemporalGraphStore} must share.
 *
 * <p>Subclasses provide a fresh, initialized store per test.</p>
 */
public abstract class TemporalGraphStoreContractTest {

    protected static final String NS = "acme";
    protected static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    protected TemporalGraphStore store;

    protected abstract TemporalGraphStore createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
        store.initialize().join();
    }

    @AfterEach
    void tearDownStore() {
        if (store != null) {
            store.close();
        }
    }

    protected static EntityNode node(String namespace, String name) {
        return EntityNode.builder().namespace(namespace).name(name).label("Person").validAt(T0).build();
    }

    protected static EntityEdge edge(String namespace, EntityNode source, EntityNode target, String relation, Instant validAt) {
        return EntityEdge.builder()
            .namespace(namespace)
            .sourceId(source.getUuid())
            .targetId(target.getUuid())
            .relationName(relation)
            .fact(source.getName() + " " + relation + " " + target.getName())
            .validAt(validAt)
            .build();
    }

    private static Throwable causeOf(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }

    @Nested
    @DisplayName("commit")
    class Commit {

        @Test
        @DisplayName("episode, nodes and edges of a batch are all readable afterwards")
        void testCommitAndRead() {
            Episode episode = Episode.builder().namespace(NS).body("Alice knows Bob").referenceTime(T0).build();
            EntityNode alice = node(NS, "Alice");
            EntityNode bob = node(NS, "Bob");
            EntityEdge knows = edge(NS, alice, bob, "KNOWS", T0).withFactEmbedding(new float[] {0.5f, -0.25f, 1.0f});

            store.commit(GraphWriteBatch.builder(NS).episode(episode).node(alice).node(bob).edge(knows).build()).join();

            assertEquals("Alice knows Bob", store.getEpisode(episode.getUuid()).join().getBody());
            assertEquals("Alice", store.getNode(alice.getUuid()).join().getName());
            EntityEdge stored = store.getEdge(knows.getUuid()).join();
            assertEquals("KNOWS", stored.getRelationName());
            assertEquals(T0, stored.getValidAt());
            assertNull(stored.getInvalidAt());
            assertArrayEquals(new float[] {0.5f, -0.25f, 1.0f}, stored.getFactEmbedding());
            assertEquals(1, store.getEdgesBetween(alice.getUuid(), bob.getUuid(), "KNOWS").join().size());
            assertTrue(store.getEdgesBetween(alice.getUuid(), bob.getUuid(), "LIKES").join().isEmpty());
            assertEquals(1, store.getEdgesForNode(bob.getUuid()).join().size());
        }

        @Test
        @DisplayName("unknown ids read as null")
        void testUnknownIds() {
            assertNull(store.getNode("missing").join());
            assertNull(store.getEdge("missing").join());
            assertNull(store.getEpisode("missing").join());
        }

        @Test
        @DisplayName("a batch mixing namespaces is rejected")
        void testNamespaceMismatch() {
            EntityNode other = node("other", "Mallory");

            CompletionException error = assertThrows(CompletionException.class,
                () -> store.commit(GraphWriteBatch.builder(NS).node(other).build()).join());
            assertInstanceOf(IllegalStateException.class, causeOf(error));
            assertNull(store.getNode(other.getUuid()).join());
        }
    }

    @Nested
    @DisplayName("open-edge exclusivity")
    class Exclusivity {

        @Test
        @DisplayName("a second open edge on the same triple is rejected and nothing of the batch is written")
        void testSecondOpenEdgeRejected() {
            EntityNode alice = node(NS, "Alice");
            EntityNode acme = node(NS, "Acme");
            store.commit(GraphWriteBatch.builder(NS).node(alice).node(acme)
                .edge(edge(NS, alice, acme, "WORKS_FOR", T0)).build()).join();

            EntityNode bystander = node(NS, "Bystander");
            EntityEdge duplicate = edge(NS, alice, acme, "WORKS_FOR", T0.plusSeconds(60));
            CompletionException error = assertThrows(CompletionException.class,
                () -> store.commit(GraphWriteBatch.builder(NS).node(bystander).edge(duplicate).build()).join());

            assertInstanceOf(IllegalStateException.class, causeOf(error));
            assertNull(store.getNode(bystander.getUuid()).join());
            assertNull(store.getEdge(duplicate.getUuid()).join());
        }

        @Test
        @DisplayName("closing the open edge and adding its successor in one batch is allowed")
        void testSupersedeInOneBatch() {
            EntityNode alice = node(NS, "Alice");
            EntityNode acme = node(NS, "Acme");
            EntityEdge first = edge(NS, alice, acme, "WORKS_FOR", T0);
            store.commit(GraphWriteBatch.builder(NS).node(alice).node(acme).edge(first).build()).join();

            Instant change = T0.plus(Duration.ofDays(30));
            EntityEdge second = edge(NS, alice, acme, "WORKS_FOR", change);
            store.commit(GraphWriteBatch.builder(NS)
                .invalidation(new EdgeInvalidation(first.getUuid(), change, List.of(second.getUuid())))
                .edge(second)
                .build()).join();

            EntityEdge closed = store.getEdge(first.getUuid()).join();
            assertEquals(change, closed.getInvalidAt());
            assertEquals(List.of(second.getUuid()), closed.getInvalidatedBy());
            assertTrue(store.getEdge(second.getUuid()).join().isOpen());
        }

        @Test
        @DisplayName("edges with the same endpoints but different relations may both be open")
        void testDifferentRelations() {
            EntityNode alice = node(NS, "Alice");
            EntityNode bob = node(NS, "Bob");
            store.commit(GraphWriteBatch.builder(NS).node(alice).node(bob)
                .edge(edge(NS, alice, bob, "KNOWS", T0))
                .edge(edge(NS, alice, bob, "MANAGES", T0))
                .build()).join();

            assertEquals(2, store.getEdgesBetween(alice.getUuid(), bob.getUuid(), null).join().size());
        }
    }

    @Nested
    @DisplayName("invalidated edges")
    class InvalidatedEdges {

        @Test
        @DisplayName("only invalidatedBy may grow once an edge is closed")
        void testClosedEdgeIsImmutable() {
            EntityNode alice = node(NS, "Alice");
            EntityNode acme = node(NS, "Acme");
            EntityEdge edge = edge(NS, alice, acme, "WORKS_FOR", T0);
            store.commit(GraphWriteBatch.builder(NS).node(alice).node(acme).edge(edge).build()).join();
            Instant end = T0.plusSeconds(3600);
            store.invalidateEdge(edge.getUuid(), end, List.of("episode-1")).join();

            EntityEdge closed = store.getEdge(edge.getUuid()).join();
            EntityEdge rewritten = closed.toBuilder().fact("Alice founded Acme").build();
            CompletionException error = assertThrows(CompletionException.class,
                () -> store.upsertEdge(rewritten).join());
            assertInstanceOf(IllegalStateException.class, causeOf(error));

            store.invalidateEdge(edge.getUuid(), end.plusSeconds(60), List.of("episode-2")).join();
            EntityEdge after = store.getEdge(edge.getUuid()).join();
            assertEquals(end, after.getInvalidAt());
            assertEquals(List.of("episode-1", "episode-2"), after.getInvalidatedBy());
            assertEquals(edge.getFact(), after.getFact());
        }
    }

    @Nested
    @DisplayName("point-in-time view")
    class PointInTime {

        @Test
        @DisplayName("returns exactly the nodes and edges with validAt <= t < invalidAt")
        void testRandomIntervals() {
            Random random = new Random(7);
            EntityNode hub = node(NS, "Hub");
            GraphWriteBatch.Builder batch = GraphWriteBatch.builder(NS).node(hub);
            List<EntityEdge> edges = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                EntityNode spoke = node(NS, "Spoke " + i);
                Instant validAt = T0.plusSeconds(random.nextInt(1000));
                Instant invalidAt = random.nextBoolean() ? validAt.plusSeconds(1 + random.nextInt(500)) : null;
                EntityEdge edge = edge(NS, hub, spoke, "LINKS", validAt).toBuilder().invalidAt(invalidAt).build();
                batch.node(spoke).edge(edge);
                edges.add(edge);
            }
            store.commit(batch.build()).join();

            for (int sample = 0; sample < 25; sample++) {
                Instant at = T0.plusSeconds(random.nextInt(1600));
                Set<String> expected = new HashSet<>();
                for (EntityEdge edge : edges) {
                    boolean started = !edge.getValidAt().isAfter(at);
                    boolean notEnded = edge.getInvalidAt() == null || at.isBefore(edge.getInvalidAt());
                    if (started && notEnded) {
                        expected.add(edge.getUuid());
                    }
                }
                Set<String> actual = new HashSet<>();
                for (EntityEdge edge : store.pointInTimeView(NS, at).join().edges()) {
                    actual.add(edge.getUuid());
                }
                assertEquals(expected, actual, "edges valid at " + at);
            }
        }

        @Test
        @DisplayName("an edge is valid at its validAt and no longer valid at its invalidAt")
        void testIntervalBoundaries() {
            EntityNode alice = node(NS, "Alice");
            EntityNode acme = node(NS, "Acme");
            Instant end = T0.plusSeconds(100);
            EntityEdge edge = edge(NS, alice, acme, "WORKS_FOR", T0).toBuilder().invalidAt(end).build();
            store.commit(GraphWriteBatch.builder(NS).node(alice).node(acme).edge(edge).build()).join();

            assertEquals(1, store.pointInTimeView(NS, T0).join().edges().size());
            assertEquals(1, store.pointInTimeView(NS, end.minusMillis(1)).join().edges().size());
            assertTrue(store.pointInTimeView(NS, end).join().edges().isEmpty());
            assertTrue(store.pointInTimeView(NS, T0.minusMillis(1)).join().edges().isEmpty());
        }

        @Test
        @DisplayName("historical and far-future instants are stored exactly and bound views")
        void testDistantInstants() {
            Instant founded = Instant.parse("1602-03-20T00:00:00.123456789Z");
            Instant dissolved = Instant.parse("2400-01-01T00:00:00Z");
            EntityNode voc = EntityNode.builder().namespace(NS).name("Dutch East India Company")
                .label("Organization").validAt(founded).build();
            EntityNode amsterdam = EntityNode.builder().namespace(NS).name("Amsterdam")
                .label("Location").validAt(founded).build();
            EntityEdge seated = edge(NS, voc, amsterdam, "HEADQUARTERED_IN", founded)
                .toBuilder().invalidAt(dissolved).build();
            store.commit(GraphWriteBatch.builder(NS).node(voc).node(amsterdam).edge(seated).build()).join();

            EntityEdge stored = store.getEdge(seated.getUuid()).join();
            assertEquals(founded, stored.getValidAt());
            assertEquals(dissolved, stored.getInvalidAt());
            assertEquals(founded, store.getNode(voc.getUuid()).join().getValidAt());

            GraphSnapshot in1650 = store.pointInTimeView(NS, Instant.parse("1650-01-01T00:00:00Z")).join();
            assertEquals(2, in1650.nodes().size());
            assertEquals(1, in1650.edges().size());
            assertTrue(store.pointInTimeView(NS, founded.minusNanos(1)).join().edges().isEmpty());
            assertTrue(store.pointInTimeView(NS, Instant.parse("2500-01-01T00:00:00Z")).join().edges().isEmpty());
        }

        @Test
        @DisplayName("superseded nodes disappear from views after the merge")
        void testSupersededNode() {
            EntityNode john = node(NS, "John Smith");
            EntityNode j = node(NS, "J. Smith");
            Instant mergedAt = T0.plusSeconds(500);
            store.commit(GraphWriteBatch.builder(NS).node(john).node(j.supersede(john.getUuid(), mergedAt)).build()).join();

            GraphSnapshot before = store.pointInTimeView(NS, T0.plusSeconds(10)).join();
            GraphSnapshot after = store.pointInTimeView(NS, mergedAt).join();
            assertEquals(2, before.nodes().size());
            assertEquals(1, after.nodes().size());
            assertEquals(List.of(john.getUuid()), store.getActiveNodes(NS).join().stream().map(EntityNode::getUuid).toList());
        }
    }

    @Nested
    @DisplayName("namespaces")
    class Namespaces {

        @Test
        @DisplayName("reads never cross namespaces and purge only touches its own")
        void testIsolationAndPurge() {
            EntityNode alice = node(NS, "Alice");
            EntityNode acme = node(NS, "Acme");
            EntityNode eve = node("other", "Eve");
            store.commit(GraphWriteBatch.builder(NS).node(alice).node(acme)
                .edge(edge(NS, alice, acme, "WORKS_FOR", T0)).build()).join();
            store.commit(GraphWriteBatch.builder("other").node(eve).build()).join();

            assertEquals(2, store.getNodes(NS).join().size());
            assertEquals(1, store.getNodes("other").join().size());
            assertEquals(1, store.getByNamespace(NS, GraphKind.EDGE, null, null).join().size());

            store.purgeNamespace(NS).join();

            assertTrue(store.getNodes(NS).join().isEmpty());
            assertTrue(store.getEdges(NS).join().isEmpty());
            assertNull(store.getNode(alice.getUuid()).join());
            assertNotNull(store.getNode(eve.getUuid()).join());
        }

        @Test
        @DisplayName("recent episodes are the latest by reference time, oldest first")
        void testRecentEpisodes() {
            for (int i = 0; i < 5; i++) {
                Episode episode = Episode.builder().namespace(NS).body("episode " + i)
                    .referenceTime(T0.plusSeconds(i * 60L)).build();
                store.commit(GraphWriteBatch.builder(NS).episode(episode).build()).join();
            }

            List<Episode> recent = store.getRecentEpisodes(NS, 3).join();

            assertEquals(List.of("episode 2", "episode 3", "episode 4"),
                recent.stream().map(Episode::getBody).toList());
            assertTrue(store.getRecentEpisodes("other", 3).join().isEmpty());
        }

        @Test
        @DisplayName("limit and since filter getByNamespace")
        void testByNamespaceFilters() {
            Instant before = Instant.now().minusSeconds(1);
            for (int i = 0; i < 4; i++) {
                store.upsertNode(node(NS, "Person " + i)).join();
            }

            assertEquals(2, store.getByNamespace(NS, GraphKind.NODE, null, 2).join().size());
            assertEquals(4, store.getByNamespace(NS, GraphKind.NODE, before, null).join().size());
            assertTrue(store.getByNamespace(NS, GraphKind.NODE, Instant.now().plusSeconds(60), null).join().isEmpty());
        }
    }

    @Nested
    @DisplayName("communities")
    class Communities {

        @Test
        @DisplayName("replacing around affected nodes keeps unrelated communities")
        void testReplaceAffected() {
            CommunityNode sales = new CommunityNode(null, NS, "sales", "sales team", 0, List.of("a", "b"), null, null);
            CommunityNode ops = new CommunityNode(null, NS, "ops", "ops team", 0, List.of("c", "d"), null, new float[] {1f, 0f});
            store.replaceCommunities(NS, null, List.of(sales, ops)).join();

            CommunityNode merged = new CommunityNode(null, NS, "sales+", "bigger sales team", 0, List.of("a", "b", "e"), null, null);
            store.replaceCommunities(NS, List.of("e", "a"), List.of(merged)).join();

            List<CommunityNode> communities = store.getCommunities(NS).join();
            Set<String> names = new HashSet<>();
            for (CommunityNode community : communities) {
                names.add(community.getName());
            }
            assertEquals(Set.of("sales+", "ops"), names);
        }

        @Test
        @DisplayName("a full replacement removes every community of the namespace")
        void testReplaceAll() {
            store.replaceCommunities(NS, null,
                List.of(new CommunityNode(null, NS, "x", "x", 0, List.of("a", "b"), null, null))).join();
            store.replaceCommunities(NS, null, List.of()).join();

            assertFalse(store.getCommunities(NS).join().iterator().hasNext());
        }
    }
}
