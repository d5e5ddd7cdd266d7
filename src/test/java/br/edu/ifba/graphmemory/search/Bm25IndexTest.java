package br.edu.ifba.graphmemory.search;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Bm25IndexTest {

    private Bm25Index index;

    @BeforeEach
    void setUp() {
        index = new Bm25Index(1.2, 0.75);
        index.add("alice", "Alice works at Acme");
        index.add("bob", "Bob works at Globex");
        index.add("review", "Acme Acme Acme holds quarterly review");
    }

    private List<String> ids(String query, int limit) {
        return index.search(query, limit).stream().map(Bm25Index.Scored::id).toList();
    }

    @Test
    @DisplayName("only documents sharing a query term are returned, higher term frequency first")
    void testTermFrequency() {
        assertEquals(List.of("review", "alice"), ids("acme", 10));
    }

    @Test
    @DisplayName("rare terms weigh more than common ones")
    void testInverseDocumentFrequency() {
        List<Bm25Index.Scored> scored = index.search("alice works", 10);

        assertEquals("alice", scored.get(0).id());
        assertEquals("bob", scored.get(1).id());
        assertTrue(scored.get(0).score() > 2 * scored.get(1).score());
    }

    @Test
    @DisplayName("matching ignores case and punctuation")
    void testTokenization() {
        assertEquals(List.of("bob"), ids("GLOBEX!", 10));
        assertEquals(List.of("acme", "acme", "s", "q3"), Bm25Index.tokenize("ACME, Acme's Q3"));
    }

    @Test
    void testLimitAndEmptyQueries() {
        assertEquals(1, index.search("acme", 1).size());
        assertTrue(index.search("   ", 10).isEmpty());
        assertTrue(index.search("unrelated", 10).isEmpty());
        assertTrue(new Bm25Index(1.2, 0.75).search("acme", 10).isEmpty());
    }

    @Test
    @DisplayName("an id added twice keeps its first text")
    void testDuplicateId() {
        index.add("alice", "Globex Globex Globex");

        assertEquals(3, index.size());
        assertEquals(List.of("bob"), ids("globex", 10));
    }

    @Test
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new Bm25Index(-0.1, 0.75));
        assertThrows(IllegalArgumentException.class, () -> new Bm25Index(1.2, 1.5));
    }
}
