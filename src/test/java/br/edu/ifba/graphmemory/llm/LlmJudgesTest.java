package br.edu.ifba.graphmemory.llm;

import br.edu.ifba.graphmemory.capability.CandidateEntity;
import br.edu.ifba.graphmemory.capability.DedupDecision;
import br.edu.ifba.graphmemory.capability.DedupRequest;
import br.edu.ifba.graphmemory.capability.EdgeJudgment;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.exception.EmptyResponseException;
import br.edu.ifba.graphmemory.exception.MalformedOutputException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmJudgesTest {

    private static final String NS = "acme";
    private static final Instant T1 = Instant.parse("2024-01-10T00:00:00Z");
    private static final Instant T2 = Instant.parse("2024-06-01T00:00:00Z");

    private static LLMFunction answering(String response) {
        return (prompt, system, history, kwargs) -> CompletableFuture.completedFuture(response);
    }

    private static EntityNode node(String name, String summary) {
        return EntityNode.builder().namespace(NS).name(name).label("Organization").summary(summary).validAt(T1).build();
    }

    @Nested
    @DisplayName("Deduplication judge")
    class DeduplicationTests {

        private final List<EntityNode> shortlist = List.of(
            node("Acme Corporation", "Maker of anvils"), node("Acme Bank", ""));

        private DedupDecision parse(String json) {
            JsonNode root = LlmJson.parseObject(json, "dedup-judge");
            return LlmDeduplicationJudge.parseDecision(root, shortlist);
        }

        @Test
        @DisplayName("an index picks the shortlisted entity")
        void testMatch() {
            DedupDecision decision = parse("{\"duplicate_index\": 1}");

            assertTrue(decision.isMatch());
            assertEquals(shortlist.get(1).getUuid(), decision.matchedUuid());
        }

        @ParameterizedTest
        @ValueSource(strings = {"{\"duplicate_index\": null}", "{\"duplicate_index\": -1}", "{}"})
        @DisplayName("null, negative or missing index means a new entity")
        void testNewEntity(String json) {
            assertFalse(parse(json).isMatch());
        }

        @ParameterizedTest
        @ValueSource(strings = {"{\"duplicate_index\": 2}", "{\"duplicate_index\": \"first\"}"})
        @DisplayName("an index outside the shortlist or not a number is malformed")
        void testMalformed(String json) {
            assertThrows(MalformedOutputException.class, () -> parse(json));
        }

        @Test
        @DisplayName("the prompt numbers the shortlist and describes the candidate")
        void testPrompt() {
            LlmDeduplicationJudge judge = new LlmDeduplicationJudge(answering("{}"));
            DedupRequest request = new DedupRequest(
                new CandidateEntity("Acme Corp", "Organization", "Anvil maker", Map.of()),
                shortlist, "Acme Corp shipped anvils.");

            String prompt = judge.buildPrompt(request);

            assertTrue(prompt.contains("New entity: Acme Corp (Organization) - Anvil maker"));
            assertTrue(prompt.contains("0. Acme Corporation (Organization) - Maker of anvils"));
            assertTrue(prompt.contains("1. Acme Bank (Organization)\n"));
            assertTrue(prompt.contains("Acme Corp shipped anvils."));
        }

        @Test
        @DisplayName("judge resolves through the language model")
        void testJudge() {
            LlmDeduplicationJudge judge = new LlmDeduplicationJudge(answering("```json\n{\"duplicate_index\": 0}\n```"));
            DedupRequest request = new DedupRequest(CandidateEntity.of("Acme Corp", "Organization"), shortlist, "");

            assertEquals(shortlist.get(0).getUuid(), judge.judge(request).join().matchedUuid());
        }
    }

    @Nested
    @DisplayName("Temporal judge")
    class TemporalTests {

        private final EntityEdge existing = edge("Bob is the VP of Sales", T1);
        private final EntityEdge incoming = edge("Alice is the VP of Sales", T2);

        private EntityEdge edge(String fact, Instant validAt) {
            return EntityEdge.builder().namespace(NS).sourceId("s").targetId("t")
                .relationName("HOLDS_ROLE").fact(fact).validAt(validAt).build();
        }

        @ParameterizedTest
        @CsvSource({
            "CONTRADICTS, CONTRADICTS",
            "corroborates, CORROBORATES",
            "Independent, INDEPENDENT"
        })
        @DisplayName("judgments are read case-insensitively")
        void testJudgment(String answer, EdgeJudgment expected) {
            LlmTemporalJudge judge = new LlmTemporalJudge(answering("{\"judgment\": \"" + answer + "\"}"));

            assertEquals(expected, judge.judge(incoming, existing).join());
        }

        @ParameterizedTest
        @ValueSource(strings = {"{\"judgment\": \"MAYBE\"}", "{\"verdict\": \"CONTRADICTS\"}"})
        @DisplayName("an unknown or missing judgment is malformed")
        void testMalformed(String response) {
            CompletableFuture<EdgeJudgment> future = new LlmTemporalJudge(answering(response)).judge(incoming, existing);

            CompletionException e = assertThrows(CompletionException.class, future::join);
            assertInstanceOf(MalformedOutputException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("Summarizers")
    class SummarizerTests {

        @Test
        @DisplayName("community summaries are trimmed text")
        void testCommunitySummary() {
            LlmCommunitySummarizer summarizer = new LlmCommunitySummarizer(answering("  Anvil makers.  "));

            assertEquals("Anvil makers.", summarizer.summarize(List.of(node("Acme", "")), List.of()).join());
        }

        @Test
        @DisplayName("an empty entity summary fails with an empty response error")
        void testEmptyEntitySummary() {
            LlmEntitySummarizer summarizer = new LlmEntitySummarizer(answering(" "));

            CompletionException e = assertThrows(CompletionException.class,
                () -> summarizer.summarize("Acme", List.of("Makes anvils", "Ships worldwide")).join());
            assertInstanceOf(EmptyResponseException.class, e.getCause());
        }
    }
}
