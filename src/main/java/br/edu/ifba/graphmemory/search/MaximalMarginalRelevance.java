package br.edu.ifba.graphmemory.search;

import br.edu.ifba.graphmemory.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy maximal marginal relevance re-ordering.
 *
 * <p>Each step picks the candidate maximizing
 * {@code lambda * rel(d) - (1 - lambda) * max sim(d, selected)}. {@code rel(d)} is the cosine to
 * the query embedding, or without one the candidate's fused score min-max scaled to [0, 1] over
 * the candidates, so the fused order still counts when semantic search did not run. Candidates without an
 * embedding cannot be compared and keep their incoming order after the embedded ones.</p>
 */
public final class MaximalMarginalRelevance {

    private MaximalMarginalRelevance() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param candidates ids in their current order
     * @param embeddings embedding per id; missing or null entries are not re-ordered
     * @param query      query embedding, may be null
     * @param fused      fused score per id, used as relevance when {@code query} is null; missing ids score zero
     * @param lambda     1.0 is pure relevance, 0.0 pure diversity
     * @return re-ordered ids, same elements as {@code candidates}
     */
    @NotNull
    public static List<String> rerank(
            @NotNull List<String> candidates,
            @NotNull Map<String, float[]> embeddings,
            @Nullable float[] query,
            @NotNull Map<String, Double> fused,
            double lambda) {
        if (Double.isNaN(lambda) || lambda < 0.0 || lambda > 1.0) {
            throw new IllegalArgumentException("lambda must be between 0.0 and 1.0, got: " + lambda);
        }
        Map<String, float[]> remaining = new LinkedHashMap<>();
        List<String> unembedded = new ArrayList<>();
        for (String id : candidates) {
            float[] embedding = embeddings.get(id);
            if (embedding != null && embedding.length > 0) {
                remaining.putIfAbsent(id, embedding);
            } else if (!unembedded.contains(id)) {
                unembedded.add(id);
            }
        }

        double minFused = Double.POSITIVE_INFINITY;
        double maxFused = Double.NEGATIVE_INFINITY;
        for (String id : remaining.keySet()) {
            double score = fused.getOrDefault(id, 0.0);
            minFused = Math.min(minFused, score);
            maxFused = Math.max(maxFused, score);
        }
        double fusedRange = maxFused - minFused;

        List<String> selected = new ArrayList<>(candidates.size());
        List<float[]> selectedEmbeddings = new ArrayList<>();
        while (!remaining.isEmpty()) {
            String best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (Map.Entry<String, float[]> entry : remaining.entrySet()) {
                double relevance;
                if (query != null) {
                    relevance = EmbeddingUtil.safeCosine(query, entry.getValue());
                } else {
                    relevance = fusedRange > 0.0
                        ? (fused.getOrDefault(entry.getKey(), 0.0) - minFused) / fusedRange
                        : 1.0;
                }
                double redundancy = 0.0;
                for (float[] chosen : selectedEmbeddings) {
                    redundancy = Math.max(redundancy, EmbeddingUtil.safeCosine(chosen, entry.getValue()));
                }
                double score = lambda * relevance - (1.0 - lambda) * redundancy;
                // strict comparison keeps the earlier candidate on ties
                if (score > bestScore) {
                    bestScore = score;
                    best = entry.getKey();
                }
            }
            selectedEmbeddings.add(remaining.remove(best));
            selected.add(best);
        }
        selected.addAll(unembedded);
        return selected;
    }
}
