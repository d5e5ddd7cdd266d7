package br.edu.ifba.graphmemory.search;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal rank fusion: {@code score(d) = sum over rankings of 1 / (k + rank(d))}, rank starting at 1.
 *
 * <p>Scores are positive and only meaningful relative to each other. Adding a ranking never
 * lowers a document's score, and a document returned by several rankings beats one returned
 * by a single ranking at the same position.</p>
 */
public final class ReciprocalRankFusion {

    private ReciprocalRankFusion() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param rankings ids ordered best first; duplicates within one ranking count once, at their best rank
     * @param k        rank constant, 60 by default
     * @return fused scores, best first; ties keep the better best rank, then id order
     */
    @NotNull
    public static LinkedHashMap<String, Double> fuse(@NotNull List<List<String>> rankings, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0, got: " + k);
        }
        Map<String, Double> scores = new HashMap<>();
        Map<String, Integer> bestRank = new HashMap<>();
        for (List<String> ranking : rankings) {
            Map<String, Boolean> seen = new HashMap<>();
            for (int i = 0; i < ranking.size(); i++) {
                String id = ranking.get(i);
                if (seen.putIfAbsent(id, Boolean.TRUE) != null) {
                    continue;
                }
                int rank = i + 1;
                scores.merge(id, 1.0 / (k + rank), Double::sum);
                bestRank.merge(id, rank, Math::min);
            }
        }

        List<String> ids = new ArrayList<>(scores.keySet());
        ids.sort(Comparator.<String>comparingDouble(scores::get).reversed()
            .thenComparingInt(bestRank::get)
            .thenComparing(Comparator.naturalOrder()));

        LinkedHashMap<String, Double> fused = new LinkedHashMap<>();
        for (String id : ids) {
            fused.put(id, scores.get(id));
        }
        return fused;
    }
}
