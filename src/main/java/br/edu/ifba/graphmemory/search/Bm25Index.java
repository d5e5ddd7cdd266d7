package br.edu.ifba.graphmemory.search;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Okapi BM25 over a small in-memory document set.
 *
 * <pre>
 * idf(t)      = ln(1 + (N - df(t) + 0.5) / (df(t) + 0.5))
 * score(d, q) = sum over t in q of idf(t) * tf(t, d) * (k1 + 1) / (tf(t, d) + k1 * (1 - b + b * |d| / avgdl))
 * </pre>
 */
public class Bm25Index {

    private final double k1;
    private final double b;
    private final Map<String, Map<String, Integer>> termFrequencies = new LinkedHashMap<>();
    private final Map<String, Integer> lengths = new HashMap<>();
    private final Map<String, Integer> documentFrequencies = new HashMap<>();
    private long totalLength = 0;

    public Bm25Index(double k1, double b) {
        if (k1 < 0) {
            throw new IllegalArgumentException("k1 must be >= 0, got: " + k1);
        }
        if (b < 0 || b > 1) {
            throw new IllegalArgumentException("b must be between 0 and 1, got: " + b);
        }
        this.k1 = k1;
        this.b = b;
    }

    /**
     * Indexes a document. An id added twice keeps its first text.
     */
    public void add(@NotNull String id, @NotNull String text) {
        if (termFrequencies.containsKey(id)) {
            return;
        }
        List<String> tokens = tokenize(text);
        Map<String, Integer> tf = new HashMap<>();
        for (String token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        for (String term : tf.keySet()) {
            documentFrequencies.merge(term, 1, Integer::sum);
        }
        termFrequencies.put(id, tf);
        lengths.put(id, tokens.size());
        totalLength += tokens.size();
    }

    public int size() {
        return termFrequencies.size();
    }

    /**
     * Documents sharing at least one term with the query, best first, at most {@code limit}.
     */
    @NotNull
    public List<Scored> search(@NotNull String query, int limit) {
        Set<String> terms = new LinkedHashSet<>(tokenize(query));
        if (terms.isEmpty() || termFrequencies.isEmpty()) {
            return List.of();
        }
        int n = termFrequencies.size();
        double averageLength = (double) totalLength / n;

        List<Scored> scored = new ArrayList<>();
        for (Map.Entry<String, Map<String, Integer>> document : termFrequencies.entrySet()) {
            double score = 0.0;
            int length = lengths.get(document.getKey());
            for (String term : terms) {
                Integer tf = document.getValue().get(term);
                if (tf == null) {
                    continue;
                }
                int df = documentFrequencies.get(term);
                double idf = Math.log(1.0 + (n - df + 0.5) / (df + 0.5));
                double norm = averageLength > 0 ? length / averageLength : 0.0;
                score += idf * tf * (k1 + 1) / (tf + k1 * (1 - b + b * norm));
            }
            if (score > 0) {
                scored.add(new Scored(document.getKey(), score));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed().thenComparing(Scored::id));
        return scored.size() > limit ? new ArrayList<>(scored.subList(0, limit)) : scored;
    }

    /**
     * Lowercased runs of letters and digits.
     */
    @NotNull
    static List<String> tokenize(@NotNull String text) {
        List<String> tokens = new ArrayList<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public record Scored(@NotNull String id, double score) {
    }
}
