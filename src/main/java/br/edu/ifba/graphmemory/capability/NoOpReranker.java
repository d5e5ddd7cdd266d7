package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A reranker that keeps the incoming order.
 *
 * <p>Candidates are assigned synthetic relevance scores based on their position,
 * with the first candidate receiving 1.0 and subsequent ones 0.95, 0.90, ...,
 * clamped to a minimum of 0.1.</p>
 */
public class NoOpReranker implements Reranker {

    private static final Logger logger = LoggerFactory.getLogger(NoOpReranker.class);
    private static final String PROVIDER_NAME = "none";

    @Override
    public CompletableFuture<List<RerankScore>> score(@NotNull String query, @NotNull List<RerankCandidate> candidates) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");

        logger.debug("NoOpReranker: returning {} candidates in original order", candidates.size());

        List<RerankScore> results = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            double score = Math.max(0.1, 1.0 - (i * 0.05));
            results.add(new RerankScore(candidates.get(i).id(), score));
        }
        return CompletableFuture.completedFuture(results);
    }

    @Override
    @NotNull
    public String getProviderName() {
        return PROVIDER_NAME;
    }
}
