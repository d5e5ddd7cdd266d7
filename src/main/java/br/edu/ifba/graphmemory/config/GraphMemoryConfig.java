package br.edu.ifba.graphmemory.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Tunables of the graph memory.
 *
 * All properties are read with the prefix "graph-memory", e.g.
 * {@code graph-memory.search.rrf-k=60}. Thresholds, the RRF constant and the MMR
 * lambda are exposed here rather than hard-coded.
 */
@ConfigMapping(prefix = "graph-memory")
public interface GraphMemoryConfig {

    /**
     * Episode validation and context window.
     */
    Episode episode();

    /**
     * Extraction and reflexion loop.
     */
    Extraction extraction();

    /**
     * Capability call limits and retry policy.
     */
    Capability capability();

    /**
     * Entity deduplication.
     */
    Dedup dedup();

    /**
     * Temporal invalidation.
     */
    Invalidation invalidation();

    /**
     * Hybrid search.
     */
    Search search();

    /**
     * Community detection.
     */
    Community community();

    /**
     * Validates cross-property constraints.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        double weightSum = dedup().weight().jaccard() + dedup().weight().containment()
                         + dedup().weight().edit() + dedup().weight().abbreviation();
        if (Math.abs(weightSum - 1.0) > 0.01) {
            throw new IllegalArgumentException(
                String.format(
                    "Similarity weights must sum to 1.0, got %.3f (jaccard=%.2f, containment=%.2f, edit=%.2f, abbrev=%.2f)",
                    weightSum, dedup().weight().jaccard(), dedup().weight().containment(),
                    dedup().weight().edit(), dedup().weight().abbreviation()
                )
            );
        }
        ConfigChecks.requireUnit("dedup.prefilter-threshold", dedup().prefilterThreshold());
        ConfigChecks.requireUnit("dedup.initials-score", dedup().initialsScore());
        ConfigChecks.requireUnit("invalidation.relation-similarity-threshold", invalidation().relationSimilarityThreshold());
        ConfigChecks.requireUnit("search.mmr-lambda", search().mmrLambda());
        ConfigChecks.requirePositive("episode.max-body-length", episode().maxBodyLength());
        ConfigChecks.requirePositive("extraction.max-attempts", extraction().maxAttempts());
        ConfigChecks.requirePositive("capability.max-concurrent-calls", capability().maxConcurrentCalls());
        ConfigChecks.requirePositive("dedup.shortlist-size", dedup().shortlistSize());
        ConfigChecks.requirePositive("search.rrf-k", search().rrfK());
        ConfigChecks.requirePositive("search.max-depth", search().maxDepth());
        ConfigChecks.requirePositive("community.max-iterations", community().maxIterations());
        if (extraction().maxAttempts() > 3) {
            throw new IllegalArgumentException(
                String.format("extraction.max-attempts must be at most 3, got %d", extraction().maxAttempts()));
        }
        if (capability().maxRetries() < 0) {
            throw new IllegalArgumentException(
                String.format("capability.max-retries must be >= 0, got %d", capability().maxRetries()));
        }
        if (community().minSize() < 1) {
            throw new IllegalArgumentException(
                String.format("community.min-size must be >= 1, got %d", community().minSize()));
        }
    }

    interface Episode {
        /**
         * Maximum body length in characters.
         * Default: 20000
         */
        @WithDefault("20000")
        int maxBodyLength();

        /**
         * Number of most recent prior episodes handed to the extractor for coreference.
         * Default: 4
         */
        @WithDefault("4")
        int contextWindow();
    }

    interface Extraction {
        /**
         * Total extraction calls per episode, including reflexion re-extractions.
         * Default: 3
         */
        @WithDefault("3")
        int maxAttempts();

        /**
         * Whether to ask the extractor for missed entities at all.
         */
        @WithName("reflexion.enabled")
        @WithDefault("true")
        boolean reflexionEnabled();
    }

    interface Capability {
        /**
         * Upper bound of capability calls in flight across all namespaces.
         * Default: 16
         */
        @WithDefault("16")
        int maxConcurrentCalls();

        /**
         * Retries after the first attempt.
         * Default: 3
         */
        @WithDefault("3")
        int maxRetries();

        /**
         * First backoff delay, doubled on every retry.
         * Default: 200
         */
        @WithDefault("200")
        long initialDelayMs();

        /**
         * Backoff ceiling.
         * Default: 5000
         */
        @WithDefault("5000")
        long maxDelayMs();

        /**
         * Per-call timeout applied to reranking during search.
         * Default: 10000
         */
        @WithDefault("10000")
        long rerankTimeoutMs();

        /**
         * Per-call timeout applied to query embedding during search.
         * Default: 10000
         */
        @WithDefault("10000")
        long searchEmbedTimeoutMs();
    }

    interface Dedup {
        /**
         * Minimum pre-filter score for an existing entity to enter the shortlist.
         * Default: 0.5
         */
        @WithDefault("0.5")
        double prefilterThreshold();

        /**
         * Shortlist size handed to the judgment capability.
         * Default: 10
         */
        @WithDefault("10")
        int shortlistSize();

        /**
         * Score assigned when one name is the initials form of the other ("J. Smith" / "John Smith").
         * Default: 0.9
         */
        @WithDefault("0.9")
        double initialsScore();

        /**
         * Resolve exact normalized-name matches of the same type without asking the judge.
         */
        @WithDefault("true")
        boolean exactMatchFastPath();

        Weight weight();

        interface Weight {
            @WithDefault("0.35")
            double jaccard();

            @WithDefault("0.25")
            double containment();

            @WithDefault("0.30")
            double edit();

            @WithDefault("0.10")
            double abbreviation();
        }
    }

    interface Invalidation {
        /**
         * Cosine similarity above which two relation names are considered overlapping.
         * Default: 0.85
         */
        @WithDefault("0.85")
        double relationSimilarityThreshold();

        /**
         * Also consider open edges that share only one endpoint and the relation name,
         * so that "Alice is VP" can supersede "Bob is VP".
         */
        @WithDefault("true")
        boolean sharedEndpointCandidates();
    }

    interface Search {
        /**
         * Reciprocal rank fusion constant.
         * Default: 60
         */
        @WithDefault("60")
        int rrfK();

        /**
         * Relevance/diversity trade-off of maximal marginal relevance.
         * Default: 0.5
         */
        @WithDefault("0.5")
        double mmrLambda();

        /**
         * Candidates kept per retrieval method before fusion.
         * Default: 50
         */
        @WithDefault("50")
        int perMethodLimit();

        /**
         * Results returned when the request does not set a limit.
         * Default: 10
         */
        @WithDefault("10")
        int defaultLimit();

        /**
         * Breadth-first hop bound of graph traversal.
         * Default: 3
         */
        @WithDefault("3")
        int maxDepth();

        /**
         * Candidates handed to the reranker.
         * Default: 100
         */
        @WithDefault("100")
        int rerankTopN();

        @WithName("bm25.k1")
        @WithDefault("1.2")
        double bm25K1();

        @WithName("bm25.b")
        @WithDefault("0.75")
        double bm25B();
    }

    interface Community {
        /**
         * Label propagation pass limit.
         * Default: 100
         */
        @WithDefault("100")
        int maxIterations();

        /**
         * Smallest community kept.
         * Default: 2
         */
        @WithDefault("2")
        int minSize();

        /**
         * Seed of the node visiting order.
         */
        @WithDefault("42")
        long seed();

        /**
         * Highest-degree members handed to the summarizer.
         * Default: 10
         */
        @WithDefault("10")
        int summaryMembers();

        /**
         * Run incremental detection after every persisted episode.
         */
        @WithDefault("false")
        boolean updateOnIngest();
    }
}
