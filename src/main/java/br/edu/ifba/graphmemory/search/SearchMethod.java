package br.edu.ifba.graphmemory.search;

/**
 * Retrieval methods fused by the search engine.
 */
public enum SearchMethod {
    /** Cosine similarity between the query embedding and stored embeddings. */
    SEMANTIC,
    /** Okapi BM25 over facts, names and summaries. */
    BM25,
    /** Breadth-first traversal from a center entity, scored by inverse hop distance. */
    GRAPH_TRAVERSAL
}
