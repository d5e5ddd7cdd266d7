package br.edu.ifba.graphmemory.search;

/**
 * Kinds of records a search returns.
 */
public enum SearchScope {
    EDGES,
    NODES,
    COMMUNITIES
}
