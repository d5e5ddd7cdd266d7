package br.edu.ifba.graphmemory.core;

/**
 * The kinds of records the temporal store keeps per namespace.
 */
public enum GraphKind {
    EPISODE,
    NODE,
    EDGE,
    COMMUNITY
}
