package br.edu.ifba.graphmemory.exception;

/**
 * Error kinds reported to callers of the episode pipeline and the store.
 */
public enum ErrorKind {
    INVALID_NAMESPACE,
    INVALID_EPISODE,
    CAPABILITY_UNAVAILABLE,
    TEMPORAL_CONFLICT_UNRESOLVED,
    STORE_UNAVAILABLE,
    CANCELLED,
    INTERNAL
}
