package br.edu.ifba.graphmemory.ingest;

/**
 * Stages of one episode run, in order. {@link #FAILED} is reachable from every stage
 * before {@link #PERSISTED}; a run whose commit fails is reported as failed at {@link #PERSISTED}.
 */
public enum EpisodeStage {
    RECEIVED,
    EXTRACTING,
    RESOLVING,
    INVALIDATING,
    PERSISTED,
    FAILED;

    public boolean isTerminal() {
        return this == PERSISTED || this == FAILED;
    }
}
