package br.edu.ifba.graphmemory.exception;

/**
 * Raised when the contradiction judgment between two edges could not be obtained.
 * 
 * <p>The pipeline never fails an episode for this: the new edge is persisted open and
 * the conflict is recorded as a warning on the episode result.</p>
 */
public final class TemporalConflictUnresolvedException extends GraphMemoryException {

    private static final long serialVersionUID = 1L;

    private final String newEdgeId;
    private final String existingEdgeId;

    public TemporalConflictUnresolvedException(String newEdgeId, String existingEdgeId, Throwable cause) {
        super(ErrorKind.TEMPORAL_CONFLICT_UNRESOLVED, String.format(
            "Could not judge edge %s against existing edge %s", newEdgeId, existingEdgeId), cause);
        this.newEdgeId = newEdgeId;
        this.existingEdgeId = existingEdgeId;
    }

    public String getNewEdgeId() {
        return newEdgeId;
    }

    public String getExistingEdgeId() {
        return existingEdgeId;
    }
}
