package br.edu.ifba.graphmemory.exception;

/**
 * Exception thrown when a capability call (extractor, embedder, judge, reranker) failed
 * after all retry attempts, or was refused outright.
 */
public final class CapabilityUnavailableException extends GraphMemoryException {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final int attempts;

    public CapabilityUnavailableException(String operation, int attempts, Throwable cause) {
        super(ErrorKind.CAPABILITY_UNAVAILABLE, String.format(
            "Capability call '%s' failed after %d attempt(s): %s",
            operation, attempts, cause != null ? cause.getMessage() : "unknown"), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
