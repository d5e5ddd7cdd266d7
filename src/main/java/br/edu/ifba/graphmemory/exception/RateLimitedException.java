package br.edu.ifba.graphmemory.exception;

/**
 * The provider rejected the call because of rate limiting. Retryable.
 */
public final class RateLimitedException extends CapabilityException {

    private static final long serialVersionUID = 1L;

    public RateLimitedException(String message) {
        super(message);
    }
}
