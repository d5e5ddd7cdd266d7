package br.edu.ifba.graphmemory.exception;

/**
 * Failure reported by a single capability call.
 * 
 * <p>Capability exceptions are retried with exponential backoff by the capability gate,
 * except for {@link RefusedException}. They are not part of the caller-facing taxonomy:
 * once retries are exhausted they surface as {@link CapabilityUnavailableException}.</p>
 */
public class CapabilityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
