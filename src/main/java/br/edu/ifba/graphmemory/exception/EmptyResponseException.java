package br.edu.ifba.graphmemory.exception;

/**
 * The provider answered with nothing usable. Retryable.
 */
public final class EmptyResponseException extends CapabilityException {

    private static final long serialVersionUID = 1L;

    public EmptyResponseException(String message) {
        super(message);
    }
}
