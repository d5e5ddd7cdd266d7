package br.edu.ifba.graphmemory.exception;

/**
 * The provider refused to answer. Never retried.
 */
public final class RefusedException extends CapabilityException {

    private static final long serialVersionUID = 1L;

    public RefusedException(String message) {
        super(message);
    }
}
