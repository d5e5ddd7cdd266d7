package br.edu.ifba.graphmemory.exception;

/**
 * The provider answered but the output could not be parsed into the expected shape. Retryable.
 */
public final class MalformedOutputException extends CapabilityException {

    private static final long serialVersionUID = 1L;

    public MalformedOutputException(String message, Throwable cause) {
        super(message, cause);
    }

    public MalformedOutputException(String message) {
        super(message);
    }
}
