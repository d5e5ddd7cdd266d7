package br.edu.ifba.graphmemory.exception;

/**
 * Exception thrown when the temporal store cannot complete a read or a transaction.
 */
public final class StoreUnavailableException extends GraphMemoryException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, String.format(
            "Store operation '%s' failed: %s", operation, cause != null ? cause.getMessage() : "unknown"), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
