package br.edu.ifba.graphmemory.exception;

/**
 * Exception thrown when a namespace identifier does not match {@code ^[A-Za-z0-9_-]+$}.
 */
public final class InvalidNamespaceException extends GraphMemoryException {

    private static final long serialVersionUID = 1L;

    private final String namespace;

    public InvalidNamespaceException(String namespace) {
        super(ErrorKind.INVALID_NAMESPACE, String.format(
            "Invalid namespace '%s': only letters, digits, '_' and '-' are allowed", namespace));
        this.namespace = namespace;
    }

    /**
     * Returns the rejected namespace.
     *
     * @return the namespace as supplied by the caller, may be null
     */
    public String getNamespace() {
        return namespace;
    }
}
