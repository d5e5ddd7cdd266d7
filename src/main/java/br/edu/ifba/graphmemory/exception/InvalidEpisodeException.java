package br.edu.ifba.graphmemory.exception;

/**
 * Exception thrown when an episode body is empty, too large or not parseable for its source type.
 */
public final class InvalidEpisodeException extends GraphMemoryException {

    private static final long serialVersionUID = 1L;

    public InvalidEpisodeException(String message) {
        super(ErrorKind.INVALID_EPISODE, message);
    }

    public InvalidEpisodeException(String message, Throwable cause) {
        super(ErrorKind.INVALID_EPISODE, message, cause);
    }
}
