package br.edu.ifba.graphmemory.exception;

/**
 * Raised between pipeline stages when the caller cancelled an episode before it was persisted.
 */
public final class EpisodeCancelledException extends GraphMemoryException {

    private static final long serialVersionUID = 1L;

    public EpisodeCancelledException(String episodeId) {
        super(ErrorKind.CANCELLED, "Episode " + episodeId + " was cancelled before commit");
    }
}
