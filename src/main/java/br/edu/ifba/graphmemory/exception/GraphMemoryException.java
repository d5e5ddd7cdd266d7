package br.edu.ifba.graphmemory.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Base exception for every failure the graph memory reports to its callers.
 * 
 * <p>Each exception carries an {@link ErrorKind} so that the pipeline can turn it
 * into a typed failure result without inspecting the concrete class.</p>
 */
public class GraphMemoryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public GraphMemoryException(@NotNull ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public GraphMemoryException(@NotNull ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    @NotNull
    public ErrorKind getKind() {
        return kind;
    }
}
