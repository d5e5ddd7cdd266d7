package br.edu.ifba.graphmemory.core;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * Fields shared by every persisted record: identity, namespace and transaction time.
 */
public interface GraphElement {

    @NotNull
    String getUuid();

    @NotNull
    String getNamespace();

    /**
     * When the system recorded this element (transaction time).
     */
    @NotNull
    Instant getCreatedAt();

    @NotNull
    GraphKind getKind();
}
