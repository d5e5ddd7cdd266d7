package br.edu.ifba.graphmemory.storage;

import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;

/**
 * Write rules shared by the store implementations.
 */
public final class GraphIntegrity {

    private GraphIntegrity() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Every record of a batch must belong to the batch namespace.
     *
     * @throws IllegalStateException on a namespace mismatch
     */
    public static void checkNamespaces(@NotNull GraphWriteBatch batch) {
        String namespace = batch.getNamespace();
        if (batch.getEpisode() != null && !namespace.equals(batch.getEpisode().getNamespace())) {
            throw mismatch(namespace, "episode", batch.getEpisode().getUuid(), batch.getEpisode().getNamespace());
        }
        for (EntityNode node : batch.getNodes()) {
            if (!namespace.equals(node.getNamespace())) {
                throw mismatch(namespace, "node", node.getUuid(), node.getNamespace());
            }
        }
        for (EntityEdge edge : batch.getEdges()) {
            if (!namespace.equals(edge.getNamespace())) {
                throw mismatch(namespace, "edge", edge.getUuid(), edge.getNamespace());
            }
        }
    }

    /**
     * An invalidated edge may only gain {@code invalidatedBy} entries.
     *
     * @param stored   current version, null for a new edge
     * @param incoming version about to be written
     * @throws IllegalStateException if the update would change anything else on a closed edge
     */
    public static void checkEdgeUpdate(@Nullable EntityEdge stored, @NotNull EntityEdge incoming) {
        if (stored == null) {
            return;
        }
        if (!stored.getNamespace().equals(incoming.getNamespace())) {
            throw new IllegalStateException(String.format(
                "Edge %s cannot move from namespace '%s' to '%s'",
                stored.getUuid(), stored.getNamespace(), incoming.getNamespace()));
        }
        if (!stored.isOpen() && !stored.differsOnlyInInvalidatedBy(incoming)) {
            throw new IllegalStateException(String.format(
                "Edge %s was invalidated at %s and can no longer be modified",
                stored.getUuid(), stored.getInvalidAt()));
        }
    }

    /**
     * @throws IllegalStateException if more than one edge of a triple is open
     */
    public static void checkOpenEdges(@NotNull String tripleKey, @NotNull Collection<String> openEdgeIds) {
        if (openEdgeIds.size() > 1) {
            throw new IllegalStateException(String.format(
                "At most one open edge is allowed per (source, target, relation); %s has %s",
                tripleKey, openEdgeIds));
        }
    }

    private static IllegalStateException mismatch(String namespace, String kind, String uuid, String actual) {
        return new IllegalStateException(String.format(
            "Batch for namespace '%s' contains %s %s of namespace '%s'", namespace, kind, uuid, actual));
    }
}
