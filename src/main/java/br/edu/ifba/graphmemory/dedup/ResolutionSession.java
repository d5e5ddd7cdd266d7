package br.edu.ifba.graphmemory.dedup;

import br.edu.ifba.graphmemory.core.EntityNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working state of one RESOLVING stage.
 *
 * <p>Holds a private copy of the namespace forest plus every node the stage has created or
 * updated. Nothing here is visible to other episodes until
 * {@link DeduplicationEngine#install(ResolutionSession)} is called after the commit.</p>
 */
public final class ResolutionSession {

    private static final int MAX_SUPERSEDE_HOPS = 64;

    private final String namespace;
    private final UnionFind<String> forest;
    private final Map<String, EntityNode> nodes;
    private final Map<String, EntityNode> touched = new LinkedHashMap<>();
    private final Map<String, String> canonicalByCandidate = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();
    private int created;
    private int matched;
    private int merges;

    ResolutionSession(String namespace, UnionFind<String> forest, Collection<EntityNode> storedNodes) {
        this.namespace = namespace;
        this.forest = forest;
        this.nodes = new LinkedHashMap<>();
        for (EntityNode node : storedNodes) {
            nodes.put(node.getUuid(), node);
        }
    }

    @NotNull
    public String getNamespace() {
        return namespace;
    }

    UnionFind<String> forest() {
        return forest;
    }

    /**
     * Current version of a node, following merges to the node that absorbed it.
     *
     * @return the active node, or null if unknown
     */
    @Nullable
    EntityNode activeNode(@NotNull String uuid) {
        EntityNode node = nodes.get(uuid);
        int hops = 0;
        while (node != null && node.getSupersededBy() != null && hops++ < MAX_SUPERSEDE_HOPS) {
            node = nodes.get(node.getSupersededBy());
        }
        return node != null && node.isActive() ? node : null;
    }

    @NotNull
    List<EntityNode> activeNodes() {
        List<EntityNode> active = new ArrayList<>();
        for (EntityNode node : nodes.values()) {
            if (node.isActive()) {
                active.add(node);
            }
        }
        return active;
    }

    void put(@NotNull EntityNode node) {
        nodes.put(node.getUuid(), node);
        touched.put(node.getUuid(), node);
    }

    void map(@NotNull String candidateKey, @NotNull String uuid) {
        canonicalByCandidate.put(candidateKey, uuid);
    }

    void recordCreated() {
        created++;
    }

    void recordMatched(boolean joinedSets) {
        matched++;
        if (joinedSets) {
            merges++;
        }
    }

    void warn(@NotNull String warning) {
        warnings.add(warning);
    }

    /**
     * Canonical node id of a candidate, keyed by lowercased candidate name.
     */
    @Nullable
    public String canonicalId(@NotNull String candidateKey) {
        return canonicalByCandidate.get(candidateKey);
    }

    /**
     * Nodes created or updated by this session, to be persisted.
     */
    @NotNull
    public List<EntityNode> touchedNodes() {
        return new ArrayList<>(touched.values());
    }

    /**
     * Replaces a touched node, e.g. after its embedding has been computed.
     */
    public void replaceTouched(@NotNull EntityNode node) {
        if (!touched.containsKey(node.getUuid())) {
            throw new IllegalArgumentException("Node " + node.getUuid() + " was not touched by this session");
        }
        put(node);
    }

    @Nullable
    public EntityNode node(@NotNull String uuid) {
        return nodes.get(uuid);
    }

    @NotNull
    public List<String> warnings() {
        return warnings;
    }

    public int createdCount() {
        return created;
    }

    public int matchedCount() {
        return matched;
    }

    /**
     * Unions that joined two previously distinct sets.
     */
    public int mergeCount() {
        return merges;
    }
}
