package br.edu.ifba.graphmemory.dedup;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Disjoint-set forest with path compression and union by rank.
 *
 * <p>Not thread-safe. Elements are added implicitly by {@link #find(Object)} and
 * {@link #union(Object, Object)}.</p>
 *
 * @param <T> element type, compared with equals/hashCode
 */
public final class UnionFind<T> {

    private final Map<T, T> parent;
    private final Map<T, Integer> rank;
    private int sets;

    public UnionFind() {
        this.parent = new HashMap<>();
        this.rank = new HashMap<>();
    }

    private UnionFind(UnionFind<T> other) {
        this.parent = new HashMap<>(other.parent);
        this.rank = new HashMap<>(other.rank);
        this.sets = other.sets;
    }

    /**
     * Independent copy; changes to either forest do not affect the other.
     */
    @NotNull
    public UnionFind<T> copy() {
        return new UnionFind<>(this);
    }

    /**
     * Adds {@code element} as a singleton set.
     *
     * @return false if it was already present
     */
    public boolean add(@NotNull T element) {
        Objects.requireNonNull(element, "element must not be null");
        if (parent.containsKey(element)) {
            return false;
        }
        parent.put(element, element);
        rank.put(element, 0);
        sets++;
        return true;
    }

    public boolean contains(@NotNull T element) {
        return parent.containsKey(element);
    }

    /**
     * Representative of the set containing {@code element}.
     */
    @NotNull
    public T find(@NotNull T element) {
        add(element);
        T root = element;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        // compress
        T current = element;
        while (!current.equals(root)) {
            T next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    /**
     * Merges the sets of {@code a} and {@code b}. On equal rank the root of {@code a}
     * becomes the representative.
     *
     * @return true if two distinct sets were joined
     */
    public boolean union(@NotNull T a, @NotNull T b) {
        T rootA = find(a);
        T rootB = find(b);
        if (rootA.equals(rootB)) {
            return false;
        }
        int rankA = rank.get(rootA);
        int rankB = rank.get(rootB);
        if (rankA < rankB) {
            parent.put(rootA, rootB);
        } else {
            parent.put(rootB, rootA);
            if (rankA == rankB) {
                rank.put(rootA, rankA + 1);
            }
        }
        sets--;
        return true;
    }

    public boolean connected(@NotNull T a, @NotNull T b) {
        return find(a).equals(find(b));
    }

    /**
     * Every element in the same set as {@code element}, the element itself included.
     */
    @NotNull
    public Set<T> members(@NotNull T element) {
        T root = find(element);
        Set<T> members = new LinkedHashSet<>();
        for (T candidate : new ArrayList<>(parent.keySet())) {
            if (find(candidate).equals(root)) {
                members.add(candidate);
            }
        }
        return members;
    }

    public int size() {
        return parent.size();
    }

    public int setCount() {
        return sets;
    }

    @NotNull
    public List<T> elements() {
        return new ArrayList<>(parent.keySet());
    }
}
