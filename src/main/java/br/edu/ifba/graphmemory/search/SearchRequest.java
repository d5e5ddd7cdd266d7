package br.edu.ifba.graphmemory.search;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A hybrid search over one or more namespaces.
 *
 * <p>By default only open edges are searched. {@code asOf} restricts edges to those valid at
 * that instant, closed ones included; {@code includeInvalidated} searches every edge.</p>
 */
public final class SearchRequest {

    private final String query;
    private final Set<String> namespaces;
    @Nullable
    private final Integer limit;
    @Nullable
    private final String centerNodeId;
    @Nullable
    private final Instant asOf;
    private final boolean includeInvalidated;
    private final SearchConfig config;

    private SearchRequest(Builder builder) {
        this.query = Objects.requireNonNull(builder.query, "query must not be null");
        if (builder.namespaces.isEmpty()) {
            throw new IllegalArgumentException("at least one namespace is required");
        }
        if (builder.limit != null && builder.limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + builder.limit);
        }
        this.namespaces = Collections.unmodifiableSet(new LinkedHashSet<>(builder.namespaces));
        this.limit = builder.limit;
        this.centerNodeId = builder.centerNodeId;
        this.asOf = builder.asOf;
        this.includeInvalidated = builder.includeInvalidated;
        this.config = builder.config;
    }

    @NotNull
    public String getQuery() {
        return query;
    }

    @NotNull
    public Set<String> getNamespaces() {
        return namespaces;
    }

    @Nullable
    public Integer getLimit() {
        return limit;
    }

    @Nullable
    public String getCenterNodeId() {
        return centerNodeId;
    }

    @Nullable
    public Instant getAsOf() {
        return asOf;
    }

    public boolean isIncludeInvalidated() {
        return includeInvalidated;
    }

    @NotNull
    public SearchConfig getConfig() {
        return config;
    }

    public Builder toBuilder() {
        return new Builder()
            .query(query)
            .namespaces(namespaces)
            .limit(limit)
            .centerNodeId(centerNodeId)
            .asOf(asOf)
            .includeInvalidated(includeInvalidated)
            .config(config);
    }

    @Override
    public String toString() {
        return "SearchRequest{" +
                "query='" + query + '\'' +
                ", namespaces=" + namespaces +
                ", limit=" + limit +
                ", centerNodeId='" + centerNodeId + '\'' +
                ", asOf=" + asOf +
                ", includeInvalidated=" + includeInvalidated +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String query;
        private final List<String> namespaces = new ArrayList<>();
        private Integer limit;
        private String centerNodeId;
        private Instant asOf;
        private boolean includeInvalidated = false;
        private SearchConfig config = SearchConfig.HYBRID;

        public Builder query(@NotNull String query) {
            this.query = query;
            return this;
        }

        public Builder namespace(@NotNull String namespace) {
            this.namespaces.add(namespace);
            return this;
        }

        public Builder namespaces(@NotNull Collection<String> namespaces) {
            this.namespaces.clear();
            this.namespaces.addAll(namespaces);
            return this;
        }

        public Builder limit(@Nullable Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder centerNodeId(@Nullable String centerNodeId) {
            this.centerNodeId = centerNodeId;
            return this;
        }

        public Builder asOf(@Nullable Instant asOf) {
            this.asOf = asOf;
            return this;
        }

        public Builder includeInvalidated(boolean includeInvalidated) {
            this.includeInvalidated = includeInvalidated;
            return this;
        }

        public Builder config(@NotNull SearchConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public SearchRequest build() {
            return new SearchRequest(this);
        }
    }
}
