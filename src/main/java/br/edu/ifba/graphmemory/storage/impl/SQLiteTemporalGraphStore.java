package br.edu.ifba.graphmemory.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.graphmemory.core.CommunityNode;
import br.edu.ifba.graphmemory.core.Episode;
import br.edu.ifba.graphmemory.core.EpisodeType;
import br.edu.ifba.graphmemory.core.EntityEdge;
import br.edu.ifba.graphmemory.core.EntityNode;
import br.edu.ifba.graphmemory.core.GraphElement;
import br.edu.ifba.graphmemory.core.GraphKind;
import br.edu.ifba.graphmemory.core.GraphSnapshot;
import br.edu.ifba.graphmemory.storage.EdgeInvalidation;
import br.edu.ifba.graphmemory.storage.GraphIntegrity;
import br.edu.ifba.graphmemory.storage.GraphWriteBatch;
import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import br.edu.ifba.graphmemory.utils.EmbeddingUtil;

/**
 * SQLite implementation of {@link TemporalGraphStore}.
 *
 * <p>Instants are stored as fixed-width text keys that sort chronologically, so that the
 * interval predicates of point-in-time queries run in SQL for any date an {@link Instant}
 * can hold. Lists and attribute maps are JSON columns, embeddings
 * are base64-encoded. Every batch runs in one transaction on the exclusive write
 * connection; reads use pooled connections inside a read transaction, so a reader
 * sees the state before or after a batch, never part of it.</p>
 */
public class SQLiteTemporalGraphStore implements TemporalGraphStore {

    private static final Logger LOG = Logger.getLogger(SQLiteTemporalGraphStore.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_LONG_FOR_INTS);
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    /** Shifts epoch seconds so that {@link Instant#MIN} maps to zero. */
    private static final long SECONDS_OFFSET = -Instant.MIN.getEpochSecond();
    private static final String TIME_KEY_FORMAT = "%017d.%09d";

    private static final String EPISODE_COLUMNS =
        "uuid, namespace, name, body, source_description, source_type, reference_time, created_at";
    private static final String NODE_COLUMNS =
        "uuid, namespace, name, labels, summary, name_embedding, attributes, episode_ids, created_at, valid_at, invalid_at, superseded_by";
    private static final String EDGE_COLUMNS =
        "uuid, namespace, source_id, target_id, relation_name, fact, fact_embedding, episode_ids, created_at, valid_at, invalid_at, invalidated_by";
    private static final String COMMUNITY_COLUMNS =
        "uuid, namespace, name, summary, level, created_at, summary_embedding";

    private static final String UPSERT_EPISODE = """
        INSERT INTO episodes (uuid, namespace, name, body, source_description, source_type, reference_time, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(uuid) DO UPDATE SET
            name = excluded.name,
            body = excluded.body,
            source_description = excluded.source_description,
            source_type = excluded.source_type,
            reference_time = excluded.reference_time
        """;

    private static final String UPSERT_NODE = """
        INSERT INTO entity_nodes (uuid, namespace, name, labels, summary, name_embedding, attributes,
                                  episode_ids, created_at, valid_at, invalid_at, superseded_by)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(uuid) DO UPDATE SET
            name = excluded.name,
            labels = excluded.labels,
            summary = excluded.summary,
            name_embedding = excluded.name_embedding,
            attributes = excluded.attributes,
            episode_ids = excluded.episode_ids,
            valid_at = excluded.valid_at,
            invalid_at = excluded.invalid_at,
            superseded_by = excluded.superseded_by
        """;

    private static final String UPSERT_EDGE = """
        INSERT INTO entity_edges (uuid, namespace, source_id, target_id, relation_name, fact, fact_embedding,
                                  episode_ids, created_at, valid_at, invalid_at, invalidated_by)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT(uuid) DO UPDATE SET
            source_id = excluded.source_id,
            target_id = excluded.target_id,
            relation_name = excluded.relation_name,
            fact = excluded.fact,
            fact_embedding = excluded.fact_embedding,
            episode_ids = excluded.episode_ids,
            valid_at = excluded.valid_at,
            invalid_at = excluded.invalid_at,
            invalidated_by = excluded.invalidated_by
        """;

    private static final String OTHER_OPEN_EDGE = """
        SELECT uuid FROM entity_edges
        WHERE source_id = ? AND target_id = ? AND relation_name = ? AND invalid_at IS NULL AND uuid <> ?
        """;

    private static final String[] SECONDARY_INDICES = {
        "CREATE INDEX IF NOT EXISTS idx_entity_edges_source ON entity_edges(source_id, valid_at)",
        "CREATE INDEX IF NOT EXISTS idx_entity_edges_target ON entity_edges(target_id, valid_at)",
        "CREATE INDEX IF NOT EXISTS idx_entity_edges_validity ON entity_edges(namespace, valid_at, invalid_at)",
        "CREATE INDEX IF NOT EXISTS idx_entity_nodes_validity ON entity_nodes(namespace, valid_at, invalid_at)",
        "CREATE INDEX IF NOT EXISTS idx_entity_nodes_name ON entity_nodes(namespace, name COLLATE NOCASE)"
    };

    private final SQLiteConnectionManager connectionManager;
    private final SQLiteSchemaMigrator migrator;
    private volatile boolean initialized = false;

    public SQLiteTemporalGraphStore(@NotNull String databasePath) {
        this(new SQLiteConnectionManager(databasePath));
    }

    public SQLiteTemporalGraphStore(@NotNull SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
        this.migrator = new SQLiteSchemaMigrator();
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (initialized) {
                return;
            }
            connectionManager.inWriteTransaction("initialize", conn -> {
                migrator.migrateToLatest(conn);
                return null;
            });
            initialized = true;
            LOG.infof("SQLiteTemporalGraphStore initialized at %s (schema V%03d)",
                connectionManager.getDatabasePath(), migrator.getLatestVersion());
        });
    }

    @Override
    public CompletableFuture<Void> buildIndices() {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> connectionManager.inWriteTransaction("buildIndices", conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String ddl : SECONDARY_INDICES) {
                    stmt.execute(ddl);
                }
            }
            LOG.debugf("Ensured %d secondary indices", SECONDARY_INDICES.length);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> commit(@NotNull GraphWriteBatch batch) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> connectionManager.inWriteTransaction("commit", conn -> {
            applyBatch(conn, batch);
            LOG.debugf("Committed %s", batch);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> upsertNode(@NotNull EntityNode node) {
        return commit(GraphWriteBatch.builder(node.getNamespace()).node(node).build());
    }

    @Override
    public CompletableFuture<Void> upsertEdge(@NotNull EntityEdge edge) {
        return commit(GraphWriteBatch.builder(edge.getNamespace()).edge(edge).build());
    }

    @Override
    public CompletableFuture<Void> invalidateEdge(
            @NotNull String edgeId, @NotNull Instant invalidAt, @NotNull List<String> invalidatedBy) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> connectionManager.inWriteTransaction("invalidateEdge", conn -> {
            EntityEdge current = findEdge(conn, edgeId);
            if (current == null) {
                throw new IllegalArgumentException("Unknown edge: " + edgeId);
            }
            applyBatch(conn, GraphWriteBatch.builder(current.getNamespace())
                .invalidation(new EdgeInvalidation(edgeId, invalidAt, invalidatedBy))
                .build());
            return null;
        }));
    }

    @Override
    public CompletableFuture<EntityNode> getNode(@NotNull String uuid) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> connectionManager.inReadTransaction("getNode", conn ->
            first(queryNodes(conn, "SELECT " + NODE_COLUMNS + " FROM entity_nodes WHERE uuid = ?", uuid))));
    }

    @Override
    public CompletableFuture<EntityEdge> getEdge(@NotNull String uuid) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> connectionManager.inReadTransaction("getEdge", conn -> findEdge(conn, uuid)));
    }

    @Override
    public CompletableFuture<Episode> getEpisode(@NotNull String uuid) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> connectionManager.inReadTransaction("getEpisode", conn ->
            first(queryEpisodes(conn, "SELECT " + EPISODE_COLUMNS + " FROM episodes WHERE uuid = ?", uuid))));
    }

    @Override
    public CompletableFuture<List<EntityEdge>> getEdgesBetween(
            @NotNull String sourceId, @NotNull String targetId, @Nullable String relationName) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> connectionManager.inReadTransaction("getEdgesBetween", conn -> {
            if (relationName == null) {
                return queryEdges(conn,
                    "SELECT " + EDGE_COLUMNS + " FROM entity_edges WHERE source_id = ? AND target_id = ? "
                        + "ORDER BY valid_at, created_at", sourceId, targetId);
            }
            return queryEdges(conn,
                "SELECT " + EDGE_COLUMNS + " FROM entity_edges WHERE source_id = ? AND target_id = ? "
                    + "AND relation_name = ? ORDER BY valid_at, created_at", sourceId, targetId, relationName);
        }));
    }

    @Override
    public CompletableFuture<List<EntityEdge>> getEdgesForNode(@NotNull String nodeId) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> connectionManager.inReadTransaction("getEdgesForNode", conn ->
            queryEdges(conn,
                "SELECT " + EDGE_COLUMNS + " FROM entity_edges WHERE source_id = ? OR target_id = ? "
                    + "ORDER BY valid_at, uuid", nodeId, nodeId)));
    }

    @Override
    public CompletableFuture<GraphSnapshot> pointInTimeView(@NotNull String namespace, @NotNull Instant timestamp) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> connectionManager.inReadTransaction("pointInTimeView", conn -> {
            String at = toTimeKey(timestamp);
            List<EntityNode> nodes = queryNodes(conn,
                "SELECT " + NODE_COLUMNS + " FROM entity_nodes WHERE namespace = ? AND valid_at <= ? "
                    + "AND (invalid_at IS NULL OR invalid_at > ?) ORDER BY uuid", namespace, at, at);
            List<EntityEdge> edges = queryEdges(conn,
                "SELECT " + EDGE_COLUMNS + " FROM entity_edges WHERE namespace = ? AND valid_at <= ? "
                    + "AND (invalid_at IS NULL OR invalid_at > ?) ORDER BY uuid", namespace, at, at);
            return new GraphSnapshot(namespace, timestamp, nodes, edges);
        }));
    }

    @Override
    public CompletableFuture<List<GraphElement>> getByNamespace(
            @NotNull String namespace, @NotNull GraphKind kind, @Nullable Instant since, @Nullable Integer limit) {
        ensureInitialized();
        String from = toTimeKey(since != null ? since : Instant.MIN);
        int max = limit != null ? Math.max(0, limit) : -1;
        String filter = " WHERE namespace = ? AND created_at >= ? ORDER BY created_at DESC, uuid LIMIT ?";
        return CompletableFuture.supplyAsync(() -> connectionManager.inReadTransaction("getByNamespace", conn -> {
            List<GraphElement> result = new ArrayList<>();
            switch (kind) {
                case EPISODE -> result.addAll(queryEpisodes(conn,
                    "SELECT " + EPISODE_COLUMNS + " FROM episodes" + filter, namespace, from, max));
                case NODE -> result.addAll(queryNodes(conn,
                    "SELECT " + NODE_COLUMNS + " FROM entity_nodes" + filter, namespace, from, max));
                case EDGE -> result.addAll(queryEdges(conn,
                    "SELECT " + EDGE_COLUMNS + " FROM entity_edges" + filter, namespace, from, max));
                case COMMUNITY -> result.addAll(queryCommunities(conn, namespace,
                    "SELECT " + COMMUNITY_COLUMNS + " FROM communities" + filter, namespace, from, max));
            }
            return result;
        }));
    }

    @Override
    public CompletableFuture<List<Episode>> getRecentEpisodes(@NotNull String namespace, int limit) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> connectionManager.inReadTransaction("getRecentEpisodes", conn -> {
            List<Episode> latest = queryEpisodes(conn,
                "SELECT " + EPISODE_COLUMNS + " FROM episodes WHERE namespace = ? "
                    + "ORDER BY reference_time DESC, created_at DESC, uuid DESC LIMIT ?",
                namespace, Math.max(0, limit));
            Collections.reverse(latest);
            return latest;
        }));
    }

    @Override
    public CompletableFuture<Void> replaceCommunities(
            @NotNull String namespace, @Nullable Collection<String> affectedNodeIds, @NotNull List<CommunityNode> replacements) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> connectionManager.inWriteTransaction("replaceCommunities", conn -> {
            for (CommunityNode community : replacements) {
                if (!community.getNamespace().equals(namespace)) {
                    throw new IllegalStateException(String.format(
                        "Community %s belongs to namespace '%s', not '%s'",
                        community.getUuid(), community.getNamespace(), namespace));
                }
            }
            int removed;
            if (affectedNodeIds == null) {
                removed = update(conn, "DELETE FROM communities WHERE namespace = ?", namespace);
            } else {
                removed = 0;
                for (String nodeId : new LinkedHashSet<>(affectedNodeIds)) {
                    removed += update(conn,
                        "DELETE FROM communities WHERE namespace = ? AND uuid IN "
                            + "(SELECT community_id FROM community_members WHERE node_id = ?)", namespace, nodeId);
                }
            }
            for (CommunityNode community : replacements) {
                insertCommunity(conn, community);
            }
            LOG.debugf("Replaced %d communities with %d in namespace %s", removed, replacements.size(), namespace);
            return null;
        }));
    }

    @Override
    public CompletableFuture<Void> purgeNamespace(@NotNull String namespace) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> connectionManager.inWriteTransaction("purgeNamespace", conn -> {
            update(conn, "DELETE FROM communities WHERE namespace = ?", namespace);
            int edges = update(conn, "DELETE FROM entity_edges WHERE namespace = ?", namespace);
            int nodes = update(conn, "DELETE FROM entity_nodes WHERE namespace = ?", namespace);
            update(conn, "DELETE FROM episodes WHERE namespace = ?", namespace);
            LOG.infof("Purged namespace %s: %d nodes, %d edges", namespace, nodes, edges);
            return null;
        }));
    }

    @Override
    public void close() {
        initialized = false;
        connectionManager.close();
    }

    private void applyBatch(Connection conn, GraphWriteBatch batch) throws SQLException {
        GraphIntegrity.checkNamespaces(batch);

        if (batch.getEpisode() != null) {
            writeEpisode(conn, batch.getEpisode());
        }
        for (EntityNode node : batch.getNodes()) {
            String storedNamespace = namespaceOf(conn, "entity_nodes", node.getUuid());
            if (storedNamespace != null && !storedNamespace.equals(node.getNamespace())) {
                throw new IllegalStateException("Node " + node.getUuid() + " belongs to namespace " + storedNamespace);
            }
            writeNode(conn, node);
        }
        for (EdgeInvalidation invalidation : batch.getInvalidations()) {
            EntityEdge current = findEdge(conn, invalidation.edgeId());
            if (current == null) {
                throw new IllegalArgumentException("Unknown edge: " + invalidation.edgeId());
            }
            if (!current.getNamespace().equals(batch.getNamespace())) {
                throw new IllegalStateException("Edge " + current.getUuid() + " belongs to namespace " + current.getNamespace());
            }
            writeEdge(conn, current.invalidate(invalidation.invalidAt(), invalidation.invalidatedBy()));
        }
        for (EntityEdge edge : batch.getEdges()) {
            GraphIntegrity.checkEdgeUpdate(findEdge(conn, edge.getUuid()), edge);
            if (edge.isOpen()) {
                checkNoOtherOpenEdge(conn, edge);
            }
            writeEdge(conn, edge);
        }
    }

    private void checkNoOtherOpenEdge(Connection conn, EntityEdge edge) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(OTHER_OPEN_EDGE)) {
            ps.setString(1, edge.getSourceId());
            ps.setString(2, edge.getTargetId());
            ps.setString(3, edge.getRelationName());
            ps.setString(4, edge.getUuid());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    GraphIntegrity.checkOpenEdges(edge.tripleKey(), List.of(rs.getString(1), edge.getUuid()));
                }
            }
        }
    }

    private void writeEpisode(Connection conn, Episode episode) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_EPISODE)) {
            ps.setString(1, episode.getUuid());
            ps.setString(2, episode.getNamespace());
            ps.setString(3, episode.getName());
            ps.setString(4, episode.getBody());
            ps.setString(5, episode.getSourceDescription());
            ps.setString(6, episode.getType().name());
            ps.setString(7, toTimeKey(episode.getReferenceTime()));
            ps.setString(8, toTimeKey(episode.getCreatedAt()));
            ps.executeUpdate();
        }
    }

    private void writeNode(Connection conn, EntityNode node) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_NODE)) {
            ps.setString(1, node.getUuid());
            ps.setString(2, node.getNamespace());
            ps.setString(3, node.getName());
            ps.setString(4, toJson(node.getLabels()));
            ps.setString(5, node.getSummary());
            setEmbedding(ps, 6, node.getNameEmbedding());
            ps.setString(7, toJson(node.getAttributes()));
            ps.setString(8, toJson(node.getEpisodeIds()));
            ps.setString(9, toTimeKey(node.getCreatedAt()));
            ps.setString(10, toTimeKey(node.getValidAt()));
            setInstant(ps, 11, node.getInvalidAt());
            ps.setString(12, node.getSupersededBy());
            ps.executeUpdate();
        }
    }

    private void writeEdge(Connection conn, EntityEdge edge) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_EDGE)) {
            ps.setString(1, edge.getUuid());
            ps.setString(2, edge.getNamespace());
            ps.setString(3, edge.getSourceId());
            ps.setString(4, edge.getTargetId());
            ps.setString(5, edge.getRelationName());
            ps.setString(6, edge.getFact());
            setEmbedding(ps, 7, edge.getFactEmbedding());
            ps.setString(8, toJson(edge.getEpisodeIds()));
            ps.setString(9, toTimeKey(edge.getCreatedAt()));
            ps.setString(10, toTimeKey(edge.getValidAt()));
            setInstant(ps, 11, edge.getInvalidAt());
            ps.setString(12, toJson(edge.getInvalidatedBy()));
            ps.executeUpdate();
        }
    }

    private void insertCommunity(Connection conn, CommunityNode community) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO communities (" + COMMUNITY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, community.getUuid());
            ps.setString(2, community.getNamespace());
            ps.setString(3, community.getName());
            ps.setString(4, community.getSummary());
            ps.setInt(5, community.getLevel());
            ps.setString(6, toTimeKey(community.getCreatedAt()));
            setEmbedding(ps, 7, community.getSummaryEmbedding());
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO community_members (community_id, node_id, position) VALUES (?, ?, ?)")) {
            List<String> members = community.getMemberIds();
            for (int i = 0; i < members.size(); i++) {
                ps.setString(1, community.getUuid());
                ps.setString(2, members.get(i));
                ps.setInt(3, i);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Nullable
    private EntityEdge findEdge(Connection conn, String uuid) throws SQLException {
        return first(queryEdges(conn, "SELECT " + EDGE_COLUMNS + " FROM entity_edges WHERE uuid = ?", uuid));
    }

    @Nullable
    private String namespaceOf(Connection conn, String table, String uuid) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT namespace FROM " + table + " WHERE uuid = ?")) {
            ps.setString(1, uuid);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private List<Episode> queryEpisodes(Connection conn, String sql, Object... params) throws SQLException {
        List<Episode> result = new ArrayList<>();
        try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(Episode.builder()
                    .uuid(rs.getString("uuid"))
                    .namespace(rs.getString("namespace"))
                    .name(rs.getString("name"))
                    .body(rs.getString("body"))
                    .sourceDescription(rs.getString("source_description"))
                    .type(EpisodeType.valueOf(rs.getString("source_type")))
                    .referenceTime(fromTimeKey(rs.getString("reference_time")))
                    .createdAt(fromTimeKey(rs.getString("created_at")))
                    .build());
            }
        }
        return result;
    }

    private List<EntityNode> queryNodes(Connection conn, String sql, Object... params) throws SQLException {
        List<EntityNode> result = new ArrayList<>();
        try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(EntityNode.builder()
                    .uuid(rs.getString("uuid"))
                    .namespace(rs.getString("namespace"))
                    .name(rs.getString("name"))
                    .labels(fromJson(rs.getString("labels"), STRING_LIST_TYPE))
                    .summary(rs.getString("summary"))
                    .nameEmbedding(getEmbedding(rs, "name_embedding"))
                    .attributes(fromJson(rs.getString("attributes"), ATTRIBUTES_TYPE))
                    .episodeIds(fromJson(rs.getString("episode_ids"), STRING_LIST_TYPE))
                    .createdAt(fromTimeKey(rs.getString("created_at")))
                    .validAt(fromTimeKey(rs.getString("valid_at")))
                    .invalidAt(getInstant(rs, "invalid_at"))
                    .supersededBy(rs.getString("superseded_by"))
                    .build());
            }
        }
        return result;
    }

    private List<EntityEdge> queryEdges(Connection conn, String sql, Object... params) throws SQLException {
        List<EntityEdge> result = new ArrayList<>();
        try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(EntityEdge.builder()
                    .uuid(rs.getString("uuid"))
                    .namespace(rs.getString("namespace"))
                    .sourceId(rs.getString("source_id"))
                    .targetId(rs.getString("target_id"))
                    .relationName(rs.getString("relation_name"))
                    .fact(rs.getString("fact"))
                    .factEmbedding(getEmbedding(rs, "fact_embedding"))
                    .episodeIds(fromJson(rs.getString("episode_ids"), STRING_LIST_TYPE))
                    .createdAt(fromTimeKey(rs.getString("created_at")))
                    .validAt(fromTimeKey(rs.getString("valid_at")))
                    .invalidAt(getInstant(rs, "invalid_at"))
                    .invalidatedBy(fromJson(rs.getString("invalidated_by"), STRING_LIST_TYPE))
                    .build());
            }
        }
        return result;
    }

    private List<CommunityNode> queryCommunities(Connection conn, String namespace, String sql, Object... params)
            throws SQLException {
        Map<String, List<String>> members = new HashMap<>();
        try (PreparedStatement ps = prepare(conn,
                "SELECT m.community_id, m.node_id FROM community_members m "
                    + "JOIN communities c ON c.uuid = m.community_id WHERE c.namespace = ? "
                    + "ORDER BY m.community_id, m.position", namespace);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                members.computeIfAbsent(rs.getString(1), k -> new ArrayList<>()).add(rs.getString(2));
            }
        }
        List<CommunityNode> result = new ArrayList<>();
        try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String uuid = rs.getString("uuid");
                result.add(new CommunityNode(
                    uuid,
                    rs.getString("namespace"),
                    rs.getString("name"),
                    rs.getString("summary"),
                    rs.getInt("level"),
                    members.getOrDefault(uuid, List.of()),
                    fromTimeKey(rs.getString("created_at")),
                    getEmbedding(rs, "summary_embedding")));
            }
        }
        return result;
    }

    private static PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            return ps;
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    private static int update(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = prepare(conn, sql, params)) {
            return ps.executeUpdate();
        }
    }

    @Nullable
    private static <T> T first(List<T> rows) {
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Encodes an instant as {@code SSSSSSSSSSSSSSSSS.NNNNNNNNN}: offset epoch seconds and nanos, both
     * zero-padded, so string order equals time order over the whole {@link Instant} range.
     */
    static String toTimeKey(@NotNull Instant instant) {
        return String.format(TIME_KEY_FORMAT, instant.getEpochSecond() + SECONDS_OFFSET, instant.getNano());
    }

    static Instant fromTimeKey(@NotNull String key) {
        int dot = key.indexOf('.');
        return Instant.ofEpochSecond(
            Long.parseLong(key.substring(0, dot)) - SECONDS_OFFSET, Long.parseLong(key.substring(dot + 1)));
    }

    private static void setInstant(PreparedStatement ps, int index, @Nullable Instant instant) throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, toTimeKey(instant));
        }
    }

    @Nullable
    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value == null ? null : fromTimeKey(value);
    }

    private static void setEmbedding(PreparedStatement ps, int index, @Nullable float[] embedding) throws SQLException {
        if (embedding == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, EmbeddingUtil.toBase64(embedding));
        }
    }

    @Nullable
    private static float[] getEmbedding(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? EmbeddingUtil.fromBase64(value) : null;
    }

    private static String toJson(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize column value", e);
        }
    }

    private static <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted JSON column: " + json, e);
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
