package br.edu.ifba.graphmemory.storage.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the classpath migrations under {@code /db/migrations/} in version order.
 *
 * <p>Files follow {@code V{version}__{description}.sql}. The applied version is recorded
 * in {@code schema_version}, so reopening a database only runs the missing steps.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private static final String CREATE_VERSION_TABLE = """
        CREATE TABLE IF NOT EXISTS schema_version (
            version INTEGER PRIMARY KEY,
            description TEXT NOT NULL,
            applied_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP
        )
        """;

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this.migrations = List.of(
            new Migration(1, "temporal graph schema", MIGRATION_PATH + "V001__temporal_graph.sql")
        );
    }

    /**
     * @return the highest applied version, 0 for a fresh database
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type='table' AND name='schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COALESCE(MAX(version), 0) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Applies all pending migrations in one transaction.
     *
     * @throws SQLException if a statement fails; nothing is applied in that case
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.debugf("Current schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_VERSION_TABLE);
            }
            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    migration.apply(conn);
                }
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    public int getLatestVersion() {
        return migrations.get(migrations.size() - 1).version();
    }

    /**
     * Splits a script into statements on semicolons outside quotes, dropping {@code --} comments.
     */
    static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < script.length(); i++) {
            char c = script.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == '-' && i + 1 < script.length() && script.charAt(i + 1) == '-') {
                int end = script.indexOf('\n', i);
                i = end < 0 ? script.length() : end - 1;
            } else if (c == ';') {
                addStatement(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder sql) {
        String statement = sql.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    private record Migration(int version, String description, String resourcePath) {

        void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : splitStatements(load())) {
                    LOG.tracef("Executing: %s", statement);
                    stmt.execute(statement);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
                ps.setInt(1, version);
                ps.setString(2, description);
                ps.executeUpdate();
            }
        }

        private String load() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }
    }
}
