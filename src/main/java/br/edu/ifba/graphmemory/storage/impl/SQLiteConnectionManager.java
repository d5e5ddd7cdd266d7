package br.edu.ifba.graphmemory.storage.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

import br.edu.ifba.graphmemory.exception.StoreUnavailableException;

/**
 * Connections and transaction scopes of one SQLite graph file.
 *
 * <p>The database runs in WAL mode, so readers see the last committed episode while a commit
 * is in progress. Reads borrow a pooled connection; all writes share one connection guarded
 * by a lock, which serializes commits across namespaces.</p>
 *
 * <p>{@code :memory:} is rejected: every connection would open its own empty database.</p>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    /**
     * Work run inside a transaction.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private final Path databaseFile;
    private final Duration busyTimeout;
    private final BlockingQueue<Connection> readers;
    private final ReentrantLock writerLock = new ReentrantLock();

    private Connection writer;
    private volatile boolean closed = false;

    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, Duration.ofSeconds(30), 4);
    }

    /**
     * @param busyTimeout how long SQLite waits on a locked database before failing
     * @param readers     read connections kept open between calls
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, int readers) {
        if (databasePath == null || databasePath.isBlank() || databasePath.startsWith(":memory:")) {
            throw new IllegalArgumentException("A database file path is required, got: " + databasePath);
        }
        this.databaseFile = Path.of(databasePath);
        this.busyTimeout = busyTimeout;
        this.readers = new ArrayBlockingQueue<>(readers);
    }

    /**
     * Opens an unpooled connection; the caller closes it.
     *
     * @throws StoreUnavailableException if the file cannot be opened
     */
    public Connection createConnection() {
        ensureOpen();
        Path parent = databaseFile.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            try {
                Files.createDirectories(parent);
                LOG.infof("Created database directory %s", parent);
            } catch (IOException e) {
                throw new StoreUnavailableException("create directory " + parent, e);
            }
        }
        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
            config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databaseFile, config.toProperties());
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA temp_store = MEMORY");
            }
            LOG.debugf("Opened SQLite connection to %s", databaseFile);
            return conn;
        } catch (SQLException e) {
            throw new StoreUnavailableException("connect " + databaseFile, e);
        }
    }

    /**
     * Runs {@code work} in a write transaction on the shared writer, rolling back on any failure.
     *
     * @throws StoreUnavailableException wrapping a {@link SQLException}
     */
    public <T> T inWriteTransaction(String operation, SqlWork<T> work) {
        ensureOpen();
        writerLock.lock();
        try {
            Connection conn = writer();
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, operation);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(operation, e);
        } finally {
            writerLock.unlock();
        }
    }

    /**
     * Runs {@code work} in a read transaction, so it sees one consistent snapshot.
     *
     * @throws StoreUnavailableException wrapping a {@link SQLException}
     */
    public <T> T inReadTransaction(String operation, SqlWork<T> work) {
        ensureOpen();
        Connection conn = borrowReader();
        boolean healthy = false;
        try {
            conn.setAutoCommit(false);
            T result = work.run(conn);
            conn.commit();
            conn.setAutoCommit(true);
            healthy = true;
            return result;
        } catch (SQLException e) {
            throw new StoreUnavailableException(operation, e);
        } finally {
            returnReader(conn, healthy);
        }
    }

    public String getDatabasePath() {
        return databaseFile.toString();
    }

    @Override
    public void close() {
        closed = true;
        writerLock.lock();
        try {
            if (writer != null) {
                closeQuietly(writer);
                writer = null;
            }
        } finally {
            writerLock.unlock();
        }
        Connection conn;
        while ((conn = readers.poll()) != null) {
            closeQuietly(conn);
        }
        LOG.infof("Closed SQLite connections to %s", databaseFile);
    }

    private Connection writer() throws SQLException {
        if (writer == null || writer.isClosed()) {
            writer = createConnection();
        }
        return writer;
    }

    private Connection borrowReader() {
        Connection conn;
        while ((conn = readers.poll()) != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debugf(e, "Dropping broken read connection to %s", databaseFile);
            }
        }
        return createConnection();
    }

    private void returnReader(Connection conn, boolean healthy) {
        if (!healthy) {
            rollback(conn, "read");
            closeQuietly(conn);
            return;
        }
        if (closed || !readers.offer(conn)) {
            closeQuietly(conn);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
    }

    private static void rollback(Connection conn, String operation) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warnf(e, "Rollback failed for %s", operation);
        }
    }

    private static void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            LOG.debug("Error closing SQLite connection", e);
        }
    }
}
