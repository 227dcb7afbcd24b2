package de.bsommerfeld.stockroom.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single SQLite connection of an inventory database.
 *
 * <h3>Bootstrap</h3>
 * {@link #open} applies {@code schema.sql} (every statement is
 * {@code IF NOT EXISTS}, so reopening is harmless) and seeds the
 * {@code sqlite_sequence} counter for {@code inventory} with the configured
 * floor, but only when no counter row exists yet. An existing counter is never
 * overwritten on reopen. Any failure here is a {@link StoreBootstrapException}.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #execute} and {@link #executeAndGet} wrap a unit of work in one
 * transaction: rollback and rethrow when the work throws, commit otherwise.
 * Begin and commit failures surface as {@link TransactionException}. If the
 * rollback itself fails, the connection is closed without re-enabling
 * auto-commit and the store stays closed. Outside
 * a transaction the store itself acts as an auto-commit executor, which is how
 * reads are served.
 *
 * <h3>Threading</h3>
 * Not thread-safe. One process, one thread, one connection; concurrent
 * writers from other processes are left to SQLite's own file locking and no
 * retry-on-busy is attempted.
 */
public final class InventoryStore extends JdbcExecutor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(InventoryStore.class);

    /** Reserved location that opens an ephemeral in-memory database. */
    public static final String IN_MEMORY = ":memory:";

    private final Connection connection;
    private final String location;
    private final int indexStart;
    private boolean closed;

    private InventoryStore(Connection connection, String location, int indexStart) {
        this.connection = connection;
        this.location = location;
        this.indexStart = indexStart;
    }

    /**
     * Opens or creates the database at {@code location} and makes sure the
     * schema and id sequence exist.
     *
     * @param location   file path, or {@link #IN_MEMORY}
     * @param indexStart sequence floor; the first auto-assigned id is
     *                   {@code indexStart + 1}
     * @throws StoreBootstrapException if the database cannot be opened or
     *                                 prepared
     */
    public static InventoryStore open(String location, int indexStart) {
        String url = "jdbc:sqlite:" + resolve(location);
        LOG.info("Opening inventory store at {}", url);

        Connection conn;
        try {
            conn = DriverManager.getConnection(url);
        } catch (SQLException e) {
            throw new StoreBootstrapException("Failed to open database " + location, e);
        }
        return bootstrap(conn, location, indexStart);
    }

    /**
     * Prepares schema and sequence on an already open connection and takes
     * ownership of it. On failure the connection is closed.
     */
    static InventoryStore bootstrap(Connection conn, String location, int indexStart) {
        try {
            applySchema(conn);
            initSequence(conn, indexStart);
        } catch (SQLException e) {
            try {
                conn.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new StoreBootstrapException("Failed to prepare schema in " + location, e);
        }
        return new InventoryStore(conn, location, indexStart);
    }

    public static InventoryStore openInMemory(int indexStart) {
        return open(IN_MEMORY, indexStart);
    }

    private static String resolve(String location) {
        if (location == null || location.isBlank()) {
            throw new StoreBootstrapException("No database location given", null);
        }
        if (IN_MEMORY.equals(location)) {
            return IN_MEMORY;
        }
        Path file = Paths.get(location).toAbsolutePath();
        Path parent = file.getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreBootstrapException("Failed to create directory " + parent, e);
        }
        return file.toString();
    }

    /**
     * Runs every statement of {@code schema.sql} in one transaction.
     */
    private static void applySchema(Connection conn) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.schemaStatements()) {
                stmt.execute(sql);
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
        LOG.debug("Database schema applied.");
    }

    private static void initSequence(Connection conn, int indexStart) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("init-sequence"))) {
            ps.setInt(1, indexStart);
            if (ps.executeUpdate() > 0) {
                LOG.info("Initialized id sequence at {}", indexStart);
            }
        }
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    /**
     * Runs {@code work} inside one transaction.
     *
     * @throws TransactionException if the transaction cannot be started or
     *                              committed
     * @throws InventoryException   whatever {@code work} threw, after rollback
     */
    public void execute(TransactionCallback work) throws InventoryException {
        executeAndGet(tx -> {
            work.run(tx);
            return null;
        });
    }

    /**
     * Runs {@code work} inside one transaction and returns its result once the
     * transaction has committed.
     *
     * @throws IllegalStateException if a transaction is already active on this
     *                               store
     */
    public <T> T executeAndGet(TransactionFunction<T> work) throws InventoryException {
        Connection conn = connection();
        TransactionExecutor tx = begin(conn);
        boolean resolved = false;
        try {
            T result;
            try {
                result = work.apply(tx);
            } catch (InventoryException | RuntimeException | Error e) {
                resolved = rollback(conn, e);
                throw e;
            }
            try {
                conn.commit();
            } catch (SQLException e) {
                resolved = rollback(conn, e);
                throw new TransactionException(TransactionException.Phase.COMMIT, e);
            }
            resolved = true;
            return result;
        } finally {
            tx.invalidate();
            if (resolved) {
                restoreAutoCommit(conn);
            } else {
                abandon(conn);
            }
        }
    }

    private TransactionExecutor begin(Connection conn) throws TransactionException {
        try {
            if (!conn.getAutoCommit()) {
                throw new IllegalStateException("Nested transactions are not supported");
            }
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw new TransactionException(TransactionException.Phase.BEGIN, e);
        }
        return new TransactionExecutor(conn);
    }

    /**
     * Rolls back; a rollback failure is attached to {@code cause}.
     *
     * @return {@code false} if the transaction may still be pending
     */
    private boolean rollback(Connection conn, Throwable cause) {
        try {
            conn.rollback();
            LOG.debug("Transaction rolled back: {}", cause.getMessage());
            return true;
        } catch (SQLException e) {
            cause.addSuppressed(e);
            LOG.warn("Rollback failed after: {}", cause.getMessage(), e);
            return false;
        }
    }

    /**
     * Gives up on a connection whose transaction could not be rolled back.
     * Switching auto-commit back on would commit the pending writes, so the
     * transaction is discarded with a plain {@code ROLLBACK} and the
     * connection is closed. The store is unusable afterwards.
     */
    private void abandon(Connection conn) {
        closed = true;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("ROLLBACK");
        } catch (SQLException e) {
            LOG.debug("Explicit ROLLBACK on {} failed: {}", location, e.getMessage());
        }
        try {
            conn.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close inventory store at {}", location, e);
        }
        LOG.error("Transaction on {} could not be rolled back; store closed", location);
    }

    private void restoreAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.error("Failed to restore auto-commit on {}", location, e);
        }
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    @Override
    Connection connection() {
        if (closed) {
            throw new IllegalStateException("Inventory store " + location + " is closed");
        }
        return connection;
    }

    public String location() {
        return location;
    }

    /** Configured sequence floor. */
    public int indexStart() {
        return indexStart;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Releases the connection. Call once when done; further calls are no-ops.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        try {
            connection.close();
            LOG.info("Closed inventory store at {}", location);
        } catch (SQLException e) {
            LOG.warn("Failed to close inventory store at {}", location, e);
        }
    }
}
