package io.rosterstore.sqlite;

import io.rosterstore.core.RosterStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the store's single JDBC connection and its transaction boundary.
 *
 * <p>SQLite admits one writer at a time, so every unit of work runs under one lock on one
 * connection. Each unit is a transaction: committed when it returns, rolled back when it throws.
 * Transactions begin IMMEDIATE; other connections on the same file wait up to the busy timeout.
 */
final class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    /** SQLite primary result code for constraint violations. */
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int BUSY_TIMEOUT_MILLIS = 5_000;

    private final Connection connection;
    private final ReentrantLock lock = new ReentrantLock();

    private Database(Connection connection) {
        this.connection = connection;
    }

    static Database open(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RosterStoreException.StorageFailure("Failed to create directory for " + file, e);
        }
        try {
            SQLiteConfig sqlite = new SQLiteConfig();
            sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
            sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
            sqlite.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
            // BEGIN IMMEDIATE: the write lock is held from the start of every transaction
            sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath(), sqlite.toProperties());
            logger.info("Opened roster database '{}'", file);
            return new Database(connection);
        } catch (SQLException e) {
            throw new RosterStoreException.StorageFailure("Failed to open roster database " + file, e);
        }
    }

    /**
     * Run {@code work} as one transaction.
     *
     * @param operation description used in failure messages, e.g. "upsert roster item c@x for u@x"
     */
    <T> T inTransaction(String operation, SqlWork<T> work) {
        lock.lock();
        try {
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException e) {
                rollback(operation, e);
                throw new RosterStoreException.StorageFailure("Failed to " + operation, e);
            } catch (RuntimeException | Error e) {
                rollback(operation, e);
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RosterStoreException.StorageFailure("Failed to " + operation, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same as {@link #inTransaction(String, SqlWork)} for work without a result.
     */
    void execute(String operation, SqlAction work) {
        inTransaction(operation, connection -> {
            work.apply(connection);
            return null;
        });
    }

    /**
     * Whether the failure is a UNIQUE/PRIMARY KEY rejection, i.e. a lost get-or-create race.
     */
    static boolean isConstraintViolation(SQLException e) {
        return (e.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT;
    }

    private void rollback(String operation, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            logger.error("Rollback failed after '{}'", operation, e);
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            connection.close();
        } catch (SQLException e) {
            throw new RosterStoreException.StorageFailure("Failed to close roster database", e);
        } finally {
            lock.unlock();
        }
    }

    @FunctionalInterface
    interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    @FunctionalInterface
    interface SqlAction {
        void apply(Connection connection) throws SQLException;
    }
}
