package io.rosterstore.sqlite;

import io.rosterstore.core.RosterStoreException;
import io.rosterstore.core.Subscription;
import io.rosterstore.spi.RosterStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Purges tombstones whose removal has been visible to clients for longer than the retention window.
 *
 * <p>A tombstone's age is the timestamp of the pair's newest journal row, which is the row written
 * when the item was tombstoned. Journal rows are kept unless orphan pruning is enabled.
 */
final class RetentionSweeper implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RetentionSweeper.class);

    private static final String PURGE_TOMBSTONES = """
                                                   DELETE FROM rosteritem
                                                   WHERE (subscription & ?) != 0
                                                     AND (SELECT max(j.timestamp) FROM journal j
                                                          WHERE j.userid = rosteritem.userid
                                                            AND j.contactid = rosteritem.contactid) < ?
                                                   """;

    private final Database database;
    private final RosterJournal journal;
    private final RosterStoreConfig config;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    RetentionSweeper(Database database, RosterJournal journal, RosterStoreConfig config, Clock clock) {
        this.database = Objects.requireNonNull(database, "database");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return number of roster items physically deleted
     * @throws RosterStoreException.StorageFailure if the purge fails; nothing is deleted then
     */
    int sweep() {
        Instant cutoff = clock.instant().minus(config.tombstoneRetention());
        int purged = database.inTransaction("purge roster tombstones", connection -> {
            int deleted;
            try (PreparedStatement statement = connection.prepareStatement(PURGE_TOMBSTONES)) {
                statement.setInt(1, Subscription.TOMBSTONE);
                statement.setLong(2, cutoff.toEpochMilli());
                deleted = statement.executeUpdate();
            }
            if (config.pruneOrphanedJournal()) {
                int pruned = journal.pruneOrphans(connection, cutoff);
                logger.debug("Pruned {} orphaned journal rows", pruned);
            }
            return deleted;
        });
        logger.info("Purged {} roster tombstones older than {}", purged, cutoff);
        return purged;
    }

    /**
     * Sweep, logging instead of throwing. A failed sweep defers reclamation to the next run.
     */
    int sweepQuietly() {
        try {
            return sweep();
        } catch (RosterStoreException e) {
            logger.warn("Roster tombstone purge failed, will retry on next sweep", e);
            return 0;
        }
    }

    synchronized void schedule(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (scheduler != null) {
            throw new IllegalStateException("Sweeper already scheduled");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "roster-retention-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Scheduled roster tombstone purge every {}", interval);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
