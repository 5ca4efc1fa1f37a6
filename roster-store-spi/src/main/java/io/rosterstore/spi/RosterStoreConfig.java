package io.rosterstore.spi;

import io.rosterstore.core.RosterStoreException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Construction-time configuration of a roster store.
 *
 * <p>Immutable; build through {@link #builder()}.
 */
public final class RosterStoreConfig {

    public static final Duration DEFAULT_TOMBSTONE_RETENTION = Duration.ofDays(3);

    private final Path databaseFile;
    private final Duration tombstoneRetention;
    private final boolean sweepOnStartup;
    private final Duration sweepInterval;
    private final boolean pruneOrphanedJournal;
    private final boolean collectEmptyGroups;

    private RosterStoreConfig(Builder builder) {
        this.databaseFile = builder.databaseFile;
        this.tombstoneRetention = builder.tombstoneRetention;
        this.sweepOnStartup = builder.sweepOnStartup;
        this.sweepInterval = builder.sweepInterval;
        this.pruneOrphanedJournal = builder.pruneOrphanedJournal;
        this.collectEmptyGroups = builder.collectEmptyGroups;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Backing database file, if configured.
     */
    public Optional<Path> databaseFile() {
        return Optional.ofNullable(databaseFile);
    }

    /**
     * Backing database file.
     *
     * @throws RosterStoreException.NotConfigured if none was configured
     */
    public Path requireDatabaseFile() {
        if (databaseFile == null) {
            throw new RosterStoreException.NotConfigured("No roster database configured");
        }
        return databaseFile;
    }

    /**
     * How long a tombstone survives before the sweeper may purge it.
     */
    public Duration tombstoneRetention() {
        return tombstoneRetention;
    }

    public boolean sweepOnStartup() {
        return sweepOnStartup;
    }

    /**
     * Period of the background sweep; empty disables it.
     */
    public Optional<Duration> sweepInterval() {
        return Optional.ofNullable(sweepInterval);
    }

    /**
     * Whether the sweeper also deletes journal rows of pairs that no longer have an item.
     */
    public boolean pruneOrphanedJournal() {
        return pruneOrphanedJournal;
    }

    /**
     * Whether groups left without members are dropped from the catalog.
     */
    public boolean collectEmptyGroups() {
        return collectEmptyGroups;
    }

    public Builder toBuilder() {
        return new Builder()
                .databaseFile(databaseFile)
                .tombstoneRetention(tombstoneRetention)
                .sweepOnStartup(sweepOnStartup)
                .sweepInterval(sweepInterval)
                .pruneOrphanedJournal(pruneOrphanedJournal)
                .collectEmptyGroups(collectEmptyGroups);
    }

    @Override
    public String toString() {
        return "RosterStoreConfig{databaseFile=" + databaseFile
                + ", tombstoneRetention=" + tombstoneRetention
                + ", sweepOnStartup=" + sweepOnStartup
                + ", sweepInterval=" + sweepInterval
                + ", pruneOrphanedJournal=" + pruneOrphanedJournal
                + ", collectEmptyGroups=" + collectEmptyGroups + "}";
    }

    public static final class Builder {
        private Path databaseFile;
        private Duration tombstoneRetention = DEFAULT_TOMBSTONE_RETENTION;
        private boolean sweepOnStartup = true;
        private Duration sweepInterval;
        private boolean pruneOrphanedJournal;
        private boolean collectEmptyGroups;

        private Builder() {
        }

        public Builder databaseFile(Path databaseFile) {
            this.databaseFile = databaseFile;
            return this;
        }

        public Builder tombstoneRetention(Duration tombstoneRetention) {
            Objects.requireNonNull(tombstoneRetention, "tombstoneRetention");
            if (tombstoneRetention.isNegative()) {
                throw new IllegalArgumentException("tombstoneRetention must not be negative");
            }
            this.tombstoneRetention = tombstoneRetention;
            return this;
        }

        public Builder sweepOnStartup(boolean sweepOnStartup) {
            this.sweepOnStartup = sweepOnStartup;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            if (sweepInterval != null && (sweepInterval.isZero() || sweepInterval.isNegative())) {
                throw new IllegalArgumentException("sweepInterval must be positive");
            }
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder pruneOrphanedJournal(boolean pruneOrphanedJournal) {
            this.pruneOrphanedJournal = pruneOrphanedJournal;
            return this;
        }

        public Builder collectEmptyGroups(boolean collectEmptyGroups) {
            this.collectEmptyGroups = collectEmptyGroups;
            return this;
        }

        public RosterStoreConfig build() {
            return new RosterStoreConfig(this);
        }
    }
}
