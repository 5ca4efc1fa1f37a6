package io.rosterstore.sqlite;

import io.rosterstore.core.Addresses;
import io.rosterstore.core.JournalEntry;
import io.rosterstore.core.JournalOperations;
import io.rosterstore.core.RosterItem;
import io.rosterstore.core.Subscription;
import io.rosterstore.spi.RosterStore;
import io.rosterstore.spi.RosterStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link RosterStore} backed by an SQLite database file.
 *
 * <p>Storage layout (one file):
 * <pre>
 * jidmap       - address to id
 * rosteritem   - live items, tombstones flagged in subscription bit 0x100
 * rostergroup  - per-owner group names
 * groupitem    - group membership
 * journal      - append-only change log; entry number is the version clock
 * rosterview   - rosteritem joined with max(journal.entry) per pair
 * </pre>
 *
 * <p>Open with {@link #open(RosterStoreConfig)}. Opening installs the schema, purges expired
 * tombstones and, when configured, schedules periodic purges.
 */
public final class SqliteRosterStore implements RosterStore {

    private static final Logger logger = LoggerFactory.getLogger(SqliteRosterStore.class);

    private final RosterStoreConfig config;
    private final Database database;
    private final IdentityInterner identities = new IdentityInterner();
    private final GroupCatalog groups = new GroupCatalog();
    private final RosterJournal journal;
    private final RosterView view;
    private final RetentionSweeper sweeper;

    private SqliteRosterStore(RosterStoreConfig config, Database database, Clock clock) {
        this.config = config;
        this.database = database;
        this.journal = new RosterJournal(clock);
        this.view = new RosterView(journal);
        this.sweeper = new RetentionSweeper(database, journal, config, clock);
    }

    public static SqliteRosterStore open(RosterStoreConfig config) {
        return open(config, Clock.systemUTC());
    }

    /**
     * @throws io.rosterstore.core.RosterStoreException.NotConfigured if no database file is configured
     * @throws io.rosterstore.core.RosterStoreException.StorageFailure if the database cannot be opened or the schema installed
     */
    public static SqliteRosterStore open(RosterStoreConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        Database database = Database.open(config.requireDatabaseFile());
        try {
            SchemaBootstrap.install(database);
        } catch (RuntimeException e) {
            database.close();
            throw e;
        }
        SqliteRosterStore store = new SqliteRosterStore(config, database, clock);
        if (config.sweepOnStartup()) {
            store.sweeper.sweepQuietly();
        }
        config.sweepInterval().ifPresent(store.sweeper::schedule);
        logger.info("Loaded SQLite roster storage using file '{}'", config.requireDatabaseFile());
        return store;
    }

    @Override
    public List<RosterItem> load(String owner) {
        logger.debug("Getting roster for '{}'", owner);
        return loadSince(owner, -1L);
    }

    @Override
    public List<RosterItem> loadSince(String owner, long sinceVersion) {
        Addresses.requireAddress(owner, "owner");
        return database.inTransaction("load roster of " + owner, connection -> {
            OptionalLong ownerId = identities.find(connection, owner);
            if (ownerId.isEmpty()) {
                return List.of();
            }
            List<RosterView.Row> rows = view.rows(connection, ownerId.getAsLong(), sinceVersion);
            Map<Long, Set<String>> groupsByContact = groups.groupsByContact(connection, ownerId.getAsLong());
            List<RosterItem> items = new ArrayList<>(rows.size());
            for (RosterView.Row row : rows) {
                items.add(toItem(row, groupsByContact.getOrDefault(row.contactId(), Set.of())));
            }
            return items;
        });
    }

    @Override
    public Optional<RosterItem> loadOne(String owner, String contact) {
        Addresses.requireAddress(owner, "owner");
        Addresses.requireAddress(contact, "contact");
        return database.inTransaction("load roster item " + contact + " of " + owner, connection -> {
            OptionalLong ownerId = identities.find(connection, owner);
            OptionalLong contactId = identities.find(connection, contact);
            if (ownerId.isEmpty() || contactId.isEmpty()) {
                return Optional.empty();
            }
            Optional<RosterView.Row> row = view.find(connection, ownerId.getAsLong(), contactId.getAsLong());
            if (row.isEmpty()) {
                return Optional.empty();
            }
            Set<String> names = new TreeSet<>();
            for (GroupCatalog.Group group : groups.membersOf(connection, ownerId.getAsLong(), contactId.getAsLong())) {
                names.add(group.name());
            }
            return Optional.of(toItem(row.get(), names));
        });
    }

    @Override
    public long currentVersion(String owner) {
        Addresses.requireAddress(owner, "owner");
        return database.inTransaction("read roster version of " + owner, connection -> {
            OptionalLong ownerId = identities.find(connection, owner);
            return ownerId.isEmpty() ? 0L : journal.highWaterMark(connection, ownerId.getAsLong());
        });
    }

    @Override
    public RosterItem upsert(String owner, RosterItem desired, boolean respectSubscription) {
        Addresses.requireAddress(owner, "owner");
        Objects.requireNonNull(desired, "desired");
        String contact = desired.contact();
        logger.debug("Set roster item {} for {} (respect subscription: {})", contact, owner, respectSubscription);

        long ownerId = resolveIdentity(owner);
        long contactId = resolveIdentity(contact);

        return database.inTransaction("upsert roster item " + contact + " for " + owner, connection -> {
            Optional<RosterView.Row> existing = view.find(connection, ownerId, contactId);

            List<String> groupOps = new ArrayList<>();
            Set<String> memberOf = new HashSet<>();
            List<Long> leaving = new ArrayList<>();
            for (GroupCatalog.Group group : groups.membersOf(connection, ownerId, contactId)) {
                memberOf.add(group.name());
                if (!desired.groups().contains(group.name())) {
                    leaving.add(group.id());
                    groupOps.add(JournalOperations.groupDelete(group.name()));
                }
            }
            groups.removeMember(connection, leaving, contactId);

            for (String name : desired.groups()) {
                if (memberOf.contains(name)) {
                    continue;
                }
                long groupId = groups.resolveGroup(connection, ownerId, name);
                if (groups.addMember(connection, groupId, contactId)) {
                    groupOps.add(JournalOperations.groupAdd(name));
                }
            }
            if (config.collectEmptyGroups() && !leaving.isEmpty()) {
                groups.collectEmpty(connection, ownerId);
            }

            Subscription written;
            long version;
            if (existing.isPresent()) {
                written = respectSubscription
                        ? desired.subscription().live()
                        : Subscription.fromBitmask(existing.get().subscription()).live();
                version = view.updateItem(connection, ownerId, existing.get(), desired.name(), written.bitmask(), groupOps);
            } else {
                written = desired.subscription().live();
                version = view.addItem(connection, ownerId, contactId, desired.name(), written.bitmask(), groupOps);
            }
            return new RosterItem(contact, desired.name(), written, new TreeSet<>(desired.groups()), version);
        });
    }

    @Override
    public void remove(String owner, String contact) {
        Addresses.requireAddress(owner, "owner");
        Addresses.requireAddress(contact, "contact");
        logger.debug("Delete roster item {} for {}", contact, owner);
        database.execute("remove roster item " + contact + " for " + owner, connection -> {
            OptionalLong ownerId = identities.find(connection, owner);
            OptionalLong contactId = identities.find(connection, contact);
            if (ownerId.isEmpty() || contactId.isEmpty()) {
                return;
            }
            removeItem(connection, ownerId.getAsLong(), contactId.getAsLong());
            if (config.collectEmptyGroups()) {
                groups.collectEmpty(connection, ownerId.getAsLong());
            }
        });
    }

    @Override
    public void wipe(String owner) {
        Addresses.requireAddress(owner, "owner");
        logger.debug("Wipe roster of {}", owner);
        database.execute("wipe roster of " + owner, connection -> {
            OptionalLong ownerId = identities.find(connection, owner);
            if (ownerId.isEmpty()) {
                return;
            }
            for (RosterView.Row row : view.rows(connection, ownerId.getAsLong(), -1L)) {
                removeItem(connection, ownerId.getAsLong(), row.contactId());
            }
            groups.removeAll(connection, ownerId.getAsLong());
        });
    }

    @Override
    public List<JournalEntry> journal(String owner, String contact) {
        Addresses.requireAddress(owner, "owner");
        Addresses.requireAddress(contact, "contact");
        return database.inTransaction("read journal of " + contact + " for " + owner, connection -> {
            OptionalLong ownerId = identities.find(connection, owner);
            OptionalLong contactId = identities.find(connection, contact);
            if (ownerId.isEmpty() || contactId.isEmpty()) {
                return List.of();
            }
            return journal.entries(connection, ownerId.getAsLong(), contactId.getAsLong(), owner, contact);
        });
    }

    @Override
    public int sweep() {
        return sweeper.sweep();
    }

    @Override
    public void close() {
        sweeper.close();
        database.close();
    }

    private long resolveIdentity(String address) {
        return database.inTransaction("resolve identity " + address, connection -> identities.resolve(connection, address));
    }

    private void removeItem(Connection connection, long ownerId, long contactId) throws SQLException {
        List<String> groupOps = new ArrayList<>();
        List<Long> groupIds = new ArrayList<>();
        for (GroupCatalog.Group group : groups.membersOf(connection, ownerId, contactId)) {
            groupIds.add(group.id());
            groupOps.add(JournalOperations.groupDelete(group.name()));
        }
        groups.removeMember(connection, groupIds, contactId);

        Optional<RosterView.Row> existing = view.find(connection, ownerId, contactId);
        if (existing.isPresent()) {
            view.removeItem(connection, ownerId, existing.get(), groupOps);
        }
    }

    private static RosterItem toItem(RosterView.Row row, Set<String> groupNames) {
        return new RosterItem(row.contact(), row.name(), Subscription.fromBitmask(row.subscription()), groupNames, row.version());
    }
}
