package io.rosterstore.spi;

import io.rosterstore.core.Addresses;
import io.rosterstore.core.JournalEntry;
import io.rosterstore.core.JournalOperations;
import io.rosterstore.core.RosterItem;
import io.rosterstore.core.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.TreeMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference in-memory {@link RosterStore}.
 *
 * <p>Same versioning, tombstone and retention semantics as the database-backed store, without
 * durability. Good for unit tests and embedders that keep rosters elsewhere.
 */
public final class ReferenceRosterStore implements RosterStore {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceRosterStore.class);

    private final RosterStoreConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Long> identities = new HashMap<>();
    private final Map<Pair, Entry> entries = new HashMap<>();
    // owner -> group name -> member contacts
    private final Map<String, Map<String, Set<String>>> groups = new HashMap<>();
    private final List<JournalEntry> journal = new ArrayList<>();
    private final Map<Pair, Long> versions = new HashMap<>();
    private long nextEntryNo = 1;

    public ReferenceRosterStore() {
        this(RosterStoreConfig.builder().build(), Clock.systemUTC());
    }

    public ReferenceRosterStore(RosterStoreConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<RosterItem> load(String owner) {
        return loadSince(owner, -1L);
    }

    @Override
    public List<RosterItem> loadSince(String owner, long sinceVersion) {
        Addresses.requireAddress(owner, "owner");
        lock.lock();
        try {
            List<RosterItem> items = new ArrayList<>();
            for (Map.Entry<Pair, Entry> e : entries.entrySet()) {
                Pair pair = e.getKey();
                if (!pair.owner.equals(owner)) continue;
                RosterItem item = toItem(pair, e.getValue());
                if (item.version() > sinceVersion) items.add(item);
            }
            items.sort(Comparator.comparingLong(RosterItem::version)
                    .thenComparingLong(item -> identities.get(item.contact())));
            return items;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<RosterItem> loadOne(String owner, String contact) {
        Pair pair = new Pair(Addresses.requireAddress(owner, "owner"), Addresses.requireAddress(contact, "contact"));
        lock.lock();
        try {
            Entry entry = entries.get(pair);
            return entry == null ? Optional.empty() : Optional.of(toItem(pair, entry));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long currentVersion(String owner) {
        Addresses.requireAddress(owner, "owner");
        lock.lock();
        try {
            long version = 0L;
            for (JournalEntry row : journal) {
                if (row.owner().equals(owner)) version = Math.max(version, row.entryNo());
            }
            return version;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RosterItem upsert(String owner, RosterItem desired, boolean respectSubscription) {
        Objects.requireNonNull(desired, "desired");
        Pair pair = new Pair(Addresses.requireAddress(owner, "owner"), desired.contact());
        lock.lock();
        try {
            intern(pair.owner);
            intern(pair.contact);
            logger.debug("Set roster item {} for {}", pair.contact, pair.owner);

            Map<String, Set<String>> catalog = groups.computeIfAbsent(pair.owner, o -> new TreeMap<>());
            List<String> groupOps = new ArrayList<>();
            for (Map.Entry<String, Set<String>> group : catalog.entrySet()) {
                if (!desired.groups().contains(group.getKey()) && group.getValue().remove(pair.contact)) {
                    groupOps.add(JournalOperations.groupDelete(group.getKey()));
                }
            }

            Entry existing = entries.get(pair);
            Subscription written;
            String itemOp;
            if (existing == null) {
                written = desired.subscription().live();
                itemOp = JournalOperations.insert(desired.name(), written.bitmask());
            } else {
                written = respectSubscription
                        ? desired.subscription().live()
                        : Subscription.fromBitmask(existing.subscription).live();
                itemOp = JournalOperations.update(existing.name, existing.subscription);
            }
            entries.put(pair, new Entry(desired.name(), written.bitmask()));

            for (String name : desired.groups()) {
                if (catalog.computeIfAbsent(name, n -> new LinkedHashSet<>()).add(pair.contact)) {
                    groupOps.add(JournalOperations.groupAdd(name));
                }
            }
            collectEmptyGroups(catalog);
            append(pair, itemOp, groupOps);

            return toItem(pair, entries.get(pair));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(String owner, String contact) {
        Pair pair = new Pair(Addresses.requireAddress(owner, "owner"), Addresses.requireAddress(contact, "contact"));
        lock.lock();
        try {
            logger.debug("Delete roster item {} for {}", pair.contact, pair.owner);
            removeLocked(pair);
            Map<String, Set<String>> catalog = groups.get(pair.owner);
            if (catalog != null) collectEmptyGroups(catalog);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void wipe(String owner) {
        Addresses.requireAddress(owner, "owner");
        lock.lock();
        try {
            List<Pair> pairs = new ArrayList<>();
            for (Pair pair : entries.keySet()) {
                if (pair.owner.equals(owner)) pairs.add(pair);
            }
            for (Pair pair : pairs) {
                removeLocked(pair);
            }
            groups.remove(owner);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<JournalEntry> journal(String owner, String contact) {
        Pair pair = new Pair(Addresses.requireAddress(owner, "owner"), Addresses.requireAddress(contact, "contact"));
        lock.lock();
        try {
            List<JournalEntry> rows = new ArrayList<>();
            for (JournalEntry row : journal) {
                if (row.owner().equals(pair.owner) && row.contact().equals(pair.contact)) rows.add(row);
            }
            return rows;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int sweep() {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(config.tombstoneRetention());
            Map<Pair, Instant> lastTouched = new HashMap<>();
            for (JournalEntry row : journal) {
                lastTouched.put(new Pair(row.owner(), row.contact()), row.timestamp());
            }
            int purged = 0;
            Iterator<Map.Entry<Pair, Entry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Pair, Entry> e = it.next();
                Instant touched = lastTouched.get(e.getKey());
                if ((e.getValue().subscription & Subscription.TOMBSTONE) != 0
                        && touched != null && touched.isBefore(cutoff)) {
                    it.remove();
                    purged++;
                }
            }
            if (config.pruneOrphanedJournal()) {
                Map<String, Long> newestByOwner = new HashMap<>();
                for (JournalEntry row : journal) {
                    newestByOwner.merge(row.owner(), row.entryNo(), Math::max);
                }
                journal.removeIf(row -> !entries.containsKey(new Pair(row.owner(), row.contact()))
                        && row.timestamp().isBefore(cutoff)
                        && row.entryNo() != newestByOwner.get(row.owner()));
                versions.keySet().removeIf(pair -> !entries.containsKey(pair));
            }
            logger.info("Purged {} roster tombstones older than {}", purged, cutoff);
            return purged;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
    }

    private void removeLocked(Pair pair) {
        Entry entry = entries.get(pair);
        List<String> groupOps = new ArrayList<>();
        for (Map.Entry<String, Set<String>> group : groups.getOrDefault(pair.owner, Map.of()).entrySet()) {
            if (group.getValue().remove(pair.contact)) {
                groupOps.add(JournalOperations.groupDelete(group.getKey()));
            }
        }
        if (entry == null) {
            return;
        }
        if ((entry.subscription & Subscription.TOMBSTONE) != 0) {
            entries.remove(pair);
            return;
        }
        append(pair, JournalOperations.delete(entry.name, entry.subscription), groupOps);
        entries.put(pair, new Entry(entry.name, entry.subscription | Subscription.TOMBSTONE));
    }

    private void collectEmptyGroups(Map<String, Set<String>> catalog) {
        if (config.collectEmptyGroups()) {
            catalog.values().removeIf(Set::isEmpty);
        }
    }

    private void append(Pair pair, String itemOp, List<String> groupOps) {
        long entryNo = nextEntryNo++;
        journal.add(new JournalEntry(entryNo, pair.owner, pair.contact, clock.instant(),
                JournalOperations.combine(itemOp, groupOps)));
        versions.put(pair, entryNo);
    }

    private long intern(String address) {
        return identities.computeIfAbsent(address, a -> (long) identities.size() + 1);
    }

    private RosterItem toItem(Pair pair, Entry entry) {
        Set<String> memberOf = new TreeSet<>();
        for (Map.Entry<String, Set<String>> group : groups.getOrDefault(pair.owner, Map.of()).entrySet()) {
            if (group.getValue().contains(pair.contact)) memberOf.add(group.getKey());
        }
        return new RosterItem(pair.contact, entry.name, Subscription.fromBitmask(entry.subscription), memberOf,
                versions.getOrDefault(pair, 0L));
    }

    private static final class Entry {
        private final String name;
        private final int subscription;

        private Entry(String name, int subscription) {
            this.name = name;
            this.subscription = subscription;
        }
    }

    private record Pair(String owner, String contact) {
    }
}
