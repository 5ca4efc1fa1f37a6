package io.rosterstore.spi;

import io.rosterstore.core.JournalEntry;
import io.rosterstore.core.RosterItem;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for versioned rosters (RFC 6121 roster versioning).
 *
 * <p>Every mutation of an (owner, contact) pair appends to a store-wide journal; the newest journal
 * entry number of a pair is that item's version. This SPI is blocking. Async behavior is provided
 * by {@link BlockingToAsyncAdapter}.
 */
public interface RosterStore extends Closeable {

    /**
     * Full roster of the owner, tombstones included, ordered by (version, contact).
     */
    List<RosterItem> load(String owner);

    /**
     * Items whose version is greater than {@code sinceVersion}, tombstones included.
     *
     * @param owner bare owner address
     * @param sinceVersion version the client last saw
     */
    List<RosterItem> loadSince(String owner, long sinceVersion);

    /**
     * Point lookup. Empty is a normal outcome, not an error.
     */
    Optional<RosterItem> loadOne(String owner, String contact);

    /**
     * Highest version among the owner's items, or 0 for an empty roster.
     */
    long currentVersion(String owner);

    /**
     * Add or update an item and reconcile its groups in one transaction.
     *
     * @param owner bare owner address
     * @param desired desired item; its version is ignored
     * @param respectSubscription write the desired subscription verbatim when true; when false keep
     *                            the stored subscription of an existing item and report it back
     * @return the committed item with its new version
     */
    RosterItem upsert(String owner, RosterItem desired, boolean respectSubscription);

    /**
     * Remove an item. The first call tombstones it, a call against a tombstone deletes it.
     */
    void remove(String owner, String contact);

    /**
     * Remove the owner's whole roster and group catalog.
     */
    void wipe(String owner);

    /**
     * Journal rows of one pair, oldest first.
     */
    List<JournalEntry> journal(String owner, String contact);

    /**
     * Purge tombstones older than the configured retention.
     *
     * @return number of items physically deleted
     */
    int sweep();

    /**
     * Whether items carry versions comparable across sessions. Drives the stream feature offer.
     */
    default boolean supportsVersioning() {
        return true;
    }

    @Override
    void close();
}
