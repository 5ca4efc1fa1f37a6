package io.rosterstore.spi;

import io.rosterstore.core.RosterItem;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous view of a {@link RosterStore}.
 *
 * <p>Futures complete exceptionally with the store's own {@link io.rosterstore.core.RosterStoreException}
 * when an operation fails; a failed mutation has been rolled back.
 *
 * @see BlockingToAsyncAdapter
 */
public interface AsyncRosterStore {

    CompletableFuture<List<RosterItem>> load(String owner);

    CompletableFuture<List<RosterItem>> loadSince(String owner, long sinceVersion);

    CompletableFuture<Optional<RosterItem>> loadOne(String owner, String contact);

    CompletableFuture<RosterItem> upsert(String owner, RosterItem desired, boolean respectSubscription);

    CompletableFuture<Void> remove(String owner, String contact);

    CompletableFuture<Void> wipe(String owner);
}
