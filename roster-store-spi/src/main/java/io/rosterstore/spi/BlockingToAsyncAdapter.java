package io.rosterstore.spi;

import io.rosterstore.core.RosterItem;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Adapter that wraps a blocking {@link RosterStore} to provide the {@link AsyncRosterStore} interface.
 *
 * <p>All operations run on the provided {@link Executor}. Embedded engines admit a single writer,
 * so a small bounded pool is usually the right size:
 * <pre>{@code
 * RosterStore blocking = SqliteRosterStore.open(config);
 * AsyncRosterStore async = new BlockingToAsyncAdapter(blocking, Executors.newFixedThreadPool(2));
 *
 * async.load("u@example.com")
 *      .thenAccept(items -> pushRoster(items));
 * }</pre>
 */
public final class BlockingToAsyncAdapter implements AsyncRosterStore {

    private final RosterStore delegate;
    private final Executor executor;

    /**
     * Creates an async adapter for the given blocking store.
     *
     * @param delegate the blocking store to wrap
     * @param executor executor to run blocking operations on
     */
    public BlockingToAsyncAdapter(RosterStore delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Adapter running every call on one dedicated thread, matching a single-writer engine.
     */
    public static BlockingToAsyncAdapter singleWriter(RosterStore delegate) {
        return new BlockingToAsyncAdapter(delegate, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "roster-store-writer");
            thread.setDaemon(true);
            return thread;
        }));
    }

    @Override
    public CompletableFuture<List<RosterItem>> load(String owner) {
        return supply(() -> delegate.load(owner));
    }

    @Override
    public CompletableFuture<List<RosterItem>> loadSince(String owner, long sinceVersion) {
        return supply(() -> delegate.loadSince(owner, sinceVersion));
    }

    @Override
    public CompletableFuture<Optional<RosterItem>> loadOne(String owner, String contact) {
        return supply(() -> delegate.loadOne(owner, contact));
    }

    @Override
    public CompletableFuture<RosterItem> upsert(String owner, RosterItem desired, boolean respectSubscription) {
        return supply(() -> delegate.upsert(owner, desired, respectSubscription));
    }

    @Override
    public CompletableFuture<Void> remove(String owner, String contact) {
        return CompletableFuture.runAsync(() -> delegate.remove(owner, contact), executor);
    }

    @Override
    public CompletableFuture<Void> wipe(String owner) {
        return CompletableFuture.runAsync(() -> delegate.wipe(owner), executor);
    }

    /**
     * Returns the underlying blocking store.
     */
    public RosterStore delegate() {
        return delegate;
    }

    /**
     * Returns the executor used for async operations.
     */
    public Executor executor() {
        return executor;
    }

    private <T> CompletableFuture<T> supply(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, executor);
    }
}
