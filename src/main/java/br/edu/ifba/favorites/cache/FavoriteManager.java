package br.edu.ifba.favorites.cache;

import br.edu.ifba.favorites.core.FavoriteChange;
import br.edu.ifba.favorites.core.SavedItem;
import br.edu.ifba.favorites.storage.SavedItemStore;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Repository of saved items backing an observer-driven listing.
 *
 * <p>The manager owns the current {@link FavoriteCursor} and the current
 * {@link FavoriteLoader}. Mutations run on the worker executor; once the store
 * has been updated they request exactly one reload from whichever loader is
 * attached at that moment, then publish a {@link FavoriteChange} on the main
 * executor.</p>
 *
 * <p>A failed mutation completes its future exceptionally with the store error,
 * publishes nothing and triggers no reload.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * manager.attach(() -> adapter.refresh(), "kotlin");
 * manager.add(SavedItem.of("42", "https://example.com", "Kotlin 2.0", now))
 *        .thenAccept(change -> LOG.infof("Saved %s", change.itemId()));
 * }</pre>
 */
public class FavoriteManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(FavoriteManager.class);

    private final SavedItemStore store;
    private final FavoriteCache cache;
    private final SyncScheduler syncScheduler;
    private final FavoriteChangeSink changeSink;
    private final Executor ioExecutor;
    private final Executor mainExecutor;

    private FavoriteCursor cursor;
    private FavoriteLoader loader;

    public FavoriteManager(@NotNull SavedItemStore store,
                           @NotNull FavoriteCache cache,
                           @NotNull SyncScheduler syncScheduler,
                           @NotNull FavoriteChangeSink changeSink,
                           @NotNull Executor ioExecutor,
                           @NotNull Executor mainExecutor) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.syncScheduler = Objects.requireNonNull(syncScheduler, "syncScheduler must not be null");
        this.changeSink = Objects.requireNonNull(changeSink, "changeSink must not be null");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor must not be null");
        this.mainExecutor = Objects.requireNonNull(mainExecutor, "mainExecutor must not be null");
    }

    /**
     * Loads every saved id from the store into the membership cache.
     *
     * @return future completing once the cache is primed
     */
    public CompletableFuture<Void> primeCache() {
        return CompletableFuture.runAsync(this::refreshCache, ioExecutor);
    }

    /**
     * Binds an observer to a fresh loader for the given filter and starts loading.
     * Any previously attached loader stops publishing.
     *
     * @param observer notified on the main executor after each published load
     * @param filter title substring, null or blank for all items
     * @return future of the initial load, true if it was published
     */
    public CompletableFuture<Boolean> attach(@NotNull FavoriteObserver observer, @Nullable String filter) {
        Objects.requireNonNull(observer, "observer must not be null");
        FavoriteLoader attached = new FavoriteLoader(this, store, ioExecutor, mainExecutor, filter, observer);
        synchronized (this) {
            loader = attached;
        }
        LOG.debugf("Attached loader (filter=%s)", filter);
        return attached.load();
    }

    /**
     * Releases the current cursor and forgets the loader.
     * Loads still in flight are discarded when they complete.
     */
    public synchronized void detach() {
        if (cursor != null) {
            cursor.close();
            cursor = null;
        }
        loader = null;
    }

    /**
     * @return item count of the current cursor, 0 when there is none
     */
    public synchronized int size() {
        return cursor != null ? cursor.size() : 0;
    }

    /**
     * @param position zero-based position in the current cursor
     * @return the item, or empty if there is no cursor or the position is out of range
     */
    @NotNull
    public synchronized Optional<SavedItem> itemAt(int position) {
        if (cursor == null) {
            return Optional.empty();
        }
        return cursor.itemAt(position);
    }

    /**
     * Saves an item and schedules a background content sync for it.
     *
     * @param item the item to save
     * @return future of the published "added" change
     */
    public CompletableFuture<FavoriteChange> add(@NotNull SavedItem item) {
        Objects.requireNonNull(item, "item must not be null");
        CompletableFuture<FavoriteChange> result = mutate("add item " + item.id(), () -> {
            store.insert(item);
            cache.put(item.id());
            return List.of(FavoriteChange.added(item.id()));
        }).thenApply(changes -> changes.get(0));

        CompletableFuture.runAsync(() -> syncScheduler.scheduleSync(item.id()), ioExecutor)
            .exceptionally(e -> {
                LOG.warnf(e, "Failed to schedule content sync for item %s", item.id());
                return null;
            });
        return result;
    }

    /**
     * Removes one saved item. A null or blank id is ignored.
     *
     * @param itemId id of the item to remove
     * @return future of the published "removed" change, or of null when ignored
     */
    public CompletableFuture<FavoriteChange> remove(@Nullable String itemId) {
        if (itemId == null || itemId.isBlank()) {
            return CompletableFuture.completedFuture(null);
        }
        return mutate("remove item " + itemId, () -> {
            int deleted = store.deleteById(itemId);
            cache.remove(itemId);
            return List.of(FavoriteChange.removed(itemId, deleted));
        }).thenApply(changes -> changes.get(0));
    }

    /**
     * Removes several saved items with a single reload. One "removed" change is
     * published per id. An empty collection is a no-op.
     *
     * @param itemIds ids of the items to remove
     * @return future of the published changes, empty when nothing was requested
     */
    public CompletableFuture<List<FavoriteChange>> removeMany(@Nullable Collection<String> itemIds) {
        if (itemIds == null || itemIds.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(itemIds));
        return mutate("remove " + ids.size() + " items", () -> {
            List<FavoriteChange> changes = new ArrayList<>(ids.size());
            for (String id : ids) {
                int deleted = store.deleteById(id);
                cache.remove(id);
                changes.add(FavoriteChange.removed(id, deleted));
            }
            return changes;
        });
    }

    /**
     * Deletes every saved item matching the filter.
     *
     * @param filter title substring, null or blank to delete everything
     * @return future of the published "cleared" change carrying the deleted count
     */
    public CompletableFuture<FavoriteChange> clear(@Nullable String filter) {
        return mutate("clear saved items (filter=" + filter + ")", () -> {
            int deleted = store.delete(filter);
            refreshCache();
            return List.of(FavoriteChange.cleared(deleted));
        }).thenApply(changes -> changes.get(0));
    }

    /**
     * Checks membership against the fast cache. Never touches the store.
     *
     * @param itemId item id
     * @return true if the item is saved; false for a null or empty id
     */
    public boolean isFavorite(@Nullable String itemId) {
        if (itemId == null || itemId.isEmpty()) {
            return false;
        }
        return cache.isFavorite(itemId);
    }

    /**
     * Asynchronous variant of {@link #isFavorite(String)} evaluated on the worker executor.
     *
     * @param itemId item id
     * @return future of the membership check
     */
    public CompletableFuture<Boolean> check(@Nullable String itemId) {
        return CompletableFuture.supplyAsync(() -> isFavorite(itemId), ioExecutor);
    }

    @Override
    public void close() {
        detach();
    }

    /**
     * Installs a freshly loaded cursor if the loader is still attached.
     *
     * @return false if the loader is stale and the cursor was not installed
     */
    synchronized boolean swapCursor(FavoriteLoader source, FavoriteCursor fresh) {
        if (source != loader) {
            return false;
        }
        FavoriteCursor previous = cursor;
        cursor = fresh;
        if (previous != null) {
            previous.close();
        }
        return true;
    }

    private CompletableFuture<List<FavoriteChange>> mutate(String description,
                                                           Supplier<List<FavoriteChange>> work) {
        return CompletableFuture
            .supplyAsync(() -> {
                List<FavoriteChange> changes = work.get();
                reload();
                return changes;
            }, ioExecutor)
            .thenApplyAsync(changes -> {
                changes.forEach(changeSink::setLiveValue);
                return changes;
            }, mainExecutor)
            .whenComplete((changes, e) -> {
                if (e != null) {
                    LOG.errorf(e, "Failed to %s", description);
                } else {
                    LOG.debugf("Completed: %s", description);
                }
            });
    }

    private void reload() {
        FavoriteLoader current;
        synchronized (this) {
            current = loader;
        }
        if (current != null) {
            current.load();
        }
    }

    private void refreshCache() {
        List<String> ids = new ArrayList<>();
        try (FavoriteCursor all = new FavoriteCursor(store.queryAll())) {
            for (SavedItem item : all.toList()) {
                ids.add(item.id());
            }
        }
        cache.replaceAll(ids);
        LOG.debugf("Favorite cache refreshed with %d ids", ids.size());
    }
}
