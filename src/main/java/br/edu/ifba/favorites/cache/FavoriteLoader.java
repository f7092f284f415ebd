package br.edu.ifba.favorites.cache;

import br.edu.ifba.favorites.storage.SavedItemStore;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queries the store for one filter and publishes the result to one observer.
 *
 * <p>Each {@link #load()} runs the query on the worker executor and publishes on
 * the main executor. A result is published only if:</p>
 * <ul>
 *   <li>this loader is still the one attached to its manager, and</li>
 *   <li>no later load of this loader has been published already.</li>
 * </ul>
 * <p>Discarded results are closed and never reach the observer.</p>
 */
public final class FavoriteLoader {

    private static final Logger LOG = Logger.getLogger(FavoriteLoader.class);

    private final FavoriteManager manager;
    private final SavedItemStore store;
    private final Executor ioExecutor;
    private final Executor mainExecutor;
    private final String filter;
    private final FavoriteObserver observer;

    private final AtomicLong requested = new AtomicLong();
    private long published = 0;

    FavoriteLoader(FavoriteManager manager, SavedItemStore store, Executor ioExecutor, Executor mainExecutor,
                   @Nullable String filter, @NotNull FavoriteObserver observer) {
        this.manager = manager;
        this.store = store;
        this.ioExecutor = ioExecutor;
        this.mainExecutor = mainExecutor;
        this.filter = filter;
        this.observer = observer;
    }

    /**
     * Requests a fresh query. Safe to call from any thread, any number of times.
     *
     * @return future completing with true if this load's result was published
     */
    public CompletableFuture<Boolean> load() {
        long generation = requested.incrementAndGet();
        return CompletableFuture
            .supplyAsync(() -> new FavoriteCursor(store.query(filter)), ioExecutor)
            .thenApplyAsync(cursor -> publish(generation, cursor), mainExecutor)
            .exceptionally(e -> {
                LOG.errorf(e, "Failed to load saved items (filter=%s)", filter);
                return false;
            });
    }

    @Nullable
    public String getFilter() {
        return filter;
    }

    private boolean publish(long generation, FavoriteCursor cursor) {
        synchronized (this) {
            if (generation <= published) {
                LOG.debugf("Discarding load %d, load %d already published", generation, published);
                cursor.close();
                return false;
            }
            if (!manager.swapCursor(this, cursor)) {
                LOG.debugf("Discarding load %d from detached loader", generation);
                cursor.close();
                return false;
            }
            published = generation;
        }
        observer.onChanged();
        return true;
    }
}
