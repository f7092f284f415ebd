package br.edu.ifba.favorites.cache;

import br.edu.ifba.favorites.core.FavoriteChange;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Change sink that keeps the latest change and forwards it to registered listeners.
 */
public class LatestChangeSink implements FavoriteChangeSink {

    private static final Logger LOG = Logger.getLogger(LatestChangeSink.class);

    private final List<Consumer<FavoriteChange>> listeners = new CopyOnWriteArrayList<>();
    private volatile FavoriteChange latest;

    @Override
    public void setLiveValue(@NotNull FavoriteChange change) {
        latest = change;
        LOG.debugf("Saved items changed: %s", change.path());
        for (Consumer<FavoriteChange> listener : listeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Change listener failed for %s", change.path());
            }
        }
    }

    public void addListener(@NotNull Consumer<FavoriteChange> listener) {
        listeners.add(listener);
    }

    public void removeListener(@NotNull Consumer<FavoriteChange> listener) {
        listeners.remove(listener);
    }

    /**
     * @return most recent change, or null if nothing changed yet
     */
    @Nullable
    public FavoriteChange getLatest() {
        return latest;
    }
}
