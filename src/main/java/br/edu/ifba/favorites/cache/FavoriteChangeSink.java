package br.edu.ifba.favorites.cache;

import br.edu.ifba.favorites.core.FavoriteChange;
import org.jetbrains.annotations.NotNull;

/**
 * Addressable "value changed" sink that mutation events are published to.
 *
 * <p>Always invoked on the main executor.</p>
 */
@FunctionalInterface
public interface FavoriteChangeSink {

    void setLiveValue(@NotNull FavoriteChange change);
}
