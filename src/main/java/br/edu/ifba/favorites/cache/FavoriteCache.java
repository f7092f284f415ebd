package br.edu.ifba.favorites.cache;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;

/**
 * Fast membership cache of saved item ids, consulted instead of the store.
 */
public interface FavoriteCache {

    boolean isFavorite(@NotNull String itemId);

    void put(@NotNull String itemId);

    void remove(@NotNull String itemId);

    /**
     * Replaces the whole cache content.
     *
     * @param itemIds ids currently saved in the store
     */
    void replaceAll(@NotNull Collection<String> itemIds);
}
