package br.edu.ifba.favorites.cache;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * FavoriteCache backed by a concurrent set.
 */
public class InMemoryFavoriteCache implements FavoriteCache {

    private final Set<String> itemIds = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isFavorite(@NotNull String itemId) {
        return itemIds.contains(itemId);
    }

    @Override
    public void put(@NotNull String itemId) {
        itemIds.add(itemId);
    }

    @Override
    public void remove(@NotNull String itemId) {
        itemIds.remove(itemId);
    }

    @Override
    public synchronized void replaceAll(@NotNull Collection<String> ids) {
        itemIds.retainAll(ids);
        itemIds.addAll(ids);
    }

    public int size() {
        return itemIds.size();
    }
}
