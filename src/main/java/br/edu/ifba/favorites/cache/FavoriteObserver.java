package br.edu.ifba.favorites.cache;

/**
 * Receives a callback on the main executor whenever a fresh cursor is published.
 */
@FunctionalInterface
public interface FavoriteObserver {

    void onChanged();
}
