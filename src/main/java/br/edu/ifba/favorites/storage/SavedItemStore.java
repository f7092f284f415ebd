package br.edu.ifba.favorites.storage;

import br.edu.ifba.favorites.core.SavedItem;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Persistent store for saved items.
 *
 * <p>All operations block on I/O and must be called from a worker thread.
 * Failures surface as {@link br.edu.ifba.favorites.core.FavoriteStoreException}.</p>
 *
 * Implementations: SQLiteSavedItemStore, InMemorySavedItemStore
 */
public interface SavedItemStore extends AutoCloseable {

    /**
     * @return all saved items, most recently saved first
     */
    @NotNull
    SavedItemRows queryAll();

    /**
     * @param titleSubstring case-insensitive substring of the title
     * @return matching saved items, most recently saved first
     */
    @NotNull
    SavedItemRows queryByTitle(@NotNull String titleSubstring);

    /**
     * Inserts an item, replacing any existing record with the same id.
     *
     * @param item the item to save
     */
    void insert(@NotNull SavedItem item);

    /**
     * @param itemId id of the item to delete
     * @return number of records deleted
     */
    int deleteById(@NotNull String itemId);

    /**
     * @param titleSubstring case-insensitive substring of the title
     * @return number of records deleted
     */
    int deleteByTitle(@NotNull String titleSubstring);

    /**
     * @return number of records deleted
     */
    int deleteAll();

    /**
     * Queries with an optional title filter.
     *
     * @param filter title substring, null or blank for all items
     * @return matching rows
     */
    @NotNull
    default SavedItemRows query(@Nullable String filter) {
        return filter == null || filter.isBlank() ? queryAll() : queryByTitle(filter);
    }

    /**
     * Deletes with an optional title filter.
     *
     * @param filter title substring, null or blank for all items
     * @return number of records deleted
     */
    default int delete(@Nullable String filter) {
        return filter == null || filter.isBlank() ? deleteAll() : deleteByTitle(filter);
    }

    @Override
    void close();
}
