package br.edu.ifba.favorites.cache;

import br.edu.ifba.favorites.core.SavedItem;
import br.edu.ifba.favorites.storage.SavedItemColumn;
import br.edu.ifba.favorites.storage.SavedItemRows;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed, position-addressable view over the result of a saved-items query.
 *
 * <p>The cursor owns its rows and releases them on {@link #close()}. It reflects
 * the store as of the query; newer changes produce a new cursor.</p>
 *
 * <p>Id and url are required: rows without them raise
 * {@link br.edu.ifba.favorites.core.MissingColumnException}. A missing title reads
 * as empty and a missing time as 0.</p>
 */
public final class FavoriteCursor implements AutoCloseable {

    private final SavedItemRows rows;

    public FavoriteCursor(@NotNull SavedItemRows rows) {
        this.rows = rows;
    }

    public int size() {
        return rows.getCount();
    }

    public boolean moveToFirst() {
        return rows.moveToFirst();
    }

    public boolean moveToNext() {
        return rows.moveToNext();
    }

    /**
     * Repositions the cursor and reads the item there.
     *
     * @param position zero-based position
     * @return the item, or empty if the position is out of range
     */
    @NotNull
    public Optional<SavedItem> itemAt(int position) {
        if (!rows.moveToPosition(position)) {
            return Optional.empty();
        }
        return Optional.of(current());
    }

    /**
     * @return the item at the current position
     * @throws IllegalStateException if the cursor is not on a row
     */
    @NotNull
    public SavedItem current() {
        String id = rows.getRequiredString(SavedItemColumn.ITEM_ID);
        String url = rows.getRequiredString(SavedItemColumn.URL);
        String title = rows.getOptionalString(SavedItemColumn.TITLE).orElse("");
        long time = rows.getOptionalString(SavedItemColumn.TIME)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .map(Long::parseLong)
            .orElse(0L);
        return SavedItem.of(id, url, title, time);
    }

    /**
     * Reads every item in result order, leaving the cursor after the last row.
     *
     * @return all items
     */
    @NotNull
    public List<SavedItem> toList() {
        List<SavedItem> items = new ArrayList<>(size());
        if (rows.moveToFirst()) {
            do {
                items.add(current());
            } while (rows.moveToNext());
        }
        return items;
    }

    @Override
    public void close() {
        rows.close();
    }
}
