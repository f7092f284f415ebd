package br.edu.ifba.favorites.storage;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * Position-addressable result of a saved-items query.
 *
 * <p>Starts positioned before the first row. Implementations hold store
 * resources until {@link #close()} is called.</p>
 */
public interface SavedItemRows extends AutoCloseable {

    /**
     * @return total number of rows in the result
     */
    int getCount();

    /**
     * @return true if the result is non-empty and is now on the first row
     */
    boolean moveToFirst();

    /**
     * @return true if there was a next row and the result is now on it
     */
    boolean moveToNext();

    /**
     * Moves to an absolute position.
     *
     * @param position zero-based row index
     * @return true if the position exists and the result is now on it
     */
    boolean moveToPosition(int position);

    /**
     * Reads a column of the current row that must be present.
     *
     * @param column logical column
     * @return column value, never null
     * @throws br.edu.ifba.favorites.core.MissingColumnException if the column is not in the result
     * @throws IllegalStateException if the result is not positioned on a row
     */
    @NotNull
    String getRequiredString(@NotNull SavedItemColumn column);

    /**
     * Reads a column of the current row that may be absent.
     *
     * @param column logical column
     * @return column value, empty if the column is missing or null
     * @throws IllegalStateException if the result is not positioned on a row
     */
    @NotNull
    Optional<String> getOptionalString(@NotNull SavedItemColumn column);

    /**
     * Releases the store resources held by this result.
     */
    @Override
    void close();
}
