package br.edu.ifba.favorites.storage.impl;

import br.edu.ifba.favorites.core.MissingColumnException;
import br.edu.ifba.favorites.core.SavedItem;
import br.edu.ifba.favorites.storage.SavedItemColumn;
import br.edu.ifba.favorites.storage.SavedItemRows;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Row set over rows copied out of the store at query time.
 *
 * <p>Later changes to the store never show up in an existing snapshot.</p>
 */
public final class SnapshotRows implements SavedItemRows {

    private final Set<SavedItemColumn> columns;
    private final List<Map<SavedItemColumn, String>> rows;
    private int position = -1;
    private volatile boolean closed = false;

    /**
     * Creates a snapshot.
     *
     * @param columns columns present in the result
     * @param rows row values keyed by column; absent keys mean SQL NULL
     */
    public SnapshotRows(@NotNull Set<SavedItemColumn> columns,
                        @NotNull List<Map<SavedItemColumn, String>> rows) {
        this.columns = columns.isEmpty()
            ? EnumSet.noneOf(SavedItemColumn.class)
            : EnumSet.copyOf(columns);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    /**
     * Creates a snapshot with all columns from saved items.
     *
     * @param items items in result order
     * @return snapshot holding the items
     */
    public static SnapshotRows of(@NotNull List<SavedItem> items) {
        List<Map<SavedItemColumn, String>> rows = new ArrayList<>(items.size());
        for (SavedItem item : items) {
            Map<SavedItemColumn, String> row = new EnumMap<>(SavedItemColumn.class);
            row.put(SavedItemColumn.ITEM_ID, item.id());
            row.put(SavedItemColumn.URL, item.url());
            row.put(SavedItemColumn.TITLE, item.title());
            row.put(SavedItemColumn.TIME, String.valueOf(item.savedAtEpochSeconds()));
            rows.add(row);
        }
        return new SnapshotRows(EnumSet.allOf(SavedItemColumn.class), rows);
    }

    @Override
    public int getCount() {
        ensureOpen();
        return rows.size();
    }

    @Override
    public boolean moveToFirst() {
        return moveToPosition(0);
    }

    @Override
    public boolean moveToNext() {
        return moveToPosition(position + 1);
    }

    @Override
    public boolean moveToPosition(int target) {
        ensureOpen();
        if (target < 0) {
            position = -1;
            return false;
        }
        if (target >= rows.size()) {
            position = rows.size();
            return false;
        }
        position = target;
        return true;
    }

    @NotNull
    @Override
    public String getRequiredString(@NotNull SavedItemColumn column) {
        Map<SavedItemColumn, String> row = currentRow();
        if (!columns.contains(column)) {
            throw new MissingColumnException(column.columnName());
        }
        String value = row.get(column);
        if (value == null) {
            throw new MissingColumnException(column.columnName());
        }
        return value;
    }

    @NotNull
    @Override
    public Optional<String> getOptionalString(@NotNull SavedItemColumn column) {
        Map<SavedItemColumn, String> row = currentRow();
        if (!columns.contains(column)) {
            return Optional.empty();
        }
        return Optional.ofNullable(row.get(column));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    private Map<SavedItemColumn, String> currentRow() {
        ensureOpen();
        if (position < 0 || position >= rows.size()) {
            throw new IllegalStateException("Not positioned on a row (position=" + position + ")");
        }
        return rows.get(position);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Rows are closed");
        }
    }
}
