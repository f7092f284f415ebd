package br.edu.ifba.favorites.storage;

/**
 * Logical columns of the saved-items table.
 */
public enum SavedItemColumn {
    ITEM_ID("itemid"),
    URL("url"),
    TITLE("title"),
    TIME("time");

    private final String columnName;

    SavedItemColumn(String columnName) {
        this.columnName = columnName;
    }

    /**
     * @return physical column name in the store
     */
    public String columnName() {
        return columnName;
    }
}
