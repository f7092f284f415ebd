package br.edu.ifba.favorites.core;

/**
 * Raised when a required column is absent from a saved-items row set.
 *
 * <p>A missing id or url column means the persisted data is corrupted; rows are
 * never silently adapted without them.</p>
 */
public class MissingColumnException extends IllegalStateException {

    private final String column;

    public MissingColumnException(String column) {
        super("Required column missing from result: " + column);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
