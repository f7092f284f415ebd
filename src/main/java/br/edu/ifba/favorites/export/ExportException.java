package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.ExportFormat;

/**
 * Thrown when an export fails. Carries the stage that failed so it can be
 * logged; callers only see success or failure.
 */
public class ExportException extends Exception {

    /**
     * Export pipeline stages.
     */
    public enum Stage {
        /** Reading the items from the store. */
        ACQUIRE,
        /** Turning items into the document. */
        SERIALIZE,
        /** Writing the document to its file or destination. */
        DELIVER
    }

    private final Stage stage;
    private final ExportFormat format;

    public ExportException(Stage stage, ExportFormat format, String message) {
        super(message);
        this.stage = stage;
        this.format = format;
    }

    public ExportException(Stage stage, ExportFormat format, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.format = format;
    }

    public Stage getStage() {
        return stage;
    }

    public ExportFormat getFormat() {
        return format;
    }
}
