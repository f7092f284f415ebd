package br.edu.ifba.favorites.notify;

/**
 * Progress of one export as reported to the user.
 */
public enum ExportStatus {
    STARTED,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != STARTED;
    }
}
