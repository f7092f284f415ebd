package br.edu.ifba.favorites.notify;

import br.edu.ifba.favorites.delivery.ExportReference;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Displays export notifications.
 */
public interface NotificationPresenter {

    /**
     * Shows (or replaces) the notification for a ticket.
     *
     * @param reference the written document when the status is SUCCEEDED, else null
     */
    void present(@NotNull ExportTicket ticket, @NotNull ExportStatus status, @Nullable ExportReference reference);

    /**
     * Removes the notification for a ticket, if any.
     */
    void dismiss(@NotNull ExportTicket ticket);
}
