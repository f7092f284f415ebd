package br.edu.ifba.favorites.notify;

import br.edu.ifba.favorites.delivery.ExportReference;
import org.jetbrains.annotations.NotNull;

/**
 * Reports export progress to the user.
 *
 * <p>Each ticket goes through {@code started} and then exactly one of
 * {@code succeeded} or {@code failed}.</p>
 */
public interface ExportNotifier {

    void started(@NotNull ExportTicket ticket);

    void succeeded(@NotNull ExportTicket ticket, @NotNull ExportReference reference);

    void failed(@NotNull ExportTicket ticket);
}
