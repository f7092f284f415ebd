package br.edu.ifba.favorites.notify;

import br.edu.ifba.favorites.core.ExportFormat;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifies one export invocation across its notifications.
 *
 * @param id unique per process
 * @param format requested format
 */
public record ExportTicket(long id, @NotNull ExportFormat format) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public ExportTicket {
        Objects.requireNonNull(format, "format must not be null");
    }

    public static ExportTicket next(@NotNull ExportFormat format) {
        return new ExportTicket(SEQUENCE.incrementAndGet(), format);
    }
}
