package br.edu.ifba.favorites.delivery;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;

/**
 * Caller-chosen target of an export, such as a file picked by the user.
 */
public interface ExportDestination {

    /**
     * Opens a fresh stream to the destination. The caller closes it.
     *
     * @throws IOException if the destination cannot be opened
     */
    @NotNull
    OutputStream open() throws IOException;

    @NotNull
    URI location();

    @NotNull
    String displayName();
}
