package br.edu.ifba.favorites.delivery;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;

/**
 * Shared media index that hands out entries files can be written into.
 */
public interface SharedIndexRegistrar {

    /**
     * Registers a new entry.
     *
     * @return location of the registered entry
     * @throws IOException if the index refuses the entry
     */
    @NotNull
    URI register(@NotNull SharedIndexEntry entry) throws IOException;

    /**
     * Opens a stream to a registered entry. The caller closes it.
     *
     * @throws IOException if the entry is unknown or cannot be opened
     */
    @NotNull
    OutputStream openOutputStream(@NotNull URI location) throws IOException;
}
