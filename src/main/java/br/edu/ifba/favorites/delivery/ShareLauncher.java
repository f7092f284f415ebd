package br.edu.ifba.favorites.delivery;

import org.jetbrains.annotations.NotNull;

/**
 * Hands a finished export to the platform's share flow.
 */
@FunctionalInterface
public interface ShareLauncher {

    void share(@NotNull ExportReference reference);
}
