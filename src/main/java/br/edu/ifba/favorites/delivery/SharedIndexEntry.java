package br.edu.ifba.favorites.delivery;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Entry registered in a shared media index.
 *
 * @param displayName file name shown to the user
 * @param mimeType content type
 * @param relativePath collection the file belongs to, e.g. {@code Downloads}
 */
public record SharedIndexEntry(
    @JsonProperty("displayName") @NotNull String displayName,
    @JsonProperty("mimeType") @NotNull String mimeType,
    @JsonProperty("relativePath") @NotNull String relativePath
) {

    public static final String DOWNLOADS = "Downloads";

    public SharedIndexEntry {
        Objects.requireNonNull(displayName, "displayName must not be null");
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        Objects.requireNonNull(relativePath, "relativePath must not be null");
    }
}
