package br.edu.ifba.favorites.delivery;

import org.jetbrains.annotations.Nullable;

/**
 * How the host exposes the public Downloads collection.
 */
public enum StorageEra {

    /** Files are registered in a shared media index. */
    MODERN,

    /** Files are copied straight into a Downloads directory. */
    LEGACY;

    /**
     * @param value era name, case-insensitive; null or blank means {@link #MODERN}
     * @throws IllegalArgumentException if the value is not a known era
     */
    public static StorageEra fromString(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return MODERN;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown storage era: " + value, e);
        }
    }
}
