package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.ExportFormat;
import br.edu.ifba.favorites.delivery.ExportReference;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one export.
 *
 * @param format requested format
 * @param reference the written document, null on failure
 * @param itemCount number of exported items, 0 on failure
 */
public record ExportResult(
    @NotNull ExportFormat format,
    @Nullable ExportReference reference,
    int itemCount
) {

    public ExportResult {
        Objects.requireNonNull(format, "format must not be null");
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must be non-negative, got: " + itemCount);
        }
    }

    public static ExportResult delivered(@NotNull ExportReference reference, int itemCount) {
        return new ExportResult(reference.format(), reference, itemCount);
    }

    public static ExportResult failed(@NotNull ExportFormat format) {
        return new ExportResult(format, null, 0);
    }

    public boolean success() {
        return reference != null;
    }

    @NotNull
    public Optional<ExportReference> referenceOptional() {
        return Optional.ofNullable(reference);
    }
}
