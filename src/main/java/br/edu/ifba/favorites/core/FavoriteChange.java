package br.edu.ifba.favorites.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Change token published after a mutation of the saved-items collection.
 *
 * <p>Every token has a path-like address rooted at {@value #BASE_PATH}:</p>
 * <ul>
 *   <li>{@code saved/add/{id}} - item added</li>
 *   <li>{@code saved/remove/{id}} - item removed</li>
 *   <li>{@code saved/clear} - collection (or its filtered subset) cleared</li>
 * </ul>
 *
 * @param kind what happened
 * @param itemId affected item, null for {@link Kind#CLEARED}
 * @param deletedCount number of records deleted, 0 for {@link Kind#ADDED}
 */
public record FavoriteChange(
    @NotNull Kind kind,
    @Nullable String itemId,
    int deletedCount
) {

    public static final String BASE_PATH = "saved";

    private static final String PATH_ADD = "add";
    private static final String PATH_REMOVE = "remove";
    private static final String PATH_CLEAR = "clear";

    public FavoriteChange {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind != Kind.CLEARED && (itemId == null || itemId.isEmpty())) {
            throw new IllegalArgumentException("itemId is required for " + kind);
        }
    }

    public static FavoriteChange added(@NotNull String itemId) {
        return new FavoriteChange(Kind.ADDED, itemId, 0);
    }

    public static FavoriteChange removed(@NotNull String itemId, int deletedCount) {
        return new FavoriteChange(Kind.REMOVED, itemId, deletedCount);
    }

    public static FavoriteChange cleared(int deletedCount) {
        return new FavoriteChange(Kind.CLEARED, null, deletedCount);
    }

    /**
     * @return address of this change, e.g. {@code saved/remove/42}
     */
    @NotNull
    public String path() {
        return switch (kind) {
            case ADDED -> BASE_PATH + "/" + PATH_ADD + "/" + itemId;
            case REMOVED -> BASE_PATH + "/" + PATH_REMOVE + "/" + itemId;
            case CLEARED -> BASE_PATH + "/" + PATH_CLEAR;
        };
    }

    public static boolean isAdded(@Nullable String path) {
        return path != null && path.startsWith(BASE_PATH + "/" + PATH_ADD);
    }

    public static boolean isRemoved(@Nullable String path) {
        return path != null && path.startsWith(BASE_PATH + "/" + PATH_REMOVE);
    }

    public static boolean isCleared(@Nullable String path) {
        return path != null && path.startsWith(BASE_PATH + "/" + PATH_CLEAR);
    }

    /**
     * Kinds of collection mutation.
     */
    public enum Kind {
        ADDED,
        REMOVED,
        CLEARED
    }
}
