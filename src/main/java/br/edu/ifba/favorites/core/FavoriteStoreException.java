package br.edu.ifba.favorites.core;

/**
 * Raised when the saved-items store fails to read or write.
 */
public class FavoriteStoreException extends RuntimeException {

    public FavoriteStoreException(String message) {
        super(message);
    }

    public FavoriteStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
