package star.engine.catalog;

/**
 * Root of the engine's error taxonomy. Unchecked, like the rest of the engine's
 * argument and state errors.
 */
public class CatalogException extends RuntimeException {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
