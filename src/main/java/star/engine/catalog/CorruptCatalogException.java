package star.engine.catalog;

/**
 * The store is unreadable or failed an integrity check: missing manifest,
 * checksum mismatch, or statistics that disagree with the stored data.
 */
public class CorruptCatalogException extends CatalogException {
    public CorruptCatalogException(String message) {
        super(message);
    }

    public CorruptCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
