package star.engine.catalog;

// Catalog cannot be interpreted with the caller's settings (resolution, format version).
public class IncompatibleCatalogException extends CatalogException {
    public IncompatibleCatalogException(String message) {
        super(message);
    }
}
