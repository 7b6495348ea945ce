package star.engine.catalog;

// Query referencing a field the catalog does not have, or a literal of the wrong type.
public class SchemaMismatchException extends CatalogException {
    public SchemaMismatchException(String message) {
        super(message);
    }
}
