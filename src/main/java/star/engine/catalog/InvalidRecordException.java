package star.engine.catalog;

// Record-level validation failure (missing required field, wrong type, bad coordinate).
public class InvalidRecordException extends CatalogException {
    public InvalidRecordException(String message) {
        super(message);
    }
}
