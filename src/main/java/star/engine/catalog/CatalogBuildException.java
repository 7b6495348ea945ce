package star.engine.catalog;

/**
 * Fatal build failure: output I/O error, or the first invalid record in strict mode.
 * When this is thrown no manifest exists at the output path.
 */
public class CatalogBuildException extends CatalogException {
    public CatalogBuildException(String message) {
        super(message);
    }

    public CatalogBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
