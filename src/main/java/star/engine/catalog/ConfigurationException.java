package star.engine.catalog;

// Missing or contradictory build options. Raised before any I/O happens.
public class ConfigurationException extends CatalogException {
    public ConfigurationException(String message) {
        super(message);
    }
}
