package star.engine.exec;

import star.engine.catalog.CatalogSchema;

/**
 * Minimal pull-based physical operator interface.
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    CatalogSchema schema();
}
