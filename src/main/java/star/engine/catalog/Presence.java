package star.engine.catalog;

/**
 * How a column treats a missing value supplied by the record source.
 */
public enum Presence {
    /** Missing value makes the record malformed. */
    REQUIRED,
    /** Missing value is stored as null. */
    NULLABLE,
    /** Missing value is stored as the type's zero. Numeric columns only. */
    DEFAULT_ZERO;

    public boolean allowsNullOnDisk() {
        return this == NULLABLE;
    }
}
