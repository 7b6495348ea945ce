package star.engine.catalog;

// Immutable data carrier for a catalog column.
public record ColumnSchema(String name, DataType type, Presence presence) {

    public static ColumnSchema required(String name, DataType type) {
        return new ColumnSchema(name, type, Presence.REQUIRED);
    }

    public static ColumnSchema nullable(String name, DataType type) {
        return new ColumnSchema(name, type, Presence.NULLABLE);
    }

    public static ColumnSchema zeroDefault(String name, DataType type) {
        return new ColumnSchema(name, type, Presence.DEFAULT_ZERO);
    }

    public boolean nullable() {
        return presence.allowsNullOnDisk();
    }
}
