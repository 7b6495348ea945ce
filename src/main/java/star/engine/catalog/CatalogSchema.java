package star.engine.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered column layout of stored records.
 *
 * The stored layout is always the two derived columns ({@value #PK}, {@value #SPATIAL_INDEX})
 * followed by the user columns in configured order.
 */
public final class CatalogSchema {
    public static final String PK = "pk";
    public static final String SPATIAL_INDEX = "spatial_index";

    public static final String RA = "ra";
    public static final String DEC = "dec";

    private final List<ColumnSchema> columns;
    private final Map<String, Integer> positions;

    private CatalogSchema(List<ColumnSchema> columns) {
        this.columns = List.copyOf(columns);
        Map<String, Integer> pos = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (pos.put(this.columns.get(i).name(), i) != null) {
                throw new ConfigurationException("Duplicate column: " + this.columns.get(i).name());
            }
        }
        this.positions = Collections.unmodifiableMap(pos);
    }

    /** Builds the stored schema for a list of user columns. */
    public static CatalogSchema forUserColumns(List<ColumnSchema> userColumns) {
        List<ColumnSchema> all = new ArrayList<>(userColumns.size() + 2);
        all.add(ColumnSchema.required(PK, DataType.LONG));
        all.add(ColumnSchema.required(SPATIAL_INDEX, DataType.LONG));
        for (ColumnSchema c : userColumns) {
            if (isDerived(c.name())) {
                throw new ConfigurationException("Column name is reserved for a derived field: " + c.name());
            }
            all.add(c);
        }
        return new CatalogSchema(all);
    }

    /** Rebuilds a schema from the full stored column list (as recorded in a manifest). */
    public static CatalogSchema ofStored(List<ColumnSchema> storedColumns) {
        if (storedColumns.size() < 2
                || !PK.equals(storedColumns.get(0).name())
                || !SPATIAL_INDEX.equals(storedColumns.get(1).name())) {
            throw new CorruptCatalogException("Stored schema does not start with derived columns");
        }
        return new CatalogSchema(storedColumns);
    }

    public static boolean isDerived(String name) {
        return PK.equals(name) || SPATIAL_INDEX.equals(name);
    }

    public List<ColumnSchema> columns() { return columns; }

    public List<ColumnSchema> userColumns() { return columns.subList(2, columns.size()); }

    public int size() { return columns.size(); }

    public boolean has(String name) { return positions.containsKey(name); }

    /** Position of a column, or -1. */
    public int indexOf(String name) {
        Integer i = positions.get(name);
        return i == null ? -1 : i;
    }

    public ColumnSchema column(String name) {
        int i = indexOf(name);
        if (i < 0) throw new SchemaMismatchException("Unknown column: " + name);
        return columns.get(i);
    }

    public List<String> columnNames() {
        List<String> out = new ArrayList<>(columns.size());
        for (ColumnSchema c : columns) out.add(c.name());
        return out;
    }

    @Override
    public String toString() {
        return "CatalogSchema" + columnNames();
    }
}
