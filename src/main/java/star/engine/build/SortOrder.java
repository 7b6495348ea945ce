package star.engine.build;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.DataType;
import star.engine.storage.Record;

/**
 * Composite ordering of stored records: sorting columns ascending, then spatial index,
 * then pk. pk is unique within a build, so the order is total and independent of the
 * sort algorithm's stability.
 */
public final class SortOrder implements Comparator<Record> {
    private final int[] indices;
    private final DataType[] types;
    private final List<String> keyColumns;

    public SortOrder(CatalogSchema schema, List<String> sortingColumns) {
        List<String> key = new ArrayList<>(sortingColumns);
        key.add(CatalogSchema.SPATIAL_INDEX);
        key.add(CatalogSchema.PK);
        this.keyColumns = List.copyOf(key);
        this.indices = new int[key.size()];
        this.types = new DataType[key.size()];
        for (int i = 0; i < key.size(); i++) {
            indices[i] = schema.indexOf(key.get(i));
            types[i] = schema.columns().get(indices[i]).type();
        }
    }

    /** Column names of the composite key, in comparison order. */
    public List<String> keyColumns() {
        return keyColumns;
    }

    @Override
    public int compare(Record a, Record b) {
        for (int i = 0; i < indices.length; i++) {
            int c = types[i].compare(a.get(indices[i]), b.get(indices[i]));
            if (c != 0) return c;
        }
        return 0;
    }
}
