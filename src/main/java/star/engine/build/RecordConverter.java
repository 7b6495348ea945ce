package star.engine.build;

import java.util.ArrayList;
import java.util.List;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnSchema;
import star.engine.catalog.InvalidRecordException;
import star.engine.index.SpatialIndexer;
import star.engine.storage.Record;

/**
 * Validates a source record against the stored schema and lays it out as a stored Record.
 * Validation happens before filtering; the pk is attached only once the record is accepted.
 */
final class RecordConverter {
    private final CatalogSchema schema;
    private final SpatialIndexer indexer;
    private final int raIndex;
    private final int decIndex;

    RecordConverter(CatalogSchema schema, SpatialIndexer indexer) {
        this.schema = schema;
        this.indexer = indexer;
        this.raIndex = schema.indexOf(CatalogSchema.RA);
        this.decIndex = schema.indexOf(CatalogSchema.DEC);
    }

    /** Validated stored values with the pk slot still unset (slot 0). */
    List<Object> validate(SourceRecord src) {
        if (src == null) throw new InvalidRecordException("Null record");
        for (String name : src.names()) {
            if (CatalogSchema.isDerived(name)) {
                throw new InvalidRecordException("Derived field supplied by source: " + name);
            }
        }
        List<ColumnSchema> cols = schema.columns();
        List<Object> values = new ArrayList<>(cols.size());
        values.add(null); // pk
        values.add(null); // spatial index
        for (int i = 2; i < cols.size(); i++) {
            ColumnSchema col = cols.get(i);
            Object raw = src.get(col.name());
            if (raw == null) {
                values.add(switch (col.presence()) {
                    case REQUIRED -> throw new InvalidRecordException("Missing required field: " + col.name());
                    case DEFAULT_ZERO -> col.type().zero();
                    case NULLABLE -> null;
                });
                continue;
            }
            Object v = col.type().coerce(raw);
            if (v == null) {
                throw new InvalidRecordException("Field '" + col.name() + "' expected " + col.type()
                    + " but got " + raw.getClass().getSimpleName() + " (" + raw + ")");
            }
            values.add(v);
        }
        values.set(1, indexer.index((Double) values.get(raIndex), (Double) values.get(decIndex)));
        return values;
    }

    Record accept(List<Object> validated, long pk) {
        validated.set(0, pk);
        return new Record(validated);
    }
}
