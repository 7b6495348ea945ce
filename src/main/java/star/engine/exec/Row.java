package star.engine.exec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnSchema;
import star.engine.catalog.SchemaMismatchException;
import star.engine.storage.Record;
import star.engine.storage.RowGroupBlock;

/**
 * Row is an execution pipeline unit: values + position + schema.
 * A row either wraps a materialized Record or is a view over a row group block,
 * in which case only the columns actually read are decoded.
 */
public class Row {
    private final CatalogSchema schema;
    private final RowId id;
    private final RowGroupBlock block; // null when materialized
    private Record record;

    private Row(CatalogSchema schema, RowId id, Record record, RowGroupBlock block) {
        this.schema = schema;
        this.id = id;
        this.record = record;
        this.block = block;
    }

    public static Row of(Record record, RowId id, CatalogSchema schema) {
        return new Row(schema, id, record, null);
    }

    public static Row view(RowGroupBlock block, RowId id, CatalogSchema schema) {
        return new Row(schema, id, null, block);
    }

    public Object value(int columnIndex) {
        if (record != null) return record.get(columnIndex);
        return block.column(columnIndex).get(id.row());
    }

    public Object get(String column) {
        int idx = schema.indexOf(column);
        if (idx < 0) throw new SchemaMismatchException("Unknown column: " + column);
        return value(idx);
    }

    public Long getLong(String column) { return (Long) get(column); }
    public Integer getInt(String column) { return (Integer) get(column); }
    public Double getDouble(String column) { return (Double) get(column); }
    public String getString(String column) { return (String) get(column); }

    public long pk() { return (Long) value(0); }
    public long spatialIndex() { return (Long) value(1); }

    /** Materializes every column. Views become independent of their block. */
    public Record record() {
        if (record == null) record = block.record(id.row());
        return record;
    }

    public Row materialize() {
        return block == null ? this : of(record(), id, schema);
    }

    public List<Object> values() { return record().getValues(); }
    public RowId id() { return id; }
    public CatalogSchema schema() { return schema; }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        List<ColumnSchema> cols = schema.columns();
        for (int i = 0; i < cols.size(); i++) out.put(cols.get(i).name(), value(i));
        return out;
    }

    @Override
    public String toString() {
        return "Row" + values() + " id=" + id;
    }
}
