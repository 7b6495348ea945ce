package star.engine.exec;

import java.util.Map;
import java.util.Objects;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnSchema;
import star.engine.catalog.SchemaMismatchException;

/**
 * Exact-match predicate on one column. A null expected value matches null cells.
 * The literal is normalized to the column type up front (an Integer literal for a LONG column
 * becomes a Long), so matching is a plain equals.
 */
public class EqualityPredicate implements Predicate {
    private final int columnIndex;
    private final String column;
    private final Object expected;

    private EqualityPredicate(int columnIndex, String column, Object expected) {
        this.columnIndex = columnIndex;
        this.column = column;
        this.expected = expected;
    }

    public static EqualityPredicate forColumnName(CatalogSchema schema, String columnName, Object expected) {
        int idx = schema.indexOf(columnName);
        if (idx < 0) throw new SchemaMismatchException("Predicate column not found: " + columnName);
        ColumnSchema c = schema.columns().get(idx);
        if (expected == null) return new EqualityPredicate(idx, columnName, null);
        Object normalized = c.type().coerce(expected);
        if (normalized == null) {
            throw new SchemaMismatchException("Expected value of type " + c.type() + " for column '" + columnName
                + "' but got " + expected.getClass().getSimpleName());
        }
        return new EqualityPredicate(idx, columnName, normalized);
    }

    public String column() { return column; }
    public int columnIndex() { return columnIndex; }
    public Object expected() { return expected; }

    @Override
    public boolean test(Row row) {
        Object v = row.value(columnIndex);
        return expected == null ? v == null : expected.equals(v);
    }

    @Override
    public boolean collectEqualities(Map<String, Object> out) {
        if (out.containsKey(column)) return Objects.equals(out.get(column), expected);
        out.put(column, expected);
        return true;
    }

    // For debugging
    @Override
    public String toString() { return column + " = " + expected; }
}
