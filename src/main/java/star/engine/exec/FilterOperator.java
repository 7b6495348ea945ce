package star.engine.exec;

import star.engine.catalog.CatalogSchema;

/**
 * Passes through the child's rows that satisfy a predicate.
 * Keeps count of the rows it tested, which lookups log to show how much pruning saved.
 */
public class FilterOperator implements Operator {
    private final Operator child;
    private final Predicate predicate;
    private long examined;

    public FilterOperator(Operator child, Predicate predicate) {
        if (predicate == null) throw new IllegalArgumentException("predicate must not be null");
        this.child = child;
        this.predicate = predicate;
    }

    @Override
    public void open() {
        examined = 0;
        child.open();
    }

    @Override
    public Row next() {
        for (Row r = child.next(); r != null; r = child.next()) {
            examined++;
            if (predicate.test(r)) return r;
        }
        return null;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public CatalogSchema schema() { return child.schema(); }

    /** Rows tested since the last open(). */
    public long examined() { return examined; }
}
