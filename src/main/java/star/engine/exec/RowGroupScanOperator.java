package star.engine.exec;

import java.util.List;

import star.engine.catalog.CatalogSchema;
import star.engine.storage.RowGroupBlock;

/**
 * Physical operator that scans a list of row groups in order.
 * Only one block is held at a time; a caller that stops pulling leaves nothing open.
 */
public class RowGroupScanOperator implements Operator {

    /** Loads (and verifies) the block behind a reference. */
    public interface RowGroupLoader {
        RowGroupBlock load(RowGroupRef ref);
    }

    private final CatalogSchema schema;
    private final List<RowGroupRef> refs;
    private final RowGroupLoader loader;
    private final boolean lazyRows;

    // State
    private int nextRef;
    private RowGroupRef current;
    private RowGroupBlock block;
    private int row;
    private boolean opened;

    /**
     * @param lazyRows when true rows are views that decode columns on access;
     *                 otherwise every row is materialized before it is returned
     */
    public RowGroupScanOperator(CatalogSchema schema, List<RowGroupRef> refs, RowGroupLoader loader, boolean lazyRows) {
        this.schema = schema;
        this.refs = List.copyOf(refs);
        this.loader = loader;
        this.lazyRows = lazyRows;
    }

    @Override
    public void open() {
        nextRef = 0;
        current = null;
        block = null;
        row = 0;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened) return null;
        while (block == null || row >= block.rowCount()) {
            if (nextRef >= refs.size()) return null; // done
            current = refs.get(nextRef++);
            block = loader.load(current);
            row = 0;
        }
        Row view = Row.view(block, new RowId(current.partition(), current.rowGroup(), row++), schema);
        return lazyRows ? view : view.materialize();
    }

    @Override
    public void close() {
        opened = false;
        block = null;
        current = null;
    }

    @Override
    public CatalogSchema schema() { return schema; }
}
