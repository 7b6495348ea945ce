package star.engine.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnSchema;
import star.engine.catalog.ColumnStatistics;
import star.engine.catalog.CorruptCatalogException;
import star.engine.catalog.InvalidRecordException;
import star.engine.catalog.Manifest;
import star.engine.catalog.RowGroupMeta;
import star.engine.exec.RowGroupRef;
import star.engine.exec.RowGroupScanOperator;
import star.engine.index.SpatialIndexer;
import star.engine.storage.PartitionFileReader;
import star.engine.storage.RowGroupBlock;

/**
 * Loads row groups and checks them against the manifest before any row is handed out:
 * statistics (manifest and block header) must equal the decoded min/max, first/last keys
 * must match, rows must be in key order, and every stored spatial index must equal the
 * recomputed one. Any disagreement is a CorruptCatalogException.
 */
final class RowGroupVerifier implements RowGroupScanOperator.RowGroupLoader {
    private final CatalogSchema schema;
    private final List<PartitionFileReader> files;
    private final List<String> statsColumns;
    private final int[] keyIndices;
    private final SpatialIndexer indexer;
    private final int raIndex;
    private final int decIndex;

    RowGroupVerifier(Manifest manifest, CatalogSchema schema, List<PartitionFileReader> files, SpatialIndexer indexer) {
        this.schema = schema;
        this.files = files;
        this.statsColumns = manifest.sortingColumns();
        List<String> key = manifest.sortKeyColumns();
        this.keyIndices = new int[key.size()];
        for (int i = 0; i < key.size(); i++) keyIndices[i] = schema.indexOf(key.get(i));
        this.indexer = indexer;
        this.raIndex = schema.indexOf(CatalogSchema.RA);
        this.decIndex = schema.indexOf(CatalogSchema.DEC);
    }

    @Override
    public RowGroupBlock load(RowGroupRef ref) {
        RowGroupBlock block = files.get(ref.partition()).read(ref.meta());
        String where = ref.partitionMeta().path() + " row group " + ref.rowGroup();
        checkStatistics(block, ref.meta(), where);
        checkKeys(block, ref.meta(), where);
        checkSpatialIndex(block, where);
        return block;
    }

    private void checkStatistics(RowGroupBlock block, RowGroupMeta meta, String where) {
        for (String name : statsColumns) {
            int idx = schema.indexOf(name);
            ColumnStatistics actual = RowGroupBlock.statistics(schema.columns().get(idx), block.column(idx));
            ColumnStatistics inManifest = meta.statisticsFor(name);
            ColumnStatistics inHeader = block.storedStatistics(name);
            if (!Objects.equals(actual, inManifest)) {
                throw new CorruptCatalogException("Manifest statistics " + inManifest + " disagree with data "
                    + actual + " in " + where);
            }
            if (!Objects.equals(actual, inHeader)) {
                throw new CorruptCatalogException("Block statistics " + inHeader + " disagree with data "
                    + actual + " in " + where);
            }
        }
    }

    private void checkKeys(RowGroupBlock block, RowGroupMeta meta, String where) {
        int rows = block.rowCount();
        if (!key(block, 0).equals(meta.firstKey()) || !key(block, rows - 1).equals(meta.lastKey())) {
            throw new CorruptCatalogException("First/last key of " + where + " disagree with the manifest");
        }
        for (int r = 1; r < rows; r++) {
            if (compareRows(block, r - 1, r) > 0) {
                throw new CorruptCatalogException("Rows out of order at row " + r + " in " + where);
            }
        }
    }

    private void checkSpatialIndex(RowGroupBlock block, String where) {
        List<Object> ra = block.column(raIndex);
        List<Object> dec = block.column(decIndex);
        List<Object> stored = block.column(1);
        for (int r = 0; r < block.rowCount(); r++) {
            boolean matches;
            try {
                matches = indexer.verify((Double) ra.get(r), (Double) dec.get(r), (Long) stored.get(r));
            } catch (InvalidRecordException e) {
                throw new CorruptCatalogException("Stored coordinate out of range at row " + r + " in " + where, e);
            }
            if (!matches) {
                throw new CorruptCatalogException("Stored spatial index differs from the recomputed one at row "
                    + r + " in " + where);
            }
        }
    }

    private List<String> key(RowGroupBlock block, int row) {
        List<String> key = new ArrayList<>(keyIndices.length);
        for (int idx : keyIndices) {
            key.add(schema.columns().get(idx).type().format(block.column(idx).get(row)));
        }
        return key;
    }

    private int compareRows(RowGroupBlock block, int a, int b) {
        for (int idx : keyIndices) {
            ColumnSchema col = schema.columns().get(idx);
            List<Object> values = block.column(idx);
            int c = col.type().compare(values.get(a), values.get(b));
            if (c != 0) return c;
        }
        return 0;
    }
}
