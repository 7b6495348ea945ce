package star.engine.query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnStatistics;
import star.engine.catalog.DataType;
import star.engine.catalog.Manifest;
import star.engine.catalog.PartitionMeta;
import star.engine.catalog.RowGroupMeta;
import star.engine.exec.Predicate;
import star.engine.exec.RowGroupRef;

/**
 * Chooses the row groups a lookup has to read.
 *
 * Only equality constraints that must hold for every match are used: a bare equality,
 * or equalities under a top-level AND. OR and NOT branches never prune.
 * Partitions are skipped by partition value, row groups by sorting column min/max.
 */
final class ScanPlanner {
    private final Manifest manifest;
    private final CatalogSchema schema;

    ScanPlanner(Manifest manifest, CatalogSchema schema) {
        this.manifest = manifest;
        this.schema = schema;
    }

    /** Every row group in stored order. */
    List<RowGroupRef> all() {
        List<RowGroupRef> refs = new ArrayList<>();
        List<PartitionMeta> partitions = manifest.partitions();
        for (int p = 0; p < partitions.size(); p++) {
            PartitionMeta pm = partitions.get(p);
            for (int g = 0; g < pm.rowGroups().size(); g++) {
                refs.add(new RowGroupRef(p, g, pm, pm.rowGroups().get(g)));
            }
        }
        return refs;
    }

    List<RowGroupRef> plan(Predicate predicate) {
        Map<String, Object> constraints = new HashMap<>();
        if (!predicate.collectEqualities(constraints)) return List.of(); // contradictory equalities
        if (constraints.isEmpty()) return all();
        List<RowGroupRef> refs = new ArrayList<>();
        List<PartitionMeta> partitions = manifest.partitions();
        for (int p = 0; p < partitions.size(); p++) {
            PartitionMeta pm = partitions.get(p);
            if (!partitionMayMatch(pm, constraints)) continue;
            for (int g = 0; g < pm.rowGroups().size(); g++) {
                RowGroupMeta rg = pm.rowGroups().get(g);
                if (rowGroupMayMatch(rg, constraints)) refs.add(new RowGroupRef(p, g, pm, rg));
            }
        }
        return refs;
    }

    private boolean partitionMayMatch(PartitionMeta pm, Map<String, Object> constraints) {
        for (String col : manifest.partitionColumns()) {
            if (!constraints.containsKey(col)) continue;
            String expected = schema.column(col).type().format(constraints.get(col));
            if (!Objects.equals(expected, pm.valueOf(col))) return false;
        }
        return true;
    }

    private boolean rowGroupMayMatch(RowGroupMeta rg, Map<String, Object> constraints) {
        for (String col : manifest.sortingColumns()) {
            if (!constraints.containsKey(col)) continue;
            Object expected = constraints.get(col);
            if (expected == null) return false; // sorting columns hold no nulls
            ColumnStatistics stats = rg.statisticsFor(col);
            if (stats == null) continue;
            DataType type = schema.column(col).type();
            if (type.compare(expected, type.parse(stats.min())) < 0) return false;
            if (type.compare(expected, type.parse(stats.max())) > 0) return false;
        }
        return true;
    }
}
