package star.engine.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Build metadata written as the last step of a successful build. A reader needs
 * nothing but this file to interpret the partition files next to it.
 */
public record Manifest(int formatVersion,
                       String buildId,
                       String createdAt,
                       List<ColumnSchema> schema,
                       List<String> columns,
                       List<String> sortingColumns,
                       List<String> partitionColumns,
                       int spatialResolution,
                       String compression,
                       int chunkSize,
                       int rowGroupSize,
                       long totalRecords,
                       BuildCounts counts,
                       List<PartitionMeta> partitions) {

    public static final int FORMAT_VERSION = 1;

    public CatalogSchema catalogSchema() {
        return CatalogSchema.ofStored(schema);
    }

    /** Names making up the composite sort key, in comparison order. */
    public List<String> sortKeyColumns() {
        List<String> key = new ArrayList<>(sortingColumns);
        key.add(CatalogSchema.SPATIAL_INDEX);
        key.add(CatalogSchema.PK);
        return key;
    }

    public int rowGroupCount() {
        int n = 0;
        for (PartitionMeta p : partitions) n += p.rowGroups().size();
        return n;
    }
}
