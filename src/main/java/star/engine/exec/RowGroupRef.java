package star.engine.exec;

import star.engine.catalog.PartitionMeta;
import star.engine.catalog.RowGroupMeta;

// A row group selected for reading, with its position in the manifest.
public record RowGroupRef(int partition, int rowGroup, PartitionMeta partitionMeta, RowGroupMeta meta) {}
