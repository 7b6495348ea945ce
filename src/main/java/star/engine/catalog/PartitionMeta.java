package star.engine.catalog;

import java.util.List;

// One physical partition file: relative path, partition key, and its row groups in stored order.
public record PartitionMeta(String path, List<PartitionValue> values, long recordCount, List<RowGroupMeta> rowGroups) {

    /** Canonical text value of a partition column, or null when absent or null. */
    public String valueOf(String column) {
        if (values == null) return null;
        for (PartitionValue v : values) {
            if (v.column().equals(column)) return v.value();
        }
        return null;
    }
}
