package star.engine.catalog;

import java.util.List;

/**
 * Location and statistics of one row group inside a partition file.
 * firstKey/lastKey hold the composite sort key (sorting columns, spatial_index, pk)
 * of the group's first and last record.
 */
public record RowGroupMeta(long offset,
                           int length,
                           int rowCount,
                           List<String> firstKey,
                           List<String> lastKey,
                           List<ColumnStatistics> statistics) {

    public ColumnStatistics statisticsFor(String column) {
        if (statistics == null) return null;
        for (ColumnStatistics s : statistics) {
            if (s.column().equals(column)) return s;
        }
        return null;
    }
}
