package star.engine.catalog;

// Value of one partition column for a partition; value is null for the null partition.
public record PartitionValue(String column, String value) {}
