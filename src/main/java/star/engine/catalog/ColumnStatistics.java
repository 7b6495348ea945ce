package star.engine.catalog;

// Min/max of one column inside a row group, in DataType canonical text form.
public record ColumnStatistics(String column, String min, String max) {}
