package star.engine.build;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnSchema;
import star.engine.catalog.ConfigurationException;
import star.engine.catalog.DataType;
import star.engine.catalog.Presence;
import star.engine.index.SpatialIndexer;
import star.engine.storage.Compression;

/**
 * Options of one catalog build. Every option except strict and workerThreads is required;
 * {@link Builder#build()} fails with a ConfigurationException naming what is missing or
 * contradictory, before anything touches the disk.
 */
public final class BuildConfig {
    public static final String OUTPUT = "catalog.output";
    public static final String CHUNK_SIZE = "catalog.chunk-size";
    public static final String COLUMNS = "catalog.columns";
    public static final String PARTITION_COLUMNS = "catalog.partition-columns";
    public static final String SORTING_COLUMNS = "catalog.sorting-columns";
    public static final String COMPRESSION = "catalog.compression";
    public static final String ROW_GROUP_SIZE = "catalog.row-group-size";
    public static final String SPATIAL_RESOLUTION = "catalog.spatial-resolution";
    public static final String STRICT = "catalog.strict";
    public static final String WORKER_THREADS = "catalog.worker-threads";

    private final Path outputPath;
    private final int chunkSize;
    private final List<ColumnSchema> columns;
    private final List<String> partitionColumns;
    private final List<String> sortingColumns;
    private final Compression compression;
    private final int rowGroupSize;
    private final int spatialResolution;
    private final boolean strict;
    private final int workerThreads;
    private final CatalogSchema schema;

    private BuildConfig(Builder b) {
        this.outputPath = b.outputPath;
        this.chunkSize = b.chunkSize;
        this.columns = List.copyOf(b.columns);
        this.partitionColumns = List.copyOf(b.partitionColumns);
        this.sortingColumns = List.copyOf(b.sortingColumns);
        this.compression = b.compression;
        this.rowGroupSize = b.rowGroupSize;
        this.spatialResolution = b.spatialResolution;
        this.strict = b.strict;
        this.workerThreads = b.workerThreads;
        this.schema = CatalogSchema.forUserColumns(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .outputPath(outputPath)
            .chunkSize(chunkSize)
            .columns(columns)
            .partitionColumns(partitionColumns)
            .sortingColumns(sortingColumns)
            .compression(compression)
            .rowGroupSize(rowGroupSize)
            .spatialResolution(spatialResolution)
            .strict(strict)
            .workerThreads(workerThreads);
    }

    /**
     * Reads options from properties. catalog.columns picks, by name and in order,
     * from the available column definitions.
     */
    public static BuildConfig fromProperties(Properties props, List<ColumnSchema> available) {
        Builder b = builder();
        String output = trimmed(props, OUTPUT);
        if (output != null) b.outputPath(Paths.get(output));
        Integer chunk = intOption(props, CHUNK_SIZE);
        if (chunk != null) b.chunkSize(chunk);
        String cols = trimmed(props, COLUMNS);
        if (cols != null) {
            Map<String, ColumnSchema> byName = new LinkedHashMap<>();
            for (ColumnSchema c : available) byName.put(c.name(), c);
            List<ColumnSchema> picked = new ArrayList<>();
            for (String name : splitList(cols)) {
                ColumnSchema c = byName.get(name);
                if (c == null) throw new ConfigurationException("Unknown column in " + COLUMNS + ": " + name);
                picked.add(c);
            }
            b.columns(picked);
        }
        // an empty value is an explicit "no partitioning"
        if (props.containsKey(PARTITION_COLUMNS)) b.partitionColumns(splitList(props.getProperty(PARTITION_COLUMNS)));
        String sorting = trimmed(props, SORTING_COLUMNS);
        if (sorting != null) b.sortingColumns(splitList(sorting));
        String codec = trimmed(props, COMPRESSION);
        if (codec != null) b.compression(Compression.fromName(codec));
        Integer rowGroup = intOption(props, ROW_GROUP_SIZE);
        if (rowGroup != null) b.rowGroupSize(rowGroup);
        Integer resolution = intOption(props, SPATIAL_RESOLUTION);
        if (resolution != null) b.spatialResolution(resolution);
        String strict = trimmed(props, STRICT);
        if (strict != null) b.strict(Boolean.parseBoolean(strict));
        Integer workers = intOption(props, WORKER_THREADS);
        if (workers != null) b.workerThreads(workers);
        return b.build();
    }

    private static String trimmed(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static Integer intOption(Properties props, String key) {
        String v = trimmed(props, key);
        if (v == null) return null;
        try {
            return Integer.parseInt(v.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + key + " is not an integer: " + v);
        }
    }

    private static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String part : raw.split(",")) {
            String s = part.trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    public Path outputPath() { return outputPath; }
    public int chunkSize() { return chunkSize; }
    public List<ColumnSchema> columns() { return columns; }
    public List<String> partitionColumns() { return partitionColumns; }
    public List<String> sortingColumns() { return sortingColumns; }
    public Compression compression() { return compression; }
    public int rowGroupSize() { return rowGroupSize; }
    public int spatialResolution() { return spatialResolution; }
    public boolean strict() { return strict; }
    public int workerThreads() { return workerThreads; }

    /** Stored schema: derived columns followed by the configured columns. */
    public CatalogSchema schema() { return schema; }

    @Override
    public String toString() {
        return "BuildConfig{output=" + outputPath + ", chunkSize=" + chunkSize + ", columns=" + schema.columnNames()
            + ", partitionColumns=" + partitionColumns + ", sortingColumns=" + sortingColumns
            + ", compression=" + compression + ", rowGroupSize=" + rowGroupSize
            + ", spatialResolution=" + spatialResolution + ", strict=" + strict
            + ", workerThreads=" + workerThreads + "}";
    }

    public static final class Builder {
        private Path outputPath;
        private Integer chunkSize;
        private List<ColumnSchema> columns;
        private List<String> partitionColumns;
        private List<String> sortingColumns;
        private Compression compression;
        private Integer rowGroupSize;
        private Integer spatialResolution;
        private boolean strict;
        private int workerThreads = 1;

        public Builder outputPath(Path outputPath) { this.outputPath = outputPath; return this; }
        public Builder chunkSize(int chunkSize) { this.chunkSize = chunkSize; return this; }
        public Builder columns(List<ColumnSchema> columns) { this.columns = columns; return this; }
        public Builder partitionColumns(List<String> partitionColumns) { this.partitionColumns = partitionColumns; return this; }
        public Builder sortingColumns(List<String> sortingColumns) { this.sortingColumns = sortingColumns; return this; }
        public Builder compression(Compression compression) { this.compression = compression; return this; }
        public Builder rowGroupSize(int rowGroupSize) { this.rowGroupSize = rowGroupSize; return this; }
        public Builder spatialResolution(int spatialResolution) { this.spatialResolution = spatialResolution; return this; }
        public Builder strict(boolean strict) { this.strict = strict; return this; }
        public Builder workerThreads(int workerThreads) { this.workerThreads = workerThreads; return this; }

        public BuildConfig build() {
            List<String> missing = new ArrayList<>();
            if (outputPath == null) missing.add(OUTPUT);
            if (chunkSize == null) missing.add(CHUNK_SIZE);
            if (columns == null) missing.add(COLUMNS);
            if (partitionColumns == null) missing.add(PARTITION_COLUMNS);
            if (sortingColumns == null) missing.add(SORTING_COLUMNS);
            if (compression == null) missing.add(COMPRESSION);
            if (rowGroupSize == null) missing.add(ROW_GROUP_SIZE);
            if (spatialResolution == null) missing.add(SPATIAL_RESOLUTION);
            if (!missing.isEmpty()) {
                throw new ConfigurationException("Missing required build options: " + missing);
            }
            if (chunkSize <= 0) throw new ConfigurationException(CHUNK_SIZE + " must be positive, got " + chunkSize);
            if (rowGroupSize <= 0) throw new ConfigurationException(ROW_GROUP_SIZE + " must be positive, got " + rowGroupSize);
            if (workerThreads <= 0) throw new ConfigurationException(WORKER_THREADS + " must be positive, got " + workerThreads);
            SpatialIndexer.checkResolution(spatialResolution);
            validateColumns();
            return new BuildConfig(this);
        }

        private void validateColumns() {
            if (columns.isEmpty()) throw new ConfigurationException(COLUMNS + " must not be empty");
            CatalogSchema schema = CatalogSchema.forUserColumns(columns); // rejects duplicates and derived names
            for (ColumnSchema c : columns) {
                if (c.presence() == Presence.DEFAULT_ZERO && !c.type().isNumeric()) {
                    throw new ConfigurationException("Zero default needs a numeric column: " + c.name());
                }
            }
            for (String coord : List.of(CatalogSchema.RA, CatalogSchema.DEC)) {
                if (!schema.has(coord)) throw new ConfigurationException("Coordinate column missing: " + coord);
                ColumnSchema c = schema.column(coord);
                if (c.type() != DataType.DOUBLE || c.presence() != Presence.REQUIRED) {
                    throw new ConfigurationException("Coordinate column must be a required DOUBLE: " + coord);
                }
            }
            Set<String> seen = new HashSet<>();
            for (String s : sortingColumns) {
                if (!seen.add(s)) throw new ConfigurationException("Duplicate sorting column: " + s);
                if (!schema.has(s)) throw new ConfigurationException("Unknown sorting column: " + s);
                if (CatalogSchema.isDerived(s)) throw new ConfigurationException("Derived column is always part of the sort key: " + s);
                ColumnSchema c = schema.column(s);
                if (c.nullable()) throw new ConfigurationException("Sorting column must not be nullable: " + s);
                if (c.type() == DataType.BOOLEAN) throw new ConfigurationException("Sorting column must not be BOOLEAN: " + s);
            }
            seen.clear();
            for (String p : partitionColumns) {
                if (!seen.add(p)) throw new ConfigurationException("Duplicate partition column: " + p);
                if (!schema.has(p)) throw new ConfigurationException("Unknown partition column: " + p);
                if (CatalogSchema.isDerived(p)) throw new ConfigurationException("Cannot partition by derived column: " + p);
                if (schema.column(p).type() == DataType.DOUBLE) {
                    throw new ConfigurationException("Cannot partition by DOUBLE column: " + p);
                }
            }
        }
    }
}
