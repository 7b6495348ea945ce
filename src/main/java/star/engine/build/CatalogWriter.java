package star.engine.build;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import star.engine.catalog.CatalogBuildException;
import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnSchema;
import star.engine.catalog.ManifestStore;
import star.engine.catalog.PartitionMeta;
import star.engine.catalog.PartitionValue;
import star.engine.catalog.RowGroupMeta;
import star.engine.storage.PartitionFileWriter;
import star.engine.storage.Record;
import star.engine.storage.RunFileReader;

/**
 * Columnar writer: merges sorted runs into partition files of row groups.
 *
 * Runs are merged k-way by the composite sort key, so every partition receives its
 * records in global key order and consecutive row groups never overlap. Partition
 * files are named from partition column values ({@code col=value/part-00000.skc}),
 * or {@code part-00000.skc} when the catalog is not partitioned. Files and their
 * directories are forced to disk before {@link #write} returns. The catalog root itself
 * is synced once the manifest is renamed into place.
 */
public class CatalogWriter {
    public static final String PART_FILE = "part-00000.skc";
    static final String NULL_PARTITION = "__null__";
    // Every partition keeps its file open until the merge ends.
    static final int MAX_PARTITIONS = 1024;

    private final BuildConfig config;
    private final CatalogSchema schema;
    private final SortOrder order;
    private final BuildObserver observer;
    private final Path outputDir;
    private final int[] partitionIndices;
    private final List<String> statsColumns;
    private final int maxPartitions;

    private final Map<String, PartitionState> partitions = new LinkedHashMap<>();

    private static final class PartitionState {
        final String relativePath;
        final List<PartitionValue> values;
        final PartitionFileWriter writer;
        final List<Record> pending = new ArrayList<>();

        PartitionState(String relativePath, List<PartitionValue> values, PartitionFileWriter writer) {
            this.relativePath = relativePath;
            this.values = values;
            this.writer = writer;
        }
    }

    public CatalogWriter(BuildConfig config, SortOrder order, BuildObserver observer) {
        this(config, order, observer, MAX_PARTITIONS);
    }

    CatalogWriter(BuildConfig config, SortOrder order, BuildObserver observer, int maxPartitions) {
        this.maxPartitions = maxPartitions;
        this.config = config;
        this.schema = config.schema();
        this.order = order;
        this.observer = observer;
        this.outputDir = config.outputPath();
        this.partitionIndices = new int[config.partitionColumns().size()];
        for (int i = 0; i < partitionIndices.length; i++) {
            partitionIndices[i] = schema.indexOf(config.partitionColumns().get(i));
        }
        this.statsColumns = config.sortingColumns();
    }

    /**
     * Merges the runs and writes every partition file. Returns partition metadata
     * sorted by path. Partition files are closed on return, also on failure.
     */
    public List<PartitionMeta> write(List<Path> runs) throws IOException {
        List<RunFileReader> readers = new ArrayList<>(runs.size());
        try {
            for (int i = 0; i < runs.size(); i++) {
                readers.add(new RunFileReader(runs.get(i), schema.columns(), i));
            }
            PriorityQueue<RunFileReader> heads = new PriorityQueue<>(Math.max(1, readers.size()),
                Comparator.comparing(RunFileReader::peek, order).thenComparingInt(RunFileReader::runIndex));
            for (RunFileReader r : readers) {
                if (r.peek() != null) heads.add(r);
            }
            while (!heads.isEmpty()) {
                RunFileReader top = heads.poll();
                append(top.next());
                if (top.peek() != null) heads.add(top);
            }
            for (PartitionState p : partitions.values()) flush(p);
        } finally {
            IOException failure = null;
            for (RunFileReader r : readers) {
                try {
                    r.close();
                } catch (IOException e) {
                    failure = e;
                }
            }
            for (PartitionState p : partitions.values()) {
                try {
                    p.writer.close();
                } catch (IOException e) {
                    failure = e;
                }
            }
            if (failure != null) throw failure;
        }

        for (PartitionState p : partitions.values()) {
            Path dir = p.writer.file().getParent();
            if (!dir.equals(outputDir)) ManifestStore.syncDirectory(dir);
        }

        List<PartitionMeta> out = new ArrayList<>(partitions.size());
        for (PartitionState p : partitions.values()) {
            out.add(new PartitionMeta(p.relativePath, p.values, p.writer.recordCount(), p.writer.rowGroups()));
        }
        out.sort(Comparator.comparing(PartitionMeta::path));
        return out;
    }

    private void append(Record record) throws IOException {
        PartitionState p = partitionFor(record);
        p.pending.add(record);
        if (p.pending.size() >= config.rowGroupSize()) flush(p);
    }

    private void flush(PartitionState p) throws IOException {
        if (p.pending.isEmpty()) return;
        RowGroupMeta meta = p.writer.writeRowGroup(p.pending);
        observer.onRowGroupWritten(p.relativePath, p.writer.rowGroups().size() - 1, meta.rowCount());
        p.pending.clear();
    }

    private PartitionState partitionFor(Record record) throws IOException {
        List<PartitionValue> values = new ArrayList<>(partitionIndices.length);
        StringBuilder dir = new StringBuilder();
        for (int idx : partitionIndices) {
            ColumnSchema col = schema.columns().get(idx);
            String text = col.type().format(record.get(idx));
            values.add(new PartitionValue(col.name(), text));
            dir.append(col.name()).append('=').append(directoryValue(text)).append('/');
        }
        String relativePath = dir + PART_FILE;
        PartitionState p = partitions.get(relativePath);
        if (p == null) {
            if (partitions.size() >= maxPartitions) {
                throw new CatalogBuildException("Partitioning by " + config.partitionColumns() + " yields more than "
                    + maxPartitions + " partitions; choose lower-cardinality partition columns");
            }
            PartitionFileWriter writer = new PartitionFileWriter(outputDir.resolve(relativePath), schema,
                config.compression(), statsColumns, order.keyColumns());
            p = new PartitionState(relativePath, values, writer);
            partitions.put(relativePath, p);
        }
        return p;
    }

    static String directoryValue(String text) {
        if (text == null) return NULL_PARTITION;
        return URLEncoder.encode(text, StandardCharsets.UTF_8);
    }
}
