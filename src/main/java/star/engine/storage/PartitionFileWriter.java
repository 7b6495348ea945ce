package star.engine.storage;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnStatistics;
import star.engine.catalog.RowGroupMeta;

/**
 * Appends row groups to one partition file.
 *
 * File layout: int magic, int format version, then row group blocks back to back.
 * Block offsets and statistics are returned to the caller for the manifest;
 * the file itself has no footer. Closing forces the file to disk, so a manifest
 * written afterwards never points at blocks still sitting in the page cache.
 */
public final class PartitionFileWriter implements Closeable {
    public static final int FILE_MAGIC = 0x534B5943; // "SKYC"
    public static final int FILE_VERSION = 1;
    static final int FILE_HEADER_BYTES = 8;

    private final Path file;
    private final CatalogSchema schema;
    private final Compression codec;
    private final List<String> statsColumns;
    private final List<String> keyColumns;
    private final FileChannel channel;
    private final OutputStream out;
    private final List<RowGroupMeta> rowGroups = new ArrayList<>();
    private long position;
    private long recordCount;

    public PartitionFileWriter(Path file, CatalogSchema schema, Compression codec,
                               List<String> statsColumns, List<String> keyColumns) throws IOException {
        this.file = file;
        this.schema = schema;
        this.codec = codec;
        this.statsColumns = List.copyOf(statsColumns);
        this.keyColumns = List.copyOf(keyColumns);
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
        this.channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        this.out = new BufferedOutputStream(Channels.newOutputStream(channel));
        DataOutputStream header = new DataOutputStream(out);
        header.writeInt(FILE_MAGIC);
        header.writeInt(FILE_VERSION);
        this.position = FILE_HEADER_BYTES;
    }

    /** Writes rows as one row group; rows must already be in stored order. */
    public RowGroupMeta writeRowGroup(List<Record> rows) throws IOException {
        if (rows.isEmpty()) throw new IllegalArgumentException("Row group must not be empty");
        byte[] block = RowGroupBlock.encode(schema, rows, codec, statsColumns);
        out.write(block);

        List<ColumnStatistics> stats = new ArrayList<>(statsColumns.size());
        for (String name : statsColumns) {
            int idx = schema.indexOf(name);
            List<Object> values = new ArrayList<>(rows.size());
            for (Record r : rows) values.add(r.get(idx));
            ColumnStatistics s = RowGroupBlock.statistics(schema.columns().get(idx), values);
            if (s != null) stats.add(s);
        }
        RowGroupMeta meta = new RowGroupMeta(position, block.length, rows.size(),
            sortKey(rows.get(0)), sortKey(rows.get(rows.size() - 1)), stats);
        rowGroups.add(meta);
        position += block.length;
        recordCount += rows.size();
        return meta;
    }

    public List<String> sortKey(Record r) {
        List<String> key = new ArrayList<>(keyColumns.size());
        for (String name : keyColumns) {
            int idx = schema.indexOf(name);
            key.add(schema.columns().get(idx).type().format(r.get(idx)));
        }
        return key;
    }

    public Path file() { return file; }
    public List<RowGroupMeta> rowGroups() { return List.copyOf(rowGroups); }
    public long recordCount() { return recordCount; }

    /** Flushes buffered blocks and forces them to the device before closing. */
    @Override
    public void close() throws IOException {
        try (OutputStream toClose = out) {
            if (channel.isOpen()) {
                toClose.flush();
                channel.force(true);
            }
        }
    }
}
