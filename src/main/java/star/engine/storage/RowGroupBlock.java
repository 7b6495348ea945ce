package star.engine.storage;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.CRC32;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.ColumnSchema;
import star.engine.catalog.ColumnStatistics;
import star.engine.catalog.CorruptCatalogException;
import star.engine.catalog.DataType;

/**
 * One self-describing row group: column chunks plus their statistics.
 *
 * Layout:
 * [0..3]   int   magic
 * [4..7]   int   rowCount
 * [8..9]   short columnCount
 * per column:
 *   short+bytes  name (UTF-8)
 *   byte  type ordinal
 *   byte  codec id
 *   byte  hasStats, then when 1: short+bytes min, short+bytes max (canonical text)
 *   int   uncompressedLength
 *   int   compressedLength
 *   bytes compressed chunk
 * int   CRC32 of all preceding bytes of the block
 *
 * Columns decode lazily so a lookup only pays for the columns it touches.
 */
public final class RowGroupBlock {
    static final int MAGIC = 0x534B5247; // "SKRG"
    private static final int CRC_BYTES = 4;

    private final CatalogSchema schema;
    private final int rowCount;
    private final List<Chunk> chunks;
    private final List<List<Object>> decoded;

    private record Chunk(ColumnSchema column, Compression codec, ColumnStatistics stats,
                         int uncompressedLength, byte[] payload) {}

    private RowGroupBlock(CatalogSchema schema, int rowCount, List<Chunk> chunks) {
        this.schema = schema;
        this.rowCount = rowCount;
        this.chunks = chunks;
        this.decoded = new ArrayList<>(Collections.nCopies(chunks.size(), null));
    }

    /** Encodes rows (already in stored order) into a block, with statistics for statsColumns. */
    public static byte[] encode(CatalogSchema schema, List<Record> rows, Compression codec,
                                List<String> statsColumns) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(MAGIC);
        out.writeInt(rows.size());
        out.writeShort(schema.size());
        List<ColumnSchema> columns = schema.columns();
        for (int c = 0; c < columns.size(); c++) {
            ColumnSchema col = columns.get(c);
            List<Object> values = new ArrayList<>(rows.size());
            for (Record r : rows) values.add(r.get(c));

            writeText(out, col.name());
            out.writeByte(col.type().ordinal());
            out.writeByte(codec.id());
            ColumnStatistics stats = statsColumns.contains(col.name()) ? statistics(col, values) : null;
            if (stats == null) {
                out.writeByte(0);
            } else {
                out.writeByte(1);
                writeText(out, stats.min());
                writeText(out, stats.max());
            }
            byte[] raw = ColumnChunkCodec.encode(col, values);
            byte[] compressed = codec.compress(raw);
            out.writeInt(raw.length);
            out.writeInt(compressed.length);
            out.write(compressed);
        }
        out.flush();
        CRC32 crc = new CRC32();
        crc.update(bytes.toByteArray());
        out.writeInt((int) crc.getValue());
        out.flush();
        return bytes.toByteArray();
    }

    public static RowGroupBlock parse(CatalogSchema schema, byte[] block) {
        if (block.length < CRC_BYTES + 10) {
            throw new CorruptCatalogException("Row group block too short: " + block.length + " bytes");
        }
        CRC32 crc = new CRC32();
        crc.update(block, 0, block.length - CRC_BYTES);
        int storedCrc = ByteBuffer.wrap(block, block.length - CRC_BYTES, CRC_BYTES).getInt();
        if ((int) crc.getValue() != storedCrc) {
            throw new CorruptCatalogException("Row group checksum mismatch");
        }
        try {
            ByteBuffer in = ByteBuffer.wrap(block, 0, block.length - CRC_BYTES);
            if (in.getInt() != MAGIC) throw new CorruptCatalogException("Bad row group magic");
            int rowCount = in.getInt();
            int columnCount = in.getShort();
            if (columnCount != schema.size()) {
                throw new CorruptCatalogException("Row group has " + columnCount + " columns, manifest schema has " + schema.size());
            }
            List<Chunk> chunks = new ArrayList<>(columnCount);
            for (int c = 0; c < columnCount; c++) {
                ColumnSchema expected = schema.columns().get(c);
                String name = readText(in);
                int typeOrdinal = in.get();
                if (!expected.name().equals(name) || expected.type().ordinal() != typeOrdinal) {
                    throw new CorruptCatalogException("Row group column " + c + " is " + name
                        + ", manifest expects " + expected.name() + " " + expected.type());
                }
                Compression codec = Compression.fromId(in.get());
                ColumnStatistics stats = null;
                if (in.get() == 1) {
                    stats = new ColumnStatistics(name, readText(in), readText(in));
                }
                int uncompressedLength = in.getInt();
                int compressedLength = in.getInt();
                if (compressedLength < 0 || compressedLength > in.remaining()) {
                    throw new CorruptCatalogException("Column chunk length out of bounds for " + name);
                }
                byte[] payload = new byte[compressedLength];
                in.get(payload);
                chunks.add(new Chunk(expected, codec, stats, uncompressedLength, payload));
            }
            return new RowGroupBlock(schema, rowCount, chunks);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new CorruptCatalogException("Malformed row group block", e);
        }
    }

    public int rowCount() { return rowCount; }

    /** Statistics stored in the block header for a column, or null. */
    public ColumnStatistics storedStatistics(String column) {
        int idx = schema.indexOf(column);
        return idx < 0 ? null : chunks.get(idx).stats();
    }

    /** Decoded values of one column; decoded on first access. */
    public List<Object> column(int index) {
        List<Object> values = decoded.get(index);
        if (values == null) {
            Chunk chunk = chunks.get(index);
            byte[] raw;
            try {
                raw = chunk.codec().decompress(chunk.payload(), chunk.uncompressedLength());
            } catch (IOException | RuntimeException e) {
                throw new CorruptCatalogException("Failed decompressing column " + chunk.column().name(), e);
            }
            if (raw.length != chunk.uncompressedLength()) {
                throw new CorruptCatalogException("Column " + chunk.column().name() + " decompressed to "
                    + raw.length + " bytes, expected " + chunk.uncompressedLength());
            }
            values = ColumnChunkCodec.decode(chunk.column(), raw, rowCount);
            decoded.set(index, values);
        }
        return values;
    }

    public Record record(int row) {
        List<Object> values = new ArrayList<>(chunks.size());
        for (int c = 0; c < chunks.size(); c++) values.add(column(c).get(row));
        return new Record(values);
    }

    public List<Record> records() {
        List<Record> out = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) out.add(record(r));
        return out;
    }

    /** Min/max over non-null values; null when every value is null. */
    public static ColumnStatistics statistics(ColumnSchema col, List<Object> values) {
        DataType type = col.type();
        Object min = null;
        Object max = null;
        for (Object v : values) {
            if (v == null) continue;
            if (min == null || type.compare(v, min) < 0) min = v;
            if (max == null || type.compare(v, max) > 0) max = v;
        }
        if (min == null) return null;
        return new ColumnStatistics(col.name(), type.format(min), type.format(max));
    }

    private static void writeText(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        if (b.length > 0xFFFF) throw new IOException("Text too long for row group header: " + b.length + " bytes");
        out.writeShort(b.length);
        out.write(b);
    }

    private static String readText(ByteBuffer in) {
        int len = in.getShort() & 0xFFFF;
        byte[] b = new byte[len];
        in.get(b);
        return new String(b, StandardCharsets.UTF_8);
    }
}
