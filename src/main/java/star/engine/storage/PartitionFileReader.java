package star.engine.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.CorruptCatalogException;
import star.engine.catalog.RowGroupMeta;

/**
 * Reads single row groups from a partition file. Each read opens, seeks and closes
 * the file, so no handle is held between row groups and instances are safe to share.
 */
public final class PartitionFileReader {
    private final Path file;
    private final CatalogSchema schema;

    public PartitionFileReader(Path file, CatalogSchema schema) {
        this.file = file;
        this.schema = schema;
    }

    public RowGroupBlock read(RowGroupMeta meta) {
        byte[] block = new byte[meta.length()];
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            if (meta.offset() < PartitionFileWriter.FILE_HEADER_BYTES
                    || meta.offset() + meta.length() > raf.length()) {
                throw new CorruptCatalogException("Row group at offset " + meta.offset()
                    + " (" + meta.length() + " bytes) lies outside " + file);
            }
            checkHeader(raf);
            raf.seek(meta.offset());
            raf.readFully(block);
        } catch (EOFException e) {
            throw new CorruptCatalogException("Partition file truncated: " + file, e);
        } catch (IOException e) {
            throw new CorruptCatalogException("Failed reading partition file " + file, e);
        }
        RowGroupBlock parsed = RowGroupBlock.parse(schema, block);
        if (parsed.rowCount() != meta.rowCount()) {
            throw new CorruptCatalogException("Row group at offset " + meta.offset() + " holds "
                + parsed.rowCount() + " rows, manifest says " + meta.rowCount());
        }
        return parsed;
    }

    private void checkHeader(RandomAccessFile raf) throws IOException {
        raf.seek(0);
        int magic = raf.readInt();
        int version = raf.readInt();
        if (magic != PartitionFileWriter.FILE_MAGIC) {
            throw new CorruptCatalogException("Not a partition file: " + file);
        }
        if (version != PartitionFileWriter.FILE_VERSION) {
            throw new CorruptCatalogException("Unsupported partition file version " + version + ": " + file);
        }
    }

    public Path file() { return file; }
}
