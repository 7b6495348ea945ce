package star.engine.storage;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import star.engine.catalog.ColumnSchema;

/**
 * Spills one sorted chunk to a temporary run file: int count, then per record
 * int length + serialized row bytes.
 */
public final class RunFileWriter {
    private RunFileWriter() {}

    public static void write(Path file, List<ColumnSchema> columns, List<Record> sorted) throws IOException {
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(
                Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE), 1 << 16))) {
            out.writeInt(sorted.size());
            for (Record r : sorted) {
                byte[] bytes = r.toBytes(columns);
                out.writeInt(bytes.length);
                out.write(bytes);
            }
        }
    }
}
