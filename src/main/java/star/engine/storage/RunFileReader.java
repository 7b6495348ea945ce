package star.engine.storage;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import star.engine.catalog.ColumnSchema;

/**
 * Streams records back from a run file in the order they were spilled.
 * {@link #peek()} exposes the head record for k-way merging.
 */
public final class RunFileReader implements Closeable {
    private final DataInputStream in;
    private final List<ColumnSchema> columns;
    private final int runIndex;
    private int remaining;
    private Record head;

    public RunFileReader(Path file, List<ColumnSchema> columns, int runIndex) throws IOException {
        this.in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file), 1 << 16));
        this.columns = columns;
        this.runIndex = runIndex;
        try {
            this.remaining = in.readInt();
            advance();
        } catch (IOException e) {
            in.close();
            throw e;
        }
    }

    public Record peek() { return head; }

    public int runIndex() { return runIndex; }

    /** Returns the head record and moves to the next one. */
    public Record next() throws IOException {
        Record current = head;
        advance();
        return current;
    }

    private void advance() throws IOException {
        if (remaining == 0) {
            head = null;
            return;
        }
        int len = in.readInt();
        byte[] bytes = new byte[len];
        in.readFully(bytes);
        head = Record.fromBytes(bytes, columns);
        remaining--;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
