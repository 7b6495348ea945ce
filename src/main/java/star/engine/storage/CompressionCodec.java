package star.engine.storage;

import java.io.IOException;

/**
 * Byte-level compressor applied to each column chunk.
 */
public interface CompressionCodec {
    String name();

    byte[] compress(byte[] raw) throws IOException;

    /** uncompressedLength is the exact size recorded next to the compressed bytes. */
    byte[] decompress(byte[] compressed, int uncompressedLength) throws IOException;
}
