package star.engine.storage;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.xerial.snappy.Snappy;

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

import star.engine.catalog.ConfigurationException;

/**
 * Named column chunk codecs. The name is what the manifest records, so a reader
 * resolves the codec with {@link #fromName(String)} and needs no outside configuration.
 */
public enum Compression implements CompressionCodec {
    NONE {
        @Override
        public byte[] compress(byte[] raw) { return raw; }

        @Override
        public byte[] decompress(byte[] compressed, int uncompressedLength) { return compressed; }
    },
    SNAPPY {
        @Override
        public byte[] compress(byte[] raw) throws IOException { return Snappy.compress(raw); }

        @Override
        public byte[] decompress(byte[] compressed, int uncompressedLength) throws IOException {
            return Snappy.uncompress(compressed);
        }
    },
    LZ4 {
        @Override
        public byte[] compress(byte[] raw) { return Lz4Holder.COMPRESSOR.compress(raw); }

        @Override
        public byte[] decompress(byte[] compressed, int uncompressedLength) {
            return Lz4Holder.DECOMPRESSOR.decompress(compressed, uncompressedLength);
        }
    },
    GZIP {
        @Override
        public byte[] compress(byte[] raw) throws IOException {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
            try (OutputStream out = new GZIPOutputStream(bytes)) {
                out.write(raw);
            }
            return bytes.toByteArray();
        }

        @Override
        public byte[] decompress(byte[] compressed, int uncompressedLength) throws IOException {
            try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
                return in.readNBytes(uncompressedLength);
            }
        }
    };

    // Stable one-byte id written into row group blocks.
    public byte id() {
        return (byte) ordinal();
    }

    public static Compression fromId(byte id) {
        Compression[] all = values();
        if (id < 0 || id >= all.length) {
            throw new IllegalArgumentException("Unknown compression id: " + id);
        }
        return all[id];
    }

    public static Compression fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Compression codec must be named");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown compression codec: " + name);
        }
    }

    private static final class Lz4Holder {
        static final LZ4Compressor COMPRESSOR = LZ4Factory.fastestInstance().fastCompressor();
        static final LZ4SafeDecompressor DECOMPRESSOR = LZ4Factory.fastestInstance().safeDecompressor();
    }
}
