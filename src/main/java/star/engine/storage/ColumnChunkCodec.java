package star.engine.storage;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import star.engine.catalog.ColumnSchema;
import star.engine.catalog.CorruptCatalogException;

/**
 * Encodes the values of one column of a row group (uncompressed form).
 *
 * Layout:
 * [nullable columns only] byte hasNulls, then ceil(n/8) bitmap bytes when hasNulls == 1 (bit set = null)
 * INT      n * int        (null rows hold 0)
 * LONG     n * long       (null rows hold 0)
 * DOUBLE   n * long raw bits
 * BOOLEAN  n * byte
 * VARCHAR  per non-null row: int length + UTF-8 bytes
 * CATEGORY int dictSize, per entry: int length + UTF-8 bytes; then per non-null row: int code
 */
public final class ColumnChunkCodec {
    private ColumnChunkCodec() {}

    public static byte[] encode(ColumnSchema col, List<Object> values) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(estimate(col, values.size()));
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            if (col.nullable()) writeNulls(out, values);
            switch (col.type()) {
                case INT -> { for (Object v : values) out.writeInt(v == null ? 0 : (Integer) v); }
                case LONG -> { for (Object v : values) out.writeLong(v == null ? 0L : (Long) v); }
                case DOUBLE -> {
                    for (Object v : values) out.writeLong(v == null ? 0L : Double.doubleToRawLongBits((Double) v));
                }
                case BOOLEAN -> { for (Object v : values) out.writeByte(v != null && (Boolean) v ? 1 : 0); }
                case VARCHAR -> {
                    for (Object v : values) {
                        if (v != null) writeString(out, (String) v);
                    }
                }
                case CATEGORY -> writeDictionary(out, values);
            }
        } catch (IOException e) {
            // in-memory stream
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    public static List<Object> decode(ColumnSchema col, byte[] data, int rowCount) {
        try {
            ByteBuffer in = ByteBuffer.wrap(data);
            boolean[] nulls = col.nullable() ? readNulls(in, rowCount) : null;
            List<Object> out = new ArrayList<>(rowCount);
            switch (col.type()) {
                case INT -> {
                    for (int i = 0; i < rowCount; i++) {
                        int v = in.getInt();
                        out.add(isNull(nulls, i) ? null : v);
                    }
                }
                case LONG -> {
                    for (int i = 0; i < rowCount; i++) {
                        long v = in.getLong();
                        out.add(isNull(nulls, i) ? null : v);
                    }
                }
                case DOUBLE -> {
                    for (int i = 0; i < rowCount; i++) {
                        double v = Double.longBitsToDouble(in.getLong());
                        out.add(isNull(nulls, i) ? null : v);
                    }
                }
                case BOOLEAN -> {
                    for (int i = 0; i < rowCount; i++) {
                        boolean v = in.get() == 1;
                        out.add(isNull(nulls, i) ? null : v);
                    }
                }
                case VARCHAR -> {
                    for (int i = 0; i < rowCount; i++) {
                        out.add(isNull(nulls, i) ? null : readString(in));
                    }
                }
                case CATEGORY -> {
                    int dictSize = in.getInt();
                    String[] dict = new String[dictSize];
                    for (int d = 0; d < dictSize; d++) dict[d] = readString(in);
                    for (int i = 0; i < rowCount; i++) {
                        if (isNull(nulls, i)) {
                            out.add(null);
                            continue;
                        }
                        int code = in.getInt();
                        if (code < 0 || code >= dictSize) {
                            throw new CorruptCatalogException("Dictionary code " + code + " out of range for column " + col.name());
                        }
                        out.add(dict[code]);
                    }
                }
            }
            if (in.hasRemaining()) {
                throw new CorruptCatalogException("Trailing bytes in column chunk " + col.name());
            }
            return out;
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new CorruptCatalogException("Truncated column chunk for " + col.name(), e);
        }
    }

    private static void writeNulls(DataOutputStream out, List<Object> values) throws IOException {
        boolean any = false;
        for (Object v : values) {
            if (v == null) { any = true; break; }
        }
        out.writeByte(any ? 1 : 0);
        if (!any) return;
        byte[] bitmap = new byte[(values.size() + 7) / 8];
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) bitmap[i >>> 3] |= (byte) (1 << (i & 7));
        }
        out.write(bitmap);
    }

    private static boolean[] readNulls(ByteBuffer in, int rowCount) {
        if (in.get() == 0) return null;
        byte[] bitmap = new byte[(rowCount + 7) / 8];
        in.get(bitmap);
        boolean[] nulls = new boolean[rowCount];
        for (int i = 0; i < rowCount; i++) {
            nulls[i] = (bitmap[i >>> 3] & (1 << (i & 7))) != 0;
        }
        return nulls;
    }

    private static boolean isNull(boolean[] nulls, int i) {
        return nulls != null && nulls[i];
    }

    private static void writeDictionary(DataOutputStream out, List<Object> values) throws IOException {
        Map<String, Integer> codes = new HashMap<>();
        List<String> dict = new ArrayList<>();
        int[] rowCodes = new int[values.size()];
        for (int i = 0; i < values.size(); i++) {
            Object v = values.get(i);
            if (v == null) { rowCodes[i] = -1; continue; }
            String s = (String) v;
            Integer code = codes.get(s);
            if (code == null) {
                code = dict.size();
                codes.put(s, code);
                dict.add(s);
            }
            rowCodes[i] = code;
        }
        out.writeInt(dict.size());
        for (String s : dict) writeString(out, s);
        for (int code : rowCodes) {
            if (code >= 0) out.writeInt(code);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(ByteBuffer in) {
        int len = in.getInt();
        if (len < 0 || len > in.remaining()) {
            throw new CorruptCatalogException("Invalid string length " + len);
        }
        byte[] b = new byte[len];
        in.get(b);
        return new String(b, StandardCharsets.UTF_8);
    }

    private static int estimate(ColumnSchema col, int n) {
        return switch (col.type()) {
            case INT -> 4 * n + 16;
            case LONG, DOUBLE -> 8 * n + 16;
            case BOOLEAN -> n + 16;
            case VARCHAR, CATEGORY -> 8 * n + 64;
        };
    }
}
