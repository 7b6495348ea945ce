package star.engine.storage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import star.engine.catalog.ColumnSchema;

/**
 * Immutable stored row: one value per column of the stored schema, in schema order.
 * Row (de)serialization is used for sorted run files during a build; partition files
 * hold the same values column by column.
 */
public final class Record {
    private final List<Object> values;

    private static final int INT_BYTES = 4;
    private static final int LONG_BYTES = 8;
    private static final int DOUBLE_BYTES = 8;
    private static final int BOOLEAN_BYTES = 1; // stored as single byte (1 or 0)
    private static final int VARCHAR_PREFIX_BYTES = 4; // length prefix for VARCHAR
    private static final int NULL_FLAG_BYTES = 1; // only for nullable columns

    public Record(List<Object> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int index) {
        return values.get(index);
    }

    // Serialize record to byte[]
    public byte[] toBytes(List<ColumnSchema> columns) {
        ByteBuffer buffer = ByteBuffer.allocate(computeSerializedSize(columns));

        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema col = columns.get(i);
            Object val = values.get(i);
            if (col.nullable()) {
                buffer.put((byte) (val == null ? 0 : 1));
                if (val == null) continue;
            }
            switch (col.type()) {
                case INT -> buffer.putInt((Integer) val);
                case LONG -> buffer.putLong((Long) val);
                case DOUBLE -> buffer.putLong(Double.doubleToRawLongBits((Double) val));
                case BOOLEAN -> buffer.put((byte) ((Boolean) val ? 1 : 0));
                case VARCHAR, CATEGORY -> {
                    byte[] strBytes = ((String) val).getBytes(StandardCharsets.UTF_8);
                    buffer.putInt(strBytes.length);
                    buffer.put(strBytes);
                }
            }
        }

        return buffer.array();
    }

    private int computeSerializedSize(List<ColumnSchema> columns) {
        int size = 0;
        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema col = columns.get(i);
            Object val = values.get(i);
            if (col.nullable()) {
                size += NULL_FLAG_BYTES;
                if (val == null) continue;
            }
            switch (col.type()) {
                case INT -> size += INT_BYTES;
                case LONG -> size += LONG_BYTES;
                case DOUBLE -> size += DOUBLE_BYTES;
                case BOOLEAN -> size += BOOLEAN_BYTES;
                case VARCHAR, CATEGORY -> {
                    String s = (String) val;
                    size += VARCHAR_PREFIX_BYTES + s.getBytes(StandardCharsets.UTF_8).length;
                }
            }
        }
        return size;
    }

    // Deserialize record from byte[]
    public static Record fromBytes(byte[] data, List<ColumnSchema> columns) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        List<Object> values = new ArrayList<>(columns.size());

        for (ColumnSchema col : columns) {
            if (col.nullable() && buffer.get() == 0) {
                values.add(null);
                continue;
            }
            switch (col.type()) {
                case INT -> values.add(buffer.getInt());
                case LONG -> values.add(buffer.getLong());
                case DOUBLE -> values.add(Double.longBitsToDouble(buffer.getLong()));
                case BOOLEAN -> values.add(buffer.get() == 1);
                case VARCHAR, CATEGORY -> {
                    int len = buffer.getInt();
                    byte[] strBytes = new byte[len];
                    buffer.get(strBytes);
                    values.add(new String(strBytes, StandardCharsets.UTF_8));
                }
            }
        }

        return new Record(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() {
        return values.toString();
    }
}
