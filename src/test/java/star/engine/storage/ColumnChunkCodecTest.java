package star.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import star.engine.catalog.ColumnSchema;
import star.engine.catalog.CorruptCatalogException;
import star.engine.catalog.DataType;

public class ColumnChunkCodecTest {
    @Test
    void nullableValuesKeepTheirNulls() {
        ColumnSchema hip = ColumnSchema.nullable("hip", DataType.INT);
        List<Object> values = Arrays.asList(1, null, 3, null, null, 6, 7, 8, null);
        byte[] raw = ColumnChunkCodec.encode(hip, values);
        assertEquals(values, ColumnChunkCodec.decode(hip, raw, values.size()));
    }

    @Test
    void categoriesAreDictionaryEncoded() {
        ColumnSchema con = ColumnSchema.nullable("constellation_id", DataType.CATEGORY);
        List<Object> values = Arrays.asList("ori", "ori", "cma", null, "ori", "cma");
        byte[] raw = ColumnChunkCodec.encode(con, values);
        assertEquals(values, ColumnChunkCodec.decode(con, raw, values.size()));

        ColumnSchema plain = ColumnSchema.nullable("ccdm", DataType.VARCHAR);
        List<Object> many = Arrays.asList(new Object[200]);
        for (int i = 0; i < many.size(); i++) many.set(i, "ori");
        assertTrue(ColumnChunkCodec.encode(con, many).length < ColumnChunkCodec.encode(plain, many).length);
    }

    @Test
    void doublesAreBitExact() {
        ColumnSchema mag = ColumnSchema.required("magnitude", DataType.DOUBLE);
        List<Object> values = List.of(-1.44, -0.0, 0.1 + 0.2, Double.MIN_VALUE);
        List<Object> back = ColumnChunkCodec.decode(mag, ColumnChunkCodec.encode(mag, values), 4);
        for (int i = 0; i < values.size(); i++) {
            assertEquals(Double.doubleToRawLongBits((Double) values.get(i)), Double.doubleToRawLongBits((Double) back.get(i)));
        }
    }

    @Test
    void truncatedOrPaddedChunkIsCorrupt() {
        ColumnSchema pk = ColumnSchema.required("pk", DataType.LONG);
        byte[] raw = ColumnChunkCodec.encode(pk, List.of(1L, 2L, 3L));
        assertThrows(CorruptCatalogException.class,
            () -> ColumnChunkCodec.decode(pk, Arrays.copyOf(raw, raw.length - 1), 3));
        assertThrows(CorruptCatalogException.class,
            () -> ColumnChunkCodec.decode(pk, Arrays.copyOf(raw, raw.length + 8), 3));
    }
}
