package star.engine.catalog;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class DataTypeTest {
    @Test
    void coerceWidensWithoutLoss() {
        assertEquals(5L, DataType.LONG.coerce(5));
        assertEquals(5.0, DataType.DOUBLE.coerce(5));
        assertEquals(7, DataType.INT.coerce(7L));
        assertNull(DataType.INT.coerce(1L + Integer.MAX_VALUE));
        assertNull(DataType.INT.coerce(1.5));
        assertNull(DataType.VARCHAR.coerce(3));
        assertEquals("cma", DataType.CATEGORY.coerce("cma"));
    }

    @Test
    void longsBeyondDoublePrecisionDoNotCoerceToDouble() {
        long exact = 1L << 53;
        assertEquals((double) exact, DataType.DOUBLE.coerce(exact));
        assertEquals((double) -exact, DataType.DOUBLE.coerce(-exact));
        assertNull(DataType.DOUBLE.coerce(exact + 1));
        assertNull(DataType.DOUBLE.coerce(Long.MIN_VALUE));
    }

    @Test
    void formatAndParseAreExact() {
        double tricky = 0.1 + 0.2;
        assertEquals(tricky, DataType.DOUBLE.parse(DataType.DOUBLE.format(tricky)));
        assertEquals(-1.44, DataType.DOUBLE.parse("-1.44"));
        assertEquals(Long.MIN_VALUE, DataType.LONG.parse(DataType.LONG.format(Long.MIN_VALUE)));
        assertNull(DataType.INT.format(null));
        assertNull(DataType.VARCHAR.parse(null));
    }

    @Test
    void doublesCompareNumerically() {
        assertTrue(DataType.DOUBLE.compare(-1.44, 0.03) < 0);
        assertTrue(DataType.DOUBLE.compare(-0.0, 0.0) < 0);
        assertEquals(0, DataType.VARCHAR.compare("a", "a"));
    }

    @Test
    void everyTypeComparesItsOwnValues() {
        assertTrue(DataType.INT.compare(-3, 2) < 0);
        assertTrue(DataType.LONG.compare(Long.MAX_VALUE, Long.MIN_VALUE) > 0);
        assertTrue(DataType.BOOLEAN.compare(false, true) < 0);
        assertTrue(DataType.CATEGORY.compare("cma", "ori") < 0);
        assertThrows(ClassCastException.class, () -> DataType.INT.compare(1L, 2L));
    }
}
