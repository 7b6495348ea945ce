package star.engine.build;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

import star.engine.catalog.ColumnSchema;
import star.engine.catalog.ConfigurationException;
import star.engine.catalog.DataType;
import star.engine.stars.StarSchema;
import star.engine.storage.Compression;

public class BuildConfigTest {
    private final Path out = Path.of("target", "config-test");

    @Test
    void missingOptionsAreNamed() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> BuildConfig.builder().outputPath(out).columns(StarSchema.COLUMNS).build());
        assertTrue(e.getMessage().contains(BuildConfig.CHUNK_SIZE));
        assertTrue(e.getMessage().contains(BuildConfig.PARTITION_COLUMNS));
        assertTrue(e.getMessage().contains(BuildConfig.SPATIAL_RESOLUTION));
        assertFalse(e.getMessage().contains(BuildConfig.STRICT));
    }

    @Test
    void starDefaultsAreValid() {
        BuildConfig c = StarSchema.config(out).build();
        assertEquals(List.of("magnitude"), c.sortingColumns());
        assertEquals(List.of(), c.partitionColumns());
        assertEquals(Compression.SNAPPY, c.compression());
        assertFalse(c.strict());
        assertEquals(1, c.workerThreads());
        assertEquals("pk", c.schema().columnNames().get(0));
        assertEquals(c.toString(), c.toBuilder().build().toString());
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).chunkSize(0).build());
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).rowGroupSize(-1).build());
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).spatialResolution(16).build());
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).workerThreads(0).build());
        // nullable, unknown, derived and duplicate sorting columns
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).sortingColumns(List.of("bv")).build());
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).sortingColumns(List.of("vmag")).build());
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).sortingColumns(List.of("pk")).build());
        assertThrows(ConfigurationException.class,
            () -> StarSchema.config(out).sortingColumns(List.of("magnitude", "magnitude")).build());
        // DOUBLE partitions would give one partition per star
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).partitionColumns(List.of("ra")).build());
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).partitionColumns(List.of("spatial_index")).build());
    }

    @Test
    void schemaMustCarryCoordinatesAndNumericZeroDefaults() {
        List<ColumnSchema> noDec = List.of(ColumnSchema.required("ra", DataType.DOUBLE),
            ColumnSchema.required("magnitude", DataType.DOUBLE));
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).columns(noDec).build());
        List<ColumnSchema> textZero = List.of(ColumnSchema.required("ra", DataType.DOUBLE),
            ColumnSchema.required("dec", DataType.DOUBLE), ColumnSchema.required("magnitude", DataType.DOUBLE),
            ColumnSchema.zeroDefault("name", DataType.VARCHAR));
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).columns(textZero).build());
        List<ColumnSchema> derived = List.of(ColumnSchema.required("ra", DataType.DOUBLE),
            ColumnSchema.required("dec", DataType.DOUBLE), ColumnSchema.required("magnitude", DataType.DOUBLE),
            ColumnSchema.required("spatial_index", DataType.LONG));
        assertThrows(ConfigurationException.class, () -> StarSchema.config(out).columns(derived).build());
    }

    @Test
    void readsPropertiesFile() {
        Properties p = new Properties();
        p.setProperty(BuildConfig.OUTPUT, "build/stars");
        p.setProperty(BuildConfig.CHUNK_SIZE, "5_000_000");
        p.setProperty(BuildConfig.COLUMNS, "hip, ra, dec, magnitude, constellation_id");
        p.setProperty(BuildConfig.PARTITION_COLUMNS, "");
        p.setProperty(BuildConfig.SORTING_COLUMNS, "magnitude");
        p.setProperty(BuildConfig.COMPRESSION, "gzip");
        p.setProperty(BuildConfig.ROW_GROUP_SIZE, "100000");
        p.setProperty(BuildConfig.SPATIAL_RESOLUTION, "5");
        p.setProperty(BuildConfig.WORKER_THREADS, "3");
        BuildConfig c = BuildConfig.fromProperties(p, StarSchema.COLUMNS);
        assertEquals(5_000_000, c.chunkSize());
        assertEquals(Compression.GZIP, c.compression());
        assertEquals(List.of("pk", "spatial_index", "hip", "ra", "dec", "magnitude", "constellation_id"),
            c.schema().columnNames());
        assertEquals(List.of(), c.partitionColumns());
        assertEquals(3, c.workerThreads());

        p.remove(BuildConfig.PARTITION_COLUMNS);
        assertThrows(ConfigurationException.class, () -> BuildConfig.fromProperties(p, StarSchema.COLUMNS));
        p.setProperty(BuildConfig.PARTITION_COLUMNS, "");
        p.setProperty(BuildConfig.CHUNK_SIZE, "many");
        assertThrows(ConfigurationException.class, () -> BuildConfig.fromProperties(p, StarSchema.COLUMNS));
        p.setProperty(BuildConfig.CHUNK_SIZE, "10");
        p.setProperty(BuildConfig.COLUMNS, "ra, dec, vmag");
        assertThrows(ConfigurationException.class, () -> BuildConfig.fromProperties(p, StarSchema.COLUMNS));
    }
}
