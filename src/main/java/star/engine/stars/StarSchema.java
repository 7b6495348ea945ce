package star.engine.stars;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

import star.engine.build.BuildConfig;
import star.engine.catalog.ColumnSchema;
import star.engine.catalog.DataType;
import star.engine.storage.Compression;

/**
 * Column layout of the star catalog and the build settings it is normally built with.
 */
public final class StarSchema {
    public static final String HIP = "hip";
    public static final String TYC = "tyc";
    public static final String NAME = "name";
    public static final String RA = "ra";
    public static final String DEC = "dec";
    public static final String MAGNITUDE = "magnitude";
    public static final String BV = "bv";
    public static final String PARALLAX_MAS = "parallax_mas";
    public static final String RA_MAS_PER_YEAR = "ra_mas_per_year";
    public static final String DEC_MAS_PER_YEAR = "dec_mas_per_year";
    public static final String CONSTELLATION_ID = "constellation_id";
    public static final String CCDM = "ccdm";
    public static final String EPOCH_YEAR = "epoch_year";

    public static final int EPOCH_J2000 = 2000;
    public static final int DEFAULT_RESOLUTION = 6;
    public static final int DEFAULT_CHUNK_SIZE = 5_000_000;
    public static final int DEFAULT_ROW_GROUP_SIZE = 100_000;

    public static final List<ColumnSchema> COLUMNS = List.of(
        ColumnSchema.nullable(HIP, DataType.INT),
        ColumnSchema.nullable(TYC, DataType.VARCHAR),
        ColumnSchema.nullable(NAME, DataType.VARCHAR),
        ColumnSchema.required(RA, DataType.DOUBLE),
        ColumnSchema.required(DEC, DataType.DOUBLE),
        ColumnSchema.required(MAGNITUDE, DataType.DOUBLE),
        ColumnSchema.nullable(BV, DataType.DOUBLE),
        ColumnSchema.nullable(PARALLAX_MAS, DataType.DOUBLE),
        ColumnSchema.zeroDefault(RA_MAS_PER_YEAR, DataType.DOUBLE),
        ColumnSchema.zeroDefault(DEC_MAS_PER_YEAR, DataType.DOUBLE),
        ColumnSchema.nullable(CONSTELLATION_ID, DataType.CATEGORY),
        ColumnSchema.nullable(CCDM, DataType.VARCHAR),
        ColumnSchema.required(EPOCH_YEAR, DataType.INT)
    );

    private StarSchema() {}

    /**
     * Settings of a full star catalog build: sorted by magnitude, unpartitioned,
     * snappy-compressed row groups of 100k rows.
     */
    public static BuildConfig.Builder config(Path output) {
        return BuildConfig.builder()
            .outputPath(output)
            .chunkSize(DEFAULT_CHUNK_SIZE)
            .columns(COLUMNS)
            .partitionColumns(List.of())
            .sortingColumns(List.of(MAGNITUDE))
            .compression(Compression.SNAPPY)
            .rowGroupSize(DEFAULT_ROW_GROUP_SIZE)
            .spatialResolution(DEFAULT_RESOLUTION);
    }

    /** Versioned directory name, e.g. {@code stars.0.1.0.mag16}. */
    public static String catalogName(String version, double limitingMagnitude) {
        String limit = BigDecimal.valueOf(limitingMagnitude).stripTrailingZeros().toPlainString();
        return "stars." + version + ".mag" + limit;
    }
}
