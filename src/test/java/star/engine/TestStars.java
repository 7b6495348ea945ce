package star.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import star.engine.build.BuildConfig;
import star.engine.build.SourceRecord;
import star.engine.stars.StarRecords;
import star.engine.stars.StarSchema;

/**
 * Small star data sets shared by tests.
 */
public final class TestStars {
    public static final double LIMIT = 9.0;
    public static final int RESOLUTION = StarSchema.DEFAULT_RESOLUTION;

    private TestStars() {}

    /**
     * 20 records: Sirius first, three fainter than {@link #LIMIT} (positions 5, 11, 17)
     * and one with ra out of range (position 8). Odd positions carry no proper motion.
     */
    public static List<SourceRecord> twenty() {
        List<SourceRecord> out = new ArrayList<>();
        out.add(sirius());
        for (int i = 1; i < 20; i++) {
            double magnitude = 0.5 + (i % 9) * 0.9;
            if (i == 5) magnitude = 10.5;
            if (i == 11) magnitude = 12.0;
            if (i == 17) magnitude = 9.01;
            double ra = i == 8 ? 400.0 : (i * 17.5) % 360.0;
            out.add(star(i, ra, -80.0 + i * 8.0, magnitude, i % 2 == 0));
        }
        return out;
    }

    public static SourceRecord sirius() {
        return StarRecords.star().hip(32349).name("Sirius").position(101.28715533, -16.71611586)
            .magnitude(-1.44).bv(0.009).parallaxMas(379.21).raMasPerYear(-546.01).decMasPerYear(-1223.07)
            .constellationId("cma").ccdm("06451-1643").build();
    }

    public static SourceRecord star(int i, double ra, double dec, double magnitude, boolean withRates) {
        SourceRecord.Builder b = SourceRecord.builder()
            .put(StarSchema.HIP, 1000 + i)
            .put(StarSchema.TYC, "10-" + i + "-1")
            .put(StarSchema.RA, ra)
            .put(StarSchema.DEC, dec)
            .put(StarSchema.MAGNITUDE, magnitude)
            .put(StarSchema.CONSTELLATION_ID, i % 3 == 0 ? "ori" : (i % 3 == 1 ? "cma" : "lyr"))
            .put(StarSchema.EPOCH_YEAR, StarSchema.EPOCH_J2000);
        if (i % 4 != 0) b.put(StarSchema.BV, 0.1 * i);
        if (withRates) {
            b.put(StarSchema.RA_MAS_PER_YEAR, 1.5 * i);
            b.put(StarSchema.DEC_MAS_PER_YEAR, -2.5 * i);
        }
        return b.build();
    }

    /** Star build settings scaled down so small inputs span several chunks and row groups. */
    public static BuildConfig.Builder config(Path output) {
        return StarSchema.config(output).chunkSize(4).rowGroupSize(5).spatialResolution(RESOLUTION);
    }
}
