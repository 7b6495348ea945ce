package star.engine.index;

import java.io.IOException;

import com.uber.h3core.H3Core;

import star.engine.catalog.ConfigurationException;
import star.engine.catalog.InvalidCoordinateException;

/**
 * Maps an equatorial coordinate to a hierarchical H3 cell id at a fixed resolution.
 *
 * Declination is used as latitude; right ascension above 180 degrees is folded
 * to a negative longitude. Cells are hierarchical, so nearby coordinates share
 * parent cells and mostly map to equal or neighbouring ids.
 */
public final class SpatialIndexer {
    public static final int MIN_RESOLUTION = 0;
    public static final int MAX_RESOLUTION = 15;

    // H3Core is thread-safe: one instance per JVM is sufficient
    private static final H3Core H3;

    static {
        try {
            H3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final int resolution;

    public SpatialIndexer(int resolution) {
        checkResolution(resolution);
        this.resolution = resolution;
    }

    public static void checkResolution(int resolution) {
        if (resolution < MIN_RESOLUTION || resolution > MAX_RESOLUTION) {
            throw new ConfigurationException("Spatial resolution must be within "
                + MIN_RESOLUTION + ".." + MAX_RESOLUTION + ", got " + resolution);
        }
    }

    public int resolution() { return resolution; }

    public long index(double ra, double dec) {
        checkDomain(ra, dec);
        return H3.latLngToCell(dec, toLongitude(ra), resolution);
    }

    /** Recomputes the cell for a stored coordinate and compares it with the stored id. */
    public boolean verify(double ra, double dec, long storedIndex) {
        return index(ra, dec) == storedIndex;
    }

    public static boolean inDomain(double ra, double dec) {
        return Double.isFinite(ra) && Double.isFinite(dec)
            && ra >= 0.0 && ra < 360.0
            && dec >= -90.0 && dec <= 90.0;
    }

    static void checkDomain(double ra, double dec) {
        if (!inDomain(ra, dec)) throw new InvalidCoordinateException(ra, dec);
    }

    static double toLongitude(double ra) {
        return ra > 180.0 ? ra - 360.0 : ra;
    }

    @Override
    public String toString() {
        return "SpatialIndexer{h3 resolution=" + resolution + "}";
    }
}
