package star.engine.catalog;

/**
 * A coordinate outside ra [0, 360) / dec [-90, 90], or not finite.
 * Record-level: counted in the build summary unless the build is strict.
 */
public class InvalidCoordinateException extends InvalidRecordException {
    private final double ra;
    private final double dec;

    public InvalidCoordinateException(double ra, double dec) {
        super("Invalid coordinate ra=" + ra + " dec=" + dec);
        this.ra = ra;
        this.dec = dec;
    }

    public double ra() { return ra; }
    public double dec() { return dec; }
}
