package star.engine.stars;

import star.engine.build.RecordFilter;
import star.engine.build.SourceRecord;

/**
 * Keeps stars at least as bright as a limiting magnitude (magnitude &lt;= limit).
 */
public final class MagnitudeFilter implements RecordFilter {
    private final double limit;

    private MagnitudeFilter(double limit) {
        this.limit = limit;
    }

    public static MagnitudeFilter atMost(double limit) {
        if (Double.isNaN(limit)) throw new IllegalArgumentException("Limiting magnitude must be a number");
        return new MagnitudeFilter(limit);
    }

    public double limit() { return limit; }

    @Override
    public boolean accept(SourceRecord record) {
        Double magnitude = record.getDouble(StarSchema.MAGNITUDE);
        return magnitude != null && magnitude <= limit;
    }

    @Override
    public String toString() {
        return "magnitude <= " + limit;
    }
}
