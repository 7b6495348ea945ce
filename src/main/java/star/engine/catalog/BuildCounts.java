package star.engine.catalog;

// Build outcome counters persisted with the manifest.
public record BuildCounts(long accepted, long rejected, long invalid, long durationMillis) {}
