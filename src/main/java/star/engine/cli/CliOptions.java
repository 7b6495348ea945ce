package star.engine.cli;

import java.util.ArrayList;
import java.util.List;

import star.engine.catalog.ConfigurationException;
import star.engine.index.SpatialIndexer;
import star.engine.stars.StarSchema;

/**
 * Command line options shared by all commands: positional arguments plus
 * {@code --name=value} flags. Malformed flag values fail instead of falling back.
 */
public final class CliOptions {
    public static final String VERSION = "0.1.0";
    static final int MAX_WORKERS = 256;

    public final List<String> positional;
    public final long count;
    public final long seed;
    public final int resolution;
    public final int limit;
    public final String version;
    public final List<Double> magnitudes;
    public final int workers;

    private CliOptions(List<String> positional, long count, long seed, int resolution, int limit,
                       String version, List<Double> magnitudes, int workers) {
        this.positional = List.copyOf(positional);
        this.count = count;
        this.seed = seed;
        this.resolution = resolution;
        this.limit = limit;
        this.version = version;
        this.magnitudes = List.copyOf(magnitudes);
        this.workers = workers;
    }

    public static CliOptions fromArgs(String[] args) {
        List<String> positional = new ArrayList<>();
        long count = 50_000;
        long seed = 42L;
        int resolution = StarSchema.DEFAULT_RESOLUTION;
        int limit = 20;
        String version = VERSION;
        List<Double> magnitudes = List.of();
        int workers = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--count=")) {
                count = parseLong("--count", s.substring("--count=".length()));
            } else if (s.startsWith("--seed=")) {
                seed = parseLong("--seed", s.substring("--seed=".length()));
            } else if (s.startsWith("--resolution=")) {
                resolution = parseInt("--resolution", s.substring("--resolution=".length()),
                    SpatialIndexer.MIN_RESOLUTION, SpatialIndexer.MAX_RESOLUTION);
            } else if (s.startsWith("--limit=")) {
                limit = parseInt("--limit", s.substring("--limit=".length()), 0, Integer.MAX_VALUE);
            } else if (s.startsWith("--version=")) {
                version = s.substring("--version=".length());
            } else if (s.startsWith("--workers=")) {
                workers = parseInt("--workers", s.substring("--workers=".length()), 1, MAX_WORKERS);
            } else if (s.startsWith("--mag=")) {
                List<Double> parsed = new ArrayList<>();
                for (String m : s.substring("--mag=".length()).split(",")) {
                    try {
                        parsed.add(Double.parseDouble(m.trim()));
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException("--mag expects numbers, got: " + m);
                    }
                }
                magnitudes = parsed;
            } else if (s.startsWith("--")) {
                throw new ConfigurationException("Unknown option: " + s);
            } else if (!s.isEmpty()) {
                positional.add(s);
            }
        }
        return new CliOptions(positional, count, seed, resolution, limit, version, magnitudes, workers);
    }

    public String positional(int i, String what) {
        if (i >= positional.size()) throw new ConfigurationException("Missing argument: " + what);
        return positional.get(i);
    }

    private static long parseLong(String flag, String raw) {
        try {
            return Long.parseLong(raw.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(flag + " expects an integer, got: " + raw);
        }
    }

    private static int parseInt(String flag, String raw, int min, int max) {
        int v;
        try {
            v = Integer.parseInt(raw.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(flag + " expects an integer, got: " + raw);
        }
        if (v < min || v > max) {
            throw new ConfigurationException(flag + " must be between " + min + " and " + max + ", got: " + raw);
        }
        return v;
    }
}
