package star.engine.stars;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import star.engine.build.BuildSummary;
import star.engine.catalog.CorruptCatalogException;
import star.engine.exec.Row;
import star.engine.query.CatalogReader;

/**
 * Post-build checks of a star catalog: the stored record count agrees with the build,
 * and a known star reads back with its catalog values. A failed check throws.
 */
public final class CatalogChecks {
    private static final Logger log = LoggerFactory.getLogger(CatalogChecks.class);

    static final String KNOWN_STAR = "Sirius";
    static final int KNOWN_HIP = 32349;
    static final double KNOWN_MAGNITUDE = -1.44;
    static final String KNOWN_CONSTELLATION = "cma";

    private CatalogChecks() {}

    /**
     * Runs the checks and returns the names of those that passed. The known-star lookup
     * only runs when the build's magnitude limit admits the star.
     */
    public static List<String> run(CatalogReader reader, BuildSummary summary, boolean expectKnownStar) {
        List<String> passed = new ArrayList<>();
        long stored = reader.count();
        if (stored != summary.accepted() || reader.manifest().totalRecords() != summary.accepted()) {
            throw new CorruptCatalogException("Record count check failed: scanned " + stored + ", manifest "
                + reader.manifest().totalRecords() + ", build accepted " + summary.accepted());
        }
        passed.add("count=" + stored);

        if (expectKnownStar) {
            Optional<Row> star = reader.get(Map.of(StarSchema.NAME, KNOWN_STAR));
            if (star.isEmpty()) throw new CorruptCatalogException(KNOWN_STAR + " not found in " + reader.root());
            Row r = star.get();
            if (!Integer.valueOf(KNOWN_HIP).equals(r.getInt(StarSchema.HIP))
                    || r.getDouble(StarSchema.MAGNITUDE) != KNOWN_MAGNITUDE
                    || !KNOWN_CONSTELLATION.equals(r.getString(StarSchema.CONSTELLATION_ID))) {
                throw new CorruptCatalogException(KNOWN_STAR + " reads back wrong: " + r.toMap());
            }
            passed.add(KNOWN_STAR.toLowerCase() + " hip=" + KNOWN_HIP);
        }
        log.info("Checks passed for {}: {}", reader.root(), passed);
        return passed;
    }
}
