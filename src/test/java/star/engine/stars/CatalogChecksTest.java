package star.engine.stars;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import star.engine.build.BuildObserver;
import star.engine.build.BuildSummary;
import star.engine.build.CatalogBuilder;
import star.engine.catalog.CorruptCatalogException;
import star.engine.query.CatalogReader;

public class CatalogChecksTest {
    @TempDir
    Path dir;

    @Test
    void checksPassOnAFreshBuildAndFailOnAWrongCount() {
        Path out = dir.resolve(StarSchema.catalogName("test", 11));
        BuildSummary summary = new CatalogBuilder(StarSchema.config(out).chunkSize(200).rowGroupSize(100).build())
            .build(new SyntheticStarSource(1_000, 9L), MagnitudeFilter.atMost(11), BuildObserver.NONE);
        CatalogReader reader = CatalogReader.open(out, StarSchema.DEFAULT_RESOLUTION);
        List<String> passed = CatalogChecks.run(reader, summary, true);
        assertEquals(2, passed.size());

        BuildSummary wrong = new BuildSummary(out, summary.buildId(), summary.accepted() + 1, 0, 0, List.of(),
            summary.partitions(), summary.rowGroups(), summary.duration());
        assertThrows(CorruptCatalogException.class, () -> CatalogChecks.run(reader, wrong, false));
    }

    @Test
    void knownStarMissingFailsTheCheck() {
        Path out = dir.resolve("faint-only");
        BuildSummary summary = new CatalogBuilder(StarSchema.config(out).chunkSize(200).rowGroupSize(100).build())
            .build(new SyntheticStarSource(500, 9L), MagnitudeFilter.atMost(11).and(s -> !"Sirius".equals(s.get("name"))),
                BuildObserver.NONE);
        CatalogReader reader = CatalogReader.open(out, StarSchema.DEFAULT_RESOLUTION);
        assertEquals(1, CatalogChecks.run(reader, summary, false).size());
        assertThrows(CorruptCatalogException.class, () -> CatalogChecks.run(reader, summary, true));
    }
}
