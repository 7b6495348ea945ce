package star.engine.stars;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import star.engine.build.SourceRecord;
import star.engine.index.SpatialIndexer;

public class SyntheticStarSourceTest {
    private static List<SourceRecord> collect(Iterable<SourceRecord> source) {
        List<SourceRecord> out = new ArrayList<>();
        for (SourceRecord r : source) out.add(r);
        return out;
    }

    @Test
    void sameSeedReplaysTheSameStream() {
        SyntheticStarSource source = new SyntheticStarSource(300, 11L);
        List<SourceRecord> first = collect(source);
        assertEquals(300, first.size());
        assertEquals(first.toString(), collect(source).toString());
        assertEquals(first.toString(), collect(new SyntheticStarSource(300, 11L)).toString());
        assertNotEquals(first.toString(), collect(new SyntheticStarSource(300, 12L)).toString());
    }

    @Test
    void startsWithNamedBrightStars() {
        List<SourceRecord> stars = collect(new SyntheticStarSource(10, 1L));
        assertEquals("Sirius", stars.get(0).get(StarSchema.NAME));
        assertEquals(32349, stars.get(0).get(StarSchema.HIP));
        assertEquals(SyntheticStarSource.BRIGHT_STARS.size(), stars.stream().filter(s -> s.has(StarSchema.NAME)).count());
        assertEquals(2, collect(new SyntheticStarSource(2, 1L)).size());
    }

    @Test
    void generatedStarsAreValid() {
        for (SourceRecord s : new SyntheticStarSource(2_000, 5L)) {
            double ra = s.getDouble(StarSchema.RA);
            double dec = s.getDouble(StarSchema.DEC);
            assertTrue(SpatialIndexer.inDomain(ra, dec), s.toString());
            double mag = s.getDouble(StarSchema.MAGNITUDE);
            assertTrue(mag >= -1.5 && mag <= 16.0, s.toString());
            assertTrue(s.has(StarSchema.RA_MAS_PER_YEAR));
            assertEquals(StarSchema.EPOCH_J2000, s.get(StarSchema.EPOCH_YEAR));
        }
    }
}
