package star.engine.query;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import star.engine.TestStars;
import star.engine.build.BuildObserver;
import star.engine.build.CatalogBuilder;
import star.engine.build.SourceRecord;
import star.engine.catalog.ColumnStatistics;
import star.engine.catalog.CorruptCatalogException;
import star.engine.catalog.IncompatibleCatalogException;
import star.engine.catalog.Manifest;
import star.engine.catalog.ManifestStore;
import star.engine.catalog.PartitionMeta;
import star.engine.catalog.RowGroupMeta;
import star.engine.catalog.SchemaMismatchException;
import star.engine.exec.EqualityPredicate;
import star.engine.exec.Row;
import star.engine.stars.MagnitudeFilter;
import star.engine.stars.StarSchema;

public class CatalogReaderTest {
    @TempDir
    Path dir;

    private Path catalog;

    @BeforeEach
    void build() {
        catalog = dir.resolve("stars.mag9");
        new CatalogBuilder(TestStars.config(catalog).build())
            .build(TestStars.twenty(), MagnitudeFilter.atMost(TestStars.LIMIT), BuildObserver.NONE);
    }

    private CatalogReader open() {
        return CatalogReader.open(catalog, TestStars.RESOLUTION);
    }

    @Test
    void allReturnsEveryStoredRecordInKeyOrder() {
        CatalogReader reader = open();
        List<Row> rows = new ArrayList<>();
        for (Row r : reader.all()) rows.add(r);
        assertEquals(16, rows.size());
        Set<Long> pks = new HashSet<>();
        double previous = Double.NEGATIVE_INFINITY;
        for (Row r : rows) {
            pks.add(r.pk());
            double magnitude = r.getDouble(StarSchema.MAGNITUDE);
            assertTrue(magnitude >= previous);
            previous = magnitude;
            assertTrue(magnitude <= TestStars.LIMIT);
        }
        assertEquals(pkRange(1, 16), pks);
        assertEquals(-1.44, rows.get(0).getDouble(StarSchema.MAGNITUDE));
    }

    private static Set<Long> pkRange(int from, int to) {
        return IntStream.rangeClosed(from, to).mapToObj(i -> (long) i).collect(Collectors.toSet());
    }

    @Test
    void iterationIsRestartable() {
        CatalogReader reader = open();
        List<Long> first = reader.stream().map(Row::pk).collect(Collectors.toList());
        List<Long> second = reader.stream().map(Row::pk).collect(Collectors.toList());
        assertEquals(first, second);
        assertEquals(16, reader.count());
        assertEquals(reader.manifest().totalRecords(), reader.count());
    }

    @Test
    void everyFieldIsPresentWithRatesZeroDefaulted() {
        CatalogReader reader = open();
        Row noRates = reader.get(Map.of(StarSchema.HIP, 1001)).orElseThrow();
        assertEquals(0.0, noRates.getDouble(StarSchema.RA_MAS_PER_YEAR));
        assertEquals(0.0, noRates.getDouble(StarSchema.DEC_MAS_PER_YEAR));
        assertEquals(2000, noRates.getInt(StarSchema.EPOCH_YEAR));
        assertNull(noRates.getString(StarSchema.NAME));
        assertEquals(reader.schema().columnNames(), new ArrayList<>(noRates.toMap().keySet()));

        Row withRates = reader.get(Map.of(StarSchema.HIP, 1002)).orElseThrow();
        assertEquals(3.0, withRates.getDouble(StarSchema.RA_MAS_PER_YEAR));
        assertEquals(-5.0, withRates.getDouble(StarSchema.DEC_MAS_PER_YEAR));
    }

    @Test
    void findsSiriusByName() {
        Row sirius = open().get(Map.of(StarSchema.NAME, "Sirius")).orElseThrow();
        assertEquals(32349, sirius.getInt(StarSchema.HIP));
        assertEquals(-1.44, sirius.getDouble(StarSchema.MAGNITUDE));
        assertEquals("cma", sirius.getString(StarSchema.CONSTELLATION_ID));
        assertEquals(1L, sirius.pk());
        assertEquals(101.28715533, sirius.getDouble(StarSchema.RA));
    }

    @Test
    void getReturnsTheFirstMatchInStoredOrder() {
        CatalogReader reader = open();
        Row expected = null;
        for (Row r : reader.all()) {
            if ("ori".equals(r.getString(StarSchema.CONSTELLATION_ID))) {
                expected = r;
                break;
            }
        }
        assertNotNull(expected);
        Row a = reader.get("constellation_id = 'ori'").orElseThrow();
        Row b = reader.get("constellation_id = 'ori'").orElseThrow();
        assertEquals(expected.pk(), a.pk());
        assertEquals(a.toMap(), b.toMap());
    }

    @Test
    void expressionLookups() {
        CatalogReader reader = open();
        assertEquals(1L, reader.get("hip = 32349 AND constellation_id = 'cma'").orElseThrow().pk());
        assertTrue(reader.get("hip = 32349 AND constellation_id = 'ori'").isEmpty());
        assertEquals(32349, reader.get("hip = 123 OR name = 'Sirius'").orElseThrow().getInt(StarSchema.HIP));
        assertEquals(-1.44, reader.get("magnitude = -1.44").orElseThrow().getDouble(StarSchema.MAGNITUDE));
    }

    @Test
    void filteredAndInvalidRecordsAreAbsent() {
        CatalogReader reader = open();
        assertEquals(Optional.empty(), reader.get(Map.of(StarSchema.HIP, 1005)));
        assertEquals(Optional.empty(), reader.get(Map.of(StarSchema.HIP, 1008)));
        assertEquals(Optional.empty(), reader.get(Map.of(StarSchema.NAME, "Betelgeuse")));
    }

    @Test
    void unknownFieldsAndWrongTypesAreSchemaMismatches() {
        CatalogReader reader = open();
        assertThrows(SchemaMismatchException.class, () -> reader.get(Map.of("vmag", 1.0)));
        assertThrows(SchemaMismatchException.class, () -> reader.get(Map.of(StarSchema.HIP, "32349")));
        assertThrows(SchemaMismatchException.class, () -> reader.get("geometry = 'POINT'"));
        assertThrows(IllegalArgumentException.class, () -> reader.get(Map.of()));
    }

    @Test
    void plannerPrunesBySortingColumnStatistics() {
        CatalogReader reader = open();
        ScanPlanner planner = new ScanPlanner(reader.manifest(), reader.schema());
        assertEquals(4, planner.all().size());
        assertEquals(1, planner.plan(EqualityPredicate.forColumnName(reader.schema(), StarSchema.MAGNITUDE, -1.44)).size());
        assertEquals(0, planner.plan(EqualityPredicate.forColumnName(reader.schema(), StarSchema.MAGNITUDE, 20.0)).size());
        assertEquals(4, planner.plan(EqualityPredicate.forColumnName(reader.schema(), StarSchema.NAME, "Sirius")).size());
        assertTrue(reader.get(Map.of(StarSchema.MAGNITUDE, 20.0)).isEmpty());
    }

    @Test
    void plannerPrunesPartitions() {
        Path byConstellation = dir.resolve("by-constellation");
        new CatalogBuilder(TestStars.config(byConstellation).partitionColumns(List.of(StarSchema.CONSTELLATION_ID)).build())
            .build(TestStars.twenty(), MagnitudeFilter.atMost(TestStars.LIMIT), BuildObserver.NONE);
        CatalogReader reader = CatalogReader.open(byConstellation, TestStars.RESOLUTION);
        ScanPlanner planner = new ScanPlanner(reader.manifest(), reader.schema());
        var refs = planner.plan(EqualityPredicate.forColumnName(reader.schema(), StarSchema.CONSTELLATION_ID, "cma"));
        assertFalse(refs.isEmpty());
        for (var ref : refs) assertEquals("cma", ref.partitionMeta().valueOf(StarSchema.CONSTELLATION_ID));
        assertEquals(32349, reader.get("constellation_id = 'cma' AND name = 'Sirius'").orElseThrow().getInt(StarSchema.HIP));
        assertTrue(reader.get("constellation_id = 'lyr' AND name = 'Sirius'").isEmpty());
        assertEquals(16, reader.count());
    }

    @Test
    void concurrentReadersSeeTheSameData() {
        CatalogReader reader = open();
        List<Long> counts = IntStream.range(0, 8).parallel()
            .mapToObj(i -> reader.count() + reader.get(Map.of(StarSchema.NAME, "Sirius")).orElseThrow().pk())
            .collect(Collectors.toList());
        for (long c : counts) assertEquals(17L, c);
    }

    @Test
    void resolutionMismatchIsIncompatible() {
        assertThrows(IncompatibleCatalogException.class, () -> CatalogReader.open(catalog, TestStars.RESOLUTION + 1));
    }

    @Test
    void missingCatalogIsCorrupt() throws IOException {
        assertThrows(CorruptCatalogException.class, () -> CatalogReader.open(dir.resolve("nothing"), TestStars.RESOLUTION));
        Path unfinished = Files.createDirectories(dir.resolve("unfinished"));
        assertThrows(CorruptCatalogException.class, () -> CatalogReader.open(unfinished, TestStars.RESOLUTION));
    }

    @Test
    void unsupportedFormatVersionIsIncompatible() throws IOException {
        rewrite(m -> new Manifest(m.formatVersion() + 1, m.buildId(), m.createdAt(), m.schema(), m.columns(),
            m.sortingColumns(), m.partitionColumns(), m.spatialResolution(), m.compression(), m.chunkSize(),
            m.rowGroupSize(), m.totalRecords(), m.counts(), m.partitions()));
        assertThrows(IncompatibleCatalogException.class, this::open);
    }

    @Test
    void statisticsThatDisagreeWithDataAreCorrupt() throws IOException {
        rewrite(m -> {
            PartitionMeta p = m.partitions().get(0);
            List<RowGroupMeta> groups = new ArrayList<>(p.rowGroups());
            RowGroupMeta g = groups.get(1);
            ColumnStatistics s = g.statisticsFor(StarSchema.MAGNITUDE);
            groups.set(1, new RowGroupMeta(g.offset(), g.length(), g.rowCount(), g.firstKey(), g.lastKey(),
                List.of(new ColumnStatistics(s.column(), "-30.0", s.max()))));
            return withPartitions(m, List.of(new PartitionMeta(p.path(), p.values(), p.recordCount(), groups)));
        });
        CatalogReader reader = open();
        // the first row group is still readable, the second fails
        assertEquals(1L, reader.all().iterator().next().pk());
        assertThrows(CorruptCatalogException.class, reader::count);
    }

    @Test
    void wrongSpatialIndexIsCorrupt() throws IOException {
        rewrite(m -> new Manifest(m.formatVersion(), m.buildId(), m.createdAt(), m.schema(), m.columns(),
            m.sortingColumns(), m.partitionColumns(), m.spatialResolution() + 1, m.compression(), m.chunkSize(),
            m.rowGroupSize(), m.totalRecords(), m.counts(), m.partitions()));
        CatalogReader reader = CatalogReader.open(catalog, TestStars.RESOLUTION + 1);
        assertThrows(CorruptCatalogException.class, () -> reader.get(Map.of(StarSchema.NAME, "Sirius")));
    }

    @Test
    void missingPartitionFileIsCorrupt() throws IOException {
        Manifest m = open().manifest();
        Files.delete(catalog.resolve(m.partitions().get(0).path()));
        CatalogReader reader = open();
        assertThrows(CorruptCatalogException.class, reader::count);
    }

    @Test
    void manifestWithoutSortingColumnsIsCorrupt() throws IOException {
        Path file = ManifestStore.manifestPath(catalog);
        Files.writeString(file, Files.readString(file).replace("\"sortingColumns\"", "\"sortColumns\""));
        assertThrows(CorruptCatalogException.class, this::open);
    }

    @Test
    void emptyCatalogHasNoRowsAndNoMatches() {
        Path empty = dir.resolve("stars.empty");
        new CatalogBuilder(TestStars.config(empty).build())
            .build(List.<SourceRecord>of(), MagnitudeFilter.atMost(TestStars.LIMIT), BuildObserver.NONE);
        CatalogReader reader = CatalogReader.open(empty, TestStars.RESOLUTION);
        assertFalse(reader.all().iterator().hasNext());
        assertEquals(0, reader.count());
        assertEquals(Optional.empty(), reader.get(Map.of(StarSchema.NAME, "Sirius")));
        assertEquals(Optional.empty(), reader.get("hip = 32349"));
    }

    private static Manifest withPartitions(Manifest m, List<PartitionMeta> partitions) {
        return new Manifest(m.formatVersion(), m.buildId(), m.createdAt(), m.schema(), m.columns(),
            m.sortingColumns(), m.partitionColumns(), m.spatialResolution(), m.compression(), m.chunkSize(),
            m.rowGroupSize(), m.totalRecords(), m.counts(), partitions);
    }

    private void rewrite(UnaryOperator<Manifest> change) throws IOException {
        ManifestStore store = new ManifestStore();
        Manifest m = store.read(catalog);
        store.writeAtomically(catalog, change.apply(m));
    }
}
