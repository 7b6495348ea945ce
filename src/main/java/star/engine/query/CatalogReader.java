package star.engine.query;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import star.engine.catalog.CatalogSchema;
import star.engine.catalog.CorruptCatalogException;
import star.engine.catalog.IncompatibleCatalogException;
import star.engine.catalog.Manifest;
import star.engine.catalog.ManifestStore;
import star.engine.catalog.PartitionMeta;
import star.engine.exec.CompoundPredicate;
import star.engine.exec.EqualityPredicate;
import star.engine.exec.FilterOperator;
import star.engine.exec.OperatorIterator;
import star.engine.exec.Predicate;
import star.engine.exec.Row;
import star.engine.exec.RowGroupRef;
import star.engine.exec.RowGroupScanOperator;
import star.engine.index.SpatialIndexer;
import star.engine.storage.PartitionFileReader;

/**
 * Read side of a built catalog.
 *
 * Opening reads only the manifest. Row groups are read one at a time, verified, and
 * released before the next is loaded, so no file handle outlives a single read.
 * A reader holds no mutable state and may be shared between threads.
 */
public final class CatalogReader {
    private static final Logger log = LoggerFactory.getLogger(CatalogReader.class);

    private final Path root;
    private final Manifest manifest;
    private final CatalogSchema schema;
    private final ScanPlanner planner;
    private final RowGroupVerifier loader;

    private CatalogReader(Path root, Manifest manifest, int resolution) {
        this.root = root;
        this.manifest = manifest;
        this.schema = manifest.catalogSchema();
        if (!schema.columnNames().equals(manifest.columns())) {
            throw new CorruptCatalogException("Manifest column list " + manifest.columns()
                + " disagrees with its schema " + schema.columnNames());
        }
        this.planner = new ScanPlanner(manifest, schema);
        List<PartitionFileReader> files = new ArrayList<>(manifest.partitions().size());
        for (PartitionMeta p : manifest.partitions()) {
            files.add(new PartitionFileReader(root.resolve(p.path()), schema));
        }
        this.loader = new RowGroupVerifier(manifest, schema, files, new SpatialIndexer(resolution));
    }

    /**
     * Opens the catalog at {@code path}. The caller states the spatial resolution it
     * expects; a catalog built at another resolution is rejected.
     */
    public static CatalogReader open(Path path, int resolution) {
        SpatialIndexer.checkResolution(resolution);
        if (!Files.isDirectory(path)) throw new CorruptCatalogException("No catalog directory at " + path);
        Manifest m = new ManifestStore().read(path);
        if (m.formatVersion() != Manifest.FORMAT_VERSION) {
            throw new IncompatibleCatalogException("Unsupported catalog format version " + m.formatVersion()
                + " (supported: " + Manifest.FORMAT_VERSION + ") at " + path);
        }
        if (m.spatialResolution() != resolution) {
            throw new IncompatibleCatalogException("Catalog at " + path + " was built at spatial resolution "
                + m.spatialResolution() + ", requested " + resolution);
        }
        log.debug("Opened catalog {} (build {}, {} records, {} row groups)",
            path, m.buildId(), m.totalRecords(), m.rowGroupCount());
        return new CatalogReader(path, m, resolution);
    }

    public Path root() { return root; }
    public Manifest manifest() { return manifest; }
    public CatalogSchema schema() { return schema; }

    /** Every record in stored order. Each iterator() starts a fresh scan. */
    public Iterable<Row> all() {
        return () -> new OperatorIterator(new RowGroupScanOperator(schema, planner.all(), loader, false));
    }

    public Stream<Row> stream() {
        Iterator<Row> it = all().iterator();
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** Counts records by scanning; equals the manifest's total for a sound catalog. */
    public long count() {
        long n = 0;
        for (Iterator<Row> it = all().iterator(); it.hasNext(); it.next()) n++;
        return n;
    }

    /** First record in stored order matching the predicate. */
    public Optional<Row> get(Predicate predicate) {
        if (predicate == null) throw new IllegalArgumentException("predicate must not be null");
        List<RowGroupRef> refs = planner.plan(predicate);
        log.debug("Lookup {} reads {} of {} row groups", predicate, refs.size(), manifest.rowGroupCount());
        FilterOperator op = new FilterOperator(new RowGroupScanOperator(schema, refs, loader, true), predicate);
        op.open();
        try {
            Row match = op.next();
            log.debug("Lookup {} tested {} rows", predicate, op.examined());
            return match == null ? Optional.empty() : Optional.of(match.materialize());
        } finally {
            op.close();
        }
    }

    /** Lookup by field values, all of which must match. */
    public Optional<Row> get(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) throw new IllegalArgumentException("At least one field is required");
        List<Predicate> parts = new ArrayList<>(fields.size());
        for (Map.Entry<String, ?> e : fields.entrySet()) {
            parts.add(EqualityPredicate.forColumnName(schema, e.getKey(), e.getValue()));
        }
        return get(parts.size() == 1 ? parts.get(0) : CompoundPredicate.and(parts.toArray(new Predicate[0])));
    }

    /** Lookup by an expression such as {@code name = 'Sirius' AND hip = 32349}. */
    public Optional<Row> get(String where) {
        WhereClause clause = new QueryParser().parseWhere(where);
        return get(new PredicateCompiler().compile(clause, schema));
    }

    @Override
    public String toString() {
        return "CatalogReader{" + root + ", build=" + manifest.buildId() + "}";
    }
}
