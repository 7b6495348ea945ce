package star.engine.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import star.engine.build.BuildConfig;
import star.engine.build.BuildSummary;
import star.engine.build.CatalogBuilder;
import star.engine.build.LoggingBuildObserver;
import star.engine.build.RecordFilter;
import star.engine.catalog.ConfigurationException;
import star.engine.catalog.Manifest;
import star.engine.catalog.PartitionMeta;
import star.engine.exec.Row;
import star.engine.query.CatalogReader;
import star.engine.stars.CatalogChecks;
import star.engine.stars.MagnitudeFilter;
import star.engine.stars.StarSchema;
import star.engine.stars.SyntheticStarSource;

/**
 * Implementations of the command line commands. Output goes to the given stream.
 */
public final class Commands {
    static final List<Double> DEMO_MAGNITUDES = List.of(16.0, 11.0);
    static final int DEMO_CHUNK_SIZE = 10_000;
    static final int DEMO_ROW_GROUP_SIZE = 5_000;

    private final PrintStream out;

    public Commands(PrintStream out) {
        this.out = out;
    }

    /**
     * build-demo OUTPUT_DIR: builds one versioned catalog per limiting magnitude from
     * the synthetic source, then checks each of them.
     */
    public List<BuildSummary> buildDemo(CliOptions o) {
        Path base = Paths.get(o.positional(1, "output directory"));
        List<Double> magnitudes = o.magnitudes.isEmpty() ? DEMO_MAGNITUDES : o.magnitudes;
        SyntheticStarSource source = new SyntheticStarSource(o.count, o.seed);
        List<BuildSummary> summaries = new ArrayList<>();
        for (double mag : magnitudes) {
            Path output = base.resolve(StarSchema.catalogName(o.version, mag));
            BuildConfig config = StarSchema.config(output)
                .chunkSize(DEMO_CHUNK_SIZE)
                .rowGroupSize(DEMO_ROW_GROUP_SIZE)
                .spatialResolution(o.resolution)
                .workerThreads(o.workers)
                .build();
            BuildSummary summary = new CatalogBuilder(config)
                .build(source, MagnitudeFilter.atMost(mag), new LoggingBuildObserver());
            out.println("Built " + output.getFileName() + ": " + summary);

            CatalogReader reader = CatalogReader.open(output, o.resolution);
            List<String> passed = CatalogChecks.run(reader, summary, o.count > 0 && mag >= -1.44);
            out.println("Checks passed! " + passed);
            summaries.add(summary);
        }
        return summaries;
    }

    /** build PROPERTIES_FILE: builds the synthetic source with options read from a properties file. */
    public BuildSummary build(CliOptions o) {
        Path file = Paths.get(o.positional(1, "properties file"));
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read build properties " + file + ": " + e.getMessage());
        }
        BuildConfig config = BuildConfig.fromProperties(props, StarSchema.COLUMNS);
        RecordFilter filter = o.magnitudes.isEmpty() ? RecordFilter.ACCEPT_ALL : MagnitudeFilter.atMost(o.magnitudes.get(0));
        BuildSummary summary = new CatalogBuilder(config)
            .build(new SyntheticStarSource(o.count, o.seed), filter, new LoggingBuildObserver());
        out.println("Built " + config.outputPath() + ": " + summary);
        return summary;
    }

    /** info CATALOG_DIR: prints the manifest summary. */
    public Manifest info(CliOptions o) {
        CatalogReader reader = open(o);
        Manifest m = reader.manifest();
        out.println("catalog:        " + reader.root());
        out.println("build:          " + m.buildId() + " at " + m.createdAt());
        out.println("format version: " + m.formatVersion());
        out.println("columns:        " + m.columns());
        out.println("sorted by:      " + m.sortKeyColumns());
        out.println("partitioned by: " + m.partitionColumns());
        out.println("resolution:     " + m.spatialResolution());
        out.println("compression:    " + m.compression());
        out.println("records:        " + m.totalRecords() + " (rejected " + m.counts().rejected()
            + ", invalid " + m.counts().invalid() + ")");
        out.println("row groups:     " + m.rowGroupCount() + " in " + m.partitions().size() + " partition(s)");
        for (PartitionMeta p : m.partitions()) {
            out.println("  " + p.path() + ": " + p.recordCount() + " records, " + p.rowGroups().size() + " row groups");
        }
        return m;
    }

    /** scan CATALOG_DIR [--limit=N]: prints the first records in stored order. */
    public List<Row> scan(CliOptions o) {
        CatalogReader reader = open(o);
        List<Row> rows = new ArrayList<>();
        for (Row r : reader.all()) {
            if (rows.size() >= o.limit) break;
            rows.add(r);
        }
        TablePrinter.print(rows, out);
        return rows;
    }

    /** get CATALOG_DIR "EXPRESSION": prints the first record matching the expression. */
    public Optional<Row> get(CliOptions o) {
        CatalogReader reader = open(o);
        String where = o.positional(2, "lookup expression");
        Optional<Row> row = reader.get(where);
        if (row.isPresent()) {
            TablePrinter.print(List.of(row.get()), out);
        } else {
            out.println("No record matches " + where);
        }
        return row;
    }

    private static CatalogReader open(CliOptions o) {
        return CatalogReader.open(Paths.get(o.positional(1, "catalog directory")), o.resolution);
    }
}
